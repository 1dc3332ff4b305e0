package io.agentbridge.a2a;

import io.agentbridge.config.BridgeConfig;
import io.agentbridge.error.NotFoundException;
import io.agentbridge.error.ValidationException;
import io.agentbridge.model.Message;
import io.agentbridge.model.MessageStatus;
import io.agentbridge.model.MessageType;
import io.agentbridge.storage.Database;
import io.agentbridge.storage.MessageStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class A2AClientTest {

    @Test
    void delegationScenarioThreadsAndCountsUnreadPerAgent() throws Exception {
        Path root = Files.createTempDirectory("agentbridge-a2a-scenario-");
        try {
            A2AClient client = newClient(root, new MutableClock(1_000L));
            Message delegation = client.send("A", "B", MessageType.TASK_DELEGATION, Map.of("task_id", "T1"), "C1");
            Message accepted = client.send("B", "A", MessageType.TASK_ACCEPTED, Map.of("task_id", "T1"), "C1");

            List<Message> thread = client.getMessagesByContext("C1");
            Assertions.assertEquals(List.of(delegation.id(), accepted.id()), thread.stream().map(Message::id).toList());
            Assertions.assertEquals(1, client.getUnreadCount("A"));
            Assertions.assertEquals(1, client.getUnreadCount("B"));

            client.acknowledgeMessage(delegation.id(), "B");
            Assertions.assertEquals(0, client.getUnreadCount("B"));
            Assertions.assertEquals(1, client.getUnreadCount("A"));
            Assertions.assertEquals("T1", client.getMessages("B", null, null).get(0).payload().get("task_id"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void acknowledgeIsIdempotentAndFirstAcknowledgerWins() throws Exception {
        Path root = Files.createTempDirectory("agentbridge-a2a-ack-");
        try {
            MutableClock clock = new MutableClock(10_000L);
            A2AClient client = newClient(root, clock);
            Message sent = client.send("A", "B", MessageType.STATUS_REQUEST, Map.of(), null);

            clock.advance(500L);
            Message first = client.acknowledgeMessage(sent.id(), "B");
            clock.advance(500L);
            Message second = client.acknowledgeMessage(sent.id(), "C");

            Assertions.assertEquals(MessageStatus.ACKNOWLEDGED, second.status());
            Assertions.assertEquals("B", second.acknowledgedBy());
            Assertions.assertEquals(first.acknowledgedAtMs(), second.acknowledgedAtMs());
            Assertions.assertEquals(10_500L, second.acknowledgedAtMs());
            Assertions.assertThrows(NotFoundException.class, () -> client.acknowledgeMessage("msg_missing", "B"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unreadCountIgnoresAcknowledgedMessages() throws Exception {
        Path root = Files.createTempDirectory("agentbridge-a2a-unread-");
        try {
            A2AClient client = newClient(root, new MutableClock(1_000L));
            client.send("A", "X", MessageType.ANNOUNCEMENT, Map.of("n", 1), null);
            client.send("A", "X", MessageType.ANNOUNCEMENT, Map.of("n", 2), null);
            Message third = client.send("A", "X", MessageType.ANNOUNCEMENT, Map.of("n", 3), null);
            client.acknowledgeMessage(third.id(), "X");

            Assertions.assertEquals(2, client.getUnreadCount("X"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void broadcastAddressesEachTargetIndependently() throws Exception {
        Path root = Files.createTempDirectory("agentbridge-a2a-broadcast-");
        try {
            A2AClient client = newClient(root, new MutableClock(1_000L));
            BroadcastOutcome outcome = client.broadcast("lead", MessageType.ANNOUNCEMENT,
                    Map.of("text", "standup"), List.of("X", "Y", "Z"), "C9");

            Assertions.assertEquals(3, outcome.totalTargets());
            Assertions.assertEquals(3, outcome.successful());
            for (String target : List.of("X", "Y", "Z")) {
                List<Message> inbox = client.getMessages(target, null, null);
                Assertions.assertEquals(1, inbox.size(), target);
                Assertions.assertEquals(target, inbox.get(0).recipient());
            }
            Assertions.assertEquals(3, client.getMessagesByContext("C9").size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void broadcastWithoutTargetsFansOutToRegisteredAgentsExceptSender() throws Exception {
        Path root = Files.createTempDirectory("agentbridge-a2a-broadcast-registry-");
        try {
            A2AClient client = newClient(root, new MutableClock(1_000L));
            BroadcastOutcome sentinel = client.broadcast("lead", MessageType.ANNOUNCEMENT, Map.of(), List.of(), null);
            Assertions.assertEquals(Message.BROADCAST_RECIPIENT, sentinel.deliveries().get(0).target());

            client.registerAgent("lead", Map.of());
            client.registerAgent("builder", Map.of("role", "build"));
            client.registerAgent("reviewer", Map.of());
            BroadcastOutcome fanOut = client.broadcast("lead", MessageType.ANNOUNCEMENT, Map.of(), null, null);

            List<String> targets = fanOut.deliveries().stream().map(BroadcastOutcome.Delivery::target).toList();
            Assertions.assertEquals(List.of("builder", "reviewer"), targets);
            Assertions.assertThrows(ValidationException.class, () -> client.registerAgent(Message.BROADCAST_RECIPIENT, Map.of()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void broadcastRecordsFailingTargetsWithoutStoppingOthers() throws Exception {
        Path root = Files.createTempDirectory("agentbridge-a2a-broadcast-partial-");
        try {
            A2AClient client = newClient(root, new MutableClock(1_000L));
            BroadcastOutcome outcome = client.broadcast("lead", MessageType.ANNOUNCEMENT, Map.of(), List.of("X", " ", "Y"), null);

            Assertions.assertEquals(3, outcome.totalTargets());
            Assertions.assertEquals(2, outcome.successful());
            Assertions.assertFalse(outcome.deliveries().get(1).success());
            Assertions.assertNotNull(outcome.deliveries().get(1).error());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void sendRejectsMissingFieldsBeforeTouchingTheStore() throws Exception {
        Path root = Files.createTempDirectory("agentbridge-a2a-validation-");
        try {
            A2AClient client = newClient(root, new MutableClock(1_000L));
            Assertions.assertThrows(ValidationException.class, () -> client.send(" ", "B", MessageType.ANNOUNCEMENT, Map.of(), null));
            Assertions.assertThrows(ValidationException.class, () -> client.send("A", null, MessageType.ANNOUNCEMENT, Map.of(), null));
            Assertions.assertThrows(ValidationException.class, () -> client.send("A", "B", (MessageType) null, Map.of(), null));
            Assertions.assertThrows(ValidationException.class, () -> client.send("A", "B", MessageType.ANNOUNCEMENT, null, null));
            Assertions.assertThrows(ValidationException.class, () -> client.send("A", "B", "NOT_A_TYPE", Map.of(), null));
            Assertions.assertThrows(ValidationException.class, () -> client.send("A", "B".repeat(101), MessageType.ANNOUNCEMENT, Map.of(), null));
            Assertions.assertThrows(ValidationException.class, () -> client.getMessagesByContext(""));
            Assertions.assertEquals(0, client.getMessages("B", null, null).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void inboxLimitIsClampedToConfiguredMaximum() throws Exception {
        Path root = Files.createTempDirectory("agentbridge-a2a-limit-");
        try {
            MutableClock clock = new MutableClock(1_000L);
            A2AClient client = newClient(root, clock);
            for (int i = 0; i < 8; i++) {
                clock.advance(1L);
                client.send("A", "B", MessageType.PROGRESS_UPDATE, Map.of("i", i), null);
            }
            Assertions.assertEquals(3, client.getMessages("B", null, null).size());
            Assertions.assertEquals(5, client.getMessages("B", null, 100).size());
            Assertions.assertEquals(1, client.getMessages("B", null, 0).size());
            Assertions.assertEquals(7, client.getMessages("B", null, null).get(0).payload().get("i"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cleanupRemovesOnlyMessagesOlderThanRetention() throws Exception {
        Path root = Files.createTempDirectory("agentbridge-a2a-cleanup-");
        try {
            MutableClock clock = new MutableClock(0L);
            A2AClient client = newClient(root, clock);
            client.send("A", "B", MessageType.ANNOUNCEMENT, Map.of(), null);
            clock.advance(TimeUnit.DAYS.toMillis(10));
            client.send("A", "B", MessageType.ANNOUNCEMENT, Map.of(), null);

            Assertions.assertEquals(1, client.cleanupOldMessages(5));
            Assertions.assertEquals(1, client.getMessages("B", null, null).size());
            Assertions.assertThrows(ValidationException.class, () -> client.cleanupOldMessages(-1));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void awaitMessagesWakesUpOnPushAndReturnsStoredCopy() throws Exception {
        Path root = Files.createTempDirectory("agentbridge-a2a-await-");
        try {
            A2AClient client = newClient(root, new MutableClock(1_000L));
            Assertions.assertTrue(client.awaitMessages("B", null, null, Duration.ZERO).isEmpty());

            CompletableFuture<List<Message>> waiting = CompletableFuture.supplyAsync(
                    () -> client.awaitMessages("B", null, null, Duration.ofSeconds(5)));
            long deadline = System.currentTimeMillis() + 5_000L;
            while (client.healthCheck().attributes().get("subscribers").equals(0) && System.currentTimeMillis() < deadline) {
                Thread.sleep(10L);
            }
            Message sent = client.send("A", "B", MessageType.TASK_DELEGATION, Map.of("task_id", "T2"), null);

            List<Message> received = waiting.get(5, TimeUnit.SECONDS);
            Assertions.assertEquals(1, received.size());
            Assertions.assertEquals(sent.id(), received.get(0).id());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void healthCheckReportsStoreCounts() throws Exception {
        Path root = Files.createTempDirectory("agentbridge-a2a-health-");
        try {
            A2AClient client = newClient(root, new MutableClock(1_000L));
            client.send("A", "B", MessageType.ANNOUNCEMENT, Map.of(), null);
            A2AHealth health = client.healthCheck();
            Assertions.assertTrue(health.healthy());
            Assertions.assertEquals(1L, health.attributes().get("messages"));
            Assertions.assertEquals(1L, health.attributes().get("unread"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static A2AClient newClient(Path root, Clock clock) {
        Database database = new Database(BridgeConfig.fromRoot(root.toString()));
        database.init();
        return new A2AClient(new MessageStore(database), new SubscriptionHub(16), 3, 5, clock);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    private static final class MutableClock extends Clock {
        private volatile long nowMs;

        MutableClock(long nowMs) {
            this.nowMs = nowMs;
        }

        void advance(long deltaMs) {
            nowMs += deltaMs;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(nowMs);
        }

        @Override
        public long millis() {
            return nowMs;
        }
    }
}
