package io.agentbridge.a2a;

import io.agentbridge.model.Message;
import io.agentbridge.model.MessageStatus;
import io.agentbridge.model.MessageType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

final class SubscriptionHubTest {

    @Test
    void publishDeliversOnlyToMatchingSubscribers() throws Exception {
        SubscriptionHub hub = new SubscriptionHub(4);
        try (Subscription forB = hub.subscribe(MessageFilter.forRecipient("B"));
             Subscription thread = hub.subscribe(MessageFilter.forContext("C1"));
             Subscription progress = hub.subscribe(new MessageFilter(null, MessageType.PROGRESS_UPDATE, null))) {

            int delivered = hub.publish(message("m1", "B", MessageType.TASK_DELEGATION, "C1"));

            Assertions.assertEquals(2, delivered);
            Assertions.assertEquals("m1", forB.poll(Duration.ofMillis(100)).orElseThrow().id());
            Assertions.assertEquals("m1", thread.poll(Duration.ofMillis(100)).orElseThrow().id());
            Assertions.assertTrue(progress.poll(Duration.ofMillis(20)).isEmpty());
        }
    }

    @Test
    void fullQueueDropsForThatSubscriberOnly() {
        SubscriptionHub hub = new SubscriptionHub(1);
        Subscription slow = hub.subscribe(MessageFilter.forRecipient("B"));
        Subscription fast = hub.subscribe(MessageFilter.forRecipient("B"));

        hub.publish(message("m1", "B", MessageType.ANNOUNCEMENT, null));
        fast.drain();
        int delivered = hub.publish(message("m2", "B", MessageType.ANNOUNCEMENT, null));

        Assertions.assertEquals(1, delivered);
        Assertions.assertEquals(1L, slow.dropped());
        Assertions.assertEquals(0L, fast.dropped());
        Assertions.assertEquals(List.of("m1"), slow.drain().stream().map(Message::id).toList());
        Assertions.assertEquals(List.of("m2"), fast.drain().stream().map(Message::id).toList());
    }

    @Test
    void cancelledSubscriptionLeavesTheHub() throws Exception {
        SubscriptionHub hub = new SubscriptionHub(4);
        Subscription subscription = hub.subscribe(MessageFilter.forRecipient("B"));
        Assertions.assertEquals(1, hub.activeCount());

        subscription.cancel();
        subscription.cancel();

        Assertions.assertEquals(0, hub.activeCount());
        Assertions.assertTrue(subscription.cancelled());
        Assertions.assertEquals(0, hub.publish(message("m1", "B", MessageType.ANNOUNCEMENT, null)));
        Assertions.assertTrue(subscription.poll(Duration.ofSeconds(5)).isEmpty());
    }

    private static Message message(String id, String recipient, MessageType type, String contextId) {
        return new Message(id, 1L, "A", recipient, type, Map.of(), contextId, MessageStatus.SENT, 1_000L, null, null, 1_000L);
    }
}
