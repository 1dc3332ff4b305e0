package io.agentbridge.a2a;

import io.agentbridge.config.BridgeSettings;
import io.agentbridge.error.BridgeException;
import io.agentbridge.error.ValidationException;
import io.agentbridge.model.AgentRegistration;
import io.agentbridge.model.Message;
import io.agentbridge.model.MessageType;
import io.agentbridge.storage.MessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Agent-facing API over the message store.
 *
 * <p>The store is the source of truth. Push delivery through the
 * {@link SubscriptionHub} happens only after the durable insert returned, so a
 * subscriber that misses a push still finds the message on its next read.
 */
public final class A2AClient {
    private static final Logger log = LoggerFactory.getLogger(A2AClient.class);
    private static final int MAX_ID_LENGTH = 100;
    private static final long DAY_MS = 24L * 60L * 60L * 1000L;

    private final MessageStore store;
    private final SubscriptionHub hub;
    private final int defaultLimit;
    private final int maxLimit;
    private final Clock clock;

    public A2AClient(MessageStore store, SubscriptionHub hub, BridgeSettings settings) {
        this(store, hub, settings.defaultInboxLimit(), settings.maxInboxLimit(), Clock.systemUTC());
    }

    public A2AClient(MessageStore store, SubscriptionHub hub, int defaultLimit, int maxLimit, Clock clock) {
        this.store = store;
        this.hub = hub;
        this.maxLimit = Math.max(1, maxLimit);
        this.defaultLimit = Math.max(1, Math.min(this.maxLimit, defaultLimit));
        this.clock = clock;
    }

    public Message send(String sender, String recipient, MessageType type, Map<String, Object> payload, String contextId) {
        String from = requireAgentId(sender, "sender");
        String to = requireAgentId(recipient, "recipient");
        if (type == null) {
            throw new ValidationException("Message type is required");
        }
        if (payload == null) {
            throw new ValidationException("payload is required");
        }
        String context = normalizeContextId(contextId);
        Message stored = store.insert(new MessageStore.NewMessage(
                "msg_" + UUID.randomUUID(),
                from,
                to,
                type,
                new LinkedHashMap<>(payload),
                context,
                clock.millis()
        ));
        log.info("Message {} sent {} -> {} type={} context={}", stored.id(), from, to, type, context);
        int pushed = hub.publish(stored);
        if (pushed > 0) {
            log.debug("Message {} pushed to {} subscriber(s)", stored.id(), pushed);
        }
        return stored;
    }

    public Message send(String sender, String recipient, String type, Map<String, Object> payload, String contextId) {
        return send(sender, recipient, MessageType.fromString(type), payload, contextId);
    }

    /**
     * Inbox for {@code recipient}, newest first. A null limit uses the
     * configured default; any limit is clamped to {@code [1, maxLimit]}.
     */
    public List<Message> getMessages(String recipient, MessageType type, Integer limit, String afterId) {
        String to = requireAgentId(recipient, "recipient");
        return store.listForRecipient(to, type, blankToNull(afterId), effectiveLimit(limit));
    }

    public List<Message> getMessages(String recipient, MessageType type, Integer limit) {
        return getMessages(recipient, type, limit, null);
    }

    public List<Message> getMessagesByContext(String contextId) {
        if (contextId == null || contextId.isBlank()) {
            throw new ValidationException("contextId is required");
        }
        return store.listByContext(normalizeContextId(contextId));
    }

    /**
     * Marks the message acknowledged. A second call is a no-op that returns the
     * stored record, so the first acknowledger is kept.
     */
    public Message acknowledgeMessage(String messageId, String acknowledger) {
        if (messageId == null || messageId.isBlank()) {
            throw new ValidationException("messageId is required");
        }
        String by = requireAgentId(acknowledger, "acknowledger");
        MessageStore.AckOutcome outcome = store.acknowledge(messageId.trim(), by, clock.millis());
        if (outcome.transitioned()) {
            log.info("Message {} acknowledged by {}", messageId, by);
        } else {
            log.info("Message {} already acknowledged by {}, ignoring ack from {}",
                    messageId, outcome.message().acknowledgedBy(), by);
        }
        return outcome.message();
    }

    public int getUnreadCount(String agent) {
        return store.countUnread(requireAgentId(agent, "agent"));
    }

    public int cleanupOldMessages(int ageDays) {
        if (ageDays < 0) {
            throw new ValidationException("ageDays must be >= 0");
        }
        long cutoff = clock.millis() - ageDays * DAY_MS;
        int removed = store.deleteCreatedBefore(cutoff);
        log.info("Retention cleanup removed {} message(s) older than {} day(s)", removed, ageDays);
        return removed;
    }

    public A2AHealth healthCheck() {
        try {
            MessageStore.StoreCounts counts = store.counts();
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("messages", counts.messages());
            attributes.put("unread", counts.unread());
            attributes.put("agents", counts.agents());
            attributes.put("subscribers", hub.activeCount());
            return new A2AHealth(A2AHealth.HEALTHY, "message store reachable", attributes);
        } catch (BridgeException e) {
            log.warn("A2A health check failed: {}", e.getMessage());
            return new A2AHealth(A2AHealth.UNHEALTHY, e.getMessage(), Map.of("kind", e.kind().name()));
        }
    }

    /**
     * Sends one message per target. An empty target list fans out to every
     * registered agent except the sender, or to the {@code All} sentinel when
     * no agent is registered. A failing target does not stop the others.
     */
    public BroadcastOutcome broadcast(
            String sender,
            MessageType type,
            Map<String, Object> payload,
            List<String> targets,
            String contextId
    ) {
        String from = requireAgentId(sender, "sender");
        if (type == null) {
            throw new ValidationException("Message type is required");
        }
        if (payload == null) {
            throw new ValidationException("payload is required");
        }
        List<String> resolved = resolveTargets(from, targets);
        List<BroadcastOutcome.Delivery> deliveries = new ArrayList<>();
        int ok = 0;
        for (String target : resolved) {
            try {
                Message message = send(from, target, type, payload, contextId);
                deliveries.add(BroadcastOutcome.Delivery.ok(target, message));
                ok++;
            } catch (BridgeException e) {
                log.warn("Broadcast from {} to {} failed: {}", from, target, e.getMessage());
                deliveries.add(BroadcastOutcome.Delivery.fail(target, e.getMessage()));
            }
        }
        log.info("Broadcast from {} type={} delivered {}/{}", from, type, ok, resolved.size());
        return new BroadcastOutcome(resolved.size(), ok, deliveries);
    }

    public AgentRegistration registerAgent(String agentId, Map<String, Object> metadata) {
        String id = requireAgentId(agentId, "agentId");
        if (Message.BROADCAST_RECIPIENT.equals(id)) {
            throw new ValidationException("agentId must not be the broadcast sentinel " + Message.BROADCAST_RECIPIENT);
        }
        AgentRegistration registration = store.upsertAgent(id, metadata == null ? Map.of() : metadata, clock.millis());
        log.info("Agent {} registered", id);
        return registration;
    }

    public List<AgentRegistration> listAgents() {
        return store.listAgents();
    }

    /**
     * Long-poll read. Returns the inbox immediately when it is not empty,
     * otherwise waits up to {@code wait} for a push and re-reads the store.
     */
    public List<Message> awaitMessages(String recipient, MessageType type, String afterId, Duration wait) {
        String to = requireAgentId(recipient, "recipient");
        try (Subscription subscription = hub.subscribe(new MessageFilter(to, type, null))) {
            List<Message> current = getMessages(to, type, null, afterId);
            if (!current.isEmpty() || wait == null || wait.isZero() || wait.isNegative()) {
                return current;
            }
            Optional<Message> pushed = subscription.poll(wait);
            if (pushed.isEmpty()) {
                return List.of();
            }
            return getMessages(to, type, null, afterId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        }
    }

    private List<String> resolveTargets(String sender, List<String> targets) {
        Set<String> out = new LinkedHashSet<>();
        if (targets != null && !targets.isEmpty()) {
            for (String target : targets) {
                out.add(target == null ? "" : target.trim());
            }
            return new ArrayList<>(out);
        }
        for (AgentRegistration agent : store.listAgents()) {
            if (!agent.agentId().equals(sender)) {
                out.add(agent.agentId());
            }
        }
        if (out.isEmpty()) {
            out.add(Message.BROADCAST_RECIPIENT);
        }
        return new ArrayList<>(out);
    }

    private int effectiveLimit(Integer limit) {
        if (limit == null) {
            return defaultLimit;
        }
        return Math.max(1, Math.min(maxLimit, limit));
    }

    private static String requireAgentId(String raw, String field) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        String value = raw.trim();
        if (value.length() > MAX_ID_LENGTH) {
            throw new ValidationException(field + " must be at most " + MAX_ID_LENGTH + " characters");
        }
        return value;
    }

    private static String normalizeContextId(String raw) {
        String value = blankToNull(raw);
        if (value != null && value.length() > MAX_ID_LENGTH) {
            throw new ValidationException("contextId must be at most " + MAX_ID_LENGTH + " characters");
        }
        return value;
    }

    private static String blankToNull(String raw) {
        return raw == null || raw.isBlank() ? null : raw.trim();
    }
}
