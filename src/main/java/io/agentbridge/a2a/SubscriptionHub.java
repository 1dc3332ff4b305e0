package io.agentbridge.a2a;

import io.agentbridge.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process fan-out of freshly stored messages to live subscribers.
 *
 * <p>Publishing never blocks the sender; a full subscriber queue drops the
 * message for that subscriber only.
 */
public final class SubscriptionHub {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionHub.class);

    private final int queueCapacity;
    private final Set<Subscription> subscriptions = ConcurrentHashMap.newKeySet();

    public SubscriptionHub(int queueCapacity) {
        this.queueCapacity = Math.max(1, queueCapacity);
    }

    public Subscription subscribe(MessageFilter filter) {
        Subscription subscription = new Subscription(
                "sub_" + UUID.randomUUID(),
                filter == null ? new MessageFilter(null, null, null) : filter,
                queueCapacity,
                this
        );
        subscriptions.add(subscription);
        log.debug("Subscription {} opened for {}", subscription.id(), subscription.filter());
        return subscription;
    }

    /**
     * Returns how many subscribers accepted the message.
     */
    public int publish(Message message) {
        int delivered = 0;
        for (Subscription subscription : subscriptions) {
            if (subscription.offer(message)) {
                delivered++;
            } else if (!subscription.cancelled() && subscription.filter().matches(message)) {
                log.warn("Subscription {} queue full, dropped message {}", subscription.id(), message.id());
            }
        }
        return delivered;
    }

    public int activeCount() {
        return subscriptions.size();
    }

    void remove(Subscription subscription) {
        if (subscriptions.remove(subscription)) {
            log.debug("Subscription {} closed", subscription.id());
        }
    }
}
