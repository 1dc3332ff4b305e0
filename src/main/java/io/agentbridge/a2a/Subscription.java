package io.agentbridge.a2a;

import io.agentbridge.model.Message;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Best-effort push feed for one subscriber. Messages that arrive while the
 * queue is full are counted in {@link #dropped()} and must be picked up by
 * polling the store.
 */
public final class Subscription implements AutoCloseable {
    private final String id;
    private final MessageFilter filter;
    private final BlockingQueue<Message> queue;
    private final SubscriptionHub hub;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();

    Subscription(String id, MessageFilter filter, int capacity, SubscriptionHub hub) {
        this.id = id;
        this.filter = filter;
        this.queue = new LinkedBlockingQueue<>(Math.max(1, capacity));
        this.hub = hub;
    }

    public String id() {
        return id;
    }

    public MessageFilter filter() {
        return filter;
    }

    /**
     * Waits up to {@code timeout} for the next pushed message.
     */
    public Optional<Message> poll(Duration timeout) throws InterruptedException {
        if (cancelled.get()) {
            return Optional.ofNullable(queue.poll());
        }
        long waitMs = timeout == null ? 0L : Math.max(0L, timeout.toMillis());
        return Optional.ofNullable(queue.poll(waitMs, TimeUnit.MILLISECONDS));
    }

    public List<Message> drain() {
        List<Message> out = new ArrayList<>();
        queue.drainTo(out);
        return out;
    }

    public long dropped() {
        return dropped.get();
    }

    public boolean cancelled() {
        return cancelled.get();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            hub.remove(this);
        }
    }

    @Override
    public void close() {
        cancel();
    }

    boolean offer(Message message) {
        if (cancelled.get() || !filter.matches(message)) {
            return false;
        }
        if (queue.offer(message)) {
            return true;
        }
        dropped.incrementAndGet();
        return false;
    }
}
