package io.agentbridge.health;

import io.agentbridge.a2a.A2AClient;
import io.agentbridge.a2a.A2AHealth;
import io.agentbridge.adapter.AdapterHealth;
import io.agentbridge.adapter.AdapterRegistry;
import io.agentbridge.adapter.ServiceAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Probes every configured adapter and the message store concurrently.
 *
 * <p>All probes share one deadline, so {@link #aggregate()} returns within
 * roughly the probe timeout even when several probes hang. Unconfigured
 * adapters are listed as disabled and not probed.
 */
public final class HealthAggregator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HealthAggregator.class);

    private final AdapterRegistry registry;
    private final A2AClient a2a;
    private final Duration probeTimeout;
    private final ExecutorService probes;

    public HealthAggregator(AdapterRegistry registry, A2AClient a2a, Duration probeTimeout) {
        this.registry = registry;
        this.a2a = a2a;
        this.probeTimeout = probeTimeout;
        AtomicInteger counter = new AtomicInteger();
        this.probes = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "health-probe-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public HealthReport aggregate() {
        Map<String, Future<AdapterHealth>> pending = new LinkedHashMap<>();
        List<String> disabled = new ArrayList<>();
        for (ServiceAdapter adapter : registry.adapters()) {
            if (!adapter.configured()) {
                disabled.add(adapter.name());
                continue;
            }
            pending.put(adapter.name(), submit(adapter::healthCheck));
        }
        Future<A2AHealth> a2aFuture = submit(a2a::healthCheck);

        long deadline = System.nanoTime() + probeTimeout.toNanos();
        Map<String, AdapterHealth> services = new LinkedHashMap<>();
        boolean allHealthy = true;
        for (Map.Entry<String, Future<AdapterHealth>> entry : pending.entrySet()) {
            String name = entry.getKey();
            AdapterHealth health = await(entry.getValue(), deadline,
                    detail -> AdapterHealth.unhealthy(name, detail));
            services.put(name, health);
            allHealthy &= health.healthy();
        }
        A2AHealth a2aHealth = await(a2aFuture, deadline,
                detail -> new A2AHealth(A2AHealth.UNHEALTHY, detail, Map.of()));
        allHealthy &= a2aHealth.healthy();

        String status = allHealthy ? HealthReport.OK : HealthReport.DEGRADED;
        if (!allHealthy) {
            List<String> failing = new ArrayList<>();
            services.forEach((name, h) -> {
                if (!h.healthy()) {
                    failing.add(name);
                }
            });
            if (!a2aHealth.healthy()) {
                failing.add("a2a");
            }
            log.warn("Health degraded: {}", failing);
        }
        return new HealthReport(status, services, a2aHealth, disabled, Instant.now().toString());
    }

    private <T> Future<T> submit(Callable<T> probe) {
        return probes.submit(probe);
    }

    /**
     * Waits for one probe until the shared deadline. A probe still running at
     * the deadline is cancelled with an interrupt so its thread is released.
     */
    private <T> T await(Future<T> future, long deadlineNanos, Function<String, T> failure) {
        long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return failure.apply("health probe timed out after " + probeTimeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return failure.apply("health probe failed: " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure.apply("health probe interrupted");
        }
    }

    @Override
    public void close() {
        probes.shutdownNow();
    }
}
