package io.agentbridge.chain;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentbridge.adapter.AdapterRegistry;
import io.agentbridge.adapter.AdapterResult;
import io.agentbridge.adapter.ServiceAdapter;
import io.agentbridge.error.ErrorKind;
import io.agentbridge.error.ValidationException;
import io.agentbridge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs chain steps strictly in order against the adapter registry.
 *
 * <p>Each step runs on a worker thread bounded by the step timeout. A failed
 * step marked critical stops the chain; other failures are recorded and the
 * chain moves on.
 */
public final class ToolChainExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ToolChainExecutor.class);

    private final AdapterRegistry registry;
    private final Duration stepTimeout;
    private final int maxSteps;
    private final ExecutorService workers;

    public ToolChainExecutor(AdapterRegistry registry, Duration stepTimeout, int maxSteps) {
        this.registry = registry;
        this.stepTimeout = stepTimeout;
        this.maxSteps = Math.max(1, maxSteps);
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "chain-step-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public ChainExecutionResult execute(List<ToolInvocation> steps, Map<String, Object> initialContext) {
        if (steps == null) {
            throw new ValidationException("steps are required");
        }
        if (steps.size() > maxSteps) {
            throw new ValidationException("Chain has " + steps.size() + " steps, maximum is " + maxSteps);
        }
        Map<String, Object> context = new LinkedHashMap<>();
        if (initialContext != null) {
            context.putAll(initialContext);
        }
        List<StepRecord> records = new ArrayList<>();
        boolean allSucceeded = true;
        Integer haltedAt = null;

        for (int i = 0; i < steps.size(); i++) {
            ToolInvocation step = steps.get(i);
            long started = System.nanoTime();
            AdapterResult result = runStep(step, context);
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            records.add(new StepRecord(i, step, result, durationMs));

            if (result.success()) {
                publishOutputs(step, result, context);
                continue;
            }
            allSucceeded = false;
            if (step.critical()) {
                haltedAt = i;
                log.warn("Chain halted at step {} ({}.{}): {}", i, step.service(), step.operation(), result.error());
                break;
            }
            if (Thread.currentThread().isInterrupted()) {
                haltedAt = i;
                log.warn("Chain interrupted after step {}", i);
                break;
            }
            log.info("Non-critical step {} ({}.{}) failed, continuing: {}", i, step.service(), step.operation(), result.error());
        }

        boolean halted = haltedAt != null;
        int skipped = steps.size() - records.size();
        return new ChainExecutionResult(allSucceeded && !halted, halted, haltedAt, records, skipped, context);
    }

    private AdapterResult runStep(ToolInvocation step, Map<String, Object> context) {
        if (step == null || isBlank(step.service()) || isBlank(step.operation())) {
            return AdapterResult.fail(ErrorKind.VALIDATION, "Step requires service and operation");
        }
        Map<String, Object> params;
        try {
            params = ContextTemplates.resolveParams(step.params(), context);
        } catch (ValidationException e) {
            return AdapterResult.fail(ErrorKind.VALIDATION, e.getMessage());
        }
        Optional<ServiceAdapter> adapter = registry.find(step.service());
        if (adapter.isEmpty()) {
            return AdapterResult.fail(ErrorKind.SERVICE_UNAVAILABLE, "Unknown service: " + step.service());
        }
        Future<AdapterResult> future = workers.submit(() -> adapter.get().invoke(step.operation(), params));
        try {
            AdapterResult result = future.get(stepTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return result == null
                    ? AdapterResult.fail(ErrorKind.INTERNAL, step.service() + "." + step.operation() + " returned no result")
                    : result;
        } catch (TimeoutException e) {
            future.cancel(true);
            return AdapterResult.fail(ErrorKind.NETWORK,
                    step.service() + "." + step.operation() + " timed out after " + stepTimeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("Step {}.{} threw past the adapter boundary", step.service(), step.operation(), cause);
            return AdapterResult.fail(ErrorKind.INTERNAL, step.service() + "." + step.operation() + " failed: " + cause.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return AdapterResult.fail(ErrorKind.NETWORK, "Chain interrupted during " + step.service() + "." + step.operation());
        }
    }

    private void publishOutputs(ToolInvocation step, AdapterResult result, Map<String, Object> context) {
        if (step.outputs().isEmpty() || result.data() == null) {
            return;
        }
        for (Map.Entry<String, String> output : step.outputs().entrySet()) {
            String pointer = output.getValue() == null ? "" : output.getValue().trim();
            JsonNode node = pointer.isEmpty() || "/".equals(pointer) ? result.data() : at(result.data(), pointer);
            if (node == null || node.isMissingNode()) {
                log.debug("Output {} of step {}.{} found nothing at {}", output.getKey(), step.service(), step.operation(), pointer);
                continue;
            }
            context.put(output.getKey(), Jsons.mapper().convertValue(node, Object.class));
        }
    }

    private static JsonNode at(JsonNode data, String pointer) {
        try {
            return data.at(pointer.startsWith("/") ? pointer : "/" + pointer);
        } catch (IllegalArgumentException e) {
            log.debug("Invalid JSON pointer {}: {}", pointer, e.getMessage());
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }
}
