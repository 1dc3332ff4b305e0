package io.agentbridge.chain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * {@code steps} holds only the steps that ran. When {@code halted} is true the
 * last entry is the critical step that failed and {@code skipped} counts the
 * steps after it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChainExecutionResult(
        boolean success,
        boolean halted,
        Integer haltedAt,
        List<StepRecord> steps,
        int skipped,
        Map<String, Object> context
) {
}
