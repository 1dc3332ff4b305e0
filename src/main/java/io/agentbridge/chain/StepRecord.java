package io.agentbridge.chain;

import io.agentbridge.adapter.AdapterResult;

public record StepRecord(
        int index,
        ToolInvocation step,
        AdapterResult result,
        long durationMs
) {
}
