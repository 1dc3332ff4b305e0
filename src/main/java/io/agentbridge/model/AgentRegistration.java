package io.agentbridge.model;

import java.util.Map;

public record AgentRegistration(
        String agentId,
        Map<String, Object> metadata,
        long registeredAtMs,
        long lastSeenAtMs
) {
}
