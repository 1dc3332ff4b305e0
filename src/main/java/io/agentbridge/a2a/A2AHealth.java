package io.agentbridge.a2a;

import java.util.Map;

public record A2AHealth(String status, String detail, Map<String, Object> attributes) {
    public static final String HEALTHY = "HEALTHY";
    public static final String UNHEALTHY = "UNHEALTHY";

    public A2AHealth {
        attributes = attributes == null ? Map.of() : attributes;
    }

    public boolean healthy() {
        return HEALTHY.equals(status);
    }
}
