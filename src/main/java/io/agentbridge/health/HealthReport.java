package io.agentbridge.health;

import io.agentbridge.a2a.A2AHealth;
import io.agentbridge.adapter.AdapterHealth;

import java.util.List;
import java.util.Map;

public record HealthReport(
        String status,
        Map<String, AdapterHealth> services,
        A2AHealth a2a,
        List<String> disabled,
        String timestamp
) {
    public static final String OK = "ok";
    public static final String DEGRADED = "degraded";

    public boolean ok() {
        return OK.equals(status);
    }
}
