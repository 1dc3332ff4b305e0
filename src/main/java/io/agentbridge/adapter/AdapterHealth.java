package io.agentbridge.adapter;

import java.util.Map;

/**
 * One fresh health probe result for a service. Never cached.
 */
public record AdapterHealth(
        String service,
        boolean healthy,
        String detail,
        Map<String, Object> attributes
) {
    public AdapterHealth {
        attributes = attributes == null ? Map.of() : attributes;
    }

    public static AdapterHealth healthy(String service, String detail, Map<String, Object> attributes) {
        return new AdapterHealth(service, true, detail, attributes);
    }

    public static AdapterHealth unhealthy(String service, String detail) {
        return new AdapterHealth(service, false, detail, Map.of());
    }
}
