package io.agentbridge.adapter;

import io.agentbridge.config.BridgeSettings;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Service name to adapter map, fixed at construction. Lookups of unknown
 * names return an empty {@link Optional} so callers decide how to fail.
 */
public final class AdapterRegistry {
    private final Map<String, ServiceAdapter> adapters;

    public AdapterRegistry(List<ServiceAdapter> adapters) {
        Map<String, ServiceAdapter> byName = new LinkedHashMap<>();
        for (ServiceAdapter adapter : adapters) {
            String key = normalize(adapter.name());
            if (byName.putIfAbsent(key, adapter) != null) {
                throw new IllegalArgumentException("Duplicate adapter name: " + adapter.name());
            }
        }
        this.adapters = Collections.unmodifiableMap(byName);
    }

    /**
     * Registers the four built-in platforms. Adapters without credentials are
     * still registered and report themselves unconfigured.
     */
    public static AdapterRegistry fromSettings(BridgeSettings settings) {
        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(settings.adapterTimeoutMs()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        long timeoutMs = settings.adapterTimeoutMs();
        return new AdapterRegistry(List.of(
                new GitHubAdapter(settings.github(), timeoutMs, http),
                new VercelAdapter(settings.vercel(), timeoutMs, http),
                new RailwayAdapter(settings.railway(), timeoutMs, http),
                new SupabaseAdapter(settings.supabase(), timeoutMs, http)
        ));
    }

    public Optional<ServiceAdapter> find(String service) {
        if (service == null || service.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(adapters.get(normalize(service)));
    }

    public Collection<ServiceAdapter> adapters() {
        return adapters.values();
    }

    public List<String> names() {
        return List.copyOf(adapters.keySet());
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
