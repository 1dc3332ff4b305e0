package io.agentbridge.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.agentbridge.config.PlatformSettings;
import io.agentbridge.error.BridgeException;
import io.agentbridge.error.ErrorKind;
import io.agentbridge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Base for adapters that speak JSON over HTTP with a bearer credential.
 *
 * <p>Subclasses register their operations in the constructor and build calls
 * with {@link #call(RemoteRequest)}. This class owns the adapter boundary:
 * configuration checks, operation lookup, status mapping, rate-limit headroom
 * and the conversion of every failure into an {@link AdapterResult}.
 */
public abstract class HttpServiceAdapter implements ServiceAdapter {
    private static final Logger log = LoggerFactory.getLogger(HttpServiceAdapter.class);
    static final String USER_AGENT = "agentbridge/0.1.0";

    private final String name;
    private final PlatformSettings platform;
    private final Duration timeout;
    private final HttpClient http;
    private final Map<String, Operation> handlers = new LinkedHashMap<>();
    private final List<String> canonicalOperations = new ArrayList<>();
    private volatile RateWindow rateWindow;

    protected HttpServiceAdapter(String name, PlatformSettings platform, long timeoutMs, HttpClient http) {
        this.name = name;
        this.platform = platform;
        this.timeout = Duration.ofMillis(Math.max(1L, timeoutMs));
        this.http = http != null ? http : HttpClient.newBuilder()
                .connectTimeout(this.timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @FunctionalInterface
    protected interface Operation {
        JsonNode apply(Params params);
    }

    /**
     * Probe for {@link #healthCheck()}; throws {@link BridgeException} when the
     * platform is unreachable or rejects the credential.
     */
    protected abstract AdapterHealth probe();

    protected final void register(String operation, Operation handler, String... aliases) {
        handlers.put(operation, handler);
        canonicalOperations.add(operation);
        for (String alias : aliases) {
            handlers.put(alias, handler);
        }
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final List<String> operations() {
        return List.copyOf(canonicalOperations);
    }

    @Override
    public boolean configured() {
        return platform != null && platform.configured();
    }

    @Override
    public final AdapterResult invoke(String operation, Map<String, Object> params) {
        if (!configured()) {
            return AdapterResult.fail(ErrorKind.SERVICE_UNAVAILABLE, name + " is not configured");
        }
        Operation handler = operation == null ? null : handlers.get(operation.trim());
        if (handler == null) {
            return AdapterResult.fail(ErrorKind.VALIDATION, "Unknown " + name + " operation: " + operation);
        }
        try {
            JsonNode data = handler.apply(new Params(params));
            log.info("{}.{} succeeded", name, operation);
            return AdapterResult.ok(data == null ? Jsons.mapper().nullNode() : data);
        } catch (BridgeException e) {
            log.warn("{}.{} failed ({}): {}", name, operation, e.kind(), e.getMessage());
            return AdapterResult.fail(e.kind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("{}.{} failed unexpectedly", name, operation, e);
            return AdapterResult.fail(ErrorKind.INTERNAL, name + "." + operation + " failed: " + e.getMessage());
        }
    }

    @Override
    public final AdapterHealth healthCheck() {
        if (!configured()) {
            return new AdapterHealth(name, false, name + " is not configured", Map.of("configured", false));
        }
        try {
            return probe();
        } catch (BridgeException e) {
            log.warn("{} health probe failed ({}): {}", name, e.kind(), e.getMessage());
            return AdapterHealth.unhealthy(name, e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} health probe failed unexpectedly", name, e);
            return AdapterHealth.unhealthy(name, "probe failed: " + e.getMessage());
        }
    }

    protected final PlatformSettings platform() {
        return platform;
    }

    /**
     * Hook for per-platform headers and query parameters applied to every call.
     */
    protected void decorate(RemoteRequest request) {
    }

    protected final JsonNode call(RemoteRequest request) {
        return exchange(request).body();
    }

    protected final RemoteResponse exchange(RemoteRequest request) {
        decorate(request);
        if (request.guarded) {
            checkRateLimit();
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(buildUri(request))
                .timeout(timeout)
                .header("User-Agent", USER_AGENT);
        if (!request.headers.containsKey("Accept")) {
            builder.header("Accept", "application/json");
        }
        if (!request.headers.containsKey("Authorization")) {
            builder.header("Authorization", "Bearer " + platform.token());
        }
        request.headers.forEach(builder::header);
        if (request.body != null) {
            builder.header("Content-Type", "application/json");
            builder.method(request.method, HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(request.body)));
        } else {
            builder.method(request.method, HttpRequest.BodyPublishers.noBody());
        }

        HttpResponse<String> response;
        try {
            response = http.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new RemoteCallException(ErrorKind.NETWORK,
                    name + " request timed out after " + timeout.toMillis() + "ms: " + request.method + " " + request.path, e);
        } catch (IOException e) {
            throw new RemoteCallException(ErrorKind.NETWORK,
                    name + " request failed: " + e.getClass().getSimpleName() + " " + nullToEmpty(e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteCallException(ErrorKind.NETWORK, name + " request interrupted", e);
        }

        recordRateLimit(response.headers());
        JsonNode body = parseBody(response.body());
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return new RemoteResponse(status, body, response.headers());
        }
        throw new RemoteCallException(classify(status), status,
                "HTTP " + status + ": " + errorMessage(body, response.body()));
    }

    /**
     * Remaining quota reported by the last response, if the platform sends one.
     */
    protected final Optional<RateWindow> rateWindow() {
        return Optional.ofNullable(rateWindow);
    }

    protected final void updateRateWindow(long remaining, long resetEpochSec) {
        rateWindow = new RateWindow(remaining, resetEpochSec);
    }

    protected final boolean rateLimitOk() {
        RateWindow window = rateWindow;
        return window == null || window.remaining() >= platform.rateLimitBuffer();
    }

    protected static JsonNode orNull(JsonNode node) {
        return node == null || node.isMissingNode() ? Jsons.mapper().nullNode() : node;
    }

    protected static String segment(String raw) {
        return URLEncoder.encode(raw, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /**
     * Encodes a slash-separated path, keeping the slashes.
     */
    protected static String pathSegments(String raw) {
        StringBuilder out = new StringBuilder();
        for (String part : raw.split("/")) {
            if (part.isEmpty()) {
                continue;
            }
            if (out.length() > 0) {
                out.append('/');
            }
            out.append(segment(part));
        }
        return out.toString();
    }

    private void checkRateLimit() {
        RateWindow window = rateWindow;
        int buffer = platform.rateLimitBuffer();
        if (window == null || buffer <= 0 || window.remaining() >= buffer) {
            return;
        }
        long nowSec = Instant.now().getEpochSecond();
        if (window.resetEpochSec() > nowSec) {
            throw new RemoteCallException(ErrorKind.RATE_LIMITED, 429,
                    name + " rate limit low: " + window.remaining() + " remaining, resets at "
                            + Instant.ofEpochSecond(window.resetEpochSec()));
        }
    }

    private void recordRateLimit(HttpHeaders headers) {
        Optional<String> remaining = headers.firstValue("x-ratelimit-remaining");
        if (remaining.isEmpty()) {
            return;
        }
        try {
            long left = Long.parseLong(remaining.get().trim());
            long reset = headers.firstValue("x-ratelimit-reset")
                    .map(String::trim)
                    .map(Long::parseLong)
                    .orElse(0L);
            rateWindow = new RateWindow(left, reset);
            if (left < platform.rateLimitBuffer()) {
                log.warn("{} rate limit low: {} requests remaining", name, left);
            }
        } catch (NumberFormatException e) {
            log.debug("{} sent unparseable rate-limit headers: {}", name, e.getMessage());
        }
    }

    private ErrorKind classify(int status) {
        return switch (status) {
            case 401 -> ErrorKind.AUTH;
            case 403 -> rateWindow != null && rateWindow.remaining() <= 0 ? ErrorKind.RATE_LIMITED : ErrorKind.AUTH;
            case 404 -> ErrorKind.NOT_FOUND;
            case 429 -> ErrorKind.RATE_LIMITED;
            case 400, 422 -> ErrorKind.VALIDATION;
            case 502, 503, 504 -> ErrorKind.SERVICE_UNAVAILABLE;
            default -> ErrorKind.REMOTE;
        };
    }

    private URI buildUri(RemoteRequest request) {
        StringBuilder url = new StringBuilder(platform.baseUrl());
        if (!request.path.isEmpty()) {
            if (!request.path.startsWith("/")) {
                url.append('/');
            }
            url.append(request.path);
        }
        boolean first = true;
        for (Map.Entry<String, String> entry : request.query) {
            url.append(first ? '?' : '&');
            first = false;
            url.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
        }
        return URI.create(url.toString());
    }

    private static JsonNode parseBody(String raw) {
        if (raw == null || raw.isBlank()) {
            return Jsons.mapper().createObjectNode();
        }
        try {
            return Jsons.mapper().readTree(raw);
        } catch (JsonProcessingException e) {
            return Jsons.mapper().getNodeFactory().textNode(raw);
        }
    }

    private static String errorMessage(JsonNode body, String raw) {
        if (body != null && body.isObject()) {
            JsonNode error = body.path("error");
            if (error.isObject() && error.hasNonNull("message")) {
                return error.get("message").asText();
            }
            if (error.isTextual()) {
                return error.asText();
            }
            if (body.hasNonNull("message")) {
                return body.get("message").asText();
            }
        }
        String text = raw == null ? "" : raw.trim();
        return text.length() > 200 ? text.substring(0, 200) : text;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    public record RateWindow(long remaining, long resetEpochSec) {
    }

    public record RemoteResponse(int status, JsonNode body, HttpHeaders headers) {
    }

    /**
     * Mutable description of one outbound call. Null query values are skipped;
     * repeated keys are kept in order.
     */
    protected static final class RemoteRequest {
        private final String method;
        private final String path;
        private final List<Map.Entry<String, String>> query = new ArrayList<>();
        private final Map<String, String> headers = new LinkedHashMap<>();
        private Object body;
        private boolean guarded = true;

        private RemoteRequest(String method, String path) {
            this.method = method;
            this.path = path == null ? "" : path;
        }

        public static RemoteRequest get(String path) {
            return new RemoteRequest("GET", path);
        }

        public static RemoteRequest post(String path) {
            return new RemoteRequest("POST", path);
        }

        public static RemoteRequest put(String path) {
            return new RemoteRequest("PUT", path);
        }

        public static RemoteRequest patch(String path) {
            return new RemoteRequest("PATCH", path);
        }

        public static RemoteRequest delete(String path) {
            return new RemoteRequest("DELETE", path);
        }

        public static RemoteRequest head(String path) {
            return new RemoteRequest("HEAD", path);
        }

        public RemoteRequest query(String key, Object value) {
            if (value != null) {
                query.add(Map.entry(key, String.valueOf(value)));
            }
            return this;
        }

        public RemoteRequest header(String key, String value) {
            if (value != null) {
                headers.put(key, value);
            }
            return this;
        }

        public RemoteRequest body(Object value) {
            this.body = value;
            return this;
        }

        /**
         * Skips the fail-fast quota check; used by health probes that read the quota itself.
         */
        public RemoteRequest unguarded() {
            this.guarded = false;
            return this;
        }
    }
}
