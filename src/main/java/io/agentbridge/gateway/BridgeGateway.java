package io.agentbridge.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.agentbridge.adapter.AdapterResult;
import io.agentbridge.adapter.Params;
import io.agentbridge.adapter.ServiceAdapter;
import io.agentbridge.chain.ChainExecutionResult;
import io.agentbridge.chain.ToolInvocation;
import io.agentbridge.error.BridgeException;
import io.agentbridge.error.ErrorKind;
import io.agentbridge.error.ValidationException;
import io.agentbridge.health.HealthReport;
import io.agentbridge.model.Message;
import io.agentbridge.model.MessageType;
import io.agentbridge.observability.RequestIds;
import io.agentbridge.runtime.BridgeRuntime;
import io.agentbridge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON over HTTP in front of the runtime.
 *
 * <p>Every request gets a correlation id echoed in {@code X-Request-Id}, and one
 * audit line once the response is written. Bodies are parsed and checked before
 * any component runs.
 */
public final class BridgeGateway implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BridgeGateway.class);
    private static final long MAX_POLL_WAIT_MS = 30_000L;
    private static final String ADAPTERS_PREFIX = "/api/adapters";

    private final BridgeRuntime runtime;
    private final HttpServer server;
    private final ExecutorService workers;

    public BridgeGateway(BridgeRuntime runtime, int port) throws IOException {
        this.runtime = runtime;
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(1, runtime.settings().gatewayThreads()), r -> {
            Thread t = new Thread(r, "gateway-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(workers);
        route("/health", Set.of("GET"), this::health);
        route("/api/a2a/messages", Set.of("GET", "POST"), this::messages);
        route("/api/a2a/poll", Set.of("GET"), this::poll);
        route("/api/a2a/threads", Set.of("GET"), this::thread);
        route("/api/a2a/ack", Set.of("POST"), this::ack);
        route("/api/a2a/unread", Set.of("GET"), this::unread);
        route("/api/a2a/broadcast", Set.of("POST"), this::broadcast);
        route("/api/a2a/cleanup", Set.of("POST"), this::cleanup);
        route("/api/a2a/agents", Set.of("GET", "POST"), this::agents);
        route("/api/tools/execute", Set.of("POST"), this::executeChain);
        server.createContext(ADAPTERS_PREFIX, exchange -> handle(exchange, null, this::adapters));
        server.createContext("/", exchange -> handle(exchange, null, BridgeGateway::noRoute));
    }

    public void start() {
        server.start();
        log.info("AgentBridge gateway listening on port {}", port());
    }

    public int port() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(0);
        workers.shutdownNow();
    }

    private void route(String path, Set<String> methods, Handler handler) {
        server.createContext(path, exchange -> {
            if (!path.equals(exchange.getRequestURI().getPath())) {
                handle(exchange, null, BridgeGateway::noRoute);
                return;
            }
            handle(exchange, methods, handler);
        });
    }

    private static Reply noRoute(Request request) {
        throw new BridgeException(ErrorKind.NOT_FOUND, "No route for " + request.path());
    }

    private void handle(HttpExchange exchange, Set<String> methods, Handler handler) throws IOException {
        String requestId = RequestIds.acceptOrCreate(exchange.getRequestHeaders().getFirst(RequestIds.HEADER));
        exchange.getResponseHeaders().set(RequestIds.HEADER, requestId);
        String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
        String path = exchange.getRequestURI().getPath();
        Reply reply;
        try {
            if (methods != null && !methods.contains(method)) {
                exchange.getResponseHeaders().set("Allow", String.join(", ", methods));
                throw new MethodNotAllowed("Method " + method + " not allowed on " + path);
            }
            Request request = new Request(method, path, parseQuery(exchange.getRequestURI()), readBody(exchange, method), requestId);
            reply = handler.handle(request);
        } catch (MethodNotAllowed e) {
            reply = error(405, e.kind(), e.getMessage(), requestId);
        } catch (BridgeException e) {
            if (e.kind() == ErrorKind.NETWORK || e.kind() == ErrorKind.INTERNAL) {
                log.error("Request {} {} failed [{}]", method, path, requestId, e);
            }
            reply = error(e.kind().httpStatus(), e.kind(), e.getMessage(), requestId);
        } catch (RuntimeException e) {
            log.error("Unexpected failure on {} {} [{}]", method, path, requestId, e);
            reply = error(500, ErrorKind.INTERNAL, "Internal error", requestId);
        }
        try {
            writeJson(exchange, reply.body(), reply.status());
        } finally {
            exchange.close();
            audit(method, path, requestId, reply.status(), exchange);
        }
    }

    private void audit(String method, String path, String requestId, int status, HttpExchange exchange) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("method", method);
        details.put("status", status);
        InetSocketAddress remote = exchange.getRemoteAddress();
        String actor = remote == null ? "unknown" : remote.getAddress().getHostAddress();
        try {
            runtime.audit("gateway.request", actor, path, status < 400 ? "ok" : "error", requestId, details);
        } catch (RuntimeException e) {
            log.warn("Audit write failed for request {}: {}", requestId, e.getMessage());
        }
    }

    private Reply health(Request request) {
        HealthReport report = runtime.health().aggregate();
        return new Reply(report.ok() ? 200 : 503, report);
    }

    private Reply messages(Request request) {
        if ("POST".equals(request.method())) {
            Map<String, Object> body = request.body();
            Message message = runtime.a2a().send(
                    stringField(body, "sender"),
                    stringField(body, "recipient"),
                    MessageType.fromString(stringField(body, "type")),
                    mapField(body, "payload"),
                    contextId(body)
            );
            return new Reply(201, message);
        }
        Map<String, String> q = request.query();
        List<Message> messages = runtime.a2a().getMessages(
                q.get("recipient"),
                optionalType(q.get("type")),
                optionalInt(q.get("limit"), "limit"),
                blankToNull(q.get("after"))
        );
        return new Reply(200, Map.of("messages", messages, "count", messages.size()));
    }

    private Reply poll(Request request) {
        Map<String, String> q = request.query();
        Integer waitMs = optionalInt(q.get("waitMs"), "waitMs");
        long wait = waitMs == null ? 0L : Math.max(0L, Math.min(MAX_POLL_WAIT_MS, waitMs));
        List<Message> messages = runtime.a2a().awaitMessages(
                q.get("recipient"),
                optionalType(q.get("type")),
                blankToNull(q.get("after")),
                Duration.ofMillis(wait)
        );
        return new Reply(200, Map.of("messages", messages, "count", messages.size()));
    }

    private Reply thread(Request request) {
        List<Message> messages = runtime.a2a().getMessagesByContext(request.query().get("contextId"));
        return new Reply(200, Map.of("messages", messages, "count", messages.size()));
    }

    private Reply ack(Request request) {
        Map<String, Object> body = request.body();
        Message message = runtime.a2a().acknowledgeMessage(stringField(body, "messageId"), stringField(body, "acknowledger"));
        return new Reply(200, message);
    }

    private Reply unread(Request request) {
        String agent = request.query().get("agent");
        int count = runtime.a2a().getUnreadCount(agent);
        return new Reply(200, Map.of("agent", agent, "unread", count));
    }

    private Reply broadcast(Request request) {
        Map<String, Object> body = request.body();
        List<String> targets = new ArrayList<>();
        Object raw = body.get("targets");
        if (raw instanceof List<?> list) {
            for (Object item : list) {
                targets.add(item == null ? null : String.valueOf(item));
            }
        } else if (raw != null) {
            throw new ValidationException("targets must be a list of agent ids");
        }
        return new Reply(200, runtime.a2a().broadcast(
                stringField(body, "sender"),
                MessageType.fromString(stringField(body, "type")),
                mapField(body, "payload"),
                targets,
                contextId(body)
        ));
    }

    private Reply cleanup(Request request) {
        Object raw = request.body().get("ageDays");
        int ageDays;
        if (raw == null) {
            ageDays = runtime.settings().retentionDays();
        } else {
            ageDays = new Params(request.body()).requireInt("ageDays");
        }
        int removed = runtime.a2a().cleanupOldMessages(ageDays);
        return new Reply(200, Map.of("removed", removed, "ageDays", ageDays));
    }

    private Reply agents(Request request) {
        if ("POST".equals(request.method())) {
            Map<String, Object> body = request.body();
            Map<String, Object> metadata = body.get("metadata") == null ? Map.of() : mapField(body, "metadata");
            return new Reply(201, runtime.a2a().registerAgent(stringField(body, "agentId"), metadata));
        }
        return new Reply(200, Map.of("agents", runtime.a2a().listAgents()));
    }

    private Reply executeChain(Request request) {
        JsonNode body = Jsons.toTree(request.body());
        JsonNode rawSteps = body.path("steps");
        if (!rawSteps.isArray()) {
            throw new ValidationException("steps must be a list");
        }
        List<ToolInvocation> steps = new ArrayList<>();
        for (JsonNode step : rawSteps) {
            steps.add(ToolInvocation.fromJson(step));
        }
        JsonNode context = body.path("context");
        if (!context.isMissingNode() && !context.isNull() && !context.isObject()) {
            throw new ValidationException("context must be an object");
        }
        ChainExecutionResult result = runtime.chains().execute(steps, Jsons.toMap(context));
        return new Reply(200, result);
    }

    private Reply adapters(Request request) {
        String rest = request.path().substring(ADAPTERS_PREFIX.length());
        List<String> parts = new ArrayList<>();
        for (String part : rest.split("/")) {
            if (!part.isBlank()) {
                parts.add(part);
            }
        }
        if (parts.isEmpty()) {
            requireMethod(request, "GET");
            List<Map<String, Object>> services = new ArrayList<>();
            for (ServiceAdapter adapter : runtime.adapters().adapters()) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("service", adapter.name());
                row.put("configured", adapter.configured());
                row.put("operations", adapter.operations());
                services.add(row);
            }
            return new Reply(200, Map.of("services", services));
        }
        if (parts.size() != 2) {
            throw new BridgeException(ErrorKind.NOT_FOUND, "No route for " + request.path());
        }
        requireMethod(request, "POST");
        Optional<ServiceAdapter> adapter = runtime.adapters().find(parts.get(0));
        if (adapter.isEmpty()) {
            throw new BridgeException(ErrorKind.SERVICE_UNAVAILABLE, "Unknown service: " + parts.get(0));
        }
        AdapterResult result = adapter.get().invoke(parts.get(1), request.body());
        int status = result.success() ? 200 : result.errorKind() == null ? 500 : result.errorKind().httpStatus();
        return new Reply(status, result);
    }

    private static void requireMethod(Request request, String method) {
        if (!method.equals(request.method())) {
            throw new MethodNotAllowed(request.method() + " not allowed on " + request.path());
        }
    }

    private static Reply error(int status, ErrorKind kind, String message, String requestId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", message);
        body.put("kind", kind.name());
        body.put("requestId", requestId);
        body.put("timestamp", Instant.now().toString());
        return new Reply(status, body);
    }

    private static Map<String, Object> readBody(HttpExchange exchange, String method) throws IOException {
        if (!"POST".equals(method) && !"PUT".equals(method) && !"PATCH".equals(method)) {
            return Map.of();
        }
        byte[] raw = exchange.getRequestBody().readAllBytes();
        if (raw.length == 0) {
            return Map.of();
        }
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed JSON body: " + e.getOriginalMessage());
        }
        if (node == null || node.isMissingNode() || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new ValidationException("Request body must be a JSON object");
        }
        return Jsons.toMap(node);
    }

    private static String stringField(Map<String, Object> body, String key) {
        Object value = body.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Map || value instanceof List) {
            throw new ValidationException(key + " must be a string");
        }
        return String.valueOf(value);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> mapField(Map<String, Object> body, String key) {
        Object value = body.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new ValidationException(key + " must be an object");
        }
        return (Map<String, Object>) value;
    }

    private static String contextId(Map<String, Object> body) {
        String value = stringField(body, "contextId");
        return value != null ? value : stringField(body, "context_id");
    }

    private static MessageType optionalType(String raw) {
        return raw == null || raw.isBlank() ? null : MessageType.fromString(raw);
    }

    private static Integer optionalInt(String raw, String name) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(name + " must be an integer");
        }
    }

    private static String blankToNull(String raw) {
        return raw == null || raw.isBlank() ? null : raw.trim();
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    static Map<String, String> parseQuery(URI uri) {
        return parseQueryString(uri.getRawQuery());
    }

    static Map<String, String> parseQueryString(String query) {
        Map<String, String> out = new LinkedHashMap<>();
        if (query == null || query.isBlank()) {
            return out;
        }
        for (String pair : query.split("&")) {
            if (pair.isBlank()) {
                continue;
            }
            int idx = pair.indexOf('=');
            if (idx < 0) {
                out.put(decode(pair), "");
            } else {
                out.put(decode(pair.substring(0, idx)), decode(pair.substring(idx + 1)));
            }
        }
        return out;
    }

    private static String decode(String raw) {
        try {
            return URLDecoder.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Malformed query string: " + e.getMessage());
        }
    }

    @FunctionalInterface
    private interface Handler {
        Reply handle(Request request);
    }

    private record Request(String method, String path, Map<String, String> query, Map<String, Object> body, String requestId) {
    }

    private record Reply(int status, Object body) {
    }

    private static final class MethodNotAllowed extends BridgeException {
        MethodNotAllowed(String message) {
            super(ErrorKind.VALIDATION, message);
        }
    }
}
