package io.agentbridge.adapter;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Loopback HTTP server standing in for a remote platform.
 */
final class FakeRemote implements AutoCloseable {
    private final HttpServer server;
    private final List<Recorded> requests = Collections.synchronizedList(new ArrayList<>());
    private volatile Function<Recorded, Reply> responder = r -> Reply.json(200, "{}");

    FakeRemote() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            Recorded recorded = new Recorded(
                    exchange.getRequestMethod(),
                    exchange.getRequestURI().getPath(),
                    exchange.getRequestURI().getRawQuery(),
                    exchange.getRequestHeaders(),
                    body
            );
            requests.add(recorded);
            Reply reply = responder.apply(recorded);
            reply.headers().forEach((k, v) -> exchange.getResponseHeaders().set(k, v));
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            byte[] bytes = reply.body().getBytes(StandardCharsets.UTF_8);
            if ("HEAD".equals(recorded.method()) || bytes.length == 0) {
                exchange.sendResponseHeaders(reply.status(), -1);
                exchange.close();
                return;
            }
            exchange.sendResponseHeaders(reply.status(), bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
    }

    String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    void respond(Function<Recorded, Reply> value) {
        this.responder = value;
    }

    List<Recorded> requests() {
        return List.copyOf(requests);
    }

    Recorded last() {
        List<Recorded> all = requests();
        return all.get(all.size() - 1);
    }

    @Override
    public void close() {
        server.stop(0);
    }

    record Recorded(String method, String path, String rawQuery, Headers headers, String body) {
        List<String> queryValues(String key) {
            List<String> out = new ArrayList<>();
            if (rawQuery == null) {
                return out;
            }
            for (String pair : rawQuery.split("&")) {
                int idx = pair.indexOf('=');
                String k = URLDecoder.decode(idx < 0 ? pair : pair.substring(0, idx), StandardCharsets.UTF_8);
                if (k.equals(key)) {
                    out.add(idx < 0 ? "" : URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8));
                }
            }
            return out;
        }

        String query(String key) {
            List<String> values = queryValues(key);
            return values.isEmpty() ? null : values.get(0);
        }

        String header(String name) {
            return headers.getFirst(name);
        }
    }

    record Reply(int status, String body, Map<String, String> headers) {
        static Reply json(int status, String body) {
            return new Reply(status, body, Map.of());
        }
    }
}
