package io.agentbridge.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentbridge.config.PlatformSettings;
import io.agentbridge.error.ValidationException;
import io.agentbridge.util.Jsons;

import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Supabase database access through PostgREST ({@code /rest/v1}).
 *
 * <p>Filters are {@code {column, operator, value}} objects. Table, column and
 * function names must be plain identifiers so nothing can be smuggled into the
 * query string.
 */
public final class SupabaseAdapter extends HttpServiceAdapter {
    public static final String NAME = "supabase";
    private static final String REST = "/rest/v1/";
    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]{0,62}$");
    private static final Pattern ORDER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]{0,62}(\\.(asc|desc))?$");
    private static final Set<String> OPERATORS = Set.of("eq", "neq", "gt", "gte", "lt", "lte", "like", "ilike", "is", "in");

    public SupabaseAdapter(PlatformSettings platform, long timeoutMs, HttpClient http) {
        super(NAME, platform, timeoutMs, http);
        register("select", this::select);
        register("insert", this::insert);
        register("update", this::update);
        register("upsert", this::upsert);
        register("delete", this::delete);
        register("count", this::count);
        register("rpc", this::rpc);
    }

    @Override
    protected void decorate(RemoteRequest request) {
        request.header("apikey", platform().token());
    }

    @Override
    protected AdapterHealth probe() {
        call(RemoteRequest.get(REST).unguarded());
        return AdapterHealth.healthy(NAME, "connected", Map.of("connected", true));
    }

    private JsonNode select(Params p) {
        RemoteRequest request = RemoteRequest.get(REST + table(p))
                .query("select", columns(p.optString("columns", "*")));
        applyFilters(request, p, false);
        Integer limit = p.optInt("limit");
        if (limit != null) {
            request.query("limit", Math.max(0, limit));
        }
        String order = p.optString("order");
        if (order != null) {
            if (!ORDER.matcher(order).matches()) {
                throw new ValidationException("Invalid order: " + order);
            }
            request.query("order", order);
        }
        return call(request);
    }

    private JsonNode insert(Params p) {
        Object records = records(p);
        return call(RemoteRequest.post(REST + table(p))
                .header("Prefer", "return=representation")
                .body(records));
    }

    private JsonNode update(Params p) {
        Map<String, Object> values = p.requireMap("values");
        RemoteRequest request = RemoteRequest.patch(REST + table(p))
                .header("Prefer", "return=representation")
                .body(values);
        applyFilters(request, p, true);
        return call(request);
    }

    private JsonNode upsert(Params p) {
        Object records = records(p);
        RemoteRequest request = RemoteRequest.post(REST + table(p))
                .header("Prefer", "resolution=merge-duplicates,return=representation")
                .body(records);
        String onConflict = p.optString("onConflict");
        if (onConflict != null) {
            request.query("on_conflict", columns(onConflict));
        }
        return call(request);
    }

    private JsonNode delete(Params p) {
        RemoteRequest request = RemoteRequest.delete(REST + table(p))
                .header("Prefer", "return=representation");
        applyFilters(request, p, true);
        return call(request);
    }

    /**
     * Exact row count from the {@code Content-Range} header of a HEAD request.
     */
    private JsonNode count(Params p) {
        RemoteRequest request = RemoteRequest.head(REST + table(p))
                .query("select", "*")
                .header("Prefer", "count=exact");
        applyFilters(request, p, false);
        RemoteResponse response = exchange(request);
        Optional<String> range = response.headers().firstValue("content-range");
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("table", p.requireString("table"));
        Long total = range.map(SupabaseAdapter::totalFromContentRange).orElse(null);
        if (total == null) {
            out.putNull("count");
        } else {
            out.put("count", total);
        }
        return out;
    }

    private JsonNode rpc(Params p) {
        String function = identifier(p.requireString("function"), "function");
        Map<String, Object> args = p.optMap("args");
        return call(RemoteRequest.post(REST + "rpc/" + function).body(args == null ? Map.of() : args));
    }

    private void applyFilters(RemoteRequest request, Params p, boolean required) {
        List<Object> filters = p.optList("filters");
        if (filters == null || filters.isEmpty()) {
            if (required) {
                throw new ValidationException("At least one filter is required for this operation");
            }
            return;
        }
        for (Object raw : filters) {
            if (!(raw instanceof Map<?, ?> filter)) {
                throw new ValidationException("Each filter must be an object with column, operator and value");
            }
            String column = identifier(stringOf(filter.get("column")), "filter column");
            String operator = stringOf(filter.get("operator")).toLowerCase(Locale.ROOT);
            if (!OPERATORS.contains(operator)) {
                throw new ValidationException("Unsupported filter operator: " + operator);
            }
            request.query(column, operator + "." + filterValue(operator, filter.get("value")));
        }
    }

    static String filterValue(String operator, Object value) {
        if ("in".equals(operator)) {
            List<String> parts = new ArrayList<>();
            if (value instanceof List<?> list) {
                for (Object item : list) {
                    parts.add(String.valueOf(item));
                }
            } else if (value != null) {
                parts.add(String.valueOf(value));
            }
            return "(" + String.join(",", parts) + ")";
        }
        if ("is".equals(operator)) {
            String text = String.valueOf(value).toLowerCase(Locale.ROOT);
            if (!Set.of("null", "true", "false").contains(text)) {
                throw new ValidationException("Operator is accepts only null, true or false");
            }
            return text;
        }
        if (value == null) {
            throw new ValidationException("Filter value is required for operator " + operator);
        }
        return String.valueOf(value);
    }

    static Long totalFromContentRange(String header) {
        int slash = header.lastIndexOf('/');
        if (slash < 0 || slash == header.length() - 1) {
            return null;
        }
        String total = header.substring(slash + 1).trim();
        if ("*".equals(total)) {
            return null;
        }
        try {
            return Long.parseLong(total);
        } catch (NumberFormatException e) {
            throw new ValidationException("Unexpected Content-Range header: " + header);
        }
    }

    private static Object records(Params p) {
        Object records = p.require("records");
        if (records instanceof Map || records instanceof List) {
            return records;
        }
        throw new ValidationException("Parameter records must be an object or a list of objects");
    }

    private static String table(Params p) {
        return identifier(p.requireString("table"), "table");
    }

    private static String columns(String raw) {
        if ("*".equals(raw.trim())) {
            return "*";
        }
        List<String> out = new ArrayList<>();
        for (String column : raw.split(",")) {
            out.add(identifier(column.trim(), "column"));
        }
        return String.join(",", out);
    }

    private static String identifier(String raw, String what) {
        if (raw == null || !IDENTIFIER.matcher(raw).matches()) {
            throw new ValidationException("Invalid " + what + " name: " + raw);
        }
        return raw;
    }

    private static String stringOf(Object value) {
        return value == null ? "" : String.valueOf(value).trim();
    }
}
