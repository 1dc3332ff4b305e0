package io.agentbridge.chain;

import io.agentbridge.error.ValidationException;
import io.agentbridge.util.Jsons;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code {{path}}} references in step parameters against the chain
 * context. A string that is exactly one reference takes the referenced value
 * with its type; references inside longer strings are interpolated as text.
 */
public final class ContextTemplates {
    private static final Pattern REFERENCE = Pattern.compile("\\{\\{\\s*([^{}]+?)\\s*}}");
    private static final Object MISSING = new Object();

    private ContextTemplates() {
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> resolveParams(Map<String, Object> params, Map<String, Object> context) {
        if (params == null || params.isEmpty()) {
            return new LinkedHashMap<>();
        }
        return (Map<String, Object>) resolve(params, context);
    }

    public static Object resolve(Object value, Map<String, Object> context) {
        if (value instanceof String text) {
            return resolveString(text, context);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                out.put(String.valueOf(entry.getKey()), resolve(entry.getValue(), context));
            }
            return out;
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(resolve(item, context));
            }
            return out;
        }
        return value;
    }

    /**
     * Dotted lookup; numeric segments index into lists.
     */
    public static Object lookup(String path, Map<String, Object> context) {
        Object current = context;
        for (String part : path.split("\\.")) {
            if (current instanceof Map<?, ?> map) {
                if (!map.containsKey(part)) {
                    return MISSING;
                }
                current = map.get(part);
            } else if (current instanceof List<?> list) {
                int index;
                try {
                    index = Integer.parseInt(part);
                } catch (NumberFormatException e) {
                    return MISSING;
                }
                if (index < 0 || index >= list.size()) {
                    return MISSING;
                }
                current = list.get(index);
            } else {
                return MISSING;
            }
        }
        return current;
    }

    private static Object resolveString(String text, Map<String, Object> context) {
        Matcher whole = REFERENCE.matcher(text);
        if (whole.matches()) {
            return require(whole.group(1), context);
        }
        Matcher matcher = REFERENCE.matcher(text);
        StringBuilder out = new StringBuilder();
        boolean found = false;
        while (matcher.find()) {
            found = true;
            Object value = require(matcher.group(1), context);
            matcher.appendReplacement(out, Matcher.quoteReplacement(asText(value)));
        }
        if (!found) {
            return text;
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static Object require(String path, Map<String, Object> context) {
        Object value = lookup(path.trim(), context);
        if (value == MISSING) {
            throw new ValidationException("Unresolved context reference: {{" + path.trim() + "}}");
        }
        return value;
    }

    private static String asText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Map || value instanceof List) {
            return Jsons.toCompactJson(value);
        }
        return String.valueOf(value);
    }
}
