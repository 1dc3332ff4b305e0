package io.agentbridge.adapter;

import io.agentbridge.error.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed view over an operation's parameter map. Missing or ill-typed values
 * raise {@link ValidationException} naming the parameter.
 */
public final class Params {
    private final Map<String, Object> values;

    public Params(Map<String, Object> values) {
        this.values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean has(String key) {
        Object value = values.get(key);
        return value != null && !(value instanceof String s && s.isBlank());
    }

    public Object require(String key) {
        if (!has(key)) {
            throw missing(key);
        }
        return values.get(key);
    }

    public String requireString(String key) {
        String value = optString(key);
        if (value == null) {
            throw missing(key);
        }
        return value;
    }

    public String optString(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Map || value instanceof List) {
            throw new ValidationException("Parameter " + key + " must be a string");
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }

    public String optString(String key, String fallback) {
        String value = optString(key);
        return value == null ? fallback : value;
    }

    public int requireInt(String key) {
        Integer value = optInt(key);
        if (value == null) {
            throw missing(key);
        }
        return value;
    }

    public Integer optInt(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof Long l) {
            if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
                throw new ValidationException("Parameter " + key + " is out of range");
            }
            return l.intValue();
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d != Math.rint(d) || Double.isInfinite(d)) {
                throw new ValidationException("Parameter " + key + " must be an integer");
            }
            if (d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
                throw new ValidationException("Parameter " + key + " is out of range");
            }
            return (int) d;
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new ValidationException("Parameter " + key + " must be an integer");
            }
        }
        throw new ValidationException("Parameter " + key + " must be an integer");
    }

    public int optInt(String key, int fallback) {
        Integer value = optInt(key);
        return value == null ? fallback : value;
    }

    public boolean optBoolean(String key, boolean fallback) {
        Object value = values.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            if ("true".equalsIgnoreCase(s.trim())) {
                return true;
            }
            if ("false".equalsIgnoreCase(s.trim())) {
                return false;
            }
        }
        throw new ValidationException("Parameter " + key + " must be a boolean");
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> optMap(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new ValidationException("Parameter " + key + " must be an object");
    }

    public Map<String, Object> requireMap(String key) {
        Map<String, Object> value = optMap(key);
        if (value == null) {
            throw missing(key);
        }
        return value;
    }

    /**
     * A list parameter; a single non-list value is wrapped.
     */
    public List<Object> optList(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        List<Object> out = new ArrayList<>();
        out.add(value);
        return out;
    }

    private static ValidationException missing(String key) {
        return new ValidationException("Missing required parameter: " + key);
    }
}
