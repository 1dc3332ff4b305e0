package io.agentbridge.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentbridge.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Replaces credentials in JSON trees before they reach the audit trail.
 * Keys that look sensitive are masked whole; long opaque strings and bearer
 * values are masked wherever they appear.
 */
public final class SensitiveDataMasker {
    public static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key",
            "service_key", "servicekey", "credential", "cookie"
    );
    private static final Pattern OPAQUE = Pattern.compile("^[A-Za-z0-9+/=_\\-:.]{32,}$");
    private static final Pattern BEARER = Pattern.compile("^(?i)bearer\\s+\\S+$");
    private static final Pattern OWN_IDS = Pattern.compile("^(msg|req|sub)_[0-9a-fA-F\\-]+$");
    private static final Pattern KNOWN_PREFIX = Pattern.compile("^(ghp_|gho_|ghs_|github_pat_|sk_|eyJ)\\S{8,}$");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                if (isSensitiveKey(entry.getKey())) {
                    out.put(entry.getKey(), MASK);
                } else {
                    out.set(entry.getKey(), masked(entry.getValue()));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual() && likelySecretValue(input.asText(""))) {
            return Jsons.mapper().getNodeFactory().textNode(MASK);
        }
        return input;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> masked(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        return Jsons.mapper().convertValue(masked(Jsons.toTree(input)), Map.class);
    }

    static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        if (key.equals("key") || key.endsWith("_key") || key.endsWith("-key")) {
            return true;
        }
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    static boolean likelySecretValue(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim();
        if (OWN_IDS.matcher(v).matches()) {
            return false;
        }
        return BEARER.matcher(v).matches() || KNOWN_PREFIX.matcher(v).matches() || OPAQUE.matcher(v).matches();
    }
}
