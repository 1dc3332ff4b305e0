package io.agentbridge.chain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import io.agentbridge.error.ValidationException;
import io.agentbridge.util.Jsons;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One chain step. {@code outputs} maps a context key to a JSON pointer into
 * the step's result data; it is applied only when the step succeeds.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolInvocation(
        String id,
        String service,
        String operation,
        Map<String, Object> params,
        boolean critical,
        Map<String, String> outputs
) {
    public ToolInvocation {
        params = params == null ? Map.of() : params;
        outputs = outputs == null ? Map.of() : outputs;
    }

    public static ToolInvocation of(String service, String operation, Map<String, Object> params, boolean critical) {
        return new ToolInvocation(null, service, operation, params, critical, Map.of());
    }

    public ToolInvocation withOutputs(Map<String, String> value) {
        return new ToolInvocation(id, service, operation, params, critical, value);
    }

    public static ToolInvocation fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ValidationException("Each step must be a JSON object");
        }
        JsonNode params = node.path("params");
        if (!params.isMissingNode() && !params.isNull() && !params.isObject()) {
            throw new ValidationException("Step params must be an object");
        }
        JsonNode critical = node.path("critical");
        if (!critical.isMissingNode() && !critical.isNull() && !critical.isBoolean()) {
            throw new ValidationException("Step critical must be a boolean");
        }
        Map<String, String> outputs = new LinkedHashMap<>();
        JsonNode rawOutputs = node.path("outputs");
        if (rawOutputs.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = rawOutputs.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                if (!entry.getValue().isTextual()) {
                    throw new ValidationException("Output " + entry.getKey() + " must be a JSON pointer string");
                }
                outputs.put(entry.getKey(), entry.getValue().asText());
            }
        } else if (!rawOutputs.isMissingNode() && !rawOutputs.isNull()) {
            throw new ValidationException("Step outputs must be an object");
        }
        return new ToolInvocation(
                textOrNull(node.path("id")),
                textOrNull(node.path("service")),
                textOrNull(node.path("operation")),
                Jsons.toMap(params),
                critical.asBoolean(false),
                outputs
        );
    }

    private static String textOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }
}
