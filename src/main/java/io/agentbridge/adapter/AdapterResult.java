package io.agentbridge.adapter;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import io.agentbridge.error.ErrorKind;

/**
 * Outcome of one adapter operation. Adapters report failures through this value
 * and never throw out of {@link ServiceAdapter#invoke}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AdapterResult(
        boolean success,
        JsonNode data,
        String error,
        ErrorKind errorKind
) {
    public static AdapterResult ok(JsonNode data) {
        return new AdapterResult(true, data, null, null);
    }

    public static AdapterResult fail(ErrorKind kind, String error) {
        return new AdapterResult(false, null, error, kind == null ? ErrorKind.INTERNAL : kind);
    }
}
