package io.agentbridge.adapter;

import java.util.List;
import java.util.Map;

/**
 * Uniform contract over one remote platform.
 *
 * <p>Implementations translate transport, auth and quota failures into a failed
 * {@link AdapterResult}; {@link #invoke} and {@link #healthCheck} must not throw.
 */
public interface ServiceAdapter {
    String name();

    /**
     * Canonical operation names, in a stable order. Aliases are accepted by
     * {@link #invoke} but not listed.
     */
    List<String> operations();

    /**
     * False when credentials or the endpoint are missing. Unconfigured adapters
     * stay registered and answer every call with {@code SERVICE_UNAVAILABLE}.
     */
    boolean configured();

    AdapterResult invoke(String operation, Map<String, Object> params);

    AdapterHealth healthCheck();
}
