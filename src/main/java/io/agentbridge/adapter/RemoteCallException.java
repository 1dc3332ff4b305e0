package io.agentbridge.adapter;

import io.agentbridge.error.BridgeException;
import io.agentbridge.error.ErrorKind;

/**
 * Raised inside an adapter while talking to its platform and converted to an
 * {@link AdapterResult} at the adapter boundary.
 */
public final class RemoteCallException extends BridgeException {
    private final int status;

    public RemoteCallException(ErrorKind kind, int status, String message) {
        super(kind, message);
        this.status = status;
    }

    public RemoteCallException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
        this.status = 0;
    }

    /**
     * HTTP status of the failed call, or 0 when no response was received.
     */
    public int status() {
        return status;
    }
}
