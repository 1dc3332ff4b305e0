package io.agentbridge.error;

/**
 * The message store could not be reached or rejected a statement.
 */
public final class StoreUnavailableException extends BridgeException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorKind.NETWORK, message, cause);
    }
}
