package io.agentbridge.error;

public final class ValidationException extends BridgeException {
    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
