package io.agentbridge.error;

public final class NotFoundException extends BridgeException {
    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
