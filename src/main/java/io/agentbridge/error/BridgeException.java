package io.agentbridge.error;

public class BridgeException extends RuntimeException {
    private final ErrorKind kind;

    public BridgeException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind == null ? ErrorKind.INTERNAL : kind;
    }

    public BridgeException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind == null ? ErrorKind.INTERNAL : kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
