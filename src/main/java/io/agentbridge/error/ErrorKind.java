package io.agentbridge.error;

/**
 * Failure categories shared by thrown errors and adapter results.
 *
 * <p>{@link #httpStatus()} is the conventional status the gateway answers with.
 */
public enum ErrorKind {
    VALIDATION(400),
    NOT_FOUND(404),
    AUTH(401),
    RATE_LIMITED(429),
    SERVICE_UNAVAILABLE(503),
    NETWORK(502),
    REMOTE(502),
    CRITICAL_STEP_FAILURE(500),
    INTERNAL(500);

    private final int httpStatus;

    ErrorKind(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
