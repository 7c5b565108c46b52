package com.drawsync.servicebackend.coordinator;

/**
 * Rejection of a single client request. Sent back to the requesting connection only.
 */
public class CoordinatorException extends RuntimeException {
    private final ErrorCode code;

    public CoordinatorException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public CoordinatorException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
