package com.openforge.writecrew.common;

/**
 * Root of the unchecked exceptions the collaboration core throws.
 * ApiExceptionAdvice maps each subtype to an HTTP status.
 */
public abstract class CollaborationException extends RuntimeException {

    protected CollaborationException(String message) {
        super(message);
    }

    protected CollaborationException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Stable machine-readable code for the JSON error body. */
    public abstract String errorCode();
}
