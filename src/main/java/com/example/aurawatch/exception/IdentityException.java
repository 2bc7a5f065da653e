package com.example.aurawatch.exception;

/**
 * Exception thrown when the validator identity cannot be resolved or confirmed.
 */
public class IdentityException extends MonitorException {

    public IdentityException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public IdentityException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
