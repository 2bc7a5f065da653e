package com.example.aurawatch.exception;

/**
 * Exception thrown when the schedule store cannot be written.
 */
public class StoreException extends MonitorException {

    public StoreException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public StoreException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
