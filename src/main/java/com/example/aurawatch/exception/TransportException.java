package com.example.aurawatch.exception;

/**
 * Exception thrown when a chain RPC call fails or returns something undecodable.
 */
public class TransportException extends MonitorException {

    public TransportException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public TransportException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
