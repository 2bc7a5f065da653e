package com.example.aurawatch.exception;

/**
 * Exception thrown when startup parameters are invalid. Raised before any RPC use.
 */
public class ConfigException extends MonitorException {

    public ConfigException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ConfigException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
