package com.example.aurawatch.exception;

import org.springframework.boot.ExitCodeGenerator;

/**
 * Base exception for all fatal monitor failures.
 * Spring Boot maps it to the process exit status of its {@link ErrorCode}.
 */
public class MonitorException extends RuntimeException implements ExitCodeGenerator {

    private final ErrorCode errorCode;

    public MonitorException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public MonitorException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    @Override
    public int getExitCode() {
        return errorCode.getExitCode();
    }
}
