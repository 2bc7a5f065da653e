package com.example.aurawatch.exception;

/**
 * Error codes for the failures that stop the monitor.
 * Codes are grouped by category:
 * - 1xxx: Configuration errors
 * - 2xxx: Identity errors
 * - 3xxx: Transport (chain RPC) errors
 * - 4xxx: Store errors
 */
public enum ErrorCode {

    // Configuration errors (1xxx)
    INVALID_CONFIG(1001, "Invalid startup parameters", 2),

    // Identity errors (2xxx)
    KEYSTORE_UNREADABLE(2001, "Keystore directory cannot be read", 3),
    NO_KEY_FOUND(2002, "No key found in keystore", 3),
    AMBIGUOUS_IDENTITY(2003, "Ambiguous identity: more than one key found", 3),
    KEY_NOT_ON_NODE(2004, "Node does not hold the resolved key", 3),

    // Transport errors (3xxx)
    RPC_FAILED(3001, "Chain RPC call failed", 4),
    RPC_ERROR_RESPONSE(3002, "Chain RPC returned an error", 4),
    RPC_MALFORMED_RESULT(3003, "Chain RPC result could not be decoded", 4),
    MISSING_CHAIN_DATA(3004, "Required chain data is absent", 4),

    // Store errors (4xxx)
    STORE_WRITE_FAILED(4001, "Failed to write to the schedule store", 5);

    private final int code;
    private final String message;
    private final int exitCode;

    ErrorCode(int code, String message, int exitCode) {
        this.code = code;
        this.message = message;
        this.exitCode = exitCode;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Process exit status used when this error terminates the run.
     */
    public int getExitCode() {
        return exitCode;
    }

    @Override
    public String toString() {
        return String.format("[%d] %s", code, message);
    }
}
