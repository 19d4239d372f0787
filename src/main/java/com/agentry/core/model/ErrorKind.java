package com.agentry.core.model;

/**
 * Classification of a failed task execution.
 */
public enum ErrorKind {
    /** Malformed input; the task was never attempted. */
    VALIDATION_ERROR("validation_error"),
    /** A path or content was rejected by the security gate. */
    SECURITY_VIOLATION("security_violation"),
    /** The agent call exceeded its deadline and was cancelled. */
    TIMEOUT("timeout"),
    /** The agent runtime reported a failure or threw. */
    RUNTIME_ERROR("runtime_error"),
    /** Reading context or writing output failed. */
    IO_ERROR("io_error");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
