package com.agentry.core.model;

/**
 * What happens to steps whose dependencies failed.
 */
public enum FailurePolicy {
    /** A finished step unblocks its dependents whether it succeeded or not. */
    CONTINUE,
    /** Dependents of a failed step are recorded as failed without being attempted. */
    SKIP_DEPENDENTS
}
