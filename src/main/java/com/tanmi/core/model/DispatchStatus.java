package com.tanmi.core.model;

/**
 * Status of a node's dispatch record.
 */
public enum DispatchStatus {
    PENDING,
    EXECUTING,
    TESTING,
    PASSED,
    FAILED;

    /** Statuses that block disabling dispatch or switching its mode. */
    public boolean isInFlight() {
        return this == EXECUTING || this == TESTING;
    }
}
