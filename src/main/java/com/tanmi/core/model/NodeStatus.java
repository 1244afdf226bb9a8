package com.tanmi.core.model;

/**
 * Lifecycle status of a node. Which values are legal depends on the node's {@link NodeKind}.
 */
public enum NodeStatus {
    PENDING,
    IMPLEMENTING, // execution: work in progress
    VALIDATING,   // execution: submitted, awaiting verification
    PLANNING,     // planning: decomposing the requirement
    MONITORING,   // planning: at least one descendant is active
    COMPLETED,
    FAILED,
    CANCELLED;

    /** True for statuses a planning node accepts as "resolved" when checking its children. */
    public boolean isResolved() {
        return this == COMPLETED || this == CANCELLED;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
