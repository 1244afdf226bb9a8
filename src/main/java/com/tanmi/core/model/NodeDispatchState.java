package com.tanmi.core.model;

/**
 * Dispatch bookkeeping of an execution node. Kept after completion as an audit trail.
 */
public class NodeDispatchState {

    /** Commit hash (git mode) or epoch millis (no-git mode); the rollback target. */
    private String startMarker;
    private String endMarker;
    private DispatchStatus status = DispatchStatus.PENDING;

    public NodeDispatchState() {
    }

    public NodeDispatchState(String startMarker, DispatchStatus status) {
        this.startMarker = startMarker;
        this.status = status;
    }

    public String getStartMarker() { return startMarker; }
    public void setStartMarker(String startMarker) { this.startMarker = startMarker; }
    public String getEndMarker() { return endMarker; }
    public void setEndMarker(String endMarker) { this.endMarker = endMarker; }
    public DispatchStatus getStatus() { return status; }
    public void setStatus(DispatchStatus status) { this.status = status; }
}
