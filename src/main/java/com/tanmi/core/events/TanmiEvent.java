package com.tanmi.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A state change in a workspace, delivered to in-process subscribers.
 *
 * @param eventType   e.g. "node.created", "node.transitioned", "dispatch.enabled"
 * @param workspaceId the workspace this event belongs to
 * @param nodeId      the node this event relates to (nullable for workspace-level events)
 * @param payload     arbitrary key-value data associated with the event
 * @param timestamp   when the event occurred
 */
public record TanmiEvent(
    String eventType,
    String workspaceId,
    String nodeId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String NODE_CREATED = "node.created";
    public static final String NODE_UPDATED = "node.updated";
    public static final String NODE_MOVED = "node.moved";
    public static final String NODE_DELETED = "node.deleted";
    public static final String NODE_TRANSITIONED = "node.transitioned";
    public static final String FOCUS_CHANGED = "focus.changed";
    public static final String WORKSPACE_CHANGED = "workspace.changed";
    public static final String DISPATCH_ENABLED = "dispatch.enabled";
    public static final String DISPATCH_STARTED = "dispatch.started";
    public static final String DISPATCH_COMPLETED = "dispatch.completed";
    public static final String DISPATCH_ROLLED_BACK = "dispatch.rolled_back";
    public static final String DISPATCH_DISABLED = "dispatch.disabled";

    public static TanmiEvent of(String eventType, String workspaceId, String nodeId, Map<String, Object> payload) {
        return new TanmiEvent(eventType, workspaceId, nodeId, payload == null ? Map.of() : payload, Instant.now());
    }
}
