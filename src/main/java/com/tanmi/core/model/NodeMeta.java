package com.tanmi.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Structural record of a node inside the {@link NodeGraph}. Prose (title, requirement, docs)
 * lives in the node's {@link NodeDetail}.
 */
public class NodeMeta {

    private String id;
    private NodeKind type;
    private String parentId;
    private List<String> children = new ArrayList<>();
    private NodeStatus status = NodeStatus.PENDING;
    private boolean isolate;
    private List<String> references = new ArrayList<>();
    private String conclusion;
    private NodeDispatchState dispatch;
    private Instant createdAt;
    private Instant updatedAt;

    public NodeMeta() {
    }

    public NodeMeta(String id, NodeKind type, String parentId, Instant createdAt) {
        this.id = id;
        this.type = type;
        this.parentId = parentId;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public NodeKind getType() { return type; }
    public void setType(NodeKind type) { this.type = type; }
    public String getParentId() { return parentId; }
    public void setParentId(String parentId) { this.parentId = parentId; }
    public List<String> getChildren() { return children; }
    public void setChildren(List<String> children) {
        this.children = children == null ? new ArrayList<>() : new ArrayList<>(children);
    }
    public NodeStatus getStatus() { return status; }
    public void setStatus(NodeStatus status) { this.status = status; }
    public boolean isIsolate() { return isolate; }
    public void setIsolate(boolean isolate) { this.isolate = isolate; }
    public List<String> getReferences() { return references; }
    public void setReferences(List<String> references) {
        this.references = references == null ? new ArrayList<>() : new ArrayList<>(references);
    }
    public String getConclusion() { return conclusion; }
    public void setConclusion(String conclusion) { this.conclusion = conclusion; }
    public NodeDispatchState getDispatch() { return dispatch; }
    public void setDispatch(NodeDispatchState dispatch) { this.dispatch = dispatch; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    @JsonIgnore
    public boolean isRoot() {
        return parentId == null;
    }

    @JsonIgnore
    public boolean hasConclusion() {
        return conclusion != null && !conclusion.isBlank();
    }

    public void touch(Instant now) {
        this.updatedAt = now;
    }
}
