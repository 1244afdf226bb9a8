package com.tanmi.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * Top-level container for one task tree, bound to a project directory.
 */
public class WorkspaceConfig {

    public static final String DEFAULT_ROOT_NODE_ID = "root";

    private String id;
    private String name;
    private String projectRoot;
    private WorkspaceStatus status = WorkspaceStatus.ACTIVE;
    private String rootNodeId = DEFAULT_ROOT_NODE_ID;
    private Instant createdAt;
    private Instant updatedAt;
    private DispatchConfig dispatch;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getProjectRoot() { return projectRoot; }
    public void setProjectRoot(String projectRoot) { this.projectRoot = projectRoot; }
    public WorkspaceStatus getStatus() { return status; }
    public void setStatus(WorkspaceStatus status) { this.status = status; }
    public String getRootNodeId() { return rootNodeId; }
    public void setRootNodeId(String rootNodeId) { this.rootNodeId = rootNodeId; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    public DispatchConfig getDispatch() { return dispatch; }
    public void setDispatch(DispatchConfig dispatch) { this.dispatch = dispatch; }

    @JsonIgnore
    public boolean isDispatchEnabled() {
        return dispatch != null && dispatch.isEnabled();
    }

    @JsonIgnore
    public boolean isGitDispatchEnabled() {
        return isDispatchEnabled() && dispatch.isUseGit();
    }
}
