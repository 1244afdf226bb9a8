package com.tanmi.core.persistence;

import com.tanmi.core.model.LogEntry;
import com.tanmi.core.model.Memo;
import com.tanmi.core.model.NodeDetail;
import com.tanmi.core.model.NodeGraph;
import com.tanmi.core.model.Problem;
import com.tanmi.core.model.WorkspaceConfig;
import com.tanmi.core.model.WorkspaceDetail;

import java.util.List;
import java.util.Optional;

/**
 * Whole-object persistence for workspaces, their node graphs and per-node prose.
 *
 * <p>Every write replaces the stored object. Callers serialize read-modify-write
 * sequences per workspace; implementations only need to make single writes atomic.
 * A {@code null} node id in the log and problem methods addresses the workspace itself.
 */
public interface WorkspaceStore {

    // --- workspace registry ---

    /** Registers a new workspace and lays out its storage. */
    void registerWorkspace(WorkspaceConfig config, WorkspaceDetail detail, NodeGraph graph);

    Optional<WorkspaceConfig> findWorkspace(String workspaceId);

    List<WorkspaceConfig> listWorkspaces();

    /** Removes the workspace storage and its registry entry. */
    void deleteWorkspace(String workspaceId);

    // --- workspace objects ---

    WorkspaceConfig readConfig(String workspaceId);

    void writeConfig(WorkspaceConfig config);

    NodeGraph readGraph(String workspaceId);

    void writeGraph(String workspaceId, NodeGraph graph);

    WorkspaceDetail readWorkspaceDetail(String workspaceId);

    void writeWorkspaceDetail(String workspaceId, WorkspaceDetail detail);

    // --- nodes ---

    NodeDetail readDetail(String workspaceId, String nodeId);

    void writeDetail(String workspaceId, String nodeId, NodeDetail detail);

    void deleteNode(String workspaceId, String nodeId);

    void appendLog(String workspaceId, String nodeId, LogEntry entry);

    List<LogEntry> readLog(String workspaceId, String nodeId);

    Problem readProblem(String workspaceId, String nodeId);

    void writeProblem(String workspaceId, String nodeId, Problem problem);

    // --- memos ---

    Optional<Memo> findMemo(String workspaceId, String memoId);

    List<Memo> listMemos(String workspaceId);

    void writeMemo(String workspaceId, Memo memo);

    void deleteMemo(String workspaceId, String memoId);
}
