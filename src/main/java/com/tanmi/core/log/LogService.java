package com.tanmi.core.log;

import com.tanmi.core.error.ErrorCode;
import com.tanmi.core.error.TanmiException;
import com.tanmi.core.model.LogEntry;
import com.tanmi.core.model.Problem;
import com.tanmi.core.persistence.WorkspaceStore;
import com.tanmi.core.workspace.WorkspaceLocks;
import com.tanmi.core.workspace.WorkspaceService;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Append-only activity logs and the "current problem" note, per node or for the workspace
 * as a whole (null node id).
 */
@Service
public class LogService {

    private final WorkspaceStore store;
    private final WorkspaceLocks locks;
    private final WorkspaceService workspaces;

    public LogService(WorkspaceStore store, WorkspaceLocks locks, WorkspaceService workspaces) {
        this.store = store;
        this.locks = locks;
        this.workspaces = workspaces;
    }

    public LogEntry append(String workspaceId, String nodeId, String operator, String event) {
        if (operator == null || operator.isBlank()) {
            throw new TanmiException(ErrorCode.INVALID_PARAMS, "Log operator must not be blank");
        }
        if (event == null || event.isBlank()) {
            throw new TanmiException(ErrorCode.INVALID_PARAMS, "Log event must not be blank");
        }
        return locks.withLock(workspaceId, () -> {
            workspaces.requireActive(workspaceId);
            requireNode(workspaceId, nodeId);
            var entry = new LogEntry(Instant.now(), operator, event);
            store.appendLog(workspaceId, nodeId, entry);
            return entry;
        });
    }

    public List<LogEntry> read(String workspaceId, String nodeId) {
        workspaces.require(workspaceId);
        requireNode(workspaceId, nodeId);
        return store.readLog(workspaceId, nodeId);
    }

    public Problem updateProblem(String workspaceId, String nodeId, String currentProblem, String nextStep) {
        return locks.withLock(workspaceId, () -> {
            workspaces.requireActive(workspaceId);
            requireNode(workspaceId, nodeId);
            var problem = new Problem(currentProblem, nextStep);
            store.writeProblem(workspaceId, nodeId, problem);
            return problem;
        });
    }

    public void clearProblem(String workspaceId, String nodeId) {
        locks.run(workspaceId, () -> {
            workspaces.requireActive(workspaceId);
            requireNode(workspaceId, nodeId);
            store.writeProblem(workspaceId, nodeId, Problem.NONE);
        });
    }

    public Problem readProblem(String workspaceId, String nodeId) {
        workspaces.require(workspaceId);
        requireNode(workspaceId, nodeId);
        return store.readProblem(workspaceId, nodeId);
    }

    private void requireNode(String workspaceId, String nodeId) {
        if (nodeId != null) {
            store.readGraph(workspaceId).require(nodeId);
        }
    }
}
