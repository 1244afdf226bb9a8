package com.tanmi.dispatch;

import com.tanmi.core.error.ErrorCode;
import com.tanmi.core.error.TanmiException;
import com.tanmi.core.events.EventBus;
import com.tanmi.core.events.TanmiEvent;
import com.tanmi.core.git.GitCapability;
import com.tanmi.core.logging.MdcContext;
import com.tanmi.core.metrics.TanmiMetrics;
import com.tanmi.core.model.ActionRequired;
import com.tanmi.core.model.DispatchConfig;
import com.tanmi.core.model.DispatchLimits;
import com.tanmi.core.model.DispatchStatus;
import com.tanmi.core.model.LogEntry;
import com.tanmi.core.model.NodeDispatchState;
import com.tanmi.core.model.NodeGraph;
import com.tanmi.core.model.NodeKind;
import com.tanmi.core.model.NodeMeta;
import com.tanmi.core.model.NodeStatus;
import com.tanmi.core.model.TransitionAction;
import com.tanmi.core.model.WorkspaceConfig;
import com.tanmi.core.persistence.WorkspaceStore;
import com.tanmi.core.state.StateService;
import com.tanmi.core.state.TransitionTable;
import com.tanmi.core.workspace.WorkspaceLocks;
import com.tanmi.core.workspace.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands execution nodes off to an external executor and brackets each hand-off with
 * git commits on a per-workspace process branch.
 *
 * <p>In git mode, enabling records the checked-out branch, snapshots a dirty tree onto a
 * backup branch and creates {@code tanmi-process/{workspaceId}}. Every dispatch records the
 * head commit as its start marker; a successful completion commits the work, and a failed
 * test resets the tree to the start marker. Only one workspace per project root may hold
 * git-mode dispatch at a time. No-git mode keeps the same bookkeeping with timestamps
 * and never touches the repository.
 */
@Service
public class DispatchService {

    private static final Logger log = LoggerFactory.getLogger(DispatchService.class);

    public static final String EXECUTOR_OPERATOR = "tanmi-executor";
    public static final String TESTER_OPERATOR = "tanmi-tester";

    private final WorkspaceStore store;
    private final WorkspaceLocks locks;
    private final WorkspaceService workspaces;
    private final StateService states;
    private final GitCapability git;
    private final DispatchBranches branches;
    private final DispatchProperties properties;
    private final EventBus eventBus;
    private final TanmiMetrics metrics;

    /** Prepare time of in-flight dispatches, keyed by workspace and node, for the duration timer. */
    private final Map<String, Long> startedAt = new ConcurrentHashMap<>();

    public DispatchService(WorkspaceStore store, WorkspaceLocks locks, WorkspaceService workspaces,
                           StateService states, GitCapability git, DispatchBranches branches,
                           DispatchProperties properties, EventBus eventBus, TanmiMetrics metrics) {
        this.store = store;
        this.locks = locks;
        this.workspaces = workspaces;
        this.states = states;
        this.git = git;
        this.branches = branches;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public record EnableResult(DispatchConfig config, String hint) {}

    public record PrepareResult(String startMarker, ActionRequired actionRequired) {}

    public record CompleteResult(
        String nodeId,
        boolean success,
        NodeStatus status,
        String endMarker,
        String hint
    ) {}

    public record TestVerdict(String testNodeId, String dispatchedNodeId, boolean passed,
                             String resetTo, String hint) {}

    public record DisableSummary(
        boolean useGit,
        String originalBranch,
        String processBranch,
        List<String> backupBranches,
        int processCommits,
        ActionRequired actionRequired
    ) {}

    public record DisableResult(boolean merged, List<String> deletedBranches, String hint) {}

    public record GitStatus(String currentBranch, boolean dirty, boolean onProcessBranch) {}

    // --- enable / disable ---

    /**
     * Turns dispatch on for the workspace.
     *
     * @param useGit git mode when {@code true}, no-git mode when {@code false},
     *               the configured default mode when {@code null}
     */
    public EnableResult enable(String workspaceId, Boolean useGit) {
        return locks.withLock(workspaceId, () -> {
            MdcContext.setWorkspace(workspaceId);
            try {
                return doEnable(workspaceId, useGit == null ? properties.isGitDefault() : useGit);
            } finally {
                MdcContext.clear();
            }
        });
    }

    private EnableResult doEnable(String workspaceId, boolean gitMode) {
        var config = workspaces.requireActive(workspaceId);
        if (config.isDispatchEnabled()) {
            throw new TanmiException(ErrorCode.DISPATCH_ALREADY_ENABLED,
                    "Dispatch is already enabled for workspace '%s'".formatted(workspaceId),
                    "Disable dispatch first to switch modes");
        }

        var dispatch = new DispatchConfig();
        dispatch.setEnabled(true);
        dispatch.setUseGit(gitMode);
        dispatch.setEnabledAt(System.currentTimeMillis());
        dispatch.setLimits(new DispatchLimits(properties.getTimeoutMs(), properties.getMaxRetries()));

        if (gitMode) {
            var repo = Path.of(config.getProjectRoot());
            if (!git.isRepo(repo)) {
                throw new TanmiException(ErrorCode.GIT_NOT_FOUND,
                        "%s is not a git repository".formatted(repo),
                        "Run git init in the project root or enable dispatch without git");
            }
            requireNoGitConflict(config);
            prepareBranches(repo, workspaceId, dispatch);
        }

        config.setDispatch(dispatch);
        config.setUpdatedAt(Instant.now());
        store.writeConfig(config);

        var mode = gitMode ? "git" : "no-git";
        var event = gitMode
                ? "Dispatch enabled (git, process branch %s, from %s)".formatted(dispatch.getProcessBranch(),
                        dispatch.getOriginalBranch())
                : "Dispatch enabled (no-git)";
        store.appendLog(workspaceId, null, new LogEntry(Instant.now(), WorkspaceService.SYSTEM_OPERATOR, event));

        log.info("Dispatch enabled for workspace {} in {} mode", workspaceId, mode);
        metrics.recordDispatchMode(true, gitMode);
        eventBus.publish(TanmiEvent.of(TanmiEvent.DISPATCH_ENABLED, workspaceId, null, Map.of("mode", mode)));

        var hint = gitMode
                ? "Git dispatch enabled. Work is committed to %s; disable dispatch to merge it back into %s."
                        .formatted(dispatch.getProcessBranch(), dispatch.getOriginalBranch())
                : "Dispatch enabled without git. Start an execution node, then dispatch it.";
        return new EnableResult(dispatch, hint);
    }

    private void requireNoGitConflict(WorkspaceConfig config) {
        for (WorkspaceConfig other : store.listWorkspaces()) {
            if (!other.getId().equals(config.getId())
                    && other.getProjectRoot().equals(config.getProjectRoot())
                    && other.isGitDispatchEnabled()) {
                throw new TanmiException(ErrorCode.DISPATCH_CONFLICT,
                        "Workspace '%s' already holds git dispatch on %s".formatted(other.getId(),
                                config.getProjectRoot()),
                        "Disable dispatch in '%s' first, or enable this workspace without git".formatted(other.getId()));
            }
        }
    }

    /**
     * Records the original branch, moves uncommitted work onto a backup branch and leaves
     * the repository on a fresh process branch.
     */
    private void prepareBranches(Path repo, String workspaceId, DispatchConfig dispatch) {
        var original = git.currentBranch(repo);
        dispatch.setOriginalBranch(original);

        if (git.isDirty(repo)) {
            var backup = branches.nextBackupBranch(repo, workspaceId);
            git.createBranch(repo, backup);
            boolean committed = false;
            try {
                git.commitAll(repo, "tanmi: backup before dispatch of " + workspaceId);
                committed = true;
                git.checkout(repo, original);
            } catch (RuntimeException e) {
                abandonBackup(repo, original, backup, committed, e);
                throw e;
            }
            dispatch.getBackupBranches().add(backup);
            log.info("Saved uncommitted changes on {} before enabling dispatch", backup);
        }

        var process = branches.processBranch(workspaceId);
        git.createBranch(repo, process);
        dispatch.setProcessBranch(process);
    }

    /**
     * Returns the repository to {@code original} after a failed backup. An uncommitted backup
     * branch is deleted; a committed one holds the user's changes and is kept.
     */
    private void abandonBackup(Path repo, String original, String backup, boolean committed, RuntimeException cause) {
        try {
            git.checkout(repo, original);
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.warn("Could not return to '{}' after failed backup: {}", original, e.getMessage());
        }
        if (committed) {
            log.warn("Backup branch {} holds the uncommitted changes and was kept", backup);
            return;
        }
        try {
            git.deleteBranch(repo, backup);
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.warn("Could not delete half-made backup branch '{}': {}", backup, e.getMessage());
        }
    }

    /**
     * Reports what disabling would do and asks the caller to choose between merging
     * and discarding the process branch.
     */
    public DisableSummary queryDisable(String workspaceId) {
        return locks.withLock(workspaceId, () -> {
            var config = requireDispatch(workspaceId);
            requireNothingInFlight(workspaceId);
            var dispatch = config.getDispatch();

            int commits = 0;
            if (dispatch.isUseGit() && dispatch.getOriginalBranch() != null && dispatch.getProcessBranch() != null
                    && git.isRepo(Path.of(config.getProjectRoot()))) {
                commits = git.commitsBetween(Path.of(config.getProjectRoot()),
                        dispatch.getOriginalBranch(), dispatch.getProcessBranch());
            }

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("workspaceId", workspaceId);
            data.put("useGit", dispatch.isUseGit());
            data.put("processCommits", commits);
            data.put("options", dispatch.isUseGit() ? List.of("merge", "discard") : List.of("disable"));
            var message = dispatch.isUseGit()
                    ? "Ask the user whether to merge %d commit(s) from %s into %s or discard them, then call dispatch_disable_execute."
                            .formatted(commits, dispatch.getProcessBranch(), dispatch.getOriginalBranch())
                    : "Confirm with the user, then call dispatch_disable_execute.";

            return new DisableSummary(dispatch.isUseGit(), dispatch.getOriginalBranch(), dispatch.getProcessBranch(),
                    List.copyOf(dispatch.getBackupBranches()), commits,
                    new ActionRequired(ActionRequired.DISPATCH_COMPLETE_CHOICE, message, data));
        });
    }

    /**
     * Turns dispatch off. In git mode {@code merge} folds the process branch into the original
     * branch; otherwise the original branch is checked out and the process work is dropped.
     * The process and backup branches are removed either way.
     */
    public DisableResult disable(String workspaceId, boolean merge) {
        return locks.withLock(workspaceId, () -> {
            MdcContext.setWorkspace(workspaceId);
            try {
                return doDisable(workspaceId, merge);
            } finally {
                MdcContext.clear();
            }
        });
    }

    private DisableResult doDisable(String workspaceId, boolean merge) {
        var config = requireDispatch(workspaceId);
        requireNothingInFlight(workspaceId);
        var dispatch = config.getDispatch();

        boolean merged = false;
        List<String> deleted = List.of();
        var repo = Path.of(config.getProjectRoot());
        if (dispatch.isUseGit() && !git.isRepo(repo)) {
            log.warn("{} is no longer a git repository; clearing dispatch state without touching git", repo);
        } else if (dispatch.isUseGit()) {
            if (merge) {
                git.merge(repo, dispatch.getProcessBranch(), dispatch.getOriginalBranch(),
                        "tanmi: complete workspace " + workspaceId);
                merged = true;
            } else {
                git.checkout(repo, dispatch.getOriginalBranch());
            }
            deleted = branches.deleteAll(repo, workspaceId, dispatch);
        }

        config.setDispatch(null);
        config.setUpdatedAt(Instant.now());
        store.writeConfig(config);

        var event = dispatch.isUseGit()
                ? "Dispatch disabled (%s into %s)".formatted(merged ? "merged" : "discarded", dispatch.getOriginalBranch())
                : "Dispatch disabled";
        store.appendLog(workspaceId, null, new LogEntry(Instant.now(), WorkspaceService.SYSTEM_OPERATOR, event));

        log.info("Dispatch disabled for workspace {} (merged={}, branches removed={})", workspaceId, merged, deleted);
        metrics.recordDispatchMode(false, dispatch.isUseGit());
        eventBus.publish(TanmiEvent.of(TanmiEvent.DISPATCH_DISABLED, workspaceId, null, Map.of("merged", merged)));

        var hint = merged
                ? "Dispatched work merged into %s.".formatted(dispatch.getOriginalBranch())
                : dispatch.isUseGit()
                        ? "Back on %s; dispatched commits were discarded.".formatted(dispatch.getOriginalBranch())
                        : "Dispatch disabled.";
        return new DisableResult(merged, deleted, hint);
    }

    // --- per-node dispatch ---

    /**
     * Marks an implementing execution node as executing and returns the hand-off request
     * for the executor sub-agent.
     */
    public PrepareResult prepareDispatch(String workspaceId, String nodeId) {
        return locks.withLock(workspaceId, () -> {
            MdcContext.setNode(workspaceId, nodeId);
            try {
                return doPrepare(workspaceId, nodeId);
            } finally {
                MdcContext.clear();
            }
        });
    }

    private PrepareResult doPrepare(String workspaceId, String nodeId) {
        var config = requireDispatch(workspaceId);
        var dispatch = config.getDispatch();
        requireGitEnvironment(config);
        var graph = store.readGraph(workspaceId);
        var node = graph.require(nodeId);
        requireExecution(node);
        if (node.getStatus() != NodeStatus.IMPLEMENTING) {
            throw new TanmiException(ErrorCode.INVALID_NODE_STATUS,
                    "Node '%s' is %s; only implementing nodes can be dispatched".formatted(nodeId, label(node.getStatus())),
                    "Start the node before dispatching it");
        }
        if (node.getDispatch() != null && node.getDispatch().getStatus().isInFlight()) {
            throw new TanmiException(ErrorCode.INVALID_NODE_STATUS,
                    "Node '%s' is already dispatched (%s)".formatted(nodeId, label(node.getDispatch().getStatus())),
                    "Finish the running dispatch with node_dispatch_complete first");
        }

        String startMarker;
        if (dispatch.isUseGit()) {
            var repo = Path.of(config.getProjectRoot());
            var process = dispatch.getProcessBranch();
            if (!process.equals(git.currentBranch(repo))) {
                git.checkout(repo, process);
            }
            startMarker = git.currentCommit(repo);
        } else {
            startMarker = String.valueOf(System.currentTimeMillis());
        }

        node.setDispatch(new NodeDispatchState(startMarker, DispatchStatus.EXECUTING));
        node.touch(Instant.now());
        store.writeGraph(workspaceId, graph);
        store.appendLog(workspaceId, nodeId, new LogEntry(Instant.now(), WorkspaceService.SYSTEM_OPERATOR,
                "Dispatched to %s (start %s)".formatted(properties.getSubagentType(), shortMarker(startMarker))));

        var detail = store.readDetail(workspaceId, nodeId);
        var timeoutMs = dispatch.getLimits() != null ? dispatch.getLimits().timeoutMs() : properties.getTimeoutMs();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("workspaceId", workspaceId);
        data.put("nodeId", nodeId);
        data.put("subagentType", properties.getSubagentType());
        data.put("prompt", DispatchPromptBuilder.build(workspaceId, nodeId, detail));
        data.put("timeoutMs", timeoutMs);

        startedAt.put(key(workspaceId, nodeId), System.currentTimeMillis());
        metrics.dispatchStarted();
        log.info("Prepared dispatch of node {} (start marker {})", nodeId, shortMarker(startMarker));
        eventBus.publish(TanmiEvent.of(TanmiEvent.DISPATCH_STARTED, workspaceId, nodeId,
                Map.of("startMarker", startMarker)));

        return new PrepareResult(startMarker, new ActionRequired(ActionRequired.DISPATCH_TASK,
                "Use the Task tool to dispatch this node to the %s sub-agent".formatted(properties.getSubagentType()),
                data));
    }

    /**
     * Records the executor's outcome. Success commits the work (git mode) and completes the
     * node; failure fails it without touching the repository.
     */
    public CompleteResult completeDispatch(String workspaceId, String nodeId, boolean success, String conclusion) {
        return locks.withLock(workspaceId, () -> {
            MdcContext.setNode(workspaceId, nodeId);
            try {
                return doComplete(workspaceId, nodeId, success, conclusion);
            } finally {
                MdcContext.clear();
            }
        });
    }

    private CompleteResult doComplete(String workspaceId, String nodeId, boolean success, String conclusion) {
        var config = requireDispatch(workspaceId);
        var dispatch = config.getDispatch();
        var action = success ? TransitionAction.COMPLETE : TransitionAction.FAIL;
        if (conclusion == null || conclusion.isBlank()) {
            throw new TanmiException(ErrorCode.CONCLUSION_REQUIRED,
                    "Dispatch completion requires a conclusion",
                    "Summarize what the executor did or why it failed");
        }

        requireGitEnvironment(config);
        var before = store.readGraph(workspaceId).require(nodeId);
        requireExecution(before);
        if (before.getDispatch() == null || before.getDispatch().getStatus() != DispatchStatus.EXECUTING) {
            throw new TanmiException(ErrorCode.INVALID_NODE_STATUS,
                    "Node '%s' has no running dispatch to complete".formatted(nodeId),
                    "Dispatch the node with node_dispatch before reporting its outcome");
        }
        // nothing is committed unless the transition is going to succeed
        TransitionTable.resolve(before.getType(), before.getStatus(), action);

        String endMarker = null;
        if (success) {
            if (dispatch.isUseGit()) {
                var title = store.readDetail(workspaceId, nodeId).title();
                endMarker = git.commitAll(Path.of(config.getProjectRoot()), "tanmi: %s - %s".formatted(nodeId, title));
            } else {
                endMarker = String.valueOf(System.currentTimeMillis());
            }
        }

        var transition = states.transition(workspaceId, nodeId, action, "dispatch", conclusion);
        MdcContext.setNode(workspaceId, nodeId);

        var graph = store.readGraph(workspaceId);
        var node = graph.require(nodeId);
        var state = node.getDispatch();
        state.setStatus(success ? DispatchStatus.PASSED : DispatchStatus.FAILED);
        if (endMarker != null) {
            state.setEndMarker(endMarker);
        }
        node.setDispatch(state);
        store.writeGraph(workspaceId, graph);

        var event = success
                ? "Dispatch succeeded (%s %s)".formatted(dispatch.isUseGit() ? "commit" : "timestamp", shortMarker(endMarker))
                : "Dispatch failed: " + conclusion;
        store.appendLog(workspaceId, nodeId, new LogEntry(Instant.now(), EXECUTOR_OPERATOR, event));

        var outcome = success ? "passed" : "failed";
        Long started = startedAt.remove(key(workspaceId, nodeId));
        metrics.recordDispatchOutcome(outcome, started == null ? 0 : System.currentTimeMillis() - started);
        log.info("Dispatch of node {} {}", nodeId, outcome);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", success);
        payload.put("endMarker", endMarker);
        eventBus.publish(TanmiEvent.of(TanmiEvent.DISPATCH_COMPLETED, workspaceId, nodeId, payload));

        return new CompleteResult(nodeId, success, transition.currentStatus(), endMarker,
                completionHint(graph, node, success));
    }

    private static String completionHint(NodeGraph graph, NodeMeta node, boolean success) {
        var parent = graph.find(node.getParentId()).orElse(null);
        if (parent != null && parent.getStatus() == NodeStatus.MONITORING
                && StateService.allChildrenResolved(graph, parent)) {
            return "All children of '%s' are done. Complete the parent, or disable dispatch to wrap up."
                    .formatted(parent.getId());
        }
        if (!success) {
            return parent != null
                    ? "Execution failed. Return to parent '%s' to decide: retry, re-plan or cancel.".formatted(parent.getId())
                    : "Execution failed.";
        }
        return parent != null
                ? "Execution done. Return to parent '%s'; dispatch its test node next if it has one.".formatted(parent.getId())
                : "Execution done.";
    }

    /**
     * Applies a test verdict to a dispatched node. A failed test in git mode hard-resets the
     * repository to the dispatch's start marker.
     *
     * @param testNodeId an execution node carrying a dispatch record, or whose nearest
     *                   preceding execution sibling does
     */
    public TestVerdict handleTestResult(String workspaceId, String testNodeId, boolean passed, String conclusion) {
        return locks.withLock(workspaceId, () -> {
            MdcContext.setNode(workspaceId, testNodeId);
            try {
                return doHandleTest(workspaceId, testNodeId, passed, conclusion);
            } finally {
                MdcContext.clear();
            }
        });
    }

    private TestVerdict doHandleTest(String workspaceId, String testNodeId, boolean passed, String conclusion) {
        var config = requireDispatch(workspaceId);
        requireGitEnvironment(config);
        var graph = store.readGraph(workspaceId);
        var testNode = graph.require(testNodeId);
        requireExecution(testNode);
        var target = dispatchedNodeFor(graph, testNode).orElseThrow(() -> new TanmiException(
                ErrorCode.INVALID_NODE_STATUS,
                "Node '%s' has no dispatch record to test".formatted(testNodeId),
                "Dispatch the execution node before reporting a test result"));
        var state = target.getDispatch();
        var now = Instant.now();
        var verdict = conclusion == null || conclusion.isBlank() ? "" : ": " + conclusion;

        String resetTo = null;
        if (passed) {
            state.setStatus(DispatchStatus.PASSED);
            target.touch(now);
            store.writeGraph(workspaceId, graph);
            store.appendLog(workspaceId, testNodeId, new LogEntry(now, TESTER_OPERATOR,
                    "Test passed for %s%s".formatted(target.getId(), verdict)));
            log.info("Test {} passed for dispatched node {}", testNodeId, target.getId());
        } else {
            if (config.getDispatch().isUseGit() && state.getStartMarker() != null) {
                resetTo = state.getStartMarker();
                git.resetHard(Path.of(config.getProjectRoot()), resetTo);
                metrics.recordRollback();
            }
            state.setStatus(DispatchStatus.FAILED);
            state.setEndMarker(null);
            target.touch(now);
            store.writeGraph(workspaceId, graph);

            var event = resetTo != null
                    ? "Test failed, reset to %s%s".formatted(shortMarker(resetTo), verdict)
                    : "Test failed%s".formatted(verdict);
            store.appendLog(workspaceId, testNodeId, new LogEntry(now, TESTER_OPERATOR, event));
            if (!target.getId().equals(testNodeId)) {
                store.appendLog(workspaceId, target.getId(), new LogEntry(now, TESTER_OPERATOR,
                        "Rejected by test %s%s".formatted(testNodeId,
                                resetTo != null ? ", reset to " + shortMarker(resetTo) : "")));
            }
            log.warn("Test {} failed for dispatched node {}{}", testNodeId, target.getId(),
                    resetTo != null ? ", reset to " + shortMarker(resetTo) : "");
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("testNodeId", testNodeId);
            payload.put("resetTo", resetTo);
            eventBus.publish(TanmiEvent.of(TanmiEvent.DISPATCH_ROLLED_BACK, workspaceId, target.getId(), payload));
        }

        var parentId = testNode.getParentId();
        var hint = passed
                ? "Test passed. Return to parent '%s' to continue.".formatted(parentId)
                : "Test failed. Return to parent '%s' to decide how to fix the work.".formatted(parentId);
        return new TestVerdict(testNodeId, target.getId(), passed, resetTo, hint);
    }

    /**
     * The node whose dispatch a test verdict applies to: the test node itself when it was
     * dispatched, otherwise its nearest preceding execution sibling with a dispatch record.
     */
    static Optional<NodeMeta> dispatchedNodeFor(NodeGraph graph, NodeMeta testNode) {
        if (testNode.getDispatch() != null) {
            return Optional.of(testNode);
        }
        var parent = graph.find(testNode.getParentId()).orElse(null);
        if (parent == null) {
            return Optional.empty();
        }
        var siblings = parent.getChildren();
        for (int i = siblings.indexOf(testNode.getId()) - 1; i >= 0; i--) {
            var sibling = graph.getNodes().get(siblings.get(i));
            if (sibling != null && sibling.getType() == NodeKind.EXECUTION && sibling.getDispatch() != null) {
                return Optional.of(sibling);
            }
        }
        return Optional.empty();
    }

    // --- git housekeeping ---

    /**
     * Repository state for a git-mode workspace; empty in no-git mode or when the project
     * root is no longer a repository.
     */
    public Optional<GitStatus> gitStatus(String workspaceId) {
        var config = workspaces.require(workspaceId);
        if (!config.isGitDispatchEnabled()) {
            return Optional.empty();
        }
        var repo = Path.of(config.getProjectRoot());
        if (!git.isRepo(repo)) {
            return Optional.empty();
        }
        var current = git.currentBranch(repo);
        return Optional.of(new GitStatus(current, git.isDirty(repo),
                current.equals(config.getDispatch().getProcessBranch())));
    }

    /**
     * Best-effort removal of the workspace's process and backup branches.
     *
     * @return the branches deleted; empty in no-git mode
     */
    public List<String> cleanupBranches(String workspaceId) {
        return locks.withLock(workspaceId, () -> {
            var config = workspaces.require(workspaceId);
            if (!config.isGitDispatchEnabled()) {
                return List.of();
            }
            var dispatch = config.getDispatch();
            var deleted = branches.deleteAll(Path.of(config.getProjectRoot()), workspaceId, dispatch);
            dispatch.getBackupBranches().removeAll(deleted);
            config.setUpdatedAt(Instant.now());
            store.writeConfig(config);
            return deleted;
        });
    }

    // --- helpers ---

    private WorkspaceConfig requireDispatch(String workspaceId) {
        var config = workspaces.requireActive(workspaceId);
        if (!config.isDispatchEnabled()) {
            throw new TanmiException(ErrorCode.DISPATCH_NOT_ENABLED,
                    "Dispatch is not enabled for workspace '%s'".formatted(workspaceId),
                    "Call dispatch_enable first");
        }
        return config;
    }

    /**
     * Fails when a git-mode workspace's project root has stopped being a repository.
     */
    private void requireGitEnvironment(WorkspaceConfig config) {
        var repo = Path.of(config.getProjectRoot());
        if (config.isGitDispatchEnabled() && !git.isRepo(repo)) {
            throw new TanmiException(ErrorCode.GIT_ENVIRONMENT_LOST,
                    "Dispatch for workspace '%s' runs in git mode but %s is no longer a git repository"
                            .formatted(config.getId(), repo),
                    "Disable dispatch to clear the dispatch state, then enable it again");
        }
    }

    private void requireNothingInFlight(String workspaceId) {
        var inFlight = store.readGraph(workspaceId).getNodes().values().stream()
                .filter(n -> n.getDispatch() != null && n.getDispatch().getStatus().isInFlight())
                .map(NodeMeta::getId)
                .toList();
        if (!inFlight.isEmpty()) {
            throw new TanmiException(ErrorCode.DISPATCH_IN_PROGRESS,
                    "Dispatched nodes are still running: %s".formatted(inFlight),
                    "Wait for node_dispatch_complete on every dispatched node");
        }
    }

    private static void requireExecution(NodeMeta node) {
        if (node.getType() != NodeKind.EXECUTION) {
            throw new TanmiException(ErrorCode.INVALID_NODE_TYPE,
                    "Node '%s' is a planning node; only execution nodes can be dispatched".formatted(node.getId()));
        }
    }

    private static String shortMarker(String marker) {
        if (marker == null) {
            return "-";
        }
        return marker.length() == 40 ? marker.substring(0, 7) : marker;
    }

    private static String key(String workspaceId, String nodeId) {
        return workspaceId + "/" + nodeId;
    }

    private static String label(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
