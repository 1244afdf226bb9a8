package com.tanmi.core.workspace;

import com.tanmi.core.error.ErrorCode;
import com.tanmi.core.error.TanmiException;
import com.tanmi.core.events.EventBus;
import com.tanmi.core.events.TanmiEvent;
import com.tanmi.core.model.DocRef;
import com.tanmi.core.model.LogEntry;
import com.tanmi.core.model.NodeDetail;
import com.tanmi.core.model.NodeGraph;
import com.tanmi.core.model.NodeKind;
import com.tanmi.core.model.NodeMeta;
import com.tanmi.core.model.NodeStatus;
import com.tanmi.core.model.WorkspaceConfig;
import com.tanmi.core.model.WorkspaceDetail;
import com.tanmi.core.model.WorkspaceStatus;
import com.tanmi.core.node.NodeTree;
import com.tanmi.core.persistence.WorkspaceStore;
import com.tanmi.dispatch.DispatchBranches;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Workspace lifecycle: creation, lookup, status summaries, rules, archive and deletion.
 */
@Service
public class WorkspaceService {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceService.class);

    public static final String SYSTEM_OPERATOR = "system";

    private final WorkspaceStore store;
    private final WorkspaceLocks locks;
    private final DispatchBranches branches;
    private final EventBus eventBus;

    public WorkspaceService(WorkspaceStore store, WorkspaceLocks locks, DispatchBranches branches, EventBus eventBus) {
        this.store = store;
        this.locks = locks;
        this.branches = branches;
        this.eventBus = eventBus;
    }

    public record InitResult(String workspaceId, String projectRoot, String rootNodeId, String hint) {}

    public record WorkspaceView(WorkspaceConfig config, WorkspaceDetail detail, NodeGraph graph) {}

    public record StatusSummary(
        String workspaceId,
        String name,
        WorkspaceStatus status,
        String currentFocus,
        int totalNodes,
        Map<NodeStatus, Integer> statusCounts,
        boolean dispatchEnabled,
        String tree
    ) {}

    public enum RuleAction { ADD, REMOVE, REPLACE }

    /**
     * Creates a workspace bound to {@code projectRoot} with a planning root node titled after it.
     */
    public InitResult init(String name, String projectRoot, String goal, List<String> rules, List<DocRef> docs) {
        Names.validateWorkspaceName(name);
        Path root = Names.validateProjectRoot(projectRoot);

        boolean duplicate = store.listWorkspaces().stream()
                .anyMatch(ws -> ws.getProjectRoot().equals(root.toString()) && ws.getName().equals(name));
        if (duplicate) {
            throw new TanmiException(ErrorCode.WORKSPACE_EXISTS,
                    "Workspace '%s' already exists in %s".formatted(name, root),
                    "Pick a different name or reuse the existing workspace");
        }

        var now = Instant.now();
        var config = new WorkspaceConfig();
        config.setId(Ids.workspaceId());
        config.setName(name);
        config.setProjectRoot(root.toString());
        config.setStatus(WorkspaceStatus.ACTIVE);
        config.setRootNodeId(WorkspaceConfig.DEFAULT_ROOT_NODE_ID);
        config.setCreatedAt(now);
        config.setUpdatedAt(now);

        var rootNode = new NodeMeta(config.getRootNodeId(), NodeKind.PLANNING, null, now);
        var graph = new NodeGraph();
        graph.put(rootNode);
        graph.setCurrentFocus(rootNode.getId());

        var detail = new WorkspaceDetail(goal, rules, docs);
        store.registerWorkspace(config, detail, graph);
        store.writeDetail(config.getId(), rootNode.getId(), new NodeDetail(name, goal, docs, ""));
        store.appendLog(config.getId(), null, new LogEntry(now, SYSTEM_OPERATOR, "Workspace \"%s\" created".formatted(name)));

        log.info("Initialized workspace {} '{}' in {}", config.getId(), name, root);
        eventBus.publish(TanmiEvent.of(TanmiEvent.WORKSPACE_CHANGED, config.getId(), null, Map.of("change", "created")));
        return new InitResult(config.getId(), root.toString(), rootNode.getId(),
                "Workspace created. The root is a planning node: start it, then create execution or planning children.");
    }

    public List<WorkspaceConfig> list(WorkspaceStatus statusFilter) {
        return store.listWorkspaces().stream()
                .filter(ws -> statusFilter == null || ws.getStatus() == statusFilter)
                .toList();
    }

    public WorkspaceView get(String workspaceId) {
        var config = require(workspaceId);
        return new WorkspaceView(config, store.readWorkspaceDetail(workspaceId), store.readGraph(workspaceId));
    }

    /** The workspace config, failing when it does not exist. */
    public WorkspaceConfig require(String workspaceId) {
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new TanmiException(ErrorCode.WORKSPACE_NOT_FOUND, "Workspace id must not be blank");
        }
        return store.readConfig(workspaceId);
    }

    /** The workspace config, failing unless it exists and is active. */
    public WorkspaceConfig requireActive(String workspaceId) {
        var config = require(workspaceId);
        if (config.getStatus() == WorkspaceStatus.ARCHIVED) {
            throw new TanmiException(ErrorCode.WORKSPACE_ARCHIVED,
                    "Workspace '%s' is archived".formatted(workspaceId),
                    "Restore the workspace before changing it");
        }
        if (config.getStatus() == WorkspaceStatus.ERROR) {
            throw new TanmiException(ErrorCode.WORKSPACE_NOT_FOUND,
                    "Workspace '%s' storage is unreadable".formatted(workspaceId));
        }
        return config;
    }

    public StatusSummary status(String workspaceId) {
        var config = require(workspaceId);
        var graph = store.readGraph(workspaceId);

        Map<NodeStatus, Integer> counts = new EnumMap<>(NodeStatus.class);
        for (NodeMeta node : graph.getNodes().values()) {
            counts.merge(node.getStatus(), 1, Integer::sum);
        }
        var tree = NodeTree.build(graph, config.getRootNodeId(), NodeTree.UNLIMITED,
                id -> store.readDetail(workspaceId, id).title());

        return new StatusSummary(config.getId(), config.getName(), config.getStatus(), graph.getCurrentFocus(),
                graph.getNodes().size(), counts, config.isDispatchEnabled(), tree.render());
    }

    /**
     * Edits the workspace rules. {@code ADD} ignores duplicates.
     *
     * @return the rules after the change
     */
    public List<String> updateRules(String workspaceId, RuleAction action, String rule, List<String> rules) {
        return locks.withLock(workspaceId, () -> {
            requireActive(workspaceId);
            var detail = store.readWorkspaceDetail(workspaceId);
            var current = new ArrayList<>(detail.rules());

            switch (action) {
                case ADD -> {
                    requireRule(action, rule);
                    if (!current.contains(rule)) {
                        current.add(rule);
                    }
                }
                case REMOVE -> {
                    requireRule(action, rule);
                    current.remove(rule);
                }
                case REPLACE -> {
                    if (rules == null) {
                        throw new TanmiException(ErrorCode.INVALID_PARAMS, "replace requires a list of rules");
                    }
                    current = new ArrayList<>(rules);
                }
            }

            store.writeWorkspaceDetail(workspaceId, detail.withRules(current));
            touch(workspaceId);
            store.appendLog(workspaceId, null, new LogEntry(Instant.now(), SYSTEM_OPERATOR,
                    "Rules %s (%d total)".formatted(action.name().toLowerCase(), current.size())));
            return List.copyOf(current);
        });
    }

    /**
     * Marks the workspace archived. An enabled dispatch is torn down first, without merging.
     */
    public WorkspaceConfig archive(String workspaceId) {
        return locks.withLock(workspaceId, () -> {
            var config = require(workspaceId);
            if (config.getStatus() == WorkspaceStatus.ARCHIVED) {
                throw new TanmiException(ErrorCode.WORKSPACE_ARCHIVED,
                        "Workspace '%s' is already archived".formatted(workspaceId));
            }
            releaseDispatch(config);
            config.setStatus(WorkspaceStatus.ARCHIVED);
            config.setUpdatedAt(Instant.now());
            store.writeConfig(config);
            store.appendLog(workspaceId, null, new LogEntry(Instant.now(), SYSTEM_OPERATOR, "Workspace archived"));
            log.info("Archived workspace {}", workspaceId);
            eventBus.publish(TanmiEvent.of(TanmiEvent.WORKSPACE_CHANGED, workspaceId, null, Map.of("change", "archived")));
            return config;
        });
    }

    public WorkspaceConfig restore(String workspaceId) {
        return locks.withLock(workspaceId, () -> {
            var config = require(workspaceId);
            if (config.getStatus() != WorkspaceStatus.ARCHIVED) {
                throw new TanmiException(ErrorCode.WORKSPACE_ACTIVE,
                        "Workspace '%s' is not archived".formatted(workspaceId));
            }
            config.setStatus(WorkspaceStatus.ACTIVE);
            config.setUpdatedAt(Instant.now());
            store.writeConfig(config);
            store.appendLog(workspaceId, null, new LogEntry(Instant.now(), SYSTEM_OPERATOR, "Workspace restored"));
            log.info("Restored workspace {}", workspaceId);
            eventBus.publish(TanmiEvent.of(TanmiEvent.WORKSPACE_CHANGED, workspaceId, null, Map.of("change", "restored")));
            return config;
        });
    }

    /**
     * Deletes the workspace and all its storage. Active workspaces require {@code force}.
     */
    public void delete(String workspaceId, boolean force) {
        locks.run(workspaceId, () -> {
            var config = require(workspaceId);
            if (config.getStatus() == WorkspaceStatus.ACTIVE && !force) {
                throw new TanmiException(ErrorCode.WORKSPACE_ACTIVE,
                        "Workspace '%s' is active".formatted(workspaceId),
                        "Archive it first or delete with force");
            }
            releaseDispatch(config);
            store.deleteWorkspace(workspaceId);
            log.info("Deleted workspace {}", workspaceId);
            eventBus.publish(TanmiEvent.of(TanmiEvent.WORKSPACE_CHANGED, workspaceId, null, Map.of("change", "deleted")));
        });
    }

    /** Bumps the workspace's {@code updatedAt}. Callers hold the workspace lock. */
    public void touch(String workspaceId) {
        var config = store.readConfig(workspaceId);
        config.setUpdatedAt(Instant.now());
        store.writeConfig(config);
    }

    private void releaseDispatch(WorkspaceConfig config) {
        if (!config.isDispatchEnabled()) {
            return;
        }
        if (config.getDispatch().isUseGit()) {
            branches.deleteAll(Path.of(config.getProjectRoot()), config.getId(), config.getDispatch());
        }
        config.setDispatch(null);
    }

    private static void requireRule(RuleAction action, String rule) {
        if (rule == null || rule.isBlank()) {
            throw new TanmiException(ErrorCode.INVALID_PARAMS,
                    "%s requires a rule".formatted(action.name().toLowerCase()));
        }
    }
}
