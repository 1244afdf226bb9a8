package com.tanmi.core.node;

import com.tanmi.core.error.ErrorCode;
import com.tanmi.core.error.TanmiException;
import com.tanmi.core.events.EventBus;
import com.tanmi.core.events.TanmiEvent;
import com.tanmi.core.metrics.TanmiMetrics;
import com.tanmi.core.model.DocRef;
import com.tanmi.core.model.LogEntry;
import com.tanmi.core.model.NodeDetail;
import com.tanmi.core.model.NodeKind;
import com.tanmi.core.model.NodeMeta;
import com.tanmi.core.model.NodeStatus;
import com.tanmi.core.model.Problem;
import com.tanmi.core.persistence.WorkspaceStore;
import com.tanmi.core.state.StateService;
import com.tanmi.core.workspace.Ids;
import com.tanmi.core.workspace.Names;
import com.tanmi.core.workspace.WorkspaceLocks;
import com.tanmi.core.workspace.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Structural edits of the node tree: create, move, delete, plus node reads and prose updates.
 */
@Service
public class NodeService {

    private static final Logger log = LoggerFactory.getLogger(NodeService.class);

    private final WorkspaceStore store;
    private final WorkspaceLocks locks;
    private final WorkspaceService workspaces;
    private final EventBus eventBus;
    private final TanmiMetrics metrics;

    public NodeService(WorkspaceStore store, WorkspaceLocks locks, WorkspaceService workspaces,
                       EventBus eventBus, TanmiMetrics metrics) {
        this.store = store;
        this.locks = locks;
        this.workspaces = workspaces;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public record CreateResult(String nodeId, boolean parentPromoted, String hint) {}

    public record MoveResult(String nodeId, String previousParentId, String newParentId, boolean moved) {}

    public record NodeView(NodeMeta meta, NodeDetail detail, List<LogEntry> log, Problem problem) {}

    /**
     * Creates a pending node under a planning parent. The parent's first child promotes a
     * pending or planning parent to monitoring.
     */
    public CreateResult create(String workspaceId, String parentId, NodeKind type, String title,
                               String requirement, List<DocRef> docs) {
        if (type == null) {
            throw new TanmiException(ErrorCode.INVALID_NODE_TYPE, "Node type is required (planning or execution)");
        }
        return locks.withLock(workspaceId, () -> {
            workspaces.requireActive(workspaceId);
            var graph = store.readGraph(workspaceId);
            var parent = graph.find(parentId).orElseThrow(() -> new TanmiException(ErrorCode.PARENT_NOT_FOUND,
                    "Parent node '%s' not found".formatted(parentId)));

            if (!parent.getType().canHaveChildren()) {
                throw new TanmiException(ErrorCode.EXECUTION_CANNOT_HAVE_CHILDREN,
                        "Execution node '%s' cannot have children".formatted(parentId),
                        "Fail the execution node and split the work from its planning parent");
            }
            if (!acceptsChildren(parent.getStatus())) {
                throw new TanmiException(ErrorCode.INVALID_PARENT_STATUS,
                        "Parent '%s' is %s; children can only be added while it is pending, planning or monitoring"
                                .formatted(parentId, label(parent.getStatus())),
                        "Reopen the parent first");
            }
            Names.validateNodeTitle(title);

            var now = Instant.now();
            var node = new NodeMeta(Ids.nodeId(), type, parentId, now);
            graph.put(node);
            parent.getChildren().add(node.getId());
            parent.touch(now);

            boolean promoted = parent.getChildren().size() == 1
                    && (parent.getStatus() == NodeStatus.PENDING || parent.getStatus() == NodeStatus.PLANNING);
            var parentBefore = parent.getStatus();
            if (promoted) {
                parent.setStatus(NodeStatus.MONITORING);
            }

            store.writeDetail(workspaceId, node.getId(), new NodeDetail(title, requirement, docs, ""));
            store.writeGraph(workspaceId, graph);
            store.appendLog(workspaceId, null, new LogEntry(now, WorkspaceService.SYSTEM_OPERATOR,
                    "%s node \"%s\" (%s) created under %s".formatted(label(type), title, node.getId(), parentId)));
            if (promoted) {
                store.appendLog(workspaceId, parentId, new LogEntry(now, WorkspaceService.SYSTEM_OPERATOR,
                        "%s -> monitoring (first child %s created)".formatted(label(parentBefore), node.getId())));
            }
            workspaces.touch(workspaceId);

            log.info("Created {} node {} under {}", label(type), node.getId(), parentId);
            metrics.recordNodeCreated(label(type));
            eventBus.publish(TanmiEvent.of(TanmiEvent.NODE_CREATED, workspaceId, node.getId(),
                    Map.of("parentId", parentId, "type", label(type))));

            var hint = type == NodeKind.EXECUTION
                    ? "Execution node created. Start it to begin implementing."
                    : "Planning node created. Start it to enter planning, then add children.";
            return new CreateResult(node.getId(), promoted, hint);
        });
    }

    /**
     * Re-parents a node. A no-op when it already sits under {@code newParentId}.
     */
    public MoveResult move(String workspaceId, String nodeId, String newParentId) {
        return locks.withLock(workspaceId, () -> {
            workspaces.requireActive(workspaceId);
            var graph = store.readGraph(workspaceId);
            var node = graph.require(nodeId);

            if (node.isRoot()) {
                throw new TanmiException(ErrorCode.INVALID_TRANSITION, "The root node cannot be moved");
            }
            var newParent = graph.find(newParentId).orElseThrow(() -> new TanmiException(ErrorCode.PARENT_NOT_FOUND,
                    "Target parent '%s' not found".formatted(newParentId)));
            if (!newParent.getType().canHaveChildren()) {
                throw new TanmiException(ErrorCode.EXECUTION_CANNOT_HAVE_CHILDREN,
                        "Cannot move a node under execution node '%s'".formatted(newParentId));
            }
            if (nodeId.equals(newParentId) || graph.isDescendant(nodeId, newParentId)) {
                throw new TanmiException(ErrorCode.INVALID_TRANSITION,
                        "Cannot move '%s' under itself or one of its descendants".formatted(nodeId));
            }

            var previousParentId = node.getParentId();
            if (newParentId.equals(previousParentId)) {
                return new MoveResult(nodeId, previousParentId, newParentId, false);
            }

            var now = Instant.now();
            graph.find(previousParentId).ifPresent(oldParent -> {
                oldParent.getChildren().remove(nodeId);
                oldParent.touch(now);
            });
            newParent.getChildren().add(nodeId);
            newParent.touch(now);
            node.setParentId(newParentId);
            node.touch(now);

            store.writeGraph(workspaceId, graph);
            store.appendLog(workspaceId, nodeId, new LogEntry(now, StateService.AGENT_OPERATOR,
                    "Moved from %s to %s".formatted(previousParentId, newParentId)));
            workspaces.touch(workspaceId);

            log.info("Moved node {} from {} to {}", nodeId, previousParentId, newParentId);
            eventBus.publish(TanmiEvent.of(TanmiEvent.NODE_MOVED, workspaceId, nodeId,
                    Map.of("from", previousParentId, "to", newParentId)));
            return new MoveResult(nodeId, previousParentId, newParentId, true);
        });
    }

    /**
     * Deletes a node and its whole subtree, scrubbing references to the deleted ids.
     *
     * @return the deleted ids, the node itself first
     */
    public List<String> delete(String workspaceId, String nodeId) {
        return locks.withLock(workspaceId, () -> {
            var config = workspaces.requireActive(workspaceId);
            var graph = store.readGraph(workspaceId);
            var node = graph.require(nodeId);
            if (node.isRoot() || nodeId.equals(config.getRootNodeId())) {
                throw new TanmiException(ErrorCode.CANNOT_DELETE_ROOT, "The root node cannot be deleted");
            }

            var deleted = graph.subtreeOf(nodeId);
            Set<String> deletedSet = new HashSet<>(deleted);

            graph.find(node.getParentId()).ifPresent(parent -> parent.getChildren().remove(nodeId));
            for (String id : deleted) {
                graph.getNodes().remove(id);
            }
            for (NodeMeta remaining : graph.getNodes().values()) {
                remaining.getReferences().removeIf(deletedSet::contains);
            }
            if (deletedSet.contains(graph.getCurrentFocus())) {
                graph.setCurrentFocus(config.getRootNodeId());
            }

            store.writeGraph(workspaceId, graph);
            for (String id : deleted) {
                store.deleteNode(workspaceId, id);
            }
            store.appendLog(workspaceId, null, new LogEntry(Instant.now(), WorkspaceService.SYSTEM_OPERATOR,
                    "Deleted node %s and %d descendants".formatted(nodeId, deleted.size() - 1)));
            workspaces.touch(workspaceId);

            log.info("Deleted node {} ({} nodes removed)", nodeId, deleted.size());
            eventBus.publish(TanmiEvent.of(TanmiEvent.NODE_DELETED, workspaceId, nodeId, Map.of("deleted", deleted)));
            return deleted;
        });
    }

    public NodeView get(String workspaceId, String nodeId) {
        workspaces.require(workspaceId);
        var meta = store.readGraph(workspaceId).require(nodeId);
        return new NodeView(meta, store.readDetail(workspaceId, nodeId),
                store.readLog(workspaceId, nodeId), store.readProblem(workspaceId, nodeId));
    }

    /**
     * Tree below {@code rootId} (the workspace root when null), cut at {@code depth} levels.
     */
    public NodeTree list(String workspaceId, String rootId, Integer depth) {
        var config = workspaces.require(workspaceId);
        var graph = store.readGraph(workspaceId);
        var startId = rootId == null ? config.getRootNodeId() : rootId;
        graph.require(startId);
        return NodeTree.build(graph, startId, depth == null ? NodeTree.UNLIMITED : depth,
                id -> store.readDetail(workspaceId, id).title());
    }

    /**
     * Updates title, requirement and notes; null leaves a field unchanged.
     *
     * @return the names of the fields that changed
     */
    public List<String> update(String workspaceId, String nodeId, String title, String requirement, String note) {
        if (title != null) {
            Names.validateNodeTitle(title);
        }
        return locks.withLock(workspaceId, () -> {
            workspaces.requireActive(workspaceId);
            var graph = store.readGraph(workspaceId);
            var node = graph.require(nodeId);
            var detail = store.readDetail(workspaceId, nodeId);

            List<String> changed = new ArrayList<>();
            if (title != null && !title.equals(detail.title())) {
                detail = detail.withTitle(title);
                changed.add("title");
            }
            if (requirement != null && !requirement.equals(detail.requirement())) {
                detail = detail.withRequirement(requirement);
                changed.add("requirement");
            }
            if (note != null && !note.equals(detail.notes())) {
                detail = detail.withNotes(note);
                changed.add("notes");
            }
            if (changed.isEmpty()) {
                return List.of();
            }

            var now = Instant.now();
            store.writeDetail(workspaceId, nodeId, detail);
            node.touch(now);
            store.writeGraph(workspaceId, graph);
            store.appendLog(workspaceId, nodeId, new LogEntry(now, StateService.AGENT_OPERATOR,
                    "Updated " + String.join(", ", changed)));
            eventBus.publish(TanmiEvent.of(TanmiEvent.NODE_UPDATED, workspaceId, nodeId, Map.of("fields", changed)));
            return List.copyOf(changed);
        });
    }

    private static boolean acceptsChildren(NodeStatus status) {
        return status == NodeStatus.PENDING || status == NodeStatus.PLANNING || status == NodeStatus.MONITORING;
    }

    private static String label(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
