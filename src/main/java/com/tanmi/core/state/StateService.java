package com.tanmi.core.state;

import com.tanmi.core.error.ErrorCode;
import com.tanmi.core.error.TanmiException;
import com.tanmi.core.events.EventBus;
import com.tanmi.core.events.TanmiEvent;
import com.tanmi.core.logging.MdcContext;
import com.tanmi.core.metrics.TanmiMetrics;
import com.tanmi.core.model.LogEntry;
import com.tanmi.core.model.NodeGraph;
import com.tanmi.core.model.NodeKind;
import com.tanmi.core.model.NodeMeta;
import com.tanmi.core.model.NodeStatus;
import com.tanmi.core.model.Problem;
import com.tanmi.core.model.TransitionAction;
import com.tanmi.core.persistence.WorkspaceStore;
import com.tanmi.core.workspace.WorkspaceLocks;
import com.tanmi.core.workspace.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Drives node status changes through the transition tables and keeps ancestors coherent.
 *
 * <p>All validation happens before anything is written. The node change, the ancestor
 * cascade and the focus move are persisted with a single graph write.
 */
@Service
public class StateService {

    private static final Logger log = LoggerFactory.getLogger(StateService.class);

    public static final String AGENT_OPERATOR = "AI";

    private final WorkspaceStore store;
    private final WorkspaceLocks locks;
    private final WorkspaceService workspaces;
    private final EventBus eventBus;
    private final TanmiMetrics metrics;

    public StateService(WorkspaceStore store, WorkspaceLocks locks, WorkspaceService workspaces,
                        EventBus eventBus, TanmiMetrics metrics) {
        this.store = store;
        this.locks = locks;
        this.workspaces = workspaces;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /** An ancestor status change caused by a start or reopen below it. */
    public record CascadeUpdate(String nodeId, NodeStatus from, NodeStatus to) {}

    public record TransitionResult(
        String nodeId,
        NodeStatus previousStatus,
        NodeStatus currentStatus,
        String conclusion,
        List<CascadeUpdate> cascadeUpdates,
        String hint
    ) {}

    public TransitionResult transition(String workspaceId, String nodeId, TransitionAction action,
                                       String reason, String conclusion) {
        if (action == null) {
            throw new TanmiException(ErrorCode.INVALID_PARAMS, "Transition action is required");
        }
        return locks.withLock(workspaceId, () -> {
            MdcContext.setNode(workspaceId, nodeId);
            try {
                return doTransition(workspaceId, nodeId, action, reason, conclusion);
            } finally {
                MdcContext.clear();
            }
        });
    }

    private TransitionResult doTransition(String workspaceId, String nodeId, TransitionAction action,
                                          String reason, String conclusion) {
        workspaces.requireActive(workspaceId);
        var graph = store.readGraph(workspaceId);
        var node = graph.require(nodeId);
        var previous = node.getStatus();

        // validation: nothing below may fail once the graph is mutated
        var next = TransitionTable.resolve(node.getType(), previous, action);
        if (action.requiresConclusion() && (conclusion == null || conclusion.isBlank())) {
            throw new TanmiException(ErrorCode.CONCLUSION_REQUIRED,
                    "%s requires a conclusion".formatted(action.label()),
                    "Summarize the outcome in the conclusion parameter");
        }
        if (node.getType() == NodeKind.PLANNING && action == TransitionAction.COMPLETE) {
            var outstanding = outstandingChildren(graph, node);
            if (!outstanding.isEmpty()) {
                throw new TanmiException(ErrorCode.INCOMPLETE_CHILDREN,
                        "Node '%s' has unfinished children: %s".formatted(nodeId, describe(outstanding)),
                        "Complete or cancel every child before completing the parent");
            }
        }

        var cascade = computeCascade(graph, node, action);

        var now = Instant.now();
        node.setStatus(next);
        if (conclusion != null && !conclusion.isBlank()) {
            node.setConclusion(conclusion);
        }
        node.touch(now);
        for (CascadeUpdate update : cascade) {
            var ancestor = graph.require(update.nodeId());
            ancestor.setStatus(update.to());
            ancestor.touch(now);
        }
        if (action.activates()) {
            graph.setCurrentFocus(nodeId);
        }
        store.writeGraph(workspaceId, graph);

        store.appendLog(workspaceId, nodeId, new LogEntry(now, AGENT_OPERATOR, logEvent(action, previous, next, reason)));
        for (CascadeUpdate update : cascade) {
            store.appendLog(workspaceId, update.nodeId(), new LogEntry(now, WorkspaceService.SYSTEM_OPERATOR,
                    "%s -> %s (child %s was %s)".formatted(label(update.from()), label(update.to()),
                            nodeId, action == TransitionAction.REOPEN ? "reopened" : "started")));
        }
        if (action == TransitionAction.COMPLETE || action == TransitionAction.CANCEL) {
            store.writeProblem(workspaceId, nodeId, Problem.NONE);
        }
        workspaces.touch(workspaceId);

        log.info("Node {} {}: {} -> {} ({} ancestors promoted)", nodeId, action.label(), previous, next, cascade.size());
        metrics.recordTransition(label(node.getType()), action.label());
        if (!cascade.isEmpty()) {
            metrics.recordCascade(cascade.size());
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put("action", action.label());
        payload.put("from", label(previous));
        payload.put("to", label(next));
        payload.put("cascade", cascade.stream().map(CascadeUpdate::nodeId).toList());
        eventBus.publish(TanmiEvent.of(TanmiEvent.NODE_TRANSITIONED, workspaceId, nodeId, payload));

        return new TransitionResult(nodeId, previous, next, node.getConclusion(), List.copyOf(cascade),
                hintAfter(graph, node, action));
    }

    /**
     * Ancestors a start or reopen of {@code node} promotes to monitoring, nearest first.
     * The walk stops at the first ancestor that is not eligible, including one already monitoring.
     */
    static List<CascadeUpdate> computeCascade(NodeGraph graph, NodeMeta node, TransitionAction action) {
        if (!action.activates()) {
            return List.of();
        }
        List<CascadeUpdate> updates = new ArrayList<>();
        for (NodeMeta ancestor : graph.ancestorsOf(node.getId())) {
            if (ancestor.getType() != NodeKind.PLANNING || !isPromotable(ancestor.getStatus(), action)) {
                break;
            }
            updates.add(new CascadeUpdate(ancestor.getId(), ancestor.getStatus(), NodeStatus.MONITORING));
        }
        return updates;
    }

    private static boolean isPromotable(NodeStatus status, TransitionAction action) {
        return switch (status) {
            case PENDING, PLANNING -> true;
            case COMPLETED, CANCELLED -> action == TransitionAction.REOPEN;
            default -> false;
        };
    }

    static List<NodeMeta> outstandingChildren(NodeGraph graph, NodeMeta node) {
        return node.getChildren().stream()
                .map(graph.getNodes()::get)
                .filter(child -> child != null && !child.getStatus().isResolved())
                .toList();
    }

    /**
     * Whether every child of the planning node is completed or cancelled.
     */
    public static boolean allChildrenResolved(NodeGraph graph, NodeMeta node) {
        return !node.getChildren().isEmpty() && outstandingChildren(graph, node).isEmpty();
    }

    private String hintAfter(NodeGraph graph, NodeMeta node, TransitionAction action) {
        var parent = graph.find(node.getParentId()).orElse(null);
        return switch (action) {
            case START, RETRY, REOPEN -> node.getType() == NodeKind.PLANNING
                    ? "Planning: break the work into child nodes, then start them one at a time."
                    : "Implementing: log progress as you go, then complete or fail the node with a conclusion.";
            case SUBMIT -> "Validating: verify the result, then complete or fail the node.";
            case FAIL -> parent != null
                    ? "Node failed. Return to parent '%s' to re-plan, or retry this node.".formatted(parent.getId())
                    : "Node failed.";
            case COMPLETE, CANCEL -> {
                if (parent != null && parent.getStatus() == NodeStatus.MONITORING && allChildrenResolved(graph, parent)) {
                    yield "All children of '%s' are done. Review their conclusions and complete the parent."
                            .formatted(parent.getId());
                }
                yield parent != null
                        ? "Done. Move focus back to parent '%s' and pick the next child.".formatted(parent.getId())
                        : "The root is done.";
            }
        };
    }

    private static String logEvent(TransitionAction action, NodeStatus from, NodeStatus to, String reason) {
        var event = "%s: %s -> %s".formatted(action.label(), label(from), label(to));
        return reason == null || reason.isBlank() ? event : event + " (" + reason + ")";
    }

    private static String describe(List<NodeMeta> nodes) {
        return nodes.stream()
                .map(n -> "%s [%s]".formatted(n.getId(), label(n.getStatus())))
                .collect(Collectors.joining(", "));
    }

    private static String label(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
