package com.tanmi.core.context;

import com.tanmi.core.events.EventBus;
import com.tanmi.core.events.TanmiEvent;
import com.tanmi.core.model.LogEntry;
import com.tanmi.core.model.Memo;
import com.tanmi.core.model.NodeGraph;
import com.tanmi.core.model.NodeMeta;
import com.tanmi.core.model.NodeStatus;
import com.tanmi.core.model.WorkspaceDetail;
import com.tanmi.core.persistence.WorkspaceStore;
import com.tanmi.core.workspace.WorkspaceLocks;
import com.tanmi.core.workspace.WorkspaceService;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles the working context of a node from the tree, and moves the workspace focus.
 *
 * <p>Composition is read-only and runs without the workspace lock.
 */
@Service
public class ContextService {

    private final WorkspaceStore store;
    private final WorkspaceLocks locks;
    private final WorkspaceService workspaces;
    private final EventBus eventBus;

    public ContextService(WorkspaceStore store, WorkspaceLocks locks, WorkspaceService workspaces, EventBus eventBus) {
        this.store = store;
        this.locks = locks;
        this.workspaces = workspaces;
        this.eventBus = eventBus;
    }

    public record FocusResult(String previousFocus, String currentFocus) {}

    public ComposedContext get(String workspaceId, String nodeId) {
        return get(workspaceId, nodeId, ContextOptions.DEFAULTS);
    }

    public ComposedContext get(String workspaceId, String nodeId, ContextOptions options) {
        workspaces.require(workspaceId);
        var graph = store.readGraph(workspaceId);
        var node = graph.require(nodeId);
        var opts = options == null ? ContextOptions.DEFAULTS : options;

        var header = header(store.readWorkspaceDetail(workspaceId));
        var chain = chain(workspaceId, graph, node, opts);

        List<ComposedContext.Item> references = new ArrayList<>();
        List<Memo> memos = new ArrayList<>();
        for (String ref : node.getReferences()) {
            if (Memo.isReference(ref)) {
                store.findMemo(workspaceId, Memo.idFromReference(ref)).ifPresent(memos::add);
            } else {
                graph.find(ref).ifPresent(target -> references.add(item(workspaceId, target, opts)));
            }
        }

        List<ComposedContext.ChildConclusion> conclusions = new ArrayList<>();
        for (String childId : node.getChildren()) {
            var child = graph.getNodes().get(childId);
            if (child != null
                    && (child.getStatus() == NodeStatus.COMPLETED || child.getStatus() == NodeStatus.FAILED)
                    && child.hasConclusion()) {
                conclusions.add(new ComposedContext.ChildConclusion(childId,
                        store.readDetail(workspaceId, childId).title(), child.getStatus(), child.getConclusion()));
            }
        }

        var hint = ContextHints.forNode(graph, node, store.readLog(workspaceId, nodeId).size(),
                store.readDetail(workspaceId, nodeId).activeDocs().size());
        return new ComposedContext(header, chain, references, memos, conclusions, hint);
    }

    /**
     * Moves the workspace focus to {@code nodeId}.
     */
    public FocusResult focus(String workspaceId, String nodeId) {
        return locks.withLock(workspaceId, () -> {
            workspaces.requireActive(workspaceId);
            var graph = store.readGraph(workspaceId);
            graph.require(nodeId);
            var previous = graph.getCurrentFocus();
            graph.setCurrentFocus(nodeId);
            store.writeGraph(workspaceId, graph);
            workspaces.touch(workspaceId);

            Map<String, Object> payload = new HashMap<>();
            payload.put("previousFocus", previous);
            eventBus.publish(TanmiEvent.of(TanmiEvent.FOCUS_CHANGED, workspaceId, nodeId, payload));
            return new FocusResult(previous, nodeId);
        });
    }

    /**
     * The node and its ancestors up to and including the first isolated one, root-most first.
     */
    List<ComposedContext.Item> chain(String workspaceId, NodeGraph graph, NodeMeta node, ContextOptions options) {
        List<ComposedContext.Item> chain = new ArrayList<>();
        var current = node;
        while (current != null) {
            chain.add(item(workspaceId, current, options));
            if (current.isIsolate()) {
                break;
            }
            current = current.getParentId() == null ? null : graph.getNodes().get(current.getParentId());
        }
        Collections.reverse(chain);
        return chain;
    }

    private ComposedContext.Item item(String workspaceId, NodeMeta node, ContextOptions options) {
        var detail = store.readDetail(workspaceId, node.getId());

        List<LogEntry> logEntries = null;
        if (options.includeLog()) {
            logEntries = tail(store.readLog(workspaceId, node.getId()), options.maxLogEntries());
            if (options.reverseLog()) {
                logEntries = new ArrayList<>(logEntries);
                Collections.reverse(logEntries);
            }
        }

        String problem = null;
        if (options.includeProblem()) {
            var stored = store.readProblem(workspaceId, node.getId());
            if (!stored.isEmpty()) {
                problem = stored.currentProblem();
            }
        }

        return new ComposedContext.Item(node.getId(), node.getType(), node.getStatus(), detail.title(),
                detail.requirement(), detail.activeDocs(), detail.notes(), node.getConclusion(), problem, logEntries);
    }

    /** Last {@code max} entries; none when {@code max <= 0}. */
    static List<LogEntry> tail(List<LogEntry> entries, int max) {
        if (max <= 0) {
            return List.of();
        }
        if (entries.size() <= max) {
            return entries;
        }
        return entries.subList(entries.size() - max, entries.size());
    }

    private static ComposedContext.WorkspaceHeader header(WorkspaceDetail detail) {
        return new ComposedContext.WorkspaceHeader(detail.goal(), detail.rules(), detail.activeDocs());
    }
}
