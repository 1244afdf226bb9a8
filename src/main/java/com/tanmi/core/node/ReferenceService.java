package com.tanmi.core.node;

import com.tanmi.core.error.ErrorCode;
import com.tanmi.core.error.TanmiException;
import com.tanmi.core.events.EventBus;
import com.tanmi.core.events.TanmiEvent;
import com.tanmi.core.model.DocRef;
import com.tanmi.core.model.DocStatus;
import com.tanmi.core.model.LogEntry;
import com.tanmi.core.model.Memo;
import com.tanmi.core.persistence.WorkspaceStore;
import com.tanmi.core.state.StateService;
import com.tanmi.core.workspace.WorkspaceLocks;
import com.tanmi.core.workspace.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Context-inheritance controls of a node: the isolate flag and its references.
 *
 * <p>A reference target is a {@code memo://} id, a node id, or otherwise a document path.
 * All three are recorded in the node's docs; node and memo references are also mirrored
 * into {@code NodeMeta.references} so the context composer can resolve them.
 */
@Service
public class ReferenceService {

    private static final Logger log = LoggerFactory.getLogger(ReferenceService.class);

    private final WorkspaceStore store;
    private final WorkspaceLocks locks;
    private final WorkspaceService workspaces;
    private final EventBus eventBus;

    public ReferenceService(WorkspaceStore store, WorkspaceLocks locks, WorkspaceService workspaces, EventBus eventBus) {
        this.store = store;
        this.locks = locks;
        this.workspaces = workspaces;
        this.eventBus = eventBus;
    }

    /**
     * Sets the isolate flag. An isolated node cuts context inheritance from its ancestors.
     *
     * @return the previous flag value
     */
    public boolean isolate(String workspaceId, String nodeId, boolean isolate) {
        return locks.withLock(workspaceId, () -> {
            workspaces.requireActive(workspaceId);
            var graph = store.readGraph(workspaceId);
            var node = graph.require(nodeId);
            boolean previous = node.isIsolate();
            if (previous == isolate) {
                return previous;
            }
            var now = Instant.now();
            node.setIsolate(isolate);
            node.touch(now);
            store.writeGraph(workspaceId, graph);
            store.appendLog(workspaceId, nodeId, new LogEntry(now, StateService.AGENT_OPERATOR,
                    isolate ? "Isolated: ancestor context no longer inherited" : "Isolation removed"));
            eventBus.publish(TanmiEvent.of(TanmiEvent.NODE_UPDATED, workspaceId, nodeId, Map.of("isolate", isolate)));
            return previous;
        });
    }

    /**
     * Adds, removes, expires or re-activates a reference.
     *
     * @return the node's references after the change
     */
    public List<DocRef> reference(String workspaceId, String nodeId, String target, ReferenceAction action,
                                  String description) {
        if (target == null || target.isBlank()) {
            throw new TanmiException(ErrorCode.INVALID_PARAMS, "Reference target must not be blank");
        }
        if (action == null) {
            throw new TanmiException(ErrorCode.INVALID_PARAMS, "Reference action is required");
        }
        return locks.withLock(workspaceId, () -> {
            workspaces.requireActive(workspaceId);
            var graph = store.readGraph(workspaceId);
            var node = graph.require(nodeId);
            var detail = store.readDetail(workspaceId, nodeId);

            boolean memoRef = Memo.isReference(target);
            if (memoRef && action == ReferenceAction.ADD
                    && store.findMemo(workspaceId, Memo.idFromReference(target)).isEmpty()) {
                throw new TanmiException(ErrorCode.MEMO_NOT_FOUND,
                        "Memo '%s' not found".formatted(Memo.idFromReference(target)));
            }
            boolean nodeRef = !memoRef && graph.contains(target);

            List<DocRef> docs = new ArrayList<>(detail.docs());
            int index = indexOf(docs, target);
            switch (action) {
                case ADD -> {
                    if (index >= 0) {
                        throw new TanmiException(ErrorCode.REFERENCE_EXISTS,
                                "Reference '%s' already exists".formatted(target));
                    }
                    docs.add(DocRef.active(target, description == null || description.isBlank()
                            ? defaultDescription(target, nodeRef, memoRef) : description));
                    if ((nodeRef || memoRef) && !node.getReferences().contains(target)) {
                        node.getReferences().add(target);
                    }
                }
                case REMOVE -> {
                    requireFound(index, target);
                    docs.remove(index);
                    node.getReferences().remove(target);
                }
                case EXPIRE -> {
                    requireFound(index, target);
                    docs.set(index, docs.get(index).withStatus(DocStatus.EXPIRED));
                }
                case ACTIVATE -> {
                    requireFound(index, target);
                    docs.set(index, docs.get(index).withStatus(DocStatus.ACTIVE));
                }
            }

            var now = Instant.now();
            store.writeDetail(workspaceId, nodeId, detail.withDocs(docs));
            node.touch(now);
            store.writeGraph(workspaceId, graph);
            store.appendLog(workspaceId, nodeId, new LogEntry(now, StateService.AGENT_OPERATOR,
                    "Reference %s: %s".formatted(action.name().toLowerCase(Locale.ROOT), target)));
            log.debug("Reference {} {} on node {}", action, target, nodeId);
            return List.copyOf(docs);
        });
    }

    private static int indexOf(List<DocRef> docs, String path) {
        for (int i = 0; i < docs.size(); i++) {
            if (docs.get(i).path().equals(path)) {
                return i;
            }
        }
        return -1;
    }

    private static void requireFound(int index, String target) {
        if (index < 0) {
            throw new TanmiException(ErrorCode.REFERENCE_NOT_FOUND, "Reference '%s' not found".formatted(target));
        }
    }

    private static String defaultDescription(String target, boolean nodeRef, boolean memoRef) {
        if (nodeRef) {
            return "Node reference: " + target;
        }
        if (memoRef) {
            return "Memo reference: " + target;
        }
        return target;
    }
}
