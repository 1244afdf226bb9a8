package com.tanmi.core.context;

import com.tanmi.core.model.DocRef;
import com.tanmi.core.model.LogEntry;
import com.tanmi.core.model.Memo;
import com.tanmi.core.model.NodeKind;
import com.tanmi.core.model.NodeStatus;

import java.util.List;

/**
 * Working context assembled for one node.
 *
 * @param chain            the node and its inherited ancestors, root-most first
 * @param references       standalone entries for referenced nodes
 * @param memos            referenced memos that still exist
 * @param childConclusions conclusions of completed or failed direct children
 */
public record ComposedContext(
    WorkspaceHeader workspace,
    List<Item> chain,
    List<Item> references,
    List<Memo> memos,
    List<ChildConclusion> childConclusions,
    String hint
) {

    public record WorkspaceHeader(String goal, List<String> rules, List<DocRef> docs) {}

    /**
     * One node as seen from the context. {@code problem} is null when no problem is recorded;
     * {@code logEntries} is null when logs were not requested.
     */
    public record Item(
        String nodeId,
        NodeKind type,
        NodeStatus status,
        String title,
        String requirement,
        List<DocRef> docs,
        String notes,
        String conclusion,
        String problem,
        List<LogEntry> logEntries
    ) {}

    public record ChildConclusion(String nodeId, String title, NodeStatus status, String conclusion) {}
}
