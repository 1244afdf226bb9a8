package com.tanmi.core.node;

import com.tanmi.core.model.NodeGraph;
import com.tanmi.core.model.NodeKind;
import com.tanmi.core.model.NodeMeta;
import com.tanmi.core.model.NodeStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Read-only tree view of a node graph, cut at an optional depth.
 */
public record NodeTree(
    String id,
    NodeKind type,
    NodeStatus status,
    String title,
    boolean isolate,
    boolean focused,
    List<NodeTree> children
) {

    /** Depth value meaning "no limit". */
    public static final int UNLIMITED = -1;

    public NodeTree {
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Builds the tree below {@code startId}. A depth of 0 returns the start node alone.
     */
    public static NodeTree build(NodeGraph graph, String startId, int maxDepth, Function<String, String> titles) {
        return build(graph, graph.getNodes().get(startId), 0, maxDepth, titles);
    }

    private static NodeTree build(NodeGraph graph, NodeMeta node, int depth, int maxDepth,
                                  Function<String, String> titles) {
        List<NodeTree> children = new ArrayList<>();
        if (maxDepth < 0 || depth < maxDepth) {
            for (String childId : node.getChildren()) {
                NodeMeta child = graph.getNodes().get(childId);
                if (child != null) {
                    children.add(build(graph, child, depth + 1, maxDepth, titles));
                }
            }
        }
        return new NodeTree(node.getId(), node.getType(), node.getStatus(), titles.apply(node.getId()),
                node.isIsolate(), node.getId().equals(graph.getCurrentFocus()), children);
    }

    public int size() {
        int total = 1;
        for (NodeTree child : children) {
            total += child.size();
        }
        return total;
    }

    /**
     * Indented text rendering, one node per line:
     * {@code - [P] Title (id) monitoring *} where {@code *} marks the focus.
     */
    public String render() {
        var sb = new StringBuilder();
        render(sb, 0);
        return sb.toString();
    }

    private void render(StringBuilder sb, int depth) {
        sb.append("  ".repeat(depth))
                .append("- [").append(type == NodeKind.PLANNING ? 'P' : 'E').append("] ")
                .append(title)
                .append(" (").append(id).append(") ")
                .append(status.name().toLowerCase(Locale.ROOT));
        if (isolate) {
            sb.append(" [isolate]");
        }
        if (focused) {
            sb.append(" *");
        }
        sb.append('\n');
        for (NodeTree child : children) {
            child.render(sb, depth + 1);
        }
    }
}
