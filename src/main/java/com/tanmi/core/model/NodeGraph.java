package com.tanmi.core.model;

import com.tanmi.core.error.ErrorCode;
import com.tanmi.core.error.TanmiException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The persisted tree of a workspace plus its global focus pointer.
 */
public class NodeGraph {

    public static final String CURRENT_VERSION = "3.0";

    private String version = CURRENT_VERSION;
    private String currentFocus;
    private Map<String, NodeMeta> nodes = new LinkedHashMap<>();

    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }
    public String getCurrentFocus() { return currentFocus; }
    public void setCurrentFocus(String currentFocus) { this.currentFocus = currentFocus; }
    public Map<String, NodeMeta> getNodes() { return nodes; }
    public void setNodes(Map<String, NodeMeta> nodes) {
        this.nodes = nodes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(nodes);
    }

    public Optional<NodeMeta> find(String nodeId) {
        return nodeId == null ? Optional.empty() : Optional.ofNullable(nodes.get(nodeId));
    }

    /**
     * @throws TanmiException {@code NODE_NOT_FOUND} when the id is not in the graph
     */
    public NodeMeta require(String nodeId) {
        return find(nodeId).orElseThrow(() -> new TanmiException(ErrorCode.NODE_NOT_FOUND,
                "Node '%s' not found".formatted(nodeId)));
    }

    public boolean contains(String nodeId) {
        return nodeId != null && nodes.containsKey(nodeId);
    }

    public void put(NodeMeta node) {
        nodes.put(node.getId(), node);
    }

    /**
     * Ancestors of a node, nearest first. Stops at the root or at a dangling parent id.
     */
    public List<NodeMeta> ancestorsOf(String nodeId) {
        List<NodeMeta> ancestors = new ArrayList<>();
        NodeMeta current = nodes.get(nodeId);
        while (current != null && current.getParentId() != null) {
            NodeMeta parent = nodes.get(current.getParentId());
            if (parent == null) {
                break;
            }
            ancestors.add(parent);
            current = parent;
        }
        return ancestors;
    }

    /**
     * The node and all its descendants, depth-first, the node itself first.
     */
    public List<String> subtreeOf(String nodeId) {
        List<String> result = new ArrayList<>();
        collect(nodeId, result);
        return result;
    }

    private void collect(String nodeId, List<String> into) {
        NodeMeta node = nodes.get(nodeId);
        if (node == null) {
            return;
        }
        into.add(nodeId);
        for (String childId : node.getChildren()) {
            collect(childId, into);
        }
    }

    public boolean isDescendant(String ancestorId, String candidateId) {
        NodeMeta ancestor = nodes.get(ancestorId);
        if (ancestor == null) {
            return false;
        }
        for (String childId : ancestor.getChildren()) {
            if (childId.equals(candidateId) || isDescendant(childId, candidateId)) {
                return true;
            }
        }
        return false;
    }
}
