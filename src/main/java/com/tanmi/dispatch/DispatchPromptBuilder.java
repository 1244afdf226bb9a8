package com.tanmi.dispatch;

import com.tanmi.core.model.NodeDetail;

/**
 * Builds the instruction text handed to the executor sub-agent of a dispatched node.
 * Pure function, no Spring dependencies.
 */
public final class DispatchPromptBuilder {

    private static final int MAX_REQUIREMENT_CHARS = 2_000;

    private DispatchPromptBuilder() {}

    public static String build(String workspaceId, String nodeId, NodeDetail detail) {
        var sb = new StringBuilder();
        sb.append("Execute task for TanmiWorkspace node.\n\n");
        sb.append("Workspace: ").append(workspaceId).append("\n");
        sb.append("Node: ").append(nodeId).append("\n");
        sb.append("Title: ").append(detail.title()).append("\n");

        if (!detail.requirement().isBlank()) {
            sb.append("\n## Requirement\n\n");
            sb.append(truncate(detail.requirement())).append("\n");
        }

        sb.append("\n## Instructions\n\n");
        sb.append("1. Call context_get(workspaceId=\"").append(workspaceId)
                .append("\", nodeId=\"").append(nodeId).append("\") to get the full execution context\n");
        sb.append("2. Assess the task scope and whether the information is complete\n");
        sb.append("3. Execute the task within the defined boundaries\n");
        sb.append("4. Report progress via log_append\n");
        sb.append("5. On success: call ").append(completeCall(workspaceId, nodeId, true)).append("\n");
        sb.append("6. On failure: call ").append(completeCall(workspaceId, nodeId, false)).append("\n\n");
        sb.append("**IMPORTANT**: You MUST call node_dispatch_complete to finalize the dispatch. ");
        sb.append("Do NOT use node_transition directly.");
        return sb.toString();
    }

    private static String completeCall(String workspaceId, String nodeId, boolean success) {
        return "node_dispatch_complete(workspaceId=\"%s\", nodeId=\"%s\", success=%s, conclusion=\"...\")"
                .formatted(workspaceId, nodeId, success);
    }

    private static String truncate(String text) {
        if (text.length() <= MAX_REQUIREMENT_CHARS) {
            return text;
        }
        return text.substring(0, MAX_REQUIREMENT_CHARS) + "\n... (truncated, see context_get)";
    }
}
