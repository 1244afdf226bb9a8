package com.tanmi.core.context;

import com.tanmi.core.model.NodeGraph;
import com.tanmi.core.model.NodeKind;
import com.tanmi.core.model.NodeMeta;
import com.tanmi.core.model.NodeStatus;
import com.tanmi.core.state.StateService;

/**
 * Next-step hints attached to a composed context, driven by node status, log volume and
 * the number of active docs.
 */
public final class ContextHints {

    /** Log length beyond which the hint suggests condensing progress into notes. */
    static final int LONG_LOG_THRESHOLD = 50;

    private ContextHints() {}

    public static String forNode(NodeGraph graph, NodeMeta node, int logSize, int activeDocs) {
        var hint = switch (node.getStatus()) {
            case PENDING -> "Not started yet. Start the node to begin work.";
            case IMPLEMENTING -> logSize == 0
                    ? "Implementing. Record progress in the log as you go."
                    : "Implementing. Continue from the latest log entries.";
            case VALIDATING -> "Validating. Verify the result, then complete or fail with a conclusion.";
            case PLANNING -> node.getChildren().isEmpty()
                    ? "Planning. Break the requirement into child nodes."
                    : "Planning. Review the children and start the next one.";
            case MONITORING -> StateService.allChildrenResolved(graph, node)
                    ? "All children are done. Review their conclusions and complete this node."
                    : "Monitoring children. Focus the next unfinished child.";
            case COMPLETED -> "Completed. Reopen the node if the work needs to change.";
            case FAILED -> "Failed. Retry it or return to the parent to re-plan.";
            case CANCELLED -> "Cancelled. Reopen the node to resume planning.";
        };
        if (activeDocs == 0 && (node.getStatus() == NodeStatus.PENDING || node.getStatus() == NodeStatus.IMPLEMENTING)) {
            hint += " No active docs are attached; the node may be missing reference material.";
        }
        if (node.getType() == NodeKind.EXECUTION && logSize > LONG_LOG_THRESHOLD) {
            hint += " The log has %d entries; consider summarizing progress in the notes.".formatted(logSize);
        }
        return hint;
    }
}
