package com.tanmi.core.state;

import com.tanmi.core.error.ErrorCode;
import com.tanmi.core.error.TanmiException;
import com.tanmi.core.model.NodeKind;
import com.tanmi.core.model.NodeStatus;
import com.tanmi.core.model.TransitionAction;

import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Validation front for the per-kind transition tables carried by {@link NodeKind}.
 */
public final class TransitionTable {

    private TransitionTable() {}

    /**
     * Target status of {@code action}, or an {@code INVALID_TRANSITION} failure whose
     * suggestion names what the caller can do instead.
     */
    public static NodeStatus resolve(NodeKind kind, NodeStatus status, TransitionAction action) {
        return kind.next(status, action).orElseThrow(() -> new TanmiException(
                ErrorCode.INVALID_TRANSITION,
                "Cannot %s a %s node in status %s".formatted(action.label(), label(kind), label(status)),
                suggestion(kind, status, action)));
    }

    public static boolean isValid(NodeKind kind, NodeStatus status, TransitionAction action) {
        return kind.next(status, action).isPresent();
    }

    static String suggestion(NodeKind kind, NodeStatus status, TransitionAction action) {
        var available = kind.availableActions(status);
        var listed = available.isEmpty()
                ? "none"
                : available.stream().map(TransitionAction::label).collect(Collectors.joining(", "));

        if (status == NodeStatus.PENDING && action != TransitionAction.START) {
            return "Start the node before trying to %s it".formatted(action.label());
        }
        if (kind == NodeKind.EXECUTION && status == NodeStatus.FAILED && action == TransitionAction.START) {
            return "Use retry to resume a failed node";
        }
        if (status.isResolved() && action == TransitionAction.START) {
            return "Use reopen to work on a %s node again".formatted(label(status));
        }
        return "Available actions from %s: %s".formatted(label(status), listed);
    }

    private static String label(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
