package com.tanmi.core.state;

import com.tanmi.core.error.ErrorCode;
import com.tanmi.core.error.TanmiException;
import com.tanmi.core.model.NodeKind;
import com.tanmi.core.model.NodeStatus;
import com.tanmi.core.model.TransitionAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TransitionTableTest {

    @Test
    @DisplayName("every (kind, status, action) either resolves inside the kind or fails cleanly")
    void tableIsTotal() {
        for (NodeKind kind : NodeKind.values()) {
            for (NodeStatus status : kind.statuses()) {
                for (TransitionAction action : TransitionAction.values()) {
                    Optional<NodeStatus> next = kind.next(status, action);
                    if (next.isPresent()) {
                        assertTrue(kind.statuses().contains(next.get()),
                                kind + " " + status + " -" + action + "-> " + next.get());
                        assertEquals(next.get(), TransitionTable.resolve(kind, status, action));
                        assertTrue(kind.availableActions(status).contains(action));
                    } else {
                        var ex = assertThrows(TanmiException.class,
                                () -> TransitionTable.resolve(kind, status, action));
                        assertEquals(ErrorCode.INVALID_TRANSITION, ex.getCode());
                        assertNotNull(ex.getSuggestion());
                    }
                }
            }
        }
    }

    @Test
    void executionHappyPath() {
        var status = NodeStatus.PENDING;
        status = TransitionTable.resolve(NodeKind.EXECUTION, status, TransitionAction.START);
        assertEquals(NodeStatus.IMPLEMENTING, status);
        status = TransitionTable.resolve(NodeKind.EXECUTION, status, TransitionAction.SUBMIT);
        assertEquals(NodeStatus.VALIDATING, status);
        status = TransitionTable.resolve(NodeKind.EXECUTION, status, TransitionAction.COMPLETE);
        assertEquals(NodeStatus.COMPLETED, status);
        status = TransitionTable.resolve(NodeKind.EXECUTION, status, TransitionAction.REOPEN);
        assertEquals(NodeStatus.IMPLEMENTING, status);
    }

    @Test
    void planningNodesCannotSubmitOrFail() {
        assertFalse(TransitionTable.isValid(NodeKind.PLANNING, NodeStatus.PLANNING, TransitionAction.SUBMIT));
        assertFalse(TransitionTable.isValid(NodeKind.PLANNING, NodeStatus.MONITORING, TransitionAction.FAIL));
        assertTrue(TransitionTable.isValid(NodeKind.PLANNING, NodeStatus.MONITORING, TransitionAction.CANCEL));
    }

    @Test
    void executionNodesCannotCancel() {
        for (NodeStatus status : NodeKind.EXECUTION.statuses()) {
            assertFalse(TransitionTable.isValid(NodeKind.EXECUTION, status, TransitionAction.CANCEL));
        }
    }

    // --- suggestions ---

    @Test
    void pendingNodeSuggestsStarting() {
        var ex = assertThrows(TanmiException.class,
                () -> TransitionTable.resolve(NodeKind.EXECUTION, NodeStatus.PENDING, TransitionAction.COMPLETE));
        assertEquals("Start the node before trying to complete it", ex.getSuggestion());
    }

    @Test
    void failedExecutionSuggestsRetry() {
        var ex = assertThrows(TanmiException.class,
                () -> TransitionTable.resolve(NodeKind.EXECUTION, NodeStatus.FAILED, TransitionAction.START));
        assertEquals("Use retry to resume a failed node", ex.getSuggestion());
    }

    @Test
    void resolvedNodeSuggestsReopen() {
        var ex = assertThrows(TanmiException.class,
                () -> TransitionTable.resolve(NodeKind.PLANNING, NodeStatus.CANCELLED, TransitionAction.START));
        assertEquals("Use reopen to work on a cancelled node again", ex.getSuggestion());
    }

    @Test
    void otherwiseListsAvailableActions() {
        var ex = assertThrows(TanmiException.class,
                () -> TransitionTable.resolve(NodeKind.EXECUTION, NodeStatus.VALIDATING, TransitionAction.SUBMIT));
        assertTrue(ex.getSuggestion().startsWith("Available actions from validating:"));
        assertTrue(ex.getSuggestion().contains("complete"));
        assertTrue(ex.getSuggestion().contains("fail"));
    }
}
