package com.tanmi.core.model;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * The two node types. Each constant carries its own transition table as a pure
 * function from (status, action) to the next status.
 *
 * <pre>
 * EXECUTION: pending -start-> implementing -submit-> validating
 *            implementing|validating -complete-> completed, -fail-> failed
 *            failed -retry-> implementing, completed -reopen-> implementing
 *
 * PLANNING:  pending -start-> planning
 *            planning|monitoring -complete-> completed, -cancel-> cancelled
 *            completed|cancelled -reopen-> planning
 * </pre>
 */
public enum NodeKind {

    PLANNING {
        @Override
        public Set<NodeStatus> statuses() {
            return EnumSet.of(NodeStatus.PENDING, NodeStatus.PLANNING, NodeStatus.MONITORING,
                    NodeStatus.COMPLETED, NodeStatus.CANCELLED);
        }

        @Override
        public Optional<NodeStatus> next(NodeStatus status, TransitionAction action) {
            NodeStatus target = switch (status) {
                case PENDING -> action == TransitionAction.START ? NodeStatus.PLANNING : null;
                case PLANNING, MONITORING -> switch (action) {
                    case COMPLETE -> NodeStatus.COMPLETED;
                    case CANCEL -> NodeStatus.CANCELLED;
                    default -> null;
                };
                case COMPLETED, CANCELLED -> action == TransitionAction.REOPEN ? NodeStatus.PLANNING : null;
                default -> null;
            };
            return Optional.ofNullable(target);
        }
    },

    EXECUTION {
        @Override
        public Set<NodeStatus> statuses() {
            return EnumSet.of(NodeStatus.PENDING, NodeStatus.IMPLEMENTING, NodeStatus.VALIDATING,
                    NodeStatus.COMPLETED, NodeStatus.FAILED);
        }

        @Override
        public Optional<NodeStatus> next(NodeStatus status, TransitionAction action) {
            NodeStatus target = switch (status) {
                case PENDING -> action == TransitionAction.START ? NodeStatus.IMPLEMENTING : null;
                case IMPLEMENTING -> switch (action) {
                    case SUBMIT -> NodeStatus.VALIDATING;
                    case COMPLETE -> NodeStatus.COMPLETED;
                    case FAIL -> NodeStatus.FAILED;
                    default -> null;
                };
                case VALIDATING -> switch (action) {
                    case COMPLETE -> NodeStatus.COMPLETED;
                    case FAIL -> NodeStatus.FAILED;
                    default -> null;
                };
                case FAILED -> action == TransitionAction.RETRY ? NodeStatus.IMPLEMENTING : null;
                case COMPLETED -> action == TransitionAction.REOPEN ? NodeStatus.IMPLEMENTING : null;
                default -> null;
            };
            return Optional.ofNullable(target);
        }
    };

    /** Every status a node of this kind may hold. */
    public abstract Set<NodeStatus> statuses();

    /** Next status for the action, or empty when the table has no entry. */
    public abstract Optional<NodeStatus> next(NodeStatus status, TransitionAction action);

    /** Actions with a table entry for the given status, in declaration order. */
    public Set<TransitionAction> availableActions(NodeStatus status) {
        Set<TransitionAction> actions = EnumSet.noneOf(TransitionAction.class);
        for (TransitionAction action : TransitionAction.values()) {
            if (next(status, action).isPresent()) {
                actions.add(action);
            }
        }
        return actions;
    }

    public boolean canHaveChildren() {
        return this == PLANNING;
    }
}
