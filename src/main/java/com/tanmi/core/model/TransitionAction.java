package com.tanmi.core.model;

import java.util.Locale;

/**
 * Actions accepted by {@code StateService#transition}.
 */
public enum TransitionAction {
    START,
    SUBMIT,
    COMPLETE,
    FAIL,
    RETRY,
    REOPEN,
    CANCEL;

    public boolean requiresConclusion() {
        return this == COMPLETE || this == FAIL || this == CANCEL;
    }

    /** Actions that (re)activate a node, cascading to its ancestors and moving the focus. */
    public boolean activates() {
        return this == START || this == REOPEN;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TransitionAction parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
