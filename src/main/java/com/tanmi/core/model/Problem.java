package com.tanmi.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * The single mutable "current problem" note of a node.
 */
public record Problem(String currentProblem, String nextStep) {

    public static final Problem NONE = new Problem("", "");

    public Problem {
        currentProblem = currentProblem == null ? "" : currentProblem;
        nextStep = nextStep == null ? "" : nextStep;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return currentProblem.isBlank();
    }
}
