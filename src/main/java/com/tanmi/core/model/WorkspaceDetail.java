package com.tanmi.core.model;

import java.util.List;

/**
 * Workspace-wide prose: the goal, the rules every node inherits, and global docs.
 */
public record WorkspaceDetail(String goal, List<String> rules, List<DocRef> docs) {

    public WorkspaceDetail {
        goal = goal == null ? "" : goal;
        rules = rules == null ? List.of() : List.copyOf(rules);
        docs = docs == null ? List.of() : List.copyOf(docs);
    }

    public List<DocRef> activeDocs() {
        return docs.stream().filter(DocRef::isActive).toList();
    }

    public WorkspaceDetail withRules(List<String> newRules) {
        return new WorkspaceDetail(goal, newRules, docs);
    }
}
