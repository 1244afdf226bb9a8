package com.tanmi.core.model;

import java.util.List;

/**
 * Prose attached to a node. Missing fields in storage degrade to empty defaults.
 */
public record NodeDetail(String title, String requirement, List<DocRef> docs, String notes) {

    public NodeDetail {
        title = title == null ? "" : title;
        requirement = requirement == null ? "" : requirement;
        docs = docs == null ? List.of() : List.copyOf(docs);
        notes = notes == null ? "" : notes;
    }

    public static NodeDetail empty() {
        return new NodeDetail("", "", List.of(), "");
    }

    public List<DocRef> activeDocs() {
        return docs.stream().filter(DocRef::isActive).toList();
    }

    public NodeDetail withTitle(String newTitle) {
        return new NodeDetail(newTitle, requirement, docs, notes);
    }

    public NodeDetail withRequirement(String newRequirement) {
        return new NodeDetail(title, newRequirement, docs, notes);
    }

    public NodeDetail withNotes(String newNotes) {
        return new NodeDetail(title, requirement, docs, newNotes);
    }

    public NodeDetail withDocs(List<DocRef> newDocs) {
        return new NodeDetail(title, requirement, newDocs, notes);
    }
}
