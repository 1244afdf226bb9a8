package com.tanmi.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A document reference attached to a node or to the workspace.
 *
 * @param path        project-relative path, node id, or {@code memo://} reference
 * @param description what the document is for
 * @param status      expired references stay recorded but are left out of composed context
 */
public record DocRef(String path, String description, DocStatus status) {

    public DocRef {
        description = description == null ? "" : description;
        status = status == null ? DocStatus.ACTIVE : status;
    }

    public static DocRef active(String path, String description) {
        return new DocRef(path, description, DocStatus.ACTIVE);
    }

    @JsonIgnore
    public boolean isActive() {
        return status == DocStatus.ACTIVE;
    }

    public DocRef withStatus(DocStatus newStatus) {
        return new DocRef(path, description, newStatus);
    }
}
