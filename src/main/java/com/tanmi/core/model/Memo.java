package com.tanmi.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Standalone long-form note, addressable from any node as {@code memo://<id>}.
 */
public record Memo(
    String id,
    String title,
    String summary,
    List<String> tags,
    String content,
    Instant createdAt,
    Instant updatedAt
) {

    public static final String REFERENCE_PREFIX = "memo://";

    public Memo {
        tags = tags == null ? List.of() : List.copyOf(tags);
        summary = summary == null ? "" : summary;
        content = content == null ? "" : content;
    }

    public String reference() {
        return REFERENCE_PREFIX + id;
    }

    public static boolean isReference(String target) {
        return target != null && target.startsWith(REFERENCE_PREFIX);
    }

    public static String idFromReference(String reference) {
        return reference.substring(REFERENCE_PREFIX.length());
    }
}
