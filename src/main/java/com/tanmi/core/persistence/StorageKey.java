package com.tanmi.core.persistence;

import java.util.Locale;

/**
 * Directory name a workspace or node is stored under. Never leaves this package.
 */
record StorageKey(String value) {

    private static final int MAX_NAME_LENGTH = 40;

    static StorageKey forWorkspace(String name, String workspaceId) {
        var slug = name.trim().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9._-]+", "-")
                .replaceAll("^-+|-+$", "");
        if (slug.length() > MAX_NAME_LENGTH) {
            slug = slug.substring(0, MAX_NAME_LENGTH);
        }
        return new StorageKey(slug.isEmpty() ? workspaceId : slug + "_" + suffix(workspaceId));
    }

    static StorageKey forNode(String nodeId) {
        return new StorageKey(nodeId);
    }

    private static String suffix(String id) {
        int dash = id.lastIndexOf('-');
        return dash >= 0 ? id.substring(dash + 1) : id;
    }
}
