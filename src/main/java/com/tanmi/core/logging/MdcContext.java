package com.tanmi.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing workspace-scoped MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String WORKSPACE_ID = "workspaceId";
    public static final String NODE_ID = "nodeId";

    private MdcContext() {}

    public static void setWorkspace(String workspaceId) {
        MDC.put(WORKSPACE_ID, workspaceId);
        MDC.remove(NODE_ID);
    }

    public static void setNode(String workspaceId, String nodeId) {
        MDC.put(WORKSPACE_ID, workspaceId);
        MDC.put(NODE_ID, nodeId);
    }

    public static void clear() {
        MDC.remove(WORKSPACE_ID);
        MDC.remove(NODE_ID);
    }
}
