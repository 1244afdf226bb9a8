package com.tanmi.core.error;

/**
 * Stable failure kinds reported by the orchestration engine.
 */
public enum ErrorCode {
    // workspace
    WORKSPACE_EXISTS,
    WORKSPACE_NOT_FOUND,
    WORKSPACE_ACTIVE,
    WORKSPACE_ARCHIVED,
    INVALID_NAME,
    INVALID_PATH,

    // nodes
    NODE_NOT_FOUND,
    PARENT_NOT_FOUND,
    INVALID_TITLE,
    INVALID_PARAMS,
    INVALID_NODE_TYPE,
    INVALID_NODE_STATUS,
    CANNOT_DELETE_ROOT,
    EXECUTION_CANNOT_HAVE_CHILDREN,
    INVALID_PARENT_STATUS,

    // state machine
    INVALID_TRANSITION,
    CONCLUSION_REQUIRED,
    INCOMPLETE_CHILDREN,

    // dispatch
    GIT_NOT_FOUND,
    GIT_ENVIRONMENT_LOST,
    DISPATCH_CONFLICT,
    DISPATCH_NOT_ENABLED,
    DISPATCH_ALREADY_ENABLED,
    DISPATCH_IN_PROGRESS,

    // memos and references
    MEMO_NOT_FOUND,
    REFERENCE_EXISTS,
    REFERENCE_NOT_FOUND
}
