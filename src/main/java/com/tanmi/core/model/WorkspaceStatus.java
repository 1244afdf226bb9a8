package com.tanmi.core.model;

public enum WorkspaceStatus {
    ACTIVE,
    ARCHIVED,
    ERROR
}
