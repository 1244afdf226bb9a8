package com.tanmi.core.model;

public enum DocStatus {
    ACTIVE,
    EXPIRED
}
