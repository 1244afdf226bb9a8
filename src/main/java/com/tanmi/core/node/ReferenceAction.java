package com.tanmi.core.node;

import java.util.Locale;

public enum ReferenceAction {
    ADD,
    REMOVE,
    EXPIRE,
    ACTIVATE;

    public static ReferenceAction parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
