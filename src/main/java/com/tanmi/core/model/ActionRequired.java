package com.tanmi.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Instruction the calling agent must act on, e.g. spawning a sub-agent for a dispatched node.
 *
 * @param type    {@code dispatch_task}, {@code dispatch_complete_choice}, ...
 * @param message instruction text for the caller
 * @param data    structured payload (node id, prompt, timeout, ...)
 */
public record ActionRequired(String type, String message, Map<String, Object> data) {

    public static final String DISPATCH_TASK = "dispatch_task";
    public static final String DISPATCH_COMPLETE_CHOICE = "dispatch_complete_choice";

    public ActionRequired {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
