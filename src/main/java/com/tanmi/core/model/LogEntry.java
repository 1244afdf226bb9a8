package com.tanmi.core.model;

import java.time.Instant;

/**
 * One line of a node's (or the workspace's) append-only log.
 */
public record LogEntry(Instant timestamp, String operator, String event) {
}
