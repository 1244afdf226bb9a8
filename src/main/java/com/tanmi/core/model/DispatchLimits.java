package com.tanmi.core.model;

/**
 * Advisory limits handed to the caller with each dispatch. Nothing inside the engine enforces them.
 */
public record DispatchLimits(long timeoutMs, int maxRetries) {
}
