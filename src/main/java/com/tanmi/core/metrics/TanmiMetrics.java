package com.tanmi.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralised Micrometer metrics for node lifecycles and dispatch.
 */
@Service
public class TanmiMetrics {

    private final MeterRegistry registry;
    private final AtomicInteger activeDispatches = new AtomicInteger();

    public TanmiMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("tanmi.dispatch.active", activeDispatches, AtomicInteger::get)
                .description("Execution nodes currently handed off to an executor")
                .register(registry);
    }

    public void recordTransition(String nodeType, String action) {
        Counter.builder("tanmi.node.transitions")
                .tag("type", nodeType)
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public void recordCascade(int promotedAncestors) {
        Counter.builder("tanmi.node.cascade_promotions")
                .description("Ancestors promoted to monitoring by start/reopen cascades")
                .register(registry)
                .increment(promotedAncestors);
    }

    public void recordNodeCreated(String nodeType) {
        Counter.builder("tanmi.node.created")
                .tag("type", nodeType)
                .register(registry)
                .increment();
    }

    public void dispatchStarted() {
        activeDispatches.incrementAndGet();
    }

    /**
     * Records the outcome of a dispatched execution.
     *
     * @param outcome "passed" or "failed"
     * @param ms      time between prepare and completion
     */
    public void recordDispatchOutcome(String outcome, long ms) {
        activeDispatches.updateAndGet(n -> Math.max(0, n - 1));
        Counter.builder("tanmi.dispatch.outcomes")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder("tanmi.dispatch.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(Math.max(0, ms)));
    }

    public void recordRollback() {
        Counter.builder("tanmi.dispatch.rollbacks")
                .description("Hard resets to a dispatch start marker after a failed test")
                .register(registry)
                .increment();
    }

    public void recordDispatchMode(boolean enabled, boolean useGit) {
        Counter.builder("tanmi.dispatch.mode_changes")
                .tag("enabled", String.valueOf(enabled))
                .tag("git", String.valueOf(useGit))
                .register(registry)
                .increment();
    }

    public int getActiveDispatches() {
        return activeDispatches.get();
    }
}
