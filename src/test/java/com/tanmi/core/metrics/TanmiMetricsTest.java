package com.tanmi.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TanmiMetricsTest {

    private SimpleMeterRegistry registry;
    private TanmiMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new TanmiMetrics(registry);
    }

    @Test
    @DisplayName("recordTransition counts by type and action")
    void recordTransition() {
        metrics.recordTransition("execution", "start");
        metrics.recordTransition("execution", "start");
        metrics.recordTransition("planning", "complete");

        assertEquals(2.0, registry.find("tanmi.node.transitions")
                .tag("type", "execution").tag("action", "start").counter().count());
        assertEquals(1.0, registry.find("tanmi.node.transitions")
                .tag("type", "planning").counter().count());
    }

    @Test
    @DisplayName("recordCascade adds the number of promoted ancestors")
    void recordCascade() {
        metrics.recordCascade(3);
        metrics.recordCascade(1);

        assertEquals(4.0, registry.find("tanmi.node.cascade_promotions").counter().count());
    }

    @Test
    @DisplayName("dispatch outcome decrements the active gauge and records duration")
    void dispatchLifecycle() {
        metrics.dispatchStarted();
        metrics.dispatchStarted();
        assertEquals(2.0, registry.find("tanmi.dispatch.active").gauge().value());

        metrics.recordDispatchOutcome("passed", 1200);

        assertEquals(1, metrics.getActiveDispatches());
        assertEquals(1.0, registry.find("tanmi.dispatch.outcomes").tag("outcome", "passed").counter().count());
        assertEquals(1, registry.find("tanmi.dispatch.duration").tag("outcome", "passed").timer().count());
    }

    @Test
    @DisplayName("active gauge never goes negative")
    void activeGaugeFloorsAtZero() {
        metrics.recordDispatchOutcome("failed", 10);

        assertEquals(0, metrics.getActiveDispatches());
    }

    @Test
    void rollbacksAndModeChanges() {
        metrics.recordRollback();
        metrics.recordDispatchMode(true, true);
        metrics.recordDispatchMode(false, true);

        assertEquals(1.0, registry.find("tanmi.dispatch.rollbacks").counter().count());
        assertEquals(1.0, registry.find("tanmi.dispatch.mode_changes")
                .tag("enabled", "true").tag("git", "true").counter().count());
        assertEquals(1.0, registry.find("tanmi.dispatch.mode_changes")
                .tag("enabled", "false").counter().count());
    }
}
