package com.tanmi.core.health;

import com.tanmi.core.git.GitCapability;
import com.tanmi.core.model.WorkspaceConfig;
import com.tanmi.core.persistence.WorkspaceStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the dispatch subsystem.
 * <p>
 * Reports UP when a {@code git} executable is available. Without git the engine
 * still works in no-git mode, so the status degrades instead of going DOWN.
 */
@Component("dispatchHealthIndicator")
public class DispatchHealthIndicator implements HealthIndicator {

    private final GitCapability git;
    private final WorkspaceStore store;

    public DispatchHealthIndicator(GitCapability git, WorkspaceStore store) {
        this.git = git;
        this.store = store;
    }

    @Override
    public Health health() {
        var workspaces = store.listWorkspaces();
        long enabled = workspaces.stream().filter(WorkspaceConfig::isDispatchEnabled).count();
        long gitMode = workspaces.stream().filter(WorkspaceConfig::isGitDispatchEnabled).count();

        boolean gitAvailable = git.isAvailable();
        var builder = gitAvailable ? Health.up() : Health.status("DEGRADED");
        return builder
                .withDetail("git.available", gitAvailable)
                .withDetail("workspaces", workspaces.size())
                .withDetail("dispatch.enabled", enabled)
                .withDetail("dispatch.git", gitMode)
                .build();
    }
}
