package com.tanmi.core.config;

import com.tanmi.core.git.GitCapability;
import com.tanmi.core.git.GitCliCapability;
import com.tanmi.core.persistence.JsonFileWorkspaceStore;
import com.tanmi.core.persistence.WorkspaceStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.List;

@Configuration
public class TanmiConfig {

    @Bean
    public WorkspaceStore workspaceStore(TanmiProperties properties) {
        return new JsonFileWorkspaceStore(
                Path.of(properties.getHome()),
                properties.getWorkspaceDirName(),
                JsonFileWorkspaceStore.createObjectMapper());
    }

    /**
     * Git CLI that never stages or reports the per-project workspace storage directory.
     */
    @Bean
    @ConditionalOnMissingBean
    public GitCapability gitCapability(TanmiProperties properties) {
        return new GitCliCapability("git", List.of(properties.getWorkspaceDirName()));
    }

    /**
     * Fallback registry when no metrics export is configured.
     */
    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
