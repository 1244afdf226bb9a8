package com.tanmi.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Workspace-level dispatch configuration. Present only while dispatch is enabled.
 */
public class DispatchConfig {

    private boolean enabled;
    private boolean useGit;
    private long enabledAt;
    private String originalBranch;
    private String processBranch;
    private List<String> backupBranches = new ArrayList<>();
    private DispatchLimits limits;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public boolean isUseGit() { return useGit; }
    public void setUseGit(boolean useGit) { this.useGit = useGit; }
    public long getEnabledAt() { return enabledAt; }
    public void setEnabledAt(long enabledAt) { this.enabledAt = enabledAt; }
    public String getOriginalBranch() { return originalBranch; }
    public void setOriginalBranch(String originalBranch) { this.originalBranch = originalBranch; }
    public String getProcessBranch() { return processBranch; }
    public void setProcessBranch(String processBranch) { this.processBranch = processBranch; }
    public List<String> getBackupBranches() { return backupBranches; }
    public void setBackupBranches(List<String> backupBranches) {
        this.backupBranches = backupBranches == null ? new ArrayList<>() : new ArrayList<>(backupBranches);
    }
    public DispatchLimits getLimits() { return limits; }
    public void setLimits(DispatchLimits limits) { this.limits = limits; }
}
