package com.tanmi.dispatch;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Dispatch settings bound from {@code tanmi.dispatch.*}.
 */
@Component
@ConfigurationProperties(prefix = "tanmi.dispatch")
public class DispatchProperties {

    /** Mode used when enable is called without an explicit choice: {@code git} or {@code no-git}. */
    private String defaultMode = "no-git";

    /** Advisory executor timeout handed to the caller. */
    private long timeoutMs = 300_000L;

    /** Advisory retry budget handed to the caller. */
    private int maxRetries = 3;

    /** Sub-agent type the caller should spawn for a dispatched node. */
    private String subagentType = "tanmi-executor";

    private String backupPrefix = "tanmi-backup";

    private String processPrefix = "tanmi-process";

    public boolean isGitDefault() {
        return "git".equalsIgnoreCase(defaultMode);
    }

    public String getDefaultMode() { return defaultMode; }
    public void setDefaultMode(String defaultMode) {
        if (!"git".equalsIgnoreCase(defaultMode) && !"no-git".equalsIgnoreCase(defaultMode)) {
            throw new IllegalArgumentException(
                    "tanmi.dispatch.default-mode must be 'git' or 'no-git', got '%s'".formatted(defaultMode));
        }
        this.defaultMode = defaultMode;
    }
    public long getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public String getSubagentType() { return subagentType; }
    public void setSubagentType(String subagentType) { this.subagentType = subagentType; }
    public String getBackupPrefix() { return backupPrefix; }
    public void setBackupPrefix(String backupPrefix) { this.backupPrefix = backupPrefix; }
    public String getProcessPrefix() { return processPrefix; }
    public void setProcessPrefix(String processPrefix) { this.processPrefix = processPrefix; }
}
