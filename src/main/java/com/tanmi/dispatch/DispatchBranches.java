package com.tanmi.dispatch;

import com.tanmi.core.git.GitCapability;
import com.tanmi.core.model.DispatchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Naming and best-effort removal of the branches a workspace creates in dispatch mode.
 *
 * <pre>
 *   {processPrefix}/{workspaceId}        all dispatched work is committed here
 *   {backupPrefix}/{workspaceId}/{n}     snapshot of a dirty tree taken on enable
 * </pre>
 */
@Component
public class DispatchBranches {

    private static final Logger log = LoggerFactory.getLogger(DispatchBranches.class);

    private final GitCapability git;
    private final DispatchProperties properties;

    public DispatchBranches(GitCapability git, DispatchProperties properties) {
        this.git = git;
        this.properties = properties;
    }

    public String processBranch(String workspaceId) {
        return properties.getProcessPrefix() + "/" + workspaceId;
    }

    public String backupPattern(String workspaceId) {
        return properties.getBackupPrefix() + "/" + workspaceId + "/*";
    }

    /**
     * Next free backup branch name: one more than the highest existing sequence number.
     */
    public String nextBackupBranch(Path repo, String workspaceId) {
        var prefix = properties.getBackupPrefix() + "/" + workspaceId + "/";
        int max = 0;
        for (String branch : git.listBranches(repo, backupPattern(workspaceId))) {
            if (branch.startsWith(prefix)) {
                try {
                    max = Math.max(max, Integer.parseInt(branch.substring(prefix.length())));
                } catch (NumberFormatException e) {
                    log.debug("Ignoring non-numeric backup branch '{}'", branch);
                }
            }
        }
        return prefix + (max + 1);
    }

    /**
     * Deletes the process branch and every backup branch of the workspace, first leaving
     * the process branch for the original one when it is checked out. Failures are
     * logged and skipped.
     *
     * @return the branches actually deleted
     */
    public List<String> deleteAll(Path repo, String workspaceId, DispatchConfig config) {
        var candidates = new LinkedHashSet<String>();
        candidates.add(processBranch(workspaceId));
        if (config != null) {
            if (config.getProcessBranch() != null) {
                candidates.add(config.getProcessBranch());
            }
            candidates.addAll(config.getBackupBranches());
        }
        try {
            candidates.addAll(git.listBranches(repo, backupPattern(workspaceId)));
        } catch (RuntimeException e) {
            log.debug("Could not list backup branches for {}: {}", workspaceId, e.getMessage());
        }

        if (config != null && config.getOriginalBranch() != null) {
            try {
                if (candidates.contains(git.currentBranch(repo))) {
                    git.checkout(repo, config.getOriginalBranch());
                }
            } catch (RuntimeException e) {
                log.warn("Could not return to branch '{}': {}", config.getOriginalBranch(), e.getMessage());
            }
        }

        List<String> deleted = new ArrayList<>();
        for (String branch : candidates) {
            try {
                git.deleteBranch(repo, branch);
                deleted.add(branch);
            } catch (RuntimeException e) {
                log.debug("Could not delete branch '{}': {}", branch, e.getMessage());
            }
        }
        log.info("Branch cleanup for workspace {} removed {}", workspaceId, deleted);
        return deleted;
    }
}
