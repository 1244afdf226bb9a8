package com.tanmi.dispatch;

import com.tanmi.core.git.GitCapability;
import com.tanmi.core.git.GitCommandException;
import com.tanmi.core.model.DispatchConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DispatchBranchesTest {

    private static final Path REPO = Path.of("/tmp/repo");

    private GitCapability git;
    private DispatchBranches branches;

    @BeforeEach
    void setUp() {
        git = mock(GitCapability.class);
        branches = new DispatchBranches(git, new DispatchProperties());
    }

    @Test
    void namesFollowConfiguredPrefixes() {
        assertEquals("tanmi-process/ws-1", branches.processBranch("ws-1"));
        assertEquals("tanmi-backup/ws-1/*", branches.backupPattern("ws-1"));
    }

    @Test
    void firstBackupIsNumberOne() {
        when(git.listBranches(REPO, "tanmi-backup/ws-1/*")).thenReturn(List.of());

        assertEquals("tanmi-backup/ws-1/1", branches.nextBackupBranch(REPO, "ws-1"));
    }

    @Test
    void nextBackupIsOneMoreThanHighest() {
        when(git.listBranches(REPO, "tanmi-backup/ws-1/*")).thenReturn(
                List.of("tanmi-backup/ws-1/1", "tanmi-backup/ws-1/4", "tanmi-backup/ws-1/old"));

        assertEquals("tanmi-backup/ws-1/5", branches.nextBackupBranch(REPO, "ws-1"));
    }

    @Test
    void deleteAllLeavesProcessBranchAndSkipsFailures() {
        var config = new DispatchConfig();
        config.setOriginalBranch("main");
        config.setProcessBranch("tanmi-process/ws-1");
        config.setBackupBranches(List.of("tanmi-backup/ws-1/1"));
        when(git.listBranches(REPO, "tanmi-backup/ws-1/*")).thenReturn(List.of("tanmi-backup/ws-1/1"));
        when(git.currentBranch(REPO)).thenReturn("tanmi-process/ws-1");
        doThrow(new GitCommandException("not found", 1)).when(git).deleteBranch(REPO, "tanmi-backup/ws-1/1");

        var deleted = branches.deleteAll(REPO, "ws-1", config);

        verify(git).checkout(REPO, "main");
        assertEquals(List.of("tanmi-process/ws-1"), deleted);
    }

    @Test
    void deleteAllWithoutConfigStillTriesProcessBranch() {
        when(git.listBranches(REPO, "tanmi-backup/ws-1/*")).thenThrow(new GitCommandException("no repo", 128));

        var deleted = branches.deleteAll(REPO, "ws-1", null);

        assertEquals(List.of("tanmi-process/ws-1"), deleted);
        verify(git, never()).checkout(any(), any());
    }
}
