package com.tanmi.core.git;

import java.nio.file.Path;
import java.util.List;

/**
 * Local git operations the dispatch subsystem needs. Every call is blocking and
 * scoped to the repository containing {@code repo}.
 */
public interface GitCapability {

    /** Whether a {@code git} executable can be launched at all. */
    boolean isAvailable();

    boolean isRepo(Path repo);

    String currentBranch(Path repo);

    /** True when the working tree has staged, unstaged or untracked changes. */
    boolean isDirty(Path repo);

    /** Creates {@code branch} at HEAD and switches to it. */
    void createBranch(Path repo, String branch);

    void checkout(Path repo, String branch);

    void deleteBranch(Path repo, String branch);

    /** Local branches matching a {@code git branch --list} pattern. */
    List<String> listBranches(Path repo, String pattern);

    /**
     * Stages everything and commits it. When nothing is staged no commit is made.
     *
     * @return the HEAD commit hash after the call
     */
    String commitAll(Path repo, String message);

    void resetHard(Path repo, String commit);

    /** Checks out {@code into} and merges {@code branch} into it with a merge commit. */
    void merge(Path repo, String branch, String into, String message);

    String currentCommit(Path repo);

    /** Number of commits reachable from {@code to} but not from {@code from}. */
    int commitsBetween(Path repo, String from, String to);
}
