package com.tanmi.core.git;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link GitCapability} backed by the {@code git} CLI.
 *
 * <p>Shells out via {@link ProcessBuilder} rather than depending on JGit. Each call
 * blocks until git exits.
 *
 * <p>Excluded paths, relative to the repository directory passed to each call, are left
 * out of dirty checks and commits. Workspace storage living inside the project root is
 * excluded this way so branch switches and resets never carry it along.
 */
public class GitCliCapability implements GitCapability {

    private static final Logger log = LoggerFactory.getLogger(GitCliCapability.class);

    private final String gitExecutable;
    private final List<String> excludedPaths;

    public GitCliCapability() {
        this("git", List.of());
    }

    public GitCliCapability(String gitExecutable, List<String> excludedPaths) {
        this.gitExecutable = gitExecutable;
        this.excludedPaths = List.copyOf(excludedPaths);
    }

    @Override
    public boolean isAvailable() {
        try {
            return runGit(Path.of(".").toAbsolutePath(), "--version") == 0;
        } catch (GitCommandException e) {
            log.debug("git executable '{}' not usable: {}", gitExecutable, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean isRepo(Path repo) {
        if (repo == null || !Files.isDirectory(repo)) {
            return false;
        }
        return runGit(repo, "rev-parse", "--is-inside-work-tree") == 0;
    }

    @Override
    public String currentBranch(Path repo) {
        return runGitOutput(repo, "rev-parse", "--abbrev-ref", "HEAD").trim();
    }

    @Override
    public boolean isDirty(Path repo) {
        return !runGitOutput(repo, withPathspec("status", "--porcelain")).isBlank();
    }

    @Override
    public void createBranch(Path repo, String branch) {
        log.info("Creating branch '{}' in {}", branch, repo);
        requireSuccess(repo, "checkout", "-b", branch);
    }

    @Override
    public void checkout(Path repo, String branch) {
        requireSuccess(repo, "checkout", branch);
    }

    @Override
    public void deleteBranch(Path repo, String branch) {
        requireSuccess(repo, "branch", "-D", branch);
    }

    @Override
    public List<String> listBranches(Path repo, String pattern) {
        var output = runGitOutput(repo, "branch", "--list", pattern);
        List<String> branches = new ArrayList<>();
        for (String line : output.split("\n")) {
            // current branch is prefixed with "* ", worktree checkouts with "+ "
            var name = line.replaceFirst("^[*+]?\\s*", "").trim();
            if (!name.isEmpty()) {
                branches.add(name);
            }
        }
        return branches;
    }

    @Override
    public String commitAll(Path repo, String message) {
        requireSuccess(repo, withPathspec("add", "-A"));

        int diffExit = runGit(repo, "diff", "--cached", "--quiet");
        if (diffExit == 0) {
            log.debug("Nothing staged in {}, keeping current commit", repo);
            return currentCommit(repo);
        }

        requireSuccess(repo, "commit", "-m", message);
        return currentCommit(repo);
    }

    @Override
    public void resetHard(Path repo, String commit) {
        log.info("Resetting {} to {}", repo, commit);
        requireSuccess(repo, "reset", "--hard", commit);
    }

    @Override
    public void merge(Path repo, String branch, String into, String message) {
        log.info("Merging branch '{}' into '{}'", branch, into);
        requireSuccess(repo, "checkout", into);
        requireSuccess(repo, "merge", "--no-ff", branch, "-m", message);
    }

    @Override
    public String currentCommit(Path repo) {
        return runGitOutput(repo, "rev-parse", "HEAD").trim();
    }

    @Override
    public int commitsBetween(Path repo, String from, String to) {
        var output = runGitOutput(repo, "rev-list", "--count", from + ".." + to).trim();
        if (output.isEmpty()) {
            return 0;
        }
        try {
            return Integer.parseInt(output);
        } catch (NumberFormatException e) {
            throw new GitCommandException("Unexpected rev-list output: " + output, e);
        }
    }

    private void requireSuccess(Path repo, String... args) {
        int exitCode = runGit(repo, args);
        if (exitCode != 0) {
            throw new GitCommandException(
                    "git %s failed (exit code %d)".formatted(String.join(" ", args), exitCode), exitCode);
        }
    }

    /**
     * Runs a git command, streaming its combined output to the debug log.
     * Package-private for testing.
     *
     * @return the process exit code
     */
    int runGit(Path workDir, String... args) {
        var command = buildCommand(args);
        log.debug("Running: {}", String.join(" ", command));

        try {
            var process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .start();

            // Consume output to prevent blocking
            try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream()))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("git: {}", line);
                }
            }

            return process.waitFor();
        } catch (IOException e) {
            log.error("Git command failed: {}", String.join(" ", command), e);
            throw new GitCommandException("Git command failed: " + String.join(" ", args), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitCommandException("Interrupted while running git " + String.join(" ", args), e);
        }
    }

    /**
     * Runs a git command and captures stdout. Stderr is discarded.
     * Package-private for testing.
     *
     * @throws GitCommandException when git exits non-zero
     */
    String runGitOutput(Path workDir, String... args) {
        var command = buildCommand(args);
        log.debug("Running (capture): {}", String.join(" ", command));

        try {
            var process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();

            String output;
            try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream()))) {
                output = reader.lines().collect(Collectors.joining("\n"));
            }

            int exitCode = process.waitFor();
            if (exitCode != 0) {
                log.warn("Git command exited with code {}: {}", exitCode, String.join(" ", command));
                throw new GitCommandException(
                        "git %s failed (exit code %d)".formatted(String.join(" ", args), exitCode), exitCode);
            }

            return output;
        } catch (IOException e) {
            log.error("Git command failed: {}", String.join(" ", command), e);
            throw new GitCommandException("Git command failed: " + String.join(" ", args), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitCommandException("Interrupted while running git " + String.join(" ", args), e);
        }
    }

    /**
     * Appends a whole-repository pathspec minus the excluded paths, or nothing when no
     * path is excluded.
     */
    private String[] withPathspec(String... args) {
        if (excludedPaths.isEmpty()) {
            return args;
        }
        var full = new ArrayList<>(Arrays.asList(args));
        full.add("--");
        full.add(":/");
        for (String path : excludedPaths) {
            full.add(":(exclude)" + path);
        }
        return full.toArray(String[]::new);
    }

    private List<String> buildCommand(String... args) {
        var command = new ArrayList<String>();
        command.add(gitExecutable);
        command.addAll(Arrays.asList(args));
        return command;
    }
}
