package com.tanmi.support;

import com.tanmi.core.git.GitCapability;
import com.tanmi.core.git.GitCommandException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Single-repository git double. Each branch is a list of commit ids, oldest first;
 * a dirty flag stands in for the working tree.
 */
public class InMemoryGitCapability implements GitCapability {

    private final Map<String, List<String>> branches = new LinkedHashMap<>();
    private final List<String> operations = new ArrayList<>();
    private String current;
    private boolean dirty;
    private boolean repo = true;
    private boolean failNextCommit;
    private int commitCounter;

    public InMemoryGitCapability() {
        this("main");
    }

    public InMemoryGitCapability(String initialBranch) {
        var root = nextCommit();
        branches.put(initialBranch, new ArrayList<>(List.of(root)));
        current = initialBranch;
    }

    // --- test controls ---

    public void setRepo(boolean repo) {
        this.repo = repo;
    }

    public void makeDirty() {
        this.dirty = true;
    }

    /** The next commitAll fails as git would on a broken index. */
    public void failNextCommit() {
        this.failNextCommit = true;
    }

    public List<String> getOperations() {
        return operations;
    }

    public boolean hasBranch(String branch) {
        return branches.containsKey(branch);
    }

    public String head(String branch) {
        var history = requireBranch(branch);
        return history.get(history.size() - 1);
    }

    public List<String> history(String branch) {
        return List.copyOf(requireBranch(branch));
    }

    // --- GitCapability ---

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public boolean isRepo(Path repo) {
        return this.repo;
    }

    @Override
    public String currentBranch(Path repo) {
        return current;
    }

    @Override
    public boolean isDirty(Path repo) {
        return dirty;
    }

    @Override
    public void createBranch(Path repo, String branch) {
        operations.add("createBranch " + branch);
        if (branches.containsKey(branch)) {
            throw new GitCommandException("branch '%s' already exists".formatted(branch), 128);
        }
        branches.put(branch, new ArrayList<>(requireBranch(current)));
        current = branch;
    }

    @Override
    public void checkout(Path repo, String branch) {
        operations.add("checkout " + branch);
        requireBranch(branch);
        current = branch;
    }

    @Override
    public void deleteBranch(Path repo, String branch) {
        operations.add("deleteBranch " + branch);
        if (branch.equals(current)) {
            throw new GitCommandException("cannot delete checked-out branch " + branch, 1);
        }
        if (branches.remove(branch) == null) {
            throw new GitCommandException("branch '%s' not found".formatted(branch), 1);
        }
    }

    @Override
    public List<String> listBranches(Path repo, String pattern) {
        var regex = Pattern.compile(Pattern.quote(pattern).replace("*", "\\E.*\\Q"));
        return branches.keySet().stream().filter(b -> regex.matcher(b).matches()).toList();
    }

    @Override
    public String commitAll(Path repo, String message) {
        operations.add("commitAll " + message);
        if (failNextCommit) {
            failNextCommit = false;
            throw new GitCommandException("unable to write new index file", 128);
        }
        if (!dirty) {
            return head(current);
        }
        var commit = nextCommit();
        requireBranch(current).add(commit);
        dirty = false;
        return commit;
    }

    @Override
    public void resetHard(Path repo, String commit) {
        operations.add("resetHard " + commit);
        var history = requireBranch(current);
        int idx = history.indexOf(commit);
        if (idx < 0) {
            throw new GitCommandException("unknown revision " + commit, 128);
        }
        history.subList(idx + 1, history.size()).clear();
        dirty = false;
    }

    @Override
    public void merge(Path repo, String branch, String into, String message) {
        operations.add("merge " + branch + " into " + into);
        var source = requireBranch(branch);
        checkout(repo, into);
        var target = requireBranch(into);
        for (String commit : source) {
            if (!target.contains(commit)) {
                target.add(commit);
            }
        }
        target.add(nextCommit());
    }

    @Override
    public String currentCommit(Path repo) {
        return head(current);
    }

    @Override
    public int commitsBetween(Path repo, String from, String to) {
        var base = requireBranch(from);
        return (int) requireBranch(to).stream().filter(c -> !base.contains(c)).count();
    }

    private List<String> requireBranch(String branch) {
        var history = branches.get(branch);
        if (history == null) {
            throw new GitCommandException("pathspec '%s' did not match".formatted(branch), 1);
        }
        return history;
    }

    private String nextCommit() {
        return "c%039d".formatted(++commitCounter);
    }
}
