package com.tanmi.core.git;

/**
 * Raised when a git invocation cannot be started or exits non-zero where success is required.
 */
public class GitCommandException extends RuntimeException {

    private final int exitCode;

    public GitCommandException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public GitCommandException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    /** Exit status of the git process, or -1 when it never ran to completion. */
    public int getExitCode() {
        return exitCode;
    }
}
