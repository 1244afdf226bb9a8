package com.tanmi.core.context;

/**
 * What to include when composing a node's context.
 *
 * @param maxLogEntries tail length per node log; zero or less drops log entries entirely
 * @param reverseLog    newest entry first
 */
public record ContextOptions(boolean includeLog, int maxLogEntries, boolean reverseLog, boolean includeProblem) {

    public static final int DEFAULT_MAX_LOG_ENTRIES = 20;

    public static final ContextOptions DEFAULTS = new ContextOptions(true, DEFAULT_MAX_LOG_ENTRIES, false, true);

    public ContextOptions withMaxLogEntries(int max) {
        return new ContextOptions(includeLog, max, reverseLog, includeProblem);
    }

    public ContextOptions withReverseLog(boolean reverse) {
        return new ContextOptions(includeLog, maxLogEntries, reverse, includeProblem);
    }
}
