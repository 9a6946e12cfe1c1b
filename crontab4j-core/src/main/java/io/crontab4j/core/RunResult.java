package io.crontab4j.core;

/**
 * Outcome of a manual run request.
 *
 * ran    : whether the payload was executed
 * reason : why it was not executed ("already-running", "not-due"), null when it ran
 */
public record RunResult(
        boolean ran,
        String reason
) {
    public static final String ALREADY_RUNNING = "already-running";
    public static final String NOT_DUE = "not-due";

    public static RunResult ranResult() {
        return new RunResult(true, null);
    }

    public static RunResult notRun(String reason) {
        return new RunResult(false, reason);
    }
}
