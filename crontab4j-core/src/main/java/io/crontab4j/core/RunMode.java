package io.crontab4j.core;

public enum RunMode {
    /**
     * Run only if the job's next run time has arrived.
     */
    DUE,
    /**
     * Run regardless of the next run time.
     */
    FORCE
}
