package io.crontab4j.core;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CronEventAction {
    ADDED,
    UPDATED,
    REMOVED,
    STARTED,
    FINISHED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
