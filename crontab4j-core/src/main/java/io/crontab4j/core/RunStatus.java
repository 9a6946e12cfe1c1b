package io.crontab4j.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RunStatus {
    OK,
    ERROR,
    /**
     * The referenced handler could not be resolved. Not counted as a failure.
     */
    SKIPPED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RunStatus fromWireName(String value) {
        if (value == null) {
            return null;
        }
        return RunStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
