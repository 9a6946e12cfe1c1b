package io.crontab4j;

import io.crontab4j.core.CronEvent;

@FunctionalInterface
public interface CronEventListener {
    void onEvent(CronEvent event);

    static CronEventListener noop() {
        return event -> {
        };
    }
}
