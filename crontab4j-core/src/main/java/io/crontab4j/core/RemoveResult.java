package io.crontab4j.core;

public record RemoveResult(boolean removed) {

    public static RemoveResult removedResult() {
        return new RemoveResult(true);
    }

    public static RemoveResult notFound() {
        return new RemoveResult(false);
    }
}
