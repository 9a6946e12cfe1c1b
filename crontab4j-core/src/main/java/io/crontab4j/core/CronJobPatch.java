package io.crontab4j.core;

/**
 * Partial update of a job.
 *
 * <p>Only fields set on the builder are applied. {@code description} tracks presence separately so
 * that an explicit null clears it.
 */
public final class CronJobPatch {

    private final String name;
    private final boolean hasDescription;
    private final String description;
    private final Boolean enabled;
    private final Boolean deleteAfterRun;
    private final CronSchedule schedule;
    private final CronPayloadPatch payload;

    private CronJobPatch(Builder b) {
        this.name = b.name;
        this.hasDescription = b.hasDescription;
        this.description = b.description;
        this.enabled = b.enabled;
        this.deleteAfterRun = b.deleteAfterRun;
        this.schedule = b.schedule;
        this.payload = b.payload;
    }

    public String name() {
        return name;
    }

    public boolean hasDescription() {
        return hasDescription;
    }

    public String description() {
        return description;
    }

    public Boolean enabled() {
        return enabled;
    }

    public Boolean deleteAfterRun() {
        return deleteAfterRun;
    }

    public CronSchedule schedule() {
        return schedule;
    }

    public CronPayloadPatch payload() {
        return payload;
    }

    /**
     * True if applying this patch requires re-deriving the next run time.
     */
    public boolean touchesTiming() {
        return schedule != null || enabled != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private boolean hasDescription;
        private String description;
        private Boolean enabled;
        private Boolean deleteAfterRun;
        private CronSchedule schedule;
        private CronPayloadPatch payload;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.hasDescription = true;
            this.description = description;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder deleteAfterRun(boolean deleteAfterRun) {
            this.deleteAfterRun = deleteAfterRun;
            return this;
        }

        public Builder schedule(CronSchedule schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder payload(CronPayloadPatch payload) {
            this.payload = payload;
            return this;
        }

        public CronJobPatch build() {
            return new CronJobPatch(this);
        }
    }
}
