package io.crontab4j.core;

import java.util.NoSuchElementException;

public class CronJobNotFoundException extends NoSuchElementException {

    private final String jobId;

    public CronJobNotFoundException(String jobId) {
        super("Unknown cron job id: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
