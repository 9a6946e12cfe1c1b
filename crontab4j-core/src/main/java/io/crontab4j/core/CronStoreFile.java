package io.crontab4j.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The persisted store document: {@code {"version": 1, "jobs": [...]}}.
 */
public class CronStoreFile {

    public static final int CURRENT_VERSION = 1;

    private int version = CURRENT_VERSION;
    private List<CronJob> jobs = new ArrayList<>();

    public CronStoreFile() {
    }

    public CronStoreFile(List<CronJob> jobs) {
        this.jobs = new ArrayList<>(jobs);
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public List<CronJob> getJobs() {
        return jobs;
    }

    public void setJobs(List<CronJob> jobs) {
        this.jobs = jobs == null ? new ArrayList<>() : new ArrayList<>(jobs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronStoreFile that)) return false;
        return version == that.version && Objects.equals(jobs, that.jobs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, jobs);
    }
}
