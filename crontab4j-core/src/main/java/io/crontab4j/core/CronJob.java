package io.crontab4j.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted job model.
 *
 * <p>{@code state.nextRunAt} is a cache derived from {@code (schedule, state, now)}; it can be
 * recomputed from the other fields at any time.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CronJob {

    private String id;
    private String name;
    private String description;
    private boolean enabled;
    private Boolean deleteAfterRun;
    private Instant createdAt;
    private Instant updatedAt;
    private CronSchedule schedule;
    private CronPayload payload;
    private JobState state = new JobState();

    public CronJob() {
    }

    /**
     * Detached deep copy. Schedule and payload are immutable records and are shared.
     */
    public CronJob copy() {
        CronJob c = new CronJob();
        c.id = id;
        c.name = name;
        c.description = description;
        c.enabled = enabled;
        c.deleteAfterRun = deleteAfterRun;
        c.createdAt = createdAt;
        c.updatedAt = updatedAt;
        c.schedule = schedule;
        c.payload = payload;
        c.state = state == null ? new JobState() : state.copy();
        return c;
    }

    public boolean deletesAfterRun() {
        return Boolean.TRUE.equals(deleteAfterRun);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Boolean getDeleteAfterRun() {
        return deleteAfterRun;
    }

    public void setDeleteAfterRun(Boolean deleteAfterRun) {
        this.deleteAfterRun = deleteAfterRun;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public CronSchedule getSchedule() {
        return schedule;
    }

    public void setSchedule(CronSchedule schedule) {
        this.schedule = schedule;
    }

    public CronPayload getPayload() {
        return payload;
    }

    public void setPayload(CronPayload payload) {
        this.payload = payload;
    }

    public JobState getState() {
        return state;
    }

    public void setState(JobState state) {
        this.state = state;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronJob that)) return false;
        return enabled == that.enabled
                && Objects.equals(id, that.id)
                && Objects.equals(name, that.name)
                && Objects.equals(description, that.description)
                && Objects.equals(deleteAfterRun, that.deleteAfterRun)
                && Objects.equals(createdAt, that.createdAt)
                && Objects.equals(updatedAt, that.updatedAt)
                && Objects.equals(schedule, that.schedule)
                && Objects.equals(payload, that.payload)
                && Objects.equals(state, that.state);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, description, enabled, deleteAfterRun, createdAt, updatedAt, schedule, payload, state);
    }

    @Override
    public String toString() {
        return "CronJob{id='" + id + "', name='" + name + "', enabled=" + enabled
                + ", schedule=" + schedule + ", state=" + state + '}';
    }
}
