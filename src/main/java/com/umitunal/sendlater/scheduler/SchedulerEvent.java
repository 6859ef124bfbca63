package com.umitunal.sendlater.scheduler;

import java.time.Instant;

/**
 * A lifecycle change of one job, published after it is persisted.
 */
public final class SchedulerEvent {

    public enum Type {
        SUBMITTED,
        STARTED,
        SUCCEEDED,
        FAILED,
        MISSED,
        CANCELLED
    }

    private final Type type;
    private final String jobId;
    private final String ownerId;
    private final String detail;
    private final Instant timestamp;

    public SchedulerEvent(Type type, String jobId, String ownerId, String detail, Instant timestamp) {
        this.type = type;
        this.jobId = jobId;
        this.ownerId = ownerId;
        this.detail = detail;
        this.timestamp = timestamp;
    }

    public Type getType() { return type; }
    public String getJobId() { return jobId; }
    public String getOwnerId() { return ownerId; }
    public String getDetail() { return detail; }
    public Instant getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return "SchedulerEvent{type=" + type + ", jobId=" + jobId + ", ownerId=" + ownerId
                + (detail != null ? ", detail=" + detail : "") + "}";
    }
}
