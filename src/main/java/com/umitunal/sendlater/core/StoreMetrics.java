package com.umitunal.sendlater.core;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-state job counts for monitoring.
 */
public class StoreMetrics {
    private final long totalJobs;
    private final Map<ScheduledJob.State, Long> byState;

    public StoreMetrics(Map<ScheduledJob.State, Long> byState) {
        EnumMap<ScheduledJob.State, Long> counts = new EnumMap<>(ScheduledJob.State.class);
        for (ScheduledJob.State state : ScheduledJob.State.values()) {
            counts.put(state, byState.getOrDefault(state, 0L));
        }
        this.byState = counts;
        this.totalJobs = counts.values().stream().mapToLong(Long::longValue).sum();
    }

    public long getTotalJobs() { return totalJobs; }
    public long getScheduledJobs() { return count(ScheduledJob.State.SCHEDULED); }
    public long getRunningJobs() { return count(ScheduledJob.State.RUNNING); }
    public long getSucceededJobs() { return count(ScheduledJob.State.SUCCEEDED); }
    public long getFailedJobs() { return count(ScheduledJob.State.FAILED); }
    public long getCancelledJobs() { return count(ScheduledJob.State.CANCELLED); }
    public long getMissedJobs() { return count(ScheduledJob.State.MISSED); }

    public long count(ScheduledJob.State state) {
        return byState.get(state);
    }

    @Override
    public String toString() {
        return String.format(
            "StoreMetrics{total=%d, scheduled=%d, running=%d, succeeded=%d, failed=%d, cancelled=%d, missed=%d}",
            totalJobs, getScheduledJobs(), getRunningJobs(), getSucceededJobs(),
            getFailedJobs(), getCancelledJobs(), getMissedJobs()
        );
    }
}
