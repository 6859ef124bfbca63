package com.umitunal.sendlater.core;

/**
 * Thrown when a state change is not allowed from the job's current state,
 * including when a concurrent caller already moved the job.
 */
public class InvalidTransitionException extends JobStoreException {
    private final ScheduledJob.State from;
    private final ScheduledJob.State to;

    public InvalidTransitionException(String jobId, ScheduledJob.State from, ScheduledJob.State to) {
        super("Job " + jobId + " cannot move from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }

    public ScheduledJob.State getFrom() { return from; }
    public ScheduledJob.State getTo() { return to; }
}
