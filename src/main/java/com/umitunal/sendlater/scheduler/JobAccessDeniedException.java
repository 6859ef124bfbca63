package com.umitunal.sendlater.scheduler;

/**
 * The caller tried to act on a job owned by another account.
 */
public class JobAccessDeniedException extends RuntimeException {
    private final String jobId;

    public JobAccessDeniedException(String jobId) {
        super("Job " + jobId + " belongs to another account");
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
