package com.umitunal.sendlater.scheduler;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.umitunal.sendlater.core.ScheduledJob;

import java.util.Objects;

/**
 * Listing view of one job.
 */
public class JobSummary {
    private final String jobId;
    private final String recipientId;
    private final String messagePreview;
    private final String nextRunTime;
    private final ScheduledJob.State status;

    @JsonCreator
    public JobSummary(@JsonProperty("job_id") String jobId,
                      @JsonProperty("recipient_id") String recipientId,
                      @JsonProperty("message_preview") String messagePreview,
                      @JsonProperty("next_run_time_iso") String nextRunTime,
                      @JsonProperty("status") ScheduledJob.State status) {
        this.jobId = jobId;
        this.recipientId = recipientId;
        this.messagePreview = messagePreview;
        this.nextRunTime = nextRunTime;
        this.status = status;
    }

    @JsonProperty("job_id")
    public String getJobId() { return jobId; }

    @JsonProperty("recipient_id")
    public String getRecipientId() { return recipientId; }

    @JsonProperty("message_preview")
    public String getMessagePreview() { return messagePreview; }

    /**
     * ISO-8601 UTC fire time, null once the job is terminal.
     */
    @JsonProperty("next_run_time_iso")
    public String getNextRunTime() { return nextRunTime; }

    @JsonProperty("status")
    public ScheduledJob.State getStatus() { return status; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobSummary)) return false;
        JobSummary that = (JobSummary) o;
        return jobId.equals(that.jobId) && Objects.equals(recipientId, that.recipientId)
                && Objects.equals(messagePreview, that.messagePreview)
                && Objects.equals(nextRunTime, that.nextRunTime) && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId, recipientId, messagePreview, nextRunTime, status);
    }

    @Override
    public String toString() {
        return "JobSummary{jobId=" + jobId + ", recipientId=" + recipientId
                + ", nextRunTime=" + nextRunTime + ", status=" + status + "}";
    }
}
