package com.umitunal.sendlater.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class ScheduleResponse {
    public static final String ACCEPTED_MESSAGE = "Task scheduled successfully";

    private final String jobId;
    private final String message;

    public ScheduleResponse(String jobId) {
        this(jobId, ACCEPTED_MESSAGE);
    }

    @JsonCreator
    public ScheduleResponse(@JsonProperty("job_id") String jobId, @JsonProperty("message") String message) {
        this.jobId = jobId;
        this.message = message;
    }

    @JsonProperty("job_id")
    public String getJobId() { return jobId; }

    @JsonProperty("message")
    public String getMessage() { return message; }
}
