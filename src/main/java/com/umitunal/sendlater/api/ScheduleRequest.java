package com.umitunal.sendlater.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A delivery to schedule. {@code scheduledAt} is ISO-8601 with an offset, e.g. {@code 2025-01-01T10:00:00.000Z}.
 */
public class ScheduleRequest {
    private final String recipientId;
    private final String message;
    private final String scheduledAt;

    @JsonCreator
    public ScheduleRequest(@JsonProperty("recipient_id") String recipientId,
                           @JsonProperty("message") String message,
                           @JsonProperty("scheduled_at") String scheduledAt) {
        this.recipientId = recipientId;
        this.message = message;
        this.scheduledAt = scheduledAt;
    }

    @JsonProperty("recipient_id")
    public String getRecipientId() { return recipientId; }

    @JsonProperty("message")
    public String getMessage() { return message; }

    @JsonProperty("scheduled_at")
    public String getScheduledAt() { return scheduledAt; }
}
