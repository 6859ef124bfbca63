package com.umitunal.sendlater.scheduler;

import com.umitunal.sendlater.model.DeliveryPayload;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

import static com.umitunal.sendlater.scheduler.ScheduleValidationException.Reason;

/**
 * Checks submissions against the scheduler's limits.
 */
class SubmissionValidator {
    private static final Pattern RECIPIENT = Pattern.compile("-?\\d+");

    private final SchedulerConfig config;

    SubmissionValidator(SchedulerConfig config) {
        this.config = config;
    }

    /**
     * Parse an ISO-8601 date-time. A missing offset is rejected rather than read as local time.
     */
    long parseTriggerTime(String isoTime) {
        if (isoTime == null || isoTime.isBlank()) {
            throw new ScheduleValidationException(Reason.MALFORMED_TIME, "Trigger time is required");
        }
        try {
            return OffsetDateTime.parse(isoTime.trim()).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            throw new ScheduleValidationException(Reason.MALFORMED_TIME,
                    "Trigger time must be ISO-8601 with an offset, got '" + isoTime + "'", e);
        }
    }

    void validate(String ownerId, long triggerTime, DeliveryPayload payload, long nowMillis) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId is required");
        }
        if (triggerTime <= nowMillis + config.getMinLeadTime().toMillis()) {
            throw new ScheduleValidationException(Reason.INVALID_TIME,
                    "Scheduled time must be at least " + config.getMinLeadTime().toSeconds()
                            + " seconds in the future");
        }
        if (payload == null || payload.getRecipientId() == null
                || !RECIPIENT.matcher(payload.getRecipientId()).matches()) {
            throw new ScheduleValidationException(Reason.INVALID_RECIPIENT, "Recipient id must be an integer");
        }
        String message = payload.getMessage();
        if (message == null || message.isEmpty()) {
            throw new ScheduleValidationException(Reason.EMPTY_PAYLOAD, "Message must not be empty");
        }
        if (message.codePointCount(0, message.length()) > config.getMaxMessageLength()) {
            throw new ScheduleValidationException(Reason.PAYLOAD_TOO_LARGE,
                    "Message exceeds " + config.getMaxMessageLength() + " characters");
        }
    }
}
