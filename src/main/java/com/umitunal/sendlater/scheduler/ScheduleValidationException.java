package com.umitunal.sendlater.scheduler;

/**
 * A submission was rejected before anything was persisted.
 */
public class ScheduleValidationException extends RuntimeException {

    public enum Reason {
        INVALID_TIME,       // Not far enough in the future
        MALFORMED_TIME,     // Not ISO-8601 with an explicit offset
        INVALID_RECIPIENT,
        EMPTY_PAYLOAD,
        PAYLOAD_TOO_LARGE
    }

    private final Reason reason;

    public ScheduleValidationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ScheduleValidationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
