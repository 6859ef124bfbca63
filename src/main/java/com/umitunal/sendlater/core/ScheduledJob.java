package com.umitunal.sendlater.core;

import java.util.EnumSet;
import java.util.Set;

/**
 * A one-shot unit of work that fires once at or after its trigger time.
 *
 * @param <T> the type of the job payload
 */
public interface ScheduledJob<T> {

    /**
     * Gets the unique identifier for this job.
     */
    String getId();

    /**
     * Gets the account that owns this job.
     */
    String getOwnerId();

    /**
     * Gets the job payload data.
     */
    T getPayload();

    /**
     * Gets the earliest execution time in milliseconds since epoch.
     */
    long getTriggerTime();

    /**
     * Gets how long after the trigger time a late fire is still honored, in milliseconds.
     */
    long getMisfireGrace();

    /**
     * Gets the current lifecycle state.
     */
    State getState();

    /**
     * Gets the failure reason of a failed job, or null.
     */
    String getFailureReason();

    /**
     * Gets the time of the last state change in milliseconds since epoch.
     */
    long getLastModified();

    /**
     * Checks whether the trigger time plus grace has elapsed at the given instant.
     */
    default boolean isMisfired(long nowMillis) {
        return nowMillis > getTriggerTime() + getMisfireGrace();
    }

    /**
     * Lifecycle states of a scheduled job.
     */
    enum State {
        SCHEDULED,   // Waiting for its trigger time
        RUNNING,     // Executor invoked
        SUCCEEDED,   // Delivered
        FAILED,      // Executor reported failure
        CANCELLED,   // Cancelled by its owner before firing
        MISSED;      // Grace window elapsed before the job could fire

        public boolean isTerminal() {
            return this != SCHEDULED && this != RUNNING;
        }

        public boolean canTransitionTo(State next) {
            return allowedTransitions().contains(next);
        }

        private Set<State> allowedTransitions() {
            return switch (this) {
                case SCHEDULED -> EnumSet.of(RUNNING, CANCELLED, MISSED);
                case RUNNING -> EnumSet.of(SUCCEEDED, FAILED);
                default -> EnumSet.noneOf(State.class);
            };
        }
    }
}
