package com.umitunal.sendlater.scheduler;

import com.umitunal.sendlater.core.ScheduledJob;
import com.umitunal.sendlater.model.DeliveryPayload;

/**
 * The work run when a job fires.
 * Implementations report failures through the result instead of throwing.
 */
@FunctionalInterface
public interface JobExecutor {

    /**
     * Execute a job that has just moved to RUNNING.
     *
     * @param job the job to execute
     * @return exactly one outcome
     */
    ExecutionResult execute(ScheduledJob<DeliveryPayload> job);

    /**
     * Outcome of one execution.
     */
    class ExecutionResult {

        public enum FailureReason {
            CREDENTIAL_UNAVAILABLE,
            DELIVERY_REJECTED,
            DELIVERY_TRANSPORT_FAILURE,
            EXECUTOR_ERROR
        }

        private final boolean success;
        private final FailureReason failureReason;
        private final String message;

        private ExecutionResult(boolean success, FailureReason failureReason, String message) {
            this.success = success;
            this.failureReason = failureReason;
            this.message = message;
        }

        public boolean isSuccess() { return success; }
        public FailureReason getFailureReason() { return failureReason; }
        public String getMessage() { return message; }

        /**
         * Reason text stored on the failed job, e.g. {@code DELIVERY_REJECTED: VK Error 901: ...}.
         */
        public String describe() {
            if (success) {
                return message;
            }
            return message == null ? failureReason.name() : failureReason.name() + ": " + message;
        }

        public static ExecutionResult success(String message) {
            return new ExecutionResult(true, null, message);
        }

        public static ExecutionResult failure(FailureReason reason, String message) {
            return new ExecutionResult(false, reason, message);
        }

        @Override
        public String toString() {
            return success ? "Success(" + message + ")" : "Failure(" + describe() + ")";
        }
    }
}
