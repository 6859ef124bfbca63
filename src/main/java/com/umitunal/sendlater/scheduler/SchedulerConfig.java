package com.umitunal.sendlater.scheduler;

import java.time.Duration;

/**
 * Configuration of the delivery scheduler.
 */
public class SchedulerConfig {
    private final int maxConcurrency;
    private final Duration minLeadTime;
    private final Duration misfireGrace;
    private final int maxMessageLength;
    private final int previewLength;
    private final Duration terminalRetention;
    private final Duration retentionSweepInterval;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Duration shutdownTimeout;

    private SchedulerConfig(Builder builder) {
        this.maxConcurrency = builder.maxConcurrency;
        this.minLeadTime = builder.minLeadTime;
        this.misfireGrace = builder.misfireGrace;
        this.maxMessageLength = builder.maxMessageLength;
        this.previewLength = builder.previewLength;
        this.terminalRetention = builder.terminalRetention;
        this.retentionSweepInterval = builder.retentionSweepInterval;
        this.initialBackoff = builder.initialBackoff;
        this.maxBackoff = builder.maxBackoff;
        this.shutdownTimeout = builder.shutdownTimeout;
    }

    public int getMaxConcurrency() { return maxConcurrency; }
    public Duration getMinLeadTime() { return minLeadTime; }
    public Duration getMisfireGrace() { return misfireGrace; }
    public int getMaxMessageLength() { return maxMessageLength; }
    public int getPreviewLength() { return previewLength; }
    public Duration getTerminalRetention() { return terminalRetention; }
    public Duration getRetentionSweepInterval() { return retentionSweepInterval; }
    public Duration getInitialBackoff() { return initialBackoff; }
    public Duration getMaxBackoff() { return maxBackoff; }
    public Duration getShutdownTimeout() { return shutdownTimeout; }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private int maxConcurrency = 3;
        private Duration minLeadTime = Duration.ofSeconds(2);
        private Duration misfireGrace = Duration.ofSeconds(60);
        private int maxMessageLength = 4096;
        private int previewLength = 50;
        private Duration terminalRetention = Duration.ofDays(7);
        private Duration retentionSweepInterval = Duration.ofHours(1);
        private Duration initialBackoff = Duration.ofMillis(500);
        private Duration maxBackoff = Duration.ofSeconds(30);
        private Duration shutdownTimeout = Duration.ofSeconds(20);

        private Builder() {
        }

        /**
         * Maximum number of deliveries executing at once.
         * Default: 3
         */
        public Builder withMaxConcurrency(int max) {
            this.maxConcurrency = max;
            return this;
        }

        /**
         * How far in the future a trigger time must be at submission.
         * Default: 2 seconds
         */
        public Builder withMinLeadTime(Duration lead) {
            this.minLeadTime = lead;
            return this;
        }

        /**
         * How late a job may still fire; later jobs become MISSED.
         * Default: 60 seconds
         */
        public Builder withMisfireGrace(Duration grace) {
            this.misfireGrace = grace;
            return this;
        }

        /**
         * Default: 4096 characters
         */
        public Builder withMaxMessageLength(int length) {
            this.maxMessageLength = length;
            return this;
        }

        /**
         * Default: 50 characters
         */
        public Builder withPreviewLength(int length) {
            this.previewLength = length;
            return this;
        }

        /**
         * How long finished jobs stay listable.
         * Default: 7 days
         */
        public Builder withTerminalRetention(Duration retention) {
            this.terminalRetention = retention;
            return this;
        }

        /**
         * Default: 1 hour
         */
        public Builder withRetentionSweepInterval(Duration interval) {
            this.retentionSweepInterval = interval;
            return this;
        }

        /**
         * Backoff of the dispatch loop after a store failure, doubled up to the maximum.
         * Default: 500 ms to 30 seconds
         */
        public Builder withBackoff(Duration initial, Duration max) {
            this.initialBackoff = initial;
            this.maxBackoff = max;
            return this;
        }

        /**
         * How long close() waits for running deliveries.
         * Default: 20 seconds
         */
        public Builder withShutdownTimeout(Duration timeout) {
            this.shutdownTimeout = timeout;
            return this;
        }

        public SchedulerConfig build() {
            if (maxConcurrency < 1) {
                throw new IllegalArgumentException("maxConcurrency must be at least 1");
            }
            if (minLeadTime.isNegative() || misfireGrace.isNegative()) {
                throw new IllegalArgumentException("minLeadTime and misfireGrace must not be negative");
            }
            if (maxMessageLength < 1 || previewLength < 1) {
                throw new IllegalArgumentException("message and preview lengths must be positive");
            }
            if (initialBackoff.isZero() || initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0) {
                throw new IllegalArgumentException("backoff must be positive and max >= initial");
            }
            return new SchedulerConfig(this);
        }
    }
}
