package com.umitunal.sendlater.scheduler;

import com.umitunal.sendlater.core.InvalidTransitionException;
import com.umitunal.sendlater.core.JobNotFoundException;
import com.umitunal.sendlater.core.JobStore;
import com.umitunal.sendlater.core.JobStoreException;
import com.umitunal.sendlater.core.ScheduledJob;
import com.umitunal.sendlater.model.DeliveryPayload;
import com.umitunal.sendlater.model.JobRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import static com.umitunal.sendlater.scheduler.JobExecutor.ExecutionResult;
import static com.umitunal.sendlater.scheduler.JobExecutor.ExecutionResult.FailureReason;

/**
 * Fires persisted one-shot deliveries at their trigger time.
 *
 * A single dispatch thread sleeps on a condition until the earliest trigger time or
 * until a submit, cancel or finished execution signals it. Due jobs are moved to
 * RUNNING in the store and handed to a fixed pool of {@code maxConcurrency} workers.
 * A job later than its misfire grace is marked MISSED without being executed.
 *
 * The store is the source of truth. The in-memory timeline only holds SCHEDULED jobs
 * and is rebuilt from the store by {@link #start()}.
 */
public class DeliveryScheduler implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DeliveryScheduler.class);

    private static final DateTimeFormatter ISO_UTC =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);
    private static final int COMPLETION_ATTEMPTS = 3;

    private final JobStore<DeliveryPayload> store;
    private final JobExecutor executor;
    private final SchedulerConfig config;
    private final Clock clock;
    private final SubmissionValidator validator;
    private final List<SchedulerListener> listeners = new CopyOnWriteArrayList<>();

    // Guards timeline, timelineIndex and inFlight
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final TreeSet<TimelineEntry> timeline = new TreeSet<>();
    private final Map<String, TimelineEntry> timelineIndex = new HashMap<>();
    private int inFlight;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private ExecutorService workers;
    private ScheduledExecutorService housekeeping;
    private Thread dispatchThread;

    public DeliveryScheduler(JobStore<DeliveryPayload> store, JobExecutor executor, SchedulerConfig config) {
        this(store, executor, config, Clock.systemUTC());
    }

    public DeliveryScheduler(JobStore<DeliveryPayload> store, JobExecutor executor,
                             SchedulerConfig config, Clock clock) {
        this.store = store;
        this.executor = executor;
        this.config = config;
        this.clock = clock;
        this.validator = new SubmissionValidator(config);
    }

    public void addListener(SchedulerListener listener) {
        listeners.add(listener);
    }

    /**
     * Recover pending jobs from the store and start dispatching.
     *
     * @throws JobStoreException if recovery cannot read the store; the scheduler stays stopped
     */
    public void start() throws JobStoreException {
        if (closed.get()) {
            throw new IllegalStateException("Scheduler has been closed");
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }

        List<ScheduledJob<DeliveryPayload>> pending;
        try {
            pending = store.loadAllPending(clock.millis());
        } catch (JobStoreException e) {
            running.set(false);
            throw e;
        }

        lock.lock();
        try {
            for (ScheduledJob<DeliveryPayload> job : pending) {
                addToTimeline(TimelineEntry.of(job));
            }
        } finally {
            lock.unlock();
        }

        workers = Executors.newFixedThreadPool(config.getMaxConcurrency(), namedThreads("delivery-worker"));
        housekeeping = Executors.newSingleThreadScheduledExecutor(namedThreads("delivery-retention"));
        long sweepMillis = config.getRetentionSweepInterval().toMillis();
        housekeeping.scheduleWithFixedDelay(this::sweepRetention, sweepMillis, sweepMillis, TimeUnit.MILLISECONDS);

        dispatchThread = new Thread(this::dispatchLoop, "delivery-dispatch");
        dispatchThread.start();

        logger.info("scheduler started recovered={} maxConcurrency={} misfireGrace={}",
                pending.size(), config.getMaxConcurrency(), config.getMisfireGrace());
    }

    /**
     * Schedule a delivery.
     *
     * @return the new job id
     * @throws ScheduleValidationException if the request is outside the accepted limits
     */
    public String submit(String ownerId, long triggerTime, DeliveryPayload payload) throws JobStoreException {
        ensureRunning();
        long now = clock.millis();
        validator.validate(ownerId, triggerTime, payload, now);

        String jobId = UUID.randomUUID().toString();
        JobRecord<DeliveryPayload> record = new JobRecord<>(jobId, ownerId, payload, triggerTime,
                config.getMisfireGrace().toMillis(), now);

        // Persist first; the job survives a crash from here on
        store.put(record);

        lock.lock();
        try {
            addToTimeline(TimelineEntry.of(record));
            changed.signalAll();
        } finally {
            lock.unlock();
        }

        logger.info("job scheduled jobId={} ownerId={} runAt={}", jobId, ownerId, ISO_UTC.format(Instant.ofEpochMilli(triggerTime)));
        publish(SchedulerEvent.Type.SUBMITTED, record, null);
        return jobId;
    }

    /**
     * Schedule a delivery from request values.
     *
     * @param isoTriggerTime ISO-8601 date-time with an explicit offset
     */
    public String submit(String ownerId, String isoTriggerTime, String recipientId, String message)
            throws JobStoreException {
        long triggerTime = validator.parseTriggerTime(isoTriggerTime);
        return submit(ownerId, triggerTime, new DeliveryPayload(recipientId, message));
    }

    /**
     * All jobs of an owner, ordered by trigger time then id.
     */
    public List<JobSummary> list(String ownerId) throws JobStoreException {
        List<ScheduledJob<DeliveryPayload>> jobs = new ArrayList<>(store.listByOwner(ownerId));
        jobs.sort(Comparator.<ScheduledJob<DeliveryPayload>>comparingLong(ScheduledJob::getTriggerTime)
                .thenComparing(ScheduledJob::getId));

        List<JobSummary> summaries = new ArrayList<>(jobs.size());
        for (ScheduledJob<DeliveryPayload> job : jobs) {
            summaries.add(toSummary(job));
        }
        return summaries;
    }

    /**
     * Cancel a job that has not fired yet.
     * Unknown ids and jobs already running or finished are left alone.
     *
     * @return true if this call cancelled the job
     * @throws JobAccessDeniedException if the job belongs to another owner
     */
    public boolean cancel(String ownerId, String jobId) throws JobStoreException {
        Optional<ScheduledJob<DeliveryPayload>> found = store.find(jobId);
        if (found.isEmpty()) {
            logger.info("cancel of unknown job ignored jobId={} ownerId={}", jobId, ownerId);
            return false;
        }
        ScheduledJob<DeliveryPayload> job = found.get();
        if (!job.getOwnerId().equals(ownerId)) {
            logger.warn("cancel denied jobId={} ownerId={} callerId={}", jobId, job.getOwnerId(), ownerId);
            throw new JobAccessDeniedException(jobId);
        }
        if (job.getState() != ScheduledJob.State.SCHEDULED) {
            return false;
        }

        ScheduledJob<DeliveryPayload> cancelled;
        try {
            cancelled = store.updateState(jobId, ScheduledJob.State.CANCELLED, null);
        } catch (InvalidTransitionException | JobNotFoundException e) {
            // Lost the race against dispatch
            logger.info("cancel lost to dispatch jobId={} error={}", jobId, e.getMessage());
            return false;
        }

        lock.lock();
        try {
            removeFromTimeline(jobId);
            changed.signalAll();
        } finally {
            lock.unlock();
        }

        publish(SchedulerEvent.Type.CANCELLED, cancelled, null);
        return true;
    }

    /**
     * Remove finished jobs older than the configured retention.
     *
     * @return number of jobs removed
     */
    public long purgeExpired() throws JobStoreException {
        long cutoff = clock.millis() - config.getTerminalRetention().toMillis();
        long removed = store.purgeTerminalBefore(cutoff);
        if (removed > 0) {
            logger.info("retention sweep removed={} cutoff={}", removed, ISO_UTC.format(Instant.ofEpochMilli(cutoff)));
        }
        return removed;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Number of SCHEDULED jobs waiting in the timeline.
     */
    public int getPendingCount() {
        lock.lock();
        try {
            return timeline.size();
        } finally {
            lock.unlock();
        }
    }

    public int getInFlightCount() {
        lock.lock();
        try {
            return inFlight;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop dispatching and wait a bounded time for running deliveries.
     * Jobs still SCHEDULED stay in the store for the next start.
     */
    @Override
    public void close() {
        closed.set(true);
        if (!running.compareAndSet(true, false)) {
            return;
        }
        logger.info("scheduler stopping");

        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }

        long timeoutMillis = config.getShutdownTimeout().toMillis();
        try {
            dispatchThread.join(timeoutMillis);
            housekeeping.shutdownNow();
            workers.shutdown();
            if (!workers.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                logger.warn("deliveries still running after {}ms, interrupting", timeoutMillis);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        logger.info("scheduler stopped");
    }

    private void dispatchLoop() {
        long backoff = config.getInitialBackoff().toMillis();
        while (running.get()) {
            try {
                Ready ready = awaitReady();
                if (ready == null) {
                    break;
                }
                if (ready.missed) {
                    markMissed(ready.entry);
                } else {
                    startExecution(ready.entry);
                }
                backoff = config.getInitialBackoff().toMillis();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (JobStoreException e) {
                logger.error("store error in dispatch, retrying in {}ms", backoff, e);
                if (!pause(backoff)) {
                    break;
                }
                backoff = Math.min(backoff * 2, config.getMaxBackoff().toMillis());
            } catch (RuntimeException e) {
                logger.error("unexpected error in dispatch, retrying in {}ms", backoff, e);
                if (!pause(backoff)) {
                    break;
                }
                backoff = Math.min(backoff * 2, config.getMaxBackoff().toMillis());
            }
        }
        logger.debug("dispatch loop exited");
    }

    /**
     * Block until the head of the timeline is due and can be handled.
     * A due job past its grace is returned as missed and needs no worker slot.
     *
     * @return the next job to handle, or null once the scheduler stops
     */
    private Ready awaitReady() throws InterruptedException {
        lock.lock();
        try {
            while (running.get()) {
                if (timeline.isEmpty()) {
                    changed.await();
                    continue;
                }
                TimelineEntry head = timeline.first();
                long now = clock.millis();
                long delay = head.triggerTime - now;
                if (delay > 0) {
                    changed.await(delay, TimeUnit.MILLISECONDS);
                    continue;
                }
                if (head.isMisfired(now)) {
                    removeFromTimeline(head.jobId);
                    return new Ready(head, true);
                }
                if (inFlight >= config.getMaxConcurrency()) {
                    // Wake at the latest when the head's grace runs out
                    changed.await(head.triggerTime + head.misfireGrace - now + 1, TimeUnit.MILLISECONDS);
                    continue;
                }
                removeFromTimeline(head.jobId);
                inFlight++;
                return new Ready(head, false);
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    private void markMissed(TimelineEntry entry) throws JobStoreException {
        long lateness = clock.millis() - entry.triggerTime;
        ScheduledJob<DeliveryPayload> missed;
        try {
            missed = store.updateState(entry.jobId, ScheduledJob.State.MISSED, null);
        } catch (InvalidTransitionException | JobNotFoundException e) {
            logger.debug("skip missed job jobId={} error={}", entry.jobId, e.getMessage());
            return;
        } catch (JobStoreException | RuntimeException e) {
            requeue(entry);
            throw e;
        }
        publish(SchedulerEvent.Type.MISSED, missed, "late by " + lateness + "ms");
    }

    private void startExecution(TimelineEntry entry) throws JobStoreException {
        ScheduledJob<DeliveryPayload> job;
        try {
            job = store.updateState(entry.jobId, ScheduledJob.State.RUNNING, null);
        } catch (InvalidTransitionException | JobNotFoundException e) {
            // Cancelled or removed after it left the timeline
            logger.debug("skip job jobId={} error={}", entry.jobId, e.getMessage());
            releaseSlot();
            return;
        } catch (JobStoreException | RuntimeException e) {
            // Back on the timeline with its slot returned; the loop backs off
            releaseSlot();
            requeue(entry);
            throw e;
        }

        publish(SchedulerEvent.Type.STARTED, job, null);
        try {
            workers.execute(() -> execute(job));
        } catch (RejectedExecutionException e) {
            // Shutting down; the RUNNING job is reclassified on the next start
            logger.warn("worker pool rejected job jobId={}", job.getId());
            releaseSlot();
        }
    }

    private void execute(ScheduledJob<DeliveryPayload> job) {
        try {
            ExecutionResult result;
            try {
                result = executor.execute(job);
                if (result == null) {
                    result = ExecutionResult.failure(FailureReason.EXECUTOR_ERROR, "Executor returned no result");
                }
            } catch (Throwable t) {
                logger.error("executor threw jobId={}", job.getId(), t);
                result = ExecutionResult.failure(FailureReason.EXECUTOR_ERROR, t.toString());
            }
            complete(job, result);
        } finally {
            releaseSlot();
        }
    }

    private void complete(ScheduledJob<DeliveryPayload> job, ExecutionResult result) {
        ScheduledJob.State target = result.isSuccess() ? ScheduledJob.State.SUCCEEDED : ScheduledJob.State.FAILED;
        String reason = result.isSuccess() ? null : result.describe();
        long backoff = config.getInitialBackoff().toMillis();

        for (int attempt = 1; attempt <= COMPLETION_ATTEMPTS; attempt++) {
            try {
                ScheduledJob<DeliveryPayload> done = store.updateState(job.getId(), target, reason);
                publish(result.isSuccess() ? SchedulerEvent.Type.SUCCEEDED : SchedulerEvent.Type.FAILED,
                        done, result.isSuccess() ? result.getMessage() : reason);
                return;
            } catch (InvalidTransitionException | JobNotFoundException e) {
                logger.error("cannot record outcome jobId={} state={} error={}", job.getId(), target, e.getMessage());
                return;
            } catch (JobStoreException e) {
                logger.error("failed to record outcome jobId={} state={} attempt={}", job.getId(), target, attempt, e);
                if (attempt == COMPLETION_ATTEMPTS || !pause(backoff)) {
                    break;
                }
                backoff = Math.min(backoff * 2, config.getMaxBackoff().toMillis());
            }
        }
        // Left RUNNING; recovery decides on the next start
        logger.error("outcome not persisted jobId={} state={}", job.getId(), target);
    }

    private JobSummary toSummary(ScheduledJob<DeliveryPayload> job) {
        DeliveryPayload payload = job.getPayload();
        String nextRunTime = job.getState().isTerminal()
                ? null
                : ISO_UTC.format(Instant.ofEpochMilli(job.getTriggerTime()));
        return new JobSummary(job.getId(), payload.getRecipientId(), preview(payload.getMessage()),
                nextRunTime, job.getState());
    }

    private String preview(String message) {
        int limit = config.getPreviewLength();
        if (message == null || message.codePointCount(0, message.length()) <= limit) {
            return message;
        }
        return message.substring(0, message.offsetByCodePoints(0, limit)) + "...";
    }

    private void sweepRetention() {
        try {
            purgeExpired();
        } catch (JobStoreException | RuntimeException e) {
            logger.error("retention sweep failed", e);
        }
    }

    private void publish(SchedulerEvent.Type type, ScheduledJob<?> job, String detail) {
        SchedulerEvent event = new SchedulerEvent(type, job.getId(), job.getOwnerId(), detail, clock.instant());
        for (SchedulerListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.warn("listener failed on {} jobId={}", type, job.getId(), e);
            }
        }
    }

    private void ensureRunning() {
        if (!running.get()) {
            throw new IllegalStateException("Scheduler is not running");
        }
    }

    private void requeue(TimelineEntry entry) {
        lock.lock();
        try {
            addToTimeline(entry);
        } finally {
            lock.unlock();
        }
    }

    private void releaseSlot() {
        lock.lock();
        try {
            inFlight--;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait on the condition so that close() can cut the pause short.
     *
     * @return false if the scheduler stopped or the thread was interrupted
     */
    private boolean pause(long millis) {
        lock.lock();
        try {
            long remaining = TimeUnit.MILLISECONDS.toNanos(millis);
            while (running.get() && remaining > 0) {
                remaining = changed.awaitNanos(remaining);
            }
            return running.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock
    private void addToTimeline(TimelineEntry entry) {
        TimelineEntry previous = timelineIndex.put(entry.jobId, entry);
        if (previous != null) {
            timeline.remove(previous);
        }
        timeline.add(entry);
    }

    // Caller holds the lock
    private void removeFromTimeline(String jobId) {
        TimelineEntry entry = timelineIndex.remove(jobId);
        if (entry != null) {
            timeline.remove(entry);
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> new Thread(runnable, prefix + "-" + counter.incrementAndGet());
    }

    private static final class Ready {
        private final TimelineEntry entry;
        private final boolean missed;

        private Ready(TimelineEntry entry, boolean missed) {
            this.entry = entry;
            this.missed = missed;
        }
    }

    /**
     * A SCHEDULED job in fire order: trigger time, then id.
     */
    private static final class TimelineEntry implements Comparable<TimelineEntry> {
        private final long triggerTime;
        private final String jobId;
        private final long misfireGrace;

        private TimelineEntry(long triggerTime, String jobId, long misfireGrace) {
            this.triggerTime = triggerTime;
            this.jobId = jobId;
            this.misfireGrace = misfireGrace;
        }

        static TimelineEntry of(ScheduledJob<?> job) {
            return new TimelineEntry(job.getTriggerTime(), job.getId(), job.getMisfireGrace());
        }

        boolean isMisfired(long nowMillis) {
            return nowMillis > triggerTime + misfireGrace;
        }

        @Override
        public int compareTo(TimelineEntry other) {
            int byTime = Long.compare(triggerTime, other.triggerTime);
            return byTime != 0 ? byTime : jobId.compareTo(other.jobId);
        }
    }
}
