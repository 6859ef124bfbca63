package com.umitunal.sendlater.core;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for scheduled jobs, independent of any in-memory timeline.
 * Every mutating call is persisted before it returns.
 *
 * @param <T> the type of job payload
 */
public interface JobStore<T> extends AutoCloseable {

    /**
     * Insert a new job record.
     *
     * @throws DuplicateJobException if the id is present or was used before
     */
    void put(ScheduledJob<T> job) throws JobStoreException;

    /**
     * Look up a job by id.
     */
    Optional<ScheduledJob<T>> find(String jobId) throws JobStoreException;

    /**
     * Look up a job by id.
     *
     * @throws JobNotFoundException if no such job exists
     */
    default ScheduledJob<T> get(String jobId) throws JobStoreException {
        return find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * Atomically move a job to a new state.
     * Rewriting the current terminal state again is a no-op.
     *
     * @param jobId the job to update
     * @param newState target state
     * @param reason failure reason, recorded for FAILED jobs; may be null
     * @return the job as stored after the update
     * @throws JobNotFoundException if no such job exists
     * @throws InvalidTransitionException if the current state does not allow the move
     */
    ScheduledJob<T> updateState(String jobId, ScheduledJob.State newState, String reason) throws JobStoreException;

    /**
     * All jobs of one owner, in a stable order.
     */
    List<ScheduledJob<T>> listByOwner(String ownerId) throws JobStoreException;

    /**
     * Delete a job. Removing an unknown id is not an error.
     * A removed id is never accepted by {@link #put} again.
     */
    void remove(String jobId) throws JobStoreException;

    /**
     * Called once at startup. Jobs left RUNNING by a previous process are moved back to
     * SCHEDULED while their grace window is open, otherwise to MISSED.
     *
     * @param nowMillis the recovery instant
     * @return every SCHEDULED job, ordered by trigger time then id
     */
    List<ScheduledJob<T>> loadAllPending(long nowMillis) throws JobStoreException;

    /**
     * Remove terminal jobs last modified before the cutoff.
     *
     * @return number of jobs removed
     */
    long purgeTerminalBefore(long cutoffMillis) throws JobStoreException;

    /**
     * Get statistics about stored jobs.
     */
    StoreMetrics getMetrics() throws JobStoreException;

    @Override
    void close();
}
