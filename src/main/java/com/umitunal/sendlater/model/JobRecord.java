package com.umitunal.sendlater.model;

import com.umitunal.sendlater.core.ScheduledJob;
import com.umitunal.sendlater.serialization.PayloadCodec;

import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Concrete scheduled job with its mutable lifecycle state.
 *
 * @param <T> the type of the job payload
 */
public class JobRecord<T> implements ScheduledJob<T> {
    private final String id;
    private final String ownerId;
    private final T payload;
    private final long triggerTime;
    private final long misfireGrace;

    private State state;
    private long createdAt;
    private long lastModified;
    private String failureReason;
    private long version;  // For optimistic locking

    public JobRecord(String id, String ownerId, T payload, long triggerTime, long misfireGrace, long createdAt) {
        this.id = id;
        this.ownerId = ownerId;
        this.payload = payload;
        this.triggerTime = triggerTime;
        this.misfireGrace = misfireGrace;
        this.state = State.SCHEDULED;
        this.createdAt = createdAt;
        this.lastModified = createdAt;
        this.version = 0;
    }

    /**
     * Copy any job into a record the store can mutate.
     */
    public static <T> JobRecord<T> copyOf(ScheduledJob<T> job) {
        if (job instanceof JobRecord) {
            return (JobRecord<T>) job;
        }
        JobRecord<T> copy = new JobRecord<>(job.getId(), job.getOwnerId(), job.getPayload(),
                job.getTriggerTime(), job.getMisfireGrace(), job.getLastModified());
        copy.setState(job.getState());
        copy.setFailureReason(job.getFailureReason());
        return copy;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getOwnerId() {
        return ownerId;
    }

    @Override
    public T getPayload() {
        return payload;
    }

    @Override
    public long getTriggerTime() {
        return triggerTime;
    }

    @Override
    public long getMisfireGrace() {
        return misfireGrace;
    }

    @Override
    public State getState() {
        return state;
    }

    @Override
    public String getFailureReason() {
        return failureReason;
    }

    @Override
    public long getLastModified() {
        return lastModified;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getVersion() {
        return version;
    }

    // Package-private setters for deserialization
    void setState(State state) {
        this.state = state;
    }

    void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    void setLastModified(long lastModified) {
        this.lastModified = lastModified;
    }

    void setFailureReason(String failureReason) {
        this.failureReason = failureReason;
    }

    void setVersion(long version) {
        this.version = version;
    }

    /**
     * Apply a state change. Legality is checked by the store, not here.
     */
    public void moveTo(State next, String reason, long nowMillis) {
        this.state = next;
        this.failureReason = next == State.FAILED ? reason : null;
        this.lastModified = nowMillis;
        this.version++;  // Increment version on state change
    }

    @Override
    public String toString() {
        return String.format("JobRecord{id='%s', owner='%s', state=%s, trigger=%d, grace=%d, version=%d}",
                id, ownerId, state, triggerTime, misfireGrace, version);
    }

    /**
     * Serialize to bytes for storage.
     *
     * @param codec the payload codec to use
     * @return byte array representation
     */
    public byte[] serialize(PayloadCodec<T> codec) {
        return new JobRecordSerializer<>(codec).serialize(this);
    }

    /**
     * Deserialize from bytes.
     *
     * @param bytes the byte array to deserialize
     * @param codec the payload codec to use
     * @return reconstructed record
     */
    public static <T> JobRecord<T> deserialize(byte[] bytes, PayloadCodec<T> codec) {
        return new JobRecordSerializer<>(codec).deserialize(bytes);
    }

    /**
     * Key of the trigger-time index.
     * Format: [triggerTime(8 bytes)][jobId bytes]
     * Big-endian time gives natural time ordering, the id breaks ties.
     */
    public static byte[] createTriggerKey(long triggerTime, String jobId) {
        byte[] jobIdBytes = jobId.getBytes(UTF_8);
        ByteBuffer buffer = ByteBuffer.allocate(8 + jobIdBytes.length);
        buffer.putLong(triggerTime);
        buffer.put(jobIdBytes);
        return buffer.array();
    }

    /**
     * Read the job id back out of a trigger index key.
     */
    public static String jobIdFromTriggerKey(byte[] key) {
        return new String(key, 8, key.length - 8, UTF_8);
    }

    /**
     * Key of the owner index.
     * Format: [ownerId length(4 bytes)][ownerId bytes][jobId bytes]
     * The length prefix keeps one owner's prefix from matching another owner's.
     */
    public static byte[] createOwnerKey(String ownerId, String jobId) {
        byte[] prefix = createOwnerPrefix(ownerId);
        byte[] jobIdBytes = jobId.getBytes(UTF_8);
        return ByteBuffer.allocate(prefix.length + jobIdBytes.length)
                .put(prefix)
                .put(jobIdBytes)
                .array();
    }

    public static byte[] createOwnerPrefix(String ownerId) {
        byte[] ownerBytes = ownerId.getBytes(UTF_8);
        return ByteBuffer.allocate(4 + ownerBytes.length)
                .putInt(ownerBytes.length)
                .put(ownerBytes)
                .array();
    }

    public static String jobIdFromOwnerKey(byte[] key, int prefixLength) {
        return new String(key, prefixLength, key.length - prefixLength, UTF_8);
    }
}
