package com.umitunal.sendlater.model;

import com.umitunal.sendlater.core.ScheduledJob;
import com.umitunal.sendlater.serialization.PayloadCodec;

import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * ByteBuffer serializer for JobRecord.
 *
 * Binary format:
 * - format version (1 byte)
 * - id length (4 bytes) + id bytes (UTF-8)
 * - ownerId length (4 bytes) + ownerId bytes (UTF-8)
 * - payload length (4 bytes) + payload bytes
 * - triggerTime (8 bytes)
 * - misfireGrace (8 bytes)
 * - state ordinal (4 bytes)
 * - createdAt (8 bytes)
 * - lastModified (8 bytes)
 * - failureReason length (4 bytes, -1 for null) + reason bytes (UTF-8)
 * - version (8 bytes)
 *
 * @param <T> the type of job payload
 */
public class JobRecordSerializer<T> {

    static final byte FORMAT_VERSION = 1;

    private final PayloadCodec<T> payloadCodec;

    public JobRecordSerializer(PayloadCodec<T> payloadCodec) {
        this.payloadCodec = payloadCodec;
    }

    public byte[] serialize(JobRecord<T> record) {
        byte[] idBytes = record.getId().getBytes(UTF_8);
        byte[] ownerBytes = record.getOwnerId().getBytes(UTF_8);
        byte[] payloadBytes = payloadCodec.encode(record.getPayload());
        byte[] reasonBytes = record.getFailureReason() != null
            ? record.getFailureReason().getBytes(UTF_8)
            : null;

        int totalSize = 1 +                                            // format version
                       4 + idBytes.length +                           // id
                       4 + ownerBytes.length +                        // ownerId
                       4 + payloadBytes.length +                      // payload
                       8 +                                            // triggerTime
                       8 +                                            // misfireGrace
                       4 +                                            // state ordinal
                       8 +                                            // createdAt
                       8 +                                            // lastModified
                       4 + (reasonBytes != null ? reasonBytes.length : 0) +  // failureReason
                       8;                                             // version

        ByteBuffer buffer = ByteBuffer.allocate(totalSize);
        buffer.put(FORMAT_VERSION);

        buffer.putInt(idBytes.length);
        buffer.put(idBytes);

        buffer.putInt(ownerBytes.length);
        buffer.put(ownerBytes);

        buffer.putInt(payloadBytes.length);
        buffer.put(payloadBytes);

        buffer.putLong(record.getTriggerTime());
        buffer.putLong(record.getMisfireGrace());
        buffer.putInt(record.getState().ordinal());
        buffer.putLong(record.getCreatedAt());
        buffer.putLong(record.getLastModified());

        if (reasonBytes == null) {
            buffer.putInt(-1);
        } else {
            buffer.putInt(reasonBytes.length);
            buffer.put(reasonBytes);
        }

        buffer.putLong(record.getVersion());

        return buffer.array();
    }

    public JobRecord<T> deserialize(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);

        byte format = buffer.get();
        if (format != FORMAT_VERSION) {
            throw new IllegalArgumentException("Unsupported job record format: " + format);
        }

        String id = readString(buffer);
        String ownerId = readString(buffer);

        int payloadLength = buffer.getInt();
        byte[] payloadBytes = new byte[payloadLength];
        buffer.get(payloadBytes);
        T payload = payloadCodec.decode(payloadBytes);

        long triggerTime = buffer.getLong();
        long misfireGrace = buffer.getLong();
        ScheduledJob.State state = ScheduledJob.State.values()[buffer.getInt()];
        long createdAt = buffer.getLong();

        JobRecord<T> record = new JobRecord<>(id, ownerId, payload, triggerTime, misfireGrace, createdAt);
        record.setState(state);
        record.setLastModified(buffer.getLong());

        int reasonLength = buffer.getInt();
        if (reasonLength >= 0) {
            byte[] reasonBytes = new byte[reasonLength];
            buffer.get(reasonBytes);
            record.setFailureReason(new String(reasonBytes, UTF_8));
        }

        record.setVersion(buffer.getLong());
        return record;
    }

    private static String readString(ByteBuffer buffer) {
        int length = buffer.getInt();
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return new String(bytes, UTF_8);
    }
}
