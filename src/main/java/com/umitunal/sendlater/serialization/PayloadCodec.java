package com.umitunal.sendlater.serialization;

/**
 * Encodes and decodes job payloads for storage.
 *
 * @param <T> the type of payload
 */
public interface PayloadCodec<T> {

    /**
     * Encode a payload to bytes.
     *
     * @throws CodecException if the payload cannot be encoded
     */
    byte[] encode(T payload);

    /**
     * Decode bytes to a payload.
     *
     * @throws CodecException if the bytes are not a valid encoding
     */
    T decode(byte[] bytes);

    /**
     * Pick a codec by its configured name, {@code json} or {@code kryo}.
     */
    static <T> PayloadCodec<T> named(String name, Class<T> type) {
        return switch (name.trim().toLowerCase()) {
            case "json" -> new JsonCodec<>(type);
            case "kryo" -> new KryoCodec<>(type);
            default -> throw new IllegalArgumentException("Unknown payload codec: " + name);
        };
    }
}
