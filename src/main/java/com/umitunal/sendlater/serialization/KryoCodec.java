package com.umitunal.sendlater.serialization;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

/**
 * Compact binary payload codec using Kryo.
 * Kryo instances are not thread-safe, so each thread gets its own.
 *
 * @param <T> the type to serialize
 */
public class KryoCodec<T> implements PayloadCodec<T> {
    private static final int INITIAL_BUFFER = 256;

    private final ThreadLocal<Kryo> kryoThreadLocal;
    private final Class<T> type;

    public KryoCodec(Class<T> type) {
        this.type = type;
        this.kryoThreadLocal = ThreadLocal.withInitial(() -> {
            Kryo kryo = new Kryo();
            // Payload classes are plain value objects; registration would tie
            // stored bytes to registration order
            kryo.setRegistrationRequired(false);
            kryo.setReferences(false);
            return kryo;
        });
    }

    @Override
    public byte[] encode(T payload) {
        try (Output output = new Output(INITIAL_BUFFER, -1)) {
            kryoThreadLocal.get().writeObject(output, payload);
            return output.toBytes();
        } catch (KryoException e) {
            throw new CodecException("Failed to write " + type.getSimpleName() + " with Kryo", e);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        try (Input input = new Input(bytes)) {
            return kryoThreadLocal.get().readObject(input, type);
        } catch (KryoException e) {
            throw new CodecException("Failed to read " + type.getSimpleName() + " with Kryo", e);
        }
    }
}
