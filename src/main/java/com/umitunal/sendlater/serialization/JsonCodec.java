package com.umitunal.sendlater.serialization;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;

/**
 * Jackson codec for stored rows: snake_case names, nulls left out, unknown fields ignored
 * so rows written by a newer build still load.
 *
 * @param <T> the type to serialize
 */
public class JsonCodec<T> implements PayloadCodec<T> {
    private final Class<T> type;
    private final ObjectReader reader;
    private final ObjectWriter writer;

    public JsonCodec(Class<T> type) {
        this(type, newMapper());
    }

    public JsonCodec(Class<T> type, ObjectMapper mapper) {
        this.type = type;
        this.reader = mapper.readerFor(type);
        this.writer = mapper.writerFor(type);
    }

    /**
     * Mapper configured the way rows and wire bodies are written in this project.
     */
    public static ObjectMapper newMapper() {
        return new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public byte[] encode(T payload) {
        if (payload == null) {
            throw new CodecException("Cannot store a null " + type.getSimpleName());
        }
        try {
            return writer.writeValueAsBytes(payload);
        } catch (IOException e) {
            throw new CodecException("Failed to write " + type.getSimpleName() + " as JSON", e);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        T value;
        try {
            value = reader.readValue(bytes);
        } catch (IOException e) {
            throw new CodecException("Failed to read " + type.getSimpleName() + " from JSON", e);
        }
        if (value == null) {
            // A literal "null" row
            throw new CodecException("Stored " + type.getSimpleName() + " is null");
        }
        return value;
    }
}
