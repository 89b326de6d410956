package com.umitunal.qrun.serialization;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.umitunal.qrun.core.JobSerializationException;

import java.io.IOException;

/**
 * Jackson codec for payloads that are plain data holders. Payloads need either a default
 * constructor or a {@code @JsonCreator}.
 *
 * @param <T> the payload type
 */
public class JsonCodec<T> implements PayloadCodec<T> {
    private final Class<T> type;
    private final ObjectReader reader;
    private final ObjectWriter writer;

    public JsonCodec(Class<T> type) {
        this(type, createDefaultMapper());
    }

    public JsonCodec(Class<T> type, ObjectMapper mapper) {
        this.type = type;
        this.reader = mapper.readerFor(type);
        this.writer = mapper.writerFor(type);
    }

    @Override
    public byte[] encode(T payload) {
        try {
            return writer.writeValueAsBytes(payload);
        } catch (IOException e) {
            throw new JobSerializationException("Jackson could not encode " + type.getSimpleName(), e);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        try {
            return reader.readValue(bytes);
        } catch (IOException e) {
            throw new JobSerializationException("Jackson could not decode " + type.getSimpleName(), e);
        }
    }

    /**
     * Mapper shared by the JSON codecs and the storage records: accepts empty beans and
     * ignores fields it does not know.
     */
    public static ObjectMapper createDefaultMapper() {
        return new ObjectMapper()
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
