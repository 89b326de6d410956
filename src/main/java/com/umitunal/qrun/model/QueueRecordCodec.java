package com.umitunal.qrun.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.umitunal.qrun.core.JobSerializationException;
import com.umitunal.qrun.serialization.JsonCodec;

import java.io.IOException;
import java.util.LinkedHashMap;

/**
 * JSON encoding of queue records: one record at a time for the list store, or a whole queue
 * as a {@code jobId -> record} map for the blob stores.
 */
public class QueueRecordCodec {
    private static final TypeReference<LinkedHashMap<String, QueueRecord>> BLOB_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public QueueRecordCodec() {
        this(JsonCodec.createDefaultMapper());
    }

    public QueueRecordCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(QueueRecord record) {
        try {
            return mapper.writeValueAsString(record);
        } catch (IOException e) {
            throw new JobSerializationException("Failed to encode record " + record.getId(), e);
        }
    }

    public QueueRecord decode(String json) {
        try {
            return mapper.readValue(json, QueueRecord.class);
        } catch (IOException e) {
            throw new JobSerializationException("Failed to decode queue record", e);
        }
    }

    /**
     * Encode a whole queue. Iteration order of the map is preserved.
     */
    public byte[] encodeBlob(LinkedHashMap<String, QueueRecord> records) {
        try {
            return mapper.writeValueAsBytes(records);
        } catch (IOException e) {
            throw new JobSerializationException("Failed to encode queue blob", e);
        }
    }

    public LinkedHashMap<String, QueueRecord> decodeBlob(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return new LinkedHashMap<>();
        }
        try {
            return mapper.readValue(bytes, BLOB_TYPE);
        } catch (IOException e) {
            throw new JobSerializationException("Failed to decode queue blob", e);
        }
    }
}
