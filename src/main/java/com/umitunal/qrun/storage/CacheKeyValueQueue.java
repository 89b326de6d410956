package com.umitunal.qrun.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.umitunal.qrun.config.CacheConfig;
import com.umitunal.qrun.core.JobSerializationException;
import com.umitunal.qrun.core.QueueConnectionException;
import com.umitunal.qrun.model.QueueRecordCodec;
import com.umitunal.qrun.serialization.JobSerializer;
import com.umitunal.qrun.serialization.JsonCodec;
import com.umitunal.qrun.storage.kv.KeyValueCache;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Simple KV backend: the same one-blob-per-queue layout as {@link RocksPollingQueue}, stored in a
 * generic {@link KeyValueCache}. Used where no list-capable store is available.
 *
 * <p>A cache has no key scan, so queue names are tracked under a separate {@code queues} key.
 * The ordering and atomicity caveats of {@link AbstractBlobQueue} apply.</p>
 */
public class CacheKeyValueQueue extends AbstractBlobQueue {
    private static final TypeReference<LinkedHashSet<String>> NAMES_TYPE = new TypeReference<>() {};

    private final KeyValueCache cache;
    private final String keyPrefix;
    private final ObjectMapper mapper = JsonCodec.createDefaultMapper();

    public CacheKeyValueQueue(KeyValueCache cache, CacheConfig config, JobSerializer serializer) {
        this(cache, config, serializer, Clock.systemUTC());
    }

    public CacheKeyValueQueue(KeyValueCache cache, CacheConfig config, JobSerializer serializer, Clock clock) {
        super(serializer, new QueueRecordCodec(), clock);
        this.cache = cache;
        this.keyPrefix = config.getKeyPrefix();
    }

    @Override
    protected byte[] readBlob(String queueName) {
        try {
            return cache.get(queueKey(queueName)).orElse(null);
        } catch (RuntimeException e) {
            throw new QueueConnectionException("Failed to read queue '" + queueName + "'", e);
        }
    }

    @Override
    protected void writeBlob(String queueName, byte[] blob) {
        try {
            cache.put(queueKey(queueName), blob);
        } catch (RuntimeException e) {
            throw new QueueConnectionException("Failed to write queue '" + queueName + "'", e);
        }
        trackQueue(queueName);
    }

    @Override
    protected void deleteBlob(String queueName) {
        try {
            cache.delete(queueKey(queueName));
        } catch (RuntimeException e) {
            throw new QueueConnectionException("Failed to delete queue '" + queueName + "'", e);
        }
    }

    @Override
    public synchronized Set<String> queueNames() {
        byte[] bytes = cache.get(keyPrefix + "queues").orElse(null);
        if (bytes == null) {
            return new LinkedHashSet<>();
        }
        try {
            return mapper.readValue(bytes, NAMES_TYPE);
        } catch (IOException e) {
            throw new JobSerializationException("Corrupt queue index", e);
        }
    }

    @Override
    public void close() {
        cache.close();
    }

    private void trackQueue(String queueName) {
        Set<String> names = queueNames();
        if (names.add(queueName)) {
            try {
                cache.put(keyPrefix + "queues", mapper.writeValueAsBytes(names));
            } catch (IOException e) {
                throw new JobSerializationException("Failed to write queue index", e);
            }
        }
    }

    private String queueKey(String queueName) {
        return keyPrefix + "jobs:" + queueName;
    }
}
