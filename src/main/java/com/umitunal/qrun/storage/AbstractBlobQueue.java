package com.umitunal.qrun.storage;

import com.umitunal.qrun.core.Job;
import com.umitunal.qrun.core.JobSerializationException;
import com.umitunal.qrun.core.QueueBackend;
import com.umitunal.qrun.core.QueueStats;
import com.umitunal.qrun.model.QueueRecord;
import com.umitunal.qrun.model.QueueRecordCodec;
import com.umitunal.qrun.serialization.JobSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Base class for backends that keep a whole queue in one stored value ({@code jobId -> record}).
 *
 * <p>Every operation reads the blob, changes it and writes it back. {@link #pop} scans the
 * records in the order the map was stored, so there is no FIFO promise. Methods are
 * synchronized, which protects a single instance; two processes (or two instances) popping
 * the same queue can both reserve the same record because the store offers no compare-and-set.
 * Running several workers against one of these backends is not a supported setup; use the
 * list store for that.</p>
 */
public abstract class AbstractBlobQueue implements QueueBackend {
    private static final Logger log = LoggerFactory.getLogger(AbstractBlobQueue.class);

    protected final JobSerializer serializer;
    protected final QueueRecordCodec recordCodec;
    protected final Clock clock;

    protected AbstractBlobQueue(JobSerializer serializer, QueueRecordCodec recordCodec, Clock clock) {
        this.serializer = serializer;
        this.recordCodec = recordCodec;
        this.clock = clock;
    }

    /**
     * Stored blob of a queue, or null if the queue holds nothing.
     */
    protected abstract byte[] readBlob(String queueName);

    protected abstract void writeBlob(String queueName, byte[] blob);

    protected abstract void deleteBlob(String queueName);

    @Override
    public synchronized String push(Job job) {
        long now = now();
        String queueName = job.getQueueName();
        LinkedHashMap<String, QueueRecord> records = load(queueName);

        records.put(job.getId(), QueueRecord.available(job.getId(), serializer.serialize(job),
                now + job.getDelaySeconds(), job.getAttempts(), now));
        save(queueName, records);

        log.debug("Pushed {} to '{}' (delay {}s)", job.getId(), queueName, job.getDelaySeconds());
        return job.getId();
    }

    @Override
    public synchronized Optional<Job> pop(String queueName) {
        LinkedHashMap<String, QueueRecord> records = loadOrDiscard(queueName);
        if (records.isEmpty()) {
            return Optional.empty();
        }

        long now = now();
        boolean dropped = false;
        Iterator<Map.Entry<String, QueueRecord>> it = records.entrySet().iterator();

        while (it.hasNext()) {
            QueueRecord record = it.next().getValue();
            if (!record.isPoppable(now, STALE_THRESHOLD_SECONDS)) {
                continue;
            }

            Job job;
            try {
                job = serializer.deserialize(record.getPayload());
            } catch (JobSerializationException e) {
                log.warn("Dropping undecodable job {} from '{}': {}", record.getId(), queueName, e.getMessage());
                it.remove();
                dropped = true;
                continue;
            }

            if (record.isReserved()) {
                log.warn("Reclaiming stale reservation of job {} on '{}' (reserved at {})",
                        record.getId(), queueName, record.getReservedAt());
            }
            record.reserve(now);
            save(queueName, records);
            return Optional.of(job);
        }

        if (dropped) {
            save(queueName, records);
        }
        return Optional.empty();
    }

    @Override
    public synchronized boolean delete(String jobId) {
        for (String queueName : queueNames()) {
            LinkedHashMap<String, QueueRecord> records = load(queueName);
            if (records.remove(jobId) != null) {
                save(queueName, records);
                return true;
            }
        }
        return false;
    }

    @Override
    public synchronized void release(Job job, int delaySeconds) {
        String queueName = job.getQueueName();
        LinkedHashMap<String, QueueRecord> records = load(queueName);
        QueueRecord record = records.get(job.getId());

        if (record == null) {
            log.warn("Cannot release job {}: no longer held by '{}'", job.getId(), queueName);
            return;
        }

        record.release(serializer.serialize(job), job.getAttempts(), now() + delaySeconds);
        save(queueName, records);
    }

    @Override
    public synchronized int size(String queueName) {
        return load(queueName).size();
    }

    @Override
    public synchronized int clear(String queueName) {
        int count = load(queueName).size();
        deleteBlob(queueName);
        return count;
    }

    @Override
    public synchronized QueueStats stats(String queueName) {
        long now = now();
        int pending = 0;
        int delayed = 0;
        int reserved = 0;

        for (QueueRecord record : load(queueName).values()) {
            if (record.isReserved()) {
                reserved++;
            } else if (record.isDelayed(now)) {
                delayed++;
            } else {
                pending++;
            }
        }
        return new QueueStats(queueName, pending, delayed, reserved);
    }

    protected long now() {
        return clock.instant().getEpochSecond();
    }

    private LinkedHashMap<String, QueueRecord> load(String queueName) {
        return recordCodec.decodeBlob(readBlob(queueName));
    }

    /**
     * Load for pop. A blob that no longer decodes is removed so the queue can be used again;
     * the records it held are lost.
     */
    private LinkedHashMap<String, QueueRecord> loadOrDiscard(String queueName) {
        try {
            return load(queueName);
        } catch (JobSerializationException e) {
            log.error("Discarding undecodable blob of queue '{}'", queueName, e);
            deleteBlob(queueName);
            return new LinkedHashMap<>();
        }
    }

    private void save(String queueName, LinkedHashMap<String, QueueRecord> records) {
        if (records.isEmpty()) {
            deleteBlob(queueName);
        } else {
            writeBlob(queueName, recordCodec.encodeBlob(records));
        }
    }
}
