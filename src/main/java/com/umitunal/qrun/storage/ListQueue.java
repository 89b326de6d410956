package com.umitunal.qrun.storage;

import com.umitunal.qrun.core.Job;
import com.umitunal.qrun.core.JobSerializationException;
import com.umitunal.qrun.core.QueueBackend;
import com.umitunal.qrun.core.QueueStats;
import com.umitunal.qrun.model.QueueRecord;
import com.umitunal.qrun.model.QueueRecordCodec;
import com.umitunal.qrun.serialization.JobSerializer;
import com.umitunal.qrun.storage.list.ListStoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * List store backend. Each queue uses three structures:
 * <ul>
 *   <li>{@code jobs:<queue>}: ready list, popped from the head</li>
 *   <li>{@code jobs:<queue>:delayed}: sorted set scored by {@code availableAt}</li>
 *   <li>{@code jobs:<queue>:reserved}: hash {@code jobId -> record} of jobs being worked on</li>
 * </ul>
 *
 * <p>The head pop is atomic on the server, so concurrent workers never receive the same ready
 * record. Draining with a single worker is FIFO. Moving delayed or stale entries back onto the
 * ready list is guarded by the removal result, so two workers never both re-queue one entry.</p>
 */
public class ListQueue implements QueueBackend {
    private static final Logger log = LoggerFactory.getLogger(ListQueue.class);

    private static final String DELAYED_SUFFIX = ":delayed";
    private static final String RESERVED_SUFFIX = ":reserved";

    private final ListStoreClient client;
    private final JobSerializer serializer;
    private final QueueRecordCodec recordCodec;
    private final Clock clock;
    private final String keyPrefix;

    public ListQueue(ListStoreClient client, JobSerializer serializer, String keyPrefix) {
        this(client, serializer, keyPrefix, Clock.systemUTC());
    }

    public ListQueue(ListStoreClient client, JobSerializer serializer, String keyPrefix, Clock clock) {
        this.client = client;
        this.serializer = serializer;
        this.recordCodec = new QueueRecordCodec();
        this.clock = clock;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }

    @Override
    public String push(Job job) {
        long now = now();
        QueueRecord record = QueueRecord.available(job.getId(), serializer.serialize(job),
                now + job.getDelaySeconds(), job.getAttempts(), now);
        enqueue(job.getQueueName(), record, job.getDelaySeconds());

        log.debug("Pushed {} to '{}' (delay {}s)", job.getId(), job.getQueueName(), job.getDelaySeconds());
        return job.getId();
    }

    @Override
    public Optional<Job> pop(String queueName) {
        long now = now();
        migrateDelayed(queueName, now);
        reclaimStale(queueName, now);

        String entry;
        while ((entry = client.lPop(readyKey(queueName))) != null) {
            QueueRecord record;
            Job job;
            try {
                record = recordCodec.decode(entry);
                job = serializer.deserialize(record.getPayload());
            } catch (JobSerializationException e) {
                log.warn("Dropping undecodable entry from '{}': {}", queueName, e.getMessage());
                continue;
            }

            record.reserve(now);
            client.hSet(reservedKey(queueName), record.getId(), recordCodec.encode(record));
            return Optional.of(job);
        }
        return Optional.empty();
    }

    @Override
    public boolean delete(String jobId) {
        for (String queueName : queueNames()) {
            if (client.hDel(reservedKey(queueName), jobId) > 0) {
                return true;
            }
            if (removeMatching(queueName, jobId)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void release(Job job, int delaySeconds) {
        String queueName = job.getQueueName();
        String stored = client.hGet(reservedKey(queueName), job.getId());
        if (stored == null || client.hDel(reservedKey(queueName), job.getId()) == 0) {
            log.warn("Cannot release job {}: no longer reserved on '{}'", job.getId(), queueName);
            return;
        }

        long now = now();
        QueueRecord record = decodeOrNull(stored);
        long createdAt = record == null ? now : record.getCreatedAt();
        QueueRecord released = new QueueRecord(job.getId(), serializer.serialize(job),
                now + delaySeconds, null, job.getAttempts(), createdAt);
        enqueue(queueName, released, delaySeconds);
    }

    @Override
    public int size(String queueName) {
        return (int) (client.lLen(readyKey(queueName))
                + client.zCard(delayedKey(queueName))
                + client.hLen(reservedKey(queueName)));
    }

    @Override
    public int clear(String queueName) {
        int count = size(queueName);
        client.del(readyKey(queueName), delayedKey(queueName), reservedKey(queueName));
        return count;
    }

    @Override
    public QueueStats stats(String queueName) {
        return new QueueStats(queueName,
                (int) client.lLen(readyKey(queueName)),
                (int) client.zCard(delayedKey(queueName)),
                (int) client.hLen(reservedKey(queueName)));
    }

    @Override
    public Set<String> queueNames() {
        String base = keyPrefix + "jobs:";
        Set<String> names = new LinkedHashSet<>();
        for (String key : client.keys(base + "*")) {
            String name = key.substring(base.length());
            if (name.endsWith(DELAYED_SUFFIX)) {
                name = name.substring(0, name.length() - DELAYED_SUFFIX.length());
            } else if (name.endsWith(RESERVED_SUFFIX)) {
                name = name.substring(0, name.length() - RESERVED_SUFFIX.length());
            }
            names.add(name);
        }
        return names;
    }

    @Override
    public void close() {
        client.close();
    }

    public ListStoreClient getClient() {
        return client;
    }

    private void enqueue(String queueName, QueueRecord record, int delaySeconds) {
        String encoded = recordCodec.encode(record);
        if (delaySeconds > 0) {
            client.zAdd(delayedKey(queueName), record.getAvailableAt(), encoded);
        } else {
            client.rPush(readyKey(queueName), encoded);
        }
    }

    private void migrateDelayed(String queueName, long now) {
        String delayedKey = delayedKey(queueName);
        List<String> due = client.zRangeByScore(delayedKey, Double.NEGATIVE_INFINITY, now);
        for (String entry : due) {
            if (client.zRem(delayedKey, entry) > 0) {
                client.rPush(readyKey(queueName), entry);
            }
        }
    }

    private void reclaimStale(String queueName, long now) {
        String reservedKey = reservedKey(queueName);
        for (Map.Entry<String, String> entry : client.hGetAll(reservedKey).entrySet()) {
            QueueRecord record = decodeOrNull(entry.getValue());
            if (record == null) {
                log.warn("Dropping undecodable reservation {} from '{}'", entry.getKey(), queueName);
                client.hDel(reservedKey, entry.getKey());
                continue;
            }
            if (!record.isStale(now, STALE_THRESHOLD_SECONDS)) {
                continue;
            }
            if (client.hDel(reservedKey, entry.getKey()) > 0) {
                log.warn("Reclaiming stale reservation of job {} on '{}' (reserved at {})",
                        record.getId(), queueName, record.getReservedAt());
                record.release(record.getPayload(), record.getAttempts(), record.getAvailableAt());
                client.rPush(readyKey(queueName), recordCodec.encode(record));
            }
        }
    }

    private boolean removeMatching(String queueName, String jobId) {
        for (String entry : client.lRange(readyKey(queueName), 0, -1)) {
            QueueRecord record = decodeOrNull(entry);
            if (record != null && jobId.equals(record.getId())
                    && client.lRem(readyKey(queueName), 1, entry) > 0) {
                return true;
            }
        }
        for (String entry : client.zRange(delayedKey(queueName), 0, -1)) {
            QueueRecord record = decodeOrNull(entry);
            if (record != null && jobId.equals(record.getId())
                    && client.zRem(delayedKey(queueName), entry) > 0) {
                return true;
            }
        }
        return false;
    }

    private QueueRecord decodeOrNull(String entry) {
        try {
            return recordCodec.decode(entry);
        } catch (JobSerializationException e) {
            log.debug("Undecodable list store entry: {}", e.getMessage());
            return null;
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    private String readyKey(String queueName) {
        return keyPrefix + "jobs:" + queueName;
    }

    private String delayedKey(String queueName) {
        return readyKey(queueName) + DELAYED_SUFFIX;
    }

    private String reservedKey(String queueName) {
        return readyKey(queueName) + RESERVED_SUFFIX;
    }
}
