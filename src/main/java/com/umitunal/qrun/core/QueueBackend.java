package com.umitunal.qrun.core;

import java.util.Optional;
import java.util.Set;

/**
 * Storage contract shared by every queue backend.
 *
 * <p>A stored record is either available, delayed, or reserved by a worker. A reservation
 * older than {@link #STALE_THRESHOLD_SECONDS} is treated as abandoned and the record can be
 * popped again. This is a heuristic, not a lease protocol: a worker that is merely slow can
 * see its job handed to another worker, so payloads must tolerate running more than once.</p>
 *
 * <p>Every operation may throw {@link QueueConnectionException} when the store cannot be
 * reached, and {@link JobSerializationException} when a stored payload cannot be decoded.</p>
 */
public interface QueueBackend extends AutoCloseable {

    /**
     * Seconds after which a reservation is considered abandoned.
     */
    long STALE_THRESHOLD_SECONDS = 300;

    /**
     * Store a job, available at {@code now + job.getDelaySeconds()}.
     *
     * @return the job id
     */
    String push(Job job);

    /**
     * Set the job delay and store it.
     *
     * @return the job id
     */
    default String later(int delaySeconds, Job job) {
        job.delay(delaySeconds);
        return push(job);
    }

    /**
     * Reserve the next available (or stale-reserved) job of a queue.
     *
     * @return the reserved job, or empty if nothing is eligible
     */
    Optional<Job> pop(String queueName);

    /**
     * Remove a job from whichever queue holds it.
     *
     * @return true if a record was removed, false if it was already gone
     */
    boolean delete(String jobId);

    /**
     * Make a reserved job available again after {@code delaySeconds}, storing its current
     * attempt count and payload.
     */
    void release(Job job, int delaySeconds);

    default void release(Job job) {
        release(job, 0);
    }

    /**
     * Number of records in a queue, whatever their state.
     */
    int size(String queueName);

    /**
     * Remove every record of a queue.
     *
     * @return number of records removed
     */
    int clear(String queueName);

    default boolean isEmpty(String queueName) {
        return size(queueName) == 0;
    }

    /**
     * Breakdown of a queue by record state.
     */
    QueueStats stats(String queueName);

    /**
     * Names of the queues this backend currently holds records for.
     */
    Set<String> queueNames();

    @Override
    default void close() {
    }
}
