package com.umitunal.qrun.core;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A unit of work travelling through the queue.
 *
 * A job is mutated in place across retries: the id stays the same while the
 * attempt counter grows. That is what distinguishes a retry from a new job.
 */
public class Job {
    public static final String DEFAULT_QUEUE = "default";
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final int DEFAULT_TIMEOUT_SECONDS = 60;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final String id;
    private final JobPayload payload;
    private final long createdAt;

    private String queueName = DEFAULT_QUEUE;
    private int attempts;
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
    private int delaySeconds;

    public Job(JobPayload payload) {
        this(payload, Clock.systemUTC());
    }

    public Job(JobPayload payload, Clock clock) {
        this(generateId(), payload, clock.instant().getEpochSecond());
    }

    private Job(String id, JobPayload payload, long createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.payload = Objects.requireNonNull(payload, "payload");
        this.createdAt = createdAt;
    }

    /**
     * Rebuild a job from its stored form. Used by the serializer only.
     */
    public static Job restore(String id, JobPayload payload, long createdAt, String queueName,
                              int attempts, int maxAttempts, int timeoutSeconds, int delaySeconds) {
        Job job = new Job(id, payload, createdAt);
        job.queueName = queueName;
        job.attempts = attempts;
        job.maxAttempts = maxAttempts;
        job.timeoutSeconds = timeoutSeconds;
        job.delaySeconds = delaySeconds;
        return job;
    }

    public String getId() { return id; }
    public JobPayload getPayload() { return payload; }
    public long getCreatedAt() { return createdAt; }
    public String getQueueName() { return queueName; }
    public int getAttempts() { return attempts; }
    public int getMaxAttempts() { return maxAttempts; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
    public int getDelaySeconds() { return delaySeconds; }

    /**
     * Name of the payload type, as shown in events and log entries.
     */
    public String getTypeName() {
        return payload.describe();
    }

    /**
     * Count one more execution attempt. Called by the worker right before the payload runs.
     */
    public void incrementAttempts() {
        attempts++;
    }

    /**
     * Whether another attempt is allowed after the current one failed.
     */
    public boolean canRetry() {
        return attempts < maxAttempts;
    }

    public Job onQueue(String queueName) {
        if (queueName == null || queueName.isBlank()) {
            throw new IllegalArgumentException("Queue name must not be blank");
        }
        this.queueName = queueName;
        return this;
    }

    public Job delay(int seconds) {
        if (seconds < 0) {
            throw new IllegalArgumentException("Delay must not be negative: " + seconds);
        }
        this.delaySeconds = seconds;
        return this;
    }

    public Job withMaxAttempts(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be positive: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        return this;
    }

    public Job withTimeout(int seconds) {
        if (seconds < 0) {
            throw new IllegalArgumentException("Timeout must not be negative: " + seconds);
        }
        this.timeoutSeconds = seconds;
        return this;
    }

    @Override
    public String toString() {
        return String.format("Job{id='%s', type=%s, queue='%s', attempt=%d/%d, delay=%ds}",
                id, getTypeName(), queueName, attempts, maxAttempts, delaySeconds);
    }

    private static String generateId() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
