package com.umitunal.qrun.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Storage envelope of a queued job, as persisted by every backend.
 *
 * <p>The attempt count is duplicated outside the serialized payload so operators can read
 * it without decoding the job. All timestamps are epoch seconds.</p>
 */
public class QueueRecord {
    private final String id;
    private final long createdAt;

    private byte[] payload;
    private long availableAt;
    private Long reservedAt;
    private int attempts;

    @JsonCreator
    public QueueRecord(@JsonProperty("id") String id,
                       @JsonProperty("payload") byte[] payload,
                       @JsonProperty("available_at") long availableAt,
                       @JsonProperty("reserved_at") Long reservedAt,
                       @JsonProperty("attempts") int attempts,
                       @JsonProperty("created_at") long createdAt) {
        this.id = id;
        this.payload = payload;
        this.availableAt = availableAt;
        this.reservedAt = reservedAt;
        this.attempts = attempts;
        this.createdAt = createdAt;
    }

    public static QueueRecord available(String id, byte[] payload, long availableAt, int attempts, long now) {
        return new QueueRecord(id, payload, availableAt, null, attempts, now);
    }

    @JsonProperty("id")
    public String getId() { return id; }

    @JsonProperty("payload")
    public byte[] getPayload() { return payload; }

    @JsonProperty("available_at")
    public long getAvailableAt() { return availableAt; }

    @JsonProperty("reserved_at")
    public Long getReservedAt() { return reservedAt; }

    @JsonProperty("attempts")
    public int getAttempts() { return attempts; }

    @JsonProperty("created_at")
    public long getCreatedAt() { return createdAt; }

    @JsonIgnore
    public boolean isReserved() {
        return reservedAt != null;
    }

    /**
     * Reserved longer than the threshold ago: the worker holding it is presumed dead.
     */
    public boolean isStale(long now, long staleThresholdSeconds) {
        return reservedAt != null && now - reservedAt > staleThresholdSeconds;
    }

    public boolean isDelayed(long now) {
        return availableAt > now;
    }

    /**
     * Whether a pop at {@code now} may hand out this record.
     */
    public boolean isPoppable(long now, long staleThresholdSeconds) {
        return !isDelayed(now) && (reservedAt == null || isStale(now, staleThresholdSeconds));
    }

    public void reserve(long now) {
        this.reservedAt = now;
    }

    /**
     * Make the record available again, replacing its payload with the job's current state.
     */
    public void release(byte[] payload, int attempts, long availableAt) {
        this.payload = payload;
        this.attempts = attempts;
        this.availableAt = availableAt;
        this.reservedAt = null;
    }

    @Override
    public String toString() {
        return String.format("QueueRecord{id='%s', availableAt=%d, reservedAt=%s, attempts=%d}",
                id, availableAt, reservedAt, attempts);
    }
}
