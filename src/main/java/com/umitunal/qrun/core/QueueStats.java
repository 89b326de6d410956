package com.umitunal.qrun.core;

/**
 * Record counts of a single queue, by state.
 */
public class QueueStats {
    private final String queueName;
    private final int pending;
    private final int delayed;
    private final int reserved;

    public QueueStats(String queueName, int pending, int delayed, int reserved) {
        this.queueName = queueName;
        this.pending = pending;
        this.delayed = delayed;
        this.reserved = reserved;
    }

    public static QueueStats empty(String queueName) {
        return new QueueStats(queueName, 0, 0, 0);
    }

    public String getQueueName() { return queueName; }
    public int getPending() { return pending; }
    public int getDelayed() { return delayed; }
    public int getReserved() { return reserved; }
    public int getTotal() { return pending + delayed + reserved; }

    @Override
    public String toString() {
        return String.format("QueueStats{queue='%s', total=%d, pending=%d, delayed=%d, reserved=%d}",
                queueName, getTotal(), pending, delayed, reserved);
    }
}
