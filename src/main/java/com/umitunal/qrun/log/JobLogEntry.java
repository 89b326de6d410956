package com.umitunal.qrun.log;

/**
 * Immutable record of one finished attempt.
 */
public class JobLogEntry {
    private final String id;
    private final String jobId;
    private final String typeName;
    private final String queueName;
    private final JobStatus status;
    private final String message;
    private final int attempts;
    private final long timestamp;

    public JobLogEntry(String id, String jobId, String typeName, String queueName, JobStatus status,
                       String message, int attempts, long timestamp) {
        this.id = id;
        this.jobId = jobId;
        this.typeName = typeName;
        this.queueName = queueName;
        this.status = status;
        this.message = message;
        this.attempts = attempts;
        this.timestamp = timestamp;
    }

    public String getId() { return id; }
    public String getJobId() { return jobId; }
    public String getTypeName() { return typeName; }
    public String getQueueName() { return queueName; }
    public JobStatus getStatus() { return status; }
    public String getMessage() { return message; }
    public int getAttempts() { return attempts; }

    /**
     * Epoch seconds.
     */
    public long getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return String.format("JobLogEntry{job='%s', type=%s, queue='%s', status=%s, attempts=%d, message=%s}",
                jobId, typeName, queueName, status, attempts, message);
    }
}
