package com.umitunal.qrun.event;

import com.umitunal.qrun.core.Job;

/**
 * State transition of a job inside a worker.
 *
 * Carries a snapshot of the job metadata taken when the event was raised, so listeners
 * see the attempt number of that moment even though the job keeps changing.
 */
public abstract class JobEvent {
    private final Job job;
    private final String jobId;
    private final String typeName;
    private final String queueName;
    private final int attempt;

    protected JobEvent(Job job, String queueName) {
        this.job = job;
        this.jobId = job.getId();
        this.typeName = job.getTypeName();
        this.queueName = queueName;
        this.attempt = job.getAttempts();
    }

    public Job getJob() { return job; }
    public String getJobId() { return jobId; }
    public String getTypeName() { return typeName; }
    public String getQueueName() { return queueName; }
    public int getAttempt() { return attempt; }

    @Override
    public String toString() {
        return String.format("%s{jobId='%s', type=%s, queue='%s', attempt=%d}",
                getClass().getSimpleName(), jobId, typeName, queueName, attempt);
    }
}
