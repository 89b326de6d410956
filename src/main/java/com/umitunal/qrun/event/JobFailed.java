package com.umitunal.qrun.event;

import com.umitunal.qrun.core.Job;

/**
 * Raised when a job ran out of attempts and is removed from its queue.
 */
public class JobFailed extends JobEvent {
    private final Exception error;

    public JobFailed(Job job, String queueName, Exception error) {
        super(job, queueName);
        this.error = error;
    }

    public Exception getError() { return error; }
}
