package com.umitunal.qrun.event;

import com.umitunal.qrun.core.Job;

/**
 * Raised when a failed job is about to be released for another attempt.
 */
public class JobRetrying extends JobEvent {
    private final Exception error;
    private final int backoffSeconds;

    public JobRetrying(Job job, String queueName, Exception error, int backoffSeconds) {
        super(job, queueName);
        this.error = error;
        this.backoffSeconds = backoffSeconds;
    }

    public Exception getError() { return error; }
    public int getBackoffSeconds() { return backoffSeconds; }
}
