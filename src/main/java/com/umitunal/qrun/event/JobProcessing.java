package com.umitunal.qrun.event;

import com.umitunal.qrun.core.Job;

/**
 * Raised before a job's payload runs.
 */
public class JobProcessing extends JobEvent {

    public JobProcessing(Job job, String queueName) {
        super(job, queueName);
    }
}
