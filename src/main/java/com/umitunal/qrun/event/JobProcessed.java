package com.umitunal.qrun.event;

import com.umitunal.qrun.core.Job;

/**
 * Raised after a payload completed, before its record is deleted.
 */
public class JobProcessed extends JobEvent {

    public JobProcessed(Job job, String queueName) {
        super(job, queueName);
    }
}
