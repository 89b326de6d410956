package com.umitunal.qrun.log;

import com.umitunal.qrun.core.Job;

/**
 * Receives one entry per finished attempt. The worker ignores failures of the log itself.
 */
@FunctionalInterface
public interface JobLog {

    /**
     * @param message error message of a failed attempt, null otherwise
     */
    void log(JobStatus status, Job job, String message);
}
