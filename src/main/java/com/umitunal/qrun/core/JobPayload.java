package com.umitunal.qrun.core;

/**
 * The executable part of a job.
 *
 * Implementations are registered with a {@link com.umitunal.qrun.serialization.PayloadRegistry}
 * under a stable type tag together with the codec that stores them.
 */
public interface JobPayload {

    /**
     * Run the work. Any exception counts as a failed attempt.
     *
     * @param context metadata of the running job and a dispatcher for follow-up work
     * @throws Exception if the attempt fails
     */
    void execute(JobContext context) throws Exception;

    /**
     * Name of this payload type, as it appears in events and log entries.
     */
    default String describe() {
        return getClass().getSimpleName();
    }

    /**
     * Called once when the job ran out of attempts. Exceptions thrown here are logged and ignored.
     *
     * @param job the job that failed
     * @param error the error of the last attempt
     */
    default void onPermanentFailure(Job job, Exception error) {
    }
}
