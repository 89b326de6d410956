package com.umitunal.qrun.core;

import com.umitunal.qrun.dispatch.Dispatcher;

import java.util.Optional;

/**
 * Execution context handed to a payload while it runs.
 *
 * <p>Gives read access to the job metadata and, when the worker was wired with one,
 * the {@link Dispatcher} so a payload can enqueue follow-up jobs.</p>
 */
public class JobContext {
    private final Job job;
    private final String queueName;
    private final Dispatcher dispatcher;

    public JobContext(Job job, String queueName, Dispatcher dispatcher) {
        this.job = job;
        this.queueName = queueName;
        this.dispatcher = dispatcher;
    }

    public String getJobId() { return job.getId(); }
    public String getQueueName() { return queueName; }
    public int getAttempt() { return job.getAttempts(); }
    public int getMaxAttempts() { return job.getMaxAttempts(); }

    /**
     * Whether this is the last attempt the job gets.
     */
    public boolean isLastAttempt() {
        return job.getAttempts() >= job.getMaxAttempts();
    }

    public Optional<Dispatcher> dispatcher() {
        return Optional.ofNullable(dispatcher);
    }

    /**
     * The dispatcher, for payloads that cannot run without one.
     *
     * @throws IllegalStateException if the worker was built without a dispatcher
     */
    public Dispatcher requireDispatcher() {
        if (dispatcher == null) {
            throw new IllegalStateException("No dispatcher available for job " + job.getId());
        }
        return dispatcher;
    }
}
