package com.umitunal.qrun.dispatch;

import com.umitunal.qrun.core.Job;
import com.umitunal.qrun.core.QueueBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * A job on its way to the queue. Configure it fluently, then call {@link #send()}; a pending
 * dispatch that is never sent stores nothing.
 */
public class PendingDispatch {
    private static final Logger log = LoggerFactory.getLogger(PendingDispatch.class);

    private final Job job;
    private final Supplier<QueueBackend> connection;
    private boolean cancelled;
    private boolean sent;

    PendingDispatch(Job job, Supplier<QueueBackend> connection) {
        this.job = job;
        this.connection = connection;
    }

    public PendingDispatch onQueue(String queueName) {
        job.onQueue(queueName);
        return this;
    }

    public PendingDispatch delay(int seconds) {
        job.delay(seconds);
        return this;
    }

    /**
     * Make a later {@link #send()} a no-op.
     */
    public void cancel() {
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public Job getJob() {
        return job;
    }

    /**
     * Push the job. Sending twice pushes once.
     *
     * @return the job id, or empty if the dispatch was cancelled
     */
    public Optional<String> send() {
        if (cancelled) {
            log.debug("Dispatch of {} was cancelled", job.getId());
            return Optional.empty();
        }
        if (!sent) {
            connection.get().push(job);
            sent = true;
        }
        return Optional.of(job.getId());
    }
}
