package com.umitunal.qrun.storage;

import com.umitunal.qrun.core.Job;
import com.umitunal.qrun.core.JobContext;
import com.umitunal.qrun.core.QueueBackend;
import com.umitunal.qrun.core.QueueException;
import com.umitunal.qrun.core.QueueStats;
import com.umitunal.qrun.dispatch.Dispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;

/**
 * Backend that stores nothing: {@link #push} runs the job on the calling thread.
 *
 * <p>The delay is ignored. If the payload throws, its failure callback runs and the error is
 * rethrown to the caller; unchecked exceptions as they are, checked ones wrapped in a
 * {@link QueueException}.</p>
 */
public class SyncQueue implements QueueBackend {
    private static final Logger log = LoggerFactory.getLogger(SyncQueue.class);

    private final Dispatcher dispatcher;

    public SyncQueue() {
        this(null);
    }

    /**
     * @param dispatcher handed to payloads through their context; may be null
     */
    public SyncQueue(Dispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public String push(Job job) {
        job.incrementAttempts();
        log.debug("Running {} synchronously", job);

        try {
            job.getPayload().execute(new JobContext(job, job.getQueueName(), dispatcher));
        } catch (Exception e) {
            try {
                job.getPayload().onPermanentFailure(job, e);
            } catch (Exception callbackError) {
                log.warn("Failure callback of job {} threw", job.getId(), callbackError);
            }
            if (e instanceof RuntimeException) {
                throw (RuntimeException) e;
            }
            throw new QueueException("Job " + job.getId() + " failed", e);
        }
        return job.getId();
    }

    @Override
    public Optional<Job> pop(String queueName) {
        return Optional.empty();
    }

    @Override
    public boolean delete(String jobId) {
        return false;
    }

    @Override
    public void release(Job job, int delaySeconds) {
    }

    @Override
    public int size(String queueName) {
        return 0;
    }

    @Override
    public int clear(String queueName) {
        return 0;
    }

    @Override
    public QueueStats stats(String queueName) {
        return QueueStats.empty(queueName);
    }

    @Override
    public Set<String> queueNames() {
        return Set.of();
    }
}
