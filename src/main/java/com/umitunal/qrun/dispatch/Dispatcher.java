package com.umitunal.qrun.dispatch;

import com.umitunal.qrun.core.Job;
import com.umitunal.qrun.core.JobPayload;
import com.umitunal.qrun.core.QueueBackend;
import com.umitunal.qrun.registry.QueueRegistry;
import com.umitunal.qrun.storage.SyncQueue;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Entry point for producers: sends jobs, chains and batches to the default backend.
 */
public class Dispatcher {
    private final Supplier<QueueBackend> connection;

    public Dispatcher(QueueRegistry registry) {
        Objects.requireNonNull(registry, "registry");
        this.connection = registry::connection;
    }

    public Dispatcher(QueueBackend backend) {
        Objects.requireNonNull(backend, "backend");
        this.connection = () -> backend;
    }

    /**
     * Prepare a job for sending. Nothing is stored until {@link PendingDispatch#send()}.
     */
    public PendingDispatch dispatch(Job job) {
        return new PendingDispatch(job, connection);
    }

    public PendingDispatch dispatch(JobPayload payload) {
        return dispatch(new Job(payload));
    }

    /**
     * Run a job on the calling thread, bypassing the queue.
     *
     * @throws RuntimeException whatever the payload threw, after its failure callback ran
     */
    public void dispatchSync(Job job) {
        new SyncQueue(this).push(job);
    }

    public void dispatchNow(Job job) {
        dispatchSync(job);
    }

    /**
     * Payloads that run one after another, each enqueued when the previous one completed.
     */
    public PendingChain chain(List<? extends JobPayload> payloads) {
        return new PendingChain(payloads, connection);
    }

    public PendingChain chain(JobPayload... payloads) {
        return chain(Arrays.asList(payloads));
    }

    /**
     * Jobs enqueued together under one batch id.
     */
    public PendingBatch batch(List<Job> jobs) {
        return new PendingBatch(jobs, connection);
    }

    public PendingBatch batch(Job... jobs) {
        return batch(Arrays.asList(jobs));
    }
}
