package com.umitunal.qrun.dispatch;

import com.umitunal.qrun.core.Job;
import com.umitunal.qrun.core.JobPayload;
import com.umitunal.qrun.core.QueueBackend;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

public class PendingChain {
    private final List<JobPayload> payloads;
    private final Supplier<QueueBackend> connection;
    private String queueName = Job.DEFAULT_QUEUE;

    PendingChain(List<? extends JobPayload> payloads, Supplier<QueueBackend> connection) {
        this.payloads = new ArrayList<>(payloads);
        this.connection = connection;
    }

    public PendingChain onQueue(String queueName) {
        this.queueName = queueName;
        return this;
    }

    /**
     * Enqueue the first link. The others follow one by one as each link completes.
     *
     * @return id of the job carrying the first link, or empty for an empty chain
     */
    public Optional<String> dispatch() {
        if (payloads.isEmpty()) {
            return Optional.empty();
        }
        Job job = new Job(new ChainedPayload(payloads)).onQueue(queueName);
        return Optional.of(connection.get().push(job));
    }
}
