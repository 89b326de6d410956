package com.umitunal.qrun.dispatch;

import com.umitunal.qrun.core.Job;
import com.umitunal.qrun.core.QueueBackend;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.function.Supplier;

/**
 * Jobs sent together. The batch id is returned to the caller; it is not stored with the jobs.
 */
public class PendingBatch {
    private static final SecureRandom RANDOM = new SecureRandom();

    private final List<Job> jobs;
    private final Supplier<QueueBackend> connection;
    private final List<String> jobIds = new ArrayList<>();
    private String queueName;

    PendingBatch(List<Job> jobs, Supplier<QueueBackend> connection) {
        this.jobs = new ArrayList<>(jobs);
        this.connection = connection;
    }

    /**
     * Queue for every job of the batch, overriding their own.
     */
    public PendingBatch onQueue(String queueName) {
        this.queueName = queueName;
        return this;
    }

    /**
     * Push every job.
     *
     * @return the batch id, 32 hex chars
     */
    public String dispatch() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        String batchId = HexFormat.of().formatHex(bytes);

        QueueBackend backend = connection.get();
        for (Job job : jobs) {
            if (queueName != null) {
                job.onQueue(queueName);
            }
            jobIds.add(backend.push(job));
        }
        return batchId;
    }

    /**
     * Ids of the jobs pushed by {@link #dispatch()}.
     */
    public List<String> getJobIds() {
        return Collections.unmodifiableList(jobIds);
    }
}
