package com.umitunal.qrun.worker;

import com.umitunal.qrun.core.Job;
import com.umitunal.qrun.core.JobContext;
import com.umitunal.qrun.core.QueueBackend;
import com.umitunal.qrun.core.QueueException;
import com.umitunal.qrun.dispatch.Dispatcher;
import com.umitunal.qrun.event.JobEvent;
import com.umitunal.qrun.event.JobEventBus;
import com.umitunal.qrun.event.JobFailed;
import com.umitunal.qrun.event.JobProcessed;
import com.umitunal.qrun.event.JobProcessing;
import com.umitunal.qrun.event.JobRetrying;
import com.umitunal.qrun.log.JobLog;
import com.umitunal.qrun.log.JobStatus;
import com.umitunal.qrun.registry.QueueRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Pops jobs from one backend and drives each through execution, retry or permanent failure.
 *
 * <p>A worker is a sequential loop: limits (job count, wall-clock time, memory) are checked
 * between jobs only, a running job is never interrupted. Create a new worker to reset the
 * counters.</p>
 *
 * <p>Job outcomes:</p>
 * <ul>
 *   <li>success: record deleted, counted as processed</li>
 *   <li>failure with attempts left: record released with a backoff delay</li>
 *   <li>failure on the last attempt: failure callback invoked, record deleted</li>
 * </ul>
 */
public class Worker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    static final double MEMORY_PRESSURE_RATIO = 0.85;

    private final Supplier<QueueBackend> backend;
    private final BackoffPolicy backoff;
    private final MemoryProbe memoryProbe;
    private final QueueStatus queueStatus;
    private final JobLog jobLog;
    private final JobEventBus events;
    private final Dispatcher dispatcher;
    private final Clock clock;
    private final long startedAtMillis;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile int maxJobs;
    private volatile int maxTimeSeconds;
    private volatile int memoryLimitMb;
    private volatile int jobsProcessed;
    private volatile boolean stopRequested;
    private Thread workerThread;

    private Worker(Builder builder) {
        this.backend = builder.backend;
        this.backoff = builder.backoff;
        this.memoryProbe = builder.memoryProbe;
        this.queueStatus = builder.queueStatus;
        this.jobLog = builder.jobLog;
        this.events = builder.events;
        this.dispatcher = builder.dispatcher;
        this.clock = builder.clock;
        this.maxJobs = builder.maxJobs;
        this.maxTimeSeconds = builder.maxTimeSeconds;
        this.memoryLimitMb = builder.memoryLimitMb;
        this.startedAtMillis = clock.millis();
    }

    /**
     * Worker draining the backend the registry resolves for {@code connection}
     * (the default driver unless set on the builder).
     */
    public static Builder builder(QueueRegistry registry) {
        return new Builder(registry);
    }

    public static Builder builder(QueueBackend backend) {
        Objects.requireNonNull(backend, "backend");
        return new Builder(() -> backend);
    }

    /**
     * Whether the worker should not start another job.
     */
    public boolean shouldStop() {
        if (stopRequested) {
            return true;
        }
        if (maxJobs > 0 && jobsProcessed >= maxJobs) {
            return true;
        }
        if (maxTimeSeconds > 0 && clock.millis() - startedAtMillis >= maxTimeSeconds * 1000L) {
            return true;
        }
        return memoryExceeded();
    }

    public boolean memoryExceeded() {
        return memoryProbe.usedMegabytes() >= memoryLimitMb;
    }

    /**
     * Pop and process the next job of a queue.
     *
     * @return false when nothing was processed (paused, stopped, empty or unreachable)
     *         or the job failed permanently; true otherwise
     */
    public boolean runNextJob(String queueName) {
        if (queueStatus.isPaused(queueName)) {
            log.debug("Queue '{}' is paused", queueName);
            return false;
        }
        if (shouldStop()) {
            return false;
        }

        Optional<Job> job;
        try {
            job = backend.get().pop(queueName);
        } catch (QueueException e) {
            log.warn("Could not pop from '{}', treating as empty: {}", queueName, e.getMessage());
            return false;
        }

        if (job.isEmpty()) {
            return false;
        }
        return process(job.get(), queueName);
    }

    /**
     * Run one attempt of a popped job and settle its record.
     *
     * @return true if the job completed or will be retried, false if it failed permanently
     */
    public boolean process(Job job, String queueName) {
        publish(new JobProcessing(job, queueName));
        job.incrementAttempts();

        try {
            job.getPayload().execute(new JobContext(job, queueName, dispatcher));
        } catch (Exception e) {
            return handleJobException(job, queueName, e);
        }

        publish(new JobProcessed(job, queueName));
        deleteRecord(job);
        jobsProcessed++;
        record(JobStatus.COMPLETED, job, null);
        log.debug("Completed {}", job);

        if (memoryProbe.usedMegabytes() >= memoryLimitMb * MEMORY_PRESSURE_RATIO) {
            log.warn("Memory usage near limit of {} MB, stopping after {} jobs", memoryLimitMb, jobsProcessed);
            maxJobs = jobsProcessed;
        }
        return true;
    }

    /**
     * Process jobs until the queue is empty, paused, or a limit is reached.
     * A permanent failure ends the run as well.
     *
     * @return number of jobs completed during this call
     */
    public int drain(String queueName) {
        int before = jobsProcessed;
        while (!shouldStop()) {
            if (!runNextJob(queueName)) {
                break;
            }
        }
        return jobsProcessed - before;
    }

    /**
     * Loop over {@link #runNextJob} until {@link #shouldStop()}, sleeping only after a call
     * that processed nothing.
     */
    public void daemon(String queueName, int sleepSeconds) {
        log.info("Worker started on '{}'", queueName);
        while (!shouldStop()) {
            if (!runNextJob(queueName)) {
                try {
                    TimeUnit.SECONDS.sleep(sleepSeconds);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        log.info("Worker on '{}' stopped after {} jobs", queueName, jobsProcessed);
    }

    /**
     * Run {@link #daemon} on a background thread.
     */
    public void start(String queueName, int sleepSeconds) {
        if (running.compareAndSet(false, true)) {
            workerThread = new Thread(() -> {
                try {
                    daemon(queueName, sleepSeconds);
                } finally {
                    running.set(false);
                }
            }, "qrun-worker-" + queueName);
            workerThread.setDaemon(false);
            workerThread.start();
        }
    }

    /**
     * Ask the loop to stop after the current job and wait for the background thread, if any.
     */
    public void stop() {
        stopRequested = true;
        if (workerThread != null) {
            try {
                workerThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public boolean isRunning() { return running.get(); }
    public int getJobsProcessed() { return jobsProcessed; }
    public int getMaxJobs() { return maxJobs; }
    public int getMaxTimeSeconds() { return maxTimeSeconds; }
    public int getMemoryLimitMb() { return memoryLimitMb; }

    public void setMaxJobs(int maxJobs) {
        this.maxJobs = maxJobs;
    }

    public void setMaxTimeSeconds(int maxTimeSeconds) {
        this.maxTimeSeconds = maxTimeSeconds;
    }

    public void setMemoryLimitMb(int memoryLimitMb) {
        this.memoryLimitMb = memoryLimitMb;
    }

    @Override
    public void close() {
        stop();
    }

    private boolean handleJobException(Job job, String queueName, Exception e) {
        if (job.canRetry()) {
            int delay = backoff.delayFor(job.getAttempts());
            record(JobStatus.RETRYING, job, e.getMessage());
            publish(new JobRetrying(job, queueName, e, delay));
            log.warn("Job {} failed on attempt {}/{}, retrying in {}s: {}",
                    job.getId(), job.getAttempts(), job.getMaxAttempts(), delay, e.getMessage());
            releaseRecord(job, delay);
            return true;
        }

        record(JobStatus.FAILED, job, e.getMessage());
        try {
            job.getPayload().onPermanentFailure(job, e);
        } catch (Exception callbackError) {
            log.warn("Failure callback of job {} threw", job.getId(), callbackError);
        }
        publish(new JobFailed(job, queueName, e));
        log.error("Job {} failed permanently after {} attempts", job, job.getAttempts(), e);
        deleteRecord(job);
        return false;
    }

    // The record stays reserved when these fail; the stale reservation check brings it back.
    private void deleteRecord(Job job) {
        try {
            backend.get().delete(job.getId());
        } catch (QueueException e) {
            log.warn("Failed to delete record of job {}", job.getId(), e);
        }
    }

    private void releaseRecord(Job job, int delay) {
        try {
            backend.get().release(job, delay);
        } catch (QueueException e) {
            log.warn("Failed to release job {}", job.getId(), e);
        }
    }

    private void record(JobStatus status, Job job, String message) {
        if (jobLog == null) {
            return;
        }
        try {
            jobLog.log(status, job, message);
        } catch (RuntimeException e) {
            log.warn("Job log rejected {} entry for {}", status, job.getId(), e);
        }
    }

    private void publish(JobEvent event) {
        if (events != null) {
            events.publish(event);
        }
    }

    public static class Builder {
        private final Supplier<QueueBackend> backend;
        private QueueRegistry registry;
        private String connection;
        private int maxJobs;
        private int maxTimeSeconds;
        private int memoryLimitMb = 128;
        private BackoffPolicy backoff = BackoffPolicy.exponential();
        private MemoryProbe memoryProbe = MemoryProbe.runtime();
        private QueueStatus queueStatus = new InMemoryQueueStatus();
        private JobLog jobLog;
        private JobEventBus events;
        private Dispatcher dispatcher;
        private Clock clock = Clock.systemUTC();

        private Builder(QueueRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry");
            this.backend = () -> this.registry.connection(connection);
        }

        private Builder(Supplier<QueueBackend> backend) {
            this.backend = backend;
        }

        /**
         * Driver name to resolve through the registry. Ignored for a worker built on a backend.
         */
        public Builder connection(String name) {
            this.connection = name;
            return this;
        }

        /**
         * Stop after this many completed jobs; 0 means no limit.
         */
        public Builder maxJobs(int maxJobs) {
            if (maxJobs < 0) {
                throw new IllegalArgumentException("Max jobs must not be negative: " + maxJobs);
            }
            this.maxJobs = maxJobs;
            return this;
        }

        /**
         * Stop starting jobs after this many seconds; 0 means no limit.
         */
        public Builder maxTimeSeconds(int seconds) {
            if (seconds < 0) {
                throw new IllegalArgumentException("Max time must not be negative: " + seconds);
            }
            this.maxTimeSeconds = seconds;
            return this;
        }

        public Builder memoryLimitMb(int megabytes) {
            if (megabytes <= 0) {
                throw new IllegalArgumentException("Memory limit must be positive: " + megabytes);
            }
            this.memoryLimitMb = megabytes;
            return this;
        }

        public Builder useBackoff(boolean enable) {
            this.backoff = enable ? BackoffPolicy.exponential() : BackoffPolicy.none();
            return this;
        }

        public Builder backoff(BackoffPolicy backoff) {
            this.backoff = Objects.requireNonNull(backoff, "backoff");
            return this;
        }

        public Builder memoryProbe(MemoryProbe memoryProbe) {
            this.memoryProbe = Objects.requireNonNull(memoryProbe, "memoryProbe");
            return this;
        }

        public Builder queueStatus(QueueStatus queueStatus) {
            this.queueStatus = Objects.requireNonNull(queueStatus, "queueStatus");
            return this;
        }

        public Builder jobLog(JobLog jobLog) {
            this.jobLog = jobLog;
            return this;
        }

        public Builder events(JobEventBus events) {
            this.events = events;
            return this;
        }

        public Builder dispatcher(Dispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Worker build() {
            return new Worker(this);
        }
    }
}
