package com.umitunal.qrun;

import com.umitunal.qrun.config.QueueConfig;
import com.umitunal.qrun.core.Job;
import com.umitunal.qrun.core.JobPayload;
import com.umitunal.qrun.core.QueueBackend;
import com.umitunal.qrun.core.QueueStats;
import com.umitunal.qrun.dispatch.ChainedPayload;
import com.umitunal.qrun.dispatch.Dispatcher;
import com.umitunal.qrun.dispatch.PendingBatch;
import com.umitunal.qrun.dispatch.PendingChain;
import com.umitunal.qrun.dispatch.PendingDispatch;
import com.umitunal.qrun.event.JobEventBus;
import com.umitunal.qrun.log.InMemoryJobLog;
import com.umitunal.qrun.log.JobLog;
import com.umitunal.qrun.registry.QueueRegistry;
import com.umitunal.qrun.scheduler.ExecutorTimerSource;
import com.umitunal.qrun.scheduler.Scheduler;
import com.umitunal.qrun.scheduler.TimerSource;
import com.umitunal.qrun.serialization.JobSerializer;
import com.umitunal.qrun.serialization.PayloadRegistry;
import com.umitunal.qrun.storage.SyncQueue;
import com.umitunal.qrun.worker.InMemoryQueueStatus;
import com.umitunal.qrun.worker.MemoryProbe;
import com.umitunal.qrun.worker.QueueStatus;
import com.umitunal.qrun.worker.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Wires the queue components together. Build one at startup and pass it to whatever needs it.
 *
 * <pre>{@code
 * PayloadRegistry payloads = new PayloadRegistry()
 *         .register("email", SendEmail.class, new JsonCodec<>(SendEmail.class));
 *
 * try (QueueContext queue = QueueContext.newBuilder(payloads).build()) {
 *     queue.dispatch(new SendEmail("to@example.com")).onQueue("emails").send();
 *     queue.processQueue("emails");
 * }
 * }</pre>
 */
public class QueueContext implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QueueContext.class);

    /** Limits of one {@link #processQueue} run. */
    public static final int PROCESS_MAX_JOBS = 10;
    public static final int PROCESS_MAX_TIME_SECONDS = 20;

    static final String PROCESS_HOOK_PREFIX = "qrun_process_";

    private final QueueRegistry registry;
    private final Dispatcher dispatcher;
    private final Scheduler scheduler;
    private final TimerSource timerSource;
    private final JobLog jobLog;
    private final JobEventBus events;
    private final QueueStatus queueStatus;
    private final MemoryProbe memoryProbe;
    private final Clock clock;

    private QueueContext(Builder builder) {
        this.clock = builder.clock;
        this.timerSource = builder.timerSource != null ? builder.timerSource : new ExecutorTimerSource(clock);
        this.jobLog = builder.jobLog != null ? builder.jobLog : new InMemoryJobLog(InMemoryJobLog.DEFAULT_MAX_ENTRIES, clock);
        this.events = builder.events;
        this.queueStatus = builder.queueStatus;
        this.memoryProbe = builder.memoryProbe;

        PayloadRegistry payloads = builder.payloads;
        if (!payloads.isRegistered(ChainedPayload.class)) {
            ChainedPayload.register(payloads);
        }

        this.registry = new QueueRegistry(builder.config, new JobSerializer(payloads), clock);
        this.dispatcher = new Dispatcher(registry);
        registry.extend(QueueRegistry.SYNC, r -> new SyncQueue(dispatcher));
        if (builder.defaultDriver != null) {
            registry.setDefaultDriver(builder.defaultDriver);
        }
        this.scheduler = new Scheduler(timerSource, dispatcher, payloads, clock);
    }

    public static Builder newBuilder(PayloadRegistry payloads) {
        return new Builder(payloads);
    }

    public PendingDispatch dispatch(Job job) {
        return dispatcher.dispatch(job);
    }

    public PendingDispatch dispatch(JobPayload payload) {
        return dispatcher.dispatch(payload);
    }

    public void dispatchSync(Job job) {
        dispatcher.dispatchSync(job);
    }

    public PendingChain chain(List<? extends JobPayload> payloads) {
        return dispatcher.chain(payloads);
    }

    public PendingBatch batch(List<Job> jobs) {
        return dispatcher.batch(jobs);
    }

    /**
     * Worker builder already wired to this context; set limits and call {@code build()}.
     */
    public Worker.Builder newWorker() {
        return Worker.builder(registry)
                .dispatcher(dispatcher)
                .jobLog(jobLog)
                .events(events)
                .queueStatus(queueStatus)
                .memoryProbe(memoryProbe)
                .clock(clock);
    }

    /**
     * One processing run: up to {@value #PROCESS_MAX_JOBS} jobs or {@value #PROCESS_MAX_TIME_SECONDS}
     * seconds, ending early when the queue is empty or paused.
     *
     * @return number of jobs completed
     */
    public int processQueue(String queueName) {
        Worker worker = newWorker()
                .maxJobs(PROCESS_MAX_JOBS)
                .maxTimeSeconds(PROCESS_MAX_TIME_SECONDS)
                .build();
        int processed = worker.drain(queueName);
        if (processed > 0) {
            log.info("Processed {} jobs from '{}'", processed, queueName);
        }
        return processed;
    }

    /**
     * Run {@link #processQueue} every minute through the timer source.
     */
    public void startProcessing(String queueName) {
        String hook = PROCESS_HOOK_PREFIX + queueName;
        timerSource.registerRecurringTrigger("min", 60, "Every Minute");
        timerSource.onFire(hook, args -> processQueue(queueName));
        if (timerSource.scheduledTrigger(hook).isEmpty()) {
            timerSource.scheduleRecurring(hook, "min", clock.instant().getEpochSecond());
        }
    }

    public void stopProcessing(String queueName) {
        timerSource.unschedule(PROCESS_HOOK_PREFIX + queueName);
    }

    public void pause(String queueName) {
        queueStatus.pause(queueName);
    }

    public void resume(String queueName) {
        queueStatus.resume(queueName);
    }

    public boolean isPaused(String queueName) {
        return queueStatus.isPaused(queueName);
    }

    /**
     * Remove every job of a queue from the default backend.
     *
     * @return number of jobs removed
     */
    public int clear(String queueName) {
        return registry.connection().clear(queueName);
    }

    /**
     * Clear a queue and pause it so nothing new is processed.
     */
    public int cancel(String queueName) {
        int removed = clear(queueName);
        pause(queueName);
        log.info("Cancelled '{}': {} jobs removed", queueName, removed);
        return removed;
    }

    public int queueSize(String queueName) {
        return registry.connection().size(queueName);
    }

    public QueueStats stats(String queueName) {
        return registry.connection().stats(queueName);
    }

    public QueueBackend connection() {
        return registry.connection();
    }

    public QueueRegistry registry() { return registry; }
    public Dispatcher dispatcher() { return dispatcher; }
    public Scheduler scheduler() { return scheduler; }
    public TimerSource timerSource() { return timerSource; }
    public JobLog jobLog() { return jobLog; }
    public JobEventBus events() { return events; }
    public QueueStatus queueStatus() { return queueStatus; }

    @Override
    public void close() {
        if (timerSource instanceof AutoCloseable) {
            try {
                ((AutoCloseable) timerSource).close();
            } catch (Exception e) {
                log.warn("Failed to close timer source", e);
            }
        }
        registry.close();
    }

    public static class Builder {
        private final PayloadRegistry payloads;
        private QueueConfig config;
        private String defaultDriver;
        private TimerSource timerSource;
        private JobLog jobLog;
        private JobEventBus events = new JobEventBus();
        private QueueStatus queueStatus = new InMemoryQueueStatus();
        private MemoryProbe memoryProbe = MemoryProbe.runtime();
        private Clock clock = Clock.systemUTC();

        private Builder(PayloadRegistry payloads) {
            this.payloads = Objects.requireNonNull(payloads, "payloads");
        }

        /**
         * Backend settings; read from the process environment when not set.
         */
        public Builder withConfig(QueueConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Driver used for the default connection, overriding the configured one.
         */
        public Builder withDefaultDriver(String driver) {
            this.defaultDriver = driver;
            return this;
        }

        public Builder withTimerSource(TimerSource timerSource) {
            this.timerSource = timerSource;
            return this;
        }

        public Builder withJobLog(JobLog jobLog) {
            this.jobLog = jobLog;
            return this;
        }

        public Builder withEvents(JobEventBus events) {
            this.events = Objects.requireNonNull(events, "events");
            return this;
        }

        public Builder withQueueStatus(QueueStatus queueStatus) {
            this.queueStatus = Objects.requireNonNull(queueStatus, "queueStatus");
            return this;
        }

        public Builder withMemoryProbe(MemoryProbe memoryProbe) {
            this.memoryProbe = Objects.requireNonNull(memoryProbe, "memoryProbe");
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public QueueContext build() {
            if (config == null) {
                config = QueueConfig.fromSystemEnvironment();
            }
            return new QueueContext(this);
        }
    }
}
