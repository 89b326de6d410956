package com.umitunal.qrun;

import com.umitunal.qrun.config.QueueConfig;
import com.umitunal.qrun.config.StorageConfig;
import com.umitunal.qrun.core.Job;
import com.umitunal.qrun.core.QueueStats;
import com.umitunal.qrun.log.InMemoryJobLog;
import com.umitunal.qrun.registry.QueueRegistry;
import com.umitunal.qrun.scheduler.Scheduler;
import com.umitunal.qrun.support.ExecutionLog;
import com.umitunal.qrun.support.RecordingPayload;
import com.umitunal.qrun.support.RecordingTimerSource;
import com.umitunal.qrun.support.TestPayloads;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class QueueContextTest {

    @TempDir
    Path tempDir;

    private RecordingTimerSource timer;
    private QueueContext context;

    @BeforeEach
    void setUp() {
        ExecutionLog.reset();
        timer = new RecordingTimerSource();
        context = newContext(QueueRegistry.MEMORY);
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    private QueueContext newContext(String driver) {
        QueueConfig config = QueueConfig.newBuilder()
                .withStorage(StorageConfig.newBuilder(tempDir.toString()).withDurableWrites(false).build())
                .build();
        return QueueContext.newBuilder(TestPayloads.registry())
                .withConfig(config)
                .withDefaultDriver(driver)
                .withTimerSource(timer)
                .withMemoryProbe(() -> 10)
                .build();
    }

    private void dispatch(int count, String queue) {
        for (int i = 0; i < count; i++) {
            context.dispatch(new RecordingPayload(queue + "-" + i)).onQueue(queue).send();
        }
    }

    @Test
    @DisplayName("Should process at most ten jobs per run")
    void testProcessQueueLimit() {
        // Given
        dispatch(15, "emails");

        // When
        int first = context.processQueue("emails");
        int second = context.processQueue("emails");

        // Then
        assertThat(first).isEqualTo(QueueContext.PROCESS_MAX_JOBS);
        assertThat(second).isEqualTo(5);
        assertThat(context.queueSize("emails")).isZero();
        assertThat(((InMemoryJobLog) context.jobLog()).completed()).hasSize(15);
    }

    @Test
    @DisplayName("Should not process a paused queue until it is resumed")
    void testPauseAndResume() {
        // Given
        dispatch(2, "reports");
        context.pause("reports");

        // When / Then
        assertThat(context.isPaused("reports")).isTrue();
        assertThat(context.processQueue("reports")).isZero();
        assertThat(context.queueSize("reports")).isEqualTo(2);

        context.resume("reports");
        assertThat(context.processQueue("reports")).isEqualTo(2);
    }

    @Test
    @DisplayName("Should clear and pause a cancelled queue")
    void testCancel() {
        // Given
        dispatch(3, "imports");

        // When
        int removed = context.cancel("imports");

        // Then
        assertThat(removed).isEqualTo(3);
        assertThat(context.isPaused("imports")).isTrue();
        assertThat(context.queueSize("imports")).isZero();
    }

    @Test
    @DisplayName("Should report queue stats of the default backend")
    void testStats() {
        // Given
        dispatch(2, "stats");
        context.dispatch(new RecordingPayload("later")).onQueue("stats").delay(60).send();

        // When
        QueueStats stats = context.stats("stats");

        // Then
        assertThat(stats.getPending()).isEqualTo(2);
        assertThat(stats.getDelayed()).isEqualTo(1);
        assertThat(context.clear("stats")).isEqualTo(3);
    }

    @Test
    @DisplayName("Should run a chain to the end through the worker")
    void testChain() {
        // Given
        context.chain(List.of(new RecordingPayload("one"), new RecordingPayload("two"))).onQueue("chain").dispatch();

        // When
        int processed = context.processQueue("chain");

        // Then
        assertThat(processed).isEqualTo(2);
        assertThat(ExecutionLog.executions()).containsExactly("one", "two");
    }

    @Test
    @DisplayName("Should run jobs on dispatch with the sync driver")
    void testSyncDriver() {
        // Given
        context.close();
        context = newContext(QueueRegistry.SYNC);

        // When
        context.dispatch(new RecordingPayload("now")).send();
        context.chain(List.of(new RecordingPayload("a"), new RecordingPayload("b"))).dispatch();

        // Then
        assertThat(ExecutionLog.executions()).containsExactly("now", "a", "b");
        assertThat(context.queueSize(Job.DEFAULT_QUEUE)).isZero();
    }

    @Test
    @DisplayName("Should process a queue every minute once processing is started")
    void testStartAndStopProcessing() {
        // Given
        dispatch(1, "ticks");

        // When
        context.startProcessing("ticks");
        context.startProcessing("ticks");

        // Then
        assertThat(timer.scheduleCalls).isEqualTo(1);
        assertThat(timer.triggers.get("qrun_process_ticks").getIntervalName()).isEqualTo("min");

        timer.fireImmediately("qrun_process_ticks", List.of());
        assertThat(ExecutionLog.executions()).containsExactly("ticks-0");

        context.stopProcessing("ticks");
        assertThat(timer.triggers).doesNotContainKey("qrun_process_ticks");
    }

    @Test
    @DisplayName("Should dispatch scheduled jobs through the default backend")
    void testScheduledJob() {
        // Given
        context.scheduler().job(RecordingPayload.class).everyMinute();
        context.scheduler().register();

        // When
        timer.fireImmediately(Scheduler.hookName(RecordingPayload.class), List.of());
        context.processQueue(Job.DEFAULT_QUEUE);

        // Then
        assertThat(ExecutionLog.executions()).containsExactly("scheduled");
    }

    @Test
    @DisplayName("Should store jobs in RocksDB with the polling driver")
    void testPollingDriver() {
        // Given
        context.close();
        context = newContext(QueueRegistry.POLLING);

        // When
        context.dispatch(new RecordingPayload("disk")).onQueue("durable").send();

        // Then
        assertThat(context.queueSize("durable")).isEqualTo(1);
        assertThat(context.processQueue("durable")).isEqualTo(1);
        assertThat(ExecutionLog.executions()).containsExactly("disk");
    }
}
