package com.umitunal.qrun.scheduler;

import com.umitunal.qrun.core.Job;
import com.umitunal.qrun.core.JobContext;
import com.umitunal.qrun.core.JobPayload;
import com.umitunal.qrun.dispatch.Dispatcher;
import com.umitunal.qrun.storage.ListQueue;
import com.umitunal.qrun.storage.list.InMemoryListStoreClient;
import com.umitunal.qrun.support.FailingPayload;
import com.umitunal.qrun.support.MutableClock;
import com.umitunal.qrun.support.RecordingPayload;
import com.umitunal.qrun.support.RecordingTimerSource;
import com.umitunal.qrun.support.SlowPayload;
import com.umitunal.qrun.support.TestPayloads;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.*;

class SchedulerTest {

    private static final String RECORDING_HOOK = "qrun_recording_payload";

    private MutableClock clock;
    private RecordingTimerSource timer;
    private ListQueue queue;
    private Scheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(1_700_000_000L);
        timer = new RecordingTimerSource();
        queue = new ListQueue(new InMemoryListStoreClient(), TestPayloads.serializer(), "", clock);
        scheduler = new Scheduler(timer, new Dispatcher(queue), TestPayloads.registry(), clock);
    }

    @AfterEach
    void tearDown() {
        queue.close();
    }

    @Test
    @DisplayName("Should derive hook names from the snake_case class name")
    void testHookName() {
        assertThat(Scheduler.hookName(RecordingPayload.class)).isEqualTo(RECORDING_HOOK);
        assertThat(Scheduler.hookName(SendWelcomeEmail.class)).isEqualTo("qrun_send_welcome_email");
    }

    @Test
    @DisplayName("Should register every known interval with the timer source")
    void testIntervalsRegistered() {
        // When
        scheduler.register();

        // Then
        assertThat(timer.intervals)
                .containsEntry("min", 60L)
                .containsEntry("hourly", 3600L)
                .containsEntry("twicedaily", 43200L)
                .containsEntry("daily", 86400L)
                .containsEntry("weekly", 604800L);
    }

    @Test
    @DisplayName("Should leave a matching trigger alone on repeated registration")
    void testRegisterIsIdempotent() {
        // Given
        scheduler.job(RecordingPayload.class).hourly();

        // When
        scheduler.register();
        scheduler.register();
        scheduler.register();

        // Then
        assertThat(timer.scheduleCalls).isEqualTo(1);
        assertThat(timer.unscheduleCalls).isZero();
        assertThat(timer.triggers.get(RECORDING_HOOK).getIntervalName()).isEqualTo("hourly");
        assertThat(timer.triggers.get(RECORDING_HOOK).getNextFireTime()).isEqualTo(clock.epochSeconds());
    }

    @Test
    @DisplayName("Should move a trigger to its new interval")
    void testIntervalMigration() {
        // Given
        scheduler.job(RecordingPayload.class).hourly();
        scheduler.register();

        // When
        scheduler.job(RecordingPayload.class).daily();
        scheduler.register();

        // Then
        assertThat(timer.unscheduleCalls).isEqualTo(1);
        assertThat(timer.scheduleCalls).isEqualTo(2);
        assertThat(timer.triggers.get(RECORDING_HOOK).getIntervalName()).isEqualTo("daily");
    }

    @Test
    @DisplayName("Should schedule a one-shot job once and move it when its time changes")
    void testOneShotReconcile() {
        // Given
        long fireAt = clock.epochSeconds() + 3600;
        ScheduleSpec<RecordingPayload> spec = scheduler.job(RecordingPayload.class).at(fireAt);
        assertThat(spec.isOneShot()).isTrue();

        // When
        scheduler.register();
        scheduler.register();

        // Then
        assertThat(timer.scheduleCalls).isEqualTo(1);
        ScheduledTrigger trigger = timer.triggers.get(RECORDING_HOOK);
        assertThat(trigger.isRecurring()).isFalse();
        assertThat(trigger.getIntervalName()).isNull();
        assertThat(trigger.getNextFireTime()).isEqualTo(fireAt);

        // When the time changes
        spec.at(fireAt + 60);
        scheduler.register();

        // Then
        assertThat(timer.unscheduleCalls).isEqualTo(1);
        assertThat(timer.triggers.get(RECORDING_HOOK).getNextFireTime()).isEqualTo(fireAt + 60);
    }

    @Test
    @DisplayName("Should not reschedule a one-shot job that already fired")
    void testFiredOneShotNotRescheduled() {
        // Given
        long fireAt = clock.epochSeconds();
        ScheduleSpec<RecordingPayload> spec = scheduler.job(RecordingPayload.class).at(fireAt);
        scheduler.register();
        timer.fireDue(RECORDING_HOOK);

        // When
        scheduler.register();
        scheduler.register();

        // Then
        assertThat(timer.scheduleCalls).isEqualTo(1);
        assertThat(timer.triggers).doesNotContainKey(RECORDING_HOOK);
        assertThat(queue.size(Job.DEFAULT_QUEUE)).isEqualTo(1);

        // When the time changes, the new one-shot is scheduled
        spec.at(fireAt + 60);
        scheduler.register();

        // Then
        assertThat(timer.scheduleCalls).isEqualTo(2);
        assertThat(timer.triggers.get(RECORDING_HOOK).getNextFireTime()).isEqualTo(fireAt + 60);
    }

    @Test
    @DisplayName("Should dispatch a past one-shot job only once across registrations on a real timer")
    void testOneShotOnExecutorTimer() {
        // Given
        MutableClock wallClock = MutableClock.startingAt(Instant.now().getEpochSecond());
        ListQueue target = new ListQueue(new InMemoryListStoreClient(), TestPayloads.serializer(), "", wallClock);
        try (ExecutorTimerSource executorTimer = new ExecutorTimerSource(wallClock)) {
            Scheduler onTimer = new Scheduler(executorTimer, new Dispatcher(target), TestPayloads.registry(), wallClock);
            onTimer.job(RecordingPayload.class).at(wallClock.epochSeconds());

            // When
            onTimer.register();
            await().atMost(5, TimeUnit.SECONDS).until(() -> target.size(Job.DEFAULT_QUEUE) == 1);
            await().atMost(5, TimeUnit.SECONDS).until(() -> executorTimer.scheduledTrigger(RECORDING_HOOK).isEmpty());
            onTimer.register();

            // Then
            await().during(500, TimeUnit.MILLISECONDS).atMost(2, TimeUnit.SECONDS)
                    .until(() -> target.size(Job.DEFAULT_QUEUE) == 1);
        } finally {
            target.close();
        }
    }

    @Test
    @DisplayName("Should replace a recurring trigger with a one-shot one")
    void testRecurringToOneShot() {
        // Given
        ScheduleSpec<RecordingPayload> spec = scheduler.job(RecordingPayload.class).everyFiveMinutes();
        scheduler.register();

        // When
        spec.at(clock.epochSeconds() + 10);
        scheduler.register();

        // Then
        assertThat(timer.unscheduleCalls).isEqualTo(1);
        assertThat(timer.triggers.get(RECORDING_HOOK).isRecurring()).isFalse();
    }

    @Test
    @DisplayName("Should remove the trigger while the condition is false")
    void testConditionTeardown() {
        // Given
        AtomicBoolean enabled = new AtomicBoolean(true);
        scheduler.job(RecordingPayload.class).hourly().when(enabled::get);
        scheduler.register();
        assertThat(timer.triggers).containsKey(RECORDING_HOOK);

        // When
        enabled.set(false);
        scheduler.register();

        // Then
        assertThat(timer.triggers).doesNotContainKey(RECORDING_HOOK);

        // And it comes back
        enabled.set(true);
        scheduler.register();
        assertThat(timer.triggers).containsKey(RECORDING_HOOK);
    }

    @Test
    @DisplayName("Should not schedule a job while its skip condition holds")
    void testSkip() {
        scheduler.job(RecordingPayload.class).daily().skip(() -> true);

        scheduler.register();

        assertThat(timer.triggers).isEmpty();
    }

    @Test
    @DisplayName("Should ignore a spec without an interval")
    void testNoInterval() {
        scheduler.job(RecordingPayload.class);

        scheduler.register();

        assertThat(timer.triggers).isEmpty();
        assertThat(timer.callbacks).isEmpty();
    }

    @Test
    @DisplayName("Should skip misconfigured specs and still register the valid ones")
    void testMisconfiguredSpecsSkipped() {
        // Given
        scheduler.job(SendWelcomeEmail.class, SendWelcomeEmail::new).interval("fortnightly");
        scheduler.job(SlowPayload.class, () -> new SlowPayload(1)).cron("0 3 * * 1");
        scheduler.job(FailingPayload.class).hourly();
        scheduler.job(SendInvoice.class, SendInvoice::new).hourly().timeout(-1);
        scheduler.job(RebuildIndex.class, RebuildIndex::new).daily().retries(0);
        scheduler.job(ArchiveLogs.class, ArchiveLogs::new).weekly().onQueue(" ");
        scheduler.job(RecordingPayload.class).everyMinute();

        // When
        scheduler.register();

        // Then
        assertThat(timer.triggers).containsOnlyKeys(RECORDING_HOOK);
    }

    @Test
    @DisplayName("Should register a custom interval for every N minutes")
    void testEveryMinutes() {
        // Given
        ScheduleSpec<RecordingPayload> spec = scheduler.job(RecordingPayload.class).everyMinutes(20);

        // When
        scheduler.register();

        // Then
        assertThat(spec.getInterval()).isEqualTo("20min");
        assertThat(scheduler.intervals()).anySatisfy(interval -> {
            assertThat(interval.getName()).isEqualTo("20min");
            assertThat(interval.getPeriodSeconds()).isEqualTo(1200);
        });
        assertThat(timer.intervals).containsEntry("20min", 1200L);
        assertThat(timer.triggers.get(RECORDING_HOOK).getIntervalName()).isEqualTo("20min");
        assertThat(scheduler.job(RecordingPayload.class).everyMinutes(1).getInterval()).isEqualTo("min");
        assertThatThrownBy(() -> scheduler.job(RecordingPayload.class).everyMinutes(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should map the supported cron expressions onto intervals")
    void testCronMapping() {
        assertThat(intervalForCron("@hourly")).isEqualTo("hourly");
        assertThat(intervalForCron("@daily")).isEqualTo("daily");
        assertThat(intervalForCron("@weekly")).isEqualTo("weekly");
        assertThat(intervalForCron("@twicedaily")).isEqualTo("twicedaily");
        assertThat(intervalForCron("* * * * *")).isEqualTo("min");
        assertThat(intervalForCron("*/5 * * * *")).isEqualTo("5min");
        assertThat(intervalForCron("*/7 * * * *")).isEqualTo("7min");
        assertThat(timer.intervals).containsEntry("7min", 420L);
    }

    @Test
    @DisplayName("Should reject cron steps outside one to fifty-nine minutes")
    void testCronOutOfRange() {
        scheduler.job(RecordingPayload.class).cron("*/60 * * * *");

        scheduler.register();

        assertThat(timer.triggers).isEmpty();
    }

    @Test
    @DisplayName("Should dispatch a fresh payload with the schedule overrides when fired")
    void testFireDispatchesJob() {
        // Given
        scheduler.job(RecordingPayload.class).hourly().onQueue("reports").timeout(90).retries(7);
        scheduler.register();

        // When
        timer.fireImmediately(RECORDING_HOOK, List.of());

        // Then
        Optional<Job> job = queue.pop("reports");
        assertThat(job).isPresent();
        assertThat(job.get().getTimeoutSeconds()).isEqualTo(90);
        assertThat(job.get().getMaxAttempts()).isEqualTo(7);
        assertThat(((RecordingPayload) job.get().getPayload()).getName()).isEqualTo("scheduled");
    }

    @Test
    @DisplayName("Should prefer the factory given with the schedule")
    void testSpecFactory() {
        // Given
        scheduler.job(RecordingPayload.class, () -> new RecordingPayload("custom")).hourly();
        scheduler.register();

        // When
        timer.fireImmediately(RECORDING_HOOK, List.of());

        // Then
        Job job = queue.pop(Job.DEFAULT_QUEUE).orElseThrow();
        assertThat(((RecordingPayload) job.getPayload()).getName()).isEqualTo("custom");
    }

    private String intervalForCron(String expression) {
        scheduler.job(RecordingPayload.class).cron(expression);
        scheduler.register();
        return timer.triggers.get(RECORDING_HOOK).getIntervalName();
    }

    static class SendWelcomeEmail implements JobPayload {
        @Override
        public void execute(JobContext context) {
        }
    }

    static class SendInvoice implements JobPayload {
        @Override
        public void execute(JobContext context) {
        }
    }

    static class RebuildIndex implements JobPayload {
        @Override
        public void execute(JobContext context) {
        }
    }

    static class ArchiveLogs implements JobPayload {
        @Override
        public void execute(JobContext context) {
        }
    }
}
