package com.umitunal.qrun.core;

import com.umitunal.qrun.support.MutableClock;
import com.umitunal.qrun.support.RecordingPayload;
import org.junit.jupiter.api.*;

import static org.assertj.core.api.Assertions.*;

class JobTest {

    @Test
    @DisplayName("Should start with the default settings")
    void testDefaults() {
        // When
        Job job = new Job(new RecordingPayload("x"), MutableClock.startingAt(1_700_000_000L));

        // Then
        assertThat(job.getId()).hasSize(32).matches("[0-9a-f]+");
        assertThat(job.getQueueName()).isEqualTo(Job.DEFAULT_QUEUE);
        assertThat(job.getAttempts()).isZero();
        assertThat(job.getMaxAttempts()).isEqualTo(Job.DEFAULT_MAX_ATTEMPTS);
        assertThat(job.getTimeoutSeconds()).isEqualTo(Job.DEFAULT_TIMEOUT_SECONDS);
        assertThat(job.getCreatedAt()).isEqualTo(1_700_000_000L);
        assertThat(job.getTypeName()).isEqualTo("RecordingPayload");
    }

    @Test
    @DisplayName("Should allow retries until the attempts are used up")
    void testCanRetry() {
        // Given
        Job job = new Job(new RecordingPayload("x")).withMaxAttempts(2);

        // When / Then
        job.incrementAttempts();
        assertThat(job.canRetry()).isTrue();
        assertThat(new JobContext(job, "default", null).isLastAttempt()).isFalse();

        job.incrementAttempts();
        assertThat(job.canRetry()).isFalse();
        assertThat(new JobContext(job, "default", null).isLastAttempt()).isTrue();
    }

    @Test
    @DisplayName("Should reject invalid settings")
    void testValidation() {
        Job job = new Job(new RecordingPayload("x"));

        assertThatThrownBy(() -> job.onQueue(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> job.delay(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> job.withMaxAttempts(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> job.withTimeout(-5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should expose the dispatcher only when one was given")
    void testContextDispatcher() {
        JobContext context = new JobContext(new Job(new RecordingPayload("x")), "default", null);

        assertThat(context.dispatcher()).isEmpty();
        assertThatThrownBy(context::requireDispatcher).isInstanceOf(IllegalStateException.class);
    }
}
