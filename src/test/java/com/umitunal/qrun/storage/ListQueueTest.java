package com.umitunal.qrun.storage;

import com.umitunal.qrun.core.Job;
import com.umitunal.qrun.core.QueueBackend;
import com.umitunal.qrun.model.QueueRecord;
import com.umitunal.qrun.model.QueueRecordCodec;
import com.umitunal.qrun.serialization.JobSerializer;
import com.umitunal.qrun.storage.list.InMemoryListStoreClient;
import com.umitunal.qrun.support.MutableClock;
import com.umitunal.qrun.support.RecordingPayload;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class ListQueueTest extends AbstractQueueBackendTest {

    private InMemoryListStoreClient client;

    @Override
    protected QueueBackend createBackend(JobSerializer serializer, MutableClock clock) {
        client = new InMemoryListStoreClient();
        return new ListQueue(client, serializer, "test:", clock);
    }

    @Test
    @DisplayName("Should pop jobs first in, first out")
    void testFifoOrder() {
        // Given
        backend.push(newJob("A"));
        backend.push(newJob("B"));
        backend.push(newJob("C"));

        // When
        List<String> names = new ArrayList<>();
        Optional<Job> job;
        while ((job = backend.pop(Job.DEFAULT_QUEUE)).isPresent()) {
            names.add(((RecordingPayload) job.get().getPayload()).getName());
        }

        // Then
        assertThat(names).containsExactly("A", "B", "C");
    }

    @Test
    @DisplayName("Should keep ready, delayed and reserved jobs under separate keys")
    void testKeyLayout() {
        // Given
        backend.push(newJob("reserved"));
        backend.pop(Job.DEFAULT_QUEUE);
        backend.push(newJob("ready"));
        backend.push(newJob("delayed").delay(30));

        // When / Then
        assertThat(client.lLen("test:jobs:default")).isEqualTo(1);
        assertThat(client.zCard("test:jobs:default:delayed")).isEqualTo(1);
        assertThat(client.hLen("test:jobs:default:reserved")).isEqualTo(1);
        assertThat(backend.queueNames()).containsExactly("default");
    }

    @Test
    @DisplayName("Should skip a garbage entry on the ready list")
    void testGarbageEntryDropped() {
        // Given
        client.rPush("test:jobs:default", "{not a record");
        Job job = newJob("valid");
        backend.push(job);

        // When
        Optional<Job> popped = backend.pop(Job.DEFAULT_QUEUE);

        // Then
        assertThat(popped).isPresent();
        assertThat(popped.get().getId()).isEqualTo(job.getId());
        assertThat(client.lLen("test:jobs:default")).isZero();
    }

    @Test
    @DisplayName("Should delete a job still waiting in the delayed set")
    void testDeleteDelayedJob() {
        // Given
        Job job = newJob("scheduled").delay(600);
        backend.push(job);

        // When
        boolean deleted = backend.delete(job.getId());

        // Then
        assertThat(deleted).isTrue();
        assertThat(client.zCard("test:jobs:default:delayed")).isZero();
    }

    @Test
    @DisplayName("Should keep the creation time of a job across a release")
    void testReleaseKeepsCreationTime() {
        // Given
        Job job = newJob("aged");
        backend.push(job);
        Job popped = backend.pop(Job.DEFAULT_QUEUE).orElseThrow();
        clock.advanceSeconds(42);
        popped.incrementAttempts();

        // When
        backend.release(popped, 0);

        // Then
        QueueRecord record = new QueueRecordCodec().decode(client.lRange("test:jobs:default", 0, -1).get(0));
        assertThat(record.getCreatedAt()).isEqualTo(job.getCreatedAt());
        assertThat(record.getAttempts()).isEqualTo(1);
        assertThat(record.isReserved()).isFalse();
    }

    @Test
    @DisplayName("Should drop an undecodable reservation while reclaiming")
    void testCorruptReservationDropped() {
        // Given
        client.hSet("test:jobs:default:reserved", "broken", "###");

        // When
        Optional<Job> popped = backend.pop(Job.DEFAULT_QUEUE);

        // Then
        assertThat(popped).isEmpty();
        assertThat(client.hLen("test:jobs:default:reserved")).isZero();
    }
}
