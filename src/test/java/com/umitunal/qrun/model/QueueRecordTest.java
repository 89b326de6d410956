package com.umitunal.qrun.model;

import com.umitunal.qrun.core.JobSerializationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;

import static org.assertj.core.api.Assertions.*;

class QueueRecordTest {

    private static final long NOW = 1_700_000_000L;

    private final QueueRecordCodec codec = new QueueRecordCodec();

    @Test
    @DisplayName("Should only reclaim a reservation strictly older than the threshold")
    void testStaleBoundary() {
        // Given
        QueueRecord record = QueueRecord.available("job-1", new byte[]{1}, NOW, 0, NOW);
        record.reserve(NOW);

        // Then
        assertThat(record.isReserved()).isTrue();
        assertThat(record.isPoppable(NOW + 300, 300)).isFalse();
        assertThat(record.isPoppable(NOW + 301, 300)).isTrue();
    }

    @Test
    @DisplayName("Should not hand out a record before it becomes available")
    void testDelayedRecord() {
        QueueRecord record = QueueRecord.available("job-1", new byte[]{1}, NOW + 60, 0, NOW);

        assertThat(record.isDelayed(NOW)).isTrue();
        assertThat(record.isPoppable(NOW + 59, 300)).isFalse();
        assertThat(record.isPoppable(NOW + 60, 300)).isTrue();
    }

    @Test
    @DisplayName("Should clear the reservation and take the new payload on release")
    void testRelease() {
        // Given
        QueueRecord record = QueueRecord.available("job-1", new byte[]{1}, NOW, 0, NOW);
        record.reserve(NOW);

        // When
        record.release(new byte[]{2, 3}, 1, NOW + 2);

        // Then
        assertThat(record.isReserved()).isFalse();
        assertThat(record.getPayload()).containsExactly(2, 3);
        assertThat(record.getAttempts()).isEqualTo(1);
        assertThat(record.getAvailableAt()).isEqualTo(NOW + 2);
    }

    @Test
    @DisplayName("Should store records with snake_case field names")
    void testRecordJsonFields() {
        // Given
        QueueRecord record = QueueRecord.available("job-1", "hi".getBytes(StandardCharsets.UTF_8), NOW, 2, NOW);

        // When
        String json = codec.encode(record);
        QueueRecord decoded = codec.decode(json);

        // Then
        assertThat(json).contains("\"available_at\"", "\"reserved_at\"", "\"created_at\"");
        assertThat(json).doesNotContain("reserved\"");
        assertThat(decoded.getId()).isEqualTo("job-1");
        assertThat(decoded.getAttempts()).isEqualTo(2);
        assertThat(decoded.getReservedAt()).isNull();
    }

    @Test
    @DisplayName("Should keep the insertion order of a queue blob")
    void testBlobKeepsOrder() {
        // Given
        LinkedHashMap<String, QueueRecord> queue = new LinkedHashMap<>();
        for (String id : new String[]{"c", "a", "b"}) {
            queue.put(id, QueueRecord.available(id, new byte[]{0}, NOW, 0, NOW));
        }

        // When
        LinkedHashMap<String, QueueRecord> decoded = codec.decodeBlob(codec.encodeBlob(queue));

        // Then
        assertThat(decoded.keySet()).containsExactly("c", "a", "b");
    }

    @Test
    @DisplayName("Should read a missing blob as an empty queue and reject a corrupt one")
    void testEmptyAndCorruptBlob() {
        assertThat(codec.decodeBlob(null)).isEmpty();
        assertThat(codec.decodeBlob(new byte[0])).isEmpty();
        assertThatThrownBy(() -> codec.decodeBlob("not json".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(JobSerializationException.class);
    }
}
