package com.umitunal.qrun.serialization;

import com.umitunal.qrun.core.Job;
import com.umitunal.qrun.core.JobSerializationException;
import com.umitunal.qrun.support.MutableClock;
import com.umitunal.qrun.support.RecordingPayload;
import com.umitunal.qrun.support.TestPayloads;
import org.junit.jupiter.api.*;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class JobSerializerTest {

    private JobSerializer serializer;

    @BeforeEach
    void setUp() {
        serializer = TestPayloads.serializer();
    }

    @Test
    @DisplayName("Should preserve all metadata fields")
    void testMetadataPreservation() {
        // Given
        Job original = new Job(new RecordingPayload("meta"), MutableClock.startingAt(1_650_000_000L))
                .onQueue("invoices")
                .delay(15)
                .withMaxAttempts(6)
                .withTimeout(120);
        original.incrementAttempts();

        // When
        Job restored = serializer.deserialize(serializer.serialize(original));

        // Then
        assertThat(restored.getId()).isEqualTo(original.getId());
        assertThat(restored.getCreatedAt()).isEqualTo(1_650_000_000L);
        assertThat(restored.getQueueName()).isEqualTo("invoices");
        assertThat(restored.getDelaySeconds()).isEqualTo(15);
        assertThat(restored.getMaxAttempts()).isEqualTo(6);
        assertThat(restored.getTimeoutSeconds()).isEqualTo(120);
        assertThat(restored.getAttempts()).isEqualTo(1);
        assertThat(((RecordingPayload) restored.getPayload()).getName()).isEqualTo("meta");
    }

    @Test
    @DisplayName("Should reject empty, truncated and foreign bytes")
    void testCorruptBytes() {
        byte[] valid = serializer.serialize(new Job(new RecordingPayload("x")));

        assertThatThrownBy(() -> serializer.deserialize(new byte[0]))
                .isInstanceOf(JobSerializationException.class);
        assertThatThrownBy(() -> serializer.deserialize(Arrays.copyOf(valid, valid.length / 2)))
                .isInstanceOf(JobSerializationException.class);

        byte[] wrongVersion = valid.clone();
        wrongVersion[0] = 9;
        assertThatThrownBy(() -> serializer.deserialize(wrongVersion))
                .isInstanceOf(JobSerializationException.class)
                .hasMessageContaining("version");
    }

    @Test
    @DisplayName("Should fail to deserialize a payload type the registry does not know")
    void testUnknownTag() {
        byte[] bytes = serializer.serialize(new Job(new RecordingPayload("x")));
        JobSerializer empty = new JobSerializer(new PayloadRegistry());

        assertThatThrownBy(() -> empty.deserialize(bytes))
                .isInstanceOf(JobSerializationException.class)
                .hasMessageContaining("test.recording");
    }
}
