package com.umitunal.qrun.serialization;

import com.esotericsoftware.kryo.Kryo;
import com.umitunal.qrun.core.Job;
import com.umitunal.qrun.core.JobContext;
import com.umitunal.qrun.core.JobPayload;
import com.umitunal.qrun.core.JobSerializationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class KryoCodecTest {

    @Test
    @DisplayName("Should encode and decode a payload with collections")
    void testPayloadWithCollections() {
        // Given
        KryoCodec<ResizeImage> codec = new KryoCodec<>(ResizeImage.class);
        ResizeImage original = new ResizeImage("img-42", 800, List.of("thumb", "preview"), Map.of("format", "webp"));

        // When
        ResizeImage decoded = codec.decode(codec.encode(original));

        // Then
        assertThat(decoded.imageId).isEqualTo("img-42");
        assertThat(decoded.width).isEqualTo(800);
        assertThat(decoded.variants).containsExactly("thumb", "preview");
        assertThat(decoded.options).containsEntry("format", "webp");
    }

    @Test
    @DisplayName("Should handle null fields")
    void testNullValues() {
        // Given
        KryoCodec<ResizeImage> codec = new KryoCodec<>(ResizeImage.class);
        ResizeImage original = new ResizeImage(null, 0, null, null);

        // When
        ResizeImage decoded = codec.decode(codec.encode(original));

        // Then
        assertThat(decoded.imageId).isNull();
        assertThat(decoded.variants).isNull();
        assertThat(decoded.options).isNull();
    }

    @Test
    @DisplayName("Should work with custom Kryo factory")
    void testCustomFactory() {
        // Given
        KryoCodec<ResizeImage> codec = new KryoCodec<>(ResizeImage.class, () -> {
            Kryo kryo = new Kryo();
            kryo.setRegistrationRequired(false);
            kryo.setReferences(false);
            kryo.register(ResizeImage.class);
            return kryo;
        });
        ResizeImage original = new ResizeImage("custom", 99, List.of(), Map.of());

        // When
        ResizeImage decoded = codec.decode(codec.encode(original));

        // Then
        assertThat(decoded.imageId).isEqualTo("custom");
        assertThat(decoded.width).isEqualTo(99);
    }

    @Test
    @DisplayName("Should be thread-safe")
    void testThreadSafety() throws InterruptedException {
        // Given
        KryoCodec<ResizeImage> codec = new KryoCodec<>(ResizeImage.class);
        int threadCount = 8;
        int iterations = 100;
        Thread[] threads = new Thread[threadCount];

        // When
        for (int i = 0; i < threadCount; i++) {
            final int threadNum = i;
            threads[i] = new Thread(() -> {
                for (int j = 0; j < iterations; j++) {
                    String id = "thread-" + threadNum + "-" + j;
                    ResizeImage decoded = codec.decode(codec.encode(new ResizeImage(id, j, List.of(), Map.of())));
                    assertThat(decoded.imageId).isEqualTo(id);
                }
            });
            threads[i].start();
        }

        // Then - All threads complete without error
        for (Thread thread : threads) {
            thread.join();
        }
    }

    @Test
    @DisplayName("Should report garbage input as a serialization error")
    void testGarbageInput() {
        KryoCodec<ResizeImage> codec = new KryoCodec<>(ResizeImage.class);

        assertThatThrownBy(() -> codec.decode(new byte[]{(byte) 0xFF}))
                .isInstanceOf(JobSerializationException.class);
    }

    @Test
    @DisplayName("Should carry a Kryo payload through the job serializer")
    void testThroughJobSerializer() {
        // Given
        PayloadRegistry registry = new PayloadRegistry()
                .register("images.resize", ResizeImage.class, new KryoCodec<>(ResizeImage.class));
        JobSerializer serializer = new JobSerializer(registry);
        Job job = new Job(new ResizeImage("img-7", 320, List.of("small"), Map.of()));

        // When
        Job restored = serializer.deserialize(serializer.serialize(job));

        // Then
        assertThat(((ResizeImage) restored.getPayload()).imageId).isEqualTo("img-7");
    }

    public static class ResizeImage implements JobPayload {
        private String imageId;
        private int width;
        private List<String> variants;
        private Map<String, String> options;

        public ResizeImage() {}

        public ResizeImage(String imageId, int width, List<String> variants, Map<String, String> options) {
            this.imageId = imageId;
            this.width = width;
            this.variants = variants;
            this.options = options;
        }

        @Override
        public void execute(JobContext context) {
        }
    }
}
