package com.umitunal.qrun.serialization;

import com.umitunal.qrun.core.Job;
import com.umitunal.qrun.core.JobPayload;
import com.umitunal.qrun.core.JobSerializationException;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Binary serializer for {@link Job} using ByteBuffer.
 *
 * Binary format:
 * - format version (1 byte)
 * - id length (4 bytes) + id bytes (UTF-8)
 * - type tag length (4 bytes) + tag bytes (UTF-8)
 * - payload length (4 bytes) + payload bytes
 * - queue name length (4 bytes) + queue bytes (UTF-8)
 * - attempts (4 bytes)
 * - maxAttempts (4 bytes)
 * - timeoutSeconds (4 bytes)
 * - delaySeconds (4 bytes)
 * - createdAt (8 bytes)
 */
public class JobSerializer {
    private static final byte FORMAT_VERSION = 1;

    private final PayloadRegistry registry;

    public JobSerializer(PayloadRegistry registry) {
        this.registry = registry;
    }

    public PayloadRegistry getRegistry() {
        return registry;
    }

    /**
     * Serialize a job to bytes for storage.
     *
     * @throws JobSerializationException if the payload type is not registered or fails to encode
     */
    public byte[] serialize(Job job) {
        byte[] idBytes = job.getId().getBytes(UTF_8);
        byte[] tagBytes = registry.tagOf(job.getPayload()).getBytes(UTF_8);
        byte[] payloadBytes = registry.encode(job.getPayload());
        byte[] queueBytes = job.getQueueName().getBytes(UTF_8);

        int totalSize = 1 +                              // version
                        4 + idBytes.length +             // id
                        4 + tagBytes.length +            // type tag
                        4 + payloadBytes.length +        // payload
                        4 + queueBytes.length +          // queue
                        4 + 4 + 4 + 4 +                  // attempts, maxAttempts, timeout, delay
                        8;                               // createdAt

        ByteBuffer buffer = ByteBuffer.allocate(totalSize);
        buffer.put(FORMAT_VERSION);
        putBytes(buffer, idBytes);
        putBytes(buffer, tagBytes);
        putBytes(buffer, payloadBytes);
        putBytes(buffer, queueBytes);
        buffer.putInt(job.getAttempts());
        buffer.putInt(job.getMaxAttempts());
        buffer.putInt(job.getTimeoutSeconds());
        buffer.putInt(job.getDelaySeconds());
        buffer.putLong(job.getCreatedAt());

        return buffer.array();
    }

    /**
     * Rebuild a job from bytes produced by {@link #serialize(Job)}.
     *
     * @throws JobSerializationException if the bytes are truncated, of an unknown format,
     *         or carry an unknown payload type
     */
    public Job deserialize(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new JobSerializationException("Empty job record");
        }
        try {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);

            byte version = buffer.get();
            if (version != FORMAT_VERSION) {
                throw new JobSerializationException("Unsupported job format version: " + version);
            }

            String id = new String(getBytes(buffer), UTF_8);
            String tag = new String(getBytes(buffer), UTF_8);
            byte[] payloadBytes = getBytes(buffer);
            String queueName = new String(getBytes(buffer), UTF_8);
            int attempts = buffer.getInt();
            int maxAttempts = buffer.getInt();
            int timeout = buffer.getInt();
            int delay = buffer.getInt();
            long createdAt = buffer.getLong();

            JobPayload payload = registry.decode(tag, payloadBytes);
            return Job.restore(id, payload, createdAt, queueName, attempts, maxAttempts, timeout, delay);
        } catch (BufferUnderflowException | IllegalArgumentException e) {
            throw new JobSerializationException("Corrupt job record", e);
        }
    }

    private static void putBytes(ByteBuffer buffer, byte[] bytes) {
        buffer.putInt(bytes.length);
        buffer.put(bytes);
    }

    private static byte[] getBytes(ByteBuffer buffer) {
        int length = buffer.getInt();
        if (length < 0 || length > buffer.remaining()) {
            throw new JobSerializationException("Corrupt job record: field length " + length);
        }
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return bytes;
    }
}
