package com.umitunal.qrun.dispatch;

import com.umitunal.qrun.core.Job;
import com.umitunal.qrun.core.JobContext;
import com.umitunal.qrun.core.JobPayload;
import com.umitunal.qrun.core.JobSerializationException;
import com.umitunal.qrun.serialization.PayloadCodec;
import com.umitunal.qrun.serialization.PayloadRegistry;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Payload carrying a chain: runs the head link, then enqueues the rest as a new chain on the
 * same queue. A failing head is retried with the whole chain; the rest is not enqueued
 * until it succeeds.
 *
 * Must be registered with {@link #register(PayloadRegistry)} to go through a persistent backend.
 */
public class ChainedPayload implements JobPayload {
    public static final String TYPE_TAG = "qrun.chain";

    private final List<JobPayload> links;

    public ChainedPayload(List<? extends JobPayload> links) {
        if (links.isEmpty()) {
            throw new IllegalArgumentException("A chain needs at least one link");
        }
        this.links = Collections.unmodifiableList(new ArrayList<>(links));
    }

    public static void register(PayloadRegistry registry) {
        registry.register(TYPE_TAG, ChainedPayload.class, new Codec(registry));
    }

    public JobPayload head() {
        return links.get(0);
    }

    public List<JobPayload> remaining() {
        return links.subList(1, links.size());
    }

    public List<JobPayload> getLinks() {
        return links;
    }

    @Override
    public void execute(JobContext context) throws Exception {
        head().execute(context);

        if (links.size() > 1) {
            Job next = new Job(new ChainedPayload(remaining()));
            context.requireDispatcher()
                    .dispatch(next)
                    .onQueue(context.getQueueName())
                    .send();
        }
    }

    @Override
    public String describe() {
        return head().describe();
    }

    @Override
    public void onPermanentFailure(Job job, Exception error) {
        head().onPermanentFailure(job, error);
    }

    /**
     * Stores each link as its type tag and encoded bytes, using the codecs of the registry.
     *
     * Format: link count (4 bytes), then per link tag length + tag, payload length + payload.
     */
    static class Codec implements PayloadCodec<ChainedPayload> {
        private final PayloadRegistry registry;

        Codec(PayloadRegistry registry) {
            this.registry = registry;
        }

        @Override
        public byte[] encode(ChainedPayload chain) {
            List<byte[]> tags = new ArrayList<>();
            List<byte[]> bodies = new ArrayList<>();
            int size = 4;
            for (JobPayload link : chain.links) {
                byte[] tag = registry.tagOf(link).getBytes(UTF_8);
                byte[] body = registry.encode(link);
                tags.add(tag);
                bodies.add(body);
                size += 4 + tag.length + 4 + body.length;
            }

            ByteBuffer buffer = ByteBuffer.allocate(size);
            buffer.putInt(chain.links.size());
            for (int i = 0; i < tags.size(); i++) {
                buffer.putInt(tags.get(i).length).put(tags.get(i));
                buffer.putInt(bodies.get(i).length).put(bodies.get(i));
            }
            return buffer.array();
        }

        @Override
        public ChainedPayload decode(byte[] bytes) {
            try {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                int count = buffer.getInt();
                // each link needs at least its two length fields
                if (count <= 0 || count > buffer.remaining() / 8) {
                    throw new JobSerializationException("Corrupt chain: " + count + " links");
                }
                List<JobPayload> links = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    String tag = new String(readField(buffer), UTF_8);
                    links.add(registry.decode(tag, readField(buffer)));
                }
                return new ChainedPayload(links);
            } catch (BufferUnderflowException e) {
                throw new JobSerializationException("Corrupt chain payload", e);
            }
        }

        private static byte[] readField(ByteBuffer buffer) {
            int length = buffer.getInt();
            if (length < 0 || length > buffer.remaining()) {
                throw new JobSerializationException("Corrupt chain payload: field length " + length);
            }
            byte[] bytes = new byte[length];
            buffer.get(bytes);
            return bytes;
        }
    }
}
