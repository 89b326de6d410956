package com.umitunal.qrun.serialization;

import com.umitunal.qrun.core.JobPayload;
import com.umitunal.qrun.core.JobSerializationException;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Lookup table of payload types, keyed by a stable type tag.
 *
 * <p>Every payload type that goes through a persistent backend must be registered here at
 * startup. The tag is what ends up in storage, so renaming or moving a payload class does not
 * break records that are already queued. An optional factory lets the scheduler create
 * fresh instances without reflection.</p>
 */
public class PayloadRegistry {
    private final Map<String, Registration<?>> byTag = new ConcurrentHashMap<>();
    private final Map<Class<?>, Registration<?>> byType = new ConcurrentHashMap<>();

    public <P extends JobPayload> PayloadRegistry register(String tag, Class<P> type, PayloadCodec<P> codec) {
        return register(tag, type, codec, null);
    }

    /**
     * Register a payload type.
     *
     * @param tag stable name stored next to the encoded payload
     * @param type payload class
     * @param codec codec used for the payload bytes
     * @param factory creates a default instance, used by scheduled jobs; may be null
     * @throws IllegalArgumentException if the tag or the type is already registered to something else
     */
    public synchronized <P extends JobPayload> PayloadRegistry register(String tag, Class<P> type,
                                                                        PayloadCodec<P> codec, Supplier<P> factory) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Type tag must not be blank");
        }

        // both conflicts are checked before either map changes
        Registration<?> existingTag = byTag.get(tag);
        if (existingTag != null && existingTag.type != type) {
            throw new IllegalArgumentException("Type tag '" + tag + "' is already registered for "
                    + existingTag.type.getName());
        }
        Registration<?> existingType = byType.get(type);
        if (existingType != null && !existingType.tag.equals(tag)) {
            throw new IllegalArgumentException(type.getName() + " is already registered as '"
                    + existingType.tag + "'");
        }

        Registration<P> registration = new Registration<>(tag, type, codec, factory);
        byTag.putIfAbsent(tag, registration);
        byType.putIfAbsent(type, registration);
        return this;
    }

    public boolean isRegistered(Class<?> type) {
        return byType.containsKey(type);
    }

    public boolean isRegistered(String tag) {
        return byTag.containsKey(tag);
    }

    public Set<String> tags() {
        return Set.copyOf(byTag.keySet());
    }

    /**
     * Type tag of a payload instance.
     *
     * @throws JobSerializationException if the payload type was never registered
     */
    public String tagOf(JobPayload payload) {
        return registrationFor(payload.getClass()).tag;
    }

    public byte[] encode(JobPayload payload) {
        return registrationFor(payload.getClass()).encode(payload);
    }

    /**
     * Decode payload bytes stored under a type tag.
     *
     * @throws JobSerializationException for an unknown tag or undecodable bytes
     */
    public JobPayload decode(String tag, byte[] bytes) {
        Registration<?> registration = byTag.get(tag);
        if (registration == null) {
            throw new JobSerializationException("Unknown payload type tag: " + tag);
        }
        return registration.codec.decode(bytes);
    }

    /**
     * Factory registered for a payload type, if any.
     */
    @SuppressWarnings("unchecked")
    public <P extends JobPayload> Optional<Supplier<P>> factory(Class<P> type) {
        Registration<?> registration = byType.get(type);
        if (registration == null || registration.factory == null) {
            return Optional.empty();
        }
        return Optional.of((Supplier<P>) registration.factory);
    }

    private Registration<?> registrationFor(Class<?> type) {
        Registration<?> registration = byType.get(type);
        if (registration == null) {
            throw new JobSerializationException("Payload type is not registered: " + type.getName());
        }
        return registration;
    }

    private static final class Registration<P extends JobPayload> {
        private final String tag;
        private final Class<P> type;
        private final PayloadCodec<P> codec;
        private final Supplier<P> factory;

        private Registration(String tag, Class<P> type, PayloadCodec<P> codec, Supplier<P> factory) {
            this.tag = tag;
            this.type = type;
            this.codec = codec;
            this.factory = factory;
        }

        private byte[] encode(JobPayload payload) {
            return codec.encode(type.cast(payload));
        }
    }
}
