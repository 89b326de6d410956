package com.umitunal.qrun.serialization;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.umitunal.qrun.core.JobSerializationException;

/**
 * Binary payload codec using Kryo, for payloads with fields Jackson cannot map.
 * A Kryo instance is not thread-safe, so workers and producers each get their own.
 *
 * @param <T> the payload type
 */
public class KryoCodec<T> implements PayloadCodec<T> {
    private static final int INITIAL_BUFFER = 256;

    private final Class<T> type;
    private final ThreadLocal<Kryo> kryos;

    public KryoCodec(Class<T> type) {
        this(type, KryoCodec::unregisteredKryo);
    }

    public KryoCodec(Class<T> type, KryoFactory factory) {
        this.type = type;
        this.kryos = ThreadLocal.withInitial(factory::create);
    }

    @Override
    public byte[] encode(T payload) {
        // unbounded buffer, grows with the payload
        try (Output output = new Output(INITIAL_BUFFER, -1)) {
            kryos.get().writeObject(output, payload);
            return output.toBytes();
        } catch (KryoException e) {
            throw new JobSerializationException("Kryo could not encode " + type.getSimpleName(), e);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        try (Input input = new Input(bytes)) {
            return kryos.get().readObject(input, type);
        } catch (KryoException e) {
            throw new JobSerializationException("Kryo could not decode " + type.getSimpleName(), e);
        }
    }

    /**
     * Payload types are tagged by the {@link PayloadRegistry}, so Kryo itself runs unregistered.
     */
    static Kryo unregisteredKryo() {
        Kryo kryo = new Kryo();
        kryo.setRegistrationRequired(false);
        kryo.setReferences(true);
        return kryo;
    }

    @FunctionalInterface
    public interface KryoFactory {
        Kryo create();
    }
}
