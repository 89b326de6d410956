package com.umitunal.qrun.serialization;

/**
 * Interface for encoding and decoding job payloads.
 *
 * @param <T> the type of payload
 */
public interface PayloadCodec<T> {

    /**
     * Encode a payload to bytes.
     *
     * @throws com.umitunal.qrun.core.JobSerializationException if the payload cannot be encoded
     */
    byte[] encode(T payload);

    /**
     * Decode bytes to a payload.
     *
     * @throws com.umitunal.qrun.core.JobSerializationException if the bytes are not a valid payload
     */
    T decode(byte[] bytes);
}
