package com.umitunal.qrun.core;

/**
 * A job or payload could not be encoded or decoded.
 * Permanent: a record that fails to decode will never succeed, so it is dropped instead of retried.
 */
public class JobSerializationException extends QueueException {

    public JobSerializationException(String message) {
        super(message);
    }

    public JobSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
