package com.umitunal.qrun.core;

/**
 * The backing store could not be reached or rejected an operation.
 * Transient: callers may retry.
 */
public class QueueConnectionException extends QueueException {

    public QueueConnectionException(String message) {
        super(message);
    }

    public QueueConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
