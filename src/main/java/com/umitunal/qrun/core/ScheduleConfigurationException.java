package com.umitunal.qrun.core;

/**
 * A schedule entry refers to an unknown job type or a malformed interval.
 */
public class ScheduleConfigurationException extends QueueException {

    public ScheduleConfigurationException(String message) {
        super(message);
    }
}
