package com.umitunal.qrun.scheduler;

/**
 * A named recurrence period the timer source must know before triggers can use it.
 */
public class CustomInterval {
    private final String name;
    private final long periodSeconds;
    private final String displayLabel;

    public CustomInterval(String name, long periodSeconds, String displayLabel) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Interval name must not be blank");
        }
        if (periodSeconds <= 0) {
            throw new IllegalArgumentException("Interval period must be positive: " + periodSeconds);
        }
        this.name = name;
        this.periodSeconds = periodSeconds;
        this.displayLabel = displayLabel;
    }

    public String getName() { return name; }
    public long getPeriodSeconds() { return periodSeconds; }
    public String getDisplayLabel() { return displayLabel; }

    @Override
    public String toString() {
        return name + "(" + periodSeconds + "s)";
    }
}
