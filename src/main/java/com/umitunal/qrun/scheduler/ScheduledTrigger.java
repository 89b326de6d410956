package com.umitunal.qrun.scheduler;

/**
 * A trigger as currently held by a {@link TimerSource}.
 */
public class ScheduledTrigger {
    private final String hook;
    private final String intervalName;
    private final long nextFireTime;

    private ScheduledTrigger(String hook, String intervalName, long nextFireTime) {
        this.hook = hook;
        this.intervalName = intervalName;
        this.nextFireTime = nextFireTime;
    }

    public static ScheduledTrigger recurring(String hook, String intervalName, long nextFireTime) {
        return new ScheduledTrigger(hook, intervalName, nextFireTime);
    }

    public static ScheduledTrigger once(String hook, long fireTime) {
        return new ScheduledTrigger(hook, null, fireTime);
    }

    public String getHook() { return hook; }

    /**
     * Name of the recurrence interval, null for a single-fire trigger.
     */
    public String getIntervalName() { return intervalName; }

    /**
     * Epoch seconds.
     */
    public long getNextFireTime() { return nextFireTime; }

    public boolean isRecurring() {
        return intervalName != null;
    }

    ScheduledTrigger withNextFireTime(long nextFireTime) {
        return new ScheduledTrigger(hook, intervalName, nextFireTime);
    }

    @Override
    public String toString() {
        return String.format("ScheduledTrigger{hook='%s', interval=%s, next=%d}",
                hook, isRecurring() ? intervalName : "once", nextFireTime);
    }
}
