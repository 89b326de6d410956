package com.umitunal.qrun.scheduler;

import com.umitunal.qrun.core.JobPayload;
import com.umitunal.qrun.core.ScheduleConfigurationException;

import java.time.Instant;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Schedule of one payload type, built fluently from {@link Scheduler#job(Class)}.
 *
 * <p>The interval is either the name of a recurrence interval known to the scheduler or a
 * single-fire marker {@code once:<epochSeconds>} set by {@link #at(Instant)}. Setting one
 * replaces the other, as does {@link #cron(String)}.</p>
 *
 * @param <P> the payload type
 */
public class ScheduleSpec<P extends JobPayload> {
    static final String ONCE_PREFIX = "once:";

    private final Class<P> type;
    private final Supplier<P> factory;
    private final Scheduler scheduler;

    private String interval = "";
    private String cronExpression;
    private String queueName;
    private Integer timeoutSeconds;
    private Integer maxAttempts;
    private BooleanSupplier condition;

    ScheduleSpec(Class<P> type, Supplier<P> factory, Scheduler scheduler) {
        this.type = type;
        this.factory = factory;
        this.scheduler = scheduler;
    }

    public ScheduleSpec<P> interval(String interval) {
        this.interval = interval == null ? "" : interval;
        this.cronExpression = null;
        return this;
    }

    public ScheduleSpec<P> everyMinute() {
        return interval("min");
    }

    public ScheduleSpec<P> everyFiveMinutes() {
        return interval("5min");
    }

    public ScheduleSpec<P> everyTenMinutes() {
        return interval("10min");
    }

    public ScheduleSpec<P> everyFifteenMinutes() {
        return interval("15min");
    }

    public ScheduleSpec<P> everyThirtyMinutes() {
        return interval("30min");
    }

    /**
     * Run every {@code minutes} minutes. Registers the interval {@code <minutes>min}
     * with the scheduler when it does not exist yet.
     */
    public ScheduleSpec<P> everyMinutes(int minutes) {
        return interval(scheduler.minutesInterval(minutes));
    }

    public ScheduleSpec<P> hourly() {
        return interval("hourly");
    }

    public ScheduleSpec<P> everyTwoHours() {
        return interval("2hourly");
    }

    public ScheduleSpec<P> twiceDaily() {
        return interval("twicedaily");
    }

    public ScheduleSpec<P> daily() {
        return interval("daily");
    }

    public ScheduleSpec<P> weekly() {
        return interval("weekly");
    }

    /**
     * Fire once at the given time.
     */
    public ScheduleSpec<P> at(Instant time) {
        return at(time.getEpochSecond());
    }

    public ScheduleSpec<P> at(long epochSeconds) {
        return interval(ONCE_PREFIX + epochSeconds);
    }

    /**
     * Schedule with a cron expression. Only the forms that map onto an interval are accepted:
     * {@code @hourly}, {@code @daily}, {@code @weekly}, {@code @twicedaily},
     * {@code * * * * *} and {@code *}{@code /N * * * *}. Anything else fails at registration.
     */
    public ScheduleSpec<P> cron(String expression) {
        this.interval = "";
        this.cronExpression = expression;
        return this;
    }

    /**
     * Only keep the trigger while the condition holds; evaluated on every registration.
     */
    public ScheduleSpec<P> when(BooleanSupplier condition) {
        this.condition = condition;
        return this;
    }

    /**
     * Remove the trigger while the condition holds.
     */
    public ScheduleSpec<P> skip(BooleanSupplier condition) {
        this.condition = () -> !condition.getAsBoolean();
        return this;
    }

    public ScheduleSpec<P> onQueue(String queueName) {
        this.queueName = queueName;
        return this;
    }

    public ScheduleSpec<P> timeout(int seconds) {
        this.timeoutSeconds = seconds;
        return this;
    }

    public ScheduleSpec<P> retries(int maxAttempts) {
        this.maxAttempts = maxAttempts;
        return this;
    }

    public Class<P> getType() { return type; }
    public String getQueueName() { return queueName; }
    public Integer getTimeoutSeconds() { return timeoutSeconds; }
    public Integer getMaxAttempts() { return maxAttempts; }
    public String getCronExpression() { return cronExpression; }

    /**
     * Interval as set, empty when none was set or when a cron expression is pending resolution.
     */
    public String getInterval() {
        return interval;
    }

    public boolean isOneShot() {
        return interval.startsWith(ONCE_PREFIX);
    }

    Supplier<P> getFactory() {
        return factory;
    }

    /**
     * Evaluate the condition.
     *
     * @throws ScheduleConfigurationException if the condition itself throws
     */
    public boolean shouldRun() {
        if (condition == null) {
            return true;
        }
        try {
            return condition.getAsBoolean();
        } catch (RuntimeException e) {
            throw new ScheduleConfigurationException("Condition of " + type.getSimpleName() + " failed: " + e);
        }
    }

    static long parseOnce(String interval) {
        try {
            return Long.parseLong(interval.substring(ONCE_PREFIX.length()));
        } catch (NumberFormatException e) {
            throw new ScheduleConfigurationException("Malformed one-shot interval: " + interval);
        }
    }

    @Override
    public String toString() {
        return String.format("ScheduleSpec{type=%s, interval='%s', cron=%s, queue=%s}",
                type.getSimpleName(), interval, cronExpression, queueName);
    }
}
