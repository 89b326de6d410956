package com.umitunal.qrun.scheduler;

import com.umitunal.qrun.core.Job;
import com.umitunal.qrun.core.JobPayload;
import com.umitunal.qrun.core.ScheduleConfigurationException;
import com.umitunal.qrun.dispatch.Dispatcher;
import com.umitunal.qrun.serialization.PayloadRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Declares recurring and one-shot jobs and reconciles them with a {@link TimerSource}.
 *
 * <pre>{@code
 * scheduler.job(CleanupPayload.class).daily().onQueue("maintenance");
 * scheduler.job(ReportPayload.class, ReportPayload::new).everyMinutes(20).when(() -> reportsEnabled);
 * scheduler.register();
 * }</pre>
 *
 * <p>{@link #register()} can be called any number of times: triggers that already match their
 * spec are left alone, triggers whose interval or time changed are replaced. When a trigger
 * fires, a fresh payload is created, the schedule's overrides are applied and the job is sent
 * through the dispatcher.</p>
 */
public class Scheduler {
    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    static final String HOOK_PREFIX = "qrun_";

    private static final long MINUTE = 60;
    private static final long HOUR = 60 * MINUTE;
    private static final long DAY = 24 * HOUR;

    private static final Pattern EVERY_N_MINUTES = Pattern.compile("\\*/(\\d{1,2}) \\* \\* \\* \\*");

    private final TimerSource timerSource;
    private final Dispatcher dispatcher;
    private final PayloadRegistry payloads;
    private final Clock clock;

    private final Map<Class<?>, ScheduleSpec<?>> jobs = new LinkedHashMap<>();
    private final Map<String, CustomInterval> intervals = new LinkedHashMap<>();
    // hook -> timestamp of the one-shot trigger that already fired
    private final Map<String, Long> firedOnce = new ConcurrentHashMap<>();

    public Scheduler(TimerSource timerSource, Dispatcher dispatcher, PayloadRegistry payloads) {
        this(timerSource, dispatcher, payloads, Clock.systemUTC());
    }

    /**
     * @param payloads registry consulted for payload factories of specs created without one; may be null
     */
    public Scheduler(TimerSource timerSource, Dispatcher dispatcher, PayloadRegistry payloads, Clock clock) {
        this.timerSource = timerSource;
        this.dispatcher = dispatcher;
        this.payloads = payloads;
        this.clock = clock;
        registerDefaultIntervals();
    }

    /**
     * Schedule a payload type whose instances come from the factory registered with the
     * {@link PayloadRegistry}. Replaces an earlier spec of the same type.
     */
    public synchronized <P extends JobPayload> ScheduleSpec<P> job(Class<P> type) {
        return job(type, null);
    }

    public synchronized <P extends JobPayload> ScheduleSpec<P> job(Class<P> type, Supplier<P> factory) {
        ScheduleSpec<P> spec = new ScheduleSpec<>(type, factory, this);
        jobs.put(type, spec);
        return spec;
    }

    public synchronized void addInterval(String name, long seconds, String displayLabel) {
        intervals.put(name, new CustomInterval(name, seconds, displayLabel));
    }

    public synchronized Collection<CustomInterval> intervals() {
        return Collections.unmodifiableList(new ArrayList<>(intervals.values()));
    }

    public synchronized Collection<ScheduleSpec<?>> jobs() {
        return Collections.unmodifiableList(new ArrayList<>(jobs.values()));
    }

    /**
     * Make every interval known to the timer source and reconcile the trigger of every spec.
     * A spec with a configuration error is logged and skipped.
     */
    public synchronized void register() {
        for (CustomInterval interval : intervals.values()) {
            timerSource.registerRecurringTrigger(interval.getName(), interval.getPeriodSeconds(),
                    interval.getDisplayLabel());
        }

        for (ScheduleSpec<?> spec : new ArrayList<>(jobs.values())) {
            try {
                registerJob(spec);
            } catch (ScheduleConfigurationException e) {
                log.error("Skipping schedule of {}: {}", spec.getType().getName(), e.getMessage());
            }
        }
    }

    /**
     * Hook name of a payload type: {@code qrun_} followed by the snake_case simple class name.
     */
    public static String hookName(Class<?> type) {
        String snake = type.getSimpleName().replaceAll("(?<!^)([A-Z])", "_$1");
        return HOOK_PREFIX + snake.toLowerCase(Locale.ROOT);
    }

    private <P extends JobPayload> void registerJob(ScheduleSpec<P> spec) {
        String interval = resolveInterval(spec);
        if (interval.isEmpty()) {
            return;
        }

        validateOverrides(spec);

        String hook = hookName(spec.getType());
        if (!spec.shouldRun()) {
            log.debug("Condition of {} is false, removing its trigger", hook);
            timerSource.unschedule(hook);
            return;
        }

        Supplier<P> factory = resolveFactory(spec);

        if (interval.startsWith(ScheduleSpec.ONCE_PREFIX)) {
            long timestamp = ScheduleSpec.parseOnce(interval);
            timerSource.onFire(hook, args -> {
                firedOnce.put(hook, timestamp);
                fire(spec, factory);
            });
            scheduleOnce(hook, timestamp);
        } else {
            timerSource.onFire(hook, args -> fire(spec, factory));
            CustomInterval known = intervals.get(interval);
            if (known == null) {
                throw new ScheduleConfigurationException("Unknown interval '" + interval + "'");
            }
            // cron steps add their interval during resolution, after the bulk registration above
            timerSource.registerRecurringTrigger(known.getName(), known.getPeriodSeconds(), known.getDisplayLabel());
            scheduleRecurring(hook, interval);
        }
    }

    private static void validateOverrides(ScheduleSpec<?> spec) {
        if (spec.getQueueName() != null && spec.getQueueName().isBlank()) {
            throw new ScheduleConfigurationException("Queue name must not be blank");
        }
        if (spec.getTimeoutSeconds() != null && spec.getTimeoutSeconds() < 0) {
            throw new ScheduleConfigurationException("Timeout must not be negative: " + spec.getTimeoutSeconds());
        }
        if (spec.getMaxAttempts() != null && spec.getMaxAttempts() < 1) {
            throw new ScheduleConfigurationException("Retries must be positive: " + spec.getMaxAttempts());
        }
    }

    private void scheduleOnce(String hook, long timestamp) {
        Optional<ScheduledTrigger> existing = timerSource.scheduledTrigger(hook);
        if (existing.isPresent()
                && (existing.get().isRecurring() || existing.get().getNextFireTime() != timestamp)) {
            log.info("Rescheduling {} to fire once at {}", hook, timestamp);
            timerSource.unschedule(hook);
            existing = Optional.empty();
        }
        if (existing.isEmpty()) {
            Long fired = firedOnce.get(hook);
            if (fired != null && fired == timestamp) {
                log.debug("{} already fired at {}, not scheduling it again", hook, timestamp);
                return;
            }
            timerSource.scheduleOnce(hook, timestamp);
        }
    }

    private void scheduleRecurring(String hook, String interval) {
        Optional<ScheduledTrigger> existing = timerSource.scheduledTrigger(hook);
        if (existing.isPresent() && !interval.equals(existing.get().getIntervalName())) {
            log.info("Moving {} from {} to {}", hook, existing.get().getIntervalName(), interval);
            timerSource.unschedule(hook);
            existing = Optional.empty();
        }
        if (existing.isEmpty()) {
            timerSource.scheduleRecurring(hook, interval, clock.instant().getEpochSecond());
        }
    }

    private <P extends JobPayload> void fire(ScheduleSpec<P> spec, Supplier<P> factory) {
        Job job = new Job(factory.get(), clock);
        if (spec.getQueueName() != null) {
            job.onQueue(spec.getQueueName());
        }
        if (spec.getTimeoutSeconds() != null) {
            job.withTimeout(spec.getTimeoutSeconds());
        }
        if (spec.getMaxAttempts() != null) {
            job.withMaxAttempts(spec.getMaxAttempts());
        }
        dispatcher.dispatch(job).send();
        log.info("Scheduled {} dispatched as {}", spec.getType().getSimpleName(), job.getId());
    }

    private <P extends JobPayload> Supplier<P> resolveFactory(ScheduleSpec<P> spec) {
        if (spec.getFactory() != null) {
            return spec.getFactory();
        }
        if (payloads != null) {
            Optional<Supplier<P>> registered = payloads.factory(spec.getType());
            if (registered.isPresent()) {
                return registered.get();
            }
        }
        throw new ScheduleConfigurationException("No factory for job type " + spec.getType().getName());
    }

    private String resolveInterval(ScheduleSpec<?> spec) {
        String cron = spec.getCronExpression();
        if (cron == null) {
            return spec.getInterval();
        }

        String expression = cron.trim();
        switch (expression) {
            case "@hourly":
                return "hourly";
            case "@daily":
                return "daily";
            case "@weekly":
                return "weekly";
            case "@twicedaily":
                return "twicedaily";
            case "* * * * *":
                return "min";
            default:
                break;
        }

        Matcher matcher = EVERY_N_MINUTES.matcher(expression);
        if (matcher.matches()) {
            int minutes = Integer.parseInt(matcher.group(1));
            if (minutes >= 1 && minutes <= 59) {
                return minutesInterval(minutes);
            }
        }
        throw new ScheduleConfigurationException("Unsupported cron expression '" + cron + "'");
    }

    /**
     * Name of the interval of {@code minutes} minutes, registered on first use.
     */
    synchronized String minutesInterval(int minutes) {
        if (minutes <= 0) {
            throw new IllegalArgumentException("Minutes must be positive: " + minutes);
        }
        if (minutes == 1) {
            return "min";
        }
        String name = minutes + "min";
        if (!intervals.containsKey(name)) {
            addInterval(name, minutes * MINUTE, "Every " + minutes + " Minutes");
        }
        return name;
    }

    private void registerDefaultIntervals() {
        addInterval("min", MINUTE, "Every Minute");
        addInterval("5min", 5 * MINUTE, "Every 5 Minutes");
        addInterval("10min", 10 * MINUTE, "Every 10 Minutes");
        addInterval("15min", 15 * MINUTE, "Every 15 Minutes");
        addInterval("30min", 30 * MINUTE, "Every 30 Minutes");
        addInterval("hourly", HOUR, "Once Hourly");
        addInterval("2hourly", 2 * HOUR, "Every 2 Hours");
        addInterval("3hourly", 3 * HOUR, "Every 3 Hours");
        addInterval("6hourly", 6 * HOUR, "Every 6 Hours");
        addInterval("8hourly", 8 * HOUR, "Every 8 Hours");
        addInterval("12hourly", 12 * HOUR, "Every 12 Hours");
        addInterval("twicedaily", 12 * HOUR, "Twice Daily");
        addInterval("daily", DAY, "Once Daily");
        addInterval("weekly", 7 * DAY, "Once Weekly");
    }
}
