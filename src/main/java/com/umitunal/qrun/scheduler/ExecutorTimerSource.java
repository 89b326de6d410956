package com.umitunal.qrun.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * In-process {@link TimerSource} on a single-threaded {@link ScheduledExecutorService}.
 *
 * Triggers live in memory only and are lost on shutdown; the scheduler recreates them on its
 * next registration. Callbacks run one at a time on the timer thread.
 */
public class ExecutorTimerSource implements TimerSource, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExecutorTimerSource.class);

    private final ScheduledExecutorService executor;
    private final Clock clock;

    private final Map<String, Long> intervals = new ConcurrentHashMap<>();
    private final Map<String, Consumer<List<Object>>> callbacks = new ConcurrentHashMap<>();
    private final Map<String, Entry> triggers = new ConcurrentHashMap<>();

    public ExecutorTimerSource() {
        this(Clock.systemUTC());
    }

    public ExecutorTimerSource(Clock clock) {
        this.clock = clock;
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "qrun-timer");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void registerRecurringTrigger(String intervalName, long intervalSeconds, String displayLabel) {
        intervals.put(intervalName, intervalSeconds);
    }

    @Override
    public synchronized void scheduleRecurring(String hook, String intervalName, long startTime) {
        Long period = intervals.get(intervalName);
        if (period == null) {
            throw new IllegalArgumentException("Unknown interval '" + intervalName + "'");
        }
        cancel(hook);

        long delay = Math.max(0, startTime - now());
        ScheduledTrigger trigger = ScheduledTrigger.recurring(hook, intervalName, startTime);
        Entry entry = new Entry(trigger);
        triggers.put(hook, entry);
        entry.future = executor.scheduleAtFixedRate(() -> {
            entry.trigger = entry.trigger.withNextFireTime(entry.trigger.getNextFireTime() + period);
            fire(hook, List.of());
        }, delay, period, TimeUnit.SECONDS);
        log.debug("Scheduled {} every {} ({}s), first at {}", hook, intervalName, period, startTime);
    }

    @Override
    public synchronized void scheduleOnce(String hook, long timestamp) {
        cancel(hook);

        long delay = Math.max(0, timestamp - now());
        Entry entry = new Entry(ScheduledTrigger.once(hook, timestamp));
        triggers.put(hook, entry);
        entry.future = executor.schedule(() -> {
            triggers.remove(hook, entry);
            fire(hook, List.of());
        }, delay, TimeUnit.SECONDS);
        log.debug("Scheduled {} once at {}", hook, timestamp);
    }

    @Override
    public synchronized void unschedule(String hook) {
        if (cancel(hook)) {
            log.debug("Unscheduled {}", hook);
        }
    }

    @Override
    public OptionalLong nextFireTime(String hook) {
        Entry entry = triggers.get(hook);
        return entry == null ? OptionalLong.empty() : OptionalLong.of(entry.trigger.getNextFireTime());
    }

    @Override
    public void fireImmediately(String hook, List<Object> args) {
        executor.execute(() -> fire(hook, args));
    }

    @Override
    public Optional<ScheduledTrigger> scheduledTrigger(String hook) {
        Entry entry = triggers.get(hook);
        return entry == null ? Optional.empty() : Optional.of(entry.trigger);
    }

    @Override
    public void onFire(String hook, Consumer<List<Object>> callback) {
        callbacks.put(hook, callback);
    }

    @Override
    public void close() {
        executor.shutdownNow();
        triggers.clear();
    }

    private boolean cancel(String hook) {
        Entry previous = triggers.remove(hook);
        if (previous == null) {
            return false;
        }
        previous.future.cancel(false);
        return true;
    }

    private void fire(String hook, List<Object> args) {
        Consumer<List<Object>> callback = callbacks.get(hook);
        if (callback == null) {
            log.warn("Trigger {} fired but no callback is installed", hook);
            return;
        }
        try {
            callback.accept(args);
        } catch (RuntimeException e) {
            log.error("Callback of trigger {} failed", hook, e);
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    private static final class Entry {
        private volatile ScheduledTrigger trigger;
        private volatile ScheduledFuture<?> future;

        private Entry(ScheduledTrigger trigger) {
            this.trigger = trigger;
        }
    }
}
