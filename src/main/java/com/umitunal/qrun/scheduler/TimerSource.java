package com.umitunal.qrun.scheduler;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Consumer;

/**
 * The timer the scheduler installs its triggers into. Triggers are identified by hook name;
 * a hook has at most one trigger. All times are epoch seconds.
 */
public interface TimerSource {

    /**
     * Make a named interval known. Registering the same name again replaces it.
     */
    void registerRecurringTrigger(String intervalName, long intervalSeconds, String displayLabel);

    /**
     * Fire the hook every interval, first at {@code startTime}.
     */
    void scheduleRecurring(String hook, String intervalName, long startTime);

    void scheduleOnce(String hook, long timestamp);

    /**
     * Remove the trigger of a hook, if any. The hook callback stays installed.
     */
    void unschedule(String hook);

    OptionalLong nextFireTime(String hook);

    /**
     * Run the hook callback now, outside its schedule.
     */
    void fireImmediately(String hook, List<Object> args);

    Optional<ScheduledTrigger> scheduledTrigger(String hook);

    /**
     * Install the callback that runs when the hook fires, replacing any previous one.
     */
    void onFire(String hook, Consumer<List<Object>> callback);
}
