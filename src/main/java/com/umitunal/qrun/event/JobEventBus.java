package com.umitunal.qrun.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans worker events out to registered listeners, on the worker thread.
 *
 * A listener that throws is logged and skipped; it never affects the job or the other listeners.
 */
public class JobEventBus {
    private static final Logger log = LoggerFactory.getLogger(JobEventBus.class);

    private final List<JobEventListener> listeners = new CopyOnWriteArrayList<>();

    public JobEventBus subscribe(JobEventListener listener) {
        listeners.add(listener);
        return this;
    }

    /**
     * Listener that only receives events of one type.
     */
    public <E extends JobEvent> JobEventBus subscribe(Class<E> type, Consumer<E> handler) {
        return subscribe(event -> {
            if (type.isInstance(event)) {
                handler.accept(type.cast(event));
            }
        });
    }

    public void unsubscribe(JobEventListener listener) {
        listeners.remove(listener);
    }

    public void publish(JobEvent event) {
        log.trace("Publishing {}", event);
        for (JobEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Event listener failed on {}", event, e);
            }
        }
    }
}
