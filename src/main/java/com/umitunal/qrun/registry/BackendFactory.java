package com.umitunal.qrun.registry;

import com.umitunal.qrun.core.QueueBackend;

/**
 * Creates a backend for a custom driver name registered with {@link QueueRegistry#extend}.
 */
@FunctionalInterface
public interface BackendFactory {

    QueueBackend create(QueueRegistry registry);
}
