package com.umitunal.qrun.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryQueueStatus implements QueueStatus {
    private static final Logger log = LoggerFactory.getLogger(InMemoryQueueStatus.class);

    private final Set<String> paused = ConcurrentHashMap.newKeySet();

    @Override
    public boolean isPaused(String queueName) {
        return paused.contains(queueName);
    }

    @Override
    public void pause(String queueName) {
        if (paused.add(queueName)) {
            log.info("Queue '{}' paused", queueName);
        }
    }

    @Override
    public void resume(String queueName) {
        if (paused.remove(queueName)) {
            log.info("Queue '{}' resumed", queueName);
        }
    }

    public Set<String> pausedQueues() {
        return Set.copyOf(paused);
    }
}
