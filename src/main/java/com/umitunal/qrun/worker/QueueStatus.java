package com.umitunal.qrun.worker;

/**
 * Administrative pause flag per queue name. Workers read it before every pop.
 */
public interface QueueStatus {

    boolean isPaused(String queueName);

    void pause(String queueName);

    void resume(String queueName);
}
