package com.umitunal.qrun.event;

@FunctionalInterface
public interface JobEventListener {

    void onEvent(JobEvent event);
}
