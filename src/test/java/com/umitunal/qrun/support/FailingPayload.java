package com.umitunal.qrun.support;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.umitunal.qrun.core.Job;
import com.umitunal.qrun.core.JobContext;
import com.umitunal.qrun.core.JobPayload;

/**
 * Always throws. Counts its executions and failure callbacks in {@link ExecutionLog}.
 */
public class FailingPayload implements JobPayload {
    private final String name;

    @JsonCreator
    public FailingPayload(@JsonProperty("name") String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public void execute(JobContext context) throws Exception {
        ExecutionLog.executed(name);
        throw new IllegalStateException("boom: " + name);
    }

    @Override
    public void onPermanentFailure(Job job, Exception error) {
        ExecutionLog.failureCallback(name);
    }
}
