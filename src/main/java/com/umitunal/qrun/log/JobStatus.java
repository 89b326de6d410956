package com.umitunal.qrun.log;

public enum JobStatus {
    COMPLETED,
    /** Attempt failed and the job was released for another one. */
    RETRYING,
    /** Attempts exhausted; the job was removed. */
    FAILED
}
