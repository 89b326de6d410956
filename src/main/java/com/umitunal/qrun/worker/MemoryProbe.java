package com.umitunal.qrun.worker;

/**
 * Current memory usage of the process, as compared against the worker's memory limit.
 */
@FunctionalInterface
public interface MemoryProbe {

    long usedMegabytes();

    /**
     * Heap in use by this JVM.
     */
    static MemoryProbe runtime() {
        return () -> {
            Runtime runtime = Runtime.getRuntime();
            return (runtime.totalMemory() - runtime.freeMemory()) / (1024 * 1024);
        };
    }
}
