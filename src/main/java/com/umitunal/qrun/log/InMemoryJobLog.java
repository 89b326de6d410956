package com.umitunal.qrun.log;

import com.umitunal.qrun.core.Job;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Bounded in-memory job log. Keeps the most recent {@value #DEFAULT_MAX_ENTRIES} entries by default;
 * older ones are evicted as new ones arrive.
 */
public class InMemoryJobLog implements JobLog {
    public static final int DEFAULT_MAX_ENTRIES = 1000;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final Deque<JobLogEntry> entries = new ArrayDeque<>();
    private final int maxEntries;
    private final Clock clock;

    public InMemoryJobLog() {
        this(DEFAULT_MAX_ENTRIES, Clock.systemUTC());
    }

    public InMemoryJobLog(int maxEntries, Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("Max entries must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    @Override
    public synchronized void log(JobStatus status, Job job, String message) {
        entries.addLast(new JobLogEntry(newEntryId(), job.getId(), job.getTypeName(), job.getQueueName(),
                status, message, job.getAttempts(), clock.instant().getEpochSecond()));
        while (entries.size() > maxEntries) {
            entries.removeFirst();
        }
    }

    /**
     * All entries, oldest first.
     */
    public synchronized List<JobLogEntry> all() {
        return new ArrayList<>(entries);
    }

    /**
     * Up to {@code limit} entries, newest first.
     */
    public synchronized List<JobLogEntry> recent(int limit) {
        List<JobLogEntry> result = new ArrayList<>(Math.min(limit, entries.size()));
        Iterator<JobLogEntry> it = entries.descendingIterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(it.next());
        }
        return result;
    }

    public List<JobLogEntry> forType(String typeName) {
        return filter(entry -> entry.getTypeName().equals(typeName));
    }

    public List<JobLogEntry> failed() {
        return filter(entry -> entry.getStatus() == JobStatus.FAILED);
    }

    public List<JobLogEntry> completed() {
        return filter(entry -> entry.getStatus() == JobStatus.COMPLETED);
    }

    /**
     * Drop entries older than {@code age}.
     *
     * @return number of entries removed
     */
    public synchronized int clearOlderThan(Duration age) {
        long cutoff = clock.instant().getEpochSecond() - age.getSeconds();
        int before = entries.size();
        entries.removeIf(entry -> entry.getTimestamp() < cutoff);
        return before - entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized Metrics metrics() {
        int completed = 0;
        int failed = 0;
        Map<String, Integer> byQueue = new LinkedHashMap<>();
        Map<String, Integer> byType = new LinkedHashMap<>();

        for (JobLogEntry entry : entries) {
            if (entry.getStatus() == JobStatus.COMPLETED) {
                completed++;
            } else if (entry.getStatus() == JobStatus.FAILED) {
                failed++;
            }
            byQueue.merge(entry.getQueueName(), 1, Integer::sum);
            byType.merge(entry.getTypeName(), 1, Integer::sum);
        }
        return new Metrics(entries.size(), completed, failed, byQueue, byType);
    }

    private synchronized List<JobLogEntry> filter(Predicate<JobLogEntry> predicate) {
        return entries.stream().filter(predicate).collect(Collectors.toList());
    }

    private static String newEntryId() {
        byte[] bytes = new byte[8];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    /**
     * Counts over the entries currently held.
     */
    public static class Metrics {
        private final int total;
        private final int completed;
        private final int failed;
        private final Map<String, Integer> byQueue;
        private final Map<String, Integer> byType;

        Metrics(int total, int completed, int failed, Map<String, Integer> byQueue, Map<String, Integer> byType) {
            this.total = total;
            this.completed = completed;
            this.failed = failed;
            this.byQueue = Collections.unmodifiableMap(byQueue);
            this.byType = Collections.unmodifiableMap(byType);
        }

        public int getTotal() { return total; }
        public int getCompleted() { return completed; }
        public int getFailed() { return failed; }
        public Map<String, Integer> getByQueue() { return byQueue; }
        public Map<String, Integer> getByType() { return byType; }

        @Override
        public String toString() {
            return String.format("Metrics{total=%d, completed=%d, failed=%d, byQueue=%s, byType=%s}",
                    total, completed, failed, byQueue, byType);
        }
    }
}
