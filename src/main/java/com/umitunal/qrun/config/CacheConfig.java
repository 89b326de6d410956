package com.umitunal.qrun.config;

import java.time.Duration;
import java.util.Map;

/**
 * Settings for the key-value cache behind the simple KV backend.
 *
 * Environment: {@code QRUN_KV_PREFIX}, {@code QRUN_KV_TTL_SECONDS}, {@code QRUN_KV_MAX_SIZE}.
 */
public class CacheConfig {
    public static final String DEFAULT_PREFIX = "qrun:";
    public static final Duration DEFAULT_TTL = Duration.ofDays(7);

    private final String keyPrefix;
    private final Duration ttl;
    private final long maxSize;

    private CacheConfig(Builder builder) {
        this.keyPrefix = builder.keyPrefix;
        this.ttl = builder.ttl;
        this.maxSize = builder.maxSize;
    }

    public String getKeyPrefix() { return keyPrefix; }
    public Duration getTtl() { return ttl; }
    public long getMaxSize() { return maxSize; }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static Builder fromEnvironment(Map<String, String> env) {
        Environment e = new Environment(env);
        return new Builder()
                .withKeyPrefix(e.string("QRUN_KV_PREFIX", DEFAULT_PREFIX))
                .withTtl(Duration.ofSeconds(e.integer("QRUN_KV_TTL_SECONDS", (int) DEFAULT_TTL.getSeconds())))
                .withMaxSize(e.integer("QRUN_KV_MAX_SIZE", 10_000));
    }

    public static class Builder {
        private String keyPrefix = DEFAULT_PREFIX;
        private Duration ttl = DEFAULT_TTL;
        private long maxSize = 10_000;

        private Builder() {
        }

        public Builder withKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
            return this;
        }

        /**
         * How long an untouched queue blob survives.
         * Default: 7 days
         */
        public Builder withTtl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        /**
         * Maximum number of cache entries (one per queue plus the queue index).
         */
        public Builder withMaxSize(long maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public CacheConfig build() {
            return new CacheConfig(this);
        }
    }
}
