package com.umitunal.qrun.config;

import java.util.Map;

/**
 * Top-level configuration: default driver plus the settings of each backend.
 *
 * Environment: {@code QRUN_QUEUE_DRIVER} and the variables read by the nested configs.
 */
public class QueueConfig {
    public static final String DEFAULT_DRIVER = "polling";

    private final String driver;
    private final StorageConfig storage;
    private final RedisConfig redis;
    private final CacheConfig cache;

    private QueueConfig(Builder builder) {
        this.driver = builder.driver;
        this.storage = builder.storage;
        this.redis = builder.redis;
        this.cache = builder.cache;
    }

    public String getDriver() { return driver; }
    public StorageConfig getStorage() { return storage; }
    public RedisConfig getRedis() { return redis; }
    public CacheConfig getCache() { return cache; }

    /**
     * Configuration read from the process environment.
     */
    public static QueueConfig fromSystemEnvironment() {
        return fromEnvironment(System.getenv()).build();
    }

    public static Builder fromEnvironment(Map<String, String> env) {
        Environment e = new Environment(env);
        return new Builder()
                .withDriver(e.string("QRUN_QUEUE_DRIVER", DEFAULT_DRIVER))
                .withStorage(StorageConfig.fromEnvironment(env).build())
                .withRedis(RedisConfig.fromEnvironment(env).build())
                .withCache(CacheConfig.fromEnvironment(env).build());
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private String driver = DEFAULT_DRIVER;
        private StorageConfig storage = StorageConfig.newBuilder(StorageConfig.DEFAULT_DIRECTORY).build();
        private RedisConfig redis = RedisConfig.newBuilder().build();
        private CacheConfig cache = CacheConfig.newBuilder().build();

        private Builder() {
        }

        public Builder withDriver(String driver) {
            this.driver = driver;
            return this;
        }

        public Builder withStorage(StorageConfig storage) {
            this.storage = storage;
            return this;
        }

        public Builder withRedis(RedisConfig redis) {
            this.redis = redis;
            return this;
        }

        public Builder withCache(CacheConfig cache) {
            this.cache = cache;
            return this;
        }

        public QueueConfig build() {
            return new QueueConfig(this);
        }
    }
}
