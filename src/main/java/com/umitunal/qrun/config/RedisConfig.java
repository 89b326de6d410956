package com.umitunal.qrun.config;

import java.util.Map;

/**
 * Connection settings for the Redis-backed list store.
 *
 * Environment: {@code QRUN_REDIS_HOST}, {@code QRUN_REDIS_PORT}, {@code QRUN_REDIS_USER},
 * {@code QRUN_REDIS_PASSWORD}, {@code QRUN_REDIS_DATABASE}, {@code QRUN_REDIS_PREFIX},
 * {@code QRUN_REDIS_TIMEOUT_MS}, {@code QRUN_REDIS_SSL}.
 */
public class RedisConfig {
    public static final String DEFAULT_PREFIX = "qrun:";

    private final String host;
    private final int port;
    private final String user;
    private final String password;
    private final int database;
    private final String keyPrefix;
    private final int connectTimeoutMillis;
    private final int readTimeoutMillis;
    private final boolean ssl;

    private RedisConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.user = builder.user;
        this.password = builder.password;
        this.database = builder.database;
        this.keyPrefix = builder.keyPrefix;
        this.connectTimeoutMillis = builder.connectTimeoutMillis;
        this.readTimeoutMillis = builder.readTimeoutMillis;
        this.ssl = builder.ssl;
    }

    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getUser() { return user; }
    public String getPassword() { return password; }
    public int getDatabase() { return database; }
    public String getKeyPrefix() { return keyPrefix; }
    public int getConnectTimeoutMillis() { return connectTimeoutMillis; }
    public int getReadTimeoutMillis() { return readTimeoutMillis; }
    public boolean isSsl() { return ssl; }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static Builder fromEnvironment(Map<String, String> env) {
        Environment e = new Environment(env);
        int timeout = e.integer("QRUN_REDIS_TIMEOUT_MS", 1000);
        return new Builder()
                .withHost(e.string("QRUN_REDIS_HOST", "127.0.0.1"))
                .withPort(e.integer("QRUN_REDIS_PORT", 6379))
                .withUser(e.string("QRUN_REDIS_USER", null))
                .withPassword(e.string("QRUN_REDIS_PASSWORD", null))
                .withDatabase(e.integer("QRUN_REDIS_DATABASE", 0))
                .withKeyPrefix(e.string("QRUN_REDIS_PREFIX", DEFAULT_PREFIX))
                .withConnectTimeout(timeout)
                .withReadTimeout(timeout)
                .withSsl(e.bool("QRUN_REDIS_SSL", false));
    }

    @Override
    public String toString() {
        // never includes the password
        return String.format("RedisConfig{host='%s', port=%d, database=%d, prefix='%s', ssl=%s}",
                host, port, database, keyPrefix, ssl);
    }

    public static class Builder {
        private String host = "127.0.0.1";
        private int port = 6379;
        private String user;
        private String password;
        private int database;
        private String keyPrefix = DEFAULT_PREFIX;
        private int connectTimeoutMillis = 1000;
        private int readTimeoutMillis = 1000;
        private boolean ssl;

        private Builder() {
        }

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        /**
         * ACL user name. Leave unset for password-only auth.
         */
        public Builder withUser(String user) {
            this.user = user;
            return this;
        }

        public Builder withPassword(String password) {
            this.password = password;
            return this;
        }

        public Builder withDatabase(int database) {
            this.database = database;
            return this;
        }

        /**
         * Prefix of every key the queue writes.
         * Default: {@value RedisConfig#DEFAULT_PREFIX}
         */
        public Builder withKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
            return this;
        }

        public Builder withConnectTimeout(int millis) {
            this.connectTimeoutMillis = millis;
            return this;
        }

        public Builder withReadTimeout(int millis) {
            this.readTimeoutMillis = millis;
            return this;
        }

        public Builder withSsl(boolean ssl) {
            this.ssl = ssl;
            return this;
        }

        public RedisConfig build() {
            return new RedisConfig(this);
        }
    }
}
