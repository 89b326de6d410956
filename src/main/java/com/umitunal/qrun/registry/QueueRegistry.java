package com.umitunal.qrun.registry;

import com.umitunal.qrun.config.QueueConfig;
import com.umitunal.qrun.core.QueueBackend;
import com.umitunal.qrun.serialization.JobSerializer;
import com.umitunal.qrun.storage.CacheKeyValueQueue;
import com.umitunal.qrun.storage.ListQueue;
import com.umitunal.qrun.storage.RocksPollingQueue;
import com.umitunal.qrun.storage.SyncQueue;
import com.umitunal.qrun.storage.kv.CaffeineKeyValueCache;
import com.umitunal.qrun.storage.list.InMemoryListStoreClient;
import com.umitunal.qrun.storage.list.JedisListStoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves driver names to backend instances and caches one instance per name.
 *
 * <p>Built-in drivers:</p>
 * <ul>
 *   <li>{@code polling}: RocksDB, one blob per queue (default)</li>
 *   <li>{@code redis}: list store on Redis</li>
 *   <li>{@code kv}: blob per queue in an in-process Caffeine cache</li>
 *   <li>{@code memory}: list store held in memory</li>
 *   <li>{@code sync}: runs jobs on push, stores nothing</li>
 *   <li>{@code auto}: {@code redis} when reachable, else {@code polling}</li>
 * </ul>
 *
 * Factories registered with {@link #extend} take precedence over the built-in drivers.
 */
public class QueueRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QueueRegistry.class);

    public static final String POLLING = "polling";
    public static final String REDIS = "redis";
    public static final String KV = "kv";
    public static final String MEMORY = "memory";
    public static final String SYNC = "sync";
    public static final String AUTO = "auto";

    private final QueueConfig config;
    private final JobSerializer serializer;
    private final Clock clock;

    private final Map<String, QueueBackend> connections = new ConcurrentHashMap<>();
    private final Map<String, BackendFactory> customFactories = new ConcurrentHashMap<>();
    private volatile String defaultDriver;
    private volatile String autoDriver;

    public QueueRegistry(QueueConfig config, JobSerializer serializer) {
        this(config, serializer, Clock.systemUTC());
    }

    public QueueRegistry(QueueConfig config, JobSerializer serializer, Clock clock) {
        this.config = config;
        this.serializer = serializer;
        this.clock = clock;
    }

    /**
     * Backend of the default driver.
     */
    public QueueBackend connection() {
        return connection(null);
    }

    /**
     * Backend for a driver name, created on first use.
     *
     * @param name driver name, or null for the default driver
     * @throws IllegalArgumentException for an unknown driver
     */
    public synchronized QueueBackend connection(String name) {
        String driver = name == null ? defaultDriver() : name;
        if (AUTO.equals(driver) && !customFactories.containsKey(AUTO)) {
            driver = autoDriver();
        }
        QueueBackend backend = connections.get(driver);
        if (backend == null) {
            backend = resolve(driver);
            connections.put(driver, backend);
        }
        return backend;
    }

    /**
     * Default driver: the one set with {@link #setDefaultDriver}, else the configured one.
     * A configured {@code auto} is resolved through {@link #detectBestDriver()} on first use
     * and keeps that answer for the life of the registry.
     */
    public String defaultDriver() {
        if (defaultDriver != null) {
            return defaultDriver;
        }
        String configured = config.getDriver();
        if (configured == null || configured.isBlank()) {
            return POLLING;
        }
        return AUTO.equals(configured) ? autoDriver() : configured;
    }

    public void setDefaultDriver(String driver) {
        this.defaultDriver = driver;
    }

    /**
     * Best driver for this environment: {@code redis} when the server answers, else {@code polling}.
     */
    public String detectBestDriver() {
        return isRedisReachable() ? REDIS : POLLING;
    }

    /**
     * Every known driver with a short description; custom drivers included.
     */
    public Map<String, DriverInfo> availableDrivers() {
        Map<String, DriverInfo> drivers = new LinkedHashMap<>();
        drivers.put(POLLING, new DriverInfo(true, "RocksDB at " + config.getStorage().getDataDirectory()));
        drivers.put(SYNC, new DriverInfo(true, "Synchronous execution (no queue)"));
        drivers.put(MEMORY, new DriverInfo(true, "In-process list store"));
        drivers.put(KV, new DriverInfo(true, "In-process Caffeine cache"));
        drivers.put(REDIS, new DriverInfo(isRedisReachable(),
                "Redis server at " + config.getRedis().getHost() + ":" + config.getRedis().getPort()));

        for (String name : customFactories.keySet()) {
            drivers.put(name, new DriverInfo(true, "Custom driver"));
        }
        return drivers;
    }

    public boolean isDriverAvailable(String driver) {
        if (customFactories.containsKey(driver)) {
            return true;
        }
        switch (driver) {
            case POLLING:
            case SYNC:
            case MEMORY:
            case KV:
            case AUTO:
                return true;
            case REDIS:
                return isRedisReachable();
            default:
                return false;
        }
    }

    /**
     * Register a factory for a driver name. Replaces a built-in driver of the same name.
     */
    public void extend(String driver, BackendFactory factory) {
        customFactories.put(driver, factory);
    }

    public QueueConfig getConfig() {
        return config;
    }

    public JobSerializer getSerializer() {
        return serializer;
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * Close every backend created so far.
     */
    @Override
    public synchronized void close() {
        for (Map.Entry<String, QueueBackend> entry : connections.entrySet()) {
            try {
                entry.getValue().close();
            } catch (Exception e) {
                log.warn("Failed to close backend '{}'", entry.getKey(), e);
            }
        }
        connections.clear();
    }

    private QueueBackend resolve(String name) {
        BackendFactory custom = customFactories.get(name);
        if (custom != null) {
            return custom.create(this);
        }

        log.info("Creating queue backend for driver '{}'", name);
        switch (name) {
            case POLLING:
                return new RocksPollingQueue(config.getStorage(), serializer, clock);
            case REDIS:
                return new ListQueue(new JedisListStoreClient(config.getRedis()), serializer,
                        config.getRedis().getKeyPrefix(), clock);
            case KV:
                return new CacheKeyValueQueue(new CaffeineKeyValueCache(config.getCache()), config.getCache(),
                        serializer, clock);
            case MEMORY:
                return new ListQueue(new InMemoryListStoreClient(), serializer, "", clock);
            case SYNC:
                return new SyncQueue();
            default:
                throw new IllegalArgumentException("Queue driver [" + name + "] is not supported.");
        }
    }

    private synchronized String autoDriver() {
        if (autoDriver == null) {
            autoDriver = detectBestDriver();
            log.info("Driver 'auto' resolved to '{}'", autoDriver);
        }
        return autoDriver;
    }

    private boolean isRedisReachable() {
        try (JedisListStoreClient client = new JedisListStoreClient(config.getRedis())) {
            return client.ping();
        } catch (RuntimeException e) {
            log.debug("Redis not usable: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Availability of a driver and a human-readable description.
     */
    public static class DriverInfo {
        private final boolean available;
        private final String info;

        public DriverInfo(boolean available, String info) {
            this.available = available;
            this.info = info;
        }

        public boolean isAvailable() { return available; }
        public String getInfo() { return info; }

        @Override
        public String toString() {
            return (available ? "available" : "unavailable") + ": " + info;
        }
    }
}
