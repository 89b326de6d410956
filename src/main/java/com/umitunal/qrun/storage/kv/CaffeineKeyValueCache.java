package com.umitunal.qrun.storage.kv;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.umitunal.qrun.config.CacheConfig;

import java.util.Optional;

/**
 * In-process {@link KeyValueCache} on Caffeine.
 *
 * <p>Not shared across processes, and entries expire after the configured TTL
 * (measured from the last write).</p>
 */
public class CaffeineKeyValueCache implements KeyValueCache {
    private final Cache<String, byte[]> cache;

    public CaffeineKeyValueCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(config.getTtl())
                .maximumSize(config.getMaxSize())
                .build();
    }

    @Override
    public Optional<byte[]> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(String key, byte[] value) {
        cache.put(key, value);
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
    }

    @Override
    public void close() {
        cache.invalidateAll();
        cache.cleanUp();
    }
}
