package com.umitunal.qrun.storage.kv;

import java.util.Optional;

/**
 * Minimal get/set/delete cache, the only primitive the simple KV backend needs.
 *
 * <p>Implementations may evict or expire entries; a queue stored in an evicting cache is only
 * as durable as that cache.</p>
 */
public interface KeyValueCache extends AutoCloseable {

    Optional<byte[]> get(String key);

    void put(String key, byte[] value);

    void delete(String key);

    @Override
    default void close() {
    }
}
