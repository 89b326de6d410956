package com.umitunal.qrun.storage.kv;

import com.umitunal.qrun.config.CacheConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CaffeineKeyValueCacheTest {

    private CaffeineKeyValueCache cache;

    @BeforeEach
    void setUp() {
        cache = new CaffeineKeyValueCache(CacheConfig.newBuilder().build());
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @Test
    @DisplayName("Should store, overwrite and delete values")
    void testPutGetDelete() {
        // Given
        cache.put("qrun:default", new byte[]{1});
        cache.put("qrun:default", new byte[]{2});

        // Then
        assertThat(cache.get("qrun:default")).hasValueSatisfying(v -> assertThat(v).containsExactly(2));

        // When
        cache.delete("qrun:default");

        // Then
        assertThat(cache.get("qrun:default")).isEmpty();
    }

    @Test
    @DisplayName("Should drop everything when closed")
    void testCloseInvalidates() {
        // Given
        cache.put("qrun:emails", new byte[]{1});

        // When
        cache.close();

        // Then
        assertThat(cache.get("qrun:emails")).isEmpty();
    }
}
