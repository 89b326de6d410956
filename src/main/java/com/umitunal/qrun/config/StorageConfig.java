package com.umitunal.qrun.config;

import java.util.Map;

/**
 * RocksDB settings of the polling backend.
 *
 * Environment: {@code QRUN_ROCKS_PATH}, {@code QRUN_ROCKS_DURABLE},
 * {@code QRUN_ROCKS_WRITE_BUFFER_MB}.
 */
public class StorageConfig {
    static final String DEFAULT_DIRECTORY = "./qrun-data";

    private final String dataDirectory;
    private final boolean durableWrites;
    private final int memoryBufferSizeMB;
    private final int maxMemoryBuffers;
    private final int backgroundThreads;

    private StorageConfig(Builder builder) {
        this.dataDirectory = builder.dataDirectory;
        this.durableWrites = builder.durableWrites;
        this.memoryBufferSizeMB = builder.memoryBufferSizeMB;
        this.maxMemoryBuffers = builder.maxMemoryBuffers;
        this.backgroundThreads = builder.backgroundThreads;
    }

    public String getDataDirectory() { return dataDirectory; }
    public boolean isDurableWrites() { return durableWrites; }
    public int getMemoryBufferSizeMB() { return memoryBufferSizeMB; }
    public int getMaxMemoryBuffers() { return maxMemoryBuffers; }
    public int getBackgroundThreads() { return backgroundThreads; }

    public static Builder newBuilder(String dataDirectory) {
        return new Builder(dataDirectory);
    }

    public static Builder fromEnvironment(Map<String, String> env) {
        Environment e = new Environment(env);
        return new Builder(e.string("QRUN_ROCKS_PATH", DEFAULT_DIRECTORY))
                .withDurableWrites(e.bool("QRUN_ROCKS_DURABLE", true))
                .withMemoryBufferSize(e.integer("QRUN_ROCKS_WRITE_BUFFER_MB", 16));
    }

    @Override
    public String toString() {
        return "StorageConfig{dataDirectory='" + dataDirectory + "', durableWrites=" + durableWrites + '}';
    }

    public static class Builder {
        private final String dataDirectory;
        private boolean durableWrites = true;
        private int memoryBufferSizeMB = 16;
        private int maxMemoryBuffers = 3;
        private int backgroundThreads = 2;

        private Builder(String dataDirectory) {
            this.dataDirectory = dataDirectory;
        }

        /**
         * Sync the WAL on every write. Off trades durability of the last writes for speed,
         * which is what the tests do.
         */
        public Builder withDurableWrites(boolean enable) {
            this.durableWrites = enable;
            return this;
        }

        public Builder withMemoryBufferSize(int sizeMB) {
            this.memoryBufferSizeMB = sizeMB;
            return this;
        }

        public Builder withMaxMemoryBuffers(int count) {
            this.maxMemoryBuffers = count;
            return this;
        }

        /** Flush and compaction threads. */
        public Builder withBackgroundThreads(int count) {
            this.backgroundThreads = count;
            return this;
        }

        public StorageConfig build() {
            if (dataDirectory == null || dataDirectory.isBlank()) {
                throw new IllegalArgumentException("Data directory is required");
            }
            if (memoryBufferSizeMB <= 0 || maxMemoryBuffers <= 0 || backgroundThreads <= 0) {
                throw new IllegalArgumentException("Buffer size, buffer count and background threads must be positive");
            }
            return new StorageConfig(this);
        }
    }
}
