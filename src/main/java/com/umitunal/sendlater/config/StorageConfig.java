package com.umitunal.sendlater.config;

import java.nio.file.Path;

/**
 * Configuration for the RocksDB storage engine.
 */
public class StorageConfig {
    private final Path dataDirectory;
    private final boolean durableWrites;
    private final int memoryBufferSizeMB;
    private final int maxMemoryBuffers;
    private final int backgroundThreads;
    private final int blockCacheSizeMB;

    private StorageConfig(Builder builder) {
        this.dataDirectory = builder.dataDirectory;
        this.durableWrites = builder.durableWrites;
        this.memoryBufferSizeMB = builder.memoryBufferSizeMB;
        this.maxMemoryBuffers = builder.maxMemoryBuffers;
        this.backgroundThreads = builder.backgroundThreads;
        this.blockCacheSizeMB = builder.blockCacheSizeMB;
    }

    public Path getDataDirectory() { return dataDirectory; }
    public boolean isDurableWrites() { return durableWrites; }
    public int getMemoryBufferSizeMB() { return memoryBufferSizeMB; }
    public int getMaxMemoryBuffers() { return maxMemoryBuffers; }
    public int getBackgroundThreads() { return backgroundThreads; }
    public int getBlockCacheSizeMB() { return blockCacheSizeMB; }

    /**
     * Same settings pointed at another directory, used to give each store its own database.
     */
    public StorageConfig withDataDirectory(Path directory) {
        return newBuilder(directory)
                .withDurableWrites(durableWrites)
                .withMemoryBufferSize(memoryBufferSizeMB)
                .withMaxMemoryBuffers(maxMemoryBuffers)
                .withBackgroundThreads(backgroundThreads)
                .withBlockCacheSize(blockCacheSizeMB)
                .build();
    }

    public static Builder newBuilder(Path dataDirectory) {
        return new Builder(dataDirectory);
    }

    public static Builder newBuilder(String dataDirectory) {
        return new Builder(Path.of(dataDirectory));
    }

    public static class Builder {
        private final Path dataDirectory;
        private boolean durableWrites = true;
        private int memoryBufferSizeMB = 16;
        private int maxMemoryBuffers = 3;
        private int backgroundThreads = 2;
        private int blockCacheSizeMB = 32;

        private Builder(Path dataDirectory) {
            this.dataDirectory = dataDirectory;
        }

        /**
         * Fsync the write-ahead log on every write.
         * With this off the WAL is still written, so a process crash loses nothing,
         * but an OS crash can lose the latest writes.
         * Default: true
         */
        public Builder withDurableWrites(boolean enable) {
            this.durableWrites = enable;
            return this;
        }

        /**
         * Set memory buffer size in MB.
         * Default: 16 MB
         */
        public Builder withMemoryBufferSize(int sizeMB) {
            this.memoryBufferSizeMB = sizeMB;
            return this;
        }

        /**
         * Default: 3
         */
        public Builder withMaxMemoryBuffers(int count) {
            this.maxMemoryBuffers = count;
            return this;
        }

        /**
         * Set number of background flush and compaction threads.
         * Default: 2
         */
        public Builder withBackgroundThreads(int count) {
            this.backgroundThreads = count;
            return this;
        }

        /**
         * Default: 32 MB
         */
        public Builder withBlockCacheSize(int sizeMB) {
            this.blockCacheSizeMB = sizeMB;
            return this;
        }

        public StorageConfig build() {
            if (dataDirectory == null) {
                throw new IllegalArgumentException("dataDirectory is required");
            }
            return new StorageConfig(this);
        }
    }
}
