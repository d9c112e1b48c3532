package com.ganesh.store.index;

import com.google.common.base.Preconditions;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Holds the configuration for a {@link DurableRecordIndex}.
 * Use the nested {@link Builder} class to construct a configuration object.
 */
public class IndexConfig {
    private final Path directory;
    private final long memtableThresholdBytes;
    private final int compactionTriggerFileCount;
    private final int sstableBlockSizeBytes;
    private final double bloomFilterFpp;
    private final int walSyncInterval;

    private IndexConfig(Builder builder) {
        this.directory = builder.directory;
        this.memtableThresholdBytes = builder.memtableThresholdBytes;
        this.compactionTriggerFileCount = builder.compactionTriggerFileCount;
        this.sstableBlockSizeBytes = builder.sstableBlockSizeBytes;
        this.bloomFilterFpp = builder.bloomFilterFpp;
        this.walSyncInterval = builder.walSyncInterval;
    }

    public Path getDirectory() { return directory; }
    public long getMemtableThresholdBytes() { return memtableThresholdBytes; }
    public int getCompactionTriggerFileCount() { return compactionTriggerFileCount; }
    public int getSstableBlockSizeBytes() { return sstableBlockSizeBytes; }
    public double getBloomFilterFpp() { return bloomFilterFpp; }
    public int getWalSyncInterval() { return walSyncInterval; }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A builder for creating immutable {@link IndexConfig} instances.
     * Provides default values for all configuration parameters.
     */
    public static class Builder {
        private Path directory = Paths.get("db");
        private long memtableThresholdBytes = 1024 * 1024; // 1 MB
        private int compactionTriggerFileCount = 4;
        private int sstableBlockSizeBytes = 4 * 1024; // 4 KB
        private double bloomFilterFpp = 0.01;
        private int walSyncInterval = 1000;

        /**
         * Sets the directory holding the WAL segments and SSTables.
         * @param directory The engine directory.
         * @return This builder instance for chaining.
         */
        public Builder withDirectory(Path directory) {
            this.directory = directory;
            return this;
        }

        public Builder withMemtableThresholdBytes(long memtableThresholdBytes) {
            this.memtableThresholdBytes = memtableThresholdBytes;
            return this;
        }

        public Builder withCompactionTriggerFileCount(int count) {
            this.compactionTriggerFileCount = count;
            return this;
        }

        public Builder withSstableBlockSizeBytes(int bytes) {
            this.sstableBlockSizeBytes = bytes;
            return this;
        }

        public Builder withBloomFilterFpp(double fpp) {
            this.bloomFilterFpp = fpp;
            return this;
        }

        public Builder withWalSyncInterval(int writes) {
            this.walSyncInterval = writes;
            return this;
        }

        /**
         * Builds the final, immutable {@link IndexConfig} object.
         * @return A new IndexConfig instance.
         * @throws IllegalArgumentException if a value is out of range.
         */
        public IndexConfig build() {
            Preconditions.checkArgument(directory != null, "directory must be set");
            Preconditions.checkArgument(memtableThresholdBytes > 0, "memtable threshold must be positive");
            Preconditions.checkArgument(compactionTriggerFileCount >= 2, "compaction needs at least two files");
            Preconditions.checkArgument(sstableBlockSizeBytes > 0, "block size must be positive");
            Preconditions.checkArgument(bloomFilterFpp > 0 && bloomFilterFpp < 1, "bloom filter fpp must be in (0, 1)");
            Preconditions.checkArgument(walSyncInterval > 0, "WAL sync interval must be positive");
            return new IndexConfig(this);
        }
    }
}
