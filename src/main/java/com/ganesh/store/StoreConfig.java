package com.ganesh.store;

import com.ganesh.store.id.IdAllocator;
import com.ganesh.store.index.IndexConfig;
import com.google.common.base.Preconditions;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;

/**
 * Holds the configuration for a {@link DurableItemStore} instance.
 * Use the nested {@link Builder} class to construct a configuration object.
 *
 * <p>The base directory holds two subdirectories: {@value #DATABASE_DIR} for the record index
 * and {@value #STORAGE_DIR} for the blob files.
 */
public class StoreConfig {
    public static final String DATABASE_DIR = "db";
    public static final String STORAGE_DIR = "data";

    private final Path baseDirectory;
    private final boolean autoCleanup;
    private final Duration cleanupInterval;
    private final int maxIdAttempts;
    private final boolean reconcileOnOpen;
    private final Clock clock;
    private final long memtableThresholdBytes;
    private final int compactionTriggerFileCount;
    private final int sstableBlockSizeBytes;
    private final double bloomFilterFpp;
    private final int walSyncInterval;

    private StoreConfig(Builder builder) {
        this.baseDirectory = builder.baseDirectory;
        this.autoCleanup = builder.autoCleanup;
        this.cleanupInterval = builder.cleanupInterval;
        this.maxIdAttempts = builder.maxIdAttempts;
        this.reconcileOnOpen = builder.reconcileOnOpen;
        this.clock = builder.clock;
        this.memtableThresholdBytes = builder.memtableThresholdBytes;
        this.compactionTriggerFileCount = builder.compactionTriggerFileCount;
        this.sstableBlockSizeBytes = builder.sstableBlockSizeBytes;
        this.bloomFilterFpp = builder.bloomFilterFpp;
        this.walSyncInterval = builder.walSyncInterval;
    }

    public Path getBaseDirectory() { return baseDirectory; }
    public Path getDatabaseDirectory() { return baseDirectory.resolve(DATABASE_DIR); }
    public Path getStorageDirectory() { return baseDirectory.resolve(STORAGE_DIR); }
    public boolean isAutoCleanup() { return autoCleanup; }
    public Duration getCleanupInterval() { return cleanupInterval; }
    public int getMaxIdAttempts() { return maxIdAttempts; }
    public boolean isReconcileOnOpen() { return reconcileOnOpen; }
    public Clock getClock() { return clock; }

    /**
     * @return The engine configuration for the record index under {@link #getDatabaseDirectory()}.
     */
    public IndexConfig toIndexConfig() {
        return IndexConfig.builder()
                .withDirectory(getDatabaseDirectory())
                .withMemtableThresholdBytes(memtableThresholdBytes)
                .withCompactionTriggerFileCount(compactionTriggerFileCount)
                .withSstableBlockSizeBytes(sstableBlockSizeBytes)
                .withBloomFilterFpp(bloomFilterFpp)
                .withWalSyncInterval(walSyncInterval)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A builder for creating immutable {@link StoreConfig} instances.
     * Provides default values for all configuration parameters.
     */
    public static class Builder {
        private Path baseDirectory = Paths.get("store");
        private boolean autoCleanup = false;
        private Duration cleanupInterval = Duration.ofMinutes(1);
        private int maxIdAttempts = IdAllocator.DEFAULT_MAX_ATTEMPTS;
        private boolean reconcileOnOpen = true;
        private Clock clock = Clock.systemUTC();
        private long memtableThresholdBytes = 1024 * 1024; // 1 MB
        private int compactionTriggerFileCount = 4;
        private int sstableBlockSizeBytes = 4 * 1024; // 4 KB
        private double bloomFilterFpp = 0.01;
        private int walSyncInterval = 1000;

        public Builder withBaseDirectory(Path baseDirectory) {
            this.baseDirectory = baseDirectory;
            return this;
        }

        /**
         * Enables the background expiry sweep and deletion of expired Items on read.
         * @param autoCleanup Whether expired Items are removed.
         * @return This builder instance for chaining.
         */
        public Builder withAutoCleanup(boolean autoCleanup) {
            this.autoCleanup = autoCleanup;
            return this;
        }

        public Builder withCleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
            return this;
        }

        public Builder withMaxIdAttempts(int maxIdAttempts) {
            this.maxIdAttempts = maxIdAttempts;
            return this;
        }

        public Builder withReconcileOnOpen(boolean reconcileOnOpen) {
            this.reconcileOnOpen = reconcileOnOpen;
            return this;
        }

        /**
         * Sets the clock used to decide expiry. Tests use a fixed or offset clock.
         * @param clock The time source.
         * @return This builder instance for chaining.
         */
        public Builder withClock(Clock clock) {
            this.clock = clock;
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
         * Builds the final, immutable {@link StoreConfig} object.
         * @return A new StoreConfig instance.
         * @throws IllegalArgumentException if a value is out of range.
         */
        public StoreConfig build() {
            Preconditions.checkArgument(baseDirectory != null, "base directory must be set");
            Preconditions.checkArgument(cleanupInterval != null && !cleanupInterval.isNegative() && !cleanupInterval.isZero(),
                    "cleanup interval must be positive");
            Preconditions.checkArgument(maxIdAttempts > 0, "maxIdAttempts must be positive");
            Preconditions.checkArgument(clock != null, "clock must be set");
            return new StoreConfig(this);
        }
    }
}
