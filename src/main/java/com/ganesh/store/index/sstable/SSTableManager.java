package com.ganesh.store.index.sstable;

import com.ganesh.store.StoreMetrics;
import com.ganesh.store.index.IndexConfig;
import com.ganesh.store.index.wal.LogEntry;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Manages the lifecycle of all SSTable files of a record index.
 *
 * <p>Responsibilities:
 * <ul>
 * <li>Loading existing SSTables on startup and discarding unfinished {@code .tmp} files.</li>
 * <li>Point lookups across tables, newest first.</li>
 * <li>Merged scans over all tables.</li>
 * <li>Registering flushed tables and compacting them in the background.</li>
 * </ul>
 *
 * <p>The list of tables is guarded by a {@link ReentrantReadWriteLock}: lookups and scans share the
 * read lock, registration and compaction take the write lock.
 */
public class SSTableManager {
    private static final Logger logger = LoggerFactory.getLogger(SSTableManager.class);

    /** Active tables, newest first. Guarded by {@link #lock}. */
    private final List<SSTableReader> sstableReaders = new ArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ExecutorService compactionExecutor = Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder().setNameFormat("record-index-compaction-%d").setDaemon(true).build());
    private final Compactor compactor = new Compactor();
    private final AtomicBoolean isCompacting = new AtomicBoolean(false);
    private final AtomicLong lastSequence = new AtomicLong();
    private final IndexConfig config;
    private final SSTableWriter writer;
    private final StoreMetrics metrics;

    public SSTableManager(IndexConfig config, StoreMetrics metrics) {
        this.config = config;
        this.metrics = metrics;
        this.writer = new SSTableWriter(config);
    }

    /**
     * Loads every {@code .sst} file in the engine directory, newest first.
     *
     * @throws IOException if a table cannot be opened.
     */
    public void loadSSTables() throws IOException {
        List<Path> files;
        try (Stream<Path> listing = Files.list(config.getDirectory())) {
            files = listing.collect(Collectors.toList());
        }

        List<SSTableReader> loaded = new ArrayList<>();
        for (Path file : files) {
            String name = file.getFileName().toString();
            if (name.endsWith(SSTableWriter.TEMP_EXTENSION)) {
                logger.warn("Removing unfinished SSTable {}", name);
                Files.delete(file);
            } else if (name.endsWith(SSTableWriter.SSTABLE_EXTENSION)) {
                logger.info("Loading SSTable: {}", name);
                loaded.add(new SSTableReader(file));
            }
        }
        loaded.sort(Comparator.comparingLong(SSTableReader::getSequence).reversed());

        lock.writeLock().lock();
        try {
            sstableReaders.addAll(loaded);
            loaded.stream().mapToLong(SSTableReader::getSequence).max()
                    .ifPresent(max -> lastSequence.accumulateAndGet(max, Math::max));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Searches the tables newest to oldest; the first hit, live or tombstone, wins.
     *
     * @param key The key to search for.
     * @return The newest entry for the key, if any table holds one.
     * @throws IOException if a table cannot be read.
     */
    public Optional<LogEntry> find(String key) throws IOException {
        lock.readLock().lock();
        try {
            for (SSTableReader reader : sstableReaders) {
                Optional<LogEntry> entry = reader.find(key, metrics);
                if (entry.isPresent()) {
                    return entry;
                }
            }
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Merges every table into one sorted view, keeping tombstones so that newer layers above the
     * tables can still be applied correctly.
     *
     * @return The newest entry per key across all tables.
     * @throws IOException if a table cannot be read.
     */
    public SortedMap<String, LogEntry> scanAll() throws IOException {
        lock.readLock().lock();
        List<SSTableReader.Scanner> scanners = new ArrayList<>();
        try {
            for (SSTableReader reader : sstableReaders) {
                scanners.add(reader.scan());
            }
            return compactor.merge(scanners, true);
        } finally {
            closeAll(scanners);
            lock.readLock().unlock();
        }
    }

    /**
     * Writes a frozen memtable to a new table and registers it.
     *
     * @param entries The frozen memtable.
     * @throws IOException if the table cannot be written or opened.
     */
    public void flush(SortedMap<String, LogEntry> entries) throws IOException {
        Path sstPath = writer.write(entries, lastSequence.incrementAndGet());
        if (sstPath == null) {
            return;
        }
        SSTableReader reader = new SSTableReader(sstPath);
        lock.writeLock().lock();
        try {
            sstableReaders.add(0, reader);
        } finally {
            lock.writeLock().unlock();
        }
        scheduleCompactionIfNeeded();
    }

    public int getTableCount() {
        lock.readLock().lock();
        try {
            return sstableReaders.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void scheduleCompactionIfNeeded() {
        if (compactionExecutor.isShutdown()) {
            return;
        }
        if (getTableCount() >= config.getCompactionTriggerFileCount() && isCompacting.compareAndSet(false, true)) {
            try {
                compactionExecutor.submit(this::runCompaction);
            } catch (RejectedExecutionException e) {
                isCompacting.set(false);
                logger.debug("Skipping compaction, the index is closing");
            }
        }
    }

    /**
     * Merges all tables into one. The output reuses the sequence number of the newest input and
     * replaces that file by rename before the older inputs are deleted.
     */
    private void runCompaction() {
        boolean compacted = false;
        lock.writeLock().lock();
        try {
            if (sstableReaders.size() < config.getCompactionTriggerFileCount()) {
                return;
            }
            metrics.compactions.increment();
            List<SSTableReader> inputs = new ArrayList<>(sstableReaders);
            logger.info("Compacting {} SSTables", inputs.size());

            SortedMap<String, LogEntry> merged;
            List<SSTableReader.Scanner> scanners = new ArrayList<>();
            try {
                for (SSTableReader reader : inputs) {
                    scanners.add(reader.scan());
                }
                merged = compactor.merge(scanners, false);
            } finally {
                closeAll(scanners);
            }

            // The open readers still hold the replaced file, so a failed write leaves the table set intact.
            SSTableReader newest = inputs.get(0);
            SSTableReader output = null;
            if (!merged.isEmpty()) {
                output = new SSTableReader(writer.write(merged, newest.getSequence()));
            }

            for (SSTableReader reader : inputs) {
                reader.close();
            }
            sstableReaders.clear();
            if (output != null) {
                sstableReaders.add(output);
            } else {
                Files.deleteIfExists(newest.getFilePath());
            }
            for (SSTableReader reader : inputs.subList(1, inputs.size())) {
                Files.deleteIfExists(reader.getFilePath());
            }
            logger.info("Compaction complete: {} live records in {} table(s)", merged.size(), sstableReaders.size());
            compacted = true;
        } catch (IOException | RuntimeException e) {
            logger.error("Compaction failed", e);
        } finally {
            isCompacting.set(false);
            lock.writeLock().unlock();
        }
        // Tables flushed while this run held the lock were not part of it.
        if (compacted) {
            scheduleCompactionIfNeeded();
        }
    }

    private static void closeAll(List<SSTableReader.Scanner> scanners) {
        for (SSTableReader.Scanner scanner : scanners) {
            try {
                scanner.close();
            } catch (IOException e) {
                logger.warn("Failed to close SSTable scanner", e);
            }
        }
    }

    /**
     * Waits for a running compaction and closes every table.
     *
     * @throws IOException if closing a table fails.
     */
    public void close() throws IOException {
        compactionExecutor.shutdown();
        try {
            if (!compactionExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Compaction executor did not terminate in the allotted time.");
            }
        } catch (InterruptedException e) {
            logger.error("Compaction executor shutdown was interrupted.", e);
            Thread.currentThread().interrupt();
        }

        lock.writeLock().lock();
        try {
            for (SSTableReader reader : sstableReaders) {
                reader.close();
            }
            sstableReaders.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
