package com.ganesh.store.index;

import com.ganesh.store.Item;
import com.ganesh.store.StoreMetrics;
import com.ganesh.store.exception.DuplicateRecordException;
import com.ganesh.store.exception.IndexException;
import com.ganesh.store.index.sstable.SSTableManager;
import com.ganesh.store.index.wal.LogEntry;
import com.ganesh.store.index.wal.WriteAheadLog;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * A {@link RecordIndex} backed by an embedded log-structured merge tree.
 *
 * <p>Components:
 * <ul>
 * <li><b>Memtable:</b> a sorted in-memory map receiving all writes.</li>
 * <li><b>Write-ahead log:</b> every mutation is logged before it reaches the memtable.</li>
 * <li><b>SSTables:</b> immutable sorted files holding flushed memtables.</li>
 * </ul>
 * When the memtable passes its size threshold it is frozen, replaced by an empty one, and written
 * to an SSTable on a background thread. A frozen memtable stays readable until its SSTable is
 * registered, so reads never see a gap. Deletes are tombstones that compaction removes.
 *
 * <p>Reads are lock free. Mutations are serialized by a single lock, which is what makes
 * {@link #insert(Item)} an atomic insert-if-absent.
 *
 * @see WriteAheadLog
 * @see SSTableManager
 */
public class DurableRecordIndex implements RecordIndex {
    private static final Logger logger = LoggerFactory.getLogger(DurableRecordIndex.class);

    private final ExecutorService flushExecutor = Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder().setNameFormat("record-index-flush-%d").setDaemon(true).build());
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    /** Set by the first failed flush; from then on the index only serves reads. */
    private volatile IndexException flushFailure;

    private volatile ConcurrentSkipListMap<String, LogEntry> memtable = new ConcurrentSkipListMap<>();
    /** Memtables waiting for their flush, newest first. */
    private final List<FrozenMemtable> frozenMemtables = new CopyOnWriteArrayList<>();
    /** Guarded by {@link #writeLock}. */
    private long memtableSizeInBytes;

    private final IndexConfig config;
    private final StoreMetrics metrics;
    private final ItemCodec codec = new ItemCodec();
    private final WriteAheadLog wal;
    private final SSTableManager sstableManager;

    private static final class FrozenMemtable {
        final SortedMap<String, LogEntry> entries;
        final List<Path> walSegments;

        FrozenMemtable(SortedMap<String, LogEntry> entries, List<Path> walSegments) {
            this.entries = entries;
            this.walSegments = walSegments;
        }
    }

    private DurableRecordIndex(IndexConfig config, StoreMetrics metrics) {
        this.config = config;
        this.metrics = metrics;
        this.wal = new WriteAheadLog(config.getDirectory(), config.getWalSyncInterval());
        this.sstableManager = new SSTableManager(config, metrics);
    }

    /**
     * Opens the index in the configured directory, creating it if needed, loading existing
     * SSTables and replaying the write-ahead log.
     *
     * @param config  The engine configuration.
     * @param metrics Collector for engine statistics.
     * @return The open index.
     * @throws IndexException if the directory cannot be prepared or the recovery fails.
     */
    public static DurableRecordIndex open(IndexConfig config, StoreMetrics metrics) {
        DurableRecordIndex index = new DurableRecordIndex(config, metrics);
        index.start();
        return index;
    }

    private void start() {
        logger.info("Record index starting in {}", config.getDirectory());
        try {
            Files.createDirectories(config.getDirectory());
            sstableManager.loadSSTables();
            wal.replay(memtable);
            for (LogEntry entry : memtable.values()) {
                memtableSizeInBytes += entry.sizeInBytes();
            }
        } catch (IOException e) {
            throw new IndexException("Failed to open record index in " + config.getDirectory(), e);
        }
        logger.info("Record index started with {} SSTable(s) and {} recovered entries",
                sstableManager.getTableCount(), memtable.size());
    }

    @Override
    public Optional<Item> get(String id) {
        ensureOpen();
        Optional<LogEntry> entry = lookup(id);
        if (entry.isEmpty() || entry.get().isTombstone()) {
            return Optional.empty();
        }
        return Optional.of(decode(entry.get()));
    }

    @Override
    public boolean contains(String id) {
        ensureOpen();
        Optional<LogEntry> entry = lookup(id);
        return entry.isPresent() && !entry.get().isTombstone();
    }

    @Override
    public void insert(Item item) {
        if (item.getId() == null) {
            throw new IllegalArgumentException("Item has no ID");
        }
        writeLock.lock();
        try {
            ensureWritable();
            Optional<LogEntry> existing = lookup(item.getId());
            if (existing.isPresent() && !existing.get().isTombstone()) {
                throw new DuplicateRecordException(item.getId());
            }
            append(LogEntry.of(item.getId(), codec.encode(item)));
        } catch (IOException e) {
            throw new IndexException("Failed to insert record " + item.getId(), e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean delete(String id) {
        writeLock.lock();
        try {
            ensureWritable();
            Optional<LogEntry> existing = lookup(id);
            if (existing.isEmpty() || existing.get().isTombstone()) {
                return false;
            }
            append(LogEntry.tombstone(id));
            return true;
        } catch (IOException e) {
            throw new IndexException("Failed to delete record " + id, e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<Item> findExpiredBefore(Instant now) {
        return findAll().stream()
                .filter(item -> item.getExpires().isBefore(now))
                .collect(Collectors.toList());
    }

    /**
     * Builds a merged view of every layer: SSTables first, then frozen memtables oldest to newest,
     * then the live memtable. The memory layers are captured before the tables are scanned, so a
     * flush finishing in between can only make an entry appear twice, never vanish.
     */
    @Override
    public List<Item> findAll() {
        ensureOpen();
        ConcurrentSkipListMap<String, LogEntry> live = memtable;
        List<FrozenMemtable> frozen = new ArrayList<>(frozenMemtables);
        SortedMap<String, LogEntry> view;
        try {
            view = sstableManager.scanAll();
        } catch (IOException e) {
            throw new IndexException("Failed to scan record index", e);
        }
        Collections.reverse(frozen);
        for (FrozenMemtable table : frozen) {
            view.putAll(table.entries);
        }
        view.putAll(live);

        List<Item> items = new ArrayList<>();
        for (LogEntry entry : view.values()) {
            if (!entry.isTombstone()) {
                items.add(decode(entry));
            }
        }
        return items;
    }

    /**
     * Freezes the current memtable and waits until it has been written to an SSTable.
     *
     * @throws IndexException if the flush fails.
     */
    public void flush() {
        Future<?> pending;
        writeLock.lock();
        try {
            ensureWritable();
            pending = freezeMemtable();
        } catch (IOException e) {
            throw new IndexException("Failed to roll the write-ahead log", e);
        } finally {
            writeLock.unlock();
        }
        if (pending == null) {
            return;
        }
        try {
            pending.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IndexException("Interrupted while waiting for memtable flush", e);
        } catch (ExecutionException e) {
            throw new IndexException("Memtable flush failed", e.getCause());
        }
    }

    /**
     * @return The number of SSTables currently on disk.
     */
    public int getTableCount() {
        return sstableManager.getTableCount();
    }

    private Optional<LogEntry> lookup(String id) {
        LogEntry entry = memtable.get(id);
        if (entry != null) {
            return Optional.of(entry);
        }
        for (FrozenMemtable table : frozenMemtables) {
            entry = table.entries.get(id);
            if (entry != null) {
                return Optional.of(entry);
            }
        }
        try {
            return sstableManager.find(id);
        } catch (IOException e) {
            throw new IndexException("Failed to read record " + id, e);
        }
    }

    /** Caller holds {@link #writeLock}. */
    private void append(LogEntry entry) throws IOException {
        wal.writeEntry(entry);
        metrics.walWrites.increment();
        memtable.put(entry.getKey(), entry);
        memtableSizeInBytes += entry.sizeInBytes();

        if (memtableSizeInBytes > config.getMemtableThresholdBytes()) {
            freezeMemtable();
        }
    }

    /**
     * Swaps in an empty memtable and hands the old one to the flush thread. Once the SSTable is
     * registered the covering WAL segments are deleted and the frozen memtable is dropped. If the
     * flush fails both are kept: reads still see the data and a restart replays it.
     *
     * <p>A failed flush also stops all later flushes and writes. A newer SSTable written after it
     * would sit below the kept WAL segments on the next replay and could be overridden by them.
     * Caller holds {@link #writeLock}.
     */
    private Future<?> freezeMemtable() throws IOException {
        if (memtable.isEmpty()) {
            return null;
        }
        metrics.memtableFlushes.increment();
        List<Path> retiredSegments = wal.rollNewSegment();
        FrozenMemtable frozen = new FrozenMemtable(memtable, retiredSegments);
        frozenMemtables.add(0, frozen);
        this.memtable = new ConcurrentSkipListMap<>();
        this.memtableSizeInBytes = 0;

        return flushExecutor.submit(() -> {
            IndexException earlierFailure = flushFailure;
            if (earlierFailure != null) {
                throw new IndexException("Flush skipped after an earlier flush failure", earlierFailure);
            }
            try {
                sstableManager.flush(frozen.entries);
                frozenMemtables.remove(frozen);
                wal.deleteSegments(frozen.walSegments);
            } catch (IOException | RuntimeException e) {
                logger.error("Background flush failed, the record index is now read-only", e);
                flushFailure = new IndexException("Memtable flush failed, the record index is read-only", e);
                throw e;
            }
            return null;
        });
    }

    private Item decode(LogEntry entry) {
        try {
            return codec.decode(entry.getRecord());
        } catch (IOException e) {
            throw new IndexException("Corrupt record for key " + entry.getKey(), e);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Record index is closed");
        }
    }

    private void ensureWritable() {
        ensureOpen();
        IndexException failure = flushFailure;
        if (failure != null) {
            throw new IndexException("Record index is read-only after a failed flush; reopen to recover", failure);
        }
    }

    /**
     * Waits for pending flushes, then closes the WAL and every SSTable. Entries still in the
     * memtable are safe in the WAL and are replayed on the next open.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.info("Record index closing");
        try {
            flushExecutor.shutdown();
            if (!flushExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Flush executor did not terminate in time.");
            }
            wal.close();
            sstableManager.close();
        } catch (IOException e) {
            throw new IndexException("Failed to close record index cleanly", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IndexException("Interrupted while closing record index", e);
        }
    }
}
