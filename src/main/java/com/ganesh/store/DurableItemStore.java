package com.ganesh.store;

import com.ganesh.store.blob.BlobStore;
import com.ganesh.store.exception.BlobStoreException;
import com.ganesh.store.exception.DuplicateRecordException;
import com.ganesh.store.exception.IdAllocationException;
import com.ganesh.store.exception.ItemNotFoundException;
import com.ganesh.store.id.IdAllocator;
import com.ganesh.store.index.DurableRecordIndex;
import com.ganesh.store.index.RecordIndex;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * An {@link ItemStore} keeping records in a {@link RecordIndex} and payloads in a {@link BlobStore}.
 *
 * <p>The two halves of an Item are written and removed in a fixed order:
 * <ul>
 * <li><b>put:</b> record first, then blob. A failed blob write rolls the record back.</li>
 * <li><b>delete:</b> record first, then blob. The record marks existence, so an interrupted delete
 * can leave an orphan blob that no lookup returns, but never a record without its blob.</li>
 * </ul>
 * Neither pair of steps is atomic, and concurrent readers can observe the gap between them.
 * Leftovers from a crash are removed by the reconciliation pass on {@link #open(StoreConfig)}.
 *
 * <p>With automatic cleanup enabled, expired Items are deleted when read and by an
 * {@link ExpiryReaper} running in the background.
 */
public class DurableItemStore implements ItemStore {
    private static final Logger logger = LoggerFactory.getLogger(DurableItemStore.class);

    private final StoreConfig config;
    private final RecordIndex index;
    private final BlobStore blobStore;
    private final IdAllocator idAllocator;
    private final StoreMetrics metrics;
    private final ExpiryReaper reaper;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private DurableItemStore(StoreConfig config, RecordIndex index, StoreMetrics metrics) {
        this.config = config;
        this.index = index;
        this.metrics = metrics;
        this.blobStore = new BlobStore(config.getStorageDirectory());
        this.idAllocator = new IdAllocator(index, config.getMaxIdAttempts(), metrics);
        this.reaper = config.isAutoCleanup()
                ? new ExpiryReaper(index, this::deleteItem, config.getClock(), config.getCleanupInterval(), metrics)
                : null;
    }

    /**
     * Opens or initializes a store in the given directory.
     *
     * @param baseDirectory The store directory; missing directories are created.
     * @param autoCleanup   Whether expired Items are deleted on read and by a background job.
     * @return The open store.
     */
    public static DurableItemStore open(Path baseDirectory, boolean autoCleanup) {
        return open(StoreConfig.builder()
                .withBaseDirectory(baseDirectory)
                .withAutoCleanup(autoCleanup)
                .build());
    }

    /**
     * Opens or initializes a store with its own {@link DurableRecordIndex}.
     *
     * @param config The store configuration.
     * @return The open store.
     * @throws BlobStoreException if a directory cannot be created.
     * @throws com.ganesh.store.exception.IndexException if the record index cannot be opened.
     */
    public static DurableItemStore open(StoreConfig config) {
        StoreMetrics metrics = new StoreMetrics();
        return open(config, DurableRecordIndex.open(config.toIndexConfig(), metrics), metrics);
    }

    /**
     * Opens a store on top of an already open record index. The store takes ownership of the
     * index and closes it on {@link #close()}.
     *
     * @param config  The store configuration.
     * @param index   The record index.
     * @param metrics The metrics collector.
     * @return The open store.
     */
    public static DurableItemStore open(StoreConfig config, RecordIndex index, StoreMetrics metrics) {
        logger.info("Opening Store in {}", config.getBaseDirectory());
        try {
            createDirectories(config);
            DurableItemStore store = new DurableItemStore(config, index, metrics);
            if (config.isReconcileOnOpen()) {
                store.reconcile();
            }
            if (store.reaper != null) {
                store.reaper.start();
            }
            return store;
        } catch (RuntimeException e) {
            try {
                index.close();
            } catch (RuntimeException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    private static void createDirectories(StoreConfig config) {
        for (Path dir : new Path[]{config.getBaseDirectory(), config.getDatabaseDirectory(), config.getStorageDirectory()}) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                logger.error("Cannot create directory {}", dir, e);
                throw new BlobStoreException("Cannot create directory " + dir, e);
            }
        }
    }

    @Override
    public String put(Item item, InputStream payload) {
        long startTime = System.nanoTime();
        String id;
        try {
            ensureOpen();
            metrics.puts.increment();
            logger.debug("Requested insertion of Item into the Store");
            id = insertRecord(item);
        } catch (RuntimeException e) {
            closeQuietly(payload, e);
            throw e;
        }

        try {
            blobStore.write(id, payload);
        } catch (IOException e) {
            logger.error("Failed to store file for Item {}, rolling back", id, e);
            BlobStoreException failure = new BlobStoreException("Failed to store file for Item " + id, e);
            rollback(id, failure);
            throw failure;
        } catch (RuntimeException e) {
            logger.error("Failed to store file for Item {}, rolling back", id, e);
            rollback(id, e);
            throw e;
        }
        metrics.recordPutLatency(System.nanoTime() - startTime);
        logger.debug("Stored Item {}", id);
        return id;
    }

    /**
     * Allocates an ID and inserts the record. An insert that loses a race for the same ID to
     * another put counts as a collision and draws again within the same attempt budget.
     */
    private String insertRecord(Item item) {
        try {
            return idAllocator.allocate(id -> tryInsert(item, id));
        } catch (IdAllocationException e) {
            logger.error("Failed to create an ID for a new Item", e);
            throw e;
        }
    }

    private boolean tryInsert(Item item, String id) {
        try {
            index.insert(item.withId(id));
            logger.debug("Inserted record for Item {}", id);
            return true;
        } catch (DuplicateRecordException e) {
            logger.warn("ID {} was taken by a concurrent insert, drawing again", id);
            return false;
        } catch (RuntimeException e) {
            logger.error("Failed to insert Item {} into the record index", id, e);
            throw e;
        }
    }

    private void rollback(String id, RuntimeException failure) {
        metrics.putRollbacks.increment();
        try {
            blobStore.delete(id);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
        try {
            index.delete(id);
        } catch (RuntimeException e) {
            logger.error("Rollback of record {} failed, it has no file now", id, e);
            failure.addSuppressed(e);
        }
    }

    @Override
    public Item get(String id) {
        ensureOpen();
        long startTime = System.nanoTime();
        metrics.gets.increment();
        logger.debug("Requested Item {} from Store", id);
        try {
            Item item = index.get(id).orElseThrow(() -> {
                logger.debug("Requested Item {} was not found", id);
                return new ItemNotFoundException(id);
            });

            if (config.isAutoCleanup() && item.isExpired(config.getClock().instant())) {
                logger.info("Requested Item {} is expired since {}, will be deleted", id, item.getExpires());
                deleteItem(id);
                metrics.expiredOnRead.increment();
                throw new ItemNotFoundException(id);
            }
            return item;
        } finally {
            metrics.recordGetLatency(System.nanoTime() - startTime);
        }
    }

    @Override
    public InputStream getFile(String id) {
        ensureOpen();
        try {
            return blobStore.open(id);
        } catch (IOException e) {
            throw new BlobStoreException("Cannot open file of Item " + id, e);
        } catch (IllegalArgumentException e) {
            throw new ItemNotFoundException(id);
        }
    }

    @Override
    public void delete(String id) {
        ensureOpen();
        deleteItem(id);
    }

    /**
     * The delete path shared by callers, expiry on read and the reaper. It skips the open check
     * so that a sweep still running during {@link #close()} ends cleanly.
     */
    private void deleteItem(String id) {
        metrics.deletes.increment();
        logger.debug("Requested deletion of Item {}", id);

        boolean recordRemoved = index.delete(id);
        if (!recordRemoved) {
            logger.debug("No record for Item {}, it was already deleted", id);
        }

        try {
            boolean blobRemoved = blobStore.delete(id);
            if (recordRemoved && !blobRemoved) {
                logger.warn("Item {} had no file to delete", id);
            }
        } catch (IOException e) {
            logger.error("Failed to delete file of Item {}", id, e);
            throw new BlobStoreException("Failed to delete file of Item " + id, e);
        } catch (IllegalArgumentException e) {
            logger.debug("Ignoring delete of malformed ID {}", id);
        }
    }

    /**
     * Removes blob files without a record and records without a blob file. Runs before the
     * store is handed out, so nothing else touches either side meanwhile.
     */
    private void reconcile() {
        Set<String> blobIds;
        try {
            blobIds = ImmutableSet.copyOf(blobStore.listIds());
        } catch (IOException e) {
            throw new BlobStoreException("Cannot list " + blobStore.getDirectory(), e);
        }
        Set<String> recordIds = index.findAll().stream().map(Item::getId).collect(Collectors.toSet());

        Set<String> orphanBlobs = Sets.difference(blobIds, recordIds);
        for (String id : orphanBlobs) {
            try {
                blobStore.delete(id);
            } catch (IOException e) {
                throw new BlobStoreException("Cannot remove orphan file " + id, e);
            }
        }
        Set<String> danglingRecords = Sets.difference(recordIds, blobIds);
        for (String id : danglingRecords) {
            index.delete(id);
        }
        if (!orphanBlobs.isEmpty() || !danglingRecords.isEmpty()) {
            logger.warn("Reconciliation removed {} orphan file(s) and {} record(s) without a file",
                    orphanBlobs.size(), danglingRecords.size());
        } else {
            logger.info("Reconciliation found {} consistent Item(s)", recordIds.size());
        }
    }

    /**
     * Runs one expiry sweep on the calling thread.
     *
     * @return The number of Items deleted.
     * @throws IllegalStateException if automatic cleanup is disabled.
     */
    public int sweepExpired() {
        ensureOpen();
        if (reaper == null) {
            throw new IllegalStateException("Automatic cleanup is disabled for this store");
        }
        return reaper.sweepNow();
    }

    /**
     * @return The underlying record index.
     */
    public RecordIndex recordIndex() {
        return index;
    }

    @Override
    public StoreMetrics getMetrics() {
        return metrics;
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Store is closed");
        }
    }

    private static void closeQuietly(InputStream payload, RuntimeException failure) {
        try {
            payload.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.info("Closing Store");
        if (reaper != null) {
            reaper.stop();
        }
        index.close();
        logger.info("Store closed\n{}", metrics.getSummary());
    }
}
