package com.ganesh.store;

import com.ganesh.store.exception.BlobStoreException;
import com.ganesh.store.exception.DuplicateRecordException;
import com.ganesh.store.exception.IdAllocationException;
import com.ganesh.store.exception.ItemNotFoundException;
import com.ganesh.store.id.IdAllocator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DurableItemStoreTest {

    private DurableItemStore store;
    private StoreConfig config;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        config = StoreConfig.builder()
                .withBaseDirectory(tempDir.resolve("store"))
                .withAutoCleanup(true)
                .build();
        store = DurableItemStore.open(config);
    }

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.close();
        }
    }

    private static InputStream payload(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private static String read(InputStream in) throws IOException {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static Item liveItem() {
        return Item.builder()
                .filename("notes.txt")
                .contentType("text/plain")
                .created(Instant.now())
                .expires(Instant.now().plus(Duration.ofHours(1)))
                .attribute("owner", "127.0.0.1")
                .build();
    }

    @Test
    void testPutAndGet() throws IOException {
        Item item = liveItem();
        String id = store.put(item, payload("hello world"));

        assertNotNull(id);
        assertEquals(item.withId(id), store.get(id));
        assertEquals("hello world", read(store.getFile(id)));
    }

    @Test
    void testDirectoryLayout() throws IOException {
        String id = store.put(liveItem(), payload("x"));

        assertTrue(Files.isDirectory(tempDir.resolve("store").resolve(StoreConfig.DATABASE_DIR)));
        assertTrue(Files.isRegularFile(config.getStorageDirectory().resolve(id)));
    }

    @Test
    void testGetNonExistentItem() {
        ItemNotFoundException e = assertThrows(ItemNotFoundException.class, () -> store.get("nope"));
        assertEquals("nope", e.getItemId());
    }

    @Test
    void testGetFileOfNonExistentItem() {
        BlobStoreException e = assertThrows(BlobStoreException.class, () -> store.getFile("nope"));
        assertNotNull(e.getCause());
    }

    @Test
    void testDeleteRemovesRecordAndFile() {
        String id = store.put(liveItem(), payload("bye"));

        store.delete(id);

        assertThrows(ItemNotFoundException.class, () -> store.get(id));
        assertThrows(BlobStoreException.class, () -> store.getFile(id));
        assertFalse(Files.exists(config.getStorageDirectory().resolve(id)));
        assertFalse(store.recordIndex().contains(id));
    }

    @Test
    void testDeleteTwiceIsBenign() {
        String id = store.put(liveItem(), payload("bye"));

        store.delete(id);
        assertDoesNotThrow(() -> store.delete(id));
        assertDoesNotThrow(() -> store.delete("neverExisted"));
    }

    @Test
    void testDeleteOfRecordWhoseFileIsAlreadyGone() throws IOException {
        String id = store.put(liveItem(), payload("bye"));
        Files.delete(config.getStorageDirectory().resolve(id));

        assertDoesNotThrow(() -> store.delete(id));

        assertFalse(store.recordIndex().contains(id));
        assertThrows(ItemNotFoundException.class, () -> store.get(id));
    }

    @Test
    void testDeleteRemovesLeftoverFileWithoutRecord() throws IOException {
        Path orphan = config.getStorageDirectory().resolve("leftover");
        Files.writeString(orphan, "stale");

        store.delete("leftover");

        assertFalse(Files.exists(orphan));
    }

    @Test
    void testExpiredItemIsDeletedOnRead() {
        Item expired = Item.builder().expires(Instant.now().minus(Duration.ofHours(1))).build();
        String id = store.put(expired, payload("hello"));

        assertThrows(ItemNotFoundException.class, () -> store.get(id));

        assertFalse(store.recordIndex().contains(id), "Record should be gone after the expired read");
        assertFalse(Files.exists(config.getStorageDirectory().resolve(id)), "File should be gone after the expired read");
        assertEquals(1, store.getMetrics().expiredOnRead.sum());
        assertThrows(ItemNotFoundException.class, () -> store.get(id));
    }

    @Test
    void testExpiryIsInclusiveOfTheExpiryInstant() {
        store.close();
        Instant now = Instant.parse("2024-05-01T12:00:00Z");
        config = StoreConfig.builder()
                .withBaseDirectory(tempDir.resolve("fixed"))
                .withAutoCleanup(true)
                .withClock(Clock.fixed(now, ZoneOffset.UTC))
                .build();
        store = DurableItemStore.open(config);

        String atNow = store.put(Item.builder().expires(now).build(), payload("a"));
        String later = store.put(Item.builder().expires(now.plusMillis(1)).build(), payload("b"));

        assertThrows(ItemNotFoundException.class, () -> store.get(atNow));
        assertEquals(later, store.get(later).getId());
    }

    @Test
    void testExpiredItemIsReturnedWithoutCleanup() {
        store.close();
        store = DurableItemStore.open(tempDir.resolve("no-cleanup"), false);

        String id = store.put(Item.builder().expires(Instant.now().minus(Duration.ofHours(1))).build(), payload("old"));

        assertEquals(id, store.get(id).getId());
        assertThrows(IllegalStateException.class, () -> store.sweepExpired());
    }

    @Test
    void testPutClosesPayload() {
        TrackingInputStream in = new TrackingInputStream(payload("tracked"), false);

        store.put(liveItem(), in);

        assertTrue(in.closed);
    }

    @Test
    void testPutRollsBackWhenPayloadFails() throws IOException {
        TrackingInputStream in = new TrackingInputStream(payload("partial payload"), true);

        BlobStoreException e = assertThrows(BlobStoreException.class, () -> store.put(liveItem(), in));

        assertTrue(in.closed, "Payload should be closed even when the copy fails");
        assertEquals("simulated read failure", e.getCause().getMessage());
        assertTrue(store.recordIndex().findAll().isEmpty(), "Record should have been rolled back");
        try (var files = Files.list(config.getStorageDirectory())) {
            assertEquals(0, files.count(), "Partial file should have been removed");
        }
        assertEquals(1, store.getMetrics().putRollbacks.sum());
    }

    @Test
    void testPutRollsBackWhenPayloadThrowsUnchecked() throws IOException {
        InputStream failing = new FilterInputStream(payload("unchecked failure")) {
            @Override
            public int read(byte[] b, int off, int len) {
                throw new UncheckedIOException(new IOException("wrapped read failure"));
            }
        };

        UncheckedIOException e = assertThrows(UncheckedIOException.class, () -> store.put(liveItem(), failing));

        assertEquals("wrapped read failure", e.getCause().getMessage());
        assertTrue(store.recordIndex().findAll().isEmpty(), "Record should have been rolled back");
        try (var files = Files.list(config.getStorageDirectory())) {
            assertEquals(0, files.count(), "Empty file should have been removed");
        }
        assertEquals(1, store.getMetrics().putRollbacks.sum());
    }

    @Test
    void testLostInsertRacesShareTheAttemptBudget() throws IOException {
        AtomicInteger draws = new AtomicInteger();
        InMemoryRecordIndex index = new InMemoryRecordIndex() {
            @Override
            public Optional<Item> get(String id) {
                // Only every 16th draw looks free, and its insert then loses to another writer.
                if (draws.incrementAndGet() % 16 == 0) {
                    return Optional.empty();
                }
                return Optional.of(Item.builder().expires(Instant.MAX).build().withId(id));
            }

            @Override
            public void insert(Item item) {
                throw new DuplicateRecordException(item.getId());
            }
        };
        StoreConfig contended = StoreConfig.builder()
                .withBaseDirectory(tempDir.resolve("contended"))
                .build();
        try (DurableItemStore contendedStore = DurableItemStore.open(contended, index, new StoreMetrics())) {
            IdAllocationException e = assertThrows(IdAllocationException.class,
                    () -> contendedStore.put(liveItem(), payload("never stored")));

            assertEquals(IdAllocator.DEFAULT_MAX_ATTEMPTS, e.getAttempts());
            assertEquals(IdAllocator.DEFAULT_MAX_ATTEMPTS, draws.get());
            assertEquals(IdAllocator.DEFAULT_MAX_ATTEMPTS, contendedStore.getMetrics().idCollisions.sum());
            try (var files = Files.list(contended.getStorageDirectory())) {
                assertEquals(0, files.count());
            }
        }
    }

    @Test
    void testPutFailsWhenNoIdIsFree() throws IOException {
        InMemoryRecordIndex index = new InMemoryRecordIndex();
        StoreConfig crowded = StoreConfig.builder()
                .withBaseDirectory(tempDir.resolve("crowded"))
                .build();
        try (DurableItemStore crowdedStore = DurableItemStore.open(crowded, index, new StoreMetrics())) {
            index.everyIdTaken = true;
            TrackingInputStream in = new TrackingInputStream(payload("never stored"), false);

            IdAllocationException e = assertThrows(IdAllocationException.class, () -> crowdedStore.put(liveItem(), in));

            assertEquals(IdAllocator.DEFAULT_MAX_ATTEMPTS, e.getAttempts());
            assertEquals(IdAllocator.DEFAULT_MAX_ATTEMPTS, index.probes.get());
            assertEquals(0, index.inserts.get());
            assertTrue(in.closed);
            try (var files = Files.list(crowded.getStorageDirectory())) {
                assertEquals(0, files.count());
            }
        }
    }

    @Test
    void testMetricsCountOperations() {
        String id = store.put(liveItem(), payload("counted"));
        store.get(id);
        store.delete(id);

        var snapshot = store.getMetrics().snapshot();
        assertEquals(1L, snapshot.get("puts"));
        assertEquals(1L, snapshot.get("gets"));
        assertEquals(1L, snapshot.get("deletes"));
        assertEquals(2L, snapshot.get("walWrites"));
        assertTrue(store.getMetrics().getSummary().contains("putRollbacks"));
    }

    @Test
    void testRecoveryAfterRestart() throws IOException {
        Item item = liveItem();
        String id = store.put(item, payload("persisted"));
        store.close();

        store = DurableItemStore.open(config);

        assertEquals(item.withId(id), store.get(id));
        assertEquals("persisted", read(store.getFile(id)));
    }

    @Test
    void testReconcileOnOpenRemovesOrphansBothWays() throws IOException {
        String kept = store.put(liveItem(), payload("kept"));
        String lostFile = store.put(liveItem(), payload("lost"));
        store.close();

        Files.delete(config.getStorageDirectory().resolve(lostFile));
        Path orphan = config.getStorageDirectory().resolve("orphan");
        Files.writeString(orphan, "no record");

        store = DurableItemStore.open(config);

        assertFalse(Files.exists(orphan));
        assertThrows(ItemNotFoundException.class, () -> store.get(lostFile));
        assertEquals("kept", read(store.getFile(kept)));
    }

    @Test
    void testCloseIsIdempotentAndRejectsFurtherCalls() {
        store.close();
        assertDoesNotThrow(() -> store.close());

        assertThrows(IllegalStateException.class, () -> store.get("any"));
        assertThrows(IllegalStateException.class, () -> store.put(liveItem(), payload("late")));
        store = null;
    }

    /**
     * Serves its delegate and optionally fails once half of it has been read.
     */
    private static final class TrackingInputStream extends FilterInputStream {
        private final boolean failMidway;
        private int served;
        boolean closed;

        TrackingInputStream(InputStream delegate, boolean failMidway) {
            super(delegate);
            this.failMidway = failMidway;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (failMidway && served > 0) {
                throw new IOException("simulated read failure");
            }
            int n = super.read(b, off, Math.min(len, 4));
            if (n > 0) {
                served += n;
            }
            return n;
        }

        @Override
        public int read() throws IOException {
            byte[] one = new byte[1];
            int n = read(one, 0, 1);
            return n < 0 ? -1 : one[0] & 0xFF;
        }

        @Override
        public void close() throws IOException {
            closed = true;
            super.close();
        }
    }
}
