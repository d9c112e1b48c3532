package com.ganesh.store;

import com.ganesh.store.exception.ItemNotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class ExpiryReaperTest {

    @TempDir
    Path tempDir;

    private DurableItemStore store;

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.close();
        }
    }

    private DurableItemStore openStore(InMemoryRecordIndex index, Duration interval) {
        StoreConfig config = StoreConfig.builder()
                .withBaseDirectory(tempDir)
                .withAutoCleanup(true)
                .withCleanupInterval(interval)
                .build();
        return DurableItemStore.open(config, index, new StoreMetrics());
    }

    private static Item expiredItem() {
        return Item.builder().expires(Instant.now().minus(Duration.ofHours(1))).build();
    }

    private static Item liveItem() {
        return Item.builder().expires(Instant.now().plus(Duration.ofHours(1))).build();
    }

    private static ByteArrayInputStream payload() {
        return new ByteArrayInputStream(new byte[]{1, 2, 3});
    }

    private static void waitUntil(BooleanSupplier condition, String message) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail(message);
            }
            Thread.sleep(20);
        }
    }

    @Test
    void testSweepRemovesExpiredItemsWithoutRead() throws InterruptedException {
        InMemoryRecordIndex index = new InMemoryRecordIndex();
        store = openStore(index, Duration.ofMillis(50));
        String expired = store.put(expiredItem(), payload());
        String live = store.put(liveItem(), payload());

        waitUntil(() -> !index.records.containsKey(expired), "Expired Item was not swept");

        assertFalse(Files.exists(tempDir.resolve(StoreConfig.STORAGE_DIR).resolve(expired)));
        assertTrue(index.records.containsKey(live));
        assertTrue(Files.exists(tempDir.resolve(StoreConfig.STORAGE_DIR).resolve(live)));
        assertTrue(store.getMetrics().expiredBySweep.sum() >= 1);
    }

    @Test
    void testSweepNowReturnsDeletedCount() {
        InMemoryRecordIndex index = new InMemoryRecordIndex();
        store = openStore(index, Duration.ofHours(1));
        store.put(expiredItem(), payload());
        store.put(expiredItem(), payload());
        String live = store.put(liveItem(), payload());

        assertEquals(2, store.sweepExpired());
        assertEquals(0, store.sweepExpired());
        assertEquals(List.of(live), new ArrayList<>(index.records.keySet()));
    }

    @Test
    void testSweepFailureKeepsReaperAlive() throws InterruptedException {
        InMemoryRecordIndex index = new InMemoryRecordIndex();
        store = openStore(index, Duration.ofMillis(30));
        index.failingScans.set(2);
        String expired = store.put(expiredItem(), payload());

        waitUntil(() -> !index.records.containsKey(expired), "Reaper did not recover from failed sweeps");

        assertEquals(2, store.getMetrics().sweepFailures.sum());
    }

    @Test
    void testStopWaitsForRunningSweepAndIssuesNoFurtherDeletes() throws InterruptedException {
        InMemoryRecordIndex index = new InMemoryRecordIndex();
        for (int i = 0; i < 3; i++) {
            index.insert(expiredItem().withId("expired" + i));
        }
        CountDownLatch firstDeleteStarted = new CountDownLatch(1);
        AtomicInteger deletes = new AtomicInteger();
        ExpiryReaper reaper = new ExpiryReaper(index, id -> {
            deletes.incrementAndGet();
            firstDeleteStarted.countDown();
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            index.delete(id);
        }, Clock.systemUTC(), Duration.ofMillis(10), new StoreMetrics());

        reaper.start();
        assertTrue(firstDeleteStarted.await(5, TimeUnit.SECONDS));
        reaper.stop();

        assertTrue(reaper.isStopped(), "stop() must return only after the sweep thread exited");
        int deletesAtStop = deletes.get();
        assertEquals(1, deletesAtStop, "A stop request should end the sweep before its next delete");
        Thread.sleep(100);
        assertEquals(deletesAtStop, deletes.get());
    }

    @Test
    void testCloseStopsReaperBeforeClosingIndex() throws InterruptedException {
        InMemoryRecordIndex index = new InMemoryRecordIndex();
        store = openStore(index, Duration.ofMillis(10));
        for (int i = 0; i < 20; i++) {
            store.put(liveItem(), payload());
        }
        Thread.sleep(100);

        store.close();
        int scansAtClose = index.scans.get();
        Thread.sleep(100);

        assertTrue(index.closed.get());
        assertEquals(0, index.callsAfterClose.get(), "Reaper touched the index after it was closed");
        assertEquals(scansAtClose, index.scans.get());
        store = null;
    }

    @Test
    void testConcurrentReadAndSweepOfSameExpiredItems() throws Exception {
        InMemoryRecordIndex index = new InMemoryRecordIndex();
        store = openStore(index, Duration.ofHours(1));
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            ids.add(store.put(expiredItem(), payload()));
        }

        ConcurrentLinkedQueue<Throwable> unexpected = new ConcurrentLinkedQueue<>();
        ExecutorService executor = Executors.newFixedThreadPool(2);
        Future<?> reader = executor.submit(() -> {
            for (String id : ids) {
                try {
                    store.get(id);
                    unexpected.add(new AssertionError("Expired Item " + id + " was returned"));
                } catch (ItemNotFoundException expected) {
                    // either this read or the sweep removed it
                } catch (Throwable t) {
                    unexpected.add(t);
                }
            }
        });
        Future<?> sweeper = executor.submit(() -> {
            try {
                while (!reader.isDone()) {
                    store.sweepExpired();
                }
            } catch (Throwable t) {
                unexpected.add(t);
            }
        });
        reader.get(30, TimeUnit.SECONDS);
        sweeper.get(30, TimeUnit.SECONDS);
        executor.shutdown();

        assertTrue(unexpected.isEmpty(), () -> "Unexpected failures: " + unexpected);
        assertTrue(index.records.isEmpty());
        try (var files = Files.list(tempDir.resolve(StoreConfig.STORAGE_DIR))) {
            assertEquals(0, files.count());
        }
    }
}
