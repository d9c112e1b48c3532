package com.ganesh.store.id;

import com.ganesh.store.Item;
import com.ganesh.store.StoreMetrics;
import com.ganesh.store.exception.IdAllocationException;
import com.ganesh.store.index.RecordIndex;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class IdAllocatorTest {

    @Test
    void testAllocatedIdsAreValidAndDistinct() {
        TakenIds index = new TakenIds();
        IdAllocator allocator = new IdAllocator(index, IdAllocator.DEFAULT_MAX_ATTEMPTS, new StoreMetrics());

        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            String id = allocator.allocate();
            assertTrue(ShortIdCodec.isValid(id), id);
            assertTrue(id.length() >= 1 && id.length() <= 6, id);
            index.taken.add(id);
            ids.add(id);
        }
        assertEquals(1000, ids.size());
    }

    @Test
    void testCollisionIsRedrawn() {
        byte[] firstDraw = new byte[IdAllocator.ID_BYTES];
        new Random(42).nextBytes(firstDraw);
        String collidingId = ShortIdCodec.encode(firstDraw);

        TakenIds index = new TakenIds();
        index.taken.add(collidingId);
        StoreMetrics metrics = new StoreMetrics();
        IdAllocator allocator = new IdAllocator(index, new Random(42), IdAllocator.DEFAULT_MAX_ATTEMPTS, metrics);

        String id = allocator.allocate();

        assertNotEquals(collidingId, id);
        assertEquals(2, index.probes.get());
        assertEquals(1, metrics.idCollisions.sum());
    }

    @Test
    void testExhaustedAttemptsFail() {
        TakenIds index = new TakenIds();
        index.everyIdTaken = true;
        IdAllocator allocator = new IdAllocator(index, IdAllocator.DEFAULT_MAX_ATTEMPTS, new StoreMetrics());

        IdAllocationException e = assertThrows(IdAllocationException.class, allocator::allocate);

        assertEquals(32, e.getAttempts());
        assertEquals(32, index.probes.get());
    }

    @Test
    void testRejectedClaimsShareTheAttemptBudget() {
        TakenIds index = new TakenIds();
        StoreMetrics metrics = new StoreMetrics();
        IdAllocator allocator = new IdAllocator(index, 5, metrics);
        AtomicInteger claims = new AtomicInteger();

        IdAllocationException e = assertThrows(IdAllocationException.class,
                () -> allocator.allocate(id -> claims.incrementAndGet() < 0));

        assertEquals(5, e.getAttempts());
        assertEquals(5, index.probes.get());
        assertEquals(5, claims.get());
        assertEquals(5, metrics.idCollisions.sum());
    }

    @Test
    void testClaimIsOnlyTriedForFreeIds() {
        TakenIds index = new TakenIds();
        index.everyIdTaken = true;
        IdAllocator allocator = new IdAllocator(index, 8, new StoreMetrics());
        AtomicInteger claims = new AtomicInteger();

        assertThrows(IdAllocationException.class, () -> allocator.allocate(id -> claims.incrementAndGet() > 0));

        assertEquals(0, claims.get());
        assertThrows(IllegalArgumentException.class, () -> new IdAllocator(index, 0, new StoreMetrics()));
    }

    /**
     * Index that only answers existence probes.
     */
    private static final class TakenIds implements RecordIndex {
        final Set<String> taken = ConcurrentHashMap.newKeySet();
        final AtomicInteger probes = new AtomicInteger();
        volatile boolean everyIdTaken;

        @Override
        public Optional<Item> get(String id) {
            probes.incrementAndGet();
            if (everyIdTaken || taken.contains(id)) {
                return Optional.of(Item.builder().expires(Instant.MAX).build().withId(id));
            }
            return Optional.empty();
        }

        @Override
        public void insert(Item item) {
            throw new UnsupportedOperationException();
        }

        @Override
        public boolean delete(String id) {
            throw new UnsupportedOperationException();
        }

        @Override
        public List<Item> findExpiredBefore(Instant now) {
            return List.of();
        }

        @Override
        public List<Item> findAll() {
            return List.of();
        }

        @Override
        public void close() {
        }
    }
}
