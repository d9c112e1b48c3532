package com.ganesh.store.id;

import com.ganesh.store.StoreMetrics;
import com.ganesh.store.exception.IdAllocationException;
import com.ganesh.store.index.RecordIndex;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.Random;
import java.util.function.Predicate;

/**
 * Generates short random Item IDs that are not in use.
 *
 * <p>Each attempt draws 4 random bytes (32 bits, about 4.3 billion values), renders them with
 * {@link ShortIdCodec} and probes the record index. A free ID is returned; a taken one is redrawn,
 * up to a fixed number of attempts. This class only reads the index, so two concurrent callers can
 * still draw the same free ID; the insert into the index settles that.
 */
public class IdAllocator {
    private static final Logger logger = LoggerFactory.getLogger(IdAllocator.class);

    public static final int ID_BYTES = 4;
    public static final int DEFAULT_MAX_ATTEMPTS = 32;

    private final RecordIndex index;
    private final Random random;
    private final int maxAttempts;
    private final StoreMetrics metrics;

    public IdAllocator(RecordIndex index, int maxAttempts, StoreMetrics metrics) {
        this(index, new SecureRandom(), maxAttempts, metrics);
    }

    public IdAllocator(RecordIndex index, Random random, int maxAttempts, StoreMetrics metrics) {
        Preconditions.checkArgument(maxAttempts > 0, "maxAttempts must be positive");
        this.index = index;
        this.random = random;
        this.maxAttempts = maxAttempts;
        this.metrics = metrics;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * @return A random ID with no record in the index at the time of the probe.
     * @throws IdAllocationException if every attempt hit an existing record.
     * @throws com.ganesh.store.exception.IndexException if probing the index fails.
     */
    public String allocate() {
        return allocate(id -> true);
    }

    /**
     * Draws IDs until one is free in the index and accepted by {@code claim}. A draw that the
     * index reports as taken, or that {@code claim} rejects because a concurrent writer got there
     * first, is a collision. Every draw counts against the same attempt budget.
     *
     * @param claim Tries to take a free ID, typically by inserting its record.
     * @return The claimed ID.
     * @throws IdAllocationException if the budget ran out.
     */
    public String allocate(Predicate<String> claim) {
        byte[] buffer = new byte[ID_BYTES];
        for (int i = 0; i < maxAttempts; i++) {
            random.nextBytes(buffer);
            String id = ShortIdCodec.encode(buffer);
            if (!index.contains(id)) {
                if (claim.test(id)) {
                    return id;
                }
                logger.debug("Drawn ID {} was claimed concurrently, retrying", id);
            } else {
                logger.debug("Drawn ID {} is already in use, retrying", id);
            }
            metrics.idCollisions.increment();
        }
        logger.error("No free ID found after {} attempts", maxAttempts);
        throw new IdAllocationException(maxAttempts);
    }
}
