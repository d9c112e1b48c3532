package com.ganesh.store;

import com.ganesh.store.exception.StoreException;
import com.ganesh.store.index.RecordIndex;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Background job that removes expired Items even if nobody reads them.
 *
 * <p>On a fixed interval it asks the record index for every record that expired before now and
 * passes each ID to the store's delete path. A failing delete ends that sweep; the failure is
 * logged and the next tick starts over.
 *
 * <p>Shutdown is a handshake: {@link #stop()} signals the executor and then blocks until the
 * sweep thread has acknowledged by terminating. After {@code stop()} returns no further deletes
 * are issued.
 */
public class ExpiryReaper {
    private static final Logger logger = LoggerFactory.getLogger(ExpiryReaper.class);

    private static final long STOP_WAIT_LOG_SECONDS = 10;

    private final RecordIndex index;
    private final Consumer<String> deleter;
    private final Clock clock;
    private final Duration interval;
    private final StoreMetrics metrics;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("expiry-reaper-%d").setDaemon(true).build());

    /**
     * @param index    Source of expired records.
     * @param deleter  The store's unified delete, called once per expired ID.
     * @param clock    Time source for "now".
     * @param interval Pause between sweeps.
     * @param metrics  Collector for sweep statistics.
     */
    public ExpiryReaper(RecordIndex index, Consumer<String> deleter, Clock clock, Duration interval, StoreMetrics metrics) {
        this.index = index;
        this.deleter = deleter;
        this.clock = clock;
        this.interval = interval;
        this.metrics = metrics;
    }

    /**
     * Schedules the periodic sweep. The first sweep runs one interval from now.
     */
    public void start() {
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::scheduledSweep, millis, millis, TimeUnit.MILLISECONDS);
        logger.info("Expiry reaper started, sweeping every {}", interval);
    }

    private void scheduledSweep() {
        try {
            sweep(true);
        } catch (RuntimeException e) {
            // An escaping exception would cancel the schedule.
            metrics.sweepFailures.increment();
            logger.error("Deletion of expired Items failed", e);
        }
    }

    /**
     * Runs one sweep on the calling thread.
     *
     * @return The number of expired Items deleted.
     * @throws StoreException if querying the index or deleting an Item fails.
     */
    public int sweepNow() {
        return sweep(false);
    }

    private int sweep(boolean stopOnShutdown) {
        metrics.sweeps.increment();
        Instant now = clock.instant();
        List<Item> expired = index.findExpiredBefore(now);
        int deleted = 0;
        for (Item item : expired) {
            if (stopOnShutdown && scheduler.isShutdown()) {
                logger.info("Stop requested, abandoning sweep after {} of {} expired Items", deleted, expired.size());
                break;
            }
            logger.debug("Delete expired Item {}", item.getId());
            deleter.accept(item.getId());
            metrics.expiredBySweep.increment();
            deleted++;
        }
        if (deleted > 0) {
            logger.info("Expiry sweep removed {} Item(s)", deleted);
        }
        return deleted;
    }

    /**
     * Signals the sweep thread to stop and waits until it has exited. A sweep in progress stops
     * before its next delete.
     *
     * @throws StoreException if the calling thread is interrupted while waiting.
     */
    public void stop() {
        scheduler.shutdown();
        try {
            while (!scheduler.awaitTermination(STOP_WAIT_LOG_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Still waiting for the expiry reaper to finish its sweep");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("Interrupted while waiting for the expiry reaper to stop", e);
        }
        logger.info("Expiry reaper stopped");
    }

    /**
     * @return {@code true} once {@link #stop()} has completed.
     */
    public boolean isStopped() {
        return scheduler.isTerminated();
    }
}
