package com.ganesh.store;

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters for the store, its expiry reaper and its record index. All of them are
 * {@link LongAdder}s and safe to bump from any thread.
 */
public class StoreMetrics {
    public final LongAdder puts = new LongAdder();
    public final LongAdder gets = new LongAdder();
    public final LongAdder deletes = new LongAdder();
    public final LongAdder expiredOnRead = new LongAdder();
    public final LongAdder expiredBySweep = new LongAdder();
    public final LongAdder sweeps = new LongAdder();
    public final LongAdder sweepFailures = new LongAdder();
    public final LongAdder idCollisions = new LongAdder();
    public final LongAdder putRollbacks = new LongAdder();

    // Record index internals
    public final LongAdder walWrites = new LongAdder();
    public final LongAdder memtableFlushes = new LongAdder();
    public final LongAdder compactions = new LongAdder();
    public final LongAdder bloomFilterChecks = new LongAdder();
    public final LongAdder bloomFilterHits = new LongAdder(); // the filter saved a disk read

    private final Latency getLatency = new Latency();
    private final Latency putLatency = new Latency();

    private static final class Latency {
        final LongAdder totalNanos = new LongAdder();
        final LongAdder samples = new LongAdder();

        void record(long nanos) {
            totalNanos.add(nanos);
            samples.increment();
        }

        double averageMs() {
            long count = samples.sum();
            return count == 0 ? 0.0 : totalNanos.sum() / (double) count / 1_000_000.0;
        }
    }

    public void recordGetLatency(long nanos) {
        getLatency.record(nanos);
    }

    public void recordPutLatency(long nanos) {
        putLatency.record(nanos);
    }

    /**
     * @return The average get latency in ms, or 0 before the first sample.
     */
    public double getAverageGetLatencyMs() {
        return getLatency.averageMs();
    }

    /**
     * @return The average latency of successful puts in ms, or 0 before the first sample.
     */
    public double getAveragePutLatencyMs() {
        return putLatency.averageMs();
    }

    /**
     * @return The current value of every counter, keyed by name, in a stable order.
     */
    public Map<String, Long> snapshot() {
        return ImmutableMap.<String, Long>builder()
                .put("puts", puts.sum())
                .put("gets", gets.sum())
                .put("deletes", deletes.sum())
                .put("expiredOnRead", expiredOnRead.sum())
                .put("expiredBySweep", expiredBySweep.sum())
                .put("sweeps", sweeps.sum())
                .put("sweepFailures", sweepFailures.sum())
                .put("idCollisions", idCollisions.sum())
                .put("putRollbacks", putRollbacks.sum())
                .put("walWrites", walWrites.sum())
                .put("memtableFlushes", memtableFlushes.sum())
                .put("compactions", compactions.sum())
                .put("bloomFilterChecks", bloomFilterChecks.sum())
                .put("bloomFilterHits", bloomFilterHits.sum())
                .build();
    }

    /**
     * @return A multi-line, human-readable report of all counters and latencies.
     */
    public String getSummary() {
        StringBuilder report = new StringBuilder("--- Store Metrics ---\n");
        snapshot().forEach((name, value) -> report.append(String.format("%-18s %,d%n", name, value)));
        long checks = bloomFilterChecks.sum();
        report.append(String.format("Bloom hit rate     %.2f%%%n", checks == 0 ? 0.0 : bloomFilterHits.sum() * 100.0 / checks));
        report.append(String.format("Avg get / put      %.3f ms / %.3f ms%n", getAverageGetLatencyMs(), getAveragePutLatencyMs()));
        return report.append("---------------------").toString();
    }
}
