package de.mirkosertic.nlpquery;

import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe aggregate statistics of processed queries.
 *
 * <p>Counters are atomic. A circular buffer (guarded by a dedicated lock) stores the last 1000
 * processing times for percentile computation.</p>
 */
public class PipelineMetrics {

    private static final int BUFFER_SIZE = 1000;

    private final AtomicLong totalQueries = new AtomicLong(0);
    private final AtomicLong cacheHits = new AtomicLong(0);
    private final AtomicLong fallbacks = new AtomicLong(0);
    private final AtomicLong totalDurationMs = new AtomicLong(0);
    private final AtomicLong minDurationMs = new AtomicLong(Long.MAX_VALUE);
    private final AtomicLong maxDurationMs = new AtomicLong(0);
    private final ConcurrentHashMap<String, AtomicLong> componentFailures = new ConcurrentHashMap<>();

    private final long[] buffer = new long[BUFFER_SIZE];
    private int bufferIndex = 0;
    private boolean bufferFilled = false;
    private final Object lock = new Object();

    /**
     * Percentile values computed from the last 1000 recorded processing times.
     */
    public record Percentiles(long p50, long p75, long p90, long p95, long p99) {
    }

    /**
     * Point-in-time view of all counters.
     *
     * @param percentiles null before the first query
     * @param errorRate   fallbacks divided by total queries
     */
    public record Snapshot(long totalQueries, long cacheHits, long fallbacks, double averageProcessingTimeMs,
                           long minProcessingTimeMs, long maxProcessingTimeMs, @Nullable Percentiles percentiles,
                           Map<String, Long> componentFailures, double errorRate) {
    }

    /**
     * Records a processed query.
     *
     * @param durationMs processing time in milliseconds
     * @param cacheHit   whether the result came from the cache
     * @param fallback   whether the fallback result was returned
     */
    public void recordQuery(final long durationMs, final boolean cacheHit, final boolean fallback) {
        totalQueries.incrementAndGet();
        totalDurationMs.addAndGet(durationMs);
        if (cacheHit) {
            cacheHits.incrementAndGet();
        }
        if (fallback) {
            fallbacks.incrementAndGet();
        }

        // CAS loop for min
        long current;
        do {
            current = minDurationMs.get();
            if (durationMs >= current) break;
        } while (!minDurationMs.compareAndSet(current, durationMs));

        // CAS loop for max
        do {
            current = maxDurationMs.get();
            if (durationMs <= current) break;
        } while (!maxDurationMs.compareAndSet(current, durationMs));

        synchronized (lock) {
            buffer[bufferIndex] = durationMs;
            bufferIndex = (bufferIndex + 1) % BUFFER_SIZE;
            if (!bufferFilled && bufferIndex == 0) {
                bufferFilled = true;
            }
        }
    }

    /**
     * Records a swallowed failure of a pipeline stage.
     */
    public void recordComponentFailure(final String component) {
        componentFailures.computeIfAbsent(component, k -> new AtomicLong()).incrementAndGet();
    }

    /**
     * Computes percentiles from the last 1000 recorded processing times.
     *
     * @return percentiles, or null if no queries have been recorded yet
     */
    public @Nullable Percentiles getPercentiles() {
        final long[] snapshot;
        final int count;

        synchronized (lock) {
            if (bufferFilled) {
                snapshot = Arrays.copyOf(buffer, BUFFER_SIZE);
                count = BUFFER_SIZE;
            } else {
                snapshot = Arrays.copyOf(buffer, bufferIndex);
                count = bufferIndex;
            }
        }

        if (count == 0) {
            return null;
        }

        Arrays.sort(snapshot, 0, count);

        return new Percentiles(
                percentileValue(snapshot, count, 50),
                percentileValue(snapshot, count, 75),
                percentileValue(snapshot, count, 90),
                percentileValue(snapshot, count, 95),
                percentileValue(snapshot, count, 99));
    }

    private static long percentileValue(final long[] sortedData, final int count, final int percentile) {
        final int index = (int) Math.ceil(percentile / 100.0 * count) - 1;
        return sortedData[Math.max(0, Math.min(index, count - 1))];
    }

    /**
     * Resets all counters and clears the circular buffer.
     */
    public void reset() {
        totalQueries.set(0);
        cacheHits.set(0);
        fallbacks.set(0);
        totalDurationMs.set(0);
        minDurationMs.set(Long.MAX_VALUE);
        maxDurationMs.set(0);
        componentFailures.clear();
        synchronized (lock) {
            bufferIndex = 0;
            bufferFilled = false;
            Arrays.fill(buffer, 0L);
        }
    }

    public long getTotalQueries() {
        return totalQueries.get();
    }

    public long getCacheHits() {
        return cacheHits.get();
    }

    public long getFallbacks() {
        return fallbacks.get();
    }

    /**
     * Returns the average processing time in milliseconds, or 0.0 if no queries recorded.
     */
    public double getAverageDurationMs() {
        final long queries = totalQueries.get();
        if (queries == 0) {
            return 0.0;
        }
        return (double) totalDurationMs.get() / queries;
    }

    /**
     * Share of queries answered with the fallback result, or 0.0 if no queries recorded.
     */
    public double getErrorRate() {
        final long queries = totalQueries.get();
        if (queries == 0) {
            return 0.0;
        }
        return (double) fallbacks.get() / queries;
    }

    public Map<String, Long> getComponentFailures() {
        final Map<String, Long> snapshot = new TreeMap<>();
        for (final var entry : componentFailures.entrySet()) {
            snapshot.put(entry.getKey(), entry.getValue().get());
        }
        return snapshot;
    }

    public Snapshot snapshot() {
        final long min = minDurationMs.get();
        return new Snapshot(totalQueries.get(), cacheHits.get(), fallbacks.get(), getAverageDurationMs(),
                min == Long.MAX_VALUE ? 0 : min, maxDurationMs.get(), getPercentiles(), getComponentFailures(),
                getErrorRate());
    }
}
