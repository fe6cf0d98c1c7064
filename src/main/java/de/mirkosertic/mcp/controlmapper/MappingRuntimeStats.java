package de.mirkosertic.mcp.controlmapper;

import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe counters for mapping requests served by the MCP tools.
 *
 * <p>Counters are atomic. The durations of the last {@value #BUFFER_SIZE} successful mappings
 * are kept in a ring buffer guarded by its own lock and used for percentiles.</p>
 */
public class MappingRuntimeStats {

    static final int BUFFER_SIZE = 500;

    private final AtomicLong totalMappings = new AtomicLong(0);
    private final AtomicLong failedMappings = new AtomicLong(0);
    private final AtomicLong totalDurationMs = new AtomicLong(0);
    private final AtomicLong totalQueryTerms = new AtomicLong(0);
    private final AtomicLong totalHighControls = new AtomicLong(0);
    private final AtomicLong fallbackExtractions = new AtomicLong(0);
    private final AtomicLong minDurationMs = new AtomicLong(Long.MAX_VALUE);
    private final AtomicLong maxDurationMs = new AtomicLong(0);

    private final long[] buffer = new long[BUFFER_SIZE];
    private int bufferIndex = 0;
    private boolean bufferFilled = false;
    private final Object lock = new Object();

    public record Percentiles(long p50, long p90, long p99) {
    }

    /**
     * Record a successful mapping.
     *
     * @param durationMs   wall clock time of the mapping, in milliseconds
     * @param queryTerms   number of terms in the composite query
     * @param highControls number of controls labelled high
     * @param fallback     whether the extractor fell back to the full text
     */
    public void recordMapping(final long durationMs, final int queryTerms, final long highControls,
                              final boolean fallback) {
        totalMappings.incrementAndGet();
        totalDurationMs.addAndGet(durationMs);
        totalQueryTerms.addAndGet(queryTerms);
        totalHighControls.addAndGet(highControls);
        if (fallback) {
            fallbackExtractions.incrementAndGet();
        }

        long current;
        do {
            current = minDurationMs.get();
            if (durationMs >= current) break;
        } while (!minDurationMs.compareAndSet(current, durationMs));

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

    public void recordFailure() {
        failedMappings.incrementAndGet();
    }

    /**
     * Percentiles over the most recent mapping durations.
     *
     * @return percentiles, or null before the first mapping
     */
    public @Nullable Percentiles getPercentiles() {
        final long[] snapshot;
        synchronized (lock) {
            snapshot = Arrays.copyOf(buffer, bufferFilled ? BUFFER_SIZE : bufferIndex);
        }
        if (snapshot.length == 0) {
            return null;
        }
        Arrays.sort(snapshot);
        return new Percentiles(
                percentileValue(snapshot, 50),
                percentileValue(snapshot, 90),
                percentileValue(snapshot, 99));
    }

    private static long percentileValue(final long[] sortedData, final int percentile) {
        final int index = (int) Math.ceil(percentile / 100.0 * sortedData.length) - 1;
        return sortedData[Math.max(0, Math.min(index, sortedData.length - 1))];
    }

    public long getTotalMappings() {
        return totalMappings.get();
    }

    public long getFailedMappings() {
        return failedMappings.get();
    }

    public long getFallbackExtractions() {
        return fallbackExtractions.get();
    }

    /**
     * Minimum mapping duration, 0 before the first mapping.
     */
    public long getMinDurationMs() {
        final long min = minDurationMs.get();
        return min == Long.MAX_VALUE ? 0 : min;
    }

    public long getMaxDurationMs() {
        return maxDurationMs.get();
    }

    public double getAverageDurationMs() {
        final long mappings = totalMappings.get();
        return mappings == 0 ? 0.0 : (double) totalDurationMs.get() / mappings;
    }

    public double getAverageQueryTerms() {
        final long mappings = totalMappings.get();
        return mappings == 0 ? 0.0 : (double) totalQueryTerms.get() / mappings;
    }

    public double getAverageHighControls() {
        final long mappings = totalMappings.get();
        return mappings == 0 ? 0.0 : (double) totalHighControls.get() / mappings;
    }
}
