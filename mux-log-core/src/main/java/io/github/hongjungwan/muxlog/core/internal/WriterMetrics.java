package io.github.hongjungwan.muxlog.core.internal;

import io.github.hongjungwan.muxlog.api.FlushResult;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Writer 메트릭 수집 (LongAdder 기반 lock-free). Writer 인스턴스마다 독립.
 */
public final class WriterMetrics {

    private final Instant startTime = Instant.now();

    private final LongAdder flushes = new LongAdder();
    private final LongAdder failedFlushes = new LongAdder();
    private final LongAdder sinkFailures = new LongAdder();
    private final LongAdder charsDelivered = new LongAdder();
    private final LongAdder buffersCreated = new LongAdder();
    private final LongAdder buffersEvicted = new LongAdder();
    private final LongAdder sweeps = new LongAdder();
    private final LatencyHistogram flushLatency = new LatencyHistogram("flush");

    public void recordFlush(FlushResult result, long nanos) {
        flushes.increment();
        charsDelivered.add((long) result.deliveredChars() * (result.sinkCount() - result.failures().size()));
        if (result.hasFailures()) {
            failedFlushes.increment();
            sinkFailures.add(result.failures().size());
        }
        flushLatency.record(nanos);
    }

    public void recordBufferCreated() {
        buffersCreated.increment();
    }

    public void recordSweep(int evicted) {
        sweeps.increment();
        buffersEvicted.add(evicted);
    }

    public Snapshot getSnapshot() {
        return new Snapshot(
                Instant.now(),
                startTime,
                flushes.sum(),
                failedFlushes.sum(),
                sinkFailures.sum(),
                charsDelivered.sum(),
                buffersCreated.sum(),
                buffersEvicted.sum(),
                sweeps.sum(),
                flushLatency.getStats()
        );
    }

    public void reset() {
        flushes.reset();
        failedFlushes.reset();
        sinkFailures.reset();
        charsDelivered.reset();
        buffersCreated.reset();
        buffersEvicted.reset();
        sweeps.reset();
        flushLatency.reset();
    }

    /** Latency 히스토그램 */
    public static class LatencyHistogram {
        private final String name;
        private final LongAdder count = new LongAdder();
        private final LongAdder totalNanos = new LongAdder();
        private final AtomicLong minNanos = new AtomicLong(Long.MAX_VALUE);
        private final AtomicLong maxNanos = new AtomicLong(0);

        public LatencyHistogram(String name) {
            this.name = name;
        }

        public void record(long nanos) {
            count.increment();
            totalNanos.add(nanos);
            minNanos.accumulateAndGet(nanos, Math::min);
            maxNanos.accumulateAndGet(nanos, Math::max);
        }

        public LatencyStats getStats() {
            long c = count.sum();
            if (c == 0) {
                return new LatencyStats(name, 0, 0, 0, 0);
            }

            return new LatencyStats(
                    name,
                    c,
                    (double) totalNanos.sum() / c / 1_000_000,
                    (double) minNanos.get() / 1_000_000,
                    (double) maxNanos.get() / 1_000_000
            );
        }

        public void reset() {
            count.reset();
            totalNanos.reset();
            minNanos.set(Long.MAX_VALUE);
            maxNanos.set(0);
        }
    }

    public record LatencyStats(
            String name,
            long count,
            double avgMs,
            double minMs,
            double maxMs
    ) {}

    public record Snapshot(
            Instant snapshotTime,
            Instant startTime,
            long flushes,
            long failedFlushes,
            long sinkFailures,
            long charsDelivered,
            long buffersCreated,
            long buffersEvicted,
            long sweeps,
            LatencyStats flushLatency
    ) {
        public Duration uptime() {
            return Duration.between(startTime, snapshotTime);
        }

        public double failureRate() {
            if (flushes == 0) return 0;
            return (double) failedFlushes / flushes;
        }
    }
}
