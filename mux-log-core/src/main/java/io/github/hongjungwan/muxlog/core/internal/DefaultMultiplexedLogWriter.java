package io.github.hongjungwan.muxlog.core.internal;

import io.github.hongjungwan.muxlog.api.CallerId;
import io.github.hongjungwan.muxlog.api.FlushResult;
import io.github.hongjungwan.muxlog.api.MultiplexedLogWriter;
import io.github.hongjungwan.muxlog.api.SinkOwnership;
import io.github.hongjungwan.muxlog.api.config.MuxLogConfig;
import io.github.hongjungwan.muxlog.spi.LogSink;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * MultiplexedLogWriter 기본 구현.
 *
 * Flush 순서: 호출자 버퍼 락 → 전달 락 → Sink별 write/flush → 버퍼 비우기 → 역순 해제.
 * cleanupFlushInterval 번째 Flush마다 모든 락을 놓은 뒤 유휴 버퍼 정리를 수행.
 */
@Slf4j
public class DefaultMultiplexedLogWriter implements MultiplexedLogWriter {

    private final MuxLogConfig config;
    private final Clock clock;
    private final WriterMetrics metrics = new WriterMetrics();
    private final SinkRegistry sinks = new SinkRegistry();
    private final CallerBufferTable buffers;
    private final BufferJanitor janitor;

    private final AtomicLong flushCount = new AtomicLong(0);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public DefaultMultiplexedLogWriter(MuxLogConfig config) {
        if (config.getCleanupFlushInterval() <= 0) {
            throw new IllegalArgumentException("cleanupFlushInterval must be positive: " + config.getCleanupFlushInterval());
        }
        if (config.getIdleThreshold() == null || config.getIdleThreshold().isNegative()) {
            throw new IllegalArgumentException("idleThreshold must not be negative: " + config.getIdleThreshold());
        }
        if (config.getClock() == null) {
            throw new IllegalArgumentException("clock must not be null");
        }

        this.config = config;
        this.clock = config.getClock();
        this.buffers = new CallerBufferTable(clock, metrics);
        this.janitor = new BufferJanitor(buffers, config.getIdleThreshold(), metrics);
    }

    @Override
    public void register(LogSink sink, SinkOwnership ownership) {
        sinks.register(sink, ownership);
    }

    @Override
    public void write(CallerId caller, CharSequence text) {
        requireCaller(caller);
        ensureOpen();

        CallerBuffer buffer = buffers.acquire(caller);
        try {
            buffer.append(text);
        } finally {
            buffers.release(buffer);
        }
    }

    @Override
    public FlushResult flush(CallerId caller) {
        requireCaller(caller);
        ensureOpen();

        long start = System.nanoTime();
        FlushResult result;

        CallerBuffer buffer = buffers.acquire(caller);
        try {
            result = sinks.deliver(buffer.contents());
            buffer.clear(clock.instant());
        } finally {
            buffers.release(buffer);
        }

        metrics.recordFlush(result, System.nanoTime() - start);

        if (flushCount.incrementAndGet() % config.getCleanupFlushInterval() == 0) {
            janitor.sweep(clock.instant());
        }
        return result;
    }

    @Override
    public int pendingLength(CallerId caller) {
        requireCaller(caller);
        return buffers.pendingLength(caller);
    }

    @Override
    public int evictIdleBuffers() {
        return janitor.sweep(clock.instant());
    }

    @Override
    public List<LogSink> getSinks() {
        return sinks.snapshot().stream()
                .map(SinkRegistry.RegisteredSink::sink)
                .toList();
    }

    @Override
    public int sinkCount() {
        return sinks.size();
    }

    @Override
    public int bufferCount() {
        return buffers.size();
    }

    public WriterMetrics.Snapshot getMetrics() {
        return metrics.getSnapshot();
    }

    public MuxLogConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            int released = sinks.close();
            buffers.clear();
            log.info("Multiplexed log writer closed. Released {} owned sinks", released);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Multiplexed log writer is closed");
        }
    }

    private static void requireCaller(CallerId caller) {
        if (caller == null) {
            throw new IllegalArgumentException("Caller id must not be null");
        }
    }
}
