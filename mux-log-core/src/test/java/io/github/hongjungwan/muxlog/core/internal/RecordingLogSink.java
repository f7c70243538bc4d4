package io.github.hongjungwan.muxlog.core.internal;

import io.github.hongjungwan.muxlog.spi.LogSink;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 테스트용 Sink. write 호출 단위로 메시지를 기록.
 */
public class RecordingLogSink implements LogSink {

    private final String name;
    private final List<String> messages = new ArrayList<>();
    private final AtomicInteger flushCount = new AtomicInteger();
    private final AtomicInteger closeCount = new AtomicInteger();
    private volatile boolean failing = false;

    public RecordingLogSink(String name) {
        this.name = name;
    }

    public void failWrites(boolean failing) {
        this.failing = failing;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public synchronized void write(String text) throws IOException {
        if (failing) {
            throw new IOException("simulated failure on " + name);
        }
        messages.add(text);
    }

    @Override
    public void flush() {
        flushCount.incrementAndGet();
    }

    @Override
    public void close() {
        closeCount.incrementAndGet();
    }

    public synchronized List<String> messages() {
        return new ArrayList<>(messages);
    }

    public synchronized String joined() {
        return String.join("", messages);
    }

    public int flushCount() {
        return flushCount.get();
    }

    public int closeCount() {
        return closeCount.get();
    }
}
