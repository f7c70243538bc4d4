package io.github.hongjungwan.muxlog.test;

import io.github.hongjungwan.muxlog.spi.LogSink;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 전달된 메시지를 기록하는 테스트용 Sink. 실패 주입 지원.
 *
 * <p>Flush 프로토콜은 메시지 하나당 write 한 번을 호출하므로 {@link #messages()}의 각 원소가
 * 한 번의 Flush에 해당한다.
 */
public class CapturingLogSink implements LogSink {

    private final String name;
    private final List<String> messages = new ArrayList<>();
    private final AtomicInteger flushCount = new AtomicInteger();
    private final AtomicInteger closeCount = new AtomicInteger();
    private volatile IOException failure;
    private volatile boolean healthy = true;

    public CapturingLogSink(String name) {
        this.name = name;
    }

    public static CapturingLogSink named(String name) {
        return new CapturingLogSink(name);
    }

    /** 이후 write 호출이 지정 예외로 실패하도록 설정 */
    public CapturingLogSink failWith(IOException failure) {
        this.failure = failure;
        return this;
    }

    /** 이후 write 호출이 기본 메시지의 IOException으로 실패하도록 설정 */
    public CapturingLogSink failing() {
        return failWith(new IOException("Sink '" + name + "' is failing"));
    }

    /** 실패 주입 해제 */
    public CapturingLogSink recover() {
        this.failure = null;
        return this;
    }

    public CapturingLogSink healthy(boolean healthy) {
        this.healthy = healthy;
        return this;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public synchronized void write(String text) throws IOException {
        IOException current = failure;
        if (current != null) {
            throw current;
        }
        messages.add(text);
    }

    @Override
    public void flush() {
        flushCount.incrementAndGet();
    }

    @Override
    public boolean isHealthy() {
        return healthy;
    }

    @Override
    public void close() {
        closeCount.incrementAndGet();
    }

    public synchronized List<String> messages() {
        return new ArrayList<>(messages);
    }

    /** 받은 모든 메시지를 이어붙인 텍스트 */
    public synchronized String text() {
        return String.join("", messages);
    }

    public synchronized void clear() {
        messages.clear();
    }

    public int flushCount() {
        return flushCount.get();
    }

    public int closeCount() {
        return closeCount.get();
    }

    public boolean isClosed() {
        return closeCount.get() > 0;
    }

    @Override
    public String toString() {
        return "CapturingLogSink[" + name + "]";
    }
}
