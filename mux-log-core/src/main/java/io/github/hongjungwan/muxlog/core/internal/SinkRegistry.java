package io.github.hongjungwan.muxlog.core.internal;

import io.github.hongjungwan.muxlog.api.FlushResult;
import io.github.hongjungwan.muxlog.api.NoSinksRegisteredException;
import io.github.hongjungwan.muxlog.api.SinkFailure;
import io.github.hongjungwan.muxlog.api.SinkOwnership;
import io.github.hongjungwan.muxlog.spi.LogSink;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 등록 순서를 유지하는 Sink 목록과 전달 락.
 *
 * 등록은 registrationLock 안에서 불변 리스트를 교체하고, 전달은 deliveryLock 안에서 그 시점의
 * 스냅샷만 사용. 따라서 등록은 느린 Sink 때문에 막히지 않고, 진행 중인 전달의 Sink 집합도 바뀌지 않음.
 */
@Slf4j
public class SinkRegistry {

    private final ReentrantLock registrationLock = new ReentrantLock();
    private final ReentrantLock deliveryLock = new ReentrantLock();

    private volatile List<RegisteredSink> sinks = List.of();
    private volatile boolean closed = false;

    public void register(LogSink sink, SinkOwnership ownership) {
        if (sink == null) {
            throw new IllegalArgumentException("Log sink must not be null");
        }
        if (ownership == null) {
            throw new IllegalArgumentException("Sink ownership must not be null");
        }

        registrationLock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("Cannot register sink '" + sink.getName() + "' - writer is closed");
            }
            List<RegisteredSink> next = new ArrayList<>(sinks);
            next.add(new RegisteredSink(sink, ownership));
            sinks = List.copyOf(next);
        } finally {
            registrationLock.unlock();
        }

        log.debug("Registered {} sink '{}'", ownership, sink.getName());
    }

    /**
     * 전달 락을 잡고 스냅샷의 모든 Sink에 메시지를 쓰고 플러시.
     *
     * 한 Sink의 실패는 기록만 하고 나머지 Sink로 계속 전달.
     *
     * @throws NoSinksRegisteredException 등록된 Sink가 없는 경우
     * @throws IllegalStateException      이미 닫힌 경우
     */
    public FlushResult deliver(String text) {
        deliveryLock.lock();
        try {
            // close()는 closed를 먼저 쓰고 sinks를 비우므로, 목록을 먼저 읽어야 비워진 목록이 항상 closed=true와 짝지어짐
            List<RegisteredSink> targets = sinks;
            if (closed) {
                throw new IllegalStateException("Writer is closed");
            }
            if (targets.isEmpty()) {
                throw new NoSinksRegisteredException();
            }

            List<SinkFailure> failures = null;
            for (RegisteredSink target : targets) {
                LogSink sink = target.sink();
                try {
                    sink.write(text);
                    sink.flush();
                } catch (Exception e) {
                    log.warn("Failed to deliver log message to sink '{}'", sink.getName(), e);
                    if (failures == null) {
                        failures = new ArrayList<>();
                    }
                    failures.add(new SinkFailure(sink.getName(), e));
                }
            }

            return failures == null
                    ? FlushResult.delivered(targets.size(), text.length())
                    : new FlushResult(targets.size(), text.length(), failures);
        } finally {
            deliveryLock.unlock();
        }
    }

    /**
     * OWNED Sink를 정확히 한 번씩 닫음. 진행 중인 전달이 끝난 뒤에 닫히도록 전달 락 안에서 수행.
     *
     * @return 닫은 Sink 수
     */
    public int close() {
        List<RegisteredSink> released;
        registrationLock.lock();
        try {
            if (closed) {
                return 0;
            }
            closed = true;
            released = sinks;
            sinks = List.of();
        } finally {
            registrationLock.unlock();
        }

        int closedCount = 0;
        deliveryLock.lock();
        try {
            for (RegisteredSink target : released) {
                if (target.ownership() != SinkOwnership.OWNED) {
                    continue;
                }
                try {
                    target.sink().close();
                    closedCount++;
                } catch (Exception e) {
                    log.warn("Failed to close owned sink '{}'", target.sink().getName(), e);
                }
            }
        } finally {
            deliveryLock.unlock();
        }
        return closedCount;
    }

    /** 현재 등록된 Sink 스냅샷 (등록 순서) */
    public List<RegisteredSink> snapshot() {
        return sinks;
    }

    public int size() {
        return sinks.size();
    }

    public boolean isClosed() {
        return closed;
    }

    /** 등록 항목 */
    public record RegisteredSink(
            LogSink sink,
            SinkOwnership ownership
    ) {}
}
