package io.github.hongjungwan.muxlog.core.internal;

import io.github.hongjungwan.muxlog.api.CallerId;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 호출자별 누적 버퍼. 내용과 메타데이터는 모두 버퍼 자신의 락으로 보호.
 *
 * 락 획득 순서: 버퍼 락 → 전달 락. Janitor는 테이블 락을 잡은 뒤 tryLock만 사용.
 */
public final class CallerBuffer {

    private final CallerId caller;
    private final StringBuilder text = new StringBuilder();
    private final ReentrantLock lock = new ReentrantLock();

    private Instant lastFlushTime;
    private boolean retired;

    CallerBuffer(CallerId caller, Instant createdAt) {
        this.caller = caller;
        this.lastFlushTime = createdAt;
    }

    public CallerId getCaller() {
        return caller;
    }

    void lock() {
        lock.lock();
    }

    boolean tryLock() {
        return lock.tryLock();
    }

    void unlock() {
        lock.unlock();
    }

    // 이하 메서드는 락 보유 상태에서만 호출

    void append(CharSequence chars) {
        text.append(chars);
    }

    String contents() {
        return text.toString();
    }

    int length() {
        return text.length();
    }

    /** 전달 완료 후 내용 비우기 */
    void clear(Instant flushedAt) {
        text.setLength(0);
        lastFlushTime = flushedAt;
    }

    Instant getLastFlushTime() {
        return lastFlushTime;
    }

    /** 비어 있고 마지막 Flush 이후 threshold를 초과했는지 */
    boolean isIdle(Instant now, Duration threshold) {
        return text.length() == 0
                && Duration.between(lastFlushTime, now).compareTo(threshold) > 0;
    }

    /** 테이블에서 제거됨 표시. 이후 이 버퍼를 잡은 호출자는 새 버퍼로 재시도 */
    void retire() {
        retired = true;
    }

    boolean isRetired() {
        return retired;
    }
}
