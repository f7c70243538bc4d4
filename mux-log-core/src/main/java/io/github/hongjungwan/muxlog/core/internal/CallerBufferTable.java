package io.github.hongjungwan.muxlog.core.internal;

import io.github.hongjungwan.muxlog.api.CallerId;

import java.time.Clock;
import java.util.Iterator;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * 호출자 식별자 → 버퍼 테이블. Writer 인스턴스마다 하나씩 소유.
 *
 * 조회는 락 없이, 생성과 제거는 테이블 락 안에서 수행 (double-checked 생성).
 */
public class CallerBufferTable {

    private final ConcurrentMap<CallerId, CallerBuffer> buffers = new ConcurrentHashMap<>();
    private final ReentrantLock tableLock = new ReentrantLock();
    private final Clock clock;
    private final WriterMetrics metrics;

    public CallerBufferTable(Clock clock, WriterMetrics metrics) {
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * 호출자 버퍼를 찾거나 생성한 뒤 잠금 상태로 반환. 호출자가 반드시 {@link #release(CallerBuffer)} 해야 함.
     *
     * 조회와 락 획득 사이에 Janitor가 버퍼를 제거했다면 새 버퍼로 재시도하므로 쓰기 내용은 유실되지 않음.
     */
    public CallerBuffer acquire(CallerId caller) {
        while (true) {
            CallerBuffer buffer = lookupOrCreate(caller);
            buffer.lock();
            if (!buffer.isRetired()) {
                return buffer;
            }
            buffer.unlock();
        }
    }

    public void release(CallerBuffer buffer) {
        buffer.unlock();
    }

    private CallerBuffer lookupOrCreate(CallerId caller) {
        CallerBuffer buffer = buffers.get(caller);
        if (buffer != null) {
            return buffer;
        }

        tableLock.lock();
        try {
            buffer = buffers.get(caller);
            if (buffer == null) {
                buffer = new CallerBuffer(caller, clock.instant());
                buffers.put(caller, buffer);
                metrics.recordBufferCreated();
            }
            return buffer;
        } finally {
            tableLock.unlock();
        }
    }

    /** 대기 중인 문자 수. 버퍼가 없으면 생성하지 않고 0 반환 */
    public int pendingLength(CallerId caller) {
        CallerBuffer buffer = buffers.get(caller);
        if (buffer == null) {
            return 0;
        }
        buffer.lock();
        try {
            return buffer.isRetired() ? 0 : buffer.length();
        } finally {
            buffer.unlock();
        }
    }

    /**
     * 테이블 락 안에서 조건에 맞는 버퍼 제거. 락을 즉시 얻지 못한 버퍼는 사용 중으로 보고 건너뜀.
     *
     * @return 제거된 버퍼 수
     */
    public int evictWhere(Predicate<CallerBuffer> shouldEvict) {
        tableLock.lock();
        try {
            int evicted = 0;
            Iterator<CallerBuffer> it = buffers.values().iterator();
            while (it.hasNext()) {
                CallerBuffer buffer = it.next();
                if (!buffer.tryLock()) {
                    continue;
                }
                try {
                    if (shouldEvict.test(buffer)) {
                        buffer.retire();
                        it.remove();
                        evicted++;
                    }
                } finally {
                    buffer.unlock();
                }
            }
            return evicted;
        } finally {
            tableLock.unlock();
        }
    }

    public boolean contains(CallerId caller) {
        return buffers.containsKey(caller);
    }

    public int size() {
        return buffers.size();
    }

    /** Writer 종료 시 전체 해제 */
    public void clear() {
        tableLock.lock();
        try {
            buffers.clear();
        } finally {
            tableLock.unlock();
        }
    }
}
