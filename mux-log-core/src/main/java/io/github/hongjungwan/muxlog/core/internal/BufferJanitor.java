package io.github.hongjungwan.muxlog.core.internal;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;

/**
 * 유휴 버퍼 정리. 비어 있고 idleThreshold 이상 Flush가 없던 버퍼를 테이블에서 제거.
 *
 * 사용 중인 버퍼는 건너뛰는 best-effort 정책. 잠든 호출자가 다시 쓰면 새 버퍼가 생성될 뿐 실패하지 않음.
 * 현재 시각을 인자로 받으므로 테스트에서 결정적으로 구동 가능.
 */
@Slf4j
public class BufferJanitor {

    private final CallerBufferTable table;
    private final Duration idleThreshold;
    private final WriterMetrics metrics;

    public BufferJanitor(CallerBufferTable table, Duration idleThreshold, WriterMetrics metrics) {
        this.table = table;
        this.idleThreshold = idleThreshold;
        this.metrics = metrics;
    }

    /** 1회 정리. 제거된 버퍼 수 반환 */
    public int sweep(Instant now) {
        int evicted = table.evictWhere(buffer -> buffer.isIdle(now, idleThreshold));
        metrics.recordSweep(evicted);

        if (evicted > 0) {
            log.debug("Evicted {} idle caller buffers ({} remaining)", evicted, table.size());
        }
        return evicted;
    }

    public Duration getIdleThreshold() {
        return idleThreshold;
    }
}
