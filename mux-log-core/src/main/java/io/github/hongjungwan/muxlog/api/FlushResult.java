package io.github.hongjungwan.muxlog.api;

import java.util.List;

/**
 * 한 번의 Flush 결과. 실패한 Sink가 하나라도 있으면 success=false.
 *
 * @param sinkCount      전달을 시도한 Sink 수 (스냅샷 기준)
 * @param deliveredChars 각 Sink에 전달한 메시지 길이
 * @param failures       실패한 Sink 목록 (등록 순서)
 */
public record FlushResult(
        int sinkCount,
        int deliveredChars,
        List<SinkFailure> failures
) {

    public FlushResult {
        failures = List.copyOf(failures);
    }

    public static FlushResult delivered(int sinkCount, int deliveredChars) {
        return new FlushResult(sinkCount, deliveredChars, List.of());
    }

    public boolean success() {
        return failures.isEmpty();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
