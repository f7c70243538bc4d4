package io.github.hongjungwan.muxlog.core.io;

import io.github.hongjungwan.muxlog.api.FlushResult;
import io.github.hongjungwan.muxlog.api.SinkFailure;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writer 어댑터에서 일부 Sink 전달이 실패했을 때 발생. 나머지 Sink에는 이미 전달된 상태.
 */
public class SinkDeliveryException extends IOException {

    private final transient FlushResult result;

    public SinkDeliveryException(FlushResult result) {
        super("Log delivery failed for " + result.failures().size() + " of " + result.sinkCount()
                + " sinks: " + result.failures().stream().map(SinkFailure::describe).collect(Collectors.joining(", ")),
                result.failures().get(0).cause());
        this.result = result;
    }

    public FlushResult getResult() {
        return result;
    }

    public List<SinkFailure> getFailures() {
        return result.failures();
    }
}
