package io.github.hongjungwan.muxlog.api;

/**
 * 단일 Sink 쓰기/플러시 실패 기록. Flush 결과에 누적되며 예외로 전파되지 않음.
 */
public record SinkFailure(
        String sinkName,
        Exception cause
) {

    public String describe() {
        return sinkName + ": " + cause.getClass().getSimpleName()
                + (cause.getMessage() != null ? " - " + cause.getMessage() : "");
    }
}
