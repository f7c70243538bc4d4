package io.github.hongjungwan.muxlog.api;

/**
 * Sink가 하나도 등록되지 않은 상태에서 Flush를 호출한 경우. 설정 누락이므로 재시도 대상이 아님.
 */
public class NoSinksRegisteredException extends IllegalStateException {

    public NoSinksRegisteredException() {
        super("No log sinks registered - register at least one sink before flushing");
    }
}
