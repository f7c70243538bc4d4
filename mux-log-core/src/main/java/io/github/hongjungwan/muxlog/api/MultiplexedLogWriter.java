package io.github.hongjungwan.muxlog.api;

import io.github.hongjungwan.muxlog.api.config.MuxLogConfig;
import io.github.hongjungwan.muxlog.core.internal.DefaultMultiplexedLogWriter;
import io.github.hongjungwan.muxlog.spi.LogSink;

import java.util.List;

/**
 * 다중 호출자 로그 멀티플렉서. 호출자별 버퍼에 텍스트를 모은 뒤 Flush 시점에 등록된 모든 Sink로
 * 하나의 메시지 단위로 전달.
 *
 * 서로 다른 호출자의 Flush는 전체 Sink 집합에 대해 직렬화되므로 한 Sink 안에서 두 메시지가 섞이지 않음.
 */
public interface MultiplexedLogWriter extends AutoCloseable {

    /** 기본 설정으로 Writer 생성 */
    static MultiplexedLogWriter create() {
        return new DefaultMultiplexedLogWriter(MuxLogConfig.defaultConfig());
    }

    /** 지정 설정으로 Writer 생성 */
    static MultiplexedLogWriter create(MuxLogConfig config) {
        return new DefaultMultiplexedLogWriter(config);
    }

    /**
     * Sink 등록. 이미 진행 중인 Flush에는 영향 없음.
     *
     * @throws IllegalArgumentException sink 또는 ownership이 null인 경우
     * @throws IllegalStateException    Writer가 이미 닫힌 경우
     */
    void register(LogSink sink, SinkOwnership ownership);

    default void registerOwned(LogSink sink) {
        register(sink, SinkOwnership.OWNED);
    }

    default void registerBorrowed(LogSink sink) {
        register(sink, SinkOwnership.BORROWED);
    }

    /**
     * 호출자 버퍼에 텍스트 추가. 다른 호출자와 전역 락을 다투지 않음.
     *
     * @throws IllegalArgumentException caller가 null인 경우
     * @throws IllegalStateException    Writer가 이미 닫힌 경우
     */
    void write(CallerId caller, CharSequence text);

    /** 현재 스레드 버퍼에 텍스트 추가 */
    default void write(CharSequence text) {
        write(CallerId.current(), text);
    }

    /**
     * 호출자 버퍼의 내용을 모든 Sink에 전달하고 버퍼를 비움.
     *
     * @throws NoSinksRegisteredException 등록된 Sink가 없는 경우
     */
    FlushResult flush(CallerId caller);

    default FlushResult flush() {
        return flush(CallerId.current());
    }

    /** 호출자 버퍼에 대기 중인 문자 수. 버퍼가 없으면 0 */
    int pendingLength(CallerId caller);

    /** 설정된 Clock 기준으로 유휴 버퍼 정리. 제거된 버퍼 수 반환 */
    int evictIdleBuffers();

    /** 등록된 Sink 스냅샷 (등록 순서) */
    List<LogSink> getSinks();

    int sinkCount();

    int bufferCount();

    /** OWNED Sink를 닫고 모든 버퍼 해제. 여러 번 호출해도 안전 */
    @Override
    void close();
}
