package io.github.hongjungwan.muxlog.spi;

import java.io.Closeable;
import java.io.IOException;

/**
 * 로그 출력 대상 SPI. 파일, 소켓, 콘솔 등.
 *
 * 실패는 IOException으로 보고하며, Writer는 이를 Flush 결과로 수집할 뿐 전달을 중단하지 않음.
 * 모든 호출은 Writer의 전달 락 안에서 직렬화되므로 구현체가 별도로 동기화할 필요 없음.
 */
public interface LogSink extends Closeable {

    /** Sink 식별자 (진단/로그용) */
    String getName();

    /** 메시지 쓰기 */
    void write(String text) throws IOException;

    /** 버퍼된 출력 비우기 */
    void flush() throws IOException;

    /** Sink 상태 확인 */
    default boolean isHealthy() {
        return true;
    }

    /** 리소스 해제. OWNED로 등록된 경우 Writer가 정확히 한 번 호출 */
    @Override
    void close() throws IOException;
}
