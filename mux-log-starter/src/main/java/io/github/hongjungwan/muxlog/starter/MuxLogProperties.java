package io.github.hongjungwan.muxlog.starter;

import io.github.hongjungwan.muxlog.core.sink.SocketLogSink;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Mux Log 설정 Properties (prefix: mux-log).
 */
@Data
@ConfigurationProperties(prefix = "mux-log")
public class MuxLogProperties {

    /** 자동 설정 활성화 여부 */
    private boolean enabled = true;

    /** 비어 있는 호출자 버퍼를 정리하기까지의 유휴 시간 */
    private Duration idleThreshold = Duration.ofMinutes(2);

    /** 유휴 버퍼 정리 주기 (Flush 횟수) */
    private int cleanupFlushInterval = 100;

    /** 콘솔 Sink 설정 */
    private ConsoleProperties console = new ConsoleProperties();

    /** 파일 Sink 목록 */
    private List<FileProperties> files = new ArrayList<>();

    /** TCP Socket Sink 목록 */
    private List<SocketProperties> sockets = new ArrayList<>();

    public enum ConsoleTarget {
        STDOUT, STDERR
    }

    @Data
    public static class ConsoleProperties {
        private boolean enabled = true;
        private ConsoleTarget target = ConsoleTarget.STDOUT;
    }

    @Data
    public static class FileProperties {
        private String path;
        private String charset = "UTF-8";
    }

    @Data
    public static class SocketProperties {
        private String host;
        private int port;
        private Duration connectTimeout = SocketLogSink.DEFAULT_CONNECT_TIMEOUT;
    }
}
