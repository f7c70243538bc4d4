package io.github.hongjungwan.muxlog.starter;

import io.github.hongjungwan.muxlog.api.MultiplexedLogWriter;
import io.github.hongjungwan.muxlog.api.config.MuxLogConfig;
import io.github.hongjungwan.muxlog.core.internal.MuxLogDoctor;
import io.github.hongjungwan.muxlog.core.sink.ConsoleLogSink;
import io.github.hongjungwan.muxlog.core.sink.FileLogSink;
import io.github.hongjungwan.muxlog.core.sink.SocketLogSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Paths;

/**
 * Mux Log Spring Boot 자동 설정.
 */
@AutoConfiguration
@EnableConfigurationProperties(MuxLogProperties.class)
@ConditionalOnProperty(prefix = "mux-log", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class MuxLogAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public MuxLogConfig muxLogConfig(MuxLogProperties properties) {
        return MuxLogConfig.builder()
                .idleThreshold(properties.getIdleThreshold())
                .cleanupFlushInterval(properties.getCleanupFlushInterval())
                .build();
    }

    /** 설정된 Sink는 모두 OWNED로 등록되어 Writer 종료 시 함께 닫힘 */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public MultiplexedLogWriter multiplexedLogWriter(MuxLogConfig config, MuxLogProperties properties) {
        MultiplexedLogWriter writer = MultiplexedLogWriter.create(config);

        try {
            if (properties.getConsole().isEnabled()) {
                writer.registerOwned(properties.getConsole().getTarget() == MuxLogProperties.ConsoleTarget.STDERR
                        ? ConsoleLogSink.stderr()
                        : ConsoleLogSink.stdout());
            }

            for (MuxLogProperties.FileProperties file : properties.getFiles()) {
                writer.registerOwned(new FileLogSink(Paths.get(file.getPath()), Charset.forName(file.getCharset())));
            }

            for (MuxLogProperties.SocketProperties socket : properties.getSockets()) {
                writer.registerOwned(new SocketLogSink(socket.getHost(), socket.getPort(), socket.getConnectTimeout()));
            }
        } catch (IOException | RuntimeException e) {
            writer.close();
            throw new IllegalStateException("Failed to register configured sinks", e);
        }

        log.info("MultiplexedLogWriter created with {} sink(s)", writer.sinkCount());
        return writer;
    }

    @Bean
    @ConditionalOnMissingBean
    public MuxLogDoctor muxLogDoctor(MultiplexedLogWriter writer) {
        return new MuxLogDoctor(writer);
    }

    @Bean
    public MuxLogLifecycle muxLogLifecycle(MuxLogDoctor doctor, MultiplexedLogWriter writer) {
        return new MuxLogLifecycle(doctor, writer);
    }

    /**
     * Writer 시작 진단 및 종료를 관리하는 SmartLifecycle 구현체.
     */
    static class MuxLogLifecycle implements SmartLifecycle {

        private final MuxLogDoctor doctor;
        private final MultiplexedLogWriter writer;
        private volatile boolean running = false;

        MuxLogLifecycle(MuxLogDoctor doctor, MultiplexedLogWriter writer) {
            this.doctor = doctor;
            this.writer = writer;
        }

        @Override
        public void start() {
            log.info("Starting mux-log...");

            MuxLogDoctor.DiagnosticReport report = doctor.diagnose();

            if (report.hasFailures()) {
                log.warn("Diagnostic failures detected - flushes may not reach every destination");
            }

            running = true;
            log.info("mux-log started with {} sink(s)", writer.sinkCount());
        }

        @Override
        public void stop() {
            log.info("Stopping mux-log...");

            writer.close();

            running = false;
            log.info("mux-log stopped");
        }

        @Override
        public boolean isRunning() {
            return running;
        }

        @Override
        public int getPhase() {
            return Integer.MIN_VALUE + 100;
        }
    }
}
