package io.github.hongjungwan.muxlog.api.config;

import lombok.Builder;
import lombok.Getter;

import java.time.Clock;
import java.time.Duration;

/**
 * Configuration for the multiplexed log writer
 */
@Getter
@Builder
public class MuxLogConfig {

    /**
     * Idle time after which an empty caller buffer may be evicted
     */
    @Builder.Default
    private final Duration idleThreshold = Duration.ofMinutes(2);

    /**
     * Number of flushes between two idle-buffer sweeps
     */
    @Builder.Default
    private final int cleanupFlushInterval = 100;

    /**
     * Time source for last-flush stamps and sweeps
     */
    @Builder.Default
    private final Clock clock = Clock.systemUTC();

    public static MuxLogConfig defaultConfig() {
        return MuxLogConfig.builder().build();
    }
}
