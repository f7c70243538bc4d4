/**
 * Public API for Mux Log.
 *
 * <h2>Main Entry Points:</h2>
 * <ul>
 *   <li>{@link io.github.hongjungwan.muxlog.api.MultiplexedLogWriter} - Multiplexed writer</li>
 *   <li>{@link io.github.hongjungwan.muxlog.api.config.MuxLogConfig} - Writer configuration</li>
 *   <li>{@link io.github.hongjungwan.muxlog.spi.LogSink} - Output destination</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * try (MultiplexedLogWriter writer = MultiplexedLogWriter.create()) {
 *     writer.registerOwned(new FileLogSink(Path.of("logs/app.log")));
 *     writer.registerBorrowed(ConsoleLogSink.stdout());
 *
 *     writer.write("order ");
 *     writer.write("accepted");
 *     FlushResult result = writer.flush();
 * }
 * }</pre>
 */
package io.github.hongjungwan.muxlog.api;
