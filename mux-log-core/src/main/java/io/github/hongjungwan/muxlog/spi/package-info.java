/**
 * Service Provider Interfaces for Mux Log.
 *
 * <p>Implement {@link io.github.hongjungwan.muxlog.spi.LogSink} to add an output destination.
 * Stock implementations live in {@code io.github.hongjungwan.muxlog.core.sink}.</p>
 */
package io.github.hongjungwan.muxlog.spi;
