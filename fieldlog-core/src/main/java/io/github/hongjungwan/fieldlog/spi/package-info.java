/**
 * Service Provider Interfaces (SPI) for fieldlog.
 *
 * <p>This package contains the seams between the logging facade and its output.
 * Implement these interfaces to customize:</p>
 *
 * <ul>
 *   <li>{@link io.github.hongjungwan.fieldlog.spi.LogBackend} - Record emitter (filtering, serialization)</li>
 *   <li>{@link io.github.hongjungwan.fieldlog.spi.LogSink} - Log destination</li>
 *   <li>{@link io.github.hongjungwan.fieldlog.spi.LogHook} - Per-record field enrichment</li>
 * </ul>
 *
 * @since 1.0.0
 */
package io.github.hongjungwan.fieldlog.spi;
