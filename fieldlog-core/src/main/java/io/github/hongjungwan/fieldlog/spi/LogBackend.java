package io.github.hongjungwan.fieldlog.spi;

import io.github.hongjungwan.fieldlog.api.Level;
import io.github.hongjungwan.fieldlog.api.domain.LogRecord;

import java.util.List;

/**
 * SPI for the record emitter a logger forwards to.
 *
 * <p>The backend owns level filtering, serialization, fields bound to child loggers
 * and output. Loggers decide only what is forwarded.</p>
 *
 * <p>Implementations must be safe for concurrent {@link #emit(LogRecord)} calls.
 * Derivation methods return new instances sharing the same output.</p>
 *
 * @since 1.0.0
 */
public interface LogBackend {

    Level getLevel();

    /**
     * @param level record level, {@code null} for records without a level
     */
    boolean isEnabled(Level level);

    LogBackend withLevel(Level level);

    /**
     * Child backend that writes the given key/value pairs into every record.
     */
    LogBackend withFields(List<Object> fields);

    /**
     * Emit one record. Must not throw for output failures.
     */
    void emit(LogRecord record);

    void flush();

    void close();
}
