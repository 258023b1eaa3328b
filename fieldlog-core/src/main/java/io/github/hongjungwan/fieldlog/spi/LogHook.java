package io.github.hongjungwan.fieldlog.spi;

import io.github.hongjungwan.fieldlog.api.Level;

import java.util.Map;

/**
 * SPI invoked by the backend for every record that passes the level filter.
 *
 * <h2>Implementation Example:</h2>
 * <pre>{@code
 * LogHook hostname = (level, message, fields) -> fields.put("host", HOST_NAME);
 * }</pre>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface LogHook {

    /**
     * @param level   record level, {@code null} for records without a level
     * @param message final message
     * @param fields  mutable map whose entries are appended to the record
     */
    void run(Level level, String message, Map<String, Object> fields);
}
