package io.github.hongjungwan.fieldlog.spi;

import java.io.Closeable;
import java.io.IOException;

/**
 * SPI for destinations of serialized log records (console, file, network writer).
 *
 * <p>Each call to {@link #write(byte[])} carries exactly one complete record,
 * terminated by a newline.</p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface LogSink extends Closeable {

    /**
     * Accept one serialized record.
     *
     * @param record record bytes, never modified by the caller afterwards
     * @throws IOException if the destination cannot be written
     */
    void write(byte[] record) throws IOException;

    default void flush() throws IOException {
    }

    @Override
    default void close() throws IOException {
    }
}
