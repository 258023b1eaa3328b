package io.github.hongjungwan.fieldlog.core.sink;

import io.github.hongjungwan.fieldlog.spi.LogSink;

import java.io.IOException;
import java.util.List;

/**
 * 여러 sink로 동일 레코드를 fan-out.
 *
 * 하나가 실패해도 나머지에는 기록하고, 첫 번째 실패를 던진다.
 */
public class MultiSink implements LogSink {

    private final List<LogSink> sinks;

    public MultiSink(List<LogSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    public List<LogSink> getSinks() {
        return sinks;
    }

    @Override
    public void write(byte[] record) throws IOException {
        forEachSink(sink -> sink.write(record));
    }

    @Override
    public void flush() throws IOException {
        forEachSink(LogSink::flush);
    }

    @Override
    public void close() throws IOException {
        forEachSink(LogSink::close);
    }

    private void forEachSink(SinkOperation operation) throws IOException {
        IOException first = null;
        for (LogSink sink : sinks) {
            try {
                operation.apply(sink);
            } catch (IOException e) {
                if (first == null) {
                    first = e;
                } else {
                    first.addSuppressed(e);
                }
            }
        }
        if (first != null) {
            throw first;
        }
    }

    @FunctionalInterface
    private interface SinkOperation {
        void apply(LogSink sink) throws IOException;
    }
}
