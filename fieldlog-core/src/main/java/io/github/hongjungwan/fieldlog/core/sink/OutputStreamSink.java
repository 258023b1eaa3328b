package io.github.hongjungwan.fieldlog.core.sink;

import io.github.hongjungwan.fieldlog.spi.LogSink;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * OutputStream 기반 sink. 레코드 단위로 동기화된 write.
 */
public class OutputStreamSink implements LogSink {

    private final OutputStream out;
    private final boolean ownsStream;

    /** 스트림은 닫지 않는다 (close 시 flush만 수행) */
    public OutputStreamSink(OutputStream out) {
        this(out, false);
    }

    public OutputStreamSink(OutputStream out, boolean ownsStream) {
        if (out == null) {
            throw new IllegalArgumentException("OutputStream must not be null");
        }
        this.out = out;
        this.ownsStream = ownsStream;
    }

    public static OutputStreamSink stderr() {
        return new OutputStreamSink(System.err);
    }

    public static OutputStreamSink stdout() {
        return new OutputStreamSink(System.out);
    }

    /** 파일 append sink. 상위 디렉토리가 없으면 생성. */
    public static OutputStreamSink forFile(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        OutputStream stream = Files.newOutputStream(path,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        return new OutputStreamSink(stream, true);
    }

    @Override
    public synchronized void write(byte[] record) throws IOException {
        out.write(record);
    }

    @Override
    public synchronized void flush() throws IOException {
        out.flush();
    }

    @Override
    public synchronized void close() throws IOException {
        if (ownsStream) {
            out.close();
        } else {
            out.flush();
        }
    }
}
