package io.github.hongjungwan.fieldlog.api.config;

import io.github.hongjungwan.fieldlog.api.ErrorCounter;
import io.github.hongjungwan.fieldlog.api.Level;
import io.github.hongjungwan.fieldlog.api.SimpleErrorCounter;
import io.github.hongjungwan.fieldlog.core.sink.OutputStreamSink;
import io.github.hongjungwan.fieldlog.spi.LogHook;
import io.github.hongjungwan.fieldlog.spi.LogSink;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.With;

import java.io.OutputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.IntConsumer;

/**
 * Configuration for a fieldlog logger.
 *
 * <p>Instances are immutable: every {@code with*} method returns a modified copy, so a
 * configuration handed to one logger cannot be altered by another holder of the same value.</p>
 *
 * <pre>{@code
 * LogConfig config = LogConfig.create()
 *         .withConsoleJson()
 *         .withLevel(Level.DEBUG)
 *         .withToIgnore("health check")
 *         .withSimpleErrorCounter();
 * }</pre>
 */
@Getter
@Builder(toBuilder = true, access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class LogConfig {

    /**
     * Records are dropped when more than this many are buffered within one flush interval
     */
    public static final int DEFAULT_BUFFER_SIZE = 1000;

    public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofMillis(10);

    public static final String TIME_FORMAT_RFC3339 = "yyyy-MM-dd'T'HH:mm:ssXXX";
    public static final String TIME_FORMAT_RFC3339_NANO = "yyyy-MM-dd'T'HH:mm:ss.SSSSSSSSSXXX";
    public static final String TIME_FORMAT_UNIX = "UNIX";
    public static final String TIME_FORMAT_UNIX_MS = "UNIXMS";
    public static final String TIME_FORMAT_UNIX_MICRO = "UNIXMICRO";
    public static final String TIME_FORMAT_UNIX_NANO = "UNIXNANO";

    /**
     * Output sinks in insertion order. A single sink is used alone, several fan out to all.
     * Without sinks every record is discarded.
     */
    private final List<LogSink> sinks;

    /**
     * Minimum level name: trace, debug, info, warn, error, fatal, disabled.
     * An empty value means info.
     */
    private final String level;

    /**
     * Pattern for the time field ({@link java.time.format.DateTimeFormatter} syntax)
     * or one of the UNIX* constants.
     */
    @With
    private final String timeFieldFormat;

    /**
     * Hook invoked for every emitted record
     */
    @With
    private final LogHook hook;

    /**
     * Messages containing any of these substrings are dropped
     */
    private final List<String> toIgnore;

    /**
     * Counter of logged errors, shared by reference
     */
    @With
    private final ErrorCounter errorCounter;

    /**
     * Attach stack traces to logged errors
     */
    @With
    private final boolean stackTrace;

    /**
     * Capacity of the asynchronous buffer
     */
    @With
    private final int bufferSize;

    /**
     * Interval at which the buffer writer polls for records
     */
    @With
    private final Duration flushInterval;

    /**
     * Writer blocks on the buffer instead of polling every flush interval
     */
    @With
    private final boolean bufferWaiter;

    /**
     * Receives the number of records dropped on buffer overflow.
     * Defaults to a warning through SLF4J.
     */
    @With
    private final IntConsumer overflowHandler;

    /**
     * Write synchronously on the caller's thread
     */
    @With
    private final boolean noBuffer;

    /**
     * Called with status 1 after a fatal record. Defaults to {@link System#exit(int)}.
     */
    @With
    private final IntConsumer exitHandler;

    /** 지정한 sink 목록으로 기본 설정 생성 */
    public static LogConfig create(LogSink... sinks) {
        return LogConfig.builder()
                .sinks(List.copyOf(Arrays.asList(sinks)))
                .level(Level.INFO.getLabel())
                .timeFieldFormat(TIME_FORMAT_RFC3339)
                .toIgnore(List.of())
                .bufferSize(DEFAULT_BUFFER_SIZE)
                .flushInterval(DEFAULT_FLUSH_INTERVAL)
                .build();
    }

    /** OutputStream 목록으로 기본 설정 생성. 스트림은 닫지 않는다. */
    public static LogConfig of(OutputStream... outputs) {
        LogConfig config = create();
        for (OutputStream output : outputs) {
            config = config.withOutput(output);
        }
        return config;
    }

    public LogConfig withSink(LogSink sink) {
        Objects.requireNonNull(sink, "sink");
        List<LogSink> appended = new ArrayList<>(sinks);
        appended.add(sink);
        return toBuilder().sinks(List.copyOf(appended)).build();
    }

    public LogConfig withOutput(OutputStream output) {
        return withSink(new OutputStreamSink(output));
    }

    /** stderr로 JSON 출력 */
    public LogConfig withConsoleJson() {
        return withSink(OutputStreamSink.stderr());
    }

    public LogConfig withLevel(String level) {
        return toBuilder().level(level == null ? "" : level).build();
    }

    public LogConfig withLevel(Level level) {
        return withLevel(level.getLabel());
    }

    public LogConfig withToIgnore(String... toIgnore) {
        return toBuilder().toIgnore(List.copyOf(Arrays.asList(toIgnore))).build();
    }

    public LogConfig withToIgnore(List<String> toIgnore) {
        return toBuilder().toIgnore(List.copyOf(toIgnore)).build();
    }

    public LogConfig withSimpleErrorCounter() {
        return withErrorCounter(new SimpleErrorCounter());
    }

    public LogConfig withStackTrace() {
        return withStackTrace(true);
    }

    public LogConfig withNoBuffer() {
        return withNoBuffer(true);
    }

    public LogConfig withBufferWaiter() {
        return withBufferWaiter(true);
    }
}
