package io.github.hongjungwan.fieldlog.core.internal;

import io.github.hongjungwan.fieldlog.api.ErrorCounter;
import io.github.hongjungwan.fieldlog.api.FatalLogException;
import io.github.hongjungwan.fieldlog.api.FieldLogger;
import io.github.hongjungwan.fieldlog.api.Level;
import io.github.hongjungwan.fieldlog.api.LoggerPanicException;
import io.github.hongjungwan.fieldlog.api.SimpleErrorCounter;
import io.github.hongjungwan.fieldlog.api.StackFieldsProvider;
import io.github.hongjungwan.fieldlog.api.config.LogConfig;
import io.github.hongjungwan.fieldlog.api.domain.LogRecord;
import io.github.hongjungwan.fieldlog.core.backend.JsonLogBackend;
import io.github.hongjungwan.fieldlog.core.classify.ArgumentClassifier;
import io.github.hongjungwan.fieldlog.core.classify.Classification;
import io.github.hongjungwan.fieldlog.core.classify.ExtractedError;
import io.github.hongjungwan.fieldlog.core.sink.DiscardSink;
import io.github.hongjungwan.fieldlog.spi.LogBackend;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.List;
import java.util.function.IntConsumer;
import java.util.stream.Collectors;

/**
 * 기본 FieldLogger 구현. 인자 분류 → ignore 검사 → 에러 카운트 → 백엔드 전달.
 *
 * <p>All configuration lives in one immutable {@link State}; logging calls read it once,
 * so concurrent calls are safe. {@link #update(LogConfig, Object...)} swaps the state in a
 * single reference assignment and is not safe while other threads log through this
 * instance.</p>
 *
 * <p>Formatted calls look for an error only among the arguments left over as fields.
 * A {@link Throwable} consumed by a placeholder, as in {@code errorf("failed: %s", e)},
 * is rendered into the message and neither attached nor counted.</p>
 */
public class DefaultFieldLogger implements FieldLogger {

    private static final int FATAL_EXIT_STATUS = 1;
    private static final IntConsumer SYSTEM_EXIT = System::exit;

    private State state;

    private DefaultFieldLogger(State state) {
        this.state = state;
    }

    /** 설정 + 모든 레코드에 붙는 필드로 로거 생성 */
    public static DefaultFieldLogger create(LogConfig config, Object... fields) {
        return new DefaultFieldLogger(State.from(config, fields));
    }

    /** stderr JSON 로거 */
    public static DefaultFieldLogger consoleJson(Object... fields) {
        return create(LogConfig.create().withConsoleJson(), fields);
    }

    /** 직접 구성한 백엔드로 로거 생성 */
    public static DefaultFieldLogger of(LogBackend backend) {
        return new DefaultFieldLogger(new State(backend, null, List.of(), false, true, SYSTEM_EXIT));
    }

    /** 아무것도 기록하지 않는 미초기화 로거 */
    public static DefaultFieldLogger nop() {
        LogBackend backend = new JsonLogBackend(DiscardSink.INSTANCE, new LogSerializer(), Level.DISABLED);
        return new DefaultFieldLogger(new State(backend, null, List.of(), false, false, SYSTEM_EXIT));
    }

    /**
     * Replaces the backend, counter, ignore-list, stack-trace flag and initialized flag with
     * ones built from the given configuration. Not safe for concurrent use.
     *
     * <p>The previous backend is flushed and closed after the swap. Loggers derived from
     * this one before the update share that backend and stop writing.</p>
     */
    public void update(LogConfig config, Object... fields) {
        State previous = this.state;
        this.state = State.from(config, fields);
        previous.backend().close();
    }

    /** 소유한 백엔드 flush 후 종료 */
    public void close() {
        state.backend().close();
    }

    @Override
    public void trace(String message, Object... fields) {
        logFields(Level.TRACE, message, fields);
    }

    @Override
    public void tracef(String format, Object... args) {
        logFormatted(Level.TRACE, format, args);
    }

    @Override
    public void debug(String message, Object... fields) {
        logFields(Level.DEBUG, message, fields);
    }

    @Override
    public void debugf(String format, Object... args) {
        logFormatted(Level.DEBUG, format, args);
    }

    @Override
    public void info(String message, Object... fields) {
        logFields(Level.INFO, message, fields);
    }

    @Override
    public void infof(String format, Object... args) {
        logFormatted(Level.INFO, format, args);
    }

    @Override
    public void warn(String message, Object... fields) {
        logFields(Level.WARN, message, fields);
    }

    @Override
    public void warnf(String format, Object... args) {
        logFormatted(Level.WARN, format, args);
    }

    @Override
    public void error(String message, Object... fields) {
        logFields(Level.ERROR, message, fields);
    }

    @Override
    public void errorf(String format, Object... args) {
        logFormatted(Level.ERROR, format, args);
    }

    @Override
    public void log(Level level, String message, Object... fields) {
        logFields(level, message, fields);
    }

    @Override
    public void logf(Level level, String format, Object... args) {
        logFormatted(level, format, args);
    }

    @Override
    public void err(Throwable error, String message, Object... fields) {
        State current = state;
        if (current.isIgnored(message)) {
            return;
        }
        current.countError(error);
        emit(current, Level.ERROR, message, asFieldList(fields), error, true);
    }

    @Override
    public void errf(Throwable error, String format, Object... args) {
        State current = state;
        Classification classification = ArgumentClassifier.classify(format, args);
        String message = classification.render(format);
        if (current.isIgnored(message)) {
            return;
        }
        current.countError(error);
        emit(current, Level.ERROR, message, classification.fields(), error, true);
    }

    @Override
    public void errStack(Throwable error, Object... fields) {
        State current = state;
        String message = printStackTrace(error);
        if (current.isIgnored(message)) {
            return;
        }
        current.countError(error);
        emit(current, Level.ERROR, message, asFieldList(fields), null, false);
    }

    @Override
    public void fatal(Object... values) {
        logFatal(joinValues(values), List.of());
    }

    @Override
    public void fatalf(String format, Object... args) {
        Classification classification = ArgumentClassifier.classify(format, args);
        logFatal(classification.render(format), classification.fields());
    }

    @Override
    public void panic(Object... values) {
        raisePanic(joinValues(values), List.of());
    }

    @Override
    public void panicf(String format, Object... args) {
        Classification classification = ArgumentClassifier.classify(format, args);
        raisePanic(classification.render(format), classification.fields());
    }

    @Override
    public void print(Object... values) {
        if (values == null || values.length == 0) {
            return;
        }
        logFields(null, joinValues(values), null);
    }

    @Override
    public void printf(String format, Object... args) {
        logFormatted(null, format, args);
    }

    @Override
    public void printStack(Object... fields) {
        logFields(null, currentThreadStack(), fields);
    }

    @Override
    public DefaultFieldLogger withFields(Object... fields) {
        if (fields == null || fields.length == 0) {
            return this;
        }
        State current = state;
        return new DefaultFieldLogger(current.withBackend(current.backend().withFields(Arrays.asList(fields))));
    }

    @Override
    public DefaultFieldLogger with(Object... fields) {
        return withFields(fields);
    }

    @Override
    public DefaultFieldLogger withLevel(String level) {
        if (level == null || level.isEmpty()) {
            return this;
        }
        State current = state;
        return new DefaultFieldLogger(current.withBackend(current.backend().withLevel(Level.parse(level))));
    }

    @Override
    public DefaultFieldLogger withStack(boolean stackTrace) {
        State current = state;
        return new DefaultFieldLogger(new State(current.backend(), current.errorCounter(), current.toIgnore(),
                stackTrace, current.initialized(), current.exitHandler()));
    }

    @Override
    public DefaultFieldLogger withErrorCounter(ErrorCounter errorCounter) {
        State current = state;
        return new DefaultFieldLogger(new State(current.backend(), errorCounter, current.toIgnore(),
                current.stackTrace(), current.initialized(), current.exitHandler()));
    }

    @Override
    public DefaultFieldLogger withSimpleErrorCounter() {
        return withErrorCounter(new SimpleErrorCounter());
    }

    @Override
    public DefaultFieldLogger withToIgnore(String... toIgnore) {
        State current = state;
        return new DefaultFieldLogger(new State(current.backend(), current.errorCounter(),
                List.copyOf(Arrays.asList(toIgnore)), current.stackTrace(), current.initialized(),
                current.exitHandler()));
    }

    @Override
    public Level getLevel() {
        return state.backend().getLevel();
    }

    @Override
    public ErrorCounter getErrorCounter() {
        return state.errorCounter();
    }

    @Override
    public boolean isInitialized() {
        return state.initialized();
    }

    @Override
    public LogBackend backend() {
        return state.backend();
    }

    private void logFields(Level level, String message, Object[] fields) {
        State current = state;
        if (current.isIgnored(message)) {
            return;
        }
        ExtractedError extracted = ArgumentClassifier.extractError(fields);
        current.countError(extracted.error());
        emit(current, level, message, extracted.fields(), extracted.error(), extracted.found());
    }

    private void logFormatted(Level level, String format, Object[] args) {
        State current = state;
        Classification classification = ArgumentClassifier.classify(format, args);
        String message = classification.render(format);
        if (current.isIgnored(message)) {
            return;
        }
        ExtractedError extracted = ArgumentClassifier.extractError(classification.fields());
        current.countError(extracted.error());
        emit(current, level, message, extracted.fields(), extracted.error(), extracted.found());
    }

    private void logFatal(String message, List<Object> fields) {
        State current = state;
        if (!current.isIgnored(message)) {
            current.countError(new FatalLogException(message));
            ExtractedError extracted = ArgumentClassifier.extractError(fields);
            emit(current, Level.FATAL, message, extracted.fields(), extracted.error(), extracted.found());
        }
        current.backend().flush();
        current.exitHandler().accept(FATAL_EXIT_STATUS);
    }

    private void raisePanic(String message, List<Object> fields) {
        State current = state;
        LoggerPanicException panic = new LoggerPanicException(message);
        if (!current.isIgnored(message)) {
            current.countError(panic);
            ExtractedError extracted = ArgumentClassifier.extractError(fields);
            emit(current, Level.FATAL, message, extracted.fields(), extracted.error(), extracted.found());
            current.backend().flush();
        }
        throw panic;
    }

    private void emit(State current, Level level, String message, List<Object> fields,
                      Throwable error, boolean attachError) {
        LogBackend backend = current.backend();
        if (!backend.isEnabled(level)) {
            return;
        }

        LogRecord.LogRecordBuilder record = LogRecord.builder()
                .level(level)
                .message(message)
                .fields(fields);

        if (attachError) {
            record.errorAttached(true).error(error);
            if (error != null && current.stackTrace()) {
                attachStack(record, error);
            }
        }
        if (level == Level.TRACE) {
            record.caller(CallerLocator.locate());
        }

        backend.emit(record.build());
    }

    /** 자체 스택 정보 우선, 없으면 에러의 스택, 그것도 비어 있으면 호출 위치에서 캡처 */
    private static void attachStack(LogRecord.LogRecordBuilder record, Throwable error) {
        if (error instanceof StackFieldsProvider) {
            record.stackFields(((StackFieldsProvider) error).stackFields());
            return;
        }
        StackTraceElement[] own = error.getStackTrace();
        record.stack(own.length > 0 ? List.of(own) : CallerLocator.captureStack());
    }

    private static List<Object> asFieldList(Object[] fields) {
        // 플레이스홀더가 없으므로 모든 인자가 필드
        return ArgumentClassifier.classify(null, fields).fields();
    }

    private static String joinValues(Object[] values) {
        if (values == null) {
            return "";
        }
        return Arrays.stream(values).map(String::valueOf).collect(Collectors.joining(" "));
    }

    private static String printStackTrace(Throwable error) {
        if (error == null) {
            return "null";
        }
        StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

    private static String currentThreadStack() {
        StringBuilder stack = new StringBuilder();
        for (StackTraceElement frame : CallerLocator.captureStack()) {
            stack.append("\tat ").append(frame).append(System.lineSeparator());
        }
        return stack.toString();
    }

    private record State(LogBackend backend, ErrorCounter errorCounter, List<String> toIgnore,
                         boolean stackTrace, boolean initialized, IntConsumer exitHandler) {

        static State from(LogConfig config, Object... fields) {
            LogBackend backend = BackendFactory.create(config, fields);
            IntConsumer exit = config.getExitHandler() != null ? config.getExitHandler() : SYSTEM_EXIT;
            return new State(backend, config.getErrorCounter(), List.copyOf(config.getToIgnore()),
                    config.isStackTrace(), true, exit);
        }

        State withBackend(LogBackend newBackend) {
            return new State(newBackend, errorCounter, toIgnore, stackTrace, initialized, exitHandler);
        }

        boolean isIgnored(String message) {
            if (message == null || toIgnore.isEmpty()) {
                return false;
            }
            for (String ignore : toIgnore) {
                if (message.contains(ignore)) {
                    return true;
                }
            }
            return false;
        }

        void countError(Throwable error) {
            if (error != null && errorCounter != null) {
                errorCounter.inc(error);
            }
        }
    }
}
