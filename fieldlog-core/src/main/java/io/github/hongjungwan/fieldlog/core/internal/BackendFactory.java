package io.github.hongjungwan.fieldlog.core.internal;

import io.github.hongjungwan.fieldlog.api.Level;
import io.github.hongjungwan.fieldlog.api.config.LogConfig;
import io.github.hongjungwan.fieldlog.core.backend.JsonLogBackend;
import io.github.hongjungwan.fieldlog.core.sink.AsyncSink;
import io.github.hongjungwan.fieldlog.core.sink.DiscardSink;
import io.github.hongjungwan.fieldlog.core.sink.MultiSink;
import io.github.hongjungwan.fieldlog.spi.LogBackend;
import io.github.hongjungwan.fieldlog.spi.LogSink;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * LogConfig로부터 백엔드 구성 (sink 조합 + 비동기 버퍼 + 레벨).
 */
@Slf4j
public final class BackendFactory {

    private BackendFactory() {}

    /** 레벨 파싱 실패 시 InvalidLevelException */
    public static LogBackend create(LogConfig config, Object... fields) {
        Level level = resolveLevel(config.getLevel());
        String timeFormat = isBlank(config.getTimeFieldFormat())
                ? LogConfig.TIME_FORMAT_RFC3339
                : config.getTimeFieldFormat();

        JsonLogBackend backend = new JsonLogBackend(createSink(config, level), new LogSerializer(timeFormat), level);
        if (config.getHook() != null) {
            backend = backend.withHook(config.getHook());
        }
        if (fields != null && fields.length > 0) {
            backend = backend.withFields(Arrays.asList(fields));
        }
        return backend;
    }

    static Level resolveLevel(String level) {
        if (isBlank(level)) {
            return Level.INFO;
        }
        return Level.parse(level);
    }

    static LogSink createSink(LogConfig config, Level level) {
        List<LogSink> sinks = config.getSinks();
        if (sinks.isEmpty() || level == Level.DISABLED) {
            return DiscardSink.INSTANCE;
        }

        LogSink output = sinks.size() == 1 ? sinks.get(0) : new MultiSink(sinks);
        if (config.isNoBuffer()) {
            return output;
        }

        int size = config.getBufferSize() > 0 ? config.getBufferSize() : LogConfig.DEFAULT_BUFFER_SIZE;
        Duration interval = config.getFlushInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            interval = LogConfig.DEFAULT_FLUSH_INTERVAL;
        }
        IntConsumer overflow = config.getOverflowHandler() != null
                ? config.getOverflowHandler()
                : BackendFactory::reportDropped;

        return new AsyncSink(output, size, interval, config.isBufferWaiter(), overflow).start();
    }

    private static void reportDropped(int missed) {
        log.warn("Logger dropped {} messages", missed);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
