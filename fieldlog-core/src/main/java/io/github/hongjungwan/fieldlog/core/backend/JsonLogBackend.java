package io.github.hongjungwan.fieldlog.core.backend;

import io.github.hongjungwan.fieldlog.api.Level;
import io.github.hongjungwan.fieldlog.api.domain.LogRecord;
import io.github.hongjungwan.fieldlog.core.internal.LogSerializer;
import io.github.hongjungwan.fieldlog.spi.LogBackend;
import io.github.hongjungwan.fieldlog.spi.LogHook;
import io.github.hongjungwan.fieldlog.spi.LogSink;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON 레코드 백엔드. 레벨 필터 + 바인딩 필드 + hook 적용 후 sink로 전달.
 *
 * 출력 실패는 호출자에게 전파하지 않는다.
 */
@Slf4j
public final class JsonLogBackend implements LogBackend {

    private final LogSink sink;
    private final LogSerializer serializer;
    private final Level level;
    private final List<Object> contextFields;
    private final List<LogHook> hooks;
    private final Clock clock;

    public JsonLogBackend(LogSink sink, LogSerializer serializer, Level level) {
        this(sink, serializer, level, List.of(), List.of(), Clock.systemDefaultZone());
    }

    private JsonLogBackend(LogSink sink, LogSerializer serializer, Level level,
                           List<Object> contextFields, List<LogHook> hooks, Clock clock) {
        this.sink = sink;
        this.serializer = serializer;
        this.level = level;
        this.contextFields = contextFields;
        this.hooks = hooks;
        this.clock = clock;
    }

    @Override
    public Level getLevel() {
        return level;
    }

    @Override
    public boolean isEnabled(Level recordLevel) {
        return level.permits(recordLevel);
    }

    @Override
    public JsonLogBackend withLevel(Level newLevel) {
        return new JsonLogBackend(sink, serializer, newLevel, contextFields, hooks, clock);
    }

    @Override
    public JsonLogBackend withFields(List<Object> fields) {
        if (fields == null || fields.isEmpty()) {
            return this;
        }
        List<Object> merged = new ArrayList<>(contextFields);
        merged.addAll(fields);
        // 홀수 길이 필드는 null 값과 짝지어 다음 바인딩과 어긋나지 않게 한다
        if (fields.size() % 2 == 1) {
            merged.add(null);
        }
        return new JsonLogBackend(sink, serializer, level, Collections.unmodifiableList(merged), hooks, clock);
    }

    public JsonLogBackend withHook(LogHook hook) {
        List<LogHook> merged = new ArrayList<>(hooks);
        merged.add(hook);
        return new JsonLogBackend(sink, serializer, level, contextFields, List.copyOf(merged), clock);
    }

    public JsonLogBackend withClock(Clock newClock) {
        return new JsonLogBackend(sink, serializer, level, contextFields, hooks, newClock);
    }

    public LogSink getSink() {
        return sink;
    }

    @Override
    public void emit(LogRecord record) {
        if (!isEnabled(record.getLevel())) {
            return;
        }

        Map<String, Object> hookFields = Map.of();
        if (!hooks.isEmpty()) {
            hookFields = new LinkedHashMap<>();
            for (LogHook hook : hooks) {
                hook.run(record.getLevel(), record.getMessage(), hookFields);
            }
        }

        byte[] data;
        try {
            data = serializer.serialize(record, clock.instant(), contextFields, hookFields);
        } catch (LogSerializer.SerializationException e) {
            log.warn("Dropping log record that could not be serialized: {}", e.getMessage());
            return;
        }

        try {
            sink.write(data);
        } catch (IOException e) {
            log.warn("Failed to write log record", e);
        }
    }

    @Override
    public void flush() {
        try {
            sink.flush();
        } catch (IOException e) {
            log.warn("Failed to flush log sink", e);
        }
    }

    @Override
    public void close() {
        try {
            sink.close();
        } catch (IOException e) {
            log.warn("Failed to close log sink", e);
        }
    }
}
