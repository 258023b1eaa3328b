package io.github.hongjungwan.fieldlog.core.backend;

import io.github.hongjungwan.fieldlog.api.Level;
import io.github.hongjungwan.fieldlog.api.domain.LogRecord;
import io.github.hongjungwan.fieldlog.core.internal.LogSerializer;
import io.github.hongjungwan.fieldlog.spi.LogSink;
import io.github.hongjungwan.fieldlog.support.JsonLinesSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("JsonLogBackend 테스트")
class JsonLogBackendTest {

    private JsonLinesSink sink;
    private JsonLogBackend backend;

    @BeforeEach
    void setUp() {
        sink = new JsonLinesSink();
        backend = new JsonLogBackend(sink, new LogSerializer(), Level.INFO);
    }

    private static LogRecord record(Level level, String message) {
        return LogRecord.builder().level(level).message(message).build();
    }

    @Test
    @DisplayName("최소 레벨 미만 레코드는 기록하지 않아야 한다")
    void shouldFilterByLevel() {
        backend.emit(record(Level.DEBUG, "hidden"));
        backend.emit(record(Level.WARN, "shown"));

        assertThat(sink.records()).extracting(json -> json.get("message")).containsExactly("shown");
    }

    @Test
    @DisplayName("withLevel은 원본에 영향을 주지 않아야 한다")
    void shouldDeriveLevelWithoutChangingOriginal() {
        JsonLogBackend debug = backend.withLevel(Level.DEBUG);

        assertThat(debug.isEnabled(Level.DEBUG)).isTrue();
        assertThat(backend.isEnabled(Level.DEBUG)).isFalse();
        assertThat(debug.getSink()).isSameAs(backend.getSink());
    }

    @Test
    @DisplayName("바인딩 필드는 누적되고 홀수 길이는 null로 채워야 한다")
    void shouldAccumulateBoundFields() {
        // given
        JsonLogBackend child = backend.withFields(List.of("service", "orders"))
                .withFields(List.of("dangling"))
                .withFields(List.of("region", "KR"));

        // when
        child.emit(record(Level.INFO, "m"));

        // then
        Map<String, Object> json = sink.last();
        assertThat(json).containsEntry("service", "orders")
                .containsEntry("dangling", null)
                .containsEntry("region", "KR");
    }

    @Test
    @DisplayName("hook은 레벨과 메시지를 받아 필드를 추가할 수 있어야 한다")
    void shouldRunHooks() {
        JsonLogBackend hooked = backend.withHook((level, message, fields) -> {
            fields.put("hook_level", level.getLabel());
            fields.put("length", message.length());
        });

        hooked.emit(record(Level.WARN, "four"));

        assertThat(sink.last()).containsEntry("hook_level", "warn").containsEntry("length", 4);
    }

    @Test
    @DisplayName("주입한 Clock으로 시간을 기록해야 한다")
    void shouldUseClock() {
        Clock fixed = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
        JsonLogBackend timed = new JsonLogBackend(sink, new LogSerializer("UNIX"), Level.INFO).withClock(fixed);

        timed.emit(record(Level.INFO, "m"));

        assertThat(sink.last()).containsEntry("time", 1704067200);
    }

    @Test
    @DisplayName("sink 쓰기 실패는 호출자에게 전파되지 않아야 한다")
    void shouldSwallowWriteFailures() {
        LogSink failing = bytes -> {
            throw new IOException("broken pipe");
        };
        JsonLogBackend broken = new JsonLogBackend(failing, new LogSerializer(), Level.INFO);

        assertThatCode(() -> broken.emit(record(Level.ERROR, "m"))).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("disabled 레벨은 아무것도 기록하지 않아야 한다")
    void shouldWriteNothingWhenDisabled() {
        JsonLogBackend disabled = backend.withLevel(Level.DISABLED);

        disabled.emit(record(Level.FATAL, "m"));
        disabled.emit(record(null, "m"));

        assertThat(sink.size()).isZero();
    }
}
