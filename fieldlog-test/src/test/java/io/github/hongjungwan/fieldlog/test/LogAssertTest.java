package io.github.hongjungwan.fieldlog.test;

import io.github.hongjungwan.fieldlog.api.FieldLogger;
import io.github.hongjungwan.fieldlog.api.config.LogConfig;
import io.github.hongjungwan.fieldlog.core.internal.DefaultFieldLogger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static io.github.hongjungwan.fieldlog.test.LogAssert.assertThatLog;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LogAssert / CapturingSink 테스트")
class LogAssertTest {

    private CapturingSink sink;

    @BeforeEach
    void setUp() {
        sink = new CapturingSink();
    }

    private void capture(String json) {
        sink.write((json + "\n").getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("CapturingSink")
    class SinkTests {

        @Test
        @DisplayName("한 번의 write에 여러 줄이 오면 각각 레코드로 보관해야 한다")
        void shouldSplitLines() {
            // when
            sink.write("{\"message\":\"a\"}\n{\"message\":\"b\"}\n".getBytes(StandardCharsets.UTF_8));

            // then
            assertThat(sink.size()).isEqualTo(2);
            assertThat(sink.getRecords()).extracting(CapturedRecord::getMessage).containsExactly("a", "b");
        }

        @Test
        @DisplayName("레벨로 레코드를 필터링할 수 있어야 한다")
        void shouldFilterByLevel() {
            // given
            capture("{\"level\":\"info\",\"message\":\"one\"}");
            capture("{\"level\":\"error\",\"message\":\"two\"}");
            capture("{\"message\":\"three\"}");

            // then
            assertThat(sink.getRecords("error")).extracting(CapturedRecord::getMessage).containsExactly("two");
            assertThat(sink.getRecords(null)).extracting(CapturedRecord::getMessage).containsExactly("three");
        }

        @Test
        @DisplayName("기록이 없을 때 last()는 실패해야 한다")
        void shouldFailLastWhenEmpty() {
            assertThatThrownBy(() -> sink.last())
                    .isInstanceOf(AssertionError.class)
                    .hasMessageContaining("No log record");
        }

        @Test
        @DisplayName("clear 후에는 비어 있어야 한다")
        void shouldClear() {
            capture("{\"message\":\"x\"}");

            sink.clear();

            assertThat(sink.isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("LogAssert")
    class AssertTests {

        @Test
        @DisplayName("레벨, 메시지, 필드를 체이닝으로 검증할 수 있어야 한다")
        void shouldChainAssertions() {
            // given
            capture("{\"level\":\"warn\",\"time\":1,\"user\":\"kim\",\"count\":3,\"message\":\"disk almost full\"}");

            // then
            assertThatLog(sink.last())
                    .hasLevel("warn")
                    .hasMessage("disk almost full")
                    .messageContains("almost")
                    .hasField("time")
                    .hasFieldValue("user", "kim")
                    .hasFieldValue("count", 3L)
                    .doesNotHaveField("error");
        }

        @Test
        @DisplayName("레벨 없는 레코드를 검증할 수 있어야 한다")
        void shouldVerifyMissingLevel() {
            capture("{\"time\":1,\"message\":\"plain\"}");

            assertThatLog(sink.last()).hasNoLevel().hasMessage("plain");
        }

        @Test
        @DisplayName("필드 값이 다르면 실패해야 한다")
        void shouldFailOnDifferentValue() {
            capture("{\"level\":\"info\",\"k\":\"v\",\"message\":\"m\"}");

            assertThatThrownBy(() -> assertThatLog(sink.last()).hasFieldValue("k", "other"))
                    .isInstanceOf(AssertionError.class)
                    .hasMessageContaining("Expected field <k> to be <other> but was <v>");
        }

        @Test
        @DisplayName("없는 필드를 기대하면 실패해야 한다")
        void shouldFailOnMissingField() {
            capture("{\"level\":\"info\",\"message\":\"m\"}");

            assertThatThrownBy(() -> assertThatLog(sink.last()).hasField("missing"))
                    .isInstanceOf(AssertionError.class)
                    .hasMessageContaining("missing");
        }

        @Test
        @DisplayName("stack 배열과 error 필드를 검증할 수 있어야 한다")
        void shouldVerifyStackAndError() {
            capture("{\"level\":\"error\",\"stack\":[{\"func\":\"a.B.c\",\"source\":\"B.java\",\"line\":3}],"
                    + "\"error\":\"boom\",\"message\":\"failed\"}");

            assertThatLog(sink.last()).hasStack().hasError("boom");
        }
    }

    @Nested
    @DisplayName("로거 연동")
    class LoggerIntegrationTests {

        @Test
        @DisplayName("로거가 기록한 레코드를 그대로 검증할 수 있어야 한다")
        void shouldCaptureLoggerOutput() {
            // given
            FieldLogger logger = DefaultFieldLogger.create(LogConfig.create(sink).withNoBuffer().withLevel("trace"));

            // when
            logger.trace("tracing", "step", 1);

            // then
            assertThatLog(sink.last())
                    .hasLevel("trace")
                    .hasMessage("tracing")
                    .hasFieldValue("step", 1)
                    .hasCaller(LoggerIntegrationTests.class);
        }
    }
}
