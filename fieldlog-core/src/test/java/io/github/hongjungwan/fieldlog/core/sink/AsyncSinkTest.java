package io.github.hongjungwan.fieldlog.core.sink;

import io.github.hongjungwan.fieldlog.spi.LogSink;
import io.github.hongjungwan.fieldlog.support.JsonLinesSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AsyncSink 테스트")
class AsyncSinkTest {

    private AsyncSink sink;

    @AfterEach
    void tearDown() throws IOException {
        if (sink != null) {
            sink.close();
        }
    }

    private static byte[] line(int i) {
        return ("{\"n\":" + i + "}\n").getBytes(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("기록")
    class WriteTests {

        @Test
        @DisplayName("flush 후에는 수락된 레코드가 모두 순서대로 기록되어야 한다")
        void shouldWriteAllRecordsInOrderAfterFlush() throws IOException {
            // given
            JsonLinesSink target = new JsonLinesSink();
            sink = new AsyncSink(target, 100, Duration.ofMillis(1), false, count -> { }).start();

            // when
            for (int i = 0; i < 50; i++) {
                sink.write(line(i));
            }
            sink.flush();

            // then
            assertThat(target.size()).isEqualTo(50);
            assertThat(target.records().get(49)).containsEntry("n", 49);
            assertThat(target.flushes()).isEqualTo(1);
        }

        @Test
        @DisplayName("waiter 모드에서도 기록되어야 한다")
        void shouldWriteInWaiterMode() throws IOException {
            JsonLinesSink target = new JsonLinesSink();
            sink = new AsyncSink(target, 10, Duration.ofMillis(10), true, count -> { }).start();

            sink.write(line(1));
            sink.flush();

            assertThat(target.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("close는 남은 레코드를 기록하고 대상 sink를 닫아야 한다")
        void shouldDrainAndCloseDelegate() throws IOException {
            JsonLinesSink target = new JsonLinesSink();
            sink = new AsyncSink(target, 100, Duration.ofMillis(1), false, count -> { }).start();
            for (int i = 0; i < 20; i++) {
                sink.write(line(i));
            }

            sink.close();

            assertThat(target.size()).isEqualTo(20);
            assertThat(target.isClosed()).isTrue();
            assertThat(sink.isRunning()).isFalse();
        }

        @Test
        @DisplayName("시작 전 기록은 버려져야 한다")
        void shouldDropBeforeStart() {
            sink = new AsyncSink(new JsonLinesSink(), 10, Duration.ofMillis(1), false, count -> { });

            sink.write(line(1));

            assertThat(sink.getDroppedEvents()).isEqualTo(1);
        }

        @Test
        @DisplayName("용량이 0 이하면 생성 시점에 실패해야 한다")
        void shouldRejectNonPositiveCapacity() {
            assertThatThrownBy(() -> new AsyncSink(new JsonLinesSink(), 0, Duration.ofMillis(1), false, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("overflow")
    class OverflowTests {

        @Test
        @DisplayName("버퍼가 가득 차면 버리고 버린 개수를 overflow handler로 알려야 한다")
        void shouldDropAndReportOverflow() throws Exception {
            // given
            CountDownLatch release = new CountDownLatch(1);
            CountDownLatch firstWrite = new CountDownLatch(1);
            LogSink blocking = record -> {
                firstWrite.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            };
            AtomicInteger reported = new AtomicInteger();
            sink = new AsyncSink(blocking, 2, Duration.ofMillis(1), false, reported::addAndGet).start();

            // when
            sink.write(line(0));
            assertThat(firstWrite.await(5, TimeUnit.SECONDS)).isTrue();
            for (int i = 1; i <= 5; i++) {
                sink.write(line(i));
            }
            release.countDown();
            sink.flush();
            sink.close();

            // then
            assertThat(sink.getDroppedEvents()).isEqualTo(3);
            assertThat(reported.get()).isEqualTo(3);
        }
    }
}
