package io.github.hongjungwan.fieldlog.starter;

import io.github.hongjungwan.fieldlog.api.ErrorCounter;
import io.github.hongjungwan.fieldlog.api.FieldLog;
import io.github.hongjungwan.fieldlog.api.FieldLogger;
import io.github.hongjungwan.fieldlog.api.Level;
import io.github.hongjungwan.fieldlog.api.SimpleErrorCounter;
import io.github.hongjungwan.fieldlog.api.config.LogConfig;
import io.github.hongjungwan.fieldlog.core.bridge.JulBridge;
import io.github.hongjungwan.fieldlog.spi.LogHook;
import io.github.hongjungwan.fieldlog.test.CapturingSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static io.github.hongjungwan.fieldlog.test.LogAssert.assertThatLog;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@DisplayName("FieldLogAutoConfiguration 테스트")
class FieldLogAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(FieldLogAutoConfiguration.class))
            .withUserConfiguration(CapturingSinkConfiguration.class)
            .withPropertyValues("fieldlog.console=false", "fieldlog.buffer.enabled=false");

    @AfterEach
    void tearDown() {
        FieldLog.shutdown();
    }

    @Configuration(proxyBeanMethods = false)
    static class CapturingSinkConfiguration {

        @Bean
        CapturingSink capturingSink() {
            return new CapturingSink();
        }
    }

    @Nested
    @DisplayName("빈 등록")
    class BeanTests {

        @Test
        @DisplayName("기본 설정으로 전역 로거를 설치해야 한다")
        void shouldInstallGlobalLogger() {
            contextRunner.run(context -> {
                assertThat(context).hasSingleBean(FieldLogger.class)
                        .hasSingleBean(LogConfig.class)
                        .doesNotHaveBean(ErrorCounter.class);
                assertThat(context.getBean(FieldLogger.class)).isSameAs(FieldLog.shared());
                assertThat(FieldLog.isInitialized()).isTrue();
                assertThat(FieldLog.getLevel()).isEqualTo(Level.INFO);
                assertThat(JulBridge.isInstalled()).isTrue();
            });
        }

        @Test
        @DisplayName("컨텍스트 종료 시 전역 로거를 내려야 한다")
        void shouldShutdownOnClose() {
            contextRunner.run(context -> assertThat(FieldLog.isInitialized()).isTrue());

            assertThat(FieldLog.isInitialized()).isFalse();
            assertThat(JulBridge.isInstalled()).isFalse();
        }

        @Test
        @DisplayName("enabled=false면 아무것도 등록하지 않아야 한다")
        void shouldBackOffWhenDisabled() {
            contextRunner.withPropertyValues("fieldlog.enabled=false")
                    .run(context -> {
                        assertThat(context).doesNotHaveBean(FieldLogger.class);
                        assertThat(FieldLog.isInitialized()).isFalse();
                    });
        }

        @Test
        @DisplayName("error-counter=true면 카운터를 등록하고 설정에 연결해야 한다")
        void shouldRegisterErrorCounter() {
            contextRunner.withPropertyValues("fieldlog.error-counter=true")
                    .run(context -> {
                        ErrorCounter counter = context.getBean(ErrorCounter.class);
                        assertThat(counter).isInstanceOf(SimpleErrorCounter.class);
                        assertThat(context.getBean(LogConfig.class).getErrorCounter()).isSameAs(counter);

                        context.getBean(FieldLogger.class).error("failed", new IllegalStateException("x"));

                        assertThat(((SimpleErrorCounter) counter).getCount()).isEqualTo(1);
                    });
        }

        @Test
        @DisplayName("legacy-bridge=false면 JUL 연결을 해제해야 한다")
        void shouldSkipLegacyBridge() {
            contextRunner.withPropertyValues("fieldlog.legacy-bridge=false")
                    .run(context -> assertThat(JulBridge.isInstalled()).isFalse());
        }

        @Test
        @DisplayName("사용자 LogConfig 빈이 있으면 그것을 사용해야 한다")
        void shouldUseUserConfig() {
            LogConfig custom = LogConfig.create().withLevel("error");

            contextRunner.withBean(LogConfig.class, () -> custom)
                    .run(context -> {
                        assertThat(context.getBean(LogConfig.class)).isSameAs(custom);
                        assertThat(FieldLog.getLevel()).isEqualTo(Level.ERROR);
                    });
        }
    }

    @Nested
    @DisplayName("프로퍼티 바인딩")
    class PropertyTests {

        @Test
        @DisplayName("레벨, 필드, 무시 목록을 설정에 반영해야 한다")
        void shouldApplyProperties() {
            contextRunner.withPropertyValues(
                            "fieldlog.level=debug",
                            "fieldlog.fields.service=orders",
                            "fieldlog.fields.region=KR",
                            "fieldlog.ignore=health check")
                    .run(context -> {
                        // given
                        FieldLogger logger = context.getBean(FieldLogger.class);
                        CapturingSink sink = context.getBean(CapturingSink.class);

                        // when
                        logger.debug("health check ok");
                        logger.debug("loaded", "items", 3);

                        // then
                        assertThat(sink.size()).isEqualTo(1);
                        assertThatLog(sink.last())
                                .hasLevel("debug")
                                .hasMessage("loaded")
                                .hasFieldValue("service", "orders")
                                .hasFieldValue("region", "KR")
                                .hasFieldValue("items", 3);
                    });
        }

        @Test
        @DisplayName("버퍼 설정을 바인딩해야 한다")
        void shouldBindBufferProperties() {
            contextRunner.withPropertyValues(
                            "fieldlog.buffer.enabled=true",
                            "fieldlog.buffer.size=64",
                            "fieldlog.buffer.flush-interval=50ms",
                            "fieldlog.buffer.waiter=true",
                            "fieldlog.time-field-format=UNIXMS")
                    .run(context -> {
                        LogConfig config = context.getBean(LogConfig.class);
                        assertThat(config.isNoBuffer()).isFalse();
                        assertThat(config.getBufferSize()).isEqualTo(64);
                        assertThat(config.getFlushInterval()).isEqualTo(Duration.ofMillis(50));
                        assertThat(config.isBufferWaiter()).isTrue();
                        assertThat(config.getTimeFieldFormat()).isEqualTo("UNIXMS");
                    });
        }

        @Test
        @DisplayName("file 설정 시 파일로도 기록해야 한다")
        void shouldWriteToFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("app/fieldlog.json");

            contextRunner.withPropertyValues("fieldlog.file=" + file)
                    .run(context -> context.getBean(FieldLogger.class).warn("to file"));

            assertThat(file).exists();
            assertThat(Files.readString(file)).contains("\"message\":\"to file\"");
        }

        @Test
        @DisplayName("LogHook 빈을 모든 레코드에 적용해야 한다")
        void shouldApplyHookBean() {
            LogHook hook = mock(LogHook.class);

            contextRunner.withBean(LogHook.class, () -> hook)
                    .run(context -> context.getBean(FieldLogger.class).info("hooked"));

            verify(hook).run(eq(Level.INFO), eq("hooked"), any());
        }
    }

    @Test
    @DisplayName("필드 Map을 key/value 배열로 펼쳐야 한다")
    void shouldFlattenFields() {
        Object[] fields = FieldLogAutoConfiguration.toFieldArray(new LinkedHashMap<>(Map.of("a", "1")));

        assertThat(fields).containsExactly("a", "1");
    }
}
