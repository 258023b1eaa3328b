package io.github.hongjungwan.fieldlog.starter;

import io.github.hongjungwan.fieldlog.api.ErrorCounter;
import io.github.hongjungwan.fieldlog.api.FieldLog;
import io.github.hongjungwan.fieldlog.api.FieldLogger;
import io.github.hongjungwan.fieldlog.api.SimpleErrorCounter;
import io.github.hongjungwan.fieldlog.api.config.LogConfig;
import io.github.hongjungwan.fieldlog.core.bridge.JulBridge;
import io.github.hongjungwan.fieldlog.core.sink.OutputStreamSink;
import io.github.hongjungwan.fieldlog.spi.LogHook;
import io.github.hongjungwan.fieldlog.spi.LogSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * fieldlog Spring Boot 자동 설정. 전역 로거 설치 및 컨텍스트 종료 시 정리.
 *
 * <p>Application-defined {@link LogSink} beans are added as outputs and a {@link LogHook}
 * bean is attached to every record.</p>
 */
@AutoConfiguration
@EnableConfigurationProperties(FieldLogProperties.class)
@ConditionalOnProperty(prefix = "fieldlog", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class FieldLogAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "fieldlog", name = "error-counter", havingValue = "true")
    public ErrorCounter errorCounter() {
        return new SimpleErrorCounter();
    }

    @Bean
    @ConditionalOnMissingBean
    public LogConfig fieldLogConfig(FieldLogProperties properties,
                                    ObjectProvider<ErrorCounter> errorCounter,
                                    ObjectProvider<LogSink> sinks,
                                    ObjectProvider<LogHook> hook) {
        LogConfig config = LogConfig.create()
                .withLevel(properties.getLevel())
                .withTimeFieldFormat(properties.getTimeFieldFormat())
                .withToIgnore(properties.getIgnore())
                .withStackTrace(properties.isStackTrace())
                .withNoBuffer(!properties.getBuffer().isEnabled())
                .withBufferSize(properties.getBuffer().getSize())
                .withFlushInterval(properties.getBuffer().getFlushInterval())
                .withBufferWaiter(properties.getBuffer().isWaiter())
                .withErrorCounter(errorCounter.getIfAvailable())
                .withHook(hook.getIfAvailable());

        if (properties.isConsole()) {
            config = config.withConsoleJson();
        }
        if (properties.getFile() != null && !properties.getFile().isBlank()) {
            config = config.withSink(openFile(properties.getFile()));
        }
        for (LogSink sink : sinks.orderedStream().toList()) {
            config = config.withSink(sink);
        }
        return config;
    }

    @Bean
    @ConditionalOnMissingBean
    public FieldLogger fieldLogger(LogConfig config, FieldLogProperties properties) {
        FieldLog.init(config, toFieldArray(properties.getFields()));
        if (!properties.isLegacyBridge()) {
            JulBridge.uninstall();
        }
        log.info("fieldlog installed: level={}, legacy bridge={}", FieldLog.getLevel(), properties.isLegacyBridge());
        return FieldLog.shared();
    }

    @Bean
    public FieldLogLifecycle fieldLogLifecycle(FieldLogger fieldLogger) {
        return new FieldLogLifecycle();
    }

    private static LogSink openFile(String file) {
        try {
            return OutputStreamSink.forFile(Path.of(file));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot open log file: " + file, e);
        }
    }

    static Object[] toFieldArray(Map<String, String> fields) {
        List<Object> pairs = new ArrayList<>(fields.size() * 2);
        fields.forEach((key, value) -> {
            pairs.add(key);
            pairs.add(value);
        });
        return pairs.toArray();
    }

    /**
     * 컨텍스트 종료 시 전역 로거를 내리고 버퍼를 flush 하는 SmartLifecycle 구현체.
     */
    static class FieldLogLifecycle implements SmartLifecycle {

        private volatile boolean running = false;

        @Override
        public void start() {
            running = true;
        }

        @Override
        public void stop() {
            log.info("Stopping fieldlog...");
            FieldLog.shutdown();
            running = false;
        }

        @Override
        public boolean isRunning() {
            return running;
        }

        // 다른 빈보다 늦게 종료되어 종료 로그까지 기록
        @Override
        public int getPhase() {
            return Integer.MIN_VALUE + 100;
        }
    }
}
