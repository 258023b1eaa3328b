package io.github.hongjungwan.fieldlog.api;

import io.github.hongjungwan.fieldlog.api.config.LogConfig;
import io.github.hongjungwan.fieldlog.core.bridge.JulBridge;
import io.github.hongjungwan.fieldlog.core.internal.DefaultFieldLogger;
import io.github.hongjungwan.fieldlog.spi.LogBackend;
import lombok.extern.slf4j.Slf4j;

/**
 * 프로세스 전역 기본 로거. init 전에는 아무것도 기록하지 않는 placeholder.
 *
 * <pre>{@code
 * FieldLog.init(LogConfig.create().withConsoleJson().withLevel("debug"), "service", "orders");
 * FieldLog.info("started", "port", 8080);
 * ...
 * FieldLog.shutdown();
 * }</pre>
 *
 * <p>The installed logger is also mirrored into {@code java.util.logging}, so libraries
 * logging through JUL end up in the same output.</p>
 */
@Slf4j
public final class FieldLog {

    private static final DefaultFieldLogger PLACEHOLDER = DefaultFieldLogger.nop();
    private static final FieldLogger SHARED = new SharedLogger();
    private static final Object LOCK = new Object();

    private static volatile DefaultFieldLogger current = PLACEHOLDER;

    private FieldLog() {}

    /**
     * Builds a logger from the configuration, installs it as the global logger and mirrors
     * it into {@code java.util.logging}. The previously installed logger is closed, so
     * loggers obtained from it through {@link #get()} or {@code with*} stop writing.
     *
     * @throws InvalidLevelException if the configured level cannot be parsed
     */
    public static FieldLogger init(LogConfig config, Object... fields) {
        DefaultFieldLogger logger;
        DefaultFieldLogger previous;
        synchronized (LOCK) {
            logger = DefaultFieldLogger.create(config, fields);
            previous = current;
            current = logger;
            JulBridge.install(logger);
            log.debug("Global logger installed: level={}", logger.getLevel());
        }
        if (previous != PLACEHOLDER) {
            previous.close();
        }
        return logger;
    }

    /**
     * Rebuilds the installed logger in place. Loggers previously returned by {@link #get()}
     * see the new configuration. Falls back to {@link #init} while nothing is installed.
     */
    public static FieldLogger update(LogConfig config, Object... fields) {
        synchronized (LOCK) {
            DefaultFieldLogger logger = current;
            if (logger == PLACEHOLDER) {
                return init(config, fields);
            }
            logger.update(config, fields);
            JulBridge.install(logger);
            log.debug("Global logger updated: level={}", logger.getLevel());
            return logger;
        }
    }

    /** JUL 미러 해제, placeholder 복원 후 이전 로거 종료 (버퍼 flush) */
    public static void shutdown() {
        DefaultFieldLogger previous;
        synchronized (LOCK) {
            JulBridge.uninstall();
            previous = current;
            current = PLACEHOLDER;
        }
        if (previous != PLACEHOLDER) {
            previous.close();
        }
    }

    /** 현재 설치된 로거 */
    public static FieldLogger get() {
        return current;
    }

    /** 호출 시점마다 설치된 로거로 위임하는 뷰. 이후 init 후에도 유효 */
    public static FieldLogger shared() {
        return SHARED;
    }

    /** 임의의 로거를 java.util.logging 출력으로 연결 */
    public static void setForLegacy(FieldLogger logger, Object... fields) {
        FieldLogger target = fields == null || fields.length == 0 ? logger : logger.withFields(fields);
        JulBridge.install(target);
    }

    public static void trace(String message, Object... fields) {
        current.trace(message, fields);
    }

    public static void tracef(String format, Object... args) {
        current.tracef(format, args);
    }

    public static void debug(String message, Object... fields) {
        current.debug(message, fields);
    }

    public static void debugf(String format, Object... args) {
        current.debugf(format, args);
    }

    public static void info(String message, Object... fields) {
        current.info(message, fields);
    }

    public static void infof(String format, Object... args) {
        current.infof(format, args);
    }

    public static void warn(String message, Object... fields) {
        current.warn(message, fields);
    }

    public static void warnf(String format, Object... args) {
        current.warnf(format, args);
    }

    public static void error(String message, Object... fields) {
        current.error(message, fields);
    }

    public static void errorf(String format, Object... args) {
        current.errorf(format, args);
    }

    public static void log(Level level, String message, Object... fields) {
        current.log(level, message, fields);
    }

    public static void logf(Level level, String format, Object... args) {
        current.logf(level, format, args);
    }

    public static void err(Throwable error, String message, Object... fields) {
        current.err(error, message, fields);
    }

    public static void errf(Throwable error, String format, Object... args) {
        current.errf(error, format, args);
    }

    public static void errStack(Throwable error, Object... fields) {
        current.errStack(error, fields);
    }

    public static void fatal(Object... values) {
        current.fatal(values);
    }

    public static void fatalf(String format, Object... args) {
        current.fatalf(format, args);
    }

    public static void panic(Object... values) {
        current.panic(values);
    }

    public static void panicf(String format, Object... args) {
        current.panicf(format, args);
    }

    public static void print(Object... values) {
        current.print(values);
    }

    public static void printf(String format, Object... args) {
        current.printf(format, args);
    }

    public static void printStack(Object... fields) {
        current.printStack(fields);
    }

    public static FieldLogger withFields(Object... fields) {
        return current.withFields(fields);
    }

    public static FieldLogger withLevel(String level) {
        return current.withLevel(level);
    }

    public static FieldLogger withStack(boolean stackTrace) {
        return current.withStack(stackTrace);
    }

    public static Level getLevel() {
        return current.getLevel();
    }

    public static ErrorCounter getErrorCounter() {
        return current.getErrorCounter();
    }

    public static boolean isInitialized() {
        return current.isInitialized();
    }

    /** 설치된 로거를 매 호출마다 다시 읽는 위임 로거 */
    private static final class SharedLogger implements FieldLogger {

        @Override
        public void trace(String message, Object... fields) {
            current.trace(message, fields);
        }

        @Override
        public void tracef(String format, Object... args) {
            current.tracef(format, args);
        }

        @Override
        public void debug(String message, Object... fields) {
            current.debug(message, fields);
        }

        @Override
        public void debugf(String format, Object... args) {
            current.debugf(format, args);
        }

        @Override
        public void info(String message, Object... fields) {
            current.info(message, fields);
        }

        @Override
        public void infof(String format, Object... args) {
            current.infof(format, args);
        }

        @Override
        public void warn(String message, Object... fields) {
            current.warn(message, fields);
        }

        @Override
        public void warnf(String format, Object... args) {
            current.warnf(format, args);
        }

        @Override
        public void error(String message, Object... fields) {
            current.error(message, fields);
        }

        @Override
        public void errorf(String format, Object... args) {
            current.errorf(format, args);
        }

        @Override
        public void log(Level level, String message, Object... fields) {
            current.log(level, message, fields);
        }

        @Override
        public void logf(Level level, String format, Object... args) {
            current.logf(level, format, args);
        }

        @Override
        public void err(Throwable error, String message, Object... fields) {
            current.err(error, message, fields);
        }

        @Override
        public void errf(Throwable error, String format, Object... args) {
            current.errf(error, format, args);
        }

        @Override
        public void errStack(Throwable error, Object... fields) {
            current.errStack(error, fields);
        }

        @Override
        public void fatal(Object... values) {
            current.fatal(values);
        }

        @Override
        public void fatalf(String format, Object... args) {
            current.fatalf(format, args);
        }

        @Override
        public void panic(Object... values) {
            current.panic(values);
        }

        @Override
        public void panicf(String format, Object... args) {
            current.panicf(format, args);
        }

        @Override
        public void print(Object... values) {
            current.print(values);
        }

        @Override
        public void printf(String format, Object... args) {
            current.printf(format, args);
        }

        @Override
        public void printStack(Object... fields) {
            current.printStack(fields);
        }

        @Override
        public FieldLogger withFields(Object... fields) {
            return current.withFields(fields);
        }

        @Override
        public FieldLogger withLevel(String level) {
            return current.withLevel(level);
        }

        @Override
        public FieldLogger withStack(boolean stackTrace) {
            return current.withStack(stackTrace);
        }

        @Override
        public FieldLogger withErrorCounter(ErrorCounter errorCounter) {
            return current.withErrorCounter(errorCounter);
        }

        @Override
        public FieldLogger withSimpleErrorCounter() {
            return current.withSimpleErrorCounter();
        }

        @Override
        public FieldLogger withToIgnore(String... toIgnore) {
            return current.withToIgnore(toIgnore);
        }

        @Override
        public Level getLevel() {
            return current.getLevel();
        }

        @Override
        public ErrorCounter getErrorCounter() {
            return current.getErrorCounter();
        }

        @Override
        public boolean isInitialized() {
            return current.isInitialized();
        }

        @Override
        public LogBackend backend() {
            return current.backend();
        }
    }
}
