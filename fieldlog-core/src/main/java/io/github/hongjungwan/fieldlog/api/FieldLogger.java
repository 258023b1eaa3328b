package io.github.hongjungwan.fieldlog.api;

import io.github.hongjungwan.fieldlog.spi.LogBackend;

/**
 * fieldlog의 메인 로거 인터페이스. 메시지 + key/value 필드 기반 구조화 로깅.
 *
 * <pre>{@code
 * logger.info("user signed in", "user_id", 42, "region", "KR");
 * logger.infof("took %d ms", elapsed, "endpoint", "/orders");
 * logger.err(e, "cannot handle request", "request_id", id);
 * }</pre>
 *
 * <p>Fields are flat key/value pairs. A {@link Throwable} among the fields is attached
 * as the record's {@code error}. Formatted ({@code *f}) calls use the leading arguments
 * for the message placeholders and treat the rest as fields.</p>
 */
public interface FieldLogger {

    /** caller 필드 포함 */
    void trace(String message, Object... fields);

    void tracef(String format, Object... args);

    void debug(String message, Object... fields);

    void debugf(String format, Object... args);

    void info(String message, Object... fields);

    void infof(String format, Object... args);

    void warn(String message, Object... fields);

    void warnf(String format, Object... args);

    void error(String message, Object... fields);

    /**
     * 포맷 에러 로깅. 플레이스홀더에 쓰인 {@link Throwable}은 메시지로만 치환되고
     * error 필드나 카운트에 반영되지 않으므로, 에러를 남기려면 {@link #errf}를 사용한다.
     */
    void errorf(String format, Object... args);

    /** 레벨 지정 로깅. null 레벨은 레벨 없는 레코드 */
    void log(Level level, String message, Object... fields);

    void logf(Level level, String format, Object... args);

    /**
     * Logs the given error at error level. The error is always attached, even when
     * {@code null}; fields are not scanned for another error.
     */
    void err(Throwable error, String message, Object... fields);

    void errf(Throwable error, String format, Object... args);

    /** 에러의 전체 스택 트레이스를 메시지로 error 레벨 기록 */
    void errStack(Throwable error, Object... fields);

    /**
     * Logs the values at fatal level, then calls the configured exit handler with status 1.
     */
    void fatal(Object... values);

    void fatalf(String format, Object... args);

    /**
     * Logs the values at fatal level, then throws {@link LoggerPanicException}.
     */
    void panic(Object... values);

    void panicf(String format, Object... args);

    /** 레벨 없는 레코드 */
    void print(Object... values);

    void printf(String format, Object... args);

    /** 현재 스레드의 스택을 메시지로 레벨 없이 기록 */
    void printStack(Object... fields);

    FieldLogger withFields(Object... fields);

    default FieldLogger with(Object... fields) {
        return withFields(fields);
    }

    /** 빈 문자열이면 변경 없음, 알 수 없는 이름이면 InvalidLevelException */
    FieldLogger withLevel(String level);

    FieldLogger withStack(boolean stackTrace);

    FieldLogger withErrorCounter(ErrorCounter errorCounter);

    FieldLogger withSimpleErrorCounter();

    FieldLogger withToIgnore(String... toIgnore);

    Level getLevel();

    ErrorCounter getErrorCounter();

    /** 설정으로 생성된 로거인지 (placeholder / nop 여부) */
    boolean isInitialized();

    LogBackend backend();
}
