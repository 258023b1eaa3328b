package io.github.hongjungwan.fieldlog.core.bridge;

import io.github.hongjungwan.fieldlog.api.FieldLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.ErrorManager;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.SimpleFormatter;

/**
 * JUL 레코드를 FieldLogger로 전달하는 핸들러. 메시지 파라미터만 치환하고
 * JUL 자체의 시간/레벨 접두어는 붙이지 않는다.
 */
public class FieldLogHandler extends Handler {

    static final String LOGGER_FIELD = "logger";
    static final String ERROR_FIELD = "error";

    // 전달 중 발생한 fieldlog 자체 경고가 JUL을 거쳐 다시 들어오는 경우 차단
    private static final ThreadLocal<Boolean> FORWARDING = ThreadLocal.withInitial(() -> Boolean.FALSE);

    private final FieldLogger logger;
    private final Formatter messageFormatter = new SimpleFormatter();

    public FieldLogHandler(FieldLogger logger) {
        this.logger = logger;
    }

    @Override
    public void publish(LogRecord record) {
        if (record == null || !isLoggable(record) || FORWARDING.get()) {
            return;
        }
        FORWARDING.set(Boolean.TRUE);
        try {
            List<Object> fields = new ArrayList<>(4);
            if (record.getLoggerName() != null) {
                fields.add(LOGGER_FIELD);
                fields.add(record.getLoggerName());
            }
            if (record.getThrown() != null) {
                fields.add(ERROR_FIELD);
                fields.add(record.getThrown());
            }
            logger.log(JulBridge.fromJulLevel(record.getLevel()),
                    messageFormatter.formatMessage(record), fields.toArray());
        } catch (RuntimeException e) {
            reportError("Failed to forward JUL record", e, ErrorManager.WRITE_FAILURE);
        } finally {
            FORWARDING.set(Boolean.FALSE);
        }
    }

    @Override
    public void flush() {
        logger.backend().flush();
    }

    /** 로거 수명은 설치한 쪽이 관리 */
    @Override
    public void close() {
        flush();
    }

    public FieldLogger getLogger() {
        return logger;
    }
}
