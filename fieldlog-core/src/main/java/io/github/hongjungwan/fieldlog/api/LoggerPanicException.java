package io.github.hongjungwan.fieldlog.api;

/**
 * panic 계열 호출이 레코드를 남긴 뒤 던지는 예외.
 *
 * <p>Callers may catch it to keep the process alive, but the logging call
 * signals that the current flow of execution is expected to stop.</p>
 */
public class LoggerPanicException extends RuntimeException {

    public LoggerPanicException(String message) {
        super(message);
    }
}
