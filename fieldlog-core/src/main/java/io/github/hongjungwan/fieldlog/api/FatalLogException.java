package io.github.hongjungwan.fieldlog.api;

/**
 * fatal 메시지로부터 합성되어 {@link ErrorCounter}에 전달되는 에러.
 */
public class FatalLogException extends RuntimeException {

    public FatalLogException(String message) {
        super(message);
    }
}
