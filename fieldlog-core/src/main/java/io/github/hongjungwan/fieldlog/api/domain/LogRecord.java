package io.github.hongjungwan.fieldlog.api.domain;

import io.github.hongjungwan.fieldlog.api.Level;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Record handed from a logger to its backend.
 * Classification is already done: fields hold only key/value pairs.
 */
@Getter
@Builder(toBuilder = true)
public class LogRecord {

    /**
     * Record level, {@code null} for records written without a level
     */
    private final Level level;

    /**
     * Final (already formatted) message
     */
    private final String message;

    /**
     * Flat key/value pairs; an odd trailing key is paired with null
     */
    @Builder.Default
    private final List<Object> fields = List.of();

    /**
     * Attached error; may be null even when {@link #errorAttached} is set
     */
    private final Throwable error;

    /**
     * Whether the record carries an {@code error} attribute at all
     */
    private final boolean errorAttached;

    /**
     * Stack frames of the attached error (stack traces enabled)
     */
    private final List<StackTraceElement> stack;

    /**
     * Fields supplied by a {@link io.github.hongjungwan.fieldlog.api.StackFieldsProvider}
     */
    private final Map<String, Object> stackFields;

    /**
     * Immediate call site, set for trace records
     */
    private final String caller;
}
