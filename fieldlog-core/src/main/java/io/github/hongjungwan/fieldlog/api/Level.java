package io.github.hongjungwan.fieldlog.api;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 로그 레벨. trace &lt; debug &lt; info &lt; warn &lt; error &lt; fatal &lt; disabled 순으로 정렬.
 */
public enum Level {
    TRACE("trace"),
    DEBUG("debug"),
    INFO("info"),
    WARN("warn"),
    ERROR("error"),
    FATAL("fatal"),
    DISABLED("disabled");

    private final String label;

    Level(String label) {
        this.label = label;
    }

    /** 출력 레코드에 기록되는 소문자 이름 */
    public String getLabel() {
        return label;
    }

    /**
     * Checks whether a record of the given level passes this minimum level.
     * A {@code null} record level stands for records written without a level,
     * which pass every minimum except {@link #DISABLED}.
     */
    public boolean permits(Level recordLevel) {
        if (this == DISABLED || recordLevel == DISABLED) {
            return false;
        }
        return recordLevel == null || recordLevel.ordinal() >= ordinal();
    }

    /** 이름으로 레벨 파싱 (대소문자 무시) */
    public static Level parse(String value) {
        if (value != null) {
            String trimmed = value.trim();
            for (Level level : values()) {
                if (level.label.equalsIgnoreCase(trimmed)) {
                    return level;
                }
            }
        }
        throw new InvalidLevelException(value);
    }

    public static List<String> labels() {
        return Arrays.stream(values())
                .map(Level::getLabel)
                .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public String toString() {
        return label;
    }
}
