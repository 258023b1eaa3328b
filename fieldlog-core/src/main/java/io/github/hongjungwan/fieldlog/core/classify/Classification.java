package io.github.hongjungwan.fieldlog.core.classify;

import java.util.List;

/**
 * 포맷 호출 인자의 분류 결과: 앞쪽 포맷 치환 인자와 뒤쪽 key/value 필드.
 */
public record Classification(List<Object> formatArgs, List<Object> fields) {

    public boolean hasFormatArgs() {
        return !formatArgs.isEmpty();
    }

    /** 포맷 인자가 없으면 메시지를 그대로 반환 */
    public String render(String message) {
        return ArgumentClassifier.render(message, formatArgs);
    }
}
