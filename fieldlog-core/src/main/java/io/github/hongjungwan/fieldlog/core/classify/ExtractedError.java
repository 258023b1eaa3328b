package io.github.hongjungwan.fieldlog.core.classify;

import java.util.List;

/**
 * 필드 목록에서 분리된 첫 번째 에러와 남은 필드.
 */
public record ExtractedError(Throwable error, List<Object> fields) {

    public boolean found() {
        return error != null;
    }
}
