package io.github.hongjungwan.fieldlog.api;

import java.util.Map;

/**
 * 자체 스택 정보를 가진 예외 타입이 구현하는 capability.
 *
 * <p>When stack traces are enabled and a logged error implements this interface,
 * its fields are attached to the record instead of the rendered {@code stack} array.</p>
 */
public interface StackFieldsProvider {

    /** 레코드 최상위 필드로 병합될 스택 정보 */
    Map<String, Object> stackFields();
}
