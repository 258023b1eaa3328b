package io.github.hongjungwan.fieldlog.core.sink;

import io.github.hongjungwan.fieldlog.spi.LogSink;

/**
 * 모든 레코드를 버리는 sink. 출력 대상이 없거나 disabled 레벨일 때 사용.
 */
public enum DiscardSink implements LogSink {
    INSTANCE;

    @Override
    public void write(byte[] record) {
    }
}
