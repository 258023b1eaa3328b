package io.github.hongjungwan.fieldlog.api;

import java.util.concurrent.atomic.AtomicLong;

/**
 * AtomicLong 기반 단순 에러 카운터.
 */
public class SimpleErrorCounter implements ErrorCounter {

    private final AtomicLong count = new AtomicLong();

    @Override
    public void inc(Throwable error) {
        count.incrementAndGet();
    }

    public long getCount() {
        return count.get();
    }

    @Override
    public String toString() {
        return "SimpleErrorCounter[count=" + count.get() + "]";
    }
}
