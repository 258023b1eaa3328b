package io.github.hongjungwan.fieldlog.core.sink;

import io.github.hongjungwan.fieldlog.spi.LogSink;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntConsumer;

/**
 * 비동기 sink. ArrayBlockingQueue 버퍼 + 단일 daemon writer 스레드 기반.
 *
 * 버퍼가 가득 차면 호출자를 블로킹하지 않고 레코드를 버린다. 버려진 개수는
 * writer 스레드가 overflow handler로 전달한다.
 */
@Slf4j
public class AsyncSink implements LogSink {

    private static final AtomicInteger SEQUENCE = new AtomicInteger();
    private static final int MAX_BATCH_SIZE = 100;
    private static final long WAIT_SLICE_MS = 100;
    private static final long SHUTDOWN_TIMEOUT_MS = 5000;

    private final LogSink delegate;
    private final BlockingQueue<byte[]> buffer;
    private final int capacity;
    private final Duration pollInterval;
    private final boolean waiter;
    private final IntConsumer overflowHandler;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);
    private final AtomicInteger missed = new AtomicInteger();
    private final AtomicLong droppedEvents = new AtomicLong();
    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong written = new AtomicLong();
    private final Thread writerThread;

    /**
     * @param pollInterval 대기 모드가 아닐 때 빈 버퍼를 다시 확인하는 간격
     * @param waiter       true면 폴링 대신 큐에서 블로킹 대기
     */
    public AsyncSink(LogSink delegate, int capacity, Duration pollInterval, boolean waiter,
                     IntConsumer overflowHandler) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Buffer capacity must be positive, got: " + capacity);
        }
        this.delegate = delegate;
        this.capacity = capacity;
        this.buffer = new ArrayBlockingQueue<>(capacity);
        this.pollInterval = pollInterval;
        this.waiter = waiter;
        this.overflowHandler = overflowHandler;
        this.writerThread = new Thread(this::drainLoop, "fieldlog-writer-" + SEQUENCE.incrementAndGet());
        this.writerThread.setDaemon(true);
    }

    public AsyncSink start() {
        if (isRunning.compareAndSet(false, true)) {
            writerThread.start();
            log.debug("AsyncSink started with capacity: {}, poll interval: {}, waiter: {}",
                    capacity, pollInterval, waiter);
        }
        return this;
    }

    @Override
    public void write(byte[] record) {
        if (!isRunning.get()) {
            droppedEvents.incrementAndGet();
            return;
        }
        accepted.incrementAndGet();
        if (!buffer.offer(record)) {
            accepted.decrementAndGet();
            missed.incrementAndGet();
            droppedEvents.incrementAndGet();
        }
    }

    /** 호출 시점까지 수락된 레코드가 모두 기록될 때까지 대기 */
    @Override
    public void flush() throws IOException {
        long target = accepted.get();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(SHUTDOWN_TIMEOUT_MS);

        while (written.get() < target && writerThread.isAlive() && System.nanoTime() < deadline) {
            try {
                Thread.sleep(1);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        delegate.flush();
    }

    @Override
    public void close() throws IOException {
        if (!isRunning.compareAndSet(true, false)) {
            return;
        }
        try {
            writerThread.join(SHUTDOWN_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (writerThread.isAlive()) {
            log.warn("Timeout waiting for {} to drain. Remaining records: {}", writerThread.getName(), buffer.size());
        }
        reportMissed();
        delegate.close();
        log.debug("AsyncSink stopped. Dropped events: {}", droppedEvents.get());
    }

    private void drainLoop() {
        try {
            while (isRunning.get() || !buffer.isEmpty()) {
                byte[] record = waiter ? buffer.poll(WAIT_SLICE_MS, TimeUnit.MILLISECONDS) : buffer.poll();
                if (record == null) {
                    reportMissed();
                    if (!waiter && isRunning.get()) {
                        TimeUnit.NANOSECONDS.sleep(pollInterval.toNanos());
                    }
                    continue;
                }

                writeOne(record);
                int batchSize = 1;
                while (batchSize < MAX_BATCH_SIZE && (record = buffer.poll()) != null) {
                    writeOne(record);
                    batchSize++;
                }
                reportMissed();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            byte[] record;
            while ((record = buffer.poll()) != null) {
                writeOne(record);
            }
        }
    }

    private void writeOne(byte[] record) {
        try {
            delegate.write(record);
        } catch (IOException e) {
            log.warn("Failed to write buffered log record", e);
        } finally {
            written.incrementAndGet();
        }
    }

    private void reportMissed() {
        int count = missed.getAndSet(0);
        if (count > 0 && overflowHandler != null) {
            try {
                overflowHandler.accept(count);
            } catch (RuntimeException e) {
                log.warn("Overflow handler failed for {} dropped records", count, e);
            }
        }
    }

    public long getDroppedEvents() {
        return droppedEvents.get();
    }

    public int getQueueSize() {
        return buffer.size();
    }

    public int getQueueCapacity() {
        return capacity;
    }

    public boolean isRunning() {
        return isRunning.get();
    }
}
