package io.github.hongjungwan.phiaudit.core.sink;

import io.github.hongjungwan.phiaudit.api.domain.LogRecord;
import io.github.hongjungwan.phiaudit.core.internal.ComplianceMetrics;
import io.github.hongjungwan.phiaudit.spi.LogSink;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 비동기 sink. 호출 스레드는 큐에 넣기만 하고 전용 consumer 스레드가 delegate로 전달.
 *
 * 버퍼가 가득 차면 가장 오래된 레코드를 버리고 dropped 카운터 증가 (호출자는 블로킹되지 않음).
 */
@Slf4j
public class AsyncLogSink implements LogSink {

    static final String THREAD_NAME = "phi-audit-async-sink";

    private final LogSink delegate;
    private final BlockingQueue<LogRecord> queue;
    private final int capacity;
    private final Duration shutdownTimeout;
    private final ComplianceMetrics metrics;
    private final Thread consumer;

    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicInteger pending = new AtomicInteger(0);
    private final AtomicLong droppedCount = new AtomicLong(0);

    public AsyncLogSink(LogSink delegate, int capacity, Duration shutdownTimeout, ComplianceMetrics metrics) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.delegate = delegate;
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.shutdownTimeout = shutdownTimeout;
        this.metrics = metrics;

        this.consumer = new Thread(this::consumeLoop, THREAD_NAME);
        this.consumer.setDaemon(true);
        this.consumer.start();
    }

    @Override
    public void accept(LogRecord record) {
        if (!running.get()) {
            markDropped();
            return;
        }

        pending.incrementAndGet();
        while (!queue.offer(record)) {
            // 가장 오래된 레코드 제거 후 재시도
            if (queue.poll() != null) {
                pending.decrementAndGet();
                markDropped();
            }
        }
    }

    private void consumeLoop() {
        while (running.get() || !queue.isEmpty()) {
            try {
                LogRecord record = queue.poll(100, TimeUnit.MILLISECONDS);
                if (record != null) {
                    deliver(record);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    private void deliver(LogRecord record) {
        try {
            delegate.accept(record);
        } catch (RuntimeException e) {
            metrics.recordSinkFailure();
            log.warn("Async delivery to '{}' failed [correlationId={}]: {}",
                    delegate.getName(), record.getCorrelationId(), e.getMessage());
        } finally {
            pending.decrementAndGet();
        }
    }

    private void markDropped() {
        droppedCount.incrementAndGet();
        metrics.recordDropped();
    }

    /** 큐가 비워질 때까지 대기 (최대 shutdownTimeout) 후 delegate flush */
    @Override
    public void flush() {
        long deadline = System.nanoTime() + shutdownTimeout.toNanos();
        while (pending.get() > 0 && System.nanoTime() < deadline) {
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        delegate.flush();
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }

        try {
            consumer.join(shutdownTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        if (consumer.isAlive()) {
            consumer.interrupt();
        }

        int remaining = queue.size();
        if (remaining > 0) {
            log.warn("Async sink closed with {} undelivered records", remaining);
            for (int i = 0; i < remaining; i++) {
                markDropped();
            }
            queue.clear();
        }

        delegate.flush();
        delegate.close();
    }

    public int getQueueSize() {
        return queue.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public long getDroppedCount() {
        return droppedCount.get();
    }

    @Override
    public String getName() {
        return "async(" + delegate.getName() + ")";
    }
}
