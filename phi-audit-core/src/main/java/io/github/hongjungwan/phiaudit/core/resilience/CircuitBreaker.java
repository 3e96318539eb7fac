package io.github.hongjungwan.phiaudit.core.resilience;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * 연속 실패 기반 Circuit Breaker - N번 연속 실패 시 일정 시간 동안 fast-fail.
 *
 * OPEN 유지 시간이 지나면 다음 호출을 허용하고, 그 호출이 다시 실패하면 곧바로 OPEN.
 */
@Slf4j
public final class CircuitBreaker {

    private final String name;
    private final int failureThreshold;
    private final long openDurationMs;
    private final LongSupplier clock;
    private final StateChangeListener stateChangeListener;
    private final ReentrantLock lock = new ReentrantLock();

    private int consecutiveFailures = 0;
    private long lastFailureTime = 0;

    /** CLOSED: 정상, OPEN: 차단 */
    public enum State {
        CLOSED,
        OPEN
    }

    private CircuitBreaker(Builder builder) {
        this.name = builder.name;
        this.failureThreshold = builder.failureThreshold;
        this.openDurationMs = builder.openDurationMs;
        this.clock = builder.clock;
        this.stateChangeListener = builder.stateChangeListener;
    }

    /** 호출 허용 여부 */
    public boolean tryAcquirePermission() {
        lock.lock();
        try {
            return !isOpenInternal();
        } finally {
            lock.unlock();
        }
    }

    /** 성공 기록 - 연속 실패 카운터 리셋 */
    public void onSuccess() {
        lock.lock();
        try {
            if (consecutiveFailures > 0) {
                State previous = stateInternal();
                consecutiveFailures = 0;
                lastFailureTime = 0;
                notifyStateChange(previous, State.CLOSED);
            }
        } finally {
            lock.unlock();
        }
    }

    /** 실패 기록 - 연속 실패 카운터 증가 */
    public void onFailure(Throwable error) {
        lock.lock();
        try {
            State previous = stateInternal();
            consecutiveFailures++;
            lastFailureTime = clock.getAsLong();

            if (consecutiveFailures >= failureThreshold && previous == State.CLOSED) {
                log.warn("Circuit breaker '{}' OPEN after {} consecutive failures (last: {})",
                        name, consecutiveFailures, error.getClass().getSimpleName());
                notifyStateChange(State.CLOSED, State.OPEN);
            }
        } finally {
            lock.unlock();
        }
    }

    /** 강제 리셋 */
    public void reset() {
        lock.lock();
        try {
            State previous = stateInternal();
            consecutiveFailures = 0;
            lastFailureTime = 0;
            if (previous == State.OPEN) {
                log.info("Circuit breaker '{}' reset to CLOSED", name);
                notifyStateChange(previous, State.CLOSED);
            }
        } finally {
            lock.unlock();
        }
    }

    public State getState() {
        lock.lock();
        try {
            return stateInternal();
        } finally {
            lock.unlock();
        }
    }

    private State stateInternal() {
        return isOpenInternal() ? State.OPEN : State.CLOSED;
    }

    private boolean isOpenInternal() {
        if (consecutiveFailures >= failureThreshold) {
            long elapsed = clock.getAsLong() - lastFailureTime;
            return elapsed < openDurationMs;
        }
        return false;
    }

    public String getName() {
        return name;
    }

    /** 메트릭 스냅샷 조회 */
    public Metrics getMetrics() {
        lock.lock();
        try {
            return new Metrics(name, stateInternal(), consecutiveFailures);
        } finally {
            lock.unlock();
        }
    }

    private void notifyStateChange(State from, State to) {
        if (stateChangeListener != null && from != to) {
            try {
                stateChangeListener.onStateChange(name, from, to);
            } catch (RuntimeException e) {
                log.warn("State change listener threw exception", e);
            }
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public record Metrics(
            String name,
            State state,
            int failureCount
    ) {}

    /** 상태 변경 리스너 */
    @FunctionalInterface
    public interface StateChangeListener {
        void onStateChange(String name, State from, State to);
    }

    public static class Builder {
        private final String name;
        private int failureThreshold = 3;
        private long openDurationMs = 30_000;
        private LongSupplier clock = System::currentTimeMillis;
        private StateChangeListener stateChangeListener;

        public Builder(String name) {
            this.name = name;
        }

        /** 실패 임계값 설정 (기본: 3회) */
        public Builder failureThreshold(int threshold) {
            if (threshold < 1) {
                throw new IllegalArgumentException("failureThreshold must be >= 1");
            }
            this.failureThreshold = threshold;
            return this;
        }

        /** OPEN 유지 시간 설정 (기본: 30초) */
        public Builder openDuration(Duration duration) {
            this.openDurationMs = duration.toMillis();
            return this;
        }

        /** 밀리초 시계 (테스트용) */
        public Builder clock(LongSupplier clock) {
            this.clock = clock;
            return this;
        }

        public Builder onStateChange(StateChangeListener listener) {
            this.stateChangeListener = listener;
            return this;
        }

        public CircuitBreaker build() {
            return new CircuitBreaker(this);
        }
    }
}
