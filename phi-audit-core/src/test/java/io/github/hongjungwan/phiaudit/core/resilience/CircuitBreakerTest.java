package io.github.hongjungwan.phiaudit.core.resilience;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for CircuitBreaker (연속 실패 기반)
 */
@DisplayName("CircuitBreaker")
class CircuitBreakerTest {

    private final AtomicLong now = new AtomicLong(10_000);
    private final List<String> transitions = new ArrayList<>();
    private CircuitBreaker circuitBreaker;

    @BeforeEach
    void setUp() {
        circuitBreaker = CircuitBreaker.builder("test")
                .failureThreshold(3)
                .openDuration(Duration.ofMillis(100))
                .clock(now::get)
                .onStateChange((name, from, to) -> transitions.add(from + "->" + to))
                .build();
    }

    private void failTimes(int count) {
        for (int i = 0; i < count; i++) {
            circuitBreaker.onFailure(new RuntimeException("test"));
        }
    }

    @Nested
    @DisplayName("State Transitions")
    class StateTransitionTests {

        @Test
        @DisplayName("should start in CLOSED state")
        void shouldStartClosed() {
            assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
            assertThat(circuitBreaker.tryAcquirePermission()).isTrue();
        }

        @Test
        @DisplayName("should transition to OPEN after failure threshold")
        void shouldOpenAfterFailures() {
            failTimes(3);

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
            assertThat(circuitBreaker.tryAcquirePermission()).isFalse();
            assertThat(transitions).containsExactly("CLOSED->OPEN");
        }

        @Test
        @DisplayName("should stay CLOSED below threshold")
        void shouldStayClosedBelowThreshold() {
            failTimes(2);

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
            assertThat(circuitBreaker.getMetrics().failureCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should reset failure count on success")
        void shouldResetFailureCountOnSuccess() {
            failTimes(2);

            circuitBreaker.onSuccess();

            assertThat(circuitBreaker.getMetrics().failureCount()).isZero();
            assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        }

        @Test
        @DisplayName("should allow calls after open duration expires")
        void shouldAllowCallsAfterTimeout() {
            failTimes(3);

            now.addAndGet(150);

            assertThat(circuitBreaker.tryAcquirePermission()).isTrue();
            assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        }

        @Test
        @DisplayName("재시도 호출이 다시 실패하면 곧바로 OPEN")
        void shouldReopenOnTrialFailure() {
            failTimes(3);
            now.addAndGet(150);

            circuitBreaker.onFailure(new RuntimeException("still failing"));

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
            assertThat(transitions).containsExactly("CLOSED->OPEN", "CLOSED->OPEN");
        }

        @Test
        @DisplayName("강제 리셋 시 CLOSED로 돌아와야 한다")
        void shouldResetManually() {
            failTimes(3);

            circuitBreaker.reset();

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
            assertThat(transitions).containsExactly("CLOSED->OPEN", "OPEN->CLOSED");
        }
    }

    @Test
    @DisplayName("리스너 예외는 상태 전이에 영향을 주지 않아야 한다")
    void shouldIgnoreListenerFailure() {
        CircuitBreaker breaker = CircuitBreaker.builder("noisy")
                .failureThreshold(1)
                .onStateChange((name, from, to) -> {
                    throw new IllegalStateException("listener bug");
                })
                .build();

        assertThatCode(() -> breaker.onFailure(new RuntimeException("x"))).doesNotThrowAnyException();
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
    }

    @Test
    @DisplayName("임계치는 1 이상이어야 한다")
    void shouldRejectInvalidThreshold() {
        assertThatThrownBy(() -> CircuitBreaker.builder("x").failureThreshold(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
