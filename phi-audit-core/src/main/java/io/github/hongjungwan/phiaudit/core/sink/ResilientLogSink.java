package io.github.hongjungwan.phiaudit.core.sink;

import io.github.hongjungwan.phiaudit.api.domain.LogRecord;
import io.github.hongjungwan.phiaudit.core.internal.ComplianceMetrics;
import io.github.hongjungwan.phiaudit.core.resilience.CircuitBreaker;
import io.github.hongjungwan.phiaudit.spi.LogSink;
import lombok.extern.slf4j.Slf4j;

/**
 * 장애 복원력 sink. Circuit Breaker로 primary를 보호하고 실패/차단 시 fallback sink로 우회.
 *
 * 어떤 경우에도 accept()는 예외를 던지지 않음.
 */
@Slf4j
public class ResilientLogSink implements LogSink {

    private final LogSink primary;
    private final LogSink fallback;
    private final CircuitBreaker circuitBreaker;
    private final ComplianceMetrics metrics;

    public ResilientLogSink(LogSink primary, LogSink fallback, CircuitBreaker circuitBreaker,
                            ComplianceMetrics metrics) {
        this.primary = primary;
        this.fallback = fallback;
        this.circuitBreaker = circuitBreaker;
        this.metrics = metrics;
    }

    @Override
    public void accept(LogRecord record) {
        if (!circuitBreaker.tryAcquirePermission()) {
            sendToFallback(record);
            return;
        }

        try {
            primary.accept(record);
            circuitBreaker.onSuccess();
        } catch (RuntimeException e) {
            circuitBreaker.onFailure(e);
            metrics.recordSinkFailure();
            log.debug("Primary sink '{}' failed, using fallback: {}", primary.getName(), e.getMessage());
            sendToFallback(record);
        }
    }

    private void sendToFallback(LogRecord record) {
        metrics.recordFallbackActivation();
        try {
            fallback.accept(record);
        } catch (RuntimeException e) {
            metrics.recordSinkFailure();
            log.error("Fallback sink '{}' failed for record [correlationId={}]",
                    fallback.getName(), record.getCorrelationId(), e);
        }
    }

    @Override
    public void flush() {
        try {
            primary.flush();
        } catch (RuntimeException e) {
            log.warn("Failed to flush primary sink '{}': {}", primary.getName(), e.getMessage());
        }
        fallback.flush();
    }

    @Override
    public void close() {
        try {
            primary.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close primary sink '{}': {}", primary.getName(), e.getMessage());
        }
        fallback.close();
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    @Override
    public String getName() {
        return "resilient(" + primary.getName() + " -> " + fallback.getName() + ")";
    }
}
