package io.github.hongjungwan.phiaudit.core.internal;

import io.github.hongjungwan.phiaudit.api.domain.LogLevel;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * SDK 메트릭 수집 (LongAdder 기반 lock-free). 레벨별 레코드 수, sink 실패, 드롭, 감사 append 결과 등.
 *
 * 프로세스 기본 인스턴스는 {@link #getInstance()}, 테스트나 분리된 팩토리는 별도 인스턴스 사용.
 */
public final class ComplianceMetrics {

    private static final ComplianceMetrics INSTANCE = new ComplianceMetrics();

    private final Instant startTime = Instant.now();

    private final Map<LogLevel, LongAdder> recordsByLevel = new EnumMap<>(LogLevel.class);
    private final LongAdder recordBuildFailures = new LongAdder();
    private final LongAdder sinkFailures = new LongAdder();
    private final LongAdder recordsDropped = new LongAdder();
    private final LongAdder fallbackActivations = new LongAdder();
    private final LongAdder auditAppends = new LongAdder();
    private final LongAdder auditAppendFailures = new LongAdder();
    private final LongAdder integrityFailures = new LongAdder();

    public ComplianceMetrics() {
        for (LogLevel level : LogLevel.values()) {
            recordsByLevel.put(level, new LongAdder());
        }
    }

    public static ComplianceMetrics getInstance() {
        return INSTANCE;
    }

    public void recordEmitted(LogLevel level) {
        recordsByLevel.get(level).increment();
    }

    public void recordBuildFailure() {
        recordBuildFailures.increment();
    }

    public void recordSinkFailure() {
        sinkFailures.increment();
    }

    public void recordDropped() {
        recordsDropped.increment();
    }

    public void recordFallbackActivation() {
        fallbackActivations.increment();
    }

    public void recordAuditAppend() {
        auditAppends.increment();
    }

    public void recordAuditAppendFailure() {
        auditAppendFailures.increment();
    }

    public void recordIntegrityFailure() {
        integrityFailures.increment();
    }

    public Snapshot getSnapshot() {
        Map<LogLevel, Long> levelCounts = new EnumMap<>(LogLevel.class);
        recordsByLevel.forEach((level, counter) -> levelCounts.put(level, counter.sum()));
        return new Snapshot(
                Instant.now(),
                startTime,
                Map.copyOf(levelCounts),
                recordBuildFailures.sum(),
                sinkFailures.sum(),
                recordsDropped.sum(),
                fallbackActivations.sum(),
                auditAppends.sum(),
                auditAppendFailures.sum(),
                integrityFailures.sum()
        );
    }

    public void reset() {
        recordsByLevel.values().forEach(LongAdder::reset);
        recordBuildFailures.reset();
        sinkFailures.reset();
        recordsDropped.reset();
        fallbackActivations.reset();
        auditAppends.reset();
        auditAppendFailures.reset();
        integrityFailures.reset();
    }

    public record Snapshot(
            Instant snapshotTime,
            Instant startTime,
            Map<LogLevel, Long> recordsByLevel,
            long recordBuildFailures,
            long sinkFailures,
            long recordsDropped,
            long fallbackActivations,
            long auditAppends,
            long auditAppendFailures,
            long integrityFailures
    ) {
        public Duration uptime() {
            return Duration.between(startTime, snapshotTime);
        }

        public long recordsEmitted() {
            return recordsByLevel.values().stream().mapToLong(Long::longValue).sum();
        }
    }
}
