package io.github.hongjungwan.phiaudit.core.internal;

import io.github.hongjungwan.phiaudit.api.domain.LogLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ComplianceMetrics 테스트")
class ComplianceMetricsTest {

    @Test
    @DisplayName("카운터를 스냅샷에 반영하고 reset으로 초기화해야 한다")
    void shouldSnapshotAndReset() {
        // given
        ComplianceMetrics metrics = new ComplianceMetrics();
        metrics.recordEmitted(LogLevel.INFO);
        metrics.recordEmitted(LogLevel.INFO);
        metrics.recordEmitted(LogLevel.ERROR);
        metrics.recordDropped();
        metrics.recordAuditAppend();
        metrics.recordIntegrityFailure();

        // when
        ComplianceMetrics.Snapshot snapshot = metrics.getSnapshot();

        // then
        assertThat(snapshot.recordsByLevel()).containsEntry(LogLevel.INFO, 2L).containsEntry(LogLevel.DEBUG, 0L);
        assertThat(snapshot.recordsEmitted()).isEqualTo(3);
        assertThat(snapshot.recordsDropped()).isEqualTo(1);
        assertThat(snapshot.auditAppends()).isEqualTo(1);
        assertThat(snapshot.integrityFailures()).isEqualTo(1);
        assertThat(snapshot.uptime().isNegative()).isFalse();

        metrics.reset();
        assertThat(metrics.getSnapshot().recordsEmitted()).isZero();
    }
}
