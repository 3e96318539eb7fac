package io.github.hongjungwan.phiaudit.core.audit;

import io.github.hongjungwan.phiaudit.api.domain.AuditEntry;
import io.github.hongjungwan.phiaudit.api.domain.IntegrityReport;
import io.github.hongjungwan.phiaudit.core.masking.PhiFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AuditChainVerifier 테스트")
class AuditChainVerifierTest {

    private List<AuditEntry> chain;

    @BeforeEach
    void setUp() {
        InMemoryAuditStore store = new InMemoryAuditStore();
        AuditTrail trail = new AuditTrail(store, new PhiFilter());
        for (int i = 0; i < 3; i++) {
            trail.logAction("VIEW", "PATIENT", "p" + i, "dr", "SUCCESS", Map.of("i", i));
        }
        chain = store.snapshot();
    }

    @Test
    @DisplayName("빈 체인은 유효해야 한다")
    void emptyChainShouldBeValid() {
        assertThat(AuditChainVerifier.verify(List.of(), AuditHasher.GENESIS_HASH))
                .isEqualTo(IntegrityReport.intact(0));
    }

    @Test
    @DisplayName("다른 anchor로 검증하면 첫 엔트리에서 LINK_MISMATCH")
    void shouldReportWrongAnchor() {
        IntegrityReport report = AuditChainVerifier.verify(chain, "f".repeat(64));

        assertThat(report.valid()).isFalse();
        assertThat(report.firstBrokenIndex()).isZero();
        assertThat(report.failure()).isEqualTo(IntegrityReport.Failure.LINK_MISMATCH);
        assertThat(report.expectedHash()).isEqualTo("f".repeat(64));
        assertThat(report.actualHash()).isEqualTo(AuditHasher.GENESIS_HASH);
    }

    @Test
    @DisplayName("엔트리가 빠지면 그 다음 위치에서 LINK_MISMATCH")
    void shouldDetectRemovedEntry() {
        List<AuditEntry> withGap = new ArrayList<>(chain);
        withGap.remove(1);

        IntegrityReport report = AuditChainVerifier.verify(withGap, AuditHasher.GENESIS_HASH);

        assertThat(report.firstBrokenIndex()).isEqualTo(1);
        assertThat(report.failure()).isEqualTo(IntegrityReport.Failure.LINK_MISMATCH);
        assertThat(report.entriesChecked()).isEqualTo(2);
    }

    @Test
    @DisplayName("아카이브의 lastHash가 실제 마지막 해시와 다르면 실패")
    void shouldCheckArchiveLastHash() {
        String tip = chain.get(chain.size() - 1).getEntryHash();

        AuditArchive good = new AuditArchive(AuditHasher.GENESIS_HASH, tip, Instant.now(), chain);
        AuditArchive truncated = new AuditArchive(AuditHasher.GENESIS_HASH, tip, Instant.now(), chain.subList(0, 2));

        assertThat(AuditChainVerifier.verify(good).valid()).isTrue();
        IntegrityReport report = AuditChainVerifier.verify(truncated);
        assertThat(report.valid()).isFalse();
        assertThat(report.firstBrokenIndex()).isEqualTo(2);
    }

    @Test
    @DisplayName("잘못된 JSON export는 CodecException")
    void shouldRejectMalformedExport() {
        assertThatThrownBy(() -> AuditChainVerifier.verifyExport("not json"))
                .isInstanceOf(AuditJsonCodec.CodecException.class);
    }
}
