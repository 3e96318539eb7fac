package io.github.hongjungwan.phiaudit.core.audit;

import io.github.hongjungwan.phiaudit.api.domain.AuditEntry;
import io.github.hongjungwan.phiaudit.api.domain.IntegrityReport;

import java.util.List;
import java.util.Objects;

/**
 * 해시 체인 독립 검증. 라이브 trail, export 문서, 아카이브 모두 같은 규칙으로 검증.
 *
 * <p>각 엔트리마다 링크(previousHash == 직전 entryHash 또는 anchor)를 먼저 확인하고,
 * 이어서 entryHash를 재계산해 비교. 처음 어긋난 지점에서 중단.</p>
 */
public final class AuditChainVerifier {

    private AuditChainVerifier() {
    }

    public static IntegrityReport verify(List<AuditEntry> entries, String anchorHash) {
        String expectedPrevious = anchorHash;

        for (int i = 0; i < entries.size(); i++) {
            AuditEntry entry = entries.get(i);

            if (!Objects.equals(expectedPrevious, entry.getPreviousHash())) {
                return IntegrityReport.broken(i, IntegrityReport.Failure.LINK_MISMATCH,
                        expectedPrevious, entry.getPreviousHash());
            }

            String recomputed = AuditHasher.computeEntryHash(entry);
            if (!recomputed.equals(entry.getEntryHash())) {
                return IntegrityReport.broken(i, IntegrityReport.Failure.HASH_MISMATCH,
                        recomputed, entry.getEntryHash());
            }

            expectedPrevious = entry.getEntryHash();
        }

        return IntegrityReport.intact(entries.size());
    }

    /** genesis에서 시작하는 export 문서 검증 */
    public static IntegrityReport verifyExport(String json) {
        return verifyExport(json, AuditHasher.GENESIS_HASH);
    }

    /**
     * @throws AuditJsonCodec.CodecException JSON 파싱 실패 시
     */
    public static IntegrityReport verifyExport(String json, String anchorHash) {
        return verify(new AuditJsonCodec().fromJson(json), anchorHash);
    }

    /**
     * 아카이브 검증. 체인 자체와 더불어 헤더의 lastHash가 실제 마지막 entryHash와 일치하는지 확인.
     * lastHash 불일치는 index = entries.size() 의 LINK_MISMATCH로 보고.
     */
    public static IntegrityReport verify(AuditArchive archive) {
        List<AuditEntry> entries = archive.entries();
        IntegrityReport report = verify(entries, archive.anchorHash());
        if (!report.valid()) {
            return report;
        }

        String tip = entries.isEmpty()
                ? archive.anchorHash()
                : entries.get(entries.size() - 1).getEntryHash();
        if (!Objects.equals(tip, archive.lastHash())) {
            return new IntegrityReport(false, entries.size(), entries.size(),
                    IntegrityReport.Failure.LINK_MISMATCH, tip, archive.lastHash());
        }
        return report;
    }
}
