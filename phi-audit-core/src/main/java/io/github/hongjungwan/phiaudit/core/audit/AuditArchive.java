package io.github.hongjungwan.phiaudit.core.audit;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.github.hongjungwan.phiaudit.api.domain.AuditEntry;

import java.time.Instant;
import java.util.List;

/**
 * 아카이브 파일 내용. anchorHash는 첫 엔트리의 previousHash, lastHash는 마지막 엔트리의 entryHash.
 */
@JsonPropertyOrder({"anchorHash", "lastHash", "archivedAt", "entries"})
public record AuditArchive(
        String anchorHash,
        String lastHash,
        Instant archivedAt,
        List<AuditEntry> entries
) {

    public AuditArchive {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
