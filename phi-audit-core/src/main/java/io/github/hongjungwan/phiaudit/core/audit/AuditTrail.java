package io.github.hongjungwan.phiaudit.core.audit;

import io.github.hongjungwan.phiaudit.api.AuditValidationException;
import io.github.hongjungwan.phiaudit.api.ComplianceLogger;
import io.github.hongjungwan.phiaudit.api.domain.AuditEntry;
import io.github.hongjungwan.phiaudit.api.domain.AuditStatus;
import io.github.hongjungwan.phiaudit.api.domain.IntegrityReport;
import io.github.hongjungwan.phiaudit.core.internal.ComplianceMetrics;
import io.github.hongjungwan.phiaudit.core.masking.PhiFilter;
import io.github.hongjungwan.phiaudit.spi.AuditStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * 해시 체인 기반 감사 기록.
 *
 * <p>엔트리 생성, 해시 계산, 저장소 append, lastHash 갱신은 하나의 락 안에서 수행되므로
 * 동시 호출에서도 체인이 갈라지지 않음. 조회와 검증은 저장소 스냅샷 기준.</p>
 *
 * <p>details는 JSON 기본 타입으로 정규화된 뒤 PHI 마스킹을 거쳐 저장. userId, resourceId 등
 * 식별자 필드는 마스킹하지 않음.</p>
 */
@Slf4j
public class AuditTrail {

    private static final Logger FALLBACK = LoggerFactory.getLogger(ComplianceLogger.FALLBACK_LOGGER_NAME);

    private final AuditStore store;
    private final PhiFilter filter;
    private final ComplianceMetrics metrics;
    private final Clock clock;
    private final AuditJsonCodec codec = new AuditJsonCodec();
    private final ReentrantLock lock = new ReentrantLock();

    private volatile String lastHash;

    public AuditTrail(AuditStore store, PhiFilter filter) {
        this(store, filter, ComplianceMetrics.getInstance(), Clock.systemUTC());
    }

    public AuditTrail(AuditStore store, PhiFilter filter, ComplianceMetrics metrics, Clock clock) {
        this.store = store;
        this.filter = filter;
        this.metrics = metrics;
        this.clock = clock;

        List<AuditEntry> existing = store.snapshot();
        this.lastHash = existing.isEmpty()
                ? store.anchorHash()
                : existing.get(existing.size() - 1).getEntryHash();
    }

    /**
     * 감사 기록 추가.
     *
     * @param status "SUCCESS" 또는 "FAILURE" (대소문자 무시)
     * @return 체인에 연결된 엔트리. 저장소 실패 시에도 반환되며 이 경우 lastHash는 유지됨
     * @throws AuditValidationException status 인식 불가, 필수 필드 공백, details 직렬화 불가
     */
    public AuditEntry logAction(String action, String resourceType, String resourceId,
                                String userId, String status, Map<String, ?> details) {
        AuditStatus parsed = AuditStatus.parse(status)
                .orElseThrow(() -> new AuditValidationException("status",
                        "Unknown audit status: '" + status + "' (expected SUCCESS or FAILURE)"));
        return logAction(action, resourceType, resourceId, userId, parsed, details);
    }

    public AuditEntry logAction(String action, String resourceType, String resourceId,
                                String userId, AuditStatus status, Map<String, ?> details) {
        requireNonBlank("action", action);
        requireNonBlank("resourceType", resourceType);
        requireNonBlank("resourceId", resourceId);
        if (status == null) {
            throw new AuditValidationException("status", "status must not be null");
        }

        Map<String, Object> sanitized = sanitizeDetails(details);

        lock.lock();
        try {
            AuditEntry unsigned = AuditEntry.builder()
                    .entryId(UUID.randomUUID().toString())
                    .timestamp(clock.instant())
                    .action(action)
                    .resourceType(resourceType)
                    .resourceId(resourceId)
                    .userId(userId)
                    .status(status)
                    .details(sanitized)
                    .previousHash(lastHash)
                    .build();

            AuditEntry entry = unsigned.toBuilder()
                    .entryHash(AuditHasher.computeEntryHash(unsigned))
                    .build();

            try {
                store.append(entry);
                lastHash = entry.getEntryHash();
                metrics.recordAuditAppend();
            } catch (RuntimeException e) {
                metrics.recordAuditAppendFailure();
                FALLBACK.error("Audit entry not persisted, chain tip unchanged: {}", codec.toJsonLine(entry), e);
            }
            return entry;
        } finally {
            lock.unlock();
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, ?> details) {
        Map<String, Object> normalized = codec.normalizeDetails(details);
        return (Map<String, Object>) filter.filterStructured(normalized).value();
    }

    private static void requireNonBlank(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new AuditValidationException(field, field + " must not be blank");
        }
    }

    public boolean verifyIntegrity() {
        return verifyIntegrityReport().valid();
    }

    /** 체인 검증 결과 (처음 어긋난 위치 포함) */
    public IntegrityReport verifyIntegrityReport() {
        String anchor;
        List<AuditEntry> entries;
        lock.lock();
        try {
            anchor = store.anchorHash();
            entries = store.snapshot();
        } finally {
            lock.unlock();
        }

        IntegrityReport report = AuditChainVerifier.verify(entries, anchor);
        if (!report.valid()) {
            metrics.recordIntegrityFailure();
            log.error("Audit chain integrity violation at index {}: {} (expected={}, actual={})",
                    report.firstBrokenIndex(), report.failure(), report.expectedHash(), report.actualHash());
        }
        return report;
    }

    public List<AuditEntry> getEntriesByUser(String userId) {
        return select(entry -> Objects.equals(userId, entry.getUserId()));
    }

    public List<AuditEntry> getEntriesForResource(String resourceType, String resourceId) {
        return select(entry -> Objects.equals(resourceType, entry.getResourceType())
                && Objects.equals(resourceId, entry.getResourceId()));
    }

    public List<AuditEntry> getEntriesByAction(String action) {
        return select(entry -> Objects.equals(action, entry.getAction()));
    }

    /** 최신순 최대 count건. count <= 0이면 빈 목록. */
    public List<AuditEntry> getLatestEntries(int count) {
        if (count <= 0) {
            return List.of();
        }
        List<AuditEntry> entries = store.snapshot();
        int from = Math.max(0, entries.size() - count);
        List<AuditEntry> latest = new ArrayList<>(entries.subList(from, entries.size()));
        Collections.reverse(latest);
        return List.copyOf(latest);
    }

    private List<AuditEntry> select(Predicate<AuditEntry> predicate) {
        return store.snapshot().stream()
                .filter(predicate)
                .toList();
    }

    /** append 순서의 JSON 배열 */
    public String exportJson() {
        return codec.toJson(store.snapshot());
    }

    /**
     * 현재 체인을 아카이브로 내보내고 저장소를 비움. 새 anchor는 현재 lastHash.
     *
     * @return 작성된 아카이브 경로, 엔트리가 없으면 empty
     * @throws AuditArchiveException 체인이 손상되었거나 아카이브 쓰기 실패 시
     */
    public Optional<Path> archive(AuditArchiver archiver) {
        lock.lock();
        try {
            List<AuditEntry> entries = store.snapshot();
            if (entries.isEmpty()) {
                return Optional.empty();
            }

            String anchor = store.anchorHash();
            IntegrityReport report = AuditChainVerifier.verify(entries, anchor);
            if (!report.valid()) {
                metrics.recordIntegrityFailure();
                throw new AuditArchiveException("Refusing to archive a broken audit chain (index "
                        + report.firstBrokenIndex() + ", " + report.failure() + ")");
            }

            String tip = entries.get(entries.size() - 1).getEntryHash();
            Path archived = archiver.write(anchor, tip, entries);
            store.rotate(tip);
            lastHash = tip;
            log.info("Audit chain archived: {} entries, new anchor={}", entries.size(), tip);
            return Optional.of(archived);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        return store.size();
    }

    public String getLastHash() {
        return lastHash;
    }

    public String getAnchorHash() {
        return store.anchorHash();
    }
}
