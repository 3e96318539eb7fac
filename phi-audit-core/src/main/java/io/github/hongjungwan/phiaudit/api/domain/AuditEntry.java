package io.github.hongjungwan.phiaudit.api.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.Map;

/**
 * 해시 체인으로 연결된 감사 기록 한 건.
 *
 * <p>entryHash는 previousHash와 나머지 필드의 정규(canonical) 직렬화로부터 계산되며
 * 생성 이후 변경되지 않음. details는 PHI 마스킹이 끝난 JSON 호환 값만 담음.</p>
 */
@Getter
@JsonPropertyOrder({"entryId", "timestamp", "action", "resourceType", "resourceId",
        "userId", "status", "details", "previousHash", "entryHash"})
@JsonDeserialize(builder = AuditEntry.AuditEntryBuilder.class)
public final class AuditEntry {

    private final String entryId;
    private final Instant timestamp;
    private final String action;
    private final String resourceType;
    private final String resourceId;

    /** 시스템 작업이면 null */
    private final String userId;

    private final AuditStatus status;
    private final Map<String, Object> details;
    private final String previousHash;
    private final String entryHash;

    @Builder(toBuilder = true)
    private AuditEntry(String entryId, Instant timestamp, String action, String resourceType,
                       String resourceId, String userId, AuditStatus status, Map<String, ?> details,
                       String previousHash, String entryHash) {
        this.entryId = entryId;
        this.timestamp = timestamp;
        this.action = action;
        this.resourceType = resourceType;
        this.resourceId = resourceId;
        this.userId = userId;
        this.status = status;
        this.details = ImmutableValues.freezeMap(details);
        this.previousHash = previousHash;
        this.entryHash = entryHash;
    }

    @Override
    public String toString() {
        return "AuditEntry{entryId=" + entryId + ", action=" + action + ", resourceType=" + resourceType
                + ", resourceId=" + resourceId + ", status=" + status + ", entryHash=" + entryHash + "}";
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AuditEntryBuilder {
    }
}
