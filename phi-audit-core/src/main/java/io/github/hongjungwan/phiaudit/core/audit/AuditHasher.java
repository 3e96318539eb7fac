package io.github.hongjungwan.phiaudit.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.hongjungwan.phiaudit.api.domain.AuditEntry;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 감사 엔트리 해시 계산.
 *
 * <pre>
 * entryHash = SHA-256( UTF8(previousHash) || UTF8(canonicalJson) )
 * </pre>
 *
 * canonicalJson은 action, details, entryId, resourceId, resourceType, status, timestamp, userId를
 * 모든 깊이에서 키 정렬한 compact JSON. timestamp는 ISO-8601, userId null은 JSON null로 기록.
 */
public final class AuditHasher {

    /** 빈 체인의 anchor (0 64자) */
    public static final String GENESIS_HASH = "0".repeat(64);

    private static final String HASH_ALGORITHM = "SHA-256";

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private AuditHasher() {
    }

    /** entry.previousHash 기준으로 entryHash 재계산 */
    public static String computeEntryHash(AuditEntry entry) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance(HASH_ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Hash algorithm not available: " + HASH_ALGORITHM, e);
        }

        digest.update(String.valueOf(entry.getPreviousHash()).getBytes(StandardCharsets.UTF_8));
        digest.update(canonicalJson(entry).getBytes(StandardCharsets.UTF_8));

        return HexFormat.of().formatHex(digest.digest());
    }

    public static String canonicalJson(AuditEntry entry) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        canonical.put("action", entry.getAction());
        canonical.put("details", entry.getDetails());
        canonical.put("entryId", entry.getEntryId());
        canonical.put("resourceId", entry.getResourceId());
        canonical.put("resourceType", entry.getResourceType());
        canonical.put("status", entry.getStatus() != null ? entry.getStatus().name() : null);
        canonical.put("timestamp", entry.getTimestamp() != null ? entry.getTimestamp().toString() : null);
        canonical.put("userId", entry.getUserId());

        try {
            return CANONICAL_MAPPER.writeValueAsString(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to canonicalize audit entry " + entry.getEntryId(), e);
        }
    }

    /** 64자리 소문자 hex 여부 */
    public static boolean isValidHash(String hash) {
        return hash != null && hash.length() == 64 && hash.chars().allMatch(AuditHasher::isLowerHex);
    }

    private static boolean isLowerHex(int c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f');
    }
}
