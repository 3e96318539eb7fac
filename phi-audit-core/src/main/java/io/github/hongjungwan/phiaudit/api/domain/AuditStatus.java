package io.github.hongjungwan.phiaudit.api.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * 감사 대상 작업의 결과.
 */
public enum AuditStatus {
    SUCCESS,
    FAILURE;

    /** 대소문자 무시 파싱. 인식할 수 없는 값이면 empty. */
    public static Optional<AuditStatus> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (AuditStatus status : values()) {
            if (status.name().equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
