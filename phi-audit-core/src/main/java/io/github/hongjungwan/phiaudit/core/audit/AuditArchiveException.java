package io.github.hongjungwan.phiaudit.core.audit;

/**
 * 아카이브 쓰기/읽기 실패 또는 손상된 아카이브.
 */
public class AuditArchiveException extends RuntimeException {

    public AuditArchiveException(String message) {
        super(message);
    }

    public AuditArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
