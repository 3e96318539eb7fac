package io.github.hongjungwan.phiaudit.spi;

/**
 * 감사 저장소 I/O 실패.
 */
public class AuditStoreException extends RuntimeException {

    public AuditStoreException(String message) {
        super(message);
    }

    public AuditStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
