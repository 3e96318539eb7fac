package io.github.hongjungwan.phiaudit.api;

/**
 * 감사 기록 요청의 입력 오류. 호출자가 직접 처리해야 하므로 삼키지 않고 동기적으로 전달됨.
 */
public class AuditValidationException extends RuntimeException {

    private final String field;

    public AuditValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public AuditValidationException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /** 문제가 된 입력 필드명 */
    public String getField() {
        return field;
    }
}
