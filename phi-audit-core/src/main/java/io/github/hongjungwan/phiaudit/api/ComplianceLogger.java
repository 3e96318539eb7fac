package io.github.hongjungwan.phiaudit.api;

import io.github.hongjungwan.phiaudit.api.domain.LogLevel;

import java.util.Map;

/**
 * 구조화 컴플라이언스 로거. 모든 레코드에 correlation ID와 PHI 마스킹이 자동 적용됨.
 *
 * <p>로그 호출은 호출자에게 예외를 던지지 않음. 표현할 수 없는 필드 값은 문자열로 대체되고
 * {@code _degradedFields} 메타 필드에 키가 기록됨.</p>
 *
 * <p>{@link #audit} 은 INFO 레벨 관측용 태그일 뿐이며 해시 체인 감사 로그({@code AuditTrail})에는
 * 기록하지 않음.</p>
 */
public interface ComplianceLogger {

    /** SDK 내부 장애 보고용 SLF4J 로거 이름 */
    String FALLBACK_LOGGER_NAME = "io.github.hongjungwan.phiaudit.fallback";

    /** 클래스 기반 로거 획득 (프로세스 기본 팩토리) */
    static ComplianceLogger getLogger(Class<?> clazz) {
        return ComplianceLoggerFactory.getDefault().getLogger(clazz);
    }

    /** 이름 기반 로거 획득 (프로세스 기본 팩토리) */
    static ComplianceLogger getLogger(String name) {
        return ComplianceLoggerFactory.getDefault().getLogger(name);
    }

    /**
     * 현재 실행 스코프(스레드)에 correlation ID 바인딩.
     *
     * @throws IllegalArgumentException id가 비어 있는 경우
     */
    void setCorrelationId(String correlationId);

    void debug(String message);

    void debug(String message, Map<String, ?> fields);

    void info(String message);

    void info(String message, Map<String, ?> fields);

    void warning(String message);

    void warning(String message, Map<String, ?> fields);

    void error(String message);

    void error(String message, Map<String, ?> fields);

    void critical(String message);

    void critical(String message, Map<String, ?> fields);

    /** ERROR 레벨. exception, stackTrace 필드 추가. */
    void exception(String message, Throwable throwable);

    void exception(String message, Throwable throwable, Map<String, ?> fields);

    /** INFO 레벨, eventType=AUDIT 태그 */
    void audit(String action, String resource, String userId, String status);

    void audit(String action, String resource, String userId, String status, Map<String, ?> fields);

    boolean isEnabled(LogLevel level);

    String getName();
}
