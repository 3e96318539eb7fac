package io.github.hongjungwan.phiaudit.api.domain;

/**
 * 로그 심각도. severity 값이 클수록 심각.
 */
public enum LogLevel {
    DEBUG(10),
    INFO(20),
    WARNING(30),
    ERROR(40),
    CRITICAL(50);

    private final int severity;

    LogLevel(int severity) {
        this.severity = severity;
    }

    public int getSeverity() {
        return severity;
    }

    /** threshold 이상 심각도인지 확인 */
    public boolean isAtLeast(LogLevel threshold) {
        return severity >= threshold.severity;
    }
}
