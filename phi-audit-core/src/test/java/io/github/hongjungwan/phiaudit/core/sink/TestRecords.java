package io.github.hongjungwan.phiaudit.core.sink;

import io.github.hongjungwan.phiaudit.api.domain.LogLevel;
import io.github.hongjungwan.phiaudit.api.domain.LogRecord;

import java.time.Instant;
import java.util.Map;

final class TestRecords {

    private TestRecords() {
    }

    static LogRecord record(String message) {
        return record(LogLevel.INFO, message);
    }

    static LogRecord record(LogLevel level, String message) {
        return LogRecord.builder()
                .timestamp(Instant.parse("2024-03-01T09:30:00Z"))
                .level(level)
                .message(message)
                .loggerScope("test.scope")
                .correlationId("corr-" + message)
                .fields(Map.of("ward", "ICU"))
                .build();
    }
}
