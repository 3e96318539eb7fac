package io.github.hongjungwan.phiaudit.core.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hongjungwan.phiaudit.api.ComplianceLogger;
import io.github.hongjungwan.phiaudit.api.context.CorrelationContext;
import io.github.hongjungwan.phiaudit.api.domain.LogLevel;
import io.github.hongjungwan.phiaudit.api.domain.LogRecord;
import io.github.hongjungwan.phiaudit.core.masking.PhiFilter;
import io.github.hongjungwan.phiaudit.core.masking.ValueGraph;
import io.github.hongjungwan.phiaudit.spi.LogSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 기본 ComplianceLogger 구현. 필드 정규화 → PHI 마스킹 → LogRecord 생성 → sink 전달.
 *
 * 레코드 생성이나 sink 전달 중 발생한 예외는 메트릭에 집계되고 fallback 로거로 보고되며
 * 호출자에게 전파되지 않음.
 */
public class DefaultComplianceLogger implements ComplianceLogger {

    static final String DEGRADED_FIELDS_KEY = "_degradedFields";

    private static final Logger FALLBACK = LoggerFactory.getLogger(FALLBACK_LOGGER_NAME);
    private static final ObjectMapper FIELD_MAPPER = LogRecordSerializer.createObjectMapper();

    private final String name;
    private final PhiFilter filter;
    private final LogSink sink;
    private final LogLevel minimumLevel;
    private final ComplianceMetrics metrics;
    private final Clock clock;

    public DefaultComplianceLogger(String name, PhiFilter filter, LogSink sink, LogLevel minimumLevel,
                                   ComplianceMetrics metrics, Clock clock) {
        this.name = name;
        this.filter = filter;
        this.sink = sink;
        this.minimumLevel = minimumLevel;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public void setCorrelationId(String correlationId) {
        CorrelationContext.set(correlationId);
    }

    @Override
    public void debug(String message) {
        log(LogLevel.DEBUG, message, null);
    }

    @Override
    public void debug(String message, Map<String, ?> fields) {
        log(LogLevel.DEBUG, message, fields);
    }

    @Override
    public void info(String message) {
        log(LogLevel.INFO, message, null);
    }

    @Override
    public void info(String message, Map<String, ?> fields) {
        log(LogLevel.INFO, message, fields);
    }

    @Override
    public void warning(String message) {
        log(LogLevel.WARNING, message, null);
    }

    @Override
    public void warning(String message, Map<String, ?> fields) {
        log(LogLevel.WARNING, message, fields);
    }

    @Override
    public void error(String message) {
        log(LogLevel.ERROR, message, null);
    }

    @Override
    public void error(String message, Map<String, ?> fields) {
        log(LogLevel.ERROR, message, fields);
    }

    @Override
    public void critical(String message) {
        log(LogLevel.CRITICAL, message, null);
    }

    @Override
    public void critical(String message, Map<String, ?> fields) {
        log(LogLevel.CRITICAL, message, fields);
    }

    @Override
    public void exception(String message, Throwable throwable) {
        exception(message, throwable, null);
    }

    @Override
    public void exception(String message, Throwable throwable, Map<String, ?> fields) {
        if (!isEnabled(LogLevel.ERROR)) {
            return;
        }
        Map<String, Object> merged = copyOf(fields);
        if (throwable != null) {
            merged.put("exception", describe(throwable));
            merged.put("stackTrace", stackTraceOf(throwable));
        }
        log(LogLevel.ERROR, message, merged);
    }

    @Override
    public void audit(String action, String resource, String userId, String status) {
        audit(action, resource, userId, status, null);
    }

    @Override
    public void audit(String action, String resource, String userId, String status, Map<String, ?> fields) {
        if (!isEnabled(LogLevel.INFO)) {
            return;
        }
        Map<String, Object> merged = copyOf(fields);
        merged.put("eventType", "AUDIT");
        merged.put("action", action);
        merged.put("resource", resource);
        merged.put("userId", userId);
        merged.put("status", status);
        log(LogLevel.INFO, "Audit: " + action + " on " + resource, merged);
    }

    @Override
    public boolean isEnabled(LogLevel level) {
        return level.isAtLeast(minimumLevel);
    }

    @Override
    public String getName() {
        return name;
    }

    private void log(LogLevel level, String message, Map<String, ?> fields) {
        if (!isEnabled(level)) {
            return;
        }

        LogRecord record;
        try {
            record = buildRecord(level, message, fields);
        } catch (RuntimeException | StackOverflowError e) {
            metrics.recordBuildFailure();
            FALLBACK.error("Failed to build {} record for logger '{}': {}",
                    level, name, e.getClass().getName());
            return;
        }

        try {
            sink.accept(record);
            metrics.recordEmitted(level);
        } catch (RuntimeException e) {
            metrics.recordSinkFailure();
            FALLBACK.warn("Sink '{}' rejected {} record [correlationId={}]: {} ({})",
                    sink.getName(), level, record.getCorrelationId(), record.getMessage(),
                    e.getClass().getName());
        }
    }

    LogRecord buildRecord(LogLevel level, String message, Map<String, ?> fields) {
        Instant timestamp = clock.instant();
        String correlationId = CorrelationContext.current().orElseGet(CorrelationContext::newCorrelationId);

        Map<String, Object> normalized = new LinkedHashMap<>();
        List<String> degraded = new ArrayList<>();
        if (fields != null) {
            for (Map.Entry<String, ?> entry : fields.entrySet()) {
                String key = String.valueOf(entry.getKey());
                if (LogRecord.RESERVED_KEYS.contains(key)) {
                    continue;
                }
                normalized.put(key, normalizeValue(key, entry.getValue(), degraded));
            }
        }

        @SuppressWarnings("unchecked")
        Map<String, Object> sanitized = (Map<String, Object>) filter.filterStructured(normalized).value();
        if (!degraded.isEmpty()) {
            sanitized.put(DEGRADED_FIELDS_KEY, Collections.unmodifiableList(degraded));
        }

        return LogRecord.builder()
                .timestamp(timestamp)
                .level(level)
                .message(filter.mask(String.valueOf(message)))
                .loggerScope(name)
                .correlationId(correlationId)
                .fields(sanitized)
                .build();
    }

    /**
     * JSON 호환 값으로 변환. 불가능하면 문자열 대체 후 degraded에 키 기록.
     * 순환 참조는 변환을 시도하지 않고 자리표시 문자열로 대체.
     */
    private Object normalizeValue(String key, Object value, List<String> degraded) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (ValueGraph.inspect(value, PhiFilter.MAX_DEPTH) == ValueGraph.Shape.CYCLIC) {
            degraded.add(key);
            return "<cyclic " + value.getClass().getName() + ">";
        }
        try {
            return FIELD_MAPPER.convertValue(value, Object.class);
        } catch (IllegalArgumentException | StackOverflowError e) {
            degraded.add(key);
            return stringify(value);
        }
    }

    private static String stringify(Object value) {
        try {
            return String.valueOf(value);
        } catch (RuntimeException | StackOverflowError e) {
            return "<unrepresentable " + value.getClass().getName() + ">";
        }
    }

    private static Map<String, Object> copyOf(Map<String, ?> fields) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (fields != null) {
            copy.putAll(fields);
        }
        return copy;
    }

    private static String describe(Throwable throwable) {
        return throwable.getClass().getName() + ": " + throwable.getMessage();
    }

    private static String stackTraceOf(Throwable throwable) {
        StringWriter writer = new StringWriter();
        throwable.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
