package io.github.hongjungwan.phiaudit.api.domain;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 구조화 로그 레코드. 생성 후 불변이며 sink로 전달되는 동안만 존재.
 *
 * message와 fields는 생성 시점에 이미 PHI 마스킹이 적용된 상태.
 */
@Getter
public final class LogRecord {

    /** 예약 키. 호출자 필드와 충돌 시 항상 예약 키 값이 우선. */
    public static final Set<String> RESERVED_KEYS =
            Set.of("timestamp", "level", "message", "loggerScope", "correlationId");

    private final Instant timestamp;
    private final LogLevel level;
    private final String message;
    private final String loggerScope;
    private final String correlationId;
    private final Map<String, Object> fields;

    @Builder
    private LogRecord(Instant timestamp, LogLevel level, String message, String loggerScope,
                      String correlationId, Map<String, ?> fields) {
        this.timestamp = timestamp;
        this.level = level;
        this.message = message;
        this.loggerScope = loggerScope;
        this.correlationId = correlationId;
        this.fields = ImmutableValues.freezeMap(fields);
    }

    /** 단일 필드 조회 */
    public Object getField(String key) {
        return fields.get(key);
    }

    /**
     * JSON 한 줄 형태의 평면 Map. 예약 키가 먼저 오고 호출자 필드가 뒤따름.
     */
    public Map<String, Object> toJsonMap() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("timestamp", timestamp != null ? timestamp.toString() : null);
        json.put("level", level != null ? level.name() : null);
        json.put("message", message);
        json.put("loggerScope", loggerScope);
        json.put("correlationId", correlationId);
        fields.forEach((key, value) -> {
            if (!RESERVED_KEYS.contains(key)) {
                json.put(key, value);
            }
        });
        return json;
    }

    @Override
    public String toString() {
        return "LogRecord{level=" + level + ", loggerScope=" + loggerScope
                + ", correlationId=" + correlationId + ", message=" + message + "}";
    }
}
