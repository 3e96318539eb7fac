package io.github.hongjungwan.phiaudit.core.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.hongjungwan.phiaudit.api.domain.LogRecord;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * LogRecord JSON 직렬화. 레코드 한 건 = JSON 객체 한 줄, 호출자 필드는 최상위에 병합.
 */
public class LogRecordSerializer {

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public LogRecordSerializer() {
        this.objectMapper = createObjectMapper();
    }

    /** sink 및 필드 정규화에서 공용으로 쓰는 설정 */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /** JSON 한 줄 (개행 없음) */
    public String toJson(LogRecord record) {
        try {
            return objectMapper.writeValueAsString(record.toJsonMap());
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize log record", e);
        }
    }

    /** UTF-8 바이트 */
    public byte[] toBytes(LogRecord record) {
        return toJson(record).getBytes(StandardCharsets.UTF_8);
    }

    /** JSON 한 줄을 평면 Map으로 파싱 */
    public Map<String, Object> parse(String json) {
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to parse log record", e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public static class SerializationException extends RuntimeException {
        public SerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
