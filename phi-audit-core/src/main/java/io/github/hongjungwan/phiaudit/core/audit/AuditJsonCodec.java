package io.github.hongjungwan.phiaudit.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.hongjungwan.phiaudit.api.AuditValidationException;
import io.github.hongjungwan.phiaudit.api.domain.AuditEntry;
import io.github.hongjungwan.phiaudit.core.masking.PhiFilter;
import io.github.hongjungwan.phiaudit.core.masking.ValueGraph;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 감사 엔트리 JSON 변환 (export 배열, 저장소 JSON lines, details 정규화).
 */
public class AuditJsonCodec {

    private static final TypeReference<List<AuditEntry>> ENTRY_LIST = new TypeReference<>() {};
    private static final TypeReference<LinkedHashMap<String, Object>> DETAILS_MAP = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public AuditJsonCodec() {
        this.objectMapper = createObjectMapper();
    }

    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);
        return mapper;
    }

    /** append 순서의 JSON 배열 */
    public String toJson(List<AuditEntry> entries) {
        try {
            return objectMapper.writeValueAsString(entries);
        } catch (JsonProcessingException e) {
            throw new CodecException("Failed to export audit entries", e);
        }
    }

    public List<AuditEntry> fromJson(String json) {
        try {
            return objectMapper.readValue(json, ENTRY_LIST);
        } catch (JsonProcessingException e) {
            throw new CodecException("Failed to parse audit export", e);
        }
    }

    public String toJsonLine(AuditEntry entry) {
        try {
            return objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new CodecException("Failed to serialize audit entry " + entry.getEntryId(), e);
        }
    }

    public AuditEntry fromJsonLine(String line) {
        try {
            return objectMapper.readValue(line, AuditEntry.class);
        } catch (JsonProcessingException e) {
            throw new CodecException("Failed to parse audit entry line", e);
        }
    }

    /**
     * details를 JSON 기본 타입(Map, List, String, Number, Boolean, null)으로 정규화.
     *
     * <p>직렬화 후 다시 읽으므로 export 후 재적재한 엔트리와 동일한 해시가 계산됨.</p>
     *
     * @throws AuditValidationException JSON으로 표현할 수 없는 값, 순환 참조, 깊이 초과 (field = "details")
     */
    public Map<String, Object> normalizeDetails(Map<String, ?> details) {
        if (details == null || details.isEmpty()) {
            return new LinkedHashMap<>();
        }
        ValueGraph.Shape shape = ValueGraph.inspect(details, PhiFilter.MAX_DEPTH);
        if (shape == ValueGraph.Shape.CYCLIC) {
            throw new AuditValidationException("details", "Audit details must not contain circular references");
        }
        if (shape == ValueGraph.Shape.TOO_DEEP) {
            throw new AuditValidationException("details",
                    "Audit details must not be nested deeper than " + PhiFilter.MAX_DEPTH + " levels");
        }
        try {
            byte[] json = objectMapper.writeValueAsBytes(details);
            return objectMapper.readValue(json, DETAILS_MAP);
        } catch (IOException e) {
            throw new AuditValidationException("details",
                    "Audit details must be JSON-serializable: " + e.getMessage(), e);
        } catch (StackOverflowError e) {
            throw new AuditValidationException("details",
                    "Audit details could not be serialized: nesting too deep", e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public static class CodecException extends RuntimeException {
        public CodecException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
