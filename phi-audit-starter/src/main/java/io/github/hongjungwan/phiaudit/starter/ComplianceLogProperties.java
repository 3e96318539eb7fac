package io.github.hongjungwan.phiaudit.starter;

import io.github.hongjungwan.phiaudit.api.domain.LogLevel;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * PHI Audit SDK 설정 Properties (prefix: phi-audit).
 */
@Data
@ConfigurationProperties(prefix = "phi-audit")
public class ComplianceLogProperties {

    /** SDK 활성화 여부 */
    private boolean enabled = true;

    /** 이 레벨 미만의 레코드는 생성하지 않음 */
    private LogLevel minimumLevel = LogLevel.INFO;

    /** 비동기 sink 사용 여부 */
    private boolean asyncEnabled = false;

    /** 비동기 sink 버퍼 크기 */
    private int bufferSize = 8192;

    /** 종료 시 버퍼 flush 최대 대기 시간 */
    private Duration shutdownTimeout = Duration.ofSeconds(5);

    /**
     * 추가 PHI 카테고리 (이름 -> 정규식). 선언 순서대로 내장 카테고리 뒤에 적용.
     * 예: phi-audit.custom-categories.employeeId=EMP-\d{6}
     */
    private Map<String, String> customCategories = new LinkedHashMap<>();

    /** Sink 장애 대응 설정 */
    private SinkProperties sink = new SinkProperties();

    /** 감사 체인 설정 */
    private AuditProperties audit = new AuditProperties();

    /** Kafka 설정 */
    private KafkaProperties kafka = new KafkaProperties();

    @Data
    public static class SinkProperties {
        private int failureThreshold = 3;
        private Duration openDuration = Duration.ofSeconds(30);
    }

    @Data
    public static class AuditProperties {
        /** @AuditedAction AOP 활성화 여부 */
        private boolean enabled = true;

        /** 감사 로그 파일 경로. 미지정 시 메모리 저장소. */
        private String storePath;

        /** 기동 시 체인 검증 */
        private boolean verifyOnStartup = true;

        /** 기동 시 체인이 손상되어 있으면 기동 실패 */
        private boolean failOnBrokenChain = false;

        private String archiveDirectory = "audit/archive";

        /** Zstd 압축 레벨 (1-22) */
        private int archiveCompressionLevel = 3;
    }

    @Data
    public static class KafkaProperties {
        private String bootstrapServers;
        private String topic = "phi-audit-logs";
        private String acks = "all";
        private int retries = 3;
        private int lingerMs = 1;
        private long maxBlockMs = 5000;
    }
}
