package io.github.hongjungwan.phiaudit.api.config;

import io.github.hongjungwan.phiaudit.api.domain.LogLevel;
import io.github.hongjungwan.phiaudit.api.domain.PhiCategory;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.util.List;

/**
 * SDK 설정. 로그 레벨, 비동기 sink, Circuit Breaker, PHI 카테고리, 감사 저장소, Kafka 설정 포함.
 */
@Getter
@Builder
public class ComplianceLogConfig {

    /** 이 레벨 미만의 레코드는 생성하지 않음 */
    @Builder.Default
    private final LogLevel minimumLevel = LogLevel.INFO;

    /** 비동기 sink 사용 여부 */
    @Builder.Default
    private final boolean asyncEnabled = false;

    /** 비동기 sink 버퍼 크기. 가득 차면 가장 오래된 레코드부터 버림. */
    @Builder.Default
    private final int bufferSize = 8192;

    /** 종료 시 버퍼 flush 최대 대기 시간 */
    @Builder.Default
    private final Duration shutdownTimeout = Duration.ofSeconds(5);

    /** Circuit Breaker 연속 실패 임계치 */
    @Builder.Default
    private final int sinkFailureThreshold = 3;

    /** Circuit Breaker OPEN 유지 시간 */
    @Builder.Default
    private final Duration sinkOpenDuration = Duration.ofSeconds(30);

    /** 추가 PHI 카테고리. 내장 카테고리 뒤에 순서대로 적용. */
    @Builder.Default
    private final List<PhiCategory> phiCategories = List.of();

    /** 감사 로그 파일 경로. null이면 메모리 저장소 사용. */
    private final String auditStorePath;

    /** 감사 로그 아카이브 디렉토리 */
    @Builder.Default
    private final String archiveDirectory = "audit/archive";

    /** 아카이브 Zstd 압축 레벨 (1-22) */
    @Builder.Default
    private final int archiveCompressionLevel = 3;

    /** Kafka 브로커 주소. null이면 SLF4J sink 사용. */
    private final String kafkaBootstrapServers;

    /** Kafka 토픽명 */
    @Builder.Default
    private final String kafkaTopic = "phi-audit-logs";

    /** Kafka acks 설정: "all", "1", "0" */
    @Builder.Default
    private final String kafkaAcks = "all";

    /** Kafka 재시도 횟수 */
    @Builder.Default
    private final int kafkaRetries = 3;

    /** Kafka linger 시간 (ms) */
    @Builder.Default
    private final int kafkaLingerMs = 1;

    /** Kafka send() 최대 블로킹 시간 (ms) */
    @Builder.Default
    private final long kafkaMaxBlockMs = 5000;

    /** 개발용 기본 설정 */
    public static ComplianceLogConfig defaultConfig() {
        return ComplianceLogConfig.builder().build();
    }

    /** 프로덕션 설정: Kafka 전송 + 비동기 sink + 파일 감사 저장소 */
    public static ComplianceLogConfig productionConfig(String kafkaBootstrapServers, String auditStorePath) {
        return ComplianceLogConfig.builder()
                .minimumLevel(LogLevel.INFO)
                .asyncEnabled(true)
                .kafkaBootstrapServers(kafkaBootstrapServers)
                .kafkaAcks("all")
                .auditStorePath(auditStorePath)
                .build();
    }
}
