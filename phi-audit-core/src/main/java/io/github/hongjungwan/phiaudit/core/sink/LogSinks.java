package io.github.hongjungwan.phiaudit.core.sink;

import io.github.hongjungwan.phiaudit.api.ComplianceLogger;
import io.github.hongjungwan.phiaudit.api.config.ComplianceLogConfig;
import io.github.hongjungwan.phiaudit.core.internal.ComplianceMetrics;
import io.github.hongjungwan.phiaudit.core.internal.LogRecordSerializer;
import io.github.hongjungwan.phiaudit.core.resilience.CircuitBreaker;
import io.github.hongjungwan.phiaudit.spi.LogSink;

/**
 * 설정으로부터 sink 체인 조립.
 *
 * <pre>
 * [async] -> resilient(primary -> fallback)
 * primary: Kafka (bootstrap servers 설정 시) 또는 SLF4J
 * fallback: SLF4J fallback 로거
 * </pre>
 */
public final class LogSinks {

    private LogSinks() {
    }

    public static LogSink create(ComplianceLogConfig config, ComplianceMetrics metrics) {
        LogRecordSerializer serializer = new LogRecordSerializer();

        LogSink primary = hasKafka(config)
                ? new KafkaLogSink(config, serializer)
                : new Slf4jLogSink(Slf4jLogSink.DEFAULT_LOGGER_NAME, serializer);

        LogSink fallback = new Slf4jLogSink(ComplianceLogger.FALLBACK_LOGGER_NAME, serializer);

        CircuitBreaker breaker = CircuitBreaker.builder(primary.getName())
                .failureThreshold(config.getSinkFailureThreshold())
                .openDuration(config.getSinkOpenDuration())
                .build();

        LogSink sink = new ResilientLogSink(primary, fallback, breaker, metrics);

        if (config.isAsyncEnabled()) {
            sink = new AsyncLogSink(sink, config.getBufferSize(), config.getShutdownTimeout(), metrics);
        }
        return sink;
    }

    private static boolean hasKafka(ComplianceLogConfig config) {
        String servers = config.getKafkaBootstrapServers();
        return servers != null && !servers.isBlank();
    }
}
