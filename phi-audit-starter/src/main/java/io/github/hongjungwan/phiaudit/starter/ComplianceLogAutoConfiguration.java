package io.github.hongjungwan.phiaudit.starter;

import io.github.hongjungwan.phiaudit.api.ComplianceLoggerFactory;
import io.github.hongjungwan.phiaudit.api.config.ComplianceLogConfig;
import io.github.hongjungwan.phiaudit.api.domain.IntegrityReport;
import io.github.hongjungwan.phiaudit.api.domain.PhiCategory;
import io.github.hongjungwan.phiaudit.core.audit.AuditArchiver;
import io.github.hongjungwan.phiaudit.core.audit.AuditTrail;
import io.github.hongjungwan.phiaudit.core.audit.FileAuditStore;
import io.github.hongjungwan.phiaudit.core.audit.InMemoryAuditStore;
import io.github.hongjungwan.phiaudit.core.internal.ComplianceMetrics;
import io.github.hongjungwan.phiaudit.core.masking.PhiFilter;
import io.github.hongjungwan.phiaudit.core.sink.LogSinks;
import io.github.hongjungwan.phiaudit.spi.AuditStore;
import io.github.hongjungwan.phiaudit.spi.LogSink;
import io.github.hongjungwan.phiaudit.starter.aop.AuditUserExtractor;
import io.github.hongjungwan.phiaudit.starter.aop.AuditedActionAspect;
import io.github.hongjungwan.phiaudit.starter.aop.SecurityContextUserExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.context.annotation.Import;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * PHI Audit SDK Spring Boot 자동 설정.
 */
@AutoConfiguration
@EnableConfigurationProperties(ComplianceLogProperties.class)
@ConditionalOnProperty(prefix = "phi-audit", name = "enabled", havingValue = "true", matchIfMissing = true)
@Import(ComplianceLogAutoConfiguration.AuditedActionConfiguration.class)
@Slf4j
public class ComplianceLogAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ComplianceLogConfig complianceLogConfig(ComplianceLogProperties properties) {
        List<PhiCategory> customCategories = properties.getCustomCategories().entrySet().stream()
                .map(entry -> PhiCategory.of(entry.getKey(), entry.getValue()))
                .toList();

        return ComplianceLogConfig.builder()
                .minimumLevel(properties.getMinimumLevel())
                .asyncEnabled(properties.isAsyncEnabled())
                .bufferSize(properties.getBufferSize())
                .shutdownTimeout(properties.getShutdownTimeout())
                .sinkFailureThreshold(properties.getSink().getFailureThreshold())
                .sinkOpenDuration(properties.getSink().getOpenDuration())
                .phiCategories(customCategories)
                .auditStorePath(properties.getAudit().getStorePath())
                .archiveDirectory(properties.getAudit().getArchiveDirectory())
                .archiveCompressionLevel(properties.getAudit().getArchiveCompressionLevel())
                .kafkaBootstrapServers(properties.getKafka().getBootstrapServers())
                .kafkaTopic(properties.getKafka().getTopic())
                .kafkaAcks(properties.getKafka().getAcks())
                .kafkaRetries(properties.getKafka().getRetries())
                .kafkaLingerMs(properties.getKafka().getLingerMs())
                .kafkaMaxBlockMs(properties.getKafka().getMaxBlockMs())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ComplianceMetrics complianceMetrics() {
        return ComplianceMetrics.getInstance();
    }

    @Bean
    @ConditionalOnMissingBean
    public PhiFilter phiFilter(ComplianceLogConfig config) {
        return new PhiFilter(config.getPhiCategories());
    }

    @Bean
    @ConditionalOnMissingBean
    public LogSink logSink(ComplianceLogConfig config, ComplianceMetrics metrics) {
        return LogSinks.create(config, metrics);
    }

    /** 정적 ComplianceLogger.getLogger() 호출도 이 팩토리를 사용하도록 기본값으로 등록 */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ComplianceLoggerFactory complianceLoggerFactory(ComplianceLogConfig config, PhiFilter filter,
                                                           LogSink sink, ComplianceMetrics metrics) {
        ComplianceLoggerFactory factory = new ComplianceLoggerFactory(config, filter, sink, metrics);
        ComplianceLoggerFactory.setDefault(factory);
        return factory;
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public AuditStore auditStore(ComplianceLogConfig config) {
        String path = config.getAuditStorePath();
        if (path != null && !path.isBlank()) {
            return new FileAuditStore(Path.of(path));
        }
        log.warn("phi-audit.audit.store-path not set - audit chain is kept in memory only");
        return new InMemoryAuditStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditTrail auditTrail(AuditStore store, PhiFilter filter, ComplianceMetrics metrics) {
        return new AuditTrail(store, filter, metrics, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditArchiver auditArchiver(ComplianceLogConfig config) {
        return new AuditArchiver(Path.of(config.getArchiveDirectory()), config.getArchiveCompressionLevel());
    }

    @Bean
    public ComplianceLogLifecycle complianceLogLifecycle(ComplianceLoggerFactory factory, AuditTrail auditTrail,
                                                         ComplianceLogProperties properties) {
        return new ComplianceLogLifecycle(factory, auditTrail, properties.getAudit());
    }

    /**
     * SDK 기동 시 감사 체인 검증, 종료 시 sink flush를 담당하는 SmartLifecycle 구현체.
     */
    static class ComplianceLogLifecycle implements SmartLifecycle {

        private final ComplianceLoggerFactory factory;
        private final AuditTrail auditTrail;
        private final ComplianceLogProperties.AuditProperties auditProperties;
        private volatile boolean running = false;

        ComplianceLogLifecycle(ComplianceLoggerFactory factory, AuditTrail auditTrail,
                               ComplianceLogProperties.AuditProperties auditProperties) {
            this.factory = factory;
            this.auditTrail = auditTrail;
            this.auditProperties = auditProperties;
        }

        @Override
        public void start() {
            log.info("Starting PHI Audit SDK (sink={})", factory.getSink().getName());

            if (auditProperties.isVerifyOnStartup()) {
                IntegrityReport report = auditTrail.verifyIntegrityReport();
                if (report.valid()) {
                    log.info("Audit chain verified: {} entries", report.entriesChecked());
                } else if (auditProperties.isFailOnBrokenChain()) {
                    throw new IllegalStateException("Audit chain integrity check failed at index "
                            + report.firstBrokenIndex() + " (" + report.failure() + ")");
                } else {
                    log.error("Audit chain integrity check failed at index {} ({}) - continuing",
                            report.firstBrokenIndex(), report.failure());
                }
            }

            running = true;
        }

        @Override
        public void stop() {
            log.info("Stopping PHI Audit SDK...");
            factory.flush();
            running = false;
            log.info("PHI Audit SDK stopped");
        }

        @Override
        public boolean isRunning() {
            return running;
        }

        @Override
        public int getPhase() {
            return Integer.MIN_VALUE + 100;
        }
    }

    /**
     * AOP 기반 @AuditedAction 지원 설정.
     * phi-audit.audit.enabled=true 시 활성화 (기본값: true)
     */
    @Configuration
    @EnableAspectJAutoProxy
    @ConditionalOnProperty(prefix = "phi-audit.audit", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class AuditedActionConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public AuditUserExtractor auditUserExtractor() {
            return new SecurityContextUserExtractor();
        }

        @Bean
        @ConditionalOnMissingBean
        public AuditedActionAspect auditedActionAspect(AuditTrail auditTrail, AuditUserExtractor userExtractor) {
            log.info("AuditedActionAspect enabled - @AuditedAction methods will be recorded in the audit chain");
            return new AuditedActionAspect(auditTrail, userExtractor);
        }
    }
}
