package io.github.hongjungwan.phiaudit.starter;

import io.github.hongjungwan.phiaudit.api.ComplianceLoggerFactory;
import io.github.hongjungwan.phiaudit.api.annotation.AuditedAction;
import io.github.hongjungwan.phiaudit.api.config.ComplianceLogConfig;
import io.github.hongjungwan.phiaudit.api.domain.AuditEntry;
import io.github.hongjungwan.phiaudit.api.domain.AuditStatus;
import io.github.hongjungwan.phiaudit.api.domain.LogLevel;
import io.github.hongjungwan.phiaudit.core.audit.AuditArchiver;
import io.github.hongjungwan.phiaudit.core.audit.AuditTrail;
import io.github.hongjungwan.phiaudit.core.audit.FileAuditStore;
import io.github.hongjungwan.phiaudit.core.audit.InMemoryAuditStore;
import io.github.hongjungwan.phiaudit.core.masking.PhiFilter;
import io.github.hongjungwan.phiaudit.core.sink.AsyncLogSink;
import io.github.hongjungwan.phiaudit.spi.AuditStore;
import io.github.hongjungwan.phiaudit.spi.LogSink;
import io.github.hongjungwan.phiaudit.starter.aop.AuditUserExtractor;
import io.github.hongjungwan.phiaudit.starter.aop.AuditedActionAspect;
import io.github.hongjungwan.phiaudit.test.RecordingLogSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static io.github.hongjungwan.phiaudit.test.AuditEntryAssert.assertThatEntry;
import static io.github.hongjungwan.phiaudit.test.LogRecordAssert.assertThatRecord;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ComplianceLogAutoConfiguration 테스트")
class ComplianceLogAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ComplianceLogAutoConfiguration.class));

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        ComplianceLoggerFactory.reset();
    }

    @Nested
    @DisplayName("기본 빈 등록")
    class Defaults {

        @Test
        @DisplayName("기본 설정으로 모든 빈이 등록되어야 한다")
        void shouldRegisterDefaultBeans() {
            contextRunner.run(context -> {
                assertThat(context).hasSingleBean(ComplianceLogConfig.class);
                assertThat(context).hasSingleBean(PhiFilter.class);
                assertThat(context).hasSingleBean(LogSink.class);
                assertThat(context).hasSingleBean(ComplianceLoggerFactory.class);
                assertThat(context).hasSingleBean(AuditTrail.class);
                assertThat(context).hasSingleBean(AuditArchiver.class);
                assertThat(context).hasSingleBean(AuditedActionAspect.class);
                assertThat(context).hasSingleBean(AuditUserExtractor.class);
                assertThat(context.getBean(AuditStore.class)).isInstanceOf(InMemoryAuditStore.class);

                assertThat(ComplianceLoggerFactory.getDefault())
                        .isSameAs(context.getBean(ComplianceLoggerFactory.class));
            });
        }

        @Test
        @DisplayName("enabled=false 시 아무것도 등록하지 않는다")
        void shouldBackOffWhenDisabled() {
            contextRunner
                    .withPropertyValues("phi-audit.enabled=false")
                    .run(context -> assertThat(context).doesNotHaveBean(ComplianceLoggerFactory.class));
        }

        @Test
        @DisplayName("audit.enabled=false 시 Aspect를 등록하지 않는다")
        void shouldSkipAspectWhenAuditDisabled() {
            contextRunner
                    .withPropertyValues("phi-audit.audit.enabled=false")
                    .run(context -> {
                        assertThat(context).doesNotHaveBean(AuditedActionAspect.class);
                        assertThat(context).hasSingleBean(AuditTrail.class);
                    });
        }
    }

    @Nested
    @DisplayName("Properties 바인딩")
    class Binding {

        @Test
        @DisplayName("설정값이 ComplianceLogConfig로 전달되어야 한다")
        void shouldBindProperties() {
            contextRunner
                    .withPropertyValues(
                            "phi-audit.minimum-level=WARNING",
                            "phi-audit.async-enabled=true",
                            "phi-audit.buffer-size=16",
                            "phi-audit.custom-categories.employeeId=EMP-\\d{6}",
                            "phi-audit.sink.failure-threshold=5",
                            "phi-audit.audit.store-path=" + tempDir.resolve("audit.jsonl"),
                            "phi-audit.audit.archive-directory=" + tempDir.resolve("archive"))
                    .run(context -> {
                        ComplianceLogConfig config = context.getBean(ComplianceLogConfig.class);
                        assertThat(config.getMinimumLevel()).isEqualTo(LogLevel.WARNING);
                        assertThat(config.getBufferSize()).isEqualTo(16);
                        assertThat(config.getSinkFailureThreshold()).isEqualTo(5);
                        assertThat(config.getPhiCategories()).extracting(c -> c.name()).containsExactly("employeeId");

                        assertThat(context.getBean(LogSink.class)).isInstanceOf(AsyncLogSink.class);
                        assertThat(context.getBean(AuditStore.class)).isInstanceOf(FileAuditStore.class);
                        assertThat(context.getBean(PhiFilter.class).mask("id EMP-123456"))
                                .isEqualTo("id [REDACTED_EMPLOYEEID]");
                        assertThat(context.getBean(AuditArchiver.class).getDirectory())
                                .isEqualTo(tempDir.resolve("archive"));
                    });
        }

        @Test
        @DisplayName("사용자 정의 LogSink가 있으면 그것을 사용해야 한다")
        void shouldUseUserDefinedSink() {
            contextRunner
                    .withUserConfiguration(RecordingSinkConfiguration.class)
                    .run(context -> {
                        ComplianceLoggerFactory factory = context.getBean(ComplianceLoggerFactory.class);
                        factory.getLogger("test").info("patient kim@example.com", Map.of("ward", "ICU"));

                        RecordingLogSink sink = context.getBean(RecordingLogSink.class);
                        assertThatRecord(sink.last())
                                .hasMessage("patient [REDACTED_EMAIL]")
                                .hasFieldValue("ward", "ICU")
                                .containsNoPhi();
                    });
        }
    }

    @Nested
    @DisplayName("@AuditedAction 프록시")
    class AuditedActionProxy {

        @Test
        @DisplayName("어노테이션 메서드 호출이 감사 체인에 기록되어야 한다")
        void shouldRecordAnnotatedMethod() {
            contextRunner
                    .withUserConfiguration(ModelServiceConfiguration.class)
                    .withBean(AuditUserExtractor.class, () -> () -> "dr.lee")
                    .run(context -> {
                        ModelService service = context.getBean(ModelService.class);

                        String result = service.infer("m-1", "triage");

                        assertThat(result).isEqualTo("ok:m-1");
                        AuditTrail trail = context.getBean(AuditTrail.class);
                        List<AuditEntry> entries = trail.getEntriesByAction("INFERENCE_COMPLETED");
                        assertThat(entries).hasSize(1);
                        assertThatEntry(entries.get(0))
                                .isGenesis()
                                .hasResource("MODEL", "m-1")
                                .hasUserId("dr.lee")
                                .hasDetail("reason", "purpose=triage")
                                .hasValidHash();
                        assertThat(trail.verifyIntegrity()).isTrue();
                    });
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("failOnBrokenChain 시 손상된 체인이면 기동에 실패해야 한다")
        void shouldFailStartupOnBrokenChain() {
            contextRunner
                    .withPropertyValues("phi-audit.audit.fail-on-broken-chain=true")
                    .withBean(AuditStore.class, () -> new InMemoryAuditStore("f".repeat(64), List.of(brokenEntry())))
                    .run(context -> assertThat(context).hasFailed());
        }

        @Test
        @DisplayName("기본값은 손상된 체인이어도 기동을 계속한다")
        void shouldStartWithBrokenChainByDefault() {
            contextRunner
                    .withBean(AuditStore.class, () -> new InMemoryAuditStore("f".repeat(64), List.of(brokenEntry())))
                    .run(context -> {
                        assertThat(context).hasNotFailed();
                        assertThat(context.getBean(AuditTrail.class).verifyIntegrity()).isFalse();
                    });
        }

        private AuditEntry brokenEntry() {
            return AuditEntry.builder()
                    .entryId("e-1")
                    .timestamp(Instant.EPOCH)
                    .action("LOGIN")
                    .resourceType("USER")
                    .resourceId("u1")
                    .status(AuditStatus.SUCCESS)
                    .previousHash("0".repeat(64))
                    .entryHash("0".repeat(64))
                    .build();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class RecordingSinkConfiguration {

        @Bean
        RecordingLogSink recordingLogSink() {
            return new RecordingLogSink();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class ModelServiceConfiguration {

        @Bean
        ModelService modelService() {
            return new ModelService();
        }
    }

    static class ModelService {

        @AuditedAction(action = "INFERENCE_COMPLETED", resourceType = "MODEL", reason = "purpose=#{#purpose}")
        public String infer(String modelId, String purpose) {
            return "ok:" + modelId;
        }
    }
}
