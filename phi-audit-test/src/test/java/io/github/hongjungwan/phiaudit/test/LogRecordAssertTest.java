package io.github.hongjungwan.phiaudit.test;

import io.github.hongjungwan.phiaudit.api.ComplianceLogger;
import io.github.hongjungwan.phiaudit.api.ComplianceLoggerFactory;
import io.github.hongjungwan.phiaudit.api.config.ComplianceLogConfig;
import io.github.hongjungwan.phiaudit.api.context.CorrelationContext;
import io.github.hongjungwan.phiaudit.api.domain.LogLevel;
import io.github.hongjungwan.phiaudit.api.domain.LogRecord;
import io.github.hongjungwan.phiaudit.api.domain.PhiCategory;
import io.github.hongjungwan.phiaudit.core.internal.ComplianceMetrics;
import io.github.hongjungwan.phiaudit.core.masking.PhiFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static io.github.hongjungwan.phiaudit.test.LogRecordAssert.assertThatRecord;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LogRecordAssert 테스트")
class LogRecordAssertTest {

    private RecordingLogSink sink;
    private ComplianceLogger logger;

    @BeforeEach
    void setUp() {
        sink = new RecordingLogSink();
        ComplianceLoggerFactory factory = new ComplianceLoggerFactory(
                ComplianceLogConfig.defaultConfig(), new PhiFilter(), sink, new ComplianceMetrics());
        logger = factory.getLogger("ward.icu");
    }

    @Test
    @DisplayName("로거가 만든 레코드의 마스킹을 검증할 수 있다")
    void shouldAssertMaskedRecord() {
        try (CorrelationContext.Scope ignored = CorrelationContext.bind("req-1")) {
            logger.info("Patient kim@example.com admitted", Map.of("ssn", "123-45-6789", "ward", "ICU"));
        }

        assertThatRecord(sink.last())
                .hasLevel(LogLevel.INFO)
                .hasLoggerScope("ward.icu")
                .hasCorrelationId("req-1")
                .hasMessage("Patient [REDACTED_EMAIL] admitted")
                .messageContains("admitted")
                .hasField("ssn").isMaskedAs(PhiCategory.SSN)
                .hasField("ward").isNotMasked()
                .hasFieldValue("ward", "ICU")
                .doesNotHaveField("patientName")
                .containsNoPhi();
    }

    @Test
    @DisplayName("마스킹되지 않은 PHI가 있으면 실패해야 한다")
    void shouldFailOnRawPhi() {
        LogRecord leaked = LogRecord.builder()
                .timestamp(Instant.EPOCH)
                .level(LogLevel.INFO)
                .message("ok")
                .loggerScope("raw")
                .correlationId("c")
                .fields(Map.of("contact", "kim@example.com"))
                .build();

        assertThatThrownBy(() -> assertThatRecord(leaked).containsNoPhi())
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("contact");
        assertThatThrownBy(() -> assertThatRecord(leaked).hasField("contact").isMasked())
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("to be masked");
    }

    @Test
    @DisplayName("필드 선택 없이 마스킹 검증하면 실패해야 한다")
    void shouldRequireFieldSelection() {
        logger.info("plain");

        assertThatThrownBy(() -> assertThatRecord(sink.last()).isMasked())
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("hasField()");
    }

    @Test
    @DisplayName("RecordingLogSink는 레벨별로 레코드를 조회할 수 있다")
    void shouldFilterRecordsByLevel() {
        logger.info("one");
        logger.error("two");
        logger.debug("dropped by minimum level");

        assertThat(sink.size()).isEqualTo(2);
        assertThat(sink.getRecords(LogLevel.ERROR)).extracting(LogRecord::getMessage).containsExactly("two");

        sink.clear();
        assertThatThrownBy(sink::last).isInstanceOf(IllegalStateException.class);
    }
}
