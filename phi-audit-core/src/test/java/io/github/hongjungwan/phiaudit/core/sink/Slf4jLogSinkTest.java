package io.github.hongjungwan.phiaudit.core.sink;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.github.hongjungwan.phiaudit.api.domain.LogLevel;
import io.github.hongjungwan.phiaudit.core.internal.LogRecordSerializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Slf4jLogSink 테스트")
class Slf4jLogSinkTest {

    private static final String LOGGER_NAME = "test.phiaudit.records";

    private Logger logger;
    private MdcCapturingAppender appender;
    private Slf4jLogSink sink;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(LOGGER_NAME);
        logger.setLevel(Level.DEBUG);
        appender = new MdcCapturingAppender();
        appender.start();
        logger.addAppender(appender);
        sink = new Slf4jLogSink(LOGGER_NAME, new LogRecordSerializer());
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    @Test
    @DisplayName("레코드를 JSON 한 줄로 출력해야 한다")
    void shouldWriteJson() {
        // when
        sink.accept(TestRecords.record("Admitted"));

        // then
        assertThat(appender.list).hasSize(1);
        ILoggingEvent event = appender.list.get(0);
        Map<String, Object> json = new LogRecordSerializer().parse(event.getFormattedMessage());
        assertThat(json)
                .containsEntry("message", "Admitted")
                .containsEntry("level", "INFO")
                .containsEntry("loggerScope", "test.scope")
                .containsEntry("correlationId", "corr-Admitted")
                .containsEntry("ward", "ICU");
        assertThat(event.getLevel()).isEqualTo(Level.INFO);
    }

    @Test
    @DisplayName("correlation ID를 MDC에 넣고 출력 후 제거해야 한다")
    void shouldPopulateMdc() {
        // when
        sink.accept(TestRecords.record("Admitted"));

        // then
        assertThat(appender.list.get(0).getMDCPropertyMap()).containsEntry("correlationId", "corr-Admitted");
        assertThat(MDC.get(Slf4jLogSink.CORRELATION_ID_MDC_KEY)).isNull();
    }

    @Test
    @DisplayName("레벨을 SLF4J 레벨로 매핑하고 CRITICAL은 마커를 붙여야 한다")
    void shouldMapLevels() {
        // when
        sink.accept(TestRecords.record(LogLevel.DEBUG, "d"));
        sink.accept(TestRecords.record(LogLevel.WARNING, "w"));
        sink.accept(TestRecords.record(LogLevel.CRITICAL, "c"));

        // then
        assertThat(appender.list).extracting(ILoggingEvent::getLevel)
                .containsExactly(Level.DEBUG, Level.WARN, Level.ERROR);
        assertThat(appender.list.get(2).getMarkerList()).contains(Slf4jLogSink.CRITICAL_MARKER);
    }

    @Test
    @DisplayName("이름에 로거 이름이 포함되어야 한다")
    void shouldExposeName() {
        assertThat(sink.getName()).isEqualTo("slf4j:" + LOGGER_NAME);
    }

    /** MDC는 이벤트 생성 시점에 고정되지 않으므로 append 시점에 캡처 */
    private static class MdcCapturingAppender extends ListAppender<ILoggingEvent> {
        @Override
        protected void append(ILoggingEvent event) {
            event.prepareForDeferredProcessing();
            super.append(event);
        }
    }
}
