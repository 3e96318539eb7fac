package io.github.hongjungwan.phiaudit.core.sink;

import io.github.hongjungwan.phiaudit.api.domain.LogRecord;
import io.github.hongjungwan.phiaudit.core.internal.LogRecordSerializer;
import io.github.hongjungwan.phiaudit.spi.LogSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * SLF4J로 JSON 한 줄씩 출력하는 기본 sink. correlation ID는 MDC(correlationId)에도 설정.
 *
 * CRITICAL은 SLF4J에 해당 레벨이 없으므로 ERROR + CRITICAL 마커로 출력.
 */
public class Slf4jLogSink implements LogSink {

    public static final String DEFAULT_LOGGER_NAME = "io.github.hongjungwan.phiaudit.records";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    static final Marker CRITICAL_MARKER = MarkerFactory.getMarker("CRITICAL");

    private final Logger delegate;
    private final LogRecordSerializer serializer;

    public Slf4jLogSink() {
        this(DEFAULT_LOGGER_NAME, new LogRecordSerializer());
    }

    public Slf4jLogSink(String loggerName, LogRecordSerializer serializer) {
        this(LoggerFactory.getLogger(loggerName), serializer);
    }

    Slf4jLogSink(Logger delegate, LogRecordSerializer serializer) {
        this.delegate = delegate;
        this.serializer = serializer;
    }

    @Override
    public void accept(LogRecord record) {
        String json = serializer.toJson(record);
        MDC.put(CORRELATION_ID_MDC_KEY, record.getCorrelationId());
        try {
            switch (record.getLevel()) {
                case DEBUG -> delegate.debug(json);
                case INFO -> delegate.info(json);
                case WARNING -> delegate.warn(json);
                case ERROR -> delegate.error(json);
                case CRITICAL -> delegate.error(CRITICAL_MARKER, json);
            }
        } finally {
            MDC.remove(CORRELATION_ID_MDC_KEY);
        }
    }

    @Override
    public String getName() {
        return "slf4j:" + delegate.getName();
    }
}
