package io.github.hongjungwan.phiaudit.spi;

import io.github.hongjungwan.phiaudit.api.domain.LogRecord;

/**
 * 로그 레코드 목적지. 콘솔, 파일, 외부 수집기 등.
 *
 * <p>accept()가 던지는 예외는 로거와 {@code ResilientLogSink}가 잡아서 집계하며
 * 비즈니스 호출자에게 전파되지 않음.</p>
 */
public interface LogSink extends AutoCloseable {

    /** 레코드 한 건 수신 */
    void accept(LogRecord record);

    /** 버퍼링된 레코드 flush */
    default void flush() {
    }

    @Override
    default void close() {
        flush();
    }

    default String getName() {
        return getClass().getSimpleName();
    }
}
