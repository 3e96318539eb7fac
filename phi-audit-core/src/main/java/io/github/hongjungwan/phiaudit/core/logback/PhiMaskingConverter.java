package io.github.hongjungwan.phiaudit.core.logback;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import io.github.hongjungwan.phiaudit.core.masking.PhiFilter;

/**
 * Logback 메시지 PHI 마스킹 컨버터. SDK 진단 로그와 fallback 로그에도 PHI가 남지 않도록 사용.
 *
 * <pre>{@code
 * <conversionRule conversionWord="phiMsg"
 *                 converterClass="io.github.hongjungwan.phiaudit.core.logback.PhiMaskingConverter"/>
 * <pattern>%d %-5level %logger - %phiMsg%n</pattern>
 * }</pre>
 */
public class PhiMaskingConverter extends ClassicConverter {

    private static final PhiFilter FILTER = new PhiFilter();

    @Override
    public String convert(ILoggingEvent event) {
        String message = event.getFormattedMessage();
        if (message == null || message.isEmpty()) {
            return "";
        }
        return FILTER.mask(message);
    }
}
