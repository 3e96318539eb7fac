package io.github.hongjungwan.phiaudit.api;

import io.github.hongjungwan.phiaudit.api.config.ComplianceLogConfig;
import io.github.hongjungwan.phiaudit.core.internal.ComplianceMetrics;
import io.github.hongjungwan.phiaudit.core.internal.DefaultComplianceLogger;
import io.github.hongjungwan.phiaudit.core.masking.PhiFilter;
import io.github.hongjungwan.phiaudit.core.sink.LogSinks;
import io.github.hongjungwan.phiaudit.spi.LogSink;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * ComplianceLogger 인스턴스 팩토리. 이름별 캐시, 하나의 filter/sink/config 공유.
 */
@Slf4j
public final class ComplianceLoggerFactory implements AutoCloseable {

    private static volatile ComplianceLoggerFactory defaultFactory;

    private final ConcurrentMap<String, ComplianceLogger> loggerCache = new ConcurrentHashMap<>();
    private final ComplianceLogConfig config;
    private final PhiFilter filter;
    private final LogSink sink;
    private final ComplianceMetrics metrics;
    private final Clock clock;

    public ComplianceLoggerFactory(ComplianceLogConfig config, PhiFilter filter, LogSink sink, ComplianceMetrics metrics) {
        this(config, filter, sink, metrics, Clock.systemUTC());
    }

    public ComplianceLoggerFactory(ComplianceLogConfig config, PhiFilter filter, LogSink sink,
                                   ComplianceMetrics metrics, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.filter = Objects.requireNonNull(filter, "filter");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** 설정으로부터 filter와 sink 체인을 구성 */
    public static ComplianceLoggerFactory create(ComplianceLogConfig config) {
        ComplianceMetrics metrics = ComplianceMetrics.getInstance();
        PhiFilter filter = new PhiFilter(config.getPhiCategories());
        return new ComplianceLoggerFactory(config, filter, LogSinks.create(config, metrics), metrics);
    }

    /** 이름 기반 로거 획득 또는 생성 */
    public ComplianceLogger getLogger(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Logger name must not be blank");
        }
        return loggerCache.computeIfAbsent(name,
                key -> new DefaultComplianceLogger(key, filter, sink, config.getMinimumLevel(), metrics, clock));
    }

    /** 클래스 기반 로거 획득 또는 생성 */
    public ComplianceLogger getLogger(Class<?> clazz) {
        return getLogger(clazz.getName());
    }

    public PhiFilter getFilter() {
        return filter;
    }

    public LogSink getSink() {
        return sink;
    }

    public void flush() {
        sink.flush();
    }

    @Override
    public void close() {
        loggerCache.clear();
        sink.close();
    }

    /** 프로세스 기본 팩토리. 최초 호출 시 기본 설정(SLF4J sink)으로 생성. */
    public static ComplianceLoggerFactory getDefault() {
        ComplianceLoggerFactory factory = defaultFactory;
        if (factory == null) {
            synchronized (ComplianceLoggerFactory.class) {
                factory = defaultFactory;
                if (factory == null) {
                    factory = create(ComplianceLogConfig.defaultConfig());
                    defaultFactory = factory;
                }
            }
        }
        return factory;
    }

    /** 프로세스 기본 팩토리 교체 (Spring starter 등) */
    public static void setDefault(ComplianceLoggerFactory factory) {
        defaultFactory = Objects.requireNonNull(factory, "factory");
        log.debug("Default ComplianceLoggerFactory replaced");
    }

    /** 기본 팩토리 초기화 */
    public static void reset() {
        defaultFactory = null;
    }
}
