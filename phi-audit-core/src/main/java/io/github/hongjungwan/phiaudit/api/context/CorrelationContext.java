package io.github.hongjungwan.phiaudit.api.context;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * 요청 단위 correlation ID 바인딩. ThreadLocal 기반이며 프로세스 전역 상태를 두지 않음.
 *
 * <pre>{@code
 * try (CorrelationContext.Scope ignored = CorrelationContext.bind(requestId)) {
 *     logger.info("Inference started");
 *     executor.submit(CorrelationContext.wrap(task));
 * }
 * }</pre>
 */
public final class CorrelationContext {

    private static final ThreadLocal<String> CURRENT = new ThreadLocal<>();

    private CorrelationContext() {}

    /** 현재 스레드에 바인딩된 correlation ID */
    public static Optional<String> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    /** ID 바인딩. 반환된 Scope close 시 이전 바인딩 복원. */
    public static Scope bind(String correlationId) {
        String validated = requireValid(correlationId);
        String previous = CURRENT.get();
        CURRENT.set(validated);
        return () -> restore(previous);
    }

    /** 스코프 없이 현재 스레드에 바인딩. 해제는 {@link #clear()} 호출 측 책임. */
    public static void set(String correlationId) {
        CURRENT.set(requireValid(correlationId));
    }

    /** 현재 스레드 바인딩 해제 */
    public static void clear() {
        CURRENT.remove();
    }

    /** Runnable 래핑. 래핑 시점의 ID로 실행. */
    public static Runnable wrap(Runnable runnable) {
        String captured = CURRENT.get();
        return () -> {
            String previous = CURRENT.get();
            CURRENT.set(captured);
            try {
                runnable.run();
            } finally {
                restore(previous);
            }
        };
    }

    /** Callable 래핑. 래핑 시점의 ID로 실행. */
    public static <T> Callable<T> wrap(Callable<T> callable) {
        String captured = CURRENT.get();
        return () -> {
            String previous = CURRENT.get();
            CURRENT.set(captured);
            try {
                return callable.call();
            } finally {
                restore(previous);
            }
        };
    }

    /** 새 correlation ID (UUID) */
    public static String newCorrelationId() {
        return UUID.randomUUID().toString();
    }

    private static void restore(String previous) {
        if (previous == null) {
            CURRENT.remove();
        } else {
            CURRENT.set(previous);
        }
    }

    private static String requireValid(String correlationId) {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("Correlation ID must not be blank");
        }
        return correlationId;
    }

    /** Context 스코프 관리 (AutoCloseable) */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
