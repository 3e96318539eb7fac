package io.github.hongjungwan.phiaudit.starter.aop;

import io.github.hongjungwan.phiaudit.api.annotation.AuditedAction;
import io.github.hongjungwan.phiaudit.api.domain.AuditStatus;
import io.github.hongjungwan.phiaudit.core.audit.AuditTrail;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * {@link AuditedAction} 메서드 실행을 감사 체인에 기록하는 Aspect.
 *
 * 정상 반환 시 SUCCESS, 예외 시 FAILURE 엔트리를 남기고 예외는 그대로 전파.
 * 감사 기록 자체의 실패는 비즈니스 호출에 영향을 주지 않음.
 *
 * resourceId 추출 우선순위:
 * - resourceIdParam으로 지정된 파라미터
 * - id, resourceId, modelId 등 ID 이름의 파라미터
 * - 이름에 "id"가 포함된 파라미터
 * - "UNKNOWN"
 */
@Aspect
@Slf4j
public class AuditedActionAspect {

    static final String UNKNOWN_RESOURCE = "UNKNOWN";

    private static final ExpressionParser SPEL_PARSER = new SpelExpressionParser();

    // ID 파라미터 자동 탐색을 위한 패턴
    private static final Set<String> ID_PARAM_PATTERNS = Set.of(
            "id", "resourceid", "modelid", "patientid", "userid", "recordid"
    );

    private final AuditTrail auditTrail;
    private final AuditUserExtractor userExtractor;

    public AuditedActionAspect(AuditTrail auditTrail, AuditUserExtractor userExtractor) {
        this.auditTrail = auditTrail;
        this.userExtractor = userExtractor;
    }

    @Around("@annotation(auditedAction)")
    public Object recordAction(ProceedingJoinPoint joinPoint, AuditedAction auditedAction) throws Throwable {
        long startTime = System.currentTimeMillis();

        Object result;
        try {
            result = joinPoint.proceed();
        } catch (Throwable e) {
            if (auditedAction.recordFailure()) {
                record(joinPoint, auditedAction, AuditStatus.FAILURE, System.currentTimeMillis() - startTime, e);
            }
            throw e;
        }

        record(joinPoint, auditedAction, AuditStatus.SUCCESS, System.currentTimeMillis() - startTime, null);
        return result;
    }

    private void record(ProceedingJoinPoint joinPoint, AuditedAction auditedAction, AuditStatus status,
                        long durationMs, Throwable error) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("method", joinPoint.getSignature().getName());
        details.put("durationMs", durationMs);

        String reason = extractReason(joinPoint, auditedAction);
        if (!reason.isEmpty()) {
            details.put("reason", reason);
        }
        if (error != null) {
            details.put("errorType", error.getClass().getSimpleName());
            details.put("errorMessage", error.getMessage());
        }

        try {
            auditTrail.logAction(auditedAction.action(), auditedAction.resourceType(),
                    extractResourceId(joinPoint, auditedAction), userExtractor.extractCurrentUser(),
                    status, details);
        } catch (RuntimeException e) {
            log.warn("Failed to record @AuditedAction {} on {}: {}",
                    auditedAction.action(), joinPoint.getSignature().getName(), e.getMessage());
        }
    }

    private String extractResourceId(ProceedingJoinPoint joinPoint, AuditedAction auditedAction) {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String[] paramNames = signature.getParameterNames();
        Object[] args = joinPoint.getArgs();

        if (paramNames == null || args == null) {
            return UNKNOWN_RESOURCE;
        }

        if (!auditedAction.resourceIdParam().isEmpty()) {
            for (int i = 0; i < paramNames.length; i++) {
                if (paramNames[i].equals(auditedAction.resourceIdParam()) && args[i] != null) {
                    return String.valueOf(args[i]);
                }
            }
        }

        for (int i = 0; i < paramNames.length; i++) {
            if (ID_PARAM_PATTERNS.contains(paramNames[i].toLowerCase(Locale.ROOT)) && args[i] != null) {
                return String.valueOf(args[i]);
            }
        }

        for (int i = 0; i < paramNames.length; i++) {
            if (paramNames[i].toLowerCase(Locale.ROOT).contains("id") && args[i] != null) {
                return String.valueOf(args[i]);
            }
        }

        return UNKNOWN_RESOURCE;
    }

    /** reason 평가. #{...} 구간은 SpEL로 평가하고 실패 시 원문 유지. */
    private String extractReason(ProceedingJoinPoint joinPoint, AuditedAction auditedAction) {
        String expression = auditedAction.reason();
        if (!expression.contains("#{")) {
            return expression;
        }

        StandardEvaluationContext context = new StandardEvaluationContext();
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String[] paramNames = signature.getParameterNames();
        Object[] args = joinPoint.getArgs();
        if (paramNames != null && args != null) {
            for (int i = 0; i < paramNames.length; i++) {
                context.setVariable(paramNames[i], args[i]);
            }
        }

        StringBuilder result = new StringBuilder();
        int lastEnd = 0;
        int start;
        while ((start = expression.indexOf("#{", lastEnd)) != -1) {
            result.append(expression, lastEnd, start);

            int end = expression.indexOf('}', start);
            if (end == -1) {
                // 닫히지 않은 표현식은 나머지를 원문 그대로
                lastEnd = start;
                break;
            }

            String spelExpr = expression.substring(start + 2, end);
            try {
                Object value = SPEL_PARSER.parseExpression(spelExpr).getValue(context);
                result.append(value);
            } catch (ParseException | EvaluationException e) {
                log.debug("SpEL evaluation failed for '{}': {}", spelExpr, e.getMessage());
                result.append("#{").append(spelExpr).append('}');
            }
            lastEnd = end + 1;
        }
        result.append(expression.substring(lastEnd));
        return result.toString();
    }
}
