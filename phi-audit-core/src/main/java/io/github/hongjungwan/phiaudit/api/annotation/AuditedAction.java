package io.github.hongjungwan.phiaudit.api.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 메서드 실행을 감사 체인에 기록하는 어노테이션.
 *
 * 정상 반환 시 SUCCESS, 예외 발생 시 FAILURE 엔트리를 남김. 예외는 그대로 전파됨.
 *
 * @AuditedAction(
 *     action = "INFERENCE_COMPLETED",
 *     resourceType = "MODEL",
 *     resourceIdParam = "modelId",
 *     reason = "#{#request.purpose}"
 * )
 * public InferenceResult infer(String modelId, InferenceRequest request) { ... }
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface AuditedAction {

    /** 작업명 (예: LOGIN, INFERENCE_COMPLETED) */
    String action();

    /** 대상 리소스 유형 (예: USER, MODEL) */
    String resourceType();

    /**
     * 리소스 ID 파라미터 이름.
     * 미지정 시 id, resourceId, modelId 등 ID 형태의 파라미터를 자동 탐색.
     */
    String resourceIdParam() default "";

    /**
     * 작업 사유. details.reason으로 기록.
     * SpEL 표현식 지원: #{#paramName} 형식으로 메서드 파라미터 참조 가능.
     */
    String reason() default "";

    /** false 시 예외 발생 건은 기록하지 않음 */
    boolean recordFailure() default true;
}
