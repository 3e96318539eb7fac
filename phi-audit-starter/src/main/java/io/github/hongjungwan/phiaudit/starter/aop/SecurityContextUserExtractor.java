package io.github.hongjungwan.phiaudit.starter.aop;

import lombok.extern.slf4j.Slf4j;

/**
 * Spring Security 기반 사용자 정보 추출기.
 *
 * SecurityContextHolder에서 현재 인증된 사용자 이름을 추출.
 * Spring Security가 클래스패스에 없으면 항상 ANONYMOUS.
 */
@Slf4j
public class SecurityContextUserExtractor implements AuditUserExtractor {

    private static final String SECURITY_CONTEXT_HOLDER =
            "org.springframework.security.core.context.SecurityContextHolder";
    private static final String ANONYMOUS_PRINCIPAL = "anonymousUser";

    // Spring Security 클래스 존재 여부 (런타임 체크)
    private static final boolean SPRING_SECURITY_PRESENT = isSpringSecurityPresent();

    private static boolean isSpringSecurityPresent() {
        try {
            Class.forName(SECURITY_CONTEXT_HOLDER);
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    @Override
    public String extractCurrentUser() {
        if (!SPRING_SECURITY_PRESENT) {
            return ANONYMOUS;
        }
        String user = extractFromSecurityContext();
        return user == null || user.isBlank() || ANONYMOUS_PRINCIPAL.equals(user) ? ANONYMOUS : user;
    }

    private String extractFromSecurityContext() {
        try {
            // 리플렉션으로 Spring Security 호출 (컴파일 의존성 없이)
            Object securityContext = Class.forName(SECURITY_CONTEXT_HOLDER)
                    .getMethod("getContext")
                    .invoke(null);
            if (securityContext == null) {
                return null;
            }

            Object authentication = securityContext.getClass()
                    .getMethod("getAuthentication")
                    .invoke(securityContext);
            if (authentication == null) {
                return null;
            }

            Boolean authenticated = (Boolean) authentication.getClass()
                    .getMethod("isAuthenticated")
                    .invoke(authentication);
            if (!Boolean.TRUE.equals(authenticated)) {
                return null;
            }

            // Authentication.getName()은 UserDetails, Principal, String principal 모두 처리
            return (String) authentication.getClass()
                    .getMethod("getName")
                    .invoke(authentication);

        } catch (ReflectiveOperationException | ClassCastException e) {
            log.debug("Failed to extract user from SecurityContext: {}", e.getMessage());
            return null;
        }
    }
}
