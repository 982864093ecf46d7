package com.ids.keycloak.gate.authorization;

import com.ids.keycloak.gate.authentication.SessionAuthentication;
import com.ids.keycloak.gate.exception.AuthenticationRequiredException;
import java.util.List;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.authentication.InsufficientAuthenticationException;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

/**
 * 세션에 저장된 역할로 요청 접근을 결정하는 {@link AuthorizationManager}입니다.
 * <p>
 * 세션 인증이 없거나 역할이 비어 있으면 {@link InsufficientAuthenticationException}을 던져
 * AuthenticationEntryPoint(401)로 처리되게 하고, 필요한 역할이 부족하면 거부 결정을 반환하여
 * AccessDeniedHandler(403)로 처리되게 합니다.
 * </p>
 */
@Slf4j
public final class SessionRoleAuthorizationManager implements AuthorizationManager<RequestAuthorizationContext> {

    private final List<String> requiredRoles;
    private final boolean rolesRequired;

    private SessionRoleAuthorizationManager(List<String> requiredRoles, boolean rolesRequired) {
        this.requiredRoles = requiredRoles;
        this.rolesRequired = rolesRequired;
    }

    /**
     * 세션 인증(identity)만 요구합니다.
     */
    public static SessionRoleAuthorizationManager requireLogin() {
        return new SessionRoleAuthorizationManager(List.of(), false);
    }

    /**
     * 세션 역할이 주어진 역할을 모두 포함할 것을 요구합니다. 추가 역할은 허용됩니다.
     */
    public static SessionRoleAuthorizationManager requireRoles(String... roles) {
        return new SessionRoleAuthorizationManager(List.of(roles), true);
    }

    @Override
    public AuthorizationDecision check(Supplier<Authentication> authentication, RequestAuthorizationContext context) {
        Authentication current = authentication.get();
        if (!(current instanceof SessionAuthentication sessionAuthentication)) {
            throw new InsufficientAuthenticationException("세션 인증 정보가 없습니다.",
                new AuthenticationRequiredException());
        }

        if (!rolesRequired) {
            return new AuthorizationDecision(true);
        }

        List<String> roles = sessionAuthentication.getRoles();
        if (roles.isEmpty()) {
            throw new InsufficientAuthenticationException("세션에 역할 정보가 없습니다.",
                new AuthenticationRequiredException());
        }

        boolean granted = roles.containsAll(requiredRoles);
        if (!granted) {
            log.debug("[Authorization] 역할 부족. required: {}, actual: {}, uri: {}",
                requiredRoles, roles, context.getRequest().getRequestURI());
        }
        return new AuthorizationDecision(granted);
    }

    @Override
    public String toString() {
        return rolesRequired ? "requireRoles" + requiredRoles : "requireLogin";
    }
}
