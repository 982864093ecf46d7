package com.ids.keycloak.gate.filter;

import com.ids.keycloak.gate.authentication.SessionAuthentication;
import com.ids.keycloak.gate.model.AuthenticatedSession;
import com.ids.keycloak.gate.session.KeycloakSessionManager;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * HTTP 세션에 저장된 인증 상태를 {@link SessionAuthentication}으로 복원하여 SecurityContext에 설정하는 필터입니다.
 * <p>
 * 토큰 검증이나 갱신은 하지 않습니다. 세션에 인증 상태가 없으면 아무것도 설정하지 않으며,
 * 이후 인가 단계에서 401로 처리됩니다. 새 세션을 만들지 않습니다.
 * </p>
 */
@Slf4j
public class SessionAuthenticationFilter extends OncePerRequestFilter {

    private final KeycloakSessionManager sessionManager;

    public SessionAuthenticationFilter(KeycloakSessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        Optional<AuthenticatedSession> authenticatedSession =
            sessionManager.getAuthenticatedSession(request.getSession(false));

        authenticatedSession.ifPresent(state -> {
            SessionAuthentication authentication = new SessionAuthentication(state.identity(), state.roles());
            SecurityContext context = SecurityContextHolder.createEmptyContext();
            context.setAuthentication(authentication);
            SecurityContextHolder.setContext(context);
            log.debug("[SessionAuthFilter] 세션 인증 복원. subject: {}, roles: {}",
                state.identity().subject(), state.roles());
        });

        chain.doFilter(request, response);
    }
}
