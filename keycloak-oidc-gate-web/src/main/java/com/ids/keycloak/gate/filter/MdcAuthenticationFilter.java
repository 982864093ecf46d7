package com.ids.keycloak.gate.filter;

import com.ids.keycloak.gate.authentication.SessionAuthentication;
import com.ids.keycloak.gate.config.KeycloakLoggingProperties;
import com.ids.keycloak.gate.logging.LoggingContextAccessor;
import com.ids.keycloak.gate.logging.LoggingContextKeys;
import com.ids.keycloak.gate.model.SessionIdentity;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * 세션 인증 후 사용자 정보를 MDC에 추가하는 필터.
 * <p>
 * SecurityFilterChain에서 {@link SessionAuthenticationFilter} 이후에 위치해야 합니다.
 * <ul>
 *   <li>{@code userId}: sub claim</li>
 *   <li>{@code username}: preferred_username claim</li>
 * </ul>
 * <p>
 * MDC 정리는 {@link MdcRequestFilter}에서 담당합니다.
 *
 * @see MdcRequestFilter
 */
public class MdcAuthenticationFilter extends OncePerRequestFilter {

    private final LoggingContextAccessor contextAccessor;
    private final KeycloakLoggingProperties loggingProperties;

    public MdcAuthenticationFilter(LoggingContextAccessor contextAccessor, KeycloakLoggingProperties loggingProperties) {
        this.contextAccessor = contextAccessor;
        this.loggingProperties = loggingProperties;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        populateAuthenticationContext();
        chain.doFilter(request, response);
        // MDC clear는 MdcRequestFilter에서 담당
    }

    private void populateAuthenticationContext() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (!(auth instanceof SessionAuthentication sessionAuthentication)) {
            return;
        }

        SessionIdentity identity = sessionAuthentication.getIdentity();
        contextAccessor.put(LoggingContextKeys.USER_ID, identity.subject());
        if (loggingProperties.includeUsername()) {
            contextAccessor.put(LoggingContextKeys.USERNAME, identity.preferredUsername());
        }
    }
}
