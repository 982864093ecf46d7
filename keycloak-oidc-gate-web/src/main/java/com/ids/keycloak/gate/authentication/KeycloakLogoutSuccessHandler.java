package com.ids.keycloak.gate.authentication;

import static com.ids.keycloak.gate.config.KeycloakGateConstants.ID_TOKEN_HINT_PARAM;
import static com.ids.keycloak.gate.config.KeycloakGateConstants.POST_LOGOUT_REDIRECT_URI_PARAM;

import com.ids.keycloak.gate.config.OidcEndpoints;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.nio.charset.StandardCharsets;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.authentication.logout.SimpleUrlLogoutSuccessHandler;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * 로그아웃 후 Keycloak end-session 엔드포인트로 리다이렉트하는 핸들러입니다.
 * <p>
 * post_logout_redirect_uri는 항상 포함하고, id_token_hint는 세션에 ID Token이 있었던 경우에만 포함합니다.
 * </p>
 */
@Slf4j
public class KeycloakLogoutSuccessHandler extends SimpleUrlLogoutSuccessHandler {

    private final OidcEndpoints endpoints;

    public KeycloakLogoutSuccessHandler(OidcEndpoints endpoints) {
        this.endpoints = endpoints;
    }

    @Override
    protected String determineTargetUrl(HttpServletRequest request, HttpServletResponse response,
                                        Authentication authentication) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(endpoints.endSessionUri())
            .queryParam(POST_LOGOUT_REDIRECT_URI_PARAM, endpoints.postLogoutRedirectUri());

        Object idToken = request.getAttribute(KeycloakLogoutHandler.ID_TOKEN_HINT_ATTR);
        if (idToken instanceof String hint && !hint.isBlank()) {
            builder.queryParam(ID_TOKEN_HINT_PARAM, hint);
        }

        String targetUrl = builder.encode(StandardCharsets.UTF_8).build().toUriString();
        log.debug("[LogoutSuccessHandler] end-session 리다이렉트. id_token_hint 포함: {}", idToken != null);
        return targetUrl;
    }
}
