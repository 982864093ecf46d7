package com.ids.keycloak.gate.web;

import static com.ids.keycloak.gate.config.KeycloakGateConstants.ADMIN_ROLE;
import static com.ids.keycloak.gate.config.KeycloakGateConstants.ADMIN_URL;
import static com.ids.keycloak.gate.config.KeycloakGateConstants.HOME_URL;
import static com.ids.keycloak.gate.config.KeycloakGateConstants.NO_ROLE_URL;
import static com.ids.keycloak.gate.config.KeycloakGateConstants.USER_URL;

import com.ids.keycloak.gate.authentication.SessionAuthentication;
import com.ids.keycloak.gate.config.KeycloakGateProperties;
import com.ids.keycloak.gate.model.SessionIdentity;
import com.ids.keycloak.gate.session.KeycloakSessionManager;
import com.ids.keycloak.gate.web.view.DashboardView;
import com.ids.keycloak.gate.web.view.LandingView;
import com.ids.keycloak.gate.web.view.NoRoleView;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 랜딩, 대시보드, 역할 없음 페이지의 뷰 모델을 반환합니다.
 * 대시보드 접근 제어는 SecurityFilterChain의 역할 검사에서 이미 끝난 상태입니다.
 */
@RestController
@RequiredArgsConstructor
public class PageController {

    private static final String USER_MODE = "user";
    private static final String DEFAULT_DISPLAY_NAME = "user";

    private final KeycloakGateProperties properties;
    private final KeycloakSessionManager sessionManager;

    @GetMapping(HOME_URL)
    public LandingView landing(HttpServletRequest request) {
        Optional<SessionIdentity> identity = sessionManager.getIdentity(request.getSession(false));
        return new LandingView(
            properties.provider().realm(),
            properties.provider().browserBaseUrl(),
            identity.map(SessionIdentity::subject).orElse(null),
            identity.map(SessionIdentity::displayName).orElse(null)
        );
    }

    @GetMapping(USER_URL)
    public DashboardView userDashboard(SessionAuthentication authentication) {
        return dashboard(USER_MODE, authentication);
    }

    @GetMapping(ADMIN_URL)
    public DashboardView adminDashboard(SessionAuthentication authentication) {
        return dashboard(ADMIN_ROLE, authentication);
    }

    @GetMapping(NO_ROLE_URL)
    public NoRoleView noRole(HttpServletRequest request) {
        return new NoRoleView(
            sessionManager.getIdentity(request.getSession(false))
                .map(SessionIdentity::displayName)
                .orElse(null)
        );
    }

    private DashboardView dashboard(String mode, SessionAuthentication authentication) {
        String displayName = Optional.ofNullable(authentication.getIdentity().displayName())
            .orElse(DEFAULT_DISPLAY_NAME);
        return new DashboardView(mode, displayName, authentication.getRoles());
    }
}
