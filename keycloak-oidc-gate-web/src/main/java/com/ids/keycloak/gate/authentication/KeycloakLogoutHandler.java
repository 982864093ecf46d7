package com.ids.keycloak.gate.authentication;

import com.ids.keycloak.gate.session.KeycloakSessionManager;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.authentication.logout.LogoutHandler;

/**
 * 프론트채널 로그아웃 시 세션에 저장된 ID Token을 꺼내 요청 속성으로 넘기고,
 * 세션 전체를 무효화하는 핸들러입니다.
 * <p>
 * ID Token은 {@link KeycloakLogoutSuccessHandler}가 end-session 요청의 id_token_hint로 사용합니다.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class KeycloakLogoutHandler implements LogoutHandler {

    /** 로그아웃 성공 핸들러로 ID Token을 전달하기 위한 요청 속성 키 */
    public static final String ID_TOKEN_HINT_ATTR = KeycloakLogoutHandler.class.getName() + ".ID_TOKEN_HINT";

    private final KeycloakSessionManager sessionManager;

    @Override
    public void logout(HttpServletRequest request, HttpServletResponse response, Authentication authentication) {
        log.debug("[LogoutHandler] 로그아웃 처리를 시작합니다.");

        HttpSession session = request.getSession(false);
        if (session == null) {
            log.debug("[LogoutHandler] 무효화할 세션이 없습니다.");
            return;
        }

        sessionManager.getRawIdToken(session)
            .ifPresentOrElse(
                idToken -> request.setAttribute(ID_TOKEN_HINT_ATTR, idToken),
                () -> log.debug("[LogoutHandler] 세션에 ID Token이 없습니다.")
            );

        sessionManager.invalidateSession(session);
        log.debug("[LogoutHandler] 로그아웃 처리 완료.");
    }
}
