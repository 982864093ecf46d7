package com.ids.keycloak.gate.session;

import com.ids.keycloak.gate.model.AuthenticatedSession;
import com.ids.keycloak.gate.model.SessionIdentity;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * 인증 관련 세션 데이터를 관리하는 매니저 클래스입니다.
 * <p>
 * 인증 상태는 {@link AuthenticatedSession} 하나의 속성으로 저장/조회/삭제합니다.
 * 따라서 identity, roles, ID Token이 부분적으로만 기록되는 경우는 없습니다.
 * </p>
 */
@Slf4j
public class KeycloakSessionManager {

    /** 세션에 인증 상태를 저장하기 위한 키 */
    public static final String AUTHENTICATED_SESSION_ATTR = "KEYCLOAK_GATE_AUTHENTICATED_SESSION";

    // =====================
    // 인증 상태 저장
    // =====================

    /**
     * 콜백 성공 후 인증 상태를 세션에 기록하고 세션 ID를 교체합니다(세션 고정 공격 방지).
     *
     * @param request              현재 요청
     * @param authenticatedSession 기록할 인증 상태
     */
    public void establish(HttpServletRequest request, AuthenticatedSession authenticatedSession) {
        HttpSession session = request.getSession(true);
        session.setAttribute(AUTHENTICATED_SESSION_ATTR, authenticatedSession);
        String newSessionId = request.changeSessionId();
        log.debug("[SessionManager] 인증 상태 저장 완료. subject: {}, roles: {}, session ID 교체: {}",
            authenticatedSession.identity().subject(), authenticatedSession.roles(), newSessionId);
    }

    // =====================
    // 인증 상태 조회
    // =====================

    /**
     * 세션에서 인증 상태를 조회합니다.
     *
     * @param session HTTP 세션 (null 가능)
     * @return 인증 상태 (Optional)
     */
    public Optional<AuthenticatedSession> getAuthenticatedSession(HttpSession session) {
        if (session == null) {
            return Optional.empty();
        }
        Object value = session.getAttribute(AUTHENTICATED_SESSION_ATTR);
        if (value instanceof AuthenticatedSession authenticatedSession) {
            return Optional.of(authenticatedSession);
        }
        return Optional.empty();
    }

    public Optional<SessionIdentity> getIdentity(HttpSession session) {
        return getAuthenticatedSession(session).map(AuthenticatedSession::identity);
    }

    /**
     * 로그아웃 시 id_token_hint로 사용할 원본 ID Token을 조회합니다.
     */
    public Optional<String> getRawIdToken(HttpSession session) {
        return getAuthenticatedSession(session).map(AuthenticatedSession::rawIdToken);
    }

    // =====================
    // 세션 무효화
    // =====================

    /**
     * 세션을 무효화합니다. 인증 상태와 진행 중인 인가 요청 정보가 모두 삭제됩니다.
     *
     * @param session HTTP 세션
     */
    public void invalidateSession(HttpSession session) {
        if (session == null) {
            log.debug("[SessionManager] 무효화할 세션이 없습니다.");
            return;
        }
        String sessionId = session.getId();
        try {
            session.invalidate();
            log.debug("[SessionManager] 세션 무효화 완료. Session ID: {}", sessionId);
        } catch (IllegalStateException e) {
            log.debug("[SessionManager] 이미 무효화된 세션입니다. Session ID: {}", sessionId);
        }
    }
}
