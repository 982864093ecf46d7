package com.ids.keycloak.gate.config;

/**
 * 애플리케이션 전반에서 사용하는 경로, 역할, 클레임 상수를 정의하는 클래스입니다.
 */
public final class KeycloakGateConstants {

    private KeycloakGateConstants() {
        // 인스턴스화 방지
    }

    // ===== 라우트 =====

    /** 랜딩 페이지 */
    public static final String HOME_URL = "/";

    /** OIDC 로그인 시작 URL */
    public static final String LOGIN_URL = "/login";

    /** Authorization Code 콜백 URL (Keycloak 클라이언트에 등록된 redirect_uri 경로와 일치해야 함) */
    public static final String CALLBACK_URL = "/callback";

    /** 프론트채널 로그아웃 URL */
    public static final String LOGOUT_URL = "/logout";

    /** 일반 사용자 대시보드 */
    public static final String USER_URL = "/user";

    /** 관리자 대시보드 */
    public static final String ADMIN_URL = "/admin";

    /** 역할이 없는 사용자의 랜딩 페이지 */
    public static final String NO_ROLE_URL = "/no-role";

    // ===== 역할 =====

    /** 관리자 역할 */
    public static final String ADMIN_ROLE = "admin";

    /** 일반 사용자 역할 */
    public static final String USERS_ROLE = "users";

    /** Spring Security 역할 접두사 */
    public static final String ROLE_PREFIX = "ROLE_";

    // ===== OIDC Claims =====

    /** 사용자 고유 식별자 클레임 */
    public static final String SUB_CLAIM = "sub";

    /** 이메일 클레임 */
    public static final String EMAIL_CLAIM = "email";

    /** 사용자 명 클레임 */
    public static final String PREFERRED_USERNAME_CLAIM = "preferred_username";

    /** ID Token nonce 클레임 */
    public static final String NONCE_CLAIM = "nonce";

    // ===== Token Response =====

    public static final String ID_TOKEN_KEY = "id_token";

    public static final String ACCESS_TOKEN_KEY = "access_token";

    // ===== End-Session 파라미터 =====

    public static final String POST_LOGOUT_REDIRECT_URI_PARAM = "post_logout_redirect_uri";

    public static final String ID_TOKEN_HINT_PARAM = "id_token_hint";
}
