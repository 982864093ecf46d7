package com.ids.keycloak.gate.config;

import com.ids.keycloak.gate.exception.ConfigurationException;

/**
 * 설정으로부터 계산되는 OIDC 엔드포인트와 애플리케이션 측 고정 URL 묶음입니다.
 * <p>
 * Keycloak의 엔드포인트 규칙({@code {base}/realms/{realm}/protocol/openid-connect/...})을 따릅니다.
 * </p>
 *
 * @param authorizationUri      브라우저 리다이렉트 대상 authorize 엔드포인트
 * @param tokenUri              서버 간 코드 교환에 사용하는 token 엔드포인트
 * @param jwkSetUri             서명 검증용 certs 엔드포인트
 * @param endSessionUri         브라우저 리다이렉트 대상 logout 엔드포인트
 * @param redirectUri           Keycloak 클라이언트에 등록된 redirect_uri ({@code ${appBase}/callback})
 * @param postLogoutRedirectUri 로그아웃 후 돌아올 URL ({@code ${appBase}/})
 */
public record OidcEndpoints(
    String authorizationUri,
    String tokenUri,
    String jwkSetUri,
    String endSessionUri,
    String redirectUri,
    String postLogoutRedirectUri
) {

    private static final String OPENID_CONNECT_PATH = "/realms/%s/protocol/openid-connect";

    public static OidcEndpoints from(KeycloakGateProperties properties) {
        KeycloakProviderProperties provider = properties.provider();
        String browserRealmUrl = trimTrailingSlash(provider.browserBaseUrl()) + OPENID_CONNECT_PATH.formatted(provider.realm());
        String backendRealmUrl = trimTrailingSlash(provider.backendBaseUrl()) + OPENID_CONNECT_PATH.formatted(provider.realm());
        String appBaseUrl = trimTrailingSlash(properties.appBaseUrl());

        return new OidcEndpoints(
            browserRealmUrl + "/auth",
            backendRealmUrl + "/token",
            backendRealmUrl + "/certs",
            browserRealmUrl + "/logout",
            appBaseUrl + KeycloakGateConstants.CALLBACK_URL,
            appBaseUrl + KeycloakGateConstants.HOME_URL
        );
    }

    private static String trimTrailingSlash(String url) {
        if (url == null) {
            throw new ConfigurationException("Keycloak 또는 애플리케이션 base URL이 설정되지 않았습니다.");
        }
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
