package com.ids.keycloak.gate.exception;

/**
 * Identity Provider가 OAuth 오류를 반환한 경우의 예외입니다.
 * 콜백의 error 파라미터 또는 토큰 엔드포인트의 오류 응답에서 발생합니다.
 * 사용자는 로그인을 다시 시도할 수 있습니다.
 */
public class OAuthProviderException extends KeycloakGateException {

    private final String providerErrorCode;

    public OAuthProviderException(String providerErrorCode, String description) {
        super(
            ErrorCode.OAUTH_PROVIDER_ERROR,
            description != null
                ? "Identity Provider 오류: " + providerErrorCode + " (" + description + ")"
                : "Identity Provider 오류: " + providerErrorCode,
            providerErrorCode,
            null
        );
        this.providerErrorCode = providerErrorCode;
    }

    public String getProviderErrorCode() {
        return providerErrorCode;
    }
}
