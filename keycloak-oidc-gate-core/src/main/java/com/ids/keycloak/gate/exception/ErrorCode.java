package com.ids.keycloak.gate.exception;

public enum ErrorCode {

    // 400 Bad Request
    OAUTH_PROVIDER_ERROR("OAUTH_PROVIDER_ERROR", 400, "Identity Provider가 OAuth 오류를 반환했습니다."),
    INVALID_AUTHORIZATION_STATE("INVALID_AUTHORIZATION_STATE", 400, "인가 요청의 state 값이 일치하지 않거나 만료되었습니다."),
    MISSING_TOKENS("MISSING_TOKENS", 400, "토큰 응답에 기대한 토큰이 포함되어 있지 않습니다."),
    INVALID_TOKEN("INVALID_TOKEN", 400, "토큰을 해석하거나 검증할 수 없습니다."),

    // 401 Unauthorized
    AUTHENTICATION_REQUIRED("AUTHENTICATION_REQUIRED", 401, "이 리소스에 접근하려면 로그인이 필요합니다."),

    // 403 Forbidden
    ACCESS_DENIED("ACCESS_DENIED", 403, "이 리소스에 접근할 권한이 없습니다."),

    // 500 Internal Server Error
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", 500, "보안 설정 중 구성 오류가 발생했습니다."),

    // 502 / 504 Identity Provider 통신 실패
    PROVIDER_UNAVAILABLE("PROVIDER_UNAVAILABLE", 502, "Identity Provider와 통신할 수 없습니다. 잠시 후 다시 시도해 주세요."),
    PROVIDER_TIMEOUT("PROVIDER_TIMEOUT", 504, "Identity Provider 응답 시간이 초과되었습니다. 잠시 후 다시 시도해 주세요.");

    private final String code;
    private final int httpStatus;
    private final String defaultMessage;

    ErrorCode(String code, int httpStatus, String defaultMessage) {
        this.code = code;
        this.httpStatus = httpStatus;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
