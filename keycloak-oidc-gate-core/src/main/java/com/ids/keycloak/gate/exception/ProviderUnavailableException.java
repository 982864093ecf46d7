package com.ids.keycloak.gate.exception;

/**
 * Identity Provider 엔드포인트와 통신하지 못한 경우의 예외입니다.
 * 타임아웃이면 504, 그 외 네트워크 오류나 Provider 5xx 응답이면 502로 응답합니다.
 */
public class ProviderUnavailableException extends KeycloakGateException {

    public ProviderUnavailableException(boolean timeout, String message, Throwable cause) {
        super(timeout ? ErrorCode.PROVIDER_TIMEOUT : ErrorCode.PROVIDER_UNAVAILABLE, message, null, cause);
    }

    public boolean isTimeout() {
        return getErrorCode() == ErrorCode.PROVIDER_TIMEOUT;
    }
}
