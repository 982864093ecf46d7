package com.ids.keycloak.gate.exception;

/**
 * 애플리케이션의 모든 인증/인가 관련 예외의 최상위 클래스입니다.
 * <p>
 * {@link ErrorCode}로 HTTP 상태와 응답 코드를 결정하고,
 * detail에는 사용자에게 노출해도 되는 진단 정보(Provider 에러 코드, 응답 키 목록 등)를 담습니다.
 * </p>
 */
public class KeycloakGateException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String detail;

    /**
     * 기본 메시지를 사용하는 생성자
     * @param errorCode ErrorCode Enum
     */
    public KeycloakGateException(ErrorCode errorCode) {
        this(errorCode, errorCode.getDefaultMessage(), null, null);
    }

    /**
     * 메시지를 직접 지정하는 생성자
     * @param errorCode ErrorCode Enum
     * @param message 직접 지정할 메시지
     */
    public KeycloakGateException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    /**
     * 메시지와 detail을 지정하는 생성자 (cause 포함)
     * @param errorCode ErrorCode Enum
     * @param message 직접 지정할 메시지
     * @param detail 응답에 포함할 진단 정보 (null 가능)
     * @param cause 원인 예외 (null 가능)
     */
    public KeycloakGateException(ErrorCode errorCode, String message, String detail, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.detail = detail;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getDetail() {
        return detail;
    }
}
