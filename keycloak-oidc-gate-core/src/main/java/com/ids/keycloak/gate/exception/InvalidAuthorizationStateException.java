package com.ids.keycloak.gate.exception;

public class InvalidAuthorizationStateException extends KeycloakGateException {

    /** 응답 detail 값 */
    public static final String MISMATCHING_STATE = "mismatching_state";

    public InvalidAuthorizationStateException() {
        super(ErrorCode.INVALID_AUTHORIZATION_STATE, ErrorCode.INVALID_AUTHORIZATION_STATE.getDefaultMessage(), MISMATCHING_STATE, null);
    }
}
