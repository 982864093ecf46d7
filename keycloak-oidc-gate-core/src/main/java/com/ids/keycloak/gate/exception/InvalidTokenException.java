package com.ids.keycloak.gate.exception;

public class InvalidTokenException extends KeycloakGateException {

    public InvalidTokenException(String detail) {
        super(ErrorCode.INVALID_TOKEN, ErrorCode.INVALID_TOKEN.getDefaultMessage(), detail, null);
    }

    public InvalidTokenException(String detail, Throwable cause) {
        super(ErrorCode.INVALID_TOKEN, ErrorCode.INVALID_TOKEN.getDefaultMessage(), detail, cause);
    }
}
