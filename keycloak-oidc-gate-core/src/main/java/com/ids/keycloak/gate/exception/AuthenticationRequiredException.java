package com.ids.keycloak.gate.exception;

public class AuthenticationRequiredException extends KeycloakGateException {

    public AuthenticationRequiredException() {
        super(ErrorCode.AUTHENTICATION_REQUIRED);
    }

    public AuthenticationRequiredException(String message) {
        super(ErrorCode.AUTHENTICATION_REQUIRED, message);
    }
}
