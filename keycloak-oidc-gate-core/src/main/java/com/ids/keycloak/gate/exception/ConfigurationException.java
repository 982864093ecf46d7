package com.ids.keycloak.gate.exception;

public class ConfigurationException extends KeycloakGateException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorCode.CONFIGURATION_ERROR, message, null, cause);
    }
}
