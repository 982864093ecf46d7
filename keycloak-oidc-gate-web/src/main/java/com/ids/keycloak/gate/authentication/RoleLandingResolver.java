package com.ids.keycloak.gate.authentication;

import static com.ids.keycloak.gate.config.KeycloakGateConstants.ADMIN_ROLE;
import static com.ids.keycloak.gate.config.KeycloakGateConstants.ADMIN_URL;
import static com.ids.keycloak.gate.config.KeycloakGateConstants.NO_ROLE_URL;
import static com.ids.keycloak.gate.config.KeycloakGateConstants.USERS_ROLE;
import static com.ids.keycloak.gate.config.KeycloakGateConstants.USER_URL;

import java.util.Collection;

/**
 * 로그인 직후 역할에 따라 이동할 경로를 결정합니다.
 * admin 역할이 users 역할보다 우선합니다.
 */
public class RoleLandingResolver {

    public String resolve(Collection<String> roles) {
        if (roles.contains(ADMIN_ROLE)) {
            return ADMIN_URL;
        }
        if (roles.contains(USERS_ROLE)) {
            return USER_URL;
        }
        return NO_ROLE_URL;
    }
}
