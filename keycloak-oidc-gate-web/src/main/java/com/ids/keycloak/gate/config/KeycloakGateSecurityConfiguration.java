package com.ids.keycloak.gate.config;

import static com.ids.keycloak.gate.authorization.SessionRoleAuthorizationManager.requireLogin;
import static com.ids.keycloak.gate.authorization.SessionRoleAuthorizationManager.requireRoles;
import static com.ids.keycloak.gate.config.KeycloakGateConstants.ADMIN_ROLE;
import static com.ids.keycloak.gate.config.KeycloakGateConstants.ADMIN_URL;
import static com.ids.keycloak.gate.config.KeycloakGateConstants.USERS_ROLE;
import static com.ids.keycloak.gate.config.KeycloakGateConstants.USER_URL;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ids.keycloak.gate.authentication.KeycloakLogoutHandler;
import com.ids.keycloak.gate.authentication.KeycloakLogoutSuccessHandler;
import com.ids.keycloak.gate.exception.KeycloakAccessDeniedHandler;
import com.ids.keycloak.gate.exception.KeycloakAuthenticationEntryPoint;
import com.ids.keycloak.gate.logging.LoggingContextAccessor;
import com.ids.keycloak.gate.logging.WebMdcContextAccessor;
import com.ids.keycloak.gate.session.KeycloakSessionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.authorization.AuthorizationManagers;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.web.SecurityFilterChain;

/**
 * 웹 보안 (Web Security) 관련 Bean 설정
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(KeycloakGateProperties.class)
@Slf4j
public class KeycloakGateSecurityConfiguration {

    public KeycloakGateSecurityConfiguration() {
        log.info("Keycloak OIDC Gate: 웹 보안 설정이 활성화되었습니다.");
    }

    @Bean
    public LoggingContextAccessor loggingContextAccessor() {
        return new WebMdcContextAccessor();
    }

    @Bean
    public KeycloakAuthenticationEntryPoint keycloakAuthenticationEntryPoint(ObjectMapper objectMapper) {
        log.debug("지원 Bean을 등록합니다: [KeycloakAuthenticationEntryPoint]");
        return new KeycloakAuthenticationEntryPoint(objectMapper);
    }

    @Bean
    public KeycloakAccessDeniedHandler keycloakAccessDeniedHandler(ObjectMapper objectMapper) {
        log.debug("지원 Bean을 등록합니다: [KeycloakAccessDeniedHandler]");
        return new KeycloakAccessDeniedHandler(objectMapper);
    }

    @Bean
    public KeycloakLogoutHandler keycloakLogoutHandler(KeycloakSessionManager sessionManager) {
        log.debug("지원 Bean을 등록합니다: [KeycloakLogoutHandler]");
        return new KeycloakLogoutHandler(sessionManager);
    }

    @Bean
    public KeycloakLogoutSuccessHandler keycloakLogoutSuccessHandler(OidcEndpoints endpoints) {
        log.debug("지원 Bean을 등록합니다: [KeycloakLogoutSuccessHandler]");
        return new KeycloakLogoutSuccessHandler(endpoints);
    }

    @Bean
    public SecurityFilterChain keycloakGateSecurityFilterChain(HttpSecurity http) throws Exception {
        log.info("핵심 Bean을 등록합니다: [SecurityFilterChain]");

        // 1. 세션 인증, 로그아웃, 예외 처리 등 핵심 설정
        http.with(KeycloakGateHttpConfigurer.keycloakGate(), Customizer.withDefaults());

        // 2. 인가 설정 - 대시보드만 역할 검사, 나머지는 공개
        http.authorizeHttpRequests(authorize -> authorize
            .requestMatchers(USER_URL).access(AuthorizationManagers.allOf(requireLogin(), requireRoles(USERS_ROLE)))
            .requestMatchers(ADMIN_URL).access(AuthorizationManagers.allOf(requireLogin(), requireRoles(ADMIN_ROLE)))
            .anyRequest().permitAll()
        );

        return http.build();
    }
}
