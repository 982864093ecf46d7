package com.ids.keycloak.gate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Keycloak OIDC Gate 설정을 통합 관리하는 Root Properties 입니다.
 * <p>
 * 애플리케이션 시작 시 한 번 바인딩되는 불변 객체이며, 필요한 컴포넌트에 생성자 주입으로 전달됩니다.
 * application.yaml 예시:
 * <pre>
 * keycloak:
 *   gate:
 *     app-base-url: http://localhost:8000
 *     provider:
 *       browser-base-url: http://localhost:8080
 *       backend-base-url: http://keycloak:8080
 *       realm: demo-realm
 *     client:
 *       client-id: oidc-gate-client
 *       client-secret: secret
 *     session:
 *       secret: change-me
 *       same-site: Lax
 * </pre>
 * </p>
 *
 * @param appBaseUrl 외부에서 접근 가능한 이 애플리케이션의 base URL (redirect_uri, 로그아웃 후 이동 URL 생성에 사용)
 * @param provider   Identity Provider(Keycloak) 관련 설정
 * @param client     OAuth 클라이언트 설정
 * @param session    세션 쿠키 관련 설정
 * @param logging    MDC 로깅 관련 설정
 */
@ConfigurationProperties(prefix = "keycloak.gate")
public record KeycloakGateProperties(
    @DefaultValue("http://localhost:8000") String appBaseUrl,
    @DefaultValue KeycloakProviderProperties provider,
    @DefaultValue KeycloakClientProperties client,
    @DefaultValue KeycloakSessionProperties session,
    @DefaultValue KeycloakLoggingProperties logging
) {
}
