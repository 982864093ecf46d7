package com.ids.keycloak.gate.config;

import java.util.List;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * OAuth 클라이언트 설정입니다.
 *
 * @param clientId     Keycloak에 등록된 클라이언트 ID (resource_access 역할 추출 키로도 사용)
 * @param clientSecret 클라이언트 시크릿 (비어 있으면 public 클라이언트로 간주)
 * @param scopes       인가 요청 시 요청할 scope 목록
 */
public record KeycloakClientProperties(
    @DefaultValue("oidc-gate-client") String clientId,
    @DefaultValue("") String clientSecret,
    @DefaultValue({"openid", "profile", "email"}) List<String> scopes
) {
}
