package com.ids.keycloak.gate.config;

import java.time.Duration;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Identity Provider(Keycloak) 접속 설정입니다.
 * <p>
 * 브라우저가 보는 주소와 서버가 보는 주소가 다를 수 있으므로(컨테이너 네트워크 등) 두 base URL을 분리합니다.
 * authorize / end-session 엔드포인트는 browser base, token / certs 엔드포인트는 backend base를 사용합니다.
 * </p>
 *
 * @param browserBaseUrl   브라우저에서 접근하는 Keycloak base URL
 * @param backendBaseUrl   서버 간 통신에 사용하는 Keycloak base URL
 * @param realm            Keycloak Realm 이름
 * @param connectTimeout   토큰 엔드포인트 연결 타임아웃
 * @param readTimeout      토큰 엔드포인트 응답 타임아웃
 * @param verifySignatures true면 Realm JWK Set으로 토큰 서명을 검증, false(기본값)면 서명 검증 없이 클레임만 해석
 */
public record KeycloakProviderProperties(
    @DefaultValue("http://localhost:8080") String browserBaseUrl,
    @DefaultValue("http://host.docker.internal:8080") String backendBaseUrl,
    @DefaultValue("demo-realm") String realm,
    @DefaultValue("3s") Duration connectTimeout,
    @DefaultValue("5s") Duration readTimeout,
    @DefaultValue("false") boolean verifySignatures
) {
}
