package com.ids.keycloak.gate.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ids.keycloak.gate.authentication.OidcLoginFlow;
import com.ids.keycloak.gate.authentication.RoleLandingResolver;
import com.ids.keycloak.gate.client.KeycloakTokenClient;
import com.ids.keycloak.gate.session.KeycloakSessionManager;
import com.ids.keycloak.gate.token.JwkSetTokenClaimsDecoder;
import com.ids.keycloak.gate.token.TokenClaimsDecoder;
import com.ids.keycloak.gate.token.UnverifiedTokenClaimsDecoder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.oauth2.client.web.AuthorizationRequestRepository;
import org.springframework.security.oauth2.client.web.HttpSessionOAuth2AuthorizationRequestRepository;
import org.springframework.security.oauth2.core.endpoint.OAuth2AuthorizationRequest;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.web.client.RestTemplate;

/**
 * Identity Provider 통신과 OIDC 로그인 흐름 관련 Bean 설정
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class KeycloakOidcClientConfiguration {

    @Bean
    public OidcEndpoints oidcEndpoints(KeycloakGateProperties properties) {
        OidcEndpoints endpoints = OidcEndpoints.from(properties);
        log.info("OIDC 엔드포인트 구성 완료. authorization: {}, token: {}, redirect: {}",
            endpoints.authorizationUri(), endpoints.tokenUri(), endpoints.redirectUri());
        return endpoints;
    }

    @Bean
    public RestTemplate keycloakRestTemplate(RestTemplateBuilder builder, KeycloakGateProperties properties) {
        log.debug("지원 Bean을 등록합니다: [RestTemplate]");
        return builder
            .connectTimeout(properties.provider().connectTimeout())
            .readTimeout(properties.provider().readTimeout())
            .build();
    }

    @Bean
    public KeycloakTokenClient keycloakTokenClient(RestTemplate keycloakRestTemplate,
                                                   OidcEndpoints endpoints,
                                                   KeycloakGateProperties properties,
                                                   ObjectMapper objectMapper) {
        log.info("핵심 Bean을 등록합니다: [KeycloakTokenClient]");
        return new KeycloakTokenClient(keycloakRestTemplate, endpoints, properties.client(), objectMapper);
    }

    @Bean
    public TokenClaimsDecoder tokenClaimsDecoder(RestTemplate keycloakRestTemplate,
                                                 OidcEndpoints endpoints,
                                                 KeycloakGateProperties properties) {
        if (properties.provider().verifySignatures()) {
            log.info("핵심 Bean을 등록합니다: [TokenClaimsDecoder] (JWK Set 서명 검증: {})", endpoints.jwkSetUri());
            NimbusJwtDecoder jwtDecoder = NimbusJwtDecoder.withJwkSetUri(endpoints.jwkSetUri())
                .restOperations(keycloakRestTemplate)
                .build();
            return new JwkSetTokenClaimsDecoder(jwtDecoder);
        }
        log.warn("토큰 서명 검증이 비활성화되어 있습니다. 운영 환경에서는 keycloak.gate.provider.verify-signatures=true 를 권장합니다.");
        return new UnverifiedTokenClaimsDecoder();
    }

    @Bean
    public AuthorizationRequestRepository<OAuth2AuthorizationRequest> authorizationRequestRepository() {
        return new HttpSessionOAuth2AuthorizationRequestRepository();
    }

    @Bean
    public RoleLandingResolver roleLandingResolver() {
        return new RoleLandingResolver();
    }

    @Bean
    public OidcLoginFlow oidcLoginFlow(OidcEndpoints endpoints,
                                       KeycloakGateProperties properties,
                                       AuthorizationRequestRepository<OAuth2AuthorizationRequest> authorizationRequestRepository,
                                       KeycloakTokenClient tokenClient,
                                       TokenClaimsDecoder tokenClaimsDecoder,
                                       KeycloakSessionManager sessionManager,
                                       RoleLandingResolver landingResolver) {
        log.debug("지원 Bean을 등록합니다: [OidcLoginFlow]");
        return new OidcLoginFlow(endpoints, properties.client(), authorizationRequestRepository,
            tokenClient, tokenClaimsDecoder, sessionManager, landingResolver);
    }
}
