package com.ids.keycloak.gate.authentication;

import static com.ids.keycloak.gate.config.KeycloakGateConstants.ACCESS_TOKEN_KEY;
import static com.ids.keycloak.gate.config.KeycloakGateConstants.ID_TOKEN_KEY;
import static com.ids.keycloak.gate.config.KeycloakGateConstants.NONCE_CLAIM;

import com.ids.keycloak.gate.client.KeycloakTokenClient;
import com.ids.keycloak.gate.config.KeycloakClientProperties;
import com.ids.keycloak.gate.config.OidcEndpoints;
import com.ids.keycloak.gate.exception.InvalidAuthorizationStateException;
import com.ids.keycloak.gate.exception.InvalidTokenException;
import com.ids.keycloak.gate.exception.MissingTokensException;
import com.ids.keycloak.gate.exception.OAuthProviderException;
import com.ids.keycloak.gate.model.AuthenticatedSession;
import com.ids.keycloak.gate.model.SessionIdentity;
import com.ids.keycloak.gate.session.KeycloakSessionManager;
import com.ids.keycloak.gate.token.TokenClaimsDecoder;
import com.ids.keycloak.gate.util.KeycloakRoleExtractor;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.keygen.Base64StringKeyGenerator;
import org.springframework.security.crypto.keygen.StringKeyGenerator;
import org.springframework.security.oauth2.client.web.AuthorizationRequestRepository;
import org.springframework.security.oauth2.core.endpoint.OAuth2AuthorizationRequest;
import org.springframework.security.oauth2.core.endpoint.OAuth2ParameterNames;
import org.springframework.security.oauth2.core.oidc.endpoint.OidcParameterNames;
import org.springframework.util.StringUtils;

/**
 * OIDC Authorization Code Flow의 시작과 콜백 처리를 담당합니다.
 * <p>
 * 시작 단계에서는 state와 nonce를 생성하여 인가 요청을 세션에 저장하고,
 * 콜백 단계에서는 state 검증, 코드 교환, 토큰 디코딩, nonce 검증, 역할 추출을 거쳐
 * {@link AuthenticatedSession}을 세션에 기록합니다.
 * 콜백 처리 중 어느 단계에서든 실패하면 인증 상태는 기록되지 않습니다.
 * </p>
 */
@Slf4j
public class OidcLoginFlow {

    private static final String ERROR_PARAM = "error";
    private static final String ERROR_DESCRIPTION_PARAM = "error_description";
    private static final String INVALID_REQUEST = "invalid_request";
    private static final String INVALID_NONCE = "invalid_nonce";
    private static final String MISSING_SUBJECT = "missing_subject";

    private final OidcEndpoints endpoints;
    private final KeycloakClientProperties client;
    private final AuthorizationRequestRepository<OAuth2AuthorizationRequest> authorizationRequestRepository;
    private final KeycloakTokenClient tokenClient;
    private final TokenClaimsDecoder tokenClaimsDecoder;
    private final KeycloakSessionManager sessionManager;
    private final RoleLandingResolver landingResolver;

    private final StringKeyGenerator stateGenerator = new Base64StringKeyGenerator(Base64.getUrlEncoder());
    private final StringKeyGenerator nonceGenerator =
        new Base64StringKeyGenerator(Base64.getUrlEncoder().withoutPadding(), 96);

    public OidcLoginFlow(OidcEndpoints endpoints,
                         KeycloakClientProperties client,
                         AuthorizationRequestRepository<OAuth2AuthorizationRequest> authorizationRequestRepository,
                         KeycloakTokenClient tokenClient,
                         TokenClaimsDecoder tokenClaimsDecoder,
                         KeycloakSessionManager sessionManager,
                         RoleLandingResolver landingResolver) {
        this.endpoints = endpoints;
        this.client = client;
        this.authorizationRequestRepository = authorizationRequestRepository;
        this.tokenClient = tokenClient;
        this.tokenClaimsDecoder = tokenClaimsDecoder;
        this.sessionManager = sessionManager;
        this.landingResolver = landingResolver;
    }

    /**
     * 인가 요청을 생성하여 세션에 저장하고, 브라우저가 이동할 Authorization URI를 반환합니다.
     */
    public String initiate(HttpServletRequest request, HttpServletResponse response) {
        String nonce = nonceGenerator.generateKey();

        Map<String, Object> attributes = new HashMap<>();
        attributes.put(OidcParameterNames.NONCE, nonce);
        Map<String, Object> additionalParameters = new HashMap<>();
        additionalParameters.put(OidcParameterNames.NONCE, hash(nonce));

        OAuth2AuthorizationRequest authorizationRequest = OAuth2AuthorizationRequest.authorizationCode()
            .authorizationUri(endpoints.authorizationUri())
            .clientId(client.clientId())
            .redirectUri(endpoints.redirectUri())
            .scopes(new LinkedHashSet<>(client.scopes()))
            .state(stateGenerator.generateKey())
            .attributes(attributes)
            .additionalParameters(additionalParameters)
            .build();

        authorizationRequestRepository.saveAuthorizationRequest(authorizationRequest, request, response);
        log.debug("[OidcLogin] 인가 요청 생성 완료. client_id: {}, redirect_uri: {}",
            client.clientId(), endpoints.redirectUri());
        return authorizationRequest.getAuthorizationRequestUri();
    }

    /**
     * 콜백 요청을 처리하여 인증 상태를 세션에 기록하고, 역할에 따른 이동 경로를 반환합니다.
     */
    public String complete(HttpServletRequest request, HttpServletResponse response) {
        String error = request.getParameter(ERROR_PARAM);
        if (StringUtils.hasText(error)) {
            throw new OAuthProviderException(error, request.getParameter(ERROR_DESCRIPTION_PARAM));
        }

        OAuth2AuthorizationRequest authorizationRequest =
            authorizationRequestRepository.removeAuthorizationRequest(request, response);
        if (authorizationRequest == null) {
            throw new InvalidAuthorizationStateException();
        }

        String code = request.getParameter(OAuth2ParameterNames.CODE);
        if (!StringUtils.hasText(code)) {
            throw new OAuthProviderException(INVALID_REQUEST, "Authorization Code가 전달되지 않았습니다.");
        }

        Map<String, Object> tokenResponse =
            tokenClient.exchangeAuthorizationCode(code, authorizationRequest.getRedirectUri());

        String idToken = tokenValue(tokenResponse, ID_TOKEN_KEY);
        String accessToken = tokenValue(tokenResponse, ACCESS_TOKEN_KEY);
        if (idToken == null || accessToken == null) {
            throw new MissingTokensException(tokenResponse.keySet());
        }

        Map<String, Object> idClaims = tokenClaimsDecoder.decode(idToken);
        Map<String, Object> accessClaims = tokenClaimsDecoder.decode(accessToken);

        validateNonce(authorizationRequest, idClaims);

        SessionIdentity identity;
        try {
            identity = SessionIdentity.fromClaims(idClaims);
        } catch (IllegalArgumentException e) {
            throw new InvalidTokenException(MISSING_SUBJECT, e);
        }
        List<String> roles = KeycloakRoleExtractor.deriveRoles(accessClaims, client.clientId());

        sessionManager.establish(request, new AuthenticatedSession(identity, roles, idToken));

        String landing = landingResolver.resolve(roles);
        log.info("[OidcLogin] 로그인 성공. subject: {}, roles: {}, landing: {}", identity.subject(), roles, landing);
        return landing;
    }

    private void validateNonce(OAuth2AuthorizationRequest authorizationRequest, Map<String, Object> idClaims) {
        String nonce = authorizationRequest.getAttribute(OidcParameterNames.NONCE);
        if (nonce == null) {
            return;
        }
        Object claim = idClaims.get(NONCE_CLAIM);
        if (!hash(nonce).equals(claim)) {
            log.warn("[OidcLogin] ID Token의 nonce가 인가 요청과 일치하지 않습니다.");
            throw new InvalidTokenException(INVALID_NONCE);
        }
    }

    private static String tokenValue(Map<String, Object> tokenResponse, String key) {
        Object value = tokenResponse.get(key);
        return value instanceof String s && StringUtils.hasText(s) ? s : null;
    }

    private static String hash(String value) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(value.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 알고리즘을 사용할 수 없습니다.", e);
        }
    }
}
