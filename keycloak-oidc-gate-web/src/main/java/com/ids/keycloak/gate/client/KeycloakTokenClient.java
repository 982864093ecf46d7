package com.ids.keycloak.gate.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ids.keycloak.gate.config.KeycloakClientProperties;
import com.ids.keycloak.gate.config.OidcEndpoints;
import com.ids.keycloak.gate.exception.OAuthProviderException;
import com.ids.keycloak.gate.exception.ProviderUnavailableException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Keycloak 토큰 엔드포인트와 서버 간 통신을 담당하는 클라이언트입니다.
 * <p>
 * Authorization Code를 토큰 응답으로 교환합니다. 응답 본문은 가공하지 않은 Map으로 반환하며,
 * 필요한 토큰이 포함되어 있는지는 호출 측에서 판단합니다.
 * </p>
 */
@Slf4j
public class KeycloakTokenClient {

    private static final String GRANT_TYPE = "grant_type";
    private static final String AUTHORIZATION_CODE = "authorization_code";
    private static final String CODE = "code";
    private static final String REDIRECT_URI = "redirect_uri";
    private static final String CLIENT_ID = "client_id";
    private static final String ERROR = "error";
    private static final String ERROR_DESCRIPTION = "error_description";
    private static final String INVALID_TOKEN_RESPONSE = "invalid_token_response";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final RestTemplate restTemplate;
    private final OidcEndpoints endpoints;
    private final KeycloakClientProperties client;
    private final ObjectMapper objectMapper;

    public KeycloakTokenClient(RestTemplate restTemplate, OidcEndpoints endpoints,
                               KeycloakClientProperties client, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.endpoints = endpoints;
        this.client = client;
        this.objectMapper = objectMapper;
    }

    /**
     * Authorization Code를 토큰으로 교환합니다.
     *
     * @param code        콜백으로 전달받은 Authorization Code
     * @param redirectUri 인가 요청에 사용한 redirect_uri
     * @return 토큰 엔드포인트 응답 본문
     * @throws OAuthProviderException       Provider가 OAuth 오류(4xx)를 반환한 경우
     * @throws ProviderUnavailableException 네트워크 오류, 타임아웃, Provider 5xx 응답인 경우
     */
    public Map<String, Object> exchangeAuthorizationCode(String code, String redirectUri) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add(GRANT_TYPE, AUTHORIZATION_CODE);
        form.add(CODE, code);
        form.add(REDIRECT_URI, redirectUri);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (StringUtils.hasText(client.clientSecret())) {
            // client_secret_basic
            headers.setBasicAuth(client.clientId(), client.clientSecret(), StandardCharsets.UTF_8);
        } else {
            // public client
            form.add(CLIENT_ID, client.clientId());
        }

        log.debug("[TokenClient] Authorization Code 교환 요청. endpoint: {}", endpoints.tokenUri());
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                endpoints.tokenUri(), new HttpEntity<>(form, headers), String.class);
            Map<String, Object> body = parse(response.getBody());
            log.debug("[TokenClient] 토큰 응답 수신. keys: {}", body.keySet());
            return body;
        } catch (HttpClientErrorException e) {
            Map<String, Object> errorBody = parseQuietly(e.getResponseBodyAsString());
            String error = stringValue(errorBody.get(ERROR));
            String description = stringValue(errorBody.get(ERROR_DESCRIPTION));
            log.warn("[TokenClient] 토큰 엔드포인트가 오류를 반환했습니다. status: {}, error: {}",
                e.getStatusCode().value(), error);
            throw new OAuthProviderException(error != null ? error : INVALID_TOKEN_RESPONSE, description);
        } catch (HttpServerErrorException e) {
            log.error("[TokenClient] 토큰 엔드포인트 서버 오류. status: {}", e.getStatusCode().value());
            throw new ProviderUnavailableException(false,
                "토큰 엔드포인트가 " + e.getStatusCode().value() + " 응답을 반환했습니다.", e);
        } catch (ResourceAccessException e) {
            boolean timeout = isTimeout(e);
            log.error("[TokenClient] 토큰 엔드포인트에 연결할 수 없습니다. timeout: {}, cause: {}", timeout, e.getMessage());
            throw new ProviderUnavailableException(timeout, "토큰 엔드포인트에 연결할 수 없습니다.", e);
        } catch (RestClientException e) {
            log.error("[TokenClient] 토큰 교환 중 예상치 못한 오류: {}", e.getMessage());
            throw new ProviderUnavailableException(false, "토큰 교환 중 오류가 발생했습니다.", e);
        }
    }

    private Map<String, Object> parse(String body) {
        if (!StringUtils.hasText(body)) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(body, MAP_TYPE);
            return parsed != null ? parsed : Map.of();
        } catch (JsonProcessingException e) {
            throw new OAuthProviderException(INVALID_TOKEN_RESPONSE, "토큰 응답을 JSON으로 해석할 수 없습니다.");
        }
    }

    private Map<String, Object> parseQuietly(String body) {
        try {
            return parse(body);
        } catch (OAuthProviderException e) {
            log.debug("[TokenClient] 오류 응답 본문이 JSON이 아닙니다.");
            return Map.of();
        }
    }

    private static boolean isTimeout(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // JDK HttpClient 기반 요청 팩토리는 HttpTimeoutException으로 타임아웃을 알림
            if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static String stringValue(Object value) {
        return value instanceof String s && !s.isBlank() ? s : null;
    }
}
