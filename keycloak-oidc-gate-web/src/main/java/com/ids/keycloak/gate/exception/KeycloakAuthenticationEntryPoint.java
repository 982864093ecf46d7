package com.ids.keycloak.gate.exception;

import static com.ids.keycloak.gate.config.KeycloakGateConstants.LOGIN_URL;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ids.keycloak.gate.util.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

/**
 * 세션 인증 없이, 또는 역할이 비어 있는 세션으로 /user, /admin에 접근한 경우 401 JSON을 반환합니다.
 * detail에는 로그인을 시작할 경로가 담깁니다.
 */
@Slf4j
@RequiredArgsConstructor
public class KeycloakAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
        throws IOException {
        log.debug("[EntryPoint] 인증 필요 - uri: {}, reason: {}", request.getRequestURI(), authException.getMessage());
        ErrorResponseWriter.write(response, objectMapper, ErrorCode.AUTHENTICATION_REQUIRED, LOGIN_URL);
    }
}
