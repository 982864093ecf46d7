package com.ids.keycloak.gate.exception;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ids.keycloak.gate.util.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;

/**
 * 세션 역할이 요구 역할을 충족하지 못한 경우 403 JSON을 반환합니다. detail은 거부된 경로입니다.
 */
@Slf4j
@RequiredArgsConstructor
public class KeycloakAccessDeniedHandler implements AccessDeniedHandler {

    private final ObjectMapper objectMapper;

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response,
                       AccessDeniedException accessDeniedException) throws IOException {
        log.debug("[AccessDenied] 역할 부족 - uri: {}", request.getRequestURI());
        ErrorResponseWriter.write(response, objectMapper, ErrorCode.ACCESS_DENIED, request.getRequestURI());
    }
}
