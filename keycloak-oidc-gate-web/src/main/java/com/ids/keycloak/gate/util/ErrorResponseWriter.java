package com.ids.keycloak.gate.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ids.keycloak.gate.error.ErrorResponse;
import com.ids.keycloak.gate.exception.ErrorCode;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

/**
 * Security 필터 단계(컨트롤러 밖)에서 {@link ErrorResponse}를 직접 쓰는 유틸리티.
 */
public final class ErrorResponseWriter {

    private ErrorResponseWriter() {
    }

    /**
     * ErrorCode의 상태 코드와 기본 메시지로 JSON 응답을 씁니다. 인증 상태가 담긴 응답이므로 캐시하지 않습니다.
     */
    public static void write(HttpServletResponse response, ObjectMapper objectMapper,
                             ErrorCode errorCode, String detail) throws IOException {
        response.setStatus(errorCode.getHttpStatus());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setHeader(HttpHeaders.CACHE_CONTROL, "no-store");
        try (OutputStream os = response.getOutputStream()) {
            objectMapper.writeValue(os, new ErrorResponse(errorCode.getCode(), errorCode.getDefaultMessage(), detail));
        }
    }
}
