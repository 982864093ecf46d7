package com.ids.keycloak.gate.exception;

import com.ids.keycloak.gate.error.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 로그인/콜백 처리 중 발생한 {@link KeycloakGateException}을 JSON 에러 응답으로 변환합니다.
 * 4xx는 WARN, 5xx는 ERROR 레벨로 기록합니다.
 */
@Slf4j
@RestControllerAdvice
public class OidcFlowExceptionHandler {

    @ExceptionHandler(KeycloakGateException.class)
    public ResponseEntity<ErrorResponse> handleKeycloakGateException(KeycloakGateException e) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode.getHttpStatus() >= 500) {
            log.error("[OidcFlow] {} - {}", errorCode.getCode(), e.getMessage(), e);
        } else {
            log.warn("[OidcFlow] {} - {} (detail: {})", errorCode.getCode(), e.getMessage(), e.getDetail());
        }
        return ResponseEntity.status(errorCode.getHttpStatus())
            .body(new ErrorResponse(errorCode.getCode(), e.getMessage(), e.getDetail()));
    }
}
