package com.ids.keycloak.gate.error;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSON 에러 응답 본문입니다.
 *
 * @param code    {@link com.ids.keycloak.gate.exception.ErrorCode}의 코드 값
 * @param message 사용자에게 보여줄 메시지
 * @param detail  진단 정보 (없으면 생략)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String code, String message, String detail) {
}
