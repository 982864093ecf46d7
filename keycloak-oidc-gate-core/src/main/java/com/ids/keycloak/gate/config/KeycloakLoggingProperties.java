package com.ids.keycloak.gate.config;

import java.util.List;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 요청 MDC에 기록할 항목 설정입니다.
 * <p>
 * 콜백 쿼리 스트링의 인가 코드와 state는 maskedParameters에 지정된 이름 기준으로 마스킹된 뒤 기록됩니다.
 * </p>
 *
 * @param traceIdHeader      traceId를 읽고 응답에 되돌려줄 헤더 이름
 * @param includeQueryString 마스킹된 쿼리 스트링 기록 여부
 * @param maskedParameters   값을 가릴 쿼리 파라미터 이름
 * @param includeUsername    preferred_username 기록 여부
 */
public record KeycloakLoggingProperties(
    @DefaultValue("X-Request-Id") String traceIdHeader,
    @DefaultValue("true") boolean includeQueryString,
    @DefaultValue({"code", "state", "session_state"}) List<String> maskedParameters,
    @DefaultValue("true") boolean includeUsername
) {

    public KeycloakLoggingProperties {
        maskedParameters = maskedParameters == null ? List.of() : List.copyOf(maskedParameters);
    }
}
