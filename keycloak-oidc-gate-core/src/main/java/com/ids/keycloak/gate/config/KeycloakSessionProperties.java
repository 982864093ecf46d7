package com.ids.keycloak.gate.config;

import java.time.Duration;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 세션 쿠키 관련 설정입니다.
 * <p>
 * 기본값은 SameSite=Lax, HTTPS 전용 아님(secure=false) 입니다.
 * 운영 환경에서는 secure=true 를 권장합니다.
 * </p>
 *
 * @param secret     세션 쿠키 서명에 사용하는 비밀 키
 * @param cookieName 세션 쿠키 이름
 * @param timeout    세션 유휴 만료 시간
 * @param secure     Secure 속성 여부
 * @param httpOnly   HttpOnly 속성 여부
 * @param sameSite   SameSite 속성 (Lax, Strict, None)
 * @param path       쿠키 경로
 * @param domain     쿠키 도메인 (null이면 요청 호스트)
 */
public record KeycloakSessionProperties(
    @DefaultValue("dev_session_secret_change_me") String secret,
    @DefaultValue("session") String cookieName,
    @DefaultValue("30m") Duration timeout,
    @DefaultValue("false") boolean secure,
    @DefaultValue("true") boolean httpOnly,
    @DefaultValue("Lax") String sameSite,
    @DefaultValue("/") String path,
    String domain
) {
}
