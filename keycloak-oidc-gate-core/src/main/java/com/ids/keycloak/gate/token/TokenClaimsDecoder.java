package com.ids.keycloak.gate.token;

import com.ids.keycloak.gate.exception.InvalidTokenException;
import java.util.Map;

/**
 * JWT 문자열에서 클레임 맵을 꺼내는 전략 인터페이스입니다.
 * <p>
 * 중첩 객체는 {@code Map}, 배열은 {@code List}로 표현됩니다.
 * </p>
 */
public interface TokenClaimsDecoder {

    /**
     * 토큰을 해석하여 클레임을 반환합니다.
     *
     * @param token JWT 문자열
     * @return 클레임 맵
     * @throws InvalidTokenException 토큰을 해석하거나 검증할 수 없는 경우
     */
    Map<String, Object> decode(String token);
}
