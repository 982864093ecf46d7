package com.ids.keycloak.gate.token;

import com.ids.keycloak.gate.exception.InvalidTokenException;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;

/**
 * Realm의 JWK Set으로 서명과 만료 시간을 검증한 뒤 클레임을 반환하는 {@link TokenClaimsDecoder} 구현체입니다.
 * 실제 검증은 Spring Security의 {@link JwtDecoder}(NimbusJwtDecoder)에 위임합니다.
 */
@Slf4j
@RequiredArgsConstructor
public class JwkSetTokenClaimsDecoder implements TokenClaimsDecoder {

    private final JwtDecoder jwtDecoder;

    @Override
    public Map<String, Object> decode(String token) {
        try {
            Jwt jwt = jwtDecoder.decode(token);
            return jwt.getClaims();
        } catch (JwtException e) {
            log.warn("[TokenDecoder] JWT 검증 실패: {}", e.getMessage());
            throw new InvalidTokenException("invalid_signature", e);
        }
    }
}
