package com.ids.keycloak.gate.token;

import com.ids.keycloak.gate.exception.InvalidTokenException;
import com.nimbusds.jwt.JWT;
import com.nimbusds.jwt.JWTParser;
import java.text.ParseException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * 서명 검증 없이 JWT의 클레임만 해석하는 {@link TokenClaimsDecoder} 구현체입니다.
 * <p>
 * Nimbus JOSE + JWT 라이브러리로 페이로드를 파싱합니다.
 * 서명을 검증하지 않으므로 위조된 토큰도 받아들입니다. 토큰은 서버 간 통신으로 토큰 엔드포인트에서 직접 받은 것만 전달해야 하며,
 * 운영 환경에서는 {@link JwkSetTokenClaimsDecoder} 사용을 권장합니다.
 * </p>
 */
@Slf4j
public class UnverifiedTokenClaimsDecoder implements TokenClaimsDecoder {

    @Override
    public Map<String, Object> decode(String token) {
        try {
            JWT jwt = JWTParser.parse(token);
            return jwt.getJWTClaimsSet().getClaims();
        } catch (ParseException e) {
            log.warn("[TokenDecoder] JWT 파싱 실패: {}", e.getMessage());
            throw new InvalidTokenException("malformed_token", e);
        }
    }
}
