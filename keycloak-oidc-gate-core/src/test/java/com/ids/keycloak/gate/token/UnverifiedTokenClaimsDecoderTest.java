package com.ids.keycloak.gate.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ids.keycloak.gate.exception.ErrorCode;
import com.ids.keycloak.gate.exception.InvalidTokenException;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.PlainJWT;
import com.nimbusds.jwt.SignedJWT;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class UnverifiedTokenClaimsDecoderTest {

    private final UnverifiedTokenClaimsDecoder decoder = new UnverifiedTokenClaimsDecoder();

    @Test
    void 서명되지_않은_토큰의_클레임을_해석한다() {
        // given
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
            .subject("user-1")
            .claim("email", "a@b.c")
            .claim("realm_access", Map.of("roles", List.of("users")))
            .build();
        String token = new PlainJWT(claims).serialize();

        // when
        Map<String, Object> decoded = decoder.decode(token);

        // then
        assertThat(decoded)
            .containsEntry("sub", "user-1")
            .containsEntry("email", "a@b.c");
        assertThat(decoded.get("realm_access")).isInstanceOf(Map.class);
    }

    @Test
    void 서명을_검증하지_않고_서명된_토큰의_클레임을_해석한다() throws JOSEException {
        // given
        SignedJWT jwt = new SignedJWT(
            new JWSHeader(JWSAlgorithm.HS256),
            new JWTClaimsSet.Builder().subject("user-2").build()
        );
        jwt.sign(new MACSigner("0123456789abcdef0123456789abcdef"));

        // when
        Map<String, Object> decoded = decoder.decode(jwt.serialize());

        // then
        assertThat(decoded).containsEntry("sub", "user-2");
    }

    @Test
    void 형식이_잘못된_토큰이면_InvalidTokenException을_던진다() {
        assertThatThrownBy(() -> decoder.decode("not-a-jwt"))
            .isInstanceOf(InvalidTokenException.class)
            .satisfies(e -> {
                InvalidTokenException ex = (InvalidTokenException) e;
                assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.INVALID_TOKEN);
                assertThat(ex.getDetail()).isEqualTo("malformed_token");
            });
    }
}
