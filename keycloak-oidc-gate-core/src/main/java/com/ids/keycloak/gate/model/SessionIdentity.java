package com.ids.keycloak.gate.model;

import com.ids.keycloak.gate.config.KeycloakGateConstants;
import java.io.Serializable;
import java.util.Map;
import java.util.Objects;

/**
 * 세션에 저장되는 인증된 사용자의 식별 정보입니다.
 * ID Token 클레임에서 생성되며, subject는 항상 존재합니다.
 *
 * @param subject           사용자 고유 식별자 ('sub' 클레임)
 * @param email             이메일 (null 가능)
 * @param preferredUsername 사용자 명 (null 가능)
 */
public record SessionIdentity(String subject, String email, String preferredUsername) implements Serializable {

    public SessionIdentity {
        Objects.requireNonNull(subject, "subject must not be null");
    }

    /**
     * ID Token 클레임으로부터 SessionIdentity를 생성합니다.
     * 문자열이 아닌 email / preferred_username 값은 없는 것으로 취급합니다.
     *
     * @param idTokenClaims ID Token 클레임 맵
     * @return SessionIdentity
     * @throws IllegalArgumentException 'sub' 클레임이 없는 경우
     */
    public static SessionIdentity fromClaims(Map<String, Object> idTokenClaims) {
        String subject = stringClaim(idTokenClaims, KeycloakGateConstants.SUB_CLAIM);
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("ID Token에 'sub' 클레임이 없습니다.");
        }
        return new SessionIdentity(
            subject,
            stringClaim(idTokenClaims, KeycloakGateConstants.EMAIL_CLAIM),
            stringClaim(idTokenClaims, KeycloakGateConstants.PREFERRED_USERNAME_CLAIM)
        );
    }

    /**
     * 화면에 표시할 이름을 반환합니다. email, preferred_username 순으로 사용하고 둘 다 없으면 null 입니다.
     */
    public String displayName() {
        if (email != null && !email.isBlank()) {
            return email;
        }
        if (preferredUsername != null && !preferredUsername.isBlank()) {
            return preferredUsername;
        }
        return null;
    }

    private static String stringClaim(Map<String, Object> claims, String name) {
        Object value = claims.get(name);
        return value instanceof String s ? s : null;
    }
}
