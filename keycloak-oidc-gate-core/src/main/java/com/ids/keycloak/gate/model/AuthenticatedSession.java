package com.ids.keycloak.gate.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * 콜백 성공 시 세션에 한 번에 기록되는 인증 상태입니다.
 * <p>
 * identity, roles, rawIdToken을 하나의 세션 속성으로 저장하므로 세 값은 항상 함께 존재하거나 함께 없습니다.
 * rawIdToken은 로그아웃 시 id_token_hint 전달 용도로만 사용하며 {@link #toString()}에 노출되지 않습니다.
 * </p>
 *
 * @param identity   인증된 사용자 식별 정보
 * @param roles      중복 제거 후 오름차순 정렬된 역할 목록
 * @param rawIdToken 원본 ID Token 문자열
 */
public record AuthenticatedSession(SessionIdentity identity, List<String> roles, String rawIdToken) implements Serializable {

    public AuthenticatedSession {
        Objects.requireNonNull(identity, "identity must not be null");
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    @Override
    public String toString() {
        return "AuthenticatedSession[identity=" + identity + ", roles=" + roles
            + ", rawIdToken=" + (rawIdToken != null ? "[PROTECTED]" : "null") + "]";
    }
}
