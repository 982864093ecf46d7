package com.ids.keycloak.gate.authentication;

import com.ids.keycloak.gate.model.SessionIdentity;
import com.ids.keycloak.gate.util.KeycloakRoleExtractor;
import java.util.List;
import org.springframework.security.authentication.AbstractAuthenticationToken;

/**
 * 세션에 저장된 인증 상태로부터 매 요청마다 만들어지는 {@link org.springframework.security.core.Authentication} 구현체입니다.
 * <p>
 * Principal은 {@link SessionIdentity}이고, 권한은 세션 역할에 ROLE_ 접두사를 붙인 값입니다.
 * 원본 ID Token은 담지 않습니다.
 * </p>
 */
public class SessionAuthentication extends AbstractAuthenticationToken {

    private final SessionIdentity identity;
    private final List<String> roles;

    public SessionAuthentication(SessionIdentity identity, List<String> roles) {
        super(KeycloakRoleExtractor.toAuthorities(roles));
        this.identity = identity;
        this.roles = roles == null ? List.of() : List.copyOf(roles);
        setAuthenticated(true);
    }

    @Override
    public Object getCredentials() {
        return null;
    }

    @Override
    public SessionIdentity getPrincipal() {
        return identity;
    }

    @Override
    public String getName() {
        return identity != null ? identity.subject() : "";
    }

    public SessionIdentity getIdentity() {
        return identity;
    }

    /**
     * 세션의 역할 목록 (ROLE_ 접두사 없음, 오름차순)
     */
    public List<String> getRoles() {
        return roles;
    }
}
