package com.ids.keycloak.gate.util;

import com.ids.keycloak.gate.config.KeycloakGateConstants;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

/**
 * Access Token 클레임에서 역할 목록을 추출하는 유틸리티 클래스입니다.
 * <p>
 * 다음 세 위치의 역할을 합쳐 중복을 제거하고 오름차순으로 정렬합니다.
 * <ul>
 *   <li>{@code roles} - 커스텀 매퍼가 추가한 최상위 클레임</li>
 *   <li>{@code realm_access.roles} - Realm 레벨 역할</li>
 *   <li>{@code resource_access.{clientId}.roles} - Client 레벨 역할</li>
 * </ul>
 * 누락되었거나 형태가 다른 클레임은 빈 값으로 취급하며 예외를 던지지 않습니다.
 * </p>
 */
public final class KeycloakRoleExtractor {

    private static final String ROLES_CLAIM = "roles";
    private static final String REALM_ACCESS_CLAIM = "realm_access";
    private static final String RESOURCE_ACCESS_CLAIM = "resource_access";

    private KeycloakRoleExtractor() {
        // 유틸리티 클래스 - 인스턴스화 방지
    }

    /**
     * 클레임에서 역할 목록을 추출합니다.
     *
     * @param claims   Access Token 클레임 맵 (null 가능)
     * @param clientId resource_access에서 역할을 찾을 클라이언트 ID (null이면 Client 역할은 무시)
     * @return 중복 제거 후 오름차순 정렬된 불변 역할 목록
     */
    public static List<String> deriveRoles(Map<String, Object> claims, String clientId) {
        if (claims == null || claims.isEmpty()) {
            return Collections.emptyList();
        }

        SortedSet<String> roles = new TreeSet<>();
        addRoles(roles, claims.get(ROLES_CLAIM));
        addRoles(roles, nested(claims, REALM_ACCESS_CLAIM).get(ROLES_CLAIM));
        if (clientId != null) {
            addRoles(roles, nested(nested(claims, RESOURCE_ACCESS_CLAIM), clientId).get(ROLES_CLAIM));
        }
        return List.copyOf(roles);
    }

    /**
     * 역할 목록을 ROLE_ 접두사를 붙인 GrantedAuthority로 변환합니다.
     */
    public static Collection<GrantedAuthority> toAuthorities(Collection<String> roles) {
        if (roles == null || roles.isEmpty()) {
            return Collections.emptyList();
        }
        return roles.stream()
            .map(role -> new SimpleGrantedAuthority(KeycloakGateConstants.ROLE_PREFIX + role))
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * 클레임 맵에서 하위 객체를 꺼냅니다. 객체가 아니면 빈 맵을 반환합니다.
     */
    @SuppressWarnings("unchecked")
    private static Map<String, Object> nested(Map<String, Object> claims, String name) {
        Object value = claims.get(name);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return Collections.emptyMap();
    }

    private static void addRoles(SortedSet<String> target, Object roles) {
        if (roles instanceof Collection<?> collection) {
            for (Object role : collection) {
                if (role instanceof String s) {
                    target.add(s);
                }
            }
        }
    }
}
