package com.ids.keycloak.gate.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.security.core.GrantedAuthority;

class KeycloakRoleExtractorTest {

    private static final String CLIENT_ID = "gate-client";

    @Nested
    class 역할_추출_테스트 {

        @Test
        void 세_위치의_역할을_합쳐_중복_제거_후_정렬한다() {
            // given
            Map<String, Object> claims = Map.of(
                "roles", List.of("x"),
                "realm_access", Map.of("roles", List.of("users", "x")),
                "resource_access", Map.of(CLIENT_ID, Map.of("roles", List.of("admin")))
            );

            // when
            List<String> roles = KeycloakRoleExtractor.deriveRoles(claims, CLIENT_ID);

            // then
            assertThat(roles).containsExactly("admin", "users", "x");
        }

        @Test
        void 역할_클레임이_하나도_없으면_빈_목록을_반환한다() {
            assertThat(KeycloakRoleExtractor.deriveRoles(Map.of("sub", "u1"), CLIENT_ID)).isEmpty();
            assertThat(KeycloakRoleExtractor.deriveRoles(Map.of(), CLIENT_ID)).isEmpty();
            assertThat(KeycloakRoleExtractor.deriveRoles(null, CLIENT_ID)).isEmpty();
        }

        @Test
        void 다른_클라이언트의_역할은_포함하지_않는다() {
            // given
            Map<String, Object> claims = Map.of(
                "resource_access", Map.of(
                    "other-client", Map.of("roles", List.of("admin")),
                    CLIENT_ID, Map.of("roles", List.of("users"))
                )
            );

            // when & then
            assertThat(KeycloakRoleExtractor.deriveRoles(claims, CLIENT_ID)).containsExactly("users");
        }

        @Test
        void clientId가_null이면_Client_역할은_무시한다() {
            // given
            Map<String, Object> claims = Map.of(
                "realm_access", Map.of("roles", List.of("users")),
                "resource_access", Map.of(CLIENT_ID, Map.of("roles", List.of("admin")))
            );

            // when & then
            assertThat(KeycloakRoleExtractor.deriveRoles(claims, null)).containsExactly("users");
        }

        @Test
        void 형태가_다른_클레임과_문자열이_아닌_요소는_무시한다() {
            // given
            Map<String, Object> claims = new HashMap<>();
            claims.put("roles", "admin");
            claims.put("realm_access", List.of("users"));
            claims.put("resource_access", Map.of(CLIENT_ID, "admin"));
            claims.put("groups", Arrays.asList("g1"));

            Map<String, Object> mixed = Map.of("roles", Arrays.asList("users", 42, null, Map.of("a", "b")));

            // when & then
            assertThat(KeycloakRoleExtractor.deriveRoles(claims, CLIENT_ID)).isEmpty();
            assertThat(KeycloakRoleExtractor.deriveRoles(mixed, CLIENT_ID)).containsExactly("users");
        }

        @Test
        void 대소문자가_다른_역할은_서로_다른_역할로_취급한다() {
            Map<String, Object> claims = Map.of("roles", List.of("admin", "Admin"));

            assertThat(KeycloakRoleExtractor.deriveRoles(claims, CLIENT_ID)).containsExactly("Admin", "admin");
        }

        @Test
        void 반환된_목록은_수정할_수_없다() {
            List<String> roles = KeycloakRoleExtractor.deriveRoles(Map.of("roles", List.of("users")), CLIENT_ID);

            assertThatThrownBy(() -> roles.add("admin")).isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    class 권한_변환_테스트 {

        @Test
        void 역할에_ROLE_접두사를_붙인다() {
            assertThat(KeycloakRoleExtractor.toAuthorities(List.of("admin", "users")))
                .extracting(GrantedAuthority::getAuthority)
                .containsExactly("ROLE_admin", "ROLE_users");
        }

        @Test
        void 빈_역할이면_빈_권한_목록을_반환한다() {
            assertThat(KeycloakRoleExtractor.toAuthorities(List.of())).isEmpty();
            assertThat(KeycloakRoleExtractor.toAuthorities(null)).isEmpty();
        }
    }
}
