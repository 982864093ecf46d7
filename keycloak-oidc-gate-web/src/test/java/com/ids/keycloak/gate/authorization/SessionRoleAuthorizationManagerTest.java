package com.ids.keycloak.gate.authorization;

import static com.ids.keycloak.gate.authorization.SessionRoleAuthorizationManager.requireLogin;
import static com.ids.keycloak.gate.authorization.SessionRoleAuthorizationManager.requireRoles;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ids.keycloak.gate.authentication.SessionAuthentication;
import com.ids.keycloak.gate.exception.AuthenticationRequiredException;
import com.ids.keycloak.gate.model.SessionIdentity;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.InsufficientAuthenticationException;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

class SessionRoleAuthorizationManagerTest {

    private final RequestAuthorizationContext context =
        new RequestAuthorizationContext(new MockHttpServletRequest("GET", "/user"));

    private static Authentication session(String... roles) {
        return new SessionAuthentication(new SessionIdentity("user-1", "a@b.c", "alice"), List.of(roles));
    }

    private static Authentication anonymous() {
        return new AnonymousAuthenticationToken("key", "anonymousUser",
            AuthorityUtils.createAuthorityList("ROLE_ANONYMOUS"));
    }

    @Nested
    class 역할_검사_테스트 {

        @Test
        void 요구_역할을_모두_가지고_있으면_허용한다() {
            AuthorizationDecision decision = requireRoles("admin").check(() -> session("admin", "users"), context);

            assertThat(decision.isGranted()).isTrue();
        }

        @Test
        void 여러_역할을_요구하면_모두_있어야_허용한다() {
            assertThat(requireRoles("admin", "users").check(() -> session("admin", "users", "x"), context).isGranted())
                .isTrue();
            assertThat(requireRoles("admin", "users").check(() -> session("admin"), context).isGranted())
                .isFalse();
        }

        @Test
        void 요구_역할이_없으면_거부한다() {
            AuthorizationDecision decision = requireRoles("users").check(() -> session("admin"), context);

            assertThat(decision.isGranted()).isFalse();
        }

        @Test
        void 세션에_역할이_비어있으면_인증_필요_예외를_던진다() {
            assertThatThrownBy(() -> requireRoles("users").check(() -> session(), context))
                .isInstanceOf(InsufficientAuthenticationException.class)
                .hasCauseInstanceOf(AuthenticationRequiredException.class);
        }

        @Test
        void 세션_인증이_없으면_인증_필요_예외를_던진다() {
            assertThatThrownBy(() -> requireRoles("users").check(SessionRoleAuthorizationManagerTest::anonymous, context))
                .isInstanceOf(InsufficientAuthenticationException.class)
                .hasCauseInstanceOf(AuthenticationRequiredException.class);
            assertThatThrownBy(() -> requireRoles("users").check(() -> null, context))
                .isInstanceOf(InsufficientAuthenticationException.class);
        }
    }

    @Nested
    class 로그인_검사_테스트 {

        @Test
        void 세션_인증이_있으면_역할이_없어도_허용한다() {
            assertThat(requireLogin().check(() -> session(), context).isGranted()).isTrue();
        }

        @Test
        void 세션_인증이_없으면_인증_필요_예외를_던진다() {
            assertThatThrownBy(() -> requireLogin().check(SessionRoleAuthorizationManagerTest::anonymous, context))
                .isInstanceOf(InsufficientAuthenticationException.class);
        }
    }
}
