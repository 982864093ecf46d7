package com.ids.keycloak.gate.authentication;

import static org.assertj.core.api.Assertions.assertThat;

import com.ids.keycloak.gate.config.OidcEndpoints;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

class KeycloakLogoutSuccessHandlerTest {

    private static final String END_SESSION_URI =
        "http://keycloak.browser.test/realms/test-realm/protocol/openid-connect/logout";

    private KeycloakLogoutSuccessHandler handler;

    @BeforeEach
    void setUp() {
        handler = new KeycloakLogoutSuccessHandler(new OidcEndpoints(
            "http://keycloak.browser.test/realms/test-realm/protocol/openid-connect/auth",
            "http://keycloak.backend.test/realms/test-realm/protocol/openid-connect/token",
            "http://keycloak.backend.test/realms/test-realm/protocol/openid-connect/certs",
            END_SESSION_URI,
            "http://app.test/callback",
            "http://app.test/"
        ));
    }

    @Test
    void ID_Token이_있으면_id_token_hint를_포함하여_리다이렉트한다() throws Exception {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/logout");
        request.setAttribute(KeycloakLogoutHandler.ID_TOKEN_HINT_ATTR, "header.payload.signature");
        MockHttpServletResponse response = new MockHttpServletResponse();

        // When
        handler.onLogoutSuccess(request, response, null);

        // Then
        assertThat(response.getStatus()).isEqualTo(302);
        UriComponents location = UriComponentsBuilder.fromUriString(response.getRedirectedUrl()).build();
        assertThat(response.getRedirectedUrl()).startsWith(END_SESSION_URI + "?");
        assertThat(location.getQueryParams().getFirst("post_logout_redirect_uri")).isEqualTo("http://app.test/");
        assertThat(location.getQueryParams().getFirst("id_token_hint")).isEqualTo("header.payload.signature");
    }

    @Test
    void ID_Token이_없으면_post_logout_redirect_uri만_포함한다() throws Exception {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/logout");
        MockHttpServletResponse response = new MockHttpServletResponse();

        // When
        handler.onLogoutSuccess(request, response, null);

        // Then
        UriComponents location = UriComponentsBuilder.fromUriString(response.getRedirectedUrl()).build();
        assertThat(location.getQueryParams()).containsOnlyKeys("post_logout_redirect_uri");
    }
}
