package com.ids.keycloak.gate.exception;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ids.keycloak.gate.error.ErrorResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.InsufficientAuthenticationException;

class KeycloakAuthenticationEntryPointTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final KeycloakAuthenticationEntryPoint entryPoint = new KeycloakAuthenticationEntryPoint(objectMapper);

    @Test
    void 인증이_없으면_401과_로그인_경로를_담은_JSON을_반환한다() throws Exception {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/admin");
        MockHttpServletResponse response = new MockHttpServletResponse();

        // When
        entryPoint.commence(request, response, new InsufficientAuthenticationException("no session",
            new AuthenticationRequiredException()));

        // Then
        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentType()).startsWith(MediaType.APPLICATION_JSON_VALUE);
        assertThat(response.getHeader("Cache-Control")).isEqualTo("no-store");
        ErrorResponse body = objectMapper.readValue(response.getContentAsByteArray(), ErrorResponse.class);
        assertThat(body.code()).isEqualTo("AUTHENTICATION_REQUIRED");
        assertThat(body.message()).isEqualTo(ErrorCode.AUTHENTICATION_REQUIRED.getDefaultMessage());
        assertThat(body.detail()).isEqualTo("/login");
    }

    @Test
    void AJAX_요청이어도_리다이렉트하지_않고_JSON을_반환한다() throws Exception {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/user");
        request.addHeader("X-Requested-With", "XMLHttpRequest");
        MockHttpServletResponse response = new MockHttpServletResponse();

        // When
        entryPoint.commence(request, response, new InsufficientAuthenticationException("no session"));

        // Then
        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getRedirectedUrl()).isNull();
    }
}
