package com.ids.keycloak.gate.exception;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ids.keycloak.gate.error.ErrorResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.access.AccessDeniedException;

class KeycloakAccessDeniedHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final KeycloakAccessDeniedHandler handler = new KeycloakAccessDeniedHandler(objectMapper);

    @Test
    void 역할이_부족하면_403과_거부된_경로를_담은_JSON을_반환한다() throws Exception {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/admin");
        MockHttpServletResponse response = new MockHttpServletResponse();

        // When
        handler.handle(request, response, new AccessDeniedException("Access Denied"));

        // Then
        assertThat(response.getStatus()).isEqualTo(403);
        assertThat(response.getContentType()).startsWith(MediaType.APPLICATION_JSON_VALUE);
        ErrorResponse body = objectMapper.readValue(response.getContentAsByteArray(), ErrorResponse.class);
        assertThat(body.code()).isEqualTo("ACCESS_DENIED");
        assertThat(body.detail()).isEqualTo("/admin");
    }
}
