package com.ids.keycloak.gate.authentication;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ids.keycloak.gate.session.KeycloakSessionManager;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class KeycloakLogoutHandlerTest {

    @Mock
    private KeycloakSessionManager sessionManager;

    @Mock
    private HttpServletRequest request;

    @Mock
    private HttpServletResponse response;

    @Mock
    private HttpSession session;

    private KeycloakLogoutHandler handler;

    private static final String ID_TOKEN = "test-id-token";

    @BeforeEach
    void setUp() {
        handler = new KeycloakLogoutHandler(sessionManager);
    }

    @Nested
    class 로그아웃_테스트 {

        @Test
        void ID_Token을_요청_속성으로_넘기고_세션을_무효화한다() {
            // Given
            when(request.getSession(false)).thenReturn(session);
            when(sessionManager.getRawIdToken(session)).thenReturn(Optional.of(ID_TOKEN));

            // When
            handler.logout(request, response, null);

            // Then
            verify(request).setAttribute(KeycloakLogoutHandler.ID_TOKEN_HINT_ATTR, ID_TOKEN);
            verify(sessionManager).invalidateSession(session);
        }

        @Test
        void 세션에_ID_Token이_없어도_세션은_무효화한다() {
            // Given
            when(request.getSession(false)).thenReturn(session);
            when(sessionManager.getRawIdToken(session)).thenReturn(Optional.empty());

            // When
            handler.logout(request, response, null);

            // Then
            verify(request, never()).setAttribute(eq(KeycloakLogoutHandler.ID_TOKEN_HINT_ATTR), any());
            verify(sessionManager).invalidateSession(session);
        }

        @Test
        void 세션이_null이면_아무것도_하지_않는다() {
            // Given
            when(request.getSession(false)).thenReturn(null);

            // When
            handler.logout(request, response, null);

            // Then
            verify(sessionManager, never()).getRawIdToken(any());
            verify(sessionManager, never()).invalidateSession(any());
            verify(request, never()).setAttribute(anyString(), any());
        }
    }
}
