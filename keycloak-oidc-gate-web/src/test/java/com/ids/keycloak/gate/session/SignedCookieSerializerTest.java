package com.ids.keycloak.gate.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ids.keycloak.gate.exception.ConfigurationException;
import jakarta.servlet.http.Cookie;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.session.web.http.CookieSerializer.CookieValue;
import org.springframework.session.web.http.DefaultCookieSerializer;

class SignedCookieSerializerTest {

    private static final String COOKIE_NAME = "session";
    private static final String SECRET = "test-secret";

    private SignedCookieSerializer serializer;

    @BeforeEach
    void setUp() {
        DefaultCookieSerializer delegate = new DefaultCookieSerializer();
        delegate.setCookieName(COOKIE_NAME);
        delegate.setSameSite("Lax");
        serializer = new SignedCookieSerializer(delegate, SECRET);
    }

    @Test
    void 서명한_쿠키를_다시_읽으면_원래_세션_ID를_반환한다() {
        // Given
        MockHttpServletResponse response = new MockHttpServletResponse();
        serializer.writeCookieValue(new CookieValue(new MockHttpServletRequest(), response, "session-id-1"));
        Cookie written = response.getCookie(COOKIE_NAME);

        MockHttpServletRequest next = new MockHttpServletRequest();
        next.setCookies(written);

        // When & Then
        assertThat(decode(written.getValue())).startsWith("session-id-1.");
        assertThat(serializer.readCookieValues(next)).containsExactly("session-id-1");
        assertThat(response.getHeader("Set-Cookie")).contains("SameSite=Lax").contains("HttpOnly");
    }

    @Test
    void 서명이_변조된_쿠키는_무시한다() {
        // Given
        String forged = serializer.sign("session-id-1").replace("session-id-1", "session-id-2");
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setCookies(new Cookie(COOKIE_NAME, encode(forged)));

        // When & Then
        assertThat(serializer.readCookieValues(request)).isEmpty();
    }

    @Test
    void 서명이_없는_쿠키는_무시한다() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setCookies(new Cookie(COOKIE_NAME, encode("session-id-1")));

        assertThat(serializer.readCookieValues(request)).isEmpty();
    }

    @Test
    void 다른_키로_서명된_쿠키는_무시한다() {
        // Given
        SignedCookieSerializer other = new SignedCookieSerializer(new DefaultCookieSerializer(), "another-secret");
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setCookies(new Cookie(COOKIE_NAME, encode(other.sign("session-id-1"))));

        // When & Then
        assertThat(serializer.readCookieValues(request)).isEmpty();
    }

    @Test
    void 세션_만료_쿠키는_서명하지_않고_그대로_기록한다() {
        MockHttpServletResponse response = new MockHttpServletResponse();

        serializer.writeCookieValue(new CookieValue(new MockHttpServletRequest(), response, ""));

        Cookie expired = response.getCookie(COOKIE_NAME);
        assertThat(expired).isNotNull();
        assertThat(expired.getMaxAge()).isZero();
    }

    @Test
    void 서명_키가_비어있으면_ConfigurationException을_던진다() {
        assertThatThrownBy(() -> new SignedCookieSerializer(new DefaultCookieSerializer(), " "))
            .isInstanceOf(ConfigurationException.class);
    }

    private static String encode(String value) {
        return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }

    private static String decode(String value) {
        return new String(Base64.getDecoder().decode(value), StandardCharsets.UTF_8);
    }
}
