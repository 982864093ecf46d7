package com.ids.keycloak.gate.session;

import com.ids.keycloak.gate.exception.ConfigurationException;
import jakarta.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.session.web.http.CookieSerializer;
import org.springframework.util.StringUtils;

/**
 * 세션 ID 쿠키 값에 HMAC-SHA256 서명을 붙이는 {@link CookieSerializer} 데코레이터입니다.
 * <p>
 * 쿠키 값은 {@code {sessionId}.{signature}} 형태로 기록되며,
 * 서명이 맞지 않는 쿠키는 읽기 단계에서 버려져 세션이 없는 것으로 취급됩니다.
 * 실제 쿠키 속성(SameSite, Secure, HttpOnly 등)은 위임 대상이 처리합니다.
 * </p>
 */
@Slf4j
public class SignedCookieSerializer implements CookieSerializer {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final char SEPARATOR = '.';

    private final CookieSerializer delegate;
    private final SecretKeySpec signingKey;

    public SignedCookieSerializer(CookieSerializer delegate, String secret) {
        if (!StringUtils.hasText(secret)) {
            throw new ConfigurationException("세션 서명 키(keycloak.gate.session.secret)가 설정되지 않았습니다.");
        }
        this.delegate = delegate;
        this.signingKey = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
    }

    @Override
    public void writeCookieValue(CookieValue cookieValue) {
        String value = cookieValue.getCookieValue();
        if (!StringUtils.hasLength(value)) {
            // 세션 만료 쿠키는 그대로 전달
            delegate.writeCookieValue(cookieValue);
            return;
        }
        CookieValue signed = new CookieValue(cookieValue.getRequest(), cookieValue.getResponse(), sign(value));
        signed.setCookieMaxAge(cookieValue.getCookieMaxAge());
        delegate.writeCookieValue(signed);
    }

    @Override
    public List<String> readCookieValues(HttpServletRequest request) {
        return delegate.readCookieValues(request).stream()
            .map(this::unsign)
            .filter(Objects::nonNull)
            .collect(Collectors.toList());
    }

    String sign(String value) {
        return value + SEPARATOR + hmac(value);
    }

    /**
     * 서명을 검증하고 원래 값을 반환합니다. 검증에 실패하면 null을 반환합니다.
     */
    String unsign(String signedValue) {
        int separatorIndex = signedValue.lastIndexOf(SEPARATOR);
        if (separatorIndex <= 0 || separatorIndex == signedValue.length() - 1) {
            log.debug("[SessionCookie] 서명이 없는 세션 쿠키를 무시합니다.");
            return null;
        }
        String value = signedValue.substring(0, separatorIndex);
        String signature = signedValue.substring(separatorIndex + 1);

        boolean valid = MessageDigest.isEqual(
            hmac(value).getBytes(StandardCharsets.US_ASCII),
            signature.getBytes(StandardCharsets.US_ASCII)
        );
        if (!valid) {
            log.warn("[SessionCookie] 서명이 일치하지 않는 세션 쿠키를 무시합니다.");
            return null;
        }
        return value;
    }

    private String hmac(String value) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(signingKey);
            byte[] digest = mac.doFinal(value.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("세션 쿠키 서명 계산에 실패했습니다.", e);
        }
    }
}
