package com.ids.keycloak.gate.logging;

import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * 요청 스레드의 SLF4J MDC에 기록하는 {@link LoggingContextAccessor}.
 * <p>
 * 값이 비어 있으면 키를 지워서, 이전 값이 로그 패턴에 남지 않게 합니다
 * (예: preferred_username이 없는 토큰, 쿼리 스트링이 없는 요청).
 */
public class WebMdcContextAccessor implements LoggingContextAccessor {

    @Override
    public void put(String key, String value) {
        if (key == null) {
            return;
        }
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    @Override
    public void clear() {
        MDC.clear();
    }
}
