package com.ids.keycloak.gate.logging;

/**
 * 애플리케이션 전반에서 사용하는 표준 MDC 키를 정의합니다.
 */
public final class LoggingContextKeys {

    private LoggingContextKeys() {}

    // ===== 요청 메타데이터 (인증 전 설정) =====

    /** 요청 추적 ID (X-Request-Id 또는 자동 생성) */
    public static final String TRACE_ID = "traceId";

    public static final String HTTP_METHOD = "httpMethod";

    public static final String REQUEST_URI = "requestUri";

    /** 쿼리 스트링 (? 제외) */
    public static final String QUERY_STRING = "queryString";

    public static final String CLIENT_IP = "clientIp";

    // ===== 인증 정보 (세션 인증 후 설정) =====

    /** 인증된 사용자 ID (sub claim) */
    public static final String USER_ID = "userId";

    /** 인증된 사용자 이름 (preferred_username) */
    public static final String USERNAME = "username";
}
