package com.ids.keycloak.gate.filter;

import com.ids.keycloak.gate.config.KeycloakLoggingProperties;
import com.ids.keycloak.gate.logging.LoggingContextAccessor;
import com.ids.keycloak.gate.logging.LoggingContextKeys;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collection;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * 요청마다 traceId와 요청 정보를 MDC에 기록하는 필터.
 * <p>
 * traceId는 설정된 헤더 값을 이어받거나 새로 생성하며, 같은 헤더로 응답에 돌려줍니다.
 * /callback 쿼리 스트링의 code, state 값은 마스킹된 형태로만 기록됩니다.
 * MDC는 요청이 끝나면 비웁니다.
 *
 * @see MdcAuthenticationFilter
 */
public class MdcRequestFilter extends OncePerRequestFilter {

    static final String MASKED_VALUE = "***";

    private final LoggingContextAccessor contextAccessor;
    private final KeycloakLoggingProperties loggingProperties;

    public MdcRequestFilter(LoggingContextAccessor contextAccessor, KeycloakLoggingProperties loggingProperties) {
        this.contextAccessor = contextAccessor;
        this.loggingProperties = loggingProperties;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        String traceId = resolveTraceId(request);
        response.setHeader(loggingProperties.traceIdHeader(), traceId);
        try {
            contextAccessor.put(LoggingContextKeys.TRACE_ID, traceId);
            contextAccessor.put(LoggingContextKeys.HTTP_METHOD, request.getMethod());
            contextAccessor.put(LoggingContextKeys.REQUEST_URI, request.getRequestURI());
            contextAccessor.put(LoggingContextKeys.CLIENT_IP, request.getRemoteAddr());
            if (loggingProperties.includeQueryString()) {
                contextAccessor.put(LoggingContextKeys.QUERY_STRING,
                    maskQueryString(request.getQueryString(), loggingProperties.maskedParameters()));
            }
            chain.doFilter(request, response);
        } finally {
            contextAccessor.clear();
        }
    }

    private String resolveTraceId(HttpServletRequest request) {
        String incoming = request.getHeader(loggingProperties.traceIdHeader());
        return StringUtils.hasText(incoming) ? incoming : UUID.randomUUID().toString();
    }

    /**
     * 지정된 이름의 파라미터 값을 가린 쿼리 스트링을 반환합니다. 쿼리 스트링이 없으면 null.
     */
    static String maskQueryString(String queryString, Collection<String> maskedParameters) {
        if (!StringUtils.hasText(queryString)) {
            return null;
        }
        return Arrays.stream(queryString.split("&"))
            .map(pair -> {
                int separator = pair.indexOf('=');
                String name = separator >= 0 ? pair.substring(0, separator) : pair;
                return maskedParameters.contains(name) ? name + "=" + MASKED_VALUE : pair;
            })
            .collect(Collectors.joining("&"));
    }
}
