package com.ids.keycloak.gate.logging;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class WebMdcContextAccessorTest {

    private final WebMdcContextAccessor accessor = new WebMdcContextAccessor();

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void 값을_MDC에_기록한다() {
        accessor.put(LoggingContextKeys.USER_ID, "user-1");

        assertThat(MDC.get(LoggingContextKeys.USER_ID)).isEqualTo("user-1");
    }

    @Test
    void 빈_값이면_기존_키를_지운다() {
        // Given
        MDC.put(LoggingContextKeys.USERNAME, "alice");

        // When
        accessor.put(LoggingContextKeys.USERNAME, null);
        accessor.put(LoggingContextKeys.QUERY_STRING, " ");

        // Then
        assertThat(MDC.get(LoggingContextKeys.USERNAME)).isNull();
        assertThat(MDC.get(LoggingContextKeys.QUERY_STRING)).isNull();
    }

    @Test
    void clear는_모든_키를_지운다() {
        accessor.put(LoggingContextKeys.TRACE_ID, "trace-1");

        accessor.clear();

        assertThat(MDC.getCopyOfContextMap()).isNullOrEmpty();
    }
}
