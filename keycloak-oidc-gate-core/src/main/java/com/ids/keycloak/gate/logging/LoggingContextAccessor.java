package com.ids.keycloak.gate.logging;

/**
 * 로깅 컨텍스트에 데이터를 기록하는 추상화 인터페이스.
 */
public interface LoggingContextAccessor {

    /**
     * 컨텍스트에 키-값 쌍을 저장합니다.
     */
    void put(String key, String value);

    /**
     * 컨텍스트를 초기화합니다.
     */
    void clear();
}
