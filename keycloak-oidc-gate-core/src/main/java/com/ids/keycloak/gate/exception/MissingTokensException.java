package com.ids.keycloak.gate.exception;

import java.util.Collection;
import java.util.List;

/**
 * 코드 교환은 성공했지만 응답에 id_token 또는 access_token이 없는 경우의 예외입니다.
 * Provider 계약 위반으로 간주하며 재시도하지 않습니다.
 */
public class MissingTokensException extends KeycloakGateException {

    private final List<String> returnedKeys;

    public MissingTokensException(Collection<String> returnedKeys) {
        super(
            ErrorCode.MISSING_TOKENS,
            ErrorCode.MISSING_TOKENS.getDefaultMessage(),
            "keys=" + List.copyOf(returnedKeys),
            null
        );
        this.returnedKeys = List.copyOf(returnedKeys);
    }

    public List<String> getReturnedKeys() {
        return returnedKeys;
    }
}
