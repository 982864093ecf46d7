package com.ids.keycloak.gate.web;

import static com.ids.keycloak.gate.config.KeycloakGateConstants.CALLBACK_URL;
import static com.ids.keycloak.gate.config.KeycloakGateConstants.LOGIN_URL;

import com.ids.keycloak.gate.authentication.OidcLoginFlow;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.net.URI;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * OIDC 로그인 시작과 콜백 엔드포인트.
 * 실패 응답은 {@link com.ids.keycloak.gate.exception.OidcFlowExceptionHandler}가 처리합니다.
 */
@RestController
@RequiredArgsConstructor
public class OidcLoginController {

    private final OidcLoginFlow loginFlow;

    @GetMapping(LOGIN_URL)
    public ResponseEntity<Void> login(HttpServletRequest request, HttpServletResponse response) {
        return redirect(loginFlow.initiate(request, response));
    }

    @GetMapping(CALLBACK_URL)
    public ResponseEntity<Void> callback(HttpServletRequest request, HttpServletResponse response) {
        return redirect(loginFlow.complete(request, response));
    }

    private static ResponseEntity<Void> redirect(String location) {
        return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(location)).build();
    }
}
