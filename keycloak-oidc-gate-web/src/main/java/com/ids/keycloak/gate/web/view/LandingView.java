package com.ids.keycloak.gate.web.view;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 랜딩 페이지 뷰 모델. 로그인하지 않은 경우 user, email은 생략됩니다.
 *
 * @param realm       Keycloak realm 이름
 * @param keycloakUrl 브라우저가 접근하는 Keycloak base URL
 * @param user        로그인한 사용자의 subject
 * @param email       로그인한 사용자의 이메일
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LandingView(String realm, String keycloakUrl, String user, String email) {
}
