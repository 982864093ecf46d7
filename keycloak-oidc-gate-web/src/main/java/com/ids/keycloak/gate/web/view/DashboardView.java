package com.ids.keycloak.gate.web.view;

import java.util.List;

/**
 * 대시보드 뷰 모델.
 *
 * @param mode  대시보드 종류 (user, admin)
 * @param email 표시 이름 (이메일, 없으면 preferred_username, 둘 다 없으면 "user")
 * @param roles 세션에 저장된 역할 목록
 */
public record DashboardView(String mode, String email, List<String> roles) {
}
