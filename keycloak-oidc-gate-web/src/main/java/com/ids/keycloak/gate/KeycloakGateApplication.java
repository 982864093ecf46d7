package com.ids.keycloak.gate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

// 사용자 인증은 Keycloak에 위임하므로 로컬 사용자 저장소는 사용하지 않음
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class KeycloakGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(KeycloakGateApplication.class, args);
    }
}
