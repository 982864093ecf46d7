package com.ids.keycloak.gate.config;

import com.ids.keycloak.gate.session.KeycloakSessionManager;
import com.ids.keycloak.gate.session.SignedCookieSerializer;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.session.MapSessionRepository;
import org.springframework.session.config.annotation.web.http.EnableSpringHttpSession;
import org.springframework.session.web.http.CookieSerializer;
import org.springframework.session.web.http.DefaultCookieSerializer;

/**
 * In-Memory 세션 저장소와 서명된 세션 쿠키 설정.
 * <p>
 * 단일 인스턴스 환경에 적합하며, 재시작 시 모든 세션이 사라집니다.
 * </p>
 */
@Configuration(proxyBeanMethods = false)
@EnableSpringHttpSession
@Slf4j
public class SessionConfiguration {

    public SessionConfiguration() {
        log.info("Keycloak Gate Session: In-Memory 세션 저장소가 활성화되었습니다.");
    }

    @Bean
    public MapSessionRepository sessionRepository(KeycloakGateProperties properties) {
        log.debug("MapSessionRepository 생성. timeout: {}", properties.session().timeout());
        MapSessionRepository repository = new MapSessionRepository(new ConcurrentHashMap<>());
        repository.setDefaultMaxInactiveInterval(properties.session().timeout());
        return repository;
    }

    @Bean
    public CookieSerializer cookieSerializer(KeycloakGateProperties properties) {
        KeycloakSessionProperties session = properties.session();

        DefaultCookieSerializer serializer = new DefaultCookieSerializer();
        serializer.setCookieName(session.cookieName());
        serializer.setCookiePath(session.path());
        if (session.domain() != null) {
            serializer.setDomainName(session.domain());
        }
        serializer.setUseSecureCookie(session.secure());
        serializer.setUseHttpOnlyCookie(session.httpOnly());
        serializer.setSameSite(session.sameSite());

        log.debug("세션 쿠키 설정. name: {}, sameSite: {}, secure: {}",
            session.cookieName(), session.sameSite(), session.secure());
        return new SignedCookieSerializer(serializer, session.secret());
    }

    @Bean
    public KeycloakSessionManager keycloakSessionManager() {
        log.debug("지원 Bean을 등록합니다: [KeycloakSessionManager]");
        return new KeycloakSessionManager();
    }
}
