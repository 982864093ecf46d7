package com.ids.keycloak.gate.config;

import static com.ids.keycloak.gate.config.KeycloakGateConstants.LOGOUT_URL;

import com.ids.keycloak.gate.authentication.KeycloakLogoutHandler;
import com.ids.keycloak.gate.authentication.KeycloakLogoutSuccessHandler;
import com.ids.keycloak.gate.exception.KeycloakAccessDeniedHandler;
import com.ids.keycloak.gate.exception.KeycloakAuthenticationEntryPoint;
import com.ids.keycloak.gate.filter.MdcAuthenticationFilter;
import com.ids.keycloak.gate.filter.MdcRequestFilter;
import com.ids.keycloak.gate.filter.SessionAuthenticationFilter;
import com.ids.keycloak.gate.logging.LoggingContextAccessor;
import com.ids.keycloak.gate.session.KeycloakSessionManager;
import org.springframework.context.ApplicationContext;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.access.ExceptionTranslationFilter;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.security.web.context.NullSecurityContextRepository;
import org.springframework.security.web.context.SecurityContextHolderFilter;
import org.springframework.security.web.savedrequest.NullRequestCache;
import org.springframework.security.web.util.matcher.AntPathRequestMatcher;

/**
 * 세션 기반 인증에 필요한 핵심 설정을 {@link HttpSecurity}에 등록하는
 * {@link AbstractHttpConfigurer} 구현체입니다.
 * <p>
 * 이 Configurer는 다음을 설정합니다:
 * <ul>
 *   <li>세션 인증 필터 (SessionAuthenticationFilter)</li>
 *   <li>MDC 로깅 필터</li>
 *   <li>로그아웃 (GET /logout, end-session 리다이렉트)</li>
 *   <li>예외 핸들러</li>
 *   <li>세션 관리</li>
 * </ul>
 * </p>
 * <p>
 * 인가 설정(authorizeHttpRequests)은 이 Configurer에서 처리하지 않습니다.
 * <pre>
 * http.with(KeycloakGateHttpConfigurer.keycloakGate(), Customizer.withDefaults());
 * </pre>
 * </p>
 */
public final class KeycloakGateHttpConfigurer extends AbstractHttpConfigurer<KeycloakGateHttpConfigurer, HttpSecurity> {

    private KeycloakGateHttpConfigurer() {
    }

    public static KeycloakGateHttpConfigurer keycloakGate() {
        return new KeycloakGateHttpConfigurer();
    }

    @Override
    public void init(HttpSecurity http) throws Exception {
        ApplicationContext context = http.getSharedObject(ApplicationContext.class);

        // === Bean 조회 ===
        KeycloakAuthenticationEntryPoint authenticationEntryPoint = context.getBean(KeycloakAuthenticationEntryPoint.class);
        KeycloakAccessDeniedHandler accessDeniedHandler = context.getBean(KeycloakAccessDeniedHandler.class);
        KeycloakLogoutHandler logoutHandler = context.getBean(KeycloakLogoutHandler.class);
        KeycloakLogoutSuccessHandler logoutSuccessHandler = context.getBean(KeycloakLogoutSuccessHandler.class);

        // === 1. 세션 관리 ===
        // Spring Security가 세션을 생성하지 않음 (로그인 흐름에서 관리)
        // 세션 ID 교체는 로그인 완료 시 KeycloakSessionManager.establish에서 한 번만 수행
        http.sessionManagement(session -> session
            .sessionCreationPolicy(SessionCreationPolicy.NEVER)
            .sessionFixation(fixation -> fixation.none())
        );

        // SecurityContext를 세션에 저장하지 않음 - 매 요청마다 SessionAuthenticationFilter가 복원
        http.securityContext(securityContext -> securityContext
            .securityContextRepository(new NullSecurityContextRepository())
        );
        http.requestCache(cache -> cache.requestCache(new NullRequestCache()));

        // === 2. 로그아웃 설정 ===
        // 링크로 호출되는 프론트채널 로그아웃이므로 GET 요청을 처리
        http.logout(logout -> logout
            .logoutRequestMatcher(new AntPathRequestMatcher(LOGOUT_URL, "GET"))
            .addLogoutHandler(logoutHandler)
            .logoutSuccessHandler(logoutSuccessHandler)
        );

        // === 3. 예외 처리기 설정 ===
        http.exceptionHandling(customizer -> customizer
            .authenticationEntryPoint(authenticationEntryPoint)
            .accessDeniedHandler(accessDeniedHandler)
        );
    }

    @Override
    public void configure(HttpSecurity http) throws Exception {
        ApplicationContext context = http.getSharedObject(ApplicationContext.class);

        // === Bean 조회 ===
        KeycloakSessionManager sessionManager = context.getBean(KeycloakSessionManager.class);
        LoggingContextAccessor contextAccessor = context.getBean(LoggingContextAccessor.class);
        KeycloakGateProperties properties = context.getBean(KeycloakGateProperties.class);

        // === 4. 필터 등록 ===
        http.addFilterBefore(new MdcRequestFilter(contextAccessor, properties.logging()), SecurityContextHolderFilter.class);
        http.addFilterBefore(new SessionAuthenticationFilter(sessionManager), AnonymousAuthenticationFilter.class);
        http.addFilterBefore(new MdcAuthenticationFilter(contextAccessor, properties.logging()), ExceptionTranslationFilter.class);
    }
}
