package com.cosave.backend.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import lombok.RequiredArgsConstructor;

/**
 * Spring Security 전역 보안 설정
 *
 * - access token 인증: JwtAuthenticationFilter (RequestAuthenticator 위임)
 * - 인증 없이 보호 리소스 접근: RestAuthEntryPoint (401 AUTH_REQUIRED)
 * - 역할 부족: RestAccessDeniedHandler (403 ACCESS_DENIED)
 * - 토큰은 있는데 무효: JwtAuthenticationFilter (401 ACCESS_INVALID)
 *
 * refresh 토큰은 쿠키로만 오가고 access token은 헤더로만 받으므로 CSRF/세션/폼 로그인은 끈다.
 */
@Configuration
@RequiredArgsConstructor
public class SecurityConfig {

    private final RequestAuthenticator requestAuthenticator;
    private final SecurityErrorWriter securityErrorWriter;

    @Bean
    RestAuthEntryPoint restAuthEntryPoint() {
        return new RestAuthEntryPoint(securityErrorWriter);
    }

    @Bean
    RestAccessDeniedHandler restAccessDeniedHandler() {
        return new RestAccessDeniedHandler(securityErrorWriter);
    }

    @Bean
    JwtAuthenticationFilter jwtAuthenticationFilter() {
        return new JwtAuthenticationFilter(requestAuthenticator, securityErrorWriter);
    }

    @Bean
    SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        return http
                .csrf(csrf -> csrf.disable())
                .httpBasic(b -> b.disable())
                .formLogin(f -> f.disable())
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))

                .exceptionHandling(eh -> eh
                        .authenticationEntryPoint(restAuthEntryPoint())
                        .accessDeniedHandler(restAccessDeniedHandler()))

                .addFilterBefore(jwtAuthenticationFilter(), UsernamePasswordAuthenticationFilter.class)

                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/error").permitAll()

                        // K8s Liveness/Readiness Probe
                        .requestMatchers("/actuator/health/**").permitAll()

                        // 인증 필요 없는 Auth 엔드포인트 (refresh/logout은 쿠키로 동작)
                        .requestMatchers("/auth/login").permitAll()
                        .requestMatchers("/auth/refresh").permitAll()
                        .requestMatchers("/auth/logout").permitAll()

                        .requestMatchers("/auth/admin/**").hasRole(AuthPrincipal.ADMIN)

                        // 그 외는 인증 필요 (/auth/me, /auth/sessions, /auth/logout-all 포함)
                        .anyRequest().authenticated()
                )
                .build();
    }
}
