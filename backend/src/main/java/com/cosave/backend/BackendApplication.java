package com.cosave.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.cosave.backend.auth.config.AuthModuleConfig;

/**
 * 세션/자격증명 서버 엔트리포인트
 *
 * 설정 값 주입 흐름:
 *   환경변수(APP_AUTH_JWT_ACCESS_SECRET, APP_AUTH_JWT_REFRESH_SECRET, SPRING_DATASOURCE_*)
 *     -> application.yml -> AuthProperties(@Validated, 규칙 위반 시 부팅 실패)
 *
 * - UserDetailsService 자동설정은 끈다. JWT 필터만 쓰므로 기본 인메모리 유저가 생기면 안 된다.
 * - @EnableScheduling: SessionHousekeeping 정리 작업
 */
@EnableScheduling
@Import(AuthModuleConfig.class)
@SpringBootApplication(exclude = {UserDetailsServiceAutoConfiguration.class})
public class BackendApplication {
    public static void main(String[] args) {
        SpringApplication.run(BackendApplication.class, args);
    }
}
