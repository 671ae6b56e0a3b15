package com.cosave.backend.auth.config;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneId;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * 인증 모듈 공용 빈
 * - AuthProperties 바인딩 + 검증 활성화
 * - Clock / SecureRandom / PasswordEncoder
 */
@Configuration
@EnableConfigurationProperties(AuthProperties.class)
public class AuthModuleConfig {

    private static final ZoneId KST = ZoneId.of("Asia/Seoul");

    /**
     * 서버 표준 타임존은 KST.
     * 테스트에서는 TestClockConfig가 Clock을 제공하므로 이 빈은 만들어지지 않는다.
     */
    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.system(KST);
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
