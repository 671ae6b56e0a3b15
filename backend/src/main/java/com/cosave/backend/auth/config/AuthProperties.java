package com.cosave.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/*
  app.auth.* 값을 타입 안전하게 바인딩한다. 규칙 위반 시 부팅 실패(fail-fast).

  app:
    auth:
      jwt:
        issuer: cosave-session
        access-ttl-seconds: 900
        access-secret: ${APP_AUTH_JWT_ACCESS_SECRET}
        refresh-secret: ${APP_AUTH_JWT_REFRESH_SECRET}

      refresh:
        cookie-name: CS_REFRESH
        cookie-path: /auth
        cookie-same-site: Lax
        cookie-secure: true
        remember-me-seconds: 2592000
        session-ttl-seconds: 604800
        reuse-policy: REVOKE_ALL_FOR_OWNER

      store:
        timeout-seconds: 3

      housekeeping:
        retention-days: 30
        cron: "0 30 4 * * *"
 */
@Validated
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(@Valid @NotNull Jwt jwt,
                             @Valid @NotNull Refresh refresh,
                             @Valid @NotNull Store store,
                             @Valid @NotNull Housekeeping housekeeping) {

    /**
     * 서명 키 설정
     * - accessSecret / refreshSecret: HS256 키. 두 토큰 종류가 서로 대체되지 않도록 키를 분리한다.
     * - accessTtlSeconds: Access Token 수명 (권장 10~15분)
     * - refresh 토큰 수명은 Refresh.rememberMeSeconds / sessionTtlSeconds를 따른다.
     */
    public record Jwt(
            @NotBlank String issuer,
            @Min(1) long accessTtlSeconds,
            @NotBlank @Size(min = 32) String accessSecret,
            @NotBlank @Size(min = 32) String refreshSecret
    ) {}

    /**
     * Refresh Token + 쿠키 설정
     * - cookiePath: 이 경로 하위 요청에만 쿠키 전송 (/auth)
     * - rememberMeSeconds / sessionTtlSeconds: rememberMe 여부에 따른 refresh 수명
     * - reusePolicy: 재사용 탐지 시 처리 정책
     */
    public record Refresh(
            @NotBlank String cookieName,

            @NotBlank @Pattern(regexp = "^/.*", message = "cookiePath must start with '/'")
            String cookiePath,

            @NotNull SameSite cookieSameSite,

            boolean cookieSecure,

            @Min(1) long rememberMeSeconds,

            @Min(1) long sessionTtlSeconds,

            @NotNull ReusePolicy reusePolicy
    ) {}

    /** 세션 저장소 트랜잭션 타임아웃(초). 모든 저장소 연산에 적용된다. */
    public record Store(@Min(1) @Max(30) int timeoutSeconds) {}

    /** 만료 + 폐기된 레코드 정리 주기/보존 기간 */
    public record Housekeeping(@Min(1) int retentionDays, @NotBlank String cron) {}

    public enum SameSite {
        Lax, Strict, None
    }

    /**
     * 재사용(이미 로테이션/폐기된 refresh 재제출, 로테이션 경합 패배) 탐지 시 정책
     * - REVOKE_ALL_FOR_OWNER: 소유자의 모든 활성 세션 폐기 (기본값)
     * - REJECT_TOKEN_ONLY: 제출된 토큰만 거절
     */
    public enum ReusePolicy {
        REVOKE_ALL_FOR_OWNER, REJECT_TOKEN_ONLY
    }
}
