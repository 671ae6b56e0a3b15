package com.cosave.client;

import java.time.Duration;
import java.util.Objects;

import io.github.resilience4j.core.IntervalFunction;

/**
 * 클라이언트 세션 매니저 설정
 *
 * - refreshTimeout: refresh 1회 대기 상한 (transport connect/read 타임아웃에도 쓴다)
 * - maxRenewAttempts: renew() 최대 시도 횟수 (첫 시도 포함)
 * - backoffBase / backoffCap: 재시도 간격 min(base * 2^(attempt-1), cap)
 */
public record ClientSessionSettings(
        Duration refreshTimeout,
        int maxRenewAttempts,
        Duration backoffBase,
        Duration backoffCap
) {

    private static final Duration MAX_REFRESH_TIMEOUT = Duration.ofSeconds(5);

    public ClientSessionSettings {
        Objects.requireNonNull(refreshTimeout, "refreshTimeout must not be null");
        Objects.requireNonNull(backoffBase, "backoffBase must not be null");
        Objects.requireNonNull(backoffCap, "backoffCap must not be null");

        if (refreshTimeout.isZero() || refreshTimeout.isNegative() || refreshTimeout.compareTo(MAX_REFRESH_TIMEOUT) > 0) {
            throw new IllegalArgumentException("refreshTimeout must be in (0, 5s]");
        }
        if (maxRenewAttempts < 1) {
            throw new IllegalArgumentException("maxRenewAttempts must be >= 1");
        }
        if (backoffBase.toMillis() < 1 || backoffCap.compareTo(backoffBase) < 0) {
            throw new IllegalArgumentException("backoff must satisfy 1ms <= base <= cap");
        }
    }

    public static ClientSessionSettings defaults() {
        return new ClientSessionSettings(Duration.ofSeconds(5), 3, Duration.ofMillis(500), Duration.ofSeconds(4));
    }

    public IntervalFunction intervalFunction() {
        return IntervalFunction.ofExponentialBackoff(backoffBase.toMillis(), 2.0, backoffCap.toMillis());
    }
}
