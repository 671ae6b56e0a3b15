package com.cosave.backend.auth.token.service;

import java.time.Instant;

/**
 * 로그인/로테이션 결과
 * - accessToken: 응답 바디
 * - refreshToken: HttpOnly 쿠키 (refreshExpiresAt까지)
 */
public record SessionTokens(
        String accessToken,
        Instant accessExpiresAt,
        String refreshToken,
        Instant refreshExpiresAt,
        String recordId
) {}
