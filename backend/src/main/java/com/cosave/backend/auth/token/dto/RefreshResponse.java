package com.cosave.backend.auth.token.dto;

import java.time.Instant;

/**
 * /auth/refresh 응답 바디
 * - access token(JWT) + 만료 시각: 응답 JSON 바디
 * - refresh token: HttpOnly 쿠키로만 내려감
 */
public record RefreshResponse(String accessToken, Instant expiresAt) {}
