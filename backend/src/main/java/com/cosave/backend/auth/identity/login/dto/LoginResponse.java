package com.cosave.backend.auth.identity.login.dto;

import java.time.Instant;

/**
 * 로그인 응답 DTO
 * - accessToken + expiresAt: 바디. 이후 요청에 Authorization: Bearer {accessToken}
 * - refreshToken: 바디에 넣지 않고 HttpOnly 쿠키(Set-Cookie)로만 반환
 */
public record LoginResponse(String accessToken, Instant expiresAt) {}
