package com.cosave.backend.security;

import java.time.Instant;
import java.util.List;

/**
 * 서명/만료/aud 검증을 통과한 토큰의 payload
 *
 * - ACCESS: ownerId, email, roles
 * - REFRESH: ownerId, recordId(jti), secret
 */
public record VerifiedCredential(
        CredentialKind kind,
        Long ownerId,
        String email,
        List<String> roles,
        String recordId,
        String secret,
        Instant expiresAt
) {}
