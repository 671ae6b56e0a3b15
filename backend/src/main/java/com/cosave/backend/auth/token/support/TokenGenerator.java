package com.cosave.backend.auth.token.support;

import java.security.SecureRandom;
import java.util.Base64;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * Refresh secret 생성기
 *
 * - SecureRandom 48바이트(384bit): secret_hash 충돌 확률을 무시 가능한 수준으로 만든다.
 * - Base64 URL-safe, padding 제거 (JWT 클레임/쿠키에 안전한 문자셋)
 */
@Component
@RequiredArgsConstructor
public class TokenGenerator {

    private static final int SECRET_BYTES = 48;

    private final SecureRandom secureRandom;

    public String generateSecret() {
        byte[] bytes = new byte[SECRET_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
