package com.cosave.client.transport;

import java.time.Instant;
import java.util.Objects;

/**
 * 서버가 내려준 access token + 만료 시각.
 * 메모리에만 보관한다. refresh token은 transport가 쿠키로 따로 들고 있다.
 */
public record TokenGrant(String accessToken, Instant expiresAt) {

    public TokenGrant {
        Objects.requireNonNull(accessToken, "accessToken must not be null");
        if (accessToken.isBlank()) throw new IllegalArgumentException("accessToken must not be blank");
    }
}
