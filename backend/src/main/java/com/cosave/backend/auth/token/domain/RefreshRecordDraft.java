package com.cosave.backend.auth.token.domain;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 저장 전 refresh 레코드 재료.
 * recordId는 refresh JWT의 jti로 먼저 서명되어야 하므로 호출자가 미리 정한다.
 */
public record RefreshRecordDraft(
        String recordId,
        Long ownerId,
        String secretHash,
        DeviceInfo deviceInfo,
        boolean rememberMe,
        LocalDateTime expiresAt
) {
    public RefreshRecordDraft {
        Objects.requireNonNull(recordId, "recordId must not be null");
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(secretHash, "secretHash must not be null");
        Objects.requireNonNull(expiresAt, "expiresAt must not be null");
    }
}
