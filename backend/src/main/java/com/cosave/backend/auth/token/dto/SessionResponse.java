package com.cosave.backend.auth.token.dto;

import java.time.LocalDateTime;

import com.cosave.backend.auth.token.domain.DeviceInfo;
import com.cosave.backend.auth.token.domain.RefreshRecord;

/** 활성 세션 목록 항목. current = 요청의 refresh 쿠키가 가리키는 세션 */
public record SessionResponse(
        String recordId,
        Long ownerId,
        String ipAddress,
        String userAgent,
        String deviceName,
        String deviceId,
        boolean rememberMe,
        LocalDateTime createdAt,
        LocalDateTime lastUsedAt,
        LocalDateTime expiresAt,
        boolean current
) {
    public static SessionResponse from(RefreshRecord r, String currentRecordId) {
        DeviceInfo d = r.getDeviceInfo() == null ? DeviceInfo.unknown() : r.getDeviceInfo();
        return new SessionResponse(
                r.getRecordId(),
                r.getOwnerId(),
                d.getIpAddress(),
                d.getUserAgent(),
                d.getDeviceName(),
                d.getDeviceId(),
                r.isRememberMe(),
                r.getCreatedAt(),
                r.getLastUsedAt(),
                r.getExpiresAt(),
                r.getRecordId().equals(currentRecordId)
        );
    }
}
