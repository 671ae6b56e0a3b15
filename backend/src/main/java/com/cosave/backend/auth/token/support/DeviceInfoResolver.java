package com.cosave.backend.auth.token.support;

import org.springframework.http.HttpHeaders;

import com.cosave.backend.auth.token.domain.DeviceInfo;

import jakarta.servlet.http.HttpServletRequest;

/**
 * 요청에서 기기 메타데이터 추출
 * - IP: X-Forwarded-For의 첫 홉, 없으면 remoteAddr (리버스 프록시 뒤 배포 기준)
 */
public final class DeviceInfoResolver {
    private DeviceInfoResolver() {}

    private static final String FORWARDED_FOR = "X-Forwarded-For";

    public static DeviceInfo resolve(HttpServletRequest request) {
        return resolve(request, null, null);
    }

    public static DeviceInfo resolve(HttpServletRequest request, String deviceName, String deviceId) {
        return DeviceInfo.of(
                clientIp(request),
                request.getHeader(HttpHeaders.USER_AGENT),
                deviceName,
                deviceId
        );
    }

    private static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR);
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",", 2)[0].trim();
        }
        return request.getRemoteAddr();
    }
}
