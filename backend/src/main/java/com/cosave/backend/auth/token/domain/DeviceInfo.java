package com.cosave.backend.auth.token.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 세션 목록/감사용 기기 메타데이터 (전부 선택값)
 * 컬럼 길이를 넘는 값은 잘라서 저장한다.
 */
@Getter
@Embeddable
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DeviceInfo {

    public static final int IP_ADDRESS_MAX = 45;
    public static final int USER_AGENT_MAX = 255;
    public static final int DEVICE_NAME_MAX = 100;
    public static final int DEVICE_ID_MAX = 100;

    @Column(name = "ip_address", length = IP_ADDRESS_MAX)
    private String ipAddress;

    @Column(name = "user_agent", length = USER_AGENT_MAX)
    private String userAgent;

    @Column(name = "device_name", length = DEVICE_NAME_MAX)
    private String deviceName;

    @Column(name = "device_id", length = DEVICE_ID_MAX)
    private String deviceId;

    public static DeviceInfo of(String ipAddress, String userAgent, String deviceName, String deviceId) {
        DeviceInfo d = new DeviceInfo();
        d.ipAddress = trimToNullAndMax(ipAddress, IP_ADDRESS_MAX);
        d.userAgent = trimToNullAndMax(userAgent, USER_AGENT_MAX);
        d.deviceName = trimToNullAndMax(deviceName, DEVICE_NAME_MAX);
        d.deviceId = trimToNullAndMax(deviceId, DEVICE_ID_MAX);
        return d;
    }

    public static DeviceInfo unknown() {
        return new DeviceInfo();
    }

    /** 로테이션 시 후속 레코드로 넘길 사본 (요청의 최신 IP/UA가 있으면 그 값을 쓴다) */
    public DeviceInfo refreshedWith(DeviceInfo latest) {
        if (latest == null) return of(ipAddress, userAgent, deviceName, deviceId);
        return of(
                firstNonNull(latest.ipAddress, ipAddress),
                firstNonNull(latest.userAgent, userAgent),
                deviceName,
                deviceId
        );
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }

    private static String trimToNullAndMax(String v, int max) {
        if (v == null) return null;
        String t = v.trim();
        if (t.isEmpty()) return null;
        return t.length() <= max ? t : t.substring(0, max);
    }
}
