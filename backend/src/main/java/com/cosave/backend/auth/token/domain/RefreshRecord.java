package com.cosave.backend.auth.token.domain;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * refresh_records 테이블 매핑 엔티티 (서버가 관리하는 로그인 세션)
 *
 * - Access Token은 저장하지 않는다(Stateless). Refresh만 서버가 상태로 관리한다.
 * - record_id: 외부에 노출되는 세션 식별자(UUID). refresh JWT의 jti.
 * - secret_hash: refresh JWT에 실린 랜덤 secret의 sha256 hex. 원문은 저장하지 않는다.
 *
 * 불변 조건:
 * 1) active ⇔ revoked_at IS NULL AND expires_at > now
 * 2) revoked_at은 한 번 설정되면 바뀌지 않는다. (폐기 UPDATE는 항상 "revoked_at IS NULL" 조건부)
 * 3) 로테이션은 "이전 레코드 폐기(ROTATED + replaced_by) + 후속 레코드 INSERT"를 한 트랜잭션에서 수행한다.
 *    (JpaRefreshRecordStore.rotate)
 */
@Getter
@Entity
@Table(
    name = "refresh_records",
    indexes = {
        @Index(name = "uq_refresh_record_id", columnList = "record_id", unique = true),
        @Index(name = "uq_refresh_secret_hash", columnList = "secret_hash", unique = true),
        @Index(name = "idx_refresh_owner_revoked", columnList = "owner_id, revoked_at")
    }
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RefreshRecord {

    public static final int RECORD_ID_LEN = 36;
    public static final int SECRET_HASH_LEN = 64;

    private static final String HEX64_REGEX = "^[0-9a-f]{64}$";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "record_id", nullable = false, length = RECORD_ID_LEN, updatable = false)
    private String recordId;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private Long ownerId;

    @Column(name = "secret_hash", nullable = false, length = SECRET_HASH_LEN, updatable = false)
    private String secretHash;

    @Column(name = "remember_me", nullable = false)
    private boolean rememberMe;

    @Embedded
    private DeviceInfo deviceInfo;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "last_used_at")
    private LocalDateTime lastUsedAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "revoked_at")
    private LocalDateTime revokedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "revoke_reason", length = 30)
    private RefreshRevokeReason revokeReason;

    @Column(name = "replaced_by", length = RECORD_ID_LEN)
    private String replacedBy;


    // ========= factory =========

    public static String newRecordId() {
        return UUID.randomUUID().toString();
    }

    public static RefreshRecord create(RefreshRecordDraft draft, LocalDateTime now) {
        require(draft != null, "draft must not be null");
        require(now != null, "now must not be null");
        require(draft.expiresAt().isAfter(now), "expiresAt must be after now");

        RefreshRecord r = new RefreshRecord();
        r.recordId = draft.recordId();
        r.ownerId = draft.ownerId();
        r.secretHash = requireSecretHash(draft.secretHash());
        r.rememberMe = draft.rememberMe();
        r.deviceInfo = draft.deviceInfo() == null ? DeviceInfo.unknown() : draft.deviceInfo();
        r.createdAt = now;
        r.lastUsedAt = now;
        r.expiresAt = draft.expiresAt();
        return r;
    }


    // ========= domain =========

    public boolean isActive(LocalDateTime now) {
        return !isRevoked() && !isExpired(now);
    }

    public boolean isExpired(LocalDateTime now) {
        Objects.requireNonNull(now, "now must not be null");
        return !expiresAt.isAfter(now);
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean isRotated() {
        return revokeReason == RefreshRevokeReason.ROTATED;
    }

    public boolean isOwnedBy(Long userId) {
        return ownerId.equals(userId);
    }

    /** findActive 실패 사유(내부 로그용) */
    public String inactiveReason(LocalDateTime now) {
        if (isRevoked()) return "revoked:" + revokeReason;
        if (isExpired(now)) return "expired";
        return "active";
    }


    // ========= helpers =========

    private static String requireSecretHash(String secretHash) {
        require(secretHash != null, "secretHash must not be null");
        require(secretHash.matches(HEX64_REGEX), "secretHash must be lowercase hex(64)");
        return secretHash;
    }

    private static void require(boolean cond, String msg) {
        if (!cond) throw new IllegalArgumentException(msg);
    }
}
