package com.cosave.backend.auth.token.service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import com.cosave.backend.auth.config.AuthProperties;
import com.cosave.backend.auth.config.AuthProperties.ReusePolicy;
import com.cosave.backend.auth.identity.Identity;
import com.cosave.backend.auth.identity.IdentityStore;
import com.cosave.backend.auth.token.domain.DeviceInfo;
import com.cosave.backend.auth.token.domain.RefreshRecord;
import com.cosave.backend.auth.token.domain.RefreshRecordDraft;
import com.cosave.backend.auth.token.domain.RefreshRevokeReason;
import com.cosave.backend.auth.token.event.SessionAuditEvent;
import com.cosave.backend.auth.token.event.SessionAuditType;
import com.cosave.backend.auth.token.service.SessionRejectedException.RejectReason;
import com.cosave.backend.auth.token.store.AlreadyRotatedException;
import com.cosave.backend.auth.token.store.RecordNotFoundException;
import com.cosave.backend.auth.token.store.RefreshRecordStore;
import com.cosave.backend.auth.token.store.StoreUnavailableException;
import com.cosave.backend.auth.token.support.TokenHashUtils;
import com.cosave.backend.global.ApiException;
import com.cosave.backend.global.ErrorCode;
import com.cosave.backend.security.AuthPrincipal;
import com.cosave.backend.security.CredentialKind;
import com.cosave.backend.security.CredentialSigner;
import com.cosave.backend.security.CredentialSigner.IssuedAccess;
import com.cosave.backend.security.CredentialSigner.IssuedRefresh;
import com.cosave.backend.security.CredentialVerificationException;
import com.cosave.backend.security.VerifiedCredential;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 세션 발급/로테이션/종료 (Session Issuer)
 *
 * refresh 레코드 상태: ACTIVE → ROTATED (종료) 또는 ACTIVE → REVOKED (종료)
 *
 * refresh 흐름:
 * 1) 서명/만료/aud 검증 실패 → INVALID_TOKEN
 * 2) findActive 없음 → 재사용으로 판단 (이미 로테이션/폐기된 토큰이 다시 들어온 것)
 * 3) 소유자 + secret 해시 대조, 신원 활성 여부 확인
 * 4) store.rotate(CAS). 경합에서 지면(AlreadyRotated) 2)와 같은 재사용 정책 적용
 * 5) 새 access + 새 refresh 반환
 *
 * 재사용 정책(app.auth.refresh.reuse-policy):
 * - REVOKE_ALL_FOR_OWNER(기본): 소유자의 활성 레코드 전부 REUSE_DETECTED로 폐기 → 모든 기기 재로그인
 * - REJECT_TOKEN_ONLY: 제출된 토큰만 거절
 *
 * 트랜잭션:
 * - refresh는 메서드 단위 트랜잭션을 걸지 않는다. 저장소 연산이 각자 짧은 트랜잭션(timeout 포함)으로 커밋되고,
 *   원자성이 필요한 지점은 rotate 하나뿐이다.
 * - login은 LoginService 트랜잭션(lastLoginAt 갱신)에 참여한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionIssuer {

    private final CredentialSigner signer;
    private final RefreshRecordStore store;
    private final IdentityStore identityStore;
    private final ApplicationEventPublisher events;

    private final AuthProperties props;
    private final Clock clock;

    /** 새 세션 생성 + access/refresh 발급 */
    public SessionTokens login(Identity identity, boolean rememberMe, DeviceInfo deviceInfo) {
        if (identity == null) throw new IllegalArgumentException("identity must not be null");

        String recordId = RefreshRecord.newRecordId();
        IssuedRefresh refresh = signer.issueRefresh(identity.id(), recordId, refreshTtlSeconds(rememberMe));

        store.create(new RefreshRecordDraft(
                recordId,
                identity.id(),
                TokenHashUtils.sha256Hex(refresh.secret()),
                deviceInfo,
                rememberMe,
                toLocal(refresh.expiresAt())
        ));

        IssuedAccess access = signer.issueAccess(identity);

        publish(SessionAuditType.LOGIN, identity.id(), recordId, rememberMe ? "remember-me" : "session");
        return new SessionTokens(access.token(), access.expiresAt(), refresh.token(), refresh.expiresAt(), recordId);
    }

    /** refresh 로테이션 */
    public SessionTokens refresh(String refreshToken, DeviceInfo latest) {
        VerifiedCredential credential = verifyRefresh(refreshToken);
        Long ownerId = credential.ownerId();
        String recordId = credential.recordId();

        RefreshRecord current = store.findActive(recordId)
                .orElseThrow(() -> onReuse(ownerId, recordId, "record not active"));

        if (!current.isOwnedBy(ownerId) || !TokenHashUtils.matches(credential.secret(), current.getSecretHash())) {
            throw reject(RejectReason.INVALID_TOKEN, ownerId, recordId, "owner or secret mismatch");
        }

        Identity identity = identityStore.findById(ownerId)
                .filter(Identity::active)
                .orElseThrow(() -> reject(RejectReason.IDENTITY_UNAVAILABLE, ownerId, recordId, "identity missing or inactive"));

        // 후속 레코드: rememberMe 정책과 기기 정보를 이어받고, 수명은 로테이션 시점부터 다시 계산한다.
        String successorId = RefreshRecord.newRecordId();
        IssuedRefresh refresh = signer.issueRefresh(ownerId, successorId, refreshTtlSeconds(current.isRememberMe()));
        DeviceInfo device = current.getDeviceInfo() == null
                ? latest
                : current.getDeviceInfo().refreshedWith(latest);

        RefreshRecordDraft successor = new RefreshRecordDraft(
                successorId,
                ownerId,
                TokenHashUtils.sha256Hex(refresh.secret()),
                device,
                current.isRememberMe(),
                toLocal(refresh.expiresAt())
        );

        try {
            store.rotate(recordId, successor);
        } catch (AlreadyRotatedException | RecordNotFoundException e) {
            throw onReuse(ownerId, recordId, e.getMessage());
        }

        IssuedAccess access = signer.issueAccess(identity);

        publish(SessionAuditType.ROTATED, ownerId, recordId, "replacedBy=" + successorId);
        return new SessionTokens(access.token(), access.expiresAt(), refresh.token(), refresh.expiresAt(), successorId);
    }

    /**
     * 로그아웃 (best-effort, 멱등)
     * - 토큰이 없거나 무효여도 예외를 던지지 않는다. 호출자는 항상 쿠키를 지운다.
     * - 저장소 장애도 삼키지 않고 로그로 남긴 뒤 성공으로 끝낸다. (클라이언트 상태 정리가 우선)
     */
    public void logout(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) return;

        VerifiedCredential credential;
        try {
            credential = signer.verify(refreshToken, CredentialKind.REFRESH);
        } catch (CredentialVerificationException e) {
            log.debug("logout: refresh 검증 실패, 무시. failure={}", e.getFailure());
            return;
        }

        try {
            Optional<RefreshRecord> active = store.findActive(credential.recordId());
            if (active.isEmpty() || !TokenHashUtils.matches(credential.secret(), active.get().getSecretHash())) {
                return;
            }

            if (store.revoke(credential.recordId(), RefreshRevokeReason.LOGOUT)) {
                publish(SessionAuditType.LOGOUT, credential.ownerId(), credential.recordId(), null);
            }
        } catch (StoreUnavailableException e) {
            log.warn("logout: 세션 저장소 사용 불가, 서버 측 폐기 생략. recordId={}", credential.recordId(), e);
        }
    }

    /** 모든 기기 로그아웃 */
    public int logoutAll(Long ownerId) {
        if (ownerId == null) throw new IllegalArgumentException("ownerId must not be null");

        int revoked = store.revokeAllActiveForOwner(ownerId, RefreshRevokeReason.LOGOUT_ALL);
        publish(SessionAuditType.LOGOUT_ALL, ownerId, null, "revoked=" + revoked);
        return revoked;
    }

    /**
     * 활성 세션 목록
     * - 본인 것만 조회 가능. ADMIN은 임의 소유자 조회 가능.
     */
    public List<RefreshRecord> listSessions(AuthPrincipal actor, Long ownerId) {
        Long target = (ownerId == null) ? actor.userId() : ownerId;

        if (!actor.userId().equals(target) && !actor.isAdmin()) {
            throw new ApiException(ErrorCode.ACCESS_DENIED);
        }
        return store.listActiveForOwner(target);
    }

    /**
     * 세션 단건 폐기
     * - 남의 세션은 존재 여부를 드러내지 않도록 SESSION_NOT_FOUND로 응답한다. (ADMIN 제외)
     */
    public void revokeSession(AuthPrincipal actor, String recordId) {
        RefreshRecord record = store.findActive(recordId)
                .orElseThrow(() -> new ApiException(ErrorCode.SESSION_NOT_FOUND));

        RefreshRevokeReason reason;
        if (record.isOwnedBy(actor.userId())) {
            reason = RefreshRevokeReason.REVOKED_BY_USER;
        } else if (actor.isAdmin()) {
            reason = RefreshRevokeReason.REVOKED_BY_ADMIN;
        } else {
            throw new ApiException(ErrorCode.SESSION_NOT_FOUND);
        }

        if (store.revoke(recordId, reason)) {
            publish(SessionAuditType.SESSION_REVOKED, record.getOwnerId(), recordId, reason + " by=" + actor.userId());
        }
    }

    /** 요청의 refresh 쿠키가 가리키는 레코드 id (세션 목록의 current 표시용). 검증 실패면 empty */
    public Optional<String> currentRecordId(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) return Optional.empty();
        try {
            return Optional.of(signer.verify(refreshToken, CredentialKind.REFRESH).recordId());
        } catch (CredentialVerificationException e) {
            return Optional.empty();
        }
    }


    // ========= internals =========

    private VerifiedCredential verifyRefresh(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw reject(RejectReason.INVALID_TOKEN, null, null, "missing");
        }
        try {
            return signer.verify(refreshToken, CredentialKind.REFRESH);
        } catch (CredentialVerificationException e) {
            throw reject(RejectReason.INVALID_TOKEN, null, null, e.getFailure().name());
        }
    }

    // 재사용 탐지: 정책 적용 후 거절 예외를 돌려준다(호출자가 throw).
    private SessionRejectedException onReuse(Long ownerId, String recordId, String detail) {
        ReusePolicy policy = props.refresh().reusePolicy();
        log.warn("refresh 재사용 탐지: ownerId={}, recordId={}, policy={}, detail={}", ownerId, recordId, policy, detail);

        int revoked = 0;
        if (policy == ReusePolicy.REVOKE_ALL_FOR_OWNER) {
            revoked = store.revokeAllActiveForOwner(ownerId, RefreshRevokeReason.REUSE_DETECTED);
        }

        publish(SessionAuditType.REUSE_DETECTED, ownerId, recordId, policy + " revoked=" + revoked);
        return new SessionRejectedException(RejectReason.REVOKED_OR_REUSED);
    }

    private SessionRejectedException reject(RejectReason reason, Long ownerId, String recordId, String detail) {
        publish(SessionAuditType.REFRESH_REJECTED, ownerId, recordId, reason + ": " + detail);
        return new SessionRejectedException(reason);
    }

    private void publish(SessionAuditType type, Long ownerId, String recordId, String reason) {
        events.publishEvent(SessionAuditEvent.of(type, ownerId, recordId, reason, LocalDateTime.now(clock)));
    }

    private long refreshTtlSeconds(boolean rememberMe) {
        return rememberMe
                ? props.refresh().rememberMeSeconds()
                : props.refresh().sessionTtlSeconds();
    }

    private LocalDateTime toLocal(Instant instant) {
        return LocalDateTime.ofInstant(instant, clock.getZone());
    }
}
