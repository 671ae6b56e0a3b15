package com.cosave.backend.auth.token.store;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import com.cosave.backend.auth.token.domain.RefreshRecord;
import com.cosave.backend.auth.token.domain.RefreshRecordDraft;
import com.cosave.backend.auth.token.domain.RefreshRevokeReason;

/**
 * Refresh 레코드 저장소 (세션 서브시스템에서 유일하게 영속 상태를 가진 컴포넌트)
 *
 * 모든 연산은 제한 시간(app.auth.store.timeout-seconds) 안에서 수행되고,
 * 시간 초과/커넥션 장애/락 경합은 StoreUnavailableException으로 통일한다.
 */
public interface RefreshRecordStore {

    /** 새 활성 레코드 INSERT */
    RefreshRecord create(RefreshRecordDraft draft);

    /**
     * 활성 레코드 조회. 없음/만료/폐기는 호출자에게 구분하지 않고 empty.
     * (실제 사유는 내부 로그로만 남긴다)
     */
    Optional<RefreshRecord> findActive(String recordId);

    /**
     * 원자적 로테이션: old가 여전히 활성인 경우에만 old 폐기(ROTATED, replacedBy) + successor INSERT.
     *
     * @throws AlreadyRotatedException old가 이미 로테이션됨 (경합 패배 or 재제출)
     * @throws RecordNotFoundException old가 없거나 다른 사유로 비활성
     * @throws StoreUnavailableException 타임아웃 포함. 이 경우 로테이션은 성공으로 간주하지 않는다.
     */
    RefreshRecord rotate(String oldRecordId, RefreshRecordDraft successor);

    /** 멱등 폐기. 이미 폐기된 레코드면 false */
    boolean revoke(String recordId, RefreshRevokeReason reason);

    /** 소유자의 아직 폐기되지 않은 레코드 전부 폐기. 폐기된 건수 반환 */
    int revokeAllActiveForOwner(Long ownerId, RefreshRevokeReason reason);

    List<RefreshRecord> listActiveForOwner(Long ownerId);

    /** revoked_at != null AND expires_at < before 인 레코드 삭제 */
    int purgeExpiredRevoked(LocalDateTime before);
}
