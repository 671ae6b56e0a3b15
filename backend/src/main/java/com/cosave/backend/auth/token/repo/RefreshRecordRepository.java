package com.cosave.backend.auth.token.repo;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.cosave.backend.auth.token.domain.RefreshRecord;
import com.cosave.backend.auth.token.domain.RefreshRevokeReason;

@Repository
public interface RefreshRecordRepository extends JpaRepository<RefreshRecord, Long> {

    Optional<RefreshRecord> findByRecordId(String recordId);

    List<RefreshRecord> findAllByOwnerId(Long ownerId);

    /**
     * 로테이션 CAS (compare-and-swap)
     *
     * - "아직 활성인 경우에만" 폐기 + replaced_by 기록. 영향 행 수로 승패를 판정한다.
     * - 같은 record_id로 동시에 두 UPDATE가 오면 DB 행 잠금으로 직렬화되고,
     *   뒤에 들어온 쪽은 커밋된 revoked_at을 보고 조건 불일치 → 0 rows.
     * - 프로세스 내부 락이 아니라 DB가 판정하므로 여러 서버 인스턴스에서도 안전하다.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update RefreshRecord r
               set r.revokedAt = :now,
                   r.revokeReason = :reason,
                   r.replacedBy = :successorId,
                   r.lastUsedAt = :now
             where r.recordId = :recordId
               and r.revokedAt is null
               and r.expiresAt > :now
            """)
    int rotateIfActive(@Param("recordId") String recordId,
                       @Param("successorId") String successorId,
                       @Param("reason") RefreshRevokeReason reason,
                       @Param("now") LocalDateTime now);

    /** 단건 폐기. 이미 폐기된 레코드는 건드리지 않는다(멱등 + 단조성). */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update RefreshRecord r
               set r.revokedAt = :now,
                   r.revokeReason = :reason
             where r.recordId = :recordId
               and r.revokedAt is null
            """)
    int revokeIfNotRevoked(@Param("recordId") String recordId,
                           @Param("reason") RefreshRevokeReason reason,
                           @Param("now") LocalDateTime now);

    /** 소유자 단위 일괄 폐기 (모든 기기 로그아웃 / 재사용 탐지) */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update RefreshRecord r
               set r.revokedAt = :now,
                   r.revokeReason = :reason
             where r.ownerId = :ownerId
               and r.revokedAt is null
            """)
    int revokeAllNotRevokedByOwner(@Param("ownerId") Long ownerId,
                                   @Param("reason") RefreshRevokeReason reason,
                                   @Param("now") LocalDateTime now);

    @Query("""
            select r from RefreshRecord r
             where r.ownerId = :ownerId
               and r.revokedAt is null
               and r.expiresAt > :now
             order by r.createdAt desc, r.id desc
            """)
    List<RefreshRecord> findActiveByOwner(@Param("ownerId") Long ownerId, @Param("now") LocalDateTime now);

    /** 종료 상태(폐기 + 만료) 레코드만 삭제한다. */
    @Modifying
    @Query("""
            delete from RefreshRecord r
             where r.revokedAt is not null
               and r.expiresAt < :before
            """)
    int deleteExpiredRevoked(@Param("before") LocalDateTime before);
}
