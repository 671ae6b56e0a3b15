package com.cosave.backend.auth.token.store;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import com.cosave.backend.auth.config.AuthProperties;
import com.cosave.backend.auth.token.domain.RefreshRecord;
import com.cosave.backend.auth.token.domain.RefreshRecordDraft;
import com.cosave.backend.auth.token.domain.RefreshRevokeReason;
import com.cosave.backend.auth.token.repo.RefreshRecordRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * JPA 기반 RefreshRecordStore
 *
 * 트랜잭션:
 * - 연산마다 TransactionTemplate으로 경계를 잡고 timeout(app.auth.store.timeout-seconds)을 건다.
 *   (@Transactional(timeout=...)은 상수만 받으므로 설정값을 쓰려면 템플릿이 필요하다)
 * - 바깥 트랜잭션이 있으면 참여한다(LoginService). 이때 timeout은 바깥 경계의 것이 적용되므로 LoginService도 같은 값을 건다.
 *
 * 동시성:
 * - rotate는 조건부 UPDATE(rotateIfActive)의 영향 행 수로 승패를 정한다.
 *   이기면 같은 트랜잭션에서 successor를 INSERT, 지면 아무것도 쓰지 않고 롤백.
 *
 * 예외 변환:
 * - TransientDataAccessException(락 경합/쿼리 타임아웃 포함), DataAccessResourceFailureException,
 *   TransactionException(트랜잭션 타임아웃/생성 실패) → StoreUnavailableException
 */
@Slf4j
@Component
public class JpaRefreshRecordStore implements RefreshRecordStore {

    private final RefreshRecordRepository repository;
    private final TransactionTemplate writeTx;
    private final TransactionTemplate readTx;
    private final Clock clock;

    public JpaRefreshRecordStore(
            RefreshRecordRepository repository,
            PlatformTransactionManager transactionManager,
            AuthProperties props,
            Clock clock
    ) {
        this.repository = repository;
        this.clock = clock;

        int timeout = props.store().timeoutSeconds();

        this.writeTx = new TransactionTemplate(transactionManager);
        this.writeTx.setTimeout(timeout);

        this.readTx = new TransactionTemplate(transactionManager);
        this.readTx.setTimeout(timeout);
        this.readTx.setReadOnly(true);
    }

    @Override
    public RefreshRecord create(RefreshRecordDraft draft) {
        return guarded("create", () -> writeTx.execute(status ->
                repository.save(RefreshRecord.create(draft, now()))));
    }

    @Override
    public Optional<RefreshRecord> findActive(String recordId) {
        if (recordId == null || recordId.isBlank()) return Optional.empty();

        return guarded("findActive", () -> readTx.execute(status -> {
            LocalDateTime now = now();
            Optional<RefreshRecord> found = repository.findByRecordId(recordId);

            if (found.isEmpty()) {
                log.debug("refresh 레코드 없음: recordId={}", recordId);
                return Optional.<RefreshRecord>empty();
            }

            RefreshRecord record = found.get();
            if (!record.isActive(now)) {
                log.debug("refresh 레코드 비활성: recordId={}, reason={}", recordId, record.inactiveReason(now));
                return Optional.<RefreshRecord>empty();
            }
            return found;
        }));
    }

    @Override
    public RefreshRecord rotate(String oldRecordId, RefreshRecordDraft successor) {
        return guarded("rotate", () -> writeTx.execute(status -> {
            LocalDateTime now = now();

            int updated = repository.rotateIfActive(oldRecordId, successor.recordId(), RefreshRevokeReason.ROTATED, now);
            if (updated == 0) {
                throw losingReason(oldRecordId, now);
            }

            return repository.save(RefreshRecord.create(successor, now));
        }));
    }

    @Override
    public boolean revoke(String recordId, RefreshRevokeReason reason) {
        return guarded("revoke", () -> writeTx.execute(status ->
                repository.revokeIfNotRevoked(recordId, reason, now()) > 0));
    }

    @Override
    public int revokeAllActiveForOwner(Long ownerId, RefreshRevokeReason reason) {
        return guarded("revokeAllActiveForOwner", () -> writeTx.execute(status ->
                repository.revokeAllNotRevokedByOwner(ownerId, reason, now())));
    }

    @Override
    public List<RefreshRecord> listActiveForOwner(Long ownerId) {
        return guarded("listActiveForOwner", () -> readTx.execute(status ->
                repository.findActiveByOwner(ownerId, now())));
    }

    @Override
    public int purgeExpiredRevoked(LocalDateTime before) {
        return guarded("purgeExpiredRevoked", () -> writeTx.execute(status ->
                repository.deleteExpiredRevoked(before)));
    }

    // CAS 패배 사유 판정 (같은 트랜잭션, 커밋된 최신 상태 기준)
    private RefreshStoreException losingReason(String recordId, LocalDateTime now) {
        return repository.findByRecordId(recordId)
                .<RefreshStoreException>map(r -> r.isRotated()
                        ? new AlreadyRotatedException(recordId)
                        : new RecordNotFoundException(recordId, r.inactiveReason(now)))
                .orElseGet(() -> new RecordNotFoundException(recordId, "missing"));
    }

    private <T> T guarded(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (TransientDataAccessException | DataAccessResourceFailureException | TransactionException e) {
            throw new StoreUnavailableException(operation, e);
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
