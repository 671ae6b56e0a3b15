package com.cosave.backend.auth.token.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 감사 이벤트를 전용 로거(AUDIT)로 기록한다.
 *
 * - 트랜잭션 안에서 발행되면 커밋 이후에만 기록한다. (롤백된 로그인/로테이션은 남지 않음)
 * - 트랜잭션 밖(저장소 연산이 각자 커밋하는 refresh 경로 등)에서 발행되면 즉시 기록한다.
 */
@Component
public class SessionAuditLogListener {

    private static final Logger AUDIT = LoggerFactory.getLogger("AUDIT");

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void on(SessionAuditEvent event) {
        if (event.type() == SessionAuditType.REUSE_DETECTED) {
            AUDIT.warn("type={} ownerId={} recordId={} reason={} at={}",
                    event.type(), event.ownerId(), event.recordId(), event.reason(), event.occurredAt());
            return;
        }

        AUDIT.info("type={} ownerId={} recordId={} reason={} at={}",
                event.type(), event.ownerId(), event.recordId(), event.reason(), event.occurredAt());
    }
}
