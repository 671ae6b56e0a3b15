package com.cosave.backend.auth.token.event;

import java.time.LocalDateTime;

/**
 * 세션 수명주기 감사 이벤트
 * - 외부 응답은 사유를 뭉개지만(REFRESH_INVALID / ACCESS_INVALID), 실제 사유는 여기 reason에 남는다.
 * - ownerId / recordId는 알 수 없는 경우 null (예: 서명 검증 실패)
 */
public record SessionAuditEvent(
        SessionAuditType type,
        Long ownerId,
        String recordId,
        String reason,
        LocalDateTime occurredAt
) {
    public static SessionAuditEvent of(SessionAuditType type, Long ownerId, String recordId, String reason, LocalDateTime now) {
        return new SessionAuditEvent(type, ownerId, recordId, reason, now);
    }
}
