package com.cosave.backend.auth.token.domain;

/**
 * Refresh 레코드 폐기 사유. 한 번 기록되면 바뀌지 않는다.
 *
 * ROTATED: 정상 로테이션으로 후속 레코드(replacedBy)로 교체됨
 * LOGOUT: 이 기기에서 로그아웃
 * LOGOUT_ALL: 모든 기기에서 로그아웃
 * REVOKED_BY_USER: 세션 목록에서 사용자가 직접 종료
 * REVOKED_BY_ADMIN: 관리자가 종료
 * REUSE_DETECTED: 재사용 탐지로 소유자 세션 일괄 폐기
 */
public enum RefreshRevokeReason {
    ROTATED, LOGOUT, LOGOUT_ALL, REVOKED_BY_USER, REVOKED_BY_ADMIN, REUSE_DETECTED
}
