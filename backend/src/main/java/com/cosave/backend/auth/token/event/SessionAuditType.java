package com.cosave.backend.auth.token.event;

public enum SessionAuditType {
    LOGIN,
    ROTATED,
    LOGOUT,
    LOGOUT_ALL,
    SESSION_REVOKED,
    REUSE_DETECTED,
    REFRESH_REJECTED
}
