package com.cosave.backend.security;

import lombok.Getter;

/**
 * RequestAuthenticator 실패.
 * 필터는 MISSING을 제외한 모든 사유를 ACCESS_INVALID 하나로 응답한다. reason은 로그용.
 */
@Getter
public class AuthenticationFailedException extends RuntimeException {

    public enum Reason {
        MISSING,
        INVALID_SIGNATURE,
        EXPIRED,
        WRONG_AUDIENCE,
        USER_INACTIVE,
        IDENTITY_NOT_FOUND
    }

    private final Reason reason;

    public AuthenticationFailedException(Reason reason) {
        super("access authentication failed: " + reason);
        this.reason = reason;
    }

    public AuthenticationFailedException(Reason reason, Throwable cause) {
        super("access authentication failed: " + reason, cause);
        this.reason = reason;
    }
}
