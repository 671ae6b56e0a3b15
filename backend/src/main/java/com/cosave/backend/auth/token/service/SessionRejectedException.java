package com.cosave.backend.auth.token.service;

import com.cosave.backend.global.ApiException;
import com.cosave.backend.global.ErrorCode;

import lombok.Getter;

/**
 * refresh 거절.
 * 외부 응답은 항상 REFRESH_INVALID 하나로 뭉개고, 내부 사유(reason)는 로그/감사/테스트에서만 본다.
 */
@Getter
public class SessionRejectedException extends ApiException {

    public enum RejectReason {
        /** 서명 오류 / 만료 / aud 불일치 / 형식 오류 / secret 불일치 */
        INVALID_TOKEN,
        /** 이미 로테이션 또는 폐기된 레코드 재제출, 로테이션 경합 패배 */
        REVOKED_OR_REUSED,
        /** 소유자 신원이 없거나 비활성 */
        IDENTITY_UNAVAILABLE
    }

    private final RejectReason reason;

    public SessionRejectedException(RejectReason reason) {
        super(ErrorCode.REFRESH_INVALID);
        this.reason = reason;
    }
}
