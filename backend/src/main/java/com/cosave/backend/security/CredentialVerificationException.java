package com.cosave.backend.security;

import lombok.Getter;

/**
 * HTTP와 분리된 "토큰 검증 실패" 예외.
 * 호출자(필터/SessionIssuer)가 외부 응답 코드로 변환한다. 실패 사유는 로그/감사 이벤트용.
 */
@Getter
public class CredentialVerificationException extends RuntimeException {

    public enum Failure {
        INVALID_SIGNATURE, EXPIRED, WRONG_AUDIENCE
    }

    private final Failure failure;

    public CredentialVerificationException(Failure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }
}
