package com.cosave.backend.global;

import org.springframework.http.HttpStatus;

import lombok.Getter;

/**
 * ErrorCode 기반 비즈니스 예외
 *
 * - 상태코드/코드/메시지는 전부 ErrorCode에서 온다. 호출부에서 메시지를 만들지 않는다.
 * - 인증 계열은 하위 클래스(SessionRejectedException)가 실제 사유를 따로 들고, 응답 코드는 하나로 뭉갠다.
 *
 *   throw new ApiException(ErrorCode.SESSION_NOT_FOUND);
 */
@Getter
public class ApiException extends RuntimeException {

    private final ErrorCode errorCode;

    public ApiException(ErrorCode errorCode) {
        super(requireCode(errorCode).defaultMessage());
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return errorCode.status();
    }

    public String getCode() {
        return errorCode.name();
    }

    private static ErrorCode requireCode(ErrorCode errorCode) {
        if (errorCode == null) throw new IllegalArgumentException("ErrorCode must not be null");
        return errorCode;
    }
}
