package com.cosave.backend.global;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드(클라이언트 분기용) + HTTP 상태 + 기본 메시지의 단일 소스.
 *
 * 원칙:
 * - code = enum name() (변경 시 API 계약 깨짐)
 * - 인증 실패 계열은 세부 사유를 코드로 노출하지 않는다. (실제 사유는 감사 로그로만 남긴다)
 */
public enum ErrorCode {

    // Login
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED,
            "이메일 또는 비밀번호가 올바르지 않습니다."),
    ACCOUNT_DISABLED(HttpStatus.FORBIDDEN,
            "사용할 수 없는 계정 상태입니다."),

    // Auth / Security
    AUTH_REQUIRED(HttpStatus.UNAUTHORIZED,
            "인증이 필요합니다."),
    ACCESS_INVALID(HttpStatus.UNAUTHORIZED,
            "엑세스 토큰이 유효하지 않습니다."), // 서명 오류/만료/비활성 계정 모두 이 코드로 뭉갠다
    ACCESS_DENIED(HttpStatus.FORBIDDEN,
            "접근 권한이 없습니다."),

    // Refresh token (서명 오류/만료/재사용/폐기 모두 동일 코드)
    REFRESH_INVALID(HttpStatus.UNAUTHORIZED,
            "리프레시 토큰이 유효하지 않습니다."),

    // Session
    SESSION_NOT_FOUND(HttpStatus.NOT_FOUND,
            "세션을 찾을 수 없습니다."),
    AUTH_STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE,
            "일시적으로 인증 처리를 할 수 없습니다. 잠시 후 다시 시도해주세요."),

    // User / Data consistency
    USER_NOT_FOUND(HttpStatus.UNAUTHORIZED,
            "사용자를 찾을 수 없습니다."),

    // Validation / Common
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST,
            "요청 값이 올바르지 않습니다."),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR,
            "서버 오류가 발생했습니다.");

    private final HttpStatus status;
    private final String defaultMessage;

    ErrorCode(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
