package com.cosave.backend.global;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 공통 API 에러 응답 DTO
 *
 * ControllerAdvice / EntryPoint / Filter 어디서 응답하든 같은 JSON 스키마를 유지한다.
 * - code: 클라이언트 분기용 안정 식별자 (ErrorCode.name())
 * - message: 사용자 메시지
 * - retryAfterSeconds: 재시도 가능 시간 (503일 때만)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        String code,
        String message,
        Integer retryAfterSeconds
) {
    public static ApiError of(ErrorCode errorCode) {
        return new ApiError(errorCode.name(), errorCode.defaultMessage(), null);
    }

    public static ApiError of(ErrorCode errorCode, Integer retryAfterSeconds) {
        return new ApiError(errorCode.name(), errorCode.defaultMessage(), retryAfterSeconds);
    }

    public static ApiError from(ApiException e) {
        return new ApiError(e.getCode(), e.getMessage(), null);
    }
}
