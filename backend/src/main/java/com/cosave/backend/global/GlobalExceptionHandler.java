package com.cosave.backend.global;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.cosave.backend.auth.token.store.StoreUnavailableException;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;

/**
 * 전역 예외 처리기
 * - 컨트롤러/서비스에서 발생한 예외를 공통 응답(ApiError)으로 변환한다.
 * - HTTP 상태코드는 ErrorCode/ApiException에서만 결정된다.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final int STORE_RETRY_AFTER_SECONDS = 1;

    /** 비즈니스 로직이 의도적으로 던진 예외 */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiError> handleApiException(ApiException e) {
        return ResponseEntity.status(e.getStatus()).body(ApiError.from(e));
    }

    /**
     * 세션 저장소 일시 장애(타임아웃/커넥션/락 경합)
     * - "인증 실패"가 아니라 재시도 가능한 503으로 내려야 클라이언트가 강제 로그아웃하지 않는다.
     */
    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ApiError> handleStoreUnavailable(StoreUnavailableException e) {
        log.warn("세션 저장소 사용 불가: {}", e.getMessage());

        return ResponseEntity
                .status(ErrorCode.AUTH_STORE_UNAVAILABLE.status())
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(STORE_RETRY_AFTER_SECONDS))
                .body(ApiError.of(ErrorCode.AUTH_STORE_UNAVAILABLE, STORE_RETRY_AFTER_SECONDS));
    }

    /** @RequestBody + @Valid 검증 실패. 상세는 로그로만 */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleMethodArgumentNotValid(MethodArgumentNotValidException e) {

        e.getBindingResult().getFieldErrors()
                .forEach(fe -> log.warn("요청 검증 실패: field={}, message={}", fe.getField(), fe.getDefaultMessage()));

        return ResponseEntity
                .status(ErrorCode.VALIDATION_ERROR.status())
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR));
    }

    /** @RequestParam / @PathVariable 제약 위반 */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(ConstraintViolationException e) {

        e.getConstraintViolations()
                .forEach(v -> log.warn("요청 검증 실패: path={}, message={}", v.getPropertyPath(), v.getMessage()));

        return ResponseEntity
                .status(ErrorCode.VALIDATION_ERROR.status())
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR));
    }

    /** 처리되지 않은 예외(버그/장애) */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnhandled(Exception e) {
        log.error("처리되지 않은 예외", e);
        return ResponseEntity
                .status(ErrorCode.INTERNAL_ERROR.status())
                .body(ApiError.of(ErrorCode.INTERNAL_ERROR));
    }
}
