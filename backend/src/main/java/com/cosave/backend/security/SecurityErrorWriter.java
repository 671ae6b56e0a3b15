package com.cosave.backend.security;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import com.cosave.backend.global.ApiError;
import com.cosave.backend.global.ErrorCode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * Security 레이어(필터/EntryPoint/AccessDeniedHandler)에서 ApiError 포맷으로 응답을 쓴다.
 * Security Filter Chain에서 막힌 요청은 @Controller까지 오지 않으므로 GlobalExceptionHandler가 처리하지 못한다.
 */
@Component
@RequiredArgsConstructor
public class SecurityErrorWriter {

    static final int STORE_RETRY_AFTER_SECONDS = 1;

    private final ObjectMapper objectMapper;

    public void write(HttpServletResponse response, ErrorCode errorCode) throws IOException {
        write(response, errorCode, ApiError.of(errorCode));
    }

    public void writeStoreUnavailable(HttpServletResponse response) throws IOException {
        if (response.isCommitted()) return;

        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(STORE_RETRY_AFTER_SECONDS));
        write(response, ErrorCode.AUTH_STORE_UNAVAILABLE,
                ApiError.of(ErrorCode.AUTH_STORE_UNAVAILABLE, STORE_RETRY_AFTER_SECONDS));
    }

    private void write(HttpServletResponse response, ErrorCode errorCode, ApiError body) throws IOException {
        // 이미 다른 필터가 응답을 만들어버린 경우라면 건드리지 않음
        if (response.isCommitted()) return;

        // 인증 실패 응답은 캐시 금지
        response.setHeader(HttpHeaders.CACHE_CONTROL, "no-store");
        response.setHeader(HttpHeaders.PRAGMA, "no-cache");

        response.setStatus(errorCode.status().value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType("application/json;charset=UTF-8");

        objectMapper.writeValue(response.getWriter(), body);
    }
}
