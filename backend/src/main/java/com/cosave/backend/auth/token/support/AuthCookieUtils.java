package com.cosave.backend.auth.token.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import com.cosave.backend.auth.config.AuthProperties;
import com.cosave.backend.auth.config.AuthProperties.Refresh;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * Refresh Token 쿠키 유틸
 *
 * - HttpOnly: JS 접근 차단
 * - Path: refresh/logout 엔드포인트가 있는 경로로 한정
 * - SameSite / Secure: 설정값
 * - Max-Age: 레코드 expires_at까지 남은 초 (쿠키 수명 = 서버 세션 수명)
 */
@Component
@RequiredArgsConstructor
public class AuthCookieUtils {

    private final AuthProperties props;
    private final Clock clock;

    /** Refresh 쿠키 읽기 (없으면 null) */
    public String readRefreshCookie(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null || cookies.length == 0) return null;

        String cookieName = props.refresh().cookieName();

        return Arrays.stream(cookies)
                .filter(c -> cookieName.equals(c.getName()))
                .map(Cookie::getValue)
                .map(v -> v == null ? null : v.trim())
                .filter(v -> v != null && !v.isBlank())
                .findFirst()
                .orElse(null);
    }

    public void setRefreshCookie(HttpServletResponse response, String refreshToken, Instant expiresAt) {
        if (refreshToken == null || refreshToken.isBlank()) return;

        long maxAgeSeconds = Math.max(0, Duration.between(clock.instant(), expiresAt).getSeconds());

        ResponseCookie cookie = baseRefreshCookie(refreshToken)
                .maxAge(Duration.ofSeconds(maxAgeSeconds))
                .build();

        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }

    /** Refresh 쿠키 삭제 (path/sameSite/secure가 발급 때와 같아야 브라우저가 지운다) */
    public void clearRefreshCookie(HttpServletResponse response) {
        ResponseCookie cookie = baseRefreshCookie("deleted")
                .maxAge(Duration.ZERO)
                .build();

        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }

    private ResponseCookie.ResponseCookieBuilder baseRefreshCookie(String value) {
        Refresh r = props.refresh();
        return ResponseCookie.from(r.cookieName(), value)
                .httpOnly(true)
                .secure(r.cookieSecure())
                .path(r.cookiePath())
                .sameSite(r.cookieSameSite().name());
    }
}
