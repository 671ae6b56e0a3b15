package com.cosave.backend.auth.token.web;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.cosave.backend.auth.token.service.SessionIssuer;
import com.cosave.backend.auth.token.support.AuthCookieUtils;
import com.cosave.backend.security.AuthPrincipal;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * POST: /auth/logout, /auth/logout-all
 *
 * logout은 멱등:
 * - 쿠키 없음 / 모르는 쿠키 / 이미 폐기됨 → 그래도 204
 * - 항상 쿠키 삭제 Set-Cookie를 내려준다
 *
 * logout-all은 access token 필요 (SecurityConfig)
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthLogoutController {

    private final SessionIssuer sessionIssuer;
    private final AuthCookieUtils cookieUtils;

    @PostMapping("/logout")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void logout(HttpServletRequest request, HttpServletResponse response) {
        sessionIssuer.logout(cookieUtils.readRefreshCookie(request));
        cookieUtils.clearRefreshCookie(response);
    }

    @PostMapping("/logout-all")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void logoutAll(@AuthenticationPrincipal AuthPrincipal principal, HttpServletResponse response) {
        sessionIssuer.logoutAll(principal.userId());
        cookieUtils.clearRefreshCookie(response);
    }
}
