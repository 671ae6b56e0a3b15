package com.cosave.backend.auth.token.web;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.cosave.backend.auth.token.dto.SessionResponse;
import com.cosave.backend.auth.token.service.SessionIssuer;
import com.cosave.backend.auth.token.support.AuthCookieUtils;
import com.cosave.backend.security.AuthPrincipal;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;

/**
 * 내 세션(로그인 기기) 목록 / 단건 종료
 * - current: 요청에 실린 refresh 쿠키의 세션 (쿠키 path 밖 요청이면 항상 false)
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth/sessions")
public class AuthSessionController {

    private final SessionIssuer sessionIssuer;
    private final AuthCookieUtils cookieUtils;

    @GetMapping
    public List<SessionResponse> list(@AuthenticationPrincipal AuthPrincipal principal, HttpServletRequest request) {
        String current = sessionIssuer.currentRecordId(cookieUtils.readRefreshCookie(request)).orElse(null);

        return sessionIssuer.listSessions(principal, principal.userId()).stream()
                .map(r -> SessionResponse.from(r, current))
                .toList();
    }

    @DeleteMapping("/{recordId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void revoke(@AuthenticationPrincipal AuthPrincipal principal, @PathVariable String recordId) {
        sessionIssuer.revokeSession(principal, recordId);
    }
}
