package com.cosave.backend.auth.token.web;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.cosave.backend.auth.token.dto.RefreshResponse;
import com.cosave.backend.auth.token.service.SessionIssuer;
import com.cosave.backend.auth.token.service.SessionRejectedException;
import com.cosave.backend.auth.token.service.SessionTokens;
import com.cosave.backend.auth.token.support.AuthCookieUtils;
import com.cosave.backend.auth.token.support.DeviceInfoResolver;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * POST: /auth/refresh
 *
 * HttpOnly 쿠키의 refresh 토큰으로 로테이션한다.
 * 성공:
 * - 새 refresh 쿠키 (Max-Age = 후속 레코드 만료까지)
 * - 새 access token + 만료 시각을 바디로 반환
 * 실패:
 * - 거절(REFRESH_INVALID)이면 쿠키도 지운다. 더 이상 쓸 수 없는 토큰을 브라우저에 남기지 않는다.
 * - 저장소 장애(503)는 쿠키를 그대로 둔다. 클라이언트가 같은 쿠키로 재시도한다.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthTokenController {

    private final SessionIssuer sessionIssuer;
    private final AuthCookieUtils cookieUtils;

    @PostMapping("/refresh")
    public RefreshResponse refresh(HttpServletRequest request, HttpServletResponse response) {
        String refreshToken = cookieUtils.readRefreshCookie(request);

        SessionTokens tokens;
        try {
            tokens = sessionIssuer.refresh(refreshToken, DeviceInfoResolver.resolve(request));
        } catch (SessionRejectedException e) {
            cookieUtils.clearRefreshCookie(response);
            throw e;
        }

        cookieUtils.setRefreshCookie(response, tokens.refreshToken(), tokens.refreshExpiresAt());
        return new RefreshResponse(tokens.accessToken(), tokens.accessExpiresAt());
    }
}
