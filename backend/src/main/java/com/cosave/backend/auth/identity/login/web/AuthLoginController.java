package com.cosave.backend.auth.identity.login.web;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.cosave.backend.auth.identity.login.dto.LoginRequest;
import com.cosave.backend.auth.identity.login.dto.LoginResponse;
import com.cosave.backend.auth.identity.login.service.LoginService;
import com.cosave.backend.auth.token.service.SessionTokens;
import com.cosave.backend.auth.token.support.AuthCookieUtils;
import com.cosave.backend.auth.token.support.DeviceInfoResolver;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 로그인 API
 * - accessToken: 바디
 * - refreshToken: HttpOnly 쿠키 (Max-Age = 세션 만료까지)
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthLoginController {

    private final LoginService loginService;
    private final AuthCookieUtils cookieUtils;

    @PostMapping("/login")
    public LoginResponse login(
            @Valid @RequestBody LoginRequest req,
            HttpServletRequest request,
            HttpServletResponse response
    ) {
        SessionTokens tokens = loginService.login(
                req.email(),
                req.password(),
                req.rememberMeOrFalse(),
                DeviceInfoResolver.resolve(request, req.deviceName(), req.deviceId())
        );

        cookieUtils.setRefreshCookie(response, tokens.refreshToken(), tokens.refreshExpiresAt());
        return new LoginResponse(tokens.accessToken(), tokens.accessExpiresAt());
    }
}
