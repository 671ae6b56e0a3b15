package com.cosave.backend.security;

import java.io.IOException;

import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import com.cosave.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * 인증이 필요한 리소스에 "인증 없이" 접근했을 때 → 401 AUTH_REQUIRED
 * (토큰이 있는데 무효면 JwtAuthenticationFilter가 먼저 ACCESS_INVALID로 끝낸다)
 */
@RequiredArgsConstructor
public class RestAuthEntryPoint implements AuthenticationEntryPoint {

    private final SecurityErrorWriter errorWriter;

    @Override
    public void commence(
            HttpServletRequest request,
            HttpServletResponse response,
            AuthenticationException authException) throws IOException {

        errorWriter.write(response, ErrorCode.AUTH_REQUIRED);
    }
}
