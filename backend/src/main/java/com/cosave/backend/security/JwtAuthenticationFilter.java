package com.cosave.backend.security;

import java.io.IOException;

import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import com.cosave.backend.auth.identity.Identity;
import com.cosave.backend.global.ErrorCode;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * "Security Filter Chain"에서 access token 인증을 수행하는 필터
 *
 * 토큰 위치:
 * - Authorization: Bearer <token>
 * - 없으면 레거시 헤더 x-auth-token
 *
 * 정책:
 * - 토큰이 "없으면" 통과한다. (차단은 SecurityConfig의 인가 규칙 + EntryPoint가 담당)
 * - 토큰이 "있는데 유효하지 않으면" 여기서 401 ACCESS_INVALID로 종료한다.
 *   서명 오류 / 만료 / aud 불일치 / 비활성 계정을 구분하지 않는다.
 * - 신원 저장소 장애는 인증 실패가 아니라 503으로 내린다.
 */
@Slf4j
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";
    static final String LEGACY_TOKEN_HEADER = "x-auth-token";

    private final RequestAuthenticator authenticator;
    private final SecurityErrorWriter errorWriter;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        if (SecurityContextHolder.getContext().getAuthentication() != null) {
            filterChain.doFilter(request, response);
            return;
        }

        String token = resolveToken(request);
        if (token == null) {
            filterChain.doFilter(request, response);
            return;
        }

        Identity identity;
        try {
            identity = authenticator.authenticate(token);
        } catch (AuthenticationFailedException ex) {
            log.debug("access 인증 실패: reason={}, uri={}", ex.getReason(), request.getRequestURI());
            SecurityContextHolder.clearContext();
            errorWriter.write(response, ErrorCode.ACCESS_INVALID);
            return;
        } catch (DataAccessException ex) {
            log.warn("access 인증 중 신원 저장소 장애: uri={}", request.getRequestURI(), ex);
            SecurityContextHolder.clearContext();
            errorWriter.writeStoreUnavailable(response);
            return;
        }

        AuthPrincipal principal = AuthPrincipal.from(identity);
        var authentication = new UsernamePasswordAuthenticationToken(principal, null, principal.authorities());
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        filterChain.doFilter(request, response);
    }

    /** Bearer 우선, 없으면 x-auth-token. 공백이면 null */
    private String resolveToken(HttpServletRequest request) {
        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
            String token = authHeader.substring(BEARER_PREFIX.length()).trim();
            return token.isBlank() ? null : token;
        }

        String legacy = request.getHeader(LEGACY_TOKEN_HEADER);
        if (legacy == null || legacy.isBlank()) return null;
        return legacy.trim();
    }
}
