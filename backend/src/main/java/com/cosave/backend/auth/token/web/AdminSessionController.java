package com.cosave.backend.auth.token.web;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.cosave.backend.auth.token.dto.SessionResponse;
import com.cosave.backend.auth.token.service.SessionIssuer;
import com.cosave.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;

/** 관리자용 세션 조회/강제 종료. /auth/admin/** 는 SecurityConfig에서 ADMIN만 허용 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth/admin/sessions")
public class AdminSessionController {

    private final SessionIssuer sessionIssuer;

    @GetMapping
    public List<SessionResponse> list(@AuthenticationPrincipal AuthPrincipal principal, @RequestParam Long ownerId) {
        return sessionIssuer.listSessions(principal, ownerId).stream()
                .map(r -> SessionResponse.from(r, null))
                .toList();
    }

    @DeleteMapping("/{recordId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void revoke(@AuthenticationPrincipal AuthPrincipal principal, @PathVariable String recordId) {
        sessionIssuer.revokeSession(principal, recordId);
    }
}
