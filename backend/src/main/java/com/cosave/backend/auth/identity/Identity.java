package com.cosave.backend.auth.identity;

import java.util.Objects;
import java.util.Set;

/**
 * 세션 서브시스템이 바라보는 신원(읽기 전용 뷰)
 * - id / email / roles: access token 클레임 재료
 * - active: false면 토큰이 유효해도 인증 거부
 */
public record Identity(Long id, String email, Set<String> roles, boolean active) {

    public Identity {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(email, "email must not be null");
        roles = (roles == null) ? Set.of() : Set.copyOf(roles);
    }
}
