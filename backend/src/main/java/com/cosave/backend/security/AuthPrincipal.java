package com.cosave.backend.security;

import java.util.List;
import java.util.Set;

import org.springframework.security.core.authority.SimpleGrantedAuthority;

import com.cosave.backend.auth.identity.Identity;

/**
 * SecurityContext에 저장되는 "인증된 사용자"의 최소 정보(Principal).
 *
 * - JwtAuthenticationFilter가 RequestAuthenticator 통과 후 만들어 Authentication에 넣는다.
 * - roles: 역할 이름 집합(USER, ADMIN). Spring Security 권한은 ROLE_* 규칙으로 변환한다.
 */
public record AuthPrincipal(Long userId, String email, Set<String> roles) {

    public static final String ADMIN = "ADMIN";

    public AuthPrincipal {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");
        roles = (roles == null) ? Set.of() : Set.copyOf(roles);
    }

    public static AuthPrincipal from(Identity identity) {
        return new AuthPrincipal(identity.id(), identity.email(), identity.roles());
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    public boolean isAdmin() {
        return hasRole(ADMIN);
    }

    /** Spring Security 권한 문자열 규칙(ROLE_*) */
    public List<SimpleGrantedAuthority> authorities() {
        return roles.stream()
                .sorted()
                .map(r -> new SimpleGrantedAuthority("ROLE_" + r))
                .toList();
    }
}
