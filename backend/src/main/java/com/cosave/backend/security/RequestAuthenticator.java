package com.cosave.backend.security;

import java.util.Set;

import org.springframework.stereotype.Component;

import com.cosave.backend.auth.identity.Identity;
import com.cosave.backend.auth.identity.IdentityStore;
import com.cosave.backend.security.AuthenticationFailedException.Reason;

import lombok.RequiredArgsConstructor;

/**
 * access token → Identity
 *
 * - 서명/만료/aud 검증은 CredentialSigner (저장소 조회 없음)
 * - 신원 저장소를 한 번 읽어 비활성 계정을 거른다. 토큰이 유효해도 정지된 계정은 통과하지 못한다.
 * - refresh 레코드 상태는 보지 않는다. refresh를 폐기해도 이미 발급된 access는 만료 전까지 유효하다.
 * - 아무것도 변경하지 않는다.
 */
@Component
@RequiredArgsConstructor
public class RequestAuthenticator {

    private final CredentialSigner signer;
    private final IdentityStore identityStore;

    public Identity authenticate(String accessToken) {
        if (accessToken == null || accessToken.isBlank()) {
            throw new AuthenticationFailedException(Reason.MISSING);
        }

        VerifiedCredential credential;
        try {
            credential = signer.verify(accessToken, CredentialKind.ACCESS);
        } catch (CredentialVerificationException e) {
            throw new AuthenticationFailedException(toReason(e.getFailure()), e);
        }

        Identity identity = identityStore.findById(credential.ownerId())
                .orElseThrow(() -> new AuthenticationFailedException(Reason.IDENTITY_NOT_FOUND));

        if (!identity.active()) {
            throw new AuthenticationFailedException(Reason.USER_INACTIVE);
        }
        return identity;
    }

    /** 빈 allowedRoles = 인증된 누구나 통과 */
    public static boolean requireRole(Identity identity, Set<String> allowedRoles) {
        if (identity == null) return false;
        return matches(identity.roles(), allowedRoles);
    }

    public static boolean requireRole(AuthPrincipal principal, Set<String> allowedRoles) {
        if (principal == null) return false;
        return matches(principal.roles(), allowedRoles);
    }

    private static boolean matches(Set<String> roles, Set<String> allowedRoles) {
        if (allowedRoles == null || allowedRoles.isEmpty()) return true;
        return allowedRoles.stream().anyMatch(roles::contains);
    }

    private static Reason toReason(CredentialVerificationException.Failure failure) {
        return switch (failure) {
            case EXPIRED -> Reason.EXPIRED;
            case WRONG_AUDIENCE -> Reason.WRONG_AUDIENCE;
            case INVALID_SIGNATURE -> Reason.INVALID_SIGNATURE;
        };
    }
}
