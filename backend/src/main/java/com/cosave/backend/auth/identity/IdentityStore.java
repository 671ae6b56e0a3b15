package com.cosave.backend.auth.identity;

import java.util.Optional;

/**
 * 외부 신원 저장소 포트.
 * 세션 서브시스템(Signer/Issuer/Authenticator)은 이 인터페이스로만 사용자 정보를 읽는다.
 * 이메일/비밀번호 조회는 로그인(LoginService)만 하며, 비밀번호 해시가 필요하므로 UserRepository를 직접 쓴다.
 */
public interface IdentityStore {

    Optional<Identity> findById(Long id);
}
