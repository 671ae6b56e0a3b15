package com.cosave.backend.auth.identity.me.service;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.cosave.backend.auth.domain.User;
import com.cosave.backend.auth.identity.me.dto.MeResponse;
import com.cosave.backend.auth.repo.UserRepository;
import com.cosave.backend.global.ApiException;
import com.cosave.backend.global.ErrorCode;
import com.cosave.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;

/**
 * 내 정보 조회 (identity-probe)
 * 비활성 계정은 필터(RequestAuthenticator)에서 이미 걸러진다.
 */
@Service
@RequiredArgsConstructor
public class MeService {

    private final UserRepository userRepository;

    @Transactional(readOnly = true)
    public MeResponse me(AuthPrincipal principal) {
        if (principal == null) {
            throw new ApiException(ErrorCode.AUTH_REQUIRED);
        }

        User user = userRepository.findById(principal.userId())
                .orElseThrow(() -> new ApiException(ErrorCode.USER_NOT_FOUND));
        return MeResponse.from(user);
    }
}
