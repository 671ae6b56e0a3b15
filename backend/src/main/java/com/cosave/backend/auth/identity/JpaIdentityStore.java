package com.cosave.backend.auth.identity;

import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.cosave.backend.auth.domain.User;
import com.cosave.backend.auth.repo.UserRepository;

import lombok.RequiredArgsConstructor;

/** users 테이블 기반 IdentityStore 구현 */
@Component
@RequiredArgsConstructor
public class JpaIdentityStore implements IdentityStore {

    private final UserRepository userRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Identity> findById(Long id) {
        if (id == null) return Optional.empty();
        return userRepository.findById(id).map(JpaIdentityStore::toIdentity);
    }

    public static Identity toIdentity(User user) {
        return new Identity(user.getId(), user.getEmail(), Set.of(user.getRole().name()), user.isActive());
    }
}
