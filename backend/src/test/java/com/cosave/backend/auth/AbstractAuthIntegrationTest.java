package com.cosave.backend.auth;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.security.crypto.password.PasswordEncoder;

import com.cosave.backend.auth.domain.User;
import com.cosave.backend.auth.domain.UserRole;
import com.cosave.backend.auth.repo.UserRepository;
import com.cosave.backend.auth.token.domain.RefreshRecord;
import com.cosave.backend.auth.token.repo.RefreshRecordRepository;
import com.cosave.backend.infra.AbstractIntegrationTest;
import com.cosave.backend.infra.TestClockConfig;
import com.cosave.backend.security.CredentialKind;
import com.cosave.backend.security.CredentialSigner;

/**
 * Auth 통합 테스트 공통 베이스
 * - 매 테스트 직전 refresh 레코드 → 사용자 순서로 비운다(FK).
 */
public abstract class AbstractAuthIntegrationTest extends AbstractIntegrationTest {

    protected static final String EMAIL = "anna@cosave.dev";
    protected static final String PASSWORD = "28482848a!";
    protected static final String NICKNAME = "Anna";

    protected static final String ADMIN_EMAIL = "admin@cosave.dev";
    protected static final String ADMIN_PASSWORD = "admin-pass-1!";

    @Autowired protected UserRepository userRepository;
    @Autowired protected RefreshRecordRepository refreshRecordRepository;
    @Autowired protected PasswordEncoder passwordEncoder;
    @Autowired protected JdbcTemplate jdbcTemplate;
    @Autowired protected CredentialSigner credentialSigner;

    @BeforeEach
    void resetAuthData() {
        refreshRecordRepository.deleteAllInBatch();
        userRepository.deleteAllInBatch();
    }

    protected User createUser(String email, String rawPassword, String nickname, UserRole role) {
        return userRepository.save(
                User.create(email, passwordEncoder.encode(rawPassword), nickname, role, TestClockConfig.now())
        );
    }

    protected User createDefaultUser() {
        return createUser(EMAIL, PASSWORD, NICKNAME, UserRole.USER);
    }

    protected User createAdmin() {
        return createUser(ADMIN_EMAIL, ADMIN_PASSWORD, "Admin", UserRole.ADMIN);
    }

    protected void suspend(Long userId) {
        jdbcTemplate.update("update users set status = 'SUSPENDED' where id = ?", userId);
    }

    /** refresh JWT의 jti = 레코드 id */
    protected String recordIdOf(String refreshRaw) {
        return credentialSigner.verify(refreshRaw, CredentialKind.REFRESH).recordId();
    }

    protected RefreshRecord recordOf(String refreshRaw) {
        return record(recordIdOf(refreshRaw));
    }

    protected RefreshRecord record(String recordId) {
        return refreshRecordRepository.findByRecordId(recordId)
                .orElseThrow(() -> new IllegalStateException("refresh record not found: " + recordId));
    }

    protected List<RefreshRecord> recordsOf(Long ownerId) {
        return refreshRecordRepository.findAllByOwnerId(ownerId);
    }
}
