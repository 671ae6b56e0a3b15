package com.cosave.backend.auth.identity.login.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import com.cosave.backend.auth.config.AuthProperties;
import com.cosave.backend.auth.domain.User;
import com.cosave.backend.auth.identity.JpaIdentityStore;
import com.cosave.backend.auth.repo.UserRepository;
import com.cosave.backend.auth.token.domain.DeviceInfo;
import com.cosave.backend.auth.token.service.SessionIssuer;
import com.cosave.backend.auth.token.service.SessionTokens;
import com.cosave.backend.auth.token.store.StoreUnavailableException;
import com.cosave.backend.global.ApiException;
import com.cosave.backend.global.ErrorCode;

/**
 * 로그인 유스케이스 (issue-session)
 *
 * 계약:
 * - 이메일은 trim + 소문자로 정규화한 뒤 조회한다.
 * - "이메일 없음"과 "비밀번호 불일치"는 동일 에러(INVALID_CREDENTIALS)로 처리해 계정 유무 추측을 어렵게 한다.
 * - ACTIVE 계정만 로그인 허용(그 외는 ACCOUNT_DISABLED). 비밀번호가 맞은 뒤에만 상태를 알려준다.
 * - 성공 시 SessionIssuer가 refresh 레코드를 만들고 access/refresh를 발급한다.
 *
 * User 엔티티는 영속성 컨텍스트에 올라온 객체이므로 lastLoginAt 변경은 더티체킹으로 커밋 시점에 반영된다.
 * refresh 레코드 INSERT도 같은 트랜잭션에 참여하므로, 둘 중 하나가 실패하면 같이 롤백된다.
 *
 * 트랜잭션:
 * - 참여한 트랜잭션에는 저장소의 timeout이 적용되지 않으므로, 바깥 경계에 같은 timeout(app.auth.store.timeout-seconds)을 건다.
 * - 커밋/시작 실패는 저장소 장애(503)로 본다.
 */
@Service
public class LoginService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final SessionIssuer sessionIssuer;
    private final TransactionTemplate loginTx;
    private final Clock clock;

    public LoginService(
            UserRepository userRepository,
            PasswordEncoder passwordEncoder,
            SessionIssuer sessionIssuer,
            PlatformTransactionManager transactionManager,
            AuthProperties props,
            Clock clock
    ) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.sessionIssuer = sessionIssuer;
        this.clock = clock;

        this.loginTx = new TransactionTemplate(transactionManager);
        this.loginTx.setTimeout(props.store().timeoutSeconds());
    }

    public SessionTokens login(String rawEmail, String rawPassword, boolean rememberMe, DeviceInfo deviceInfo) {
        try {
            return loginTx.execute(status -> doLogin(rawEmail, rawPassword, rememberMe, deviceInfo));
        } catch (TransactionException e) {
            throw new StoreUnavailableException("login", e);
        }
    }

    private SessionTokens doLogin(String rawEmail, String rawPassword, boolean rememberMe, DeviceInfo deviceInfo) {
        // 컨트롤러 @Valid가 있어도 서비스는 한 번 더 체크한다.
        if (isBlank(rawEmail) || isBlank(rawPassword)) {
            throw new ApiException(ErrorCode.INVALID_CREDENTIALS);
        }

        String email = normalize(rawEmail);

        User user = userRepository.findByEmail(email)
                .orElseThrow(() -> new ApiException(ErrorCode.INVALID_CREDENTIALS));

        if (!passwordEncoder.matches(rawPassword, user.getPasswordHash())) {
            throw new ApiException(ErrorCode.INVALID_CREDENTIALS);
        }

        if (!user.isActive()) {
            throw new ApiException(ErrorCode.ACCOUNT_DISABLED);
        }

        SessionTokens tokens = sessionIssuer.login(JpaIdentityStore.toIdentity(user), rememberMe, deviceInfo);

        user.markLoggedIn(LocalDateTime.now(clock));
        return tokens;
    }

    static String normalize(String rawEmail) {
        return rawEmail.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
