package com.cosave.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.cosave.client.transport.SessionTransport;
import com.cosave.client.transport.SessionTransportException;
import com.cosave.client.transport.SessionTransportException.Kind;
import com.cosave.client.transport.TokenGrant;

@DisplayName("[Client] ClientSessionManager 동시성/재시도 계약")
class ClientSessionManagerTest {

    private static final TokenGrant OLD = new TokenGrant("access-old", Instant.parse("2026-01-01T00:15:00Z"));
    private static final TokenGrant NEW = new TokenGrant("access-new", Instant.parse("2026-01-01T00:30:00Z"));

    private static final ClientSessionSettings FAST = new ClientSessionSettings(
            Duration.ofSeconds(5), 3, Duration.ofMillis(1), Duration.ofMillis(4));

    private FakeTransport transport;
    private List<SessionTransportException> forcedLogouts;
    private ClientSessionManager manager;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        transport = new FakeTransport();
        forcedLogouts = new CopyOnWriteArrayList<>();
        manager = new ClientSessionManager(transport, forcedLogouts::add, FAST);
        pool = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    @DisplayName("execute: 유효한 토큰이면 refresh 없이 그대로 호출")
    void execute_with_valid_token() {
        loginAs(OLD);

        String result = manager.execute(token -> "ok:" + token);

        assertThat(result).isEqualTo("ok:access-old");
        assertThat(transport.refreshCalls.get()).isZero();
    }

    @Test
    @DisplayName("execute: 만료 신호 → refresh 1회 → 새 토큰으로 재시도")
    void execute_refreshes_and_retries_once() {
        loginAs(OLD);
        transport.onRefresh(() -> NEW);

        String result = manager.execute(token -> {
            if (token.equals(OLD.accessToken())) throw new CredentialExpiredException("401");
            return "ok:" + token;
        });

        assertThat(result).isEqualTo("ok:access-new");
        assertThat(transport.refreshCalls.get()).isEqualTo(1);
        assertThat(manager.currentAccessToken()).contains("access-new");
    }

    @Test
    @DisplayName("execute: 재시도한 호출도 실패하면 그대로 전달, refresh는 1회뿐")
    void retried_call_failure_is_surfaced() {
        loginAs(OLD);
        transport.onRefresh(() -> NEW);
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> manager.execute(token -> {
            attempts.incrementAndGet();
            throw new CredentialExpiredException("401");
        })).isInstanceOf(CredentialExpiredException.class);

        assertThat(attempts.get()).isEqualTo(2);
        assertThat(transport.refreshCalls.get()).isEqualTo(1);
        assertThat(forcedLogouts).isEmpty();
    }

    @Test
    @DisplayName("coalescing: 동시에 만료를 본 N개 호출 → 서버 refresh는 정확히 1회")
    void concurrent_expiry_triggers_single_refresh() throws Exception {
        int callers = 8;
        loginAs(OLD);
        CountDownLatch allSawExpiry = new CountDownLatch(callers);

        transport.onRefresh(() -> {
            await(allSawExpiry);
            return NEW;
        });

        List<Future<String>> results = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            results.add(pool.submit(() -> manager.execute(token -> {
                if (token.equals(OLD.accessToken())) {
                    allSawExpiry.countDown();
                    throw new CredentialExpiredException("401");
                }
                return token;
            })));
        }

        for (Future<String> f : results) {
            assertThat(f.get(5, TimeUnit.SECONDS)).isEqualTo("access-new");
        }
        assertThat(transport.refreshCalls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("REJECTED: 토큰 비우고 강제 로그아웃 1회 통지 (동시 호출이 여러 개여도)")
    void rejected_refresh_forces_logout_once() throws Exception {
        int callers = 4;
        loginAs(OLD);
        CountDownLatch allSawExpiry = new CountDownLatch(callers);

        transport.onRefresh(() -> {
            await(allSawExpiry);
            throw new SessionTransportException(Kind.REJECTED, 401, "refresh rejected", null);
        });

        List<Future<?>> results = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            results.add(pool.submit(() -> manager.execute(token -> {
                allSawExpiry.countDown();
                throw new CredentialExpiredException("401");
            })));
        }

        for (Future<?> f : results) {
            assertThatThrownBy(() -> f.get(5, TimeUnit.SECONDS))
                    .hasCauseInstanceOf(SessionTransportException.class);
        }
        assertThat(manager.isAuthenticated()).isFalse();
        assertThat(forcedLogouts).hasSize(1);
        assertThat(forcedLogouts.get(0).getKind()).isEqualTo(Kind.REJECTED);
        assertThat(transport.refreshCalls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("일시 장애 refresh 실패: 호출자에게 전달하되 로그아웃하지 않음")
    void transient_refresh_failure_keeps_session() {
        loginAs(OLD);
        transport.onRefresh(() -> { throw new SessionTransportException(Kind.SERVER_ERROR, 503, "unavailable", null); });

        assertThatThrownBy(() -> manager.execute(token -> { throw new CredentialExpiredException("401"); }))
                .isInstanceOfSatisfying(SessionTransportException.class, e -> assertThat(e.isRetryable()).isTrue());

        assertThat(manager.currentAccessToken()).contains("access-old");
        assertThat(forcedLogouts).isEmpty();
    }

    @Test
    @DisplayName("renew: 일시 장애는 백오프 재시도 후 성공")
    void renew_retries_transient_failures() {
        loginAs(OLD);
        transport.onRefresh(() -> { throw new SessionTransportException(Kind.NETWORK, "connect timed out"); });
        transport.onRefresh(() -> { throw new SessionTransportException(Kind.RATE_LIMITED, 429, "slow down", null); });
        transport.onRefresh(() -> NEW);

        TokenGrant renewed = manager.renew();

        assertThat(renewed).isEqualTo(NEW);
        assertThat(transport.refreshCalls.get()).isEqualTo(3);
        assertThat(manager.currentAccessToken()).contains("access-new");
    }

    @Test
    @DisplayName("renew: 시도 상한 소진 → 마지막 실패 전달, 세션 유지")
    void renew_gives_up_after_max_attempts() {
        loginAs(OLD);
        for (int i = 0; i < 5; i++) {
            transport.onRefresh(() -> { throw new SessionTransportException(Kind.SERVER_ERROR, 500, "boom", null); });
        }

        assertThatThrownBy(() -> manager.renew())
                .isInstanceOfSatisfying(SessionTransportException.class,
                        e -> assertThat(e.getKind()).isEqualTo(Kind.SERVER_ERROR));

        assertThat(transport.refreshCalls.get()).isEqualTo(3);
        assertThat(manager.isAuthenticated()).isTrue();
        assertThat(forcedLogouts).isEmpty();
    }

    @Test
    @DisplayName("renew: REJECTED는 재시도 없이 즉시 강제 로그아웃")
    void renew_rejected_is_terminal() {
        loginAs(OLD);
        transport.onRefresh(() -> { throw new SessionTransportException(Kind.REJECTED, 401, "revoked", null); });

        assertThatThrownBy(() -> manager.renew()).isInstanceOf(SessionTransportException.class);

        assertThat(transport.refreshCalls.get()).isEqualTo(1);
        assertThat(manager.isAuthenticated()).isFalse();
        assertThat(forcedLogouts).hasSize(1);
    }

    @Test
    @DisplayName("initialize: silent refresh 성공 → 로그인 상태 / 거절 → 비로그인, 강제 로그아웃 통지 없음")
    void initialize() {
        transport.onRefresh(() -> NEW);
        assertThat(manager.initialize()).isTrue();
        assertThat(manager.currentAccessToken()).contains("access-new");

        FakeTransport noCookie = new FakeTransport();
        ClientSessionManager fresh = new ClientSessionManager(noCookie, forcedLogouts::add, FAST);

        assertThat(fresh.initialize()).isFalse();
        assertThat(fresh.isAuthenticated()).isFalse();
        assertThat(forcedLogouts).isEmpty();
    }

    @Test
    @DisplayName("logout: 서버 호출이 실패해도 로컬 세션은 비워진다")
    void logout_is_local_even_if_server_fails() {
        loginAs(OLD);
        transport.logoutFailure = new SessionTransportException(Kind.NETWORK, "offline");

        manager.logout();

        assertThat(manager.isAuthenticated()).isFalse();
        assertThat(transport.logoutCalls.get()).isEqualTo(1);
        assertThat(forcedLogouts).isEmpty();
    }

    @Test
    @DisplayName("refresh 중 Error → 리더에게 전파, 진행 중 refresh 해제 → 다음 갱신은 대기 없이 진행")
    void error_in_refresh_releases_pending_handle() {
        loginAs(OLD);
        transport.onRefresh(() -> { throw new LinkageError("transport class failed to load"); });
        transport.onRefresh(() -> NEW);

        assertThatThrownBy(() -> manager.execute(token -> { throw new CredentialExpiredException("401"); }))
                .isInstanceOf(LinkageError.class);

        assertThat(manager.currentAccessToken()).contains("access-old");
        assertThat(forcedLogouts).isEmpty();

        TokenGrant renewed = manager.renew();

        assertThat(renewed).isEqualTo(NEW);
        assertThat(transport.refreshCalls.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("settings: 백오프 = min(base * 2^(n-1), cap)")
    void backoff_schedule() {
        ClientSessionSettings defaults = ClientSessionSettings.defaults();

        assertThat(defaults.intervalFunction().apply(1)).isEqualTo(500L);
        assertThat(defaults.intervalFunction().apply(2)).isEqualTo(1000L);
        assertThat(defaults.intervalFunction().apply(3)).isEqualTo(2000L);
        assertThat(defaults.intervalFunction().apply(5)).isEqualTo(4000L);

        assertThatThrownBy(() -> new ClientSessionSettings(Duration.ofSeconds(10), 3, Duration.ofMillis(500), Duration.ofSeconds(4)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private void loginAs(TokenGrant grant) {
        transport.loginResult = grant;
        manager.login("anna@cosave.dev", "28482848a!", false);
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("callers did not observe expiry in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    /** refresh 응답을 순서대로 꺼내 쓰는 가짜 transport. 마지막 응답은 계속 재사용한다. */
    private static final class FakeTransport implements SessionTransport {
        private final Deque<Supplier<TokenGrant>> refreshResults = new ArrayDeque<>();
        private final AtomicInteger refreshCalls = new AtomicInteger();
        private final AtomicInteger logoutCalls = new AtomicInteger();
        private volatile TokenGrant loginResult;
        private volatile SessionTransportException logoutFailure;

        void onRefresh(Supplier<TokenGrant> result) {
            synchronized (refreshResults) {
                refreshResults.addLast(result);
            }
        }

        @Override
        public TokenGrant login(String email, String password, boolean rememberMe) {
            return loginResult;
        }

        @Override
        public TokenGrant refresh() {
            refreshCalls.incrementAndGet();
            Supplier<TokenGrant> next;
            synchronized (refreshResults) {
                next = refreshResults.size() > 1 ? refreshResults.pollFirst() : refreshResults.peekFirst();
            }
            if (next == null) throw new SessionTransportException(Kind.REJECTED, "no refresh token held");
            return next.get();
        }

        @Override
        public void logout() {
            logoutCalls.incrementAndGet();
            if (logoutFailure != null) throw logoutFailure;
        }
    }
}
