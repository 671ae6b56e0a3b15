package com.cosave.client;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import com.cosave.client.transport.SessionTransport;
import com.cosave.client.transport.SessionTransportException;
import com.cosave.client.transport.SessionTransportException.Kind;
import com.cosave.client.transport.TokenGrant;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * 클라이언트 세션 매니저
 *
 * 상태:
 * - access token은 메모리(AtomicReference)에만 둔다. 프로세스가 재시작되면 initialize()의 silent refresh로 복구한다.
 * - (현재 토큰, 진행 중인 refresh)를 한 상태 객체로 묶어 CAS로만 바꾼다.
 *
 * 동시성 계약:
 * 1) 단일 비행(single-flight): 만료 신호를 받은 호출들은 진행 중인 refresh 하나를 공유한다.
 *    이미 다른 호출이 토큰을 갈아끼웠다면 refresh 없이 새 토큰으로 재시도한다.
 * 2) 1회 재시도: refresh 성공 후 재시도한 호출이 또 실패하면 그대로 호출자에게 전달한다. refresh는 다시 하지 않는다.
 * 3) 강제 로그아웃: REJECTED(재시도 불가) 실패를 받은 리더 한 곳에서만 토큰을 비우고 리스너에 알린다.
 *    일시 장애(NETWORK/SERVER_ERROR/RATE_LIMITED)는 로그아웃 사유가 아니다.
 *
 * 서버 측 로테이션 경합을 "줄일" 뿐 없애지는 못한다. 여러 프로세스/탭 사이의 경합은 서버가 판정한다.
 */
@Slf4j
public class ClientSessionManager {

    private static final String RENEW_RETRY_NAME = "clientSessionRenew";

    private final SessionTransport transport;
    private final SessionListener listener;
    private final ClientSessionSettings settings;
    private final Retry renewRetry;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.EMPTY);

    public ClientSessionManager(SessionTransport transport, SessionListener listener, ClientSessionSettings settings) {
        this.transport = transport;
        this.listener = listener == null ? SessionListener.NO_OP : listener;
        this.settings = settings;

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.maxRenewAttempts())
                .intervalFunction(settings.intervalFunction())
                .retryOnException(e -> e instanceof SessionTransportException ste && ste.isRetryable())
                .build();
        this.renewRetry = RetryRegistry.of(config).retry(RENEW_RETRY_NAME);
    }

    public ClientSessionManager(SessionTransport transport, SessionListener listener) {
        this(transport, listener, ClientSessionSettings.defaults());
    }

    // ========= 명시적 사용자 동작 =========

    public TokenGrant login(String email, String password, boolean rememberMe) {
        TokenGrant grant = transport.login(email, password, rememberMe);
        state.updateAndGet(s -> new SessionState(grant, s.pending()));
        log.info("로그인 완료: expiresAt={}", grant.expiresAt());
        return grant;
    }

    /** 서버 호출 실패와 관계없이 로컬 상태는 반드시 비운다 */
    public void logout() {
        try {
            transport.logout();
        } catch (SessionTransportException e) {
            log.warn("로그아웃 요청 실패, 로컬 세션만 정리: kind={}, message={}", e.getKind(), e.getMessage());
        } finally {
            state.set(SessionState.EMPTY);
        }
    }

    /**
     * 앱 시작 시 silent refresh.
     * 실패해도 예외를 던지지 않고 비로그인 상태로 시작한다(대기 시간은 refreshTimeout으로 제한).
     */
    public boolean initialize() {
        try {
            awaitRefresh(coalescedRefresh(null));
            return true;
        } catch (SessionTransportException e) {
            log.info("세션 복구 실패, 비로그인 상태로 시작: kind={}", e.getKind());
            return false;
        }
    }

    // ========= 인증 호출 =========

    /**
     * access token을 붙여 호출한다.
     * 만료 신호(CredentialExpiredException)를 받으면 공유 refresh 후 정확히 1회만 재시도한다.
     *
     * @throws CredentialExpiredException 재시도까지 만료 신호를 받은 경우
     * @throws SessionTransportException refresh 자체가 실패한 경우 (REJECTED면 이미 강제 로그아웃됨)
     */
    public <T> T execute(AuthorizedCall<T> call) {
        TokenGrant used = state.get().grant();

        if (used != null) {
            try {
                return call.call(used.accessToken());
            } catch (CredentialExpiredException e) {
                log.debug("access token 만료 신호, refresh 후 재시도");
            }
        }

        TokenGrant renewed = awaitRefresh(coalescedRefresh(used));
        return call.call(renewed.accessToken());
    }

    /**
     * 애플리케이션이 직접 요청하는 갱신(선제 갱신 등).
     * 일시 장애만 지수 백오프로 재시도하고, REJECTED는 즉시 실패(강제 로그아웃)한다.
     */
    public TokenGrant renew() {
        return Retry.decorateSupplier(renewRetry,
                () -> awaitRefresh(coalescedRefresh(state.get().grant()))).get();
    }

    public boolean isAuthenticated() {
        return state.get().grant() != null;
    }

    public Optional<String> currentAccessToken() {
        return Optional.ofNullable(state.get().grant()).map(TokenGrant::accessToken);
    }

    // ========= single-flight refresh =========

    /**
     * stale: 호출자가 실패를 관측한 토큰. 현재 토큰이 이미 다르면 refresh 없이 현재 토큰을 돌려주고,
     * 그 사이 세션이 끝났으면 서버를 부르지 않고 REJECTED로 끝낸다.
     * 리더(상태 CAS 성공)는 호출 스레드에서 직접 transport.refresh()를 수행하고, 나머지는 같은 future를 기다린다.
     */
    CompletableFuture<TokenGrant> coalescedRefresh(TokenGrant stale) {
        CompletableFuture<TokenGrant> mine = new CompletableFuture<>();

        while (true) {
            SessionState s = state.get();
            if (s.pending() != null) {
                return s.pending();
            }
            if (s.grant() != null && s.grant() != stale) {
                return CompletableFuture.completedFuture(s.grant());
            }
            if (s.grant() == null && stale != null) {
                // 실패를 관측한 사이에 강제 로그아웃/로그아웃됨. 다시 refresh하지 않는다.
                return CompletableFuture.failedFuture(new SessionTransportException(Kind.REJECTED, "session already ended"));
            }
            if (state.compareAndSet(s, new SessionState(s.grant(), mine))) {
                break;
            }
        }

        lead(mine);
        return mine;
    }

    private void lead(CompletableFuture<TokenGrant> mine) {
        try {
            TokenGrant grant = transport.refresh();
            state.updateAndGet(s -> s.pending() == mine ? new SessionState(grant, null) : s);
            mine.complete(grant);
        } catch (SessionTransportException e) {
            onRefreshFailure(mine, e);
            mine.completeExceptionally(e);
        } catch (RuntimeException e) {
            onRefreshFailure(mine, new SessionTransportException(Kind.NETWORK, null, "refresh failed: " + e.getMessage(), e));
            mine.completeExceptionally(e);
        } finally {
            // Error 등으로 빠져나가도 대기자가 timeout까지 묶이지 않게 한다. 원래 Error는 리더 호출자에게 그대로 전파된다.
            if (!mine.isDone()) {
                SessionTransportException aborted = new SessionTransportException(Kind.NETWORK, null, "refresh aborted", null);
                onRefreshFailure(mine, aborted);
                mine.completeExceptionally(aborted);
            }
        }
    }

    private void onRefreshFailure(CompletableFuture<TokenGrant> mine, SessionTransportException e) {
        if (e.isRetryable()) {
            state.updateAndGet(s -> s.pending() == mine ? new SessionState(s.grant(), null) : s);
            log.warn("refresh 일시 실패: kind={}, status={}", e.getKind(), e.getStatus());
            return;
        }

        SessionState before = state.getAndUpdate(s -> s.pending() == mine ? SessionState.EMPTY : s);
        if (before.pending() == mine && before.grant() != null) {
            log.warn("refresh 거절, 강제 로그아웃: status={}", e.getStatus());
            listener.onForcedLogout(e);
        }
    }

    private TokenGrant awaitRefresh(CompletableFuture<TokenGrant> future) {
        try {
            return future.get(settings.refreshTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new SessionTransportException(Kind.NETWORK, null, "refresh timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionTransportException(Kind.NETWORK, null, "interrupted while waiting for refresh", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof SessionTransportException ste) throw ste;
            throw new SessionTransportException(Kind.NETWORK, null, "refresh failed", e.getCause());
        }
    }

    private record SessionState(TokenGrant grant, CompletableFuture<TokenGrant> pending) {
        static final SessionState EMPTY = new SessionState(null, null);
    }
}
