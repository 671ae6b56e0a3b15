package com.cosave.client.transport;

import java.net.HttpCookie;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import com.cosave.client.ClientSessionSettings;
import com.cosave.client.transport.SessionTransportException.Kind;

import lombok.extern.slf4j.Slf4j;

/**
 * RestClient 기반 SessionTransport
 *
 * - POST /auth/login, /auth/refresh, /auth/logout 만 사용한다.
 * - refresh token은 서버가 HttpOnly 쿠키로 내려주므로 Set-Cookie에서 값을 꺼내 메모리에 들고,
 *   refresh/logout 요청에 Cookie 헤더로 되돌려 보낸다.
 * - connect/read 타임아웃은 settings.refreshTimeout (≤ 5s). 초기화가 무한 대기하지 않게 한다.
 * - 보관 쿠키는 (값, 세대)로 묶어 CAS로만 바꾼다. logout 이후 도착한 refresh 응답이 세션을 되살리지 않게 한다.
 */
@Slf4j
public class RestClientSessionTransport implements SessionTransport {

    public static final String DEFAULT_COOKIE_NAME = "CS_REFRESH";

    private static final String LOGIN_PATH = "/auth/login";
    private static final String REFRESH_PATH = "/auth/refresh";
    private static final String LOGOUT_PATH = "/auth/logout";

    private static final String CLEARED = "";

    private final RestClient restClient;
    private final String cookieName;
    private final AtomicReference<CookieSlot> cookie = new AtomicReference<>(CookieSlot.INITIAL);

    public RestClientSessionTransport(String baseUrl, ClientSessionSettings settings) {
        this(RestClient.builder()
                        .baseUrl(baseUrl)
                        .requestFactory(requestFactory(settings)),
                DEFAULT_COOKIE_NAME);
    }

    public RestClientSessionTransport(RestClient.Builder builder, String cookieName) {
        this.restClient = builder.build();
        this.cookieName = cookieName;
    }

    @Override
    public TokenGrant login(String email, String password, boolean rememberMe) {
        ResponseEntity<TokenGrant> response = call("login", () -> restClient.post()
                .uri(LOGIN_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new LoginPayload(email, password, rememberMe))
                .retrieve()
                .toEntity(TokenGrant.class));

        // 새 세션: 이전 세션에서 늦게 도착하는 refresh 응답은 버려진다
        String captured = readRefreshCookie(response.getHeaders());
        cookie.updateAndGet(s -> s.nextEpoch(captured == null ? s.token() : tokenOf(captured)));
        return requireBody(response, "login");
    }

    /**
     * 보관 중인 refresh 쿠키로 로테이션한다.
     * 요청 중에 logout/login이 일어났다면(세대 변경) 응답의 새 쿠키는 보관하지 않고 서버에서 폐기한 뒤 REJECTED로 끝낸다.
     */
    @Override
    public TokenGrant refresh() {
        CookieSlot start = cookie.get();
        String token = start.token();
        if (token == null) {
            throw new SessionTransportException(Kind.REJECTED, "no refresh token held");
        }

        ResponseEntity<TokenGrant> response;
        try {
            response = call("refresh", () -> restClient.post()
                    .uri(REFRESH_PATH)
                    .header(HttpHeaders.COOKIE, cookieName + "=" + token)
                    .retrieve()
                    .toEntity(TokenGrant.class));
        } catch (SessionTransportException e) {
            // 서버가 거절했다면 쿠키도 이미 지워졌다
            if (e.getKind() == Kind.REJECTED) cookie.compareAndSet(start, start.with(null));
            throw e;
        }

        String captured = readRefreshCookie(response.getHeaders());
        if (!storeIfSameEpoch(start.epoch(), captured)) {
            discardLateCookie(captured);
            throw new SessionTransportException(Kind.REJECTED, "session ended while refresh was in flight");
        }
        return requireBody(response, "refresh");
    }

    @Override
    public void logout() {
        CookieSlot before = cookie.getAndUpdate(s -> s.nextEpoch(null));
        if (before.token() == null) return;

        postLogout(before.token());
    }

    boolean holdsRefreshToken() {
        return cookie.get().token() != null;
    }

    private void postLogout(String token) {
        call("logout", () -> restClient.post()
                .uri(LOGOUT_PATH)
                .header(HttpHeaders.COOKIE, cookieName + "=" + token)
                .retrieve()
                .toBodilessEntity());
    }

    private boolean storeIfSameEpoch(long epoch, String captured) {
        while (true) {
            CookieSlot current = cookie.get();
            if (current.epoch() != epoch) return false;
            if (captured == null) return true;
            if (cookie.compareAndSet(current, current.with(tokenOf(captured)))) return true;
        }
    }

    // 로그아웃 이후 도착한 로테이션 결과. 살아있는 토큰을 남기지 않도록 서버에서 폐기한다.
    private void discardLateCookie(String captured) {
        String late = captured == null ? null : tokenOf(captured);
        if (late == null) return;

        try {
            postLogout(late);
        } catch (SessionTransportException e) {
            log.warn("로그아웃 후 도착한 refresh 쿠키 폐기 실패: kind={}, status={}", e.getKind(), e.getStatus());
        }
    }

    private <T> T call(String operation, Supplier<T> exchange) {
        try {
            return exchange.get();
        } catch (RestClientResponseException e) {
            throw classify(operation, e);
        } catch (ResourceAccessException e) {
            throw new SessionTransportException(Kind.NETWORK, null, operation + " failed: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new SessionTransportException(Kind.SERVER_ERROR, null, operation + " failed: " + e.getMessage(), e);
        }
    }

    private static SessionTransportException classify(String operation, RestClientResponseException e) {
        HttpStatusCode status = e.getStatusCode();
        Kind kind;
        if (status.value() == 429) {
            kind = Kind.RATE_LIMITED;
        } else if (status.is5xxServerError()) {
            kind = Kind.SERVER_ERROR;
        } else {
            kind = Kind.REJECTED;
        }

        log.debug("{} 실패: status={}, kind={}", operation, status.value(), kind);
        return new SessionTransportException(kind, status.value(), operation + " failed with status " + status.value(), e);
    }

    /** Set-Cookie의 refresh 값. 없으면 null, 삭제(Max-Age=0 / 빈 값)면 CLEARED */
    private String readRefreshCookie(HttpHeaders headers) {
        List<String> setCookies = headers.get(HttpHeaders.SET_COOKIE);
        if (setCookies == null) return null;

        String found = null;
        for (String header : setCookies) {
            for (HttpCookie parsed : HttpCookie.parse(header)) {
                if (!cookieName.equals(parsed.getName())) continue;

                found = (parsed.getMaxAge() == 0 || parsed.getValue().isEmpty()) ? CLEARED : parsed.getValue();
            }
        }
        return found;
    }

    private static String tokenOf(String captured) {
        return CLEARED.equals(captured) ? null : captured;
    }

    private static TokenGrant requireBody(ResponseEntity<TokenGrant> response, String operation) {
        TokenGrant body = response.getBody();
        if (body == null) {
            throw new SessionTransportException(Kind.SERVER_ERROR, response.getStatusCode().value(), operation + " returned no body", null);
        }
        return body;
    }

    private static SimpleClientHttpRequestFactory requestFactory(ClientSessionSettings settings) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(settings.refreshTimeout());
        factory.setReadTimeout(settings.refreshTimeout());
        return factory;
    }

    record LoginPayload(String email, String password, boolean rememberMe) {}

    /** 보관 중인 refresh 값 + 세대. login/logout마다 세대가 바뀐다. */
    private record CookieSlot(String token, long epoch) {
        static final CookieSlot INITIAL = new CookieSlot(null, 0);

        CookieSlot with(String newToken) {
            return new CookieSlot(newToken, epoch);
        }

        CookieSlot nextEpoch(String newToken) {
            return new CookieSlot(newToken, epoch + 1);
        }
    }
}
