package com.cosave.client;

/**
 * access token을 붙여 보내는 애플리케이션 호출.
 * 서버가 만료/무효(401)로 응답하면 CredentialExpiredException을 던져야 재발급 + 1회 재시도가 동작한다.
 */
@FunctionalInterface
public interface AuthorizedCall<T> {

    T call(String accessToken);
}
