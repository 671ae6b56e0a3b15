package com.cosave.client.transport;

/**
 * 세션 서버와의 통신 포트.
 * 구현체는 refresh token(쿠키)을 스스로 보관하고, 실패는 SessionTransportException으로 분류해서 던진다.
 */
public interface SessionTransport {

    TokenGrant login(String email, String password, boolean rememberMe);

    /** 보관 중인 refresh token으로 로테이션. refresh token이 없으면 REJECTED */
    TokenGrant refresh();

    void logout();
}
