package com.cosave.client;

import com.cosave.client.transport.SessionTransportException;

/**
 * 강제 로그아웃 통지.
 * 로그인 상태 → 비로그인 상태 전환 중 사용자가 요청하지 않은 유일한 경로다. 재로그인 화면으로 보내는 데 쓴다.
 */
@FunctionalInterface
public interface SessionListener {

    SessionListener NO_OP = cause -> { };

    void onForcedLogout(SessionTransportException cause);
}
