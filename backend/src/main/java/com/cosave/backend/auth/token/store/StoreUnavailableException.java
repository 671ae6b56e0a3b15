package com.cosave.backend.auth.token.store;

/**
 * 저장소 일시 장애 (타임아웃 / 커넥션 실패 / 락 경합)
 * 재시도 가능한 실패이며 "인증 실패"로 취급하지 않는다. 외부로는 503 AUTH_STORE_UNAVAILABLE.
 */
public class StoreUnavailableException extends RefreshStoreException {

    public StoreUnavailableException(String operation, Throwable cause) {
        super("refresh store unavailable during " + operation, cause);
    }
}
