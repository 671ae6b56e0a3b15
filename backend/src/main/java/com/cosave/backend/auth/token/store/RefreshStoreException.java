package com.cosave.backend.auth.token.store;

/** RefreshRecordStore 실패의 공통 상위 타입 */
public abstract class RefreshStoreException extends RuntimeException {

    protected RefreshStoreException(String message) {
        super(message);
    }

    protected RefreshStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
