package com.cosave.backend.auth.token.store;

/** 로테이션 CAS 패배: 대상 레코드가 이미 다른 요청에 의해 로테이션됨 */
public class AlreadyRotatedException extends RefreshStoreException {

    public AlreadyRotatedException(String recordId) {
        super("refresh record already rotated: " + recordId);
    }
}
