package com.cosave.client;

/** 호출이 access token 만료/무효 신호를 받았다 (HTTP 401 상당) */
public class CredentialExpiredException extends RuntimeException {

    public CredentialExpiredException(String message) {
        super(message);
    }

    public CredentialExpiredException(String message, Throwable cause) {
        super(message, cause);
    }
}
