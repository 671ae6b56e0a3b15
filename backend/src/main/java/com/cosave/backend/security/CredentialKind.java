package com.cosave.backend.security;

/**
 * 토큰 종류. aud 클레임과 서명 키를 종류별로 분리해서
 * refresh 토큰을 access 자리에(또는 반대로) 쓸 수 없게 한다.
 */
public enum CredentialKind {
    ACCESS("access"),
    REFRESH("refresh");

    private final String audience;

    CredentialKind(String audience) {
        this.audience = audience;
    }

    public String audience() {
        return audience;
    }
}
