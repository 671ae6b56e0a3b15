package com.cosave.backend.auth.identity.login.dto;

import com.cosave.backend.global.jackson.TrimStringDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * [로그인 요청 DTO]
 * - email/password는 기본 형식 검증만 수행한다. 소문자 정규화는 LoginService에서.
 * - deviceName / deviceId: 세션 목록에 보여줄 기기 정보(선택)
 */
public record LoginRequest(

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @Email
        @NotBlank
        String email,

        @NotBlank
        String password,

        Boolean rememberMe,

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @Size(max = 100)
        String deviceName,

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @Size(max = 100)
        String deviceId
) {
    public boolean rememberMeOrFalse() {
        return Boolean.TRUE.equals(rememberMe);
    }
}
