package com.cosave.backend.auth.domain;

/**
 * 계정 상태
 * - ACTIVE만 로그인/인증 허용
 * - SUSPENDED: 운영자 정지. 유효한 토큰을 들고 있어도 인증이 거부된다.
 * - WITHDRAWN: 탈퇴
 */
public enum UserStatus {
    ACTIVE, SUSPENDED, WITHDRAWN
}
