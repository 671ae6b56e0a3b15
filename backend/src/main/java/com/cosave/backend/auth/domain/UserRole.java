package com.cosave.backend.auth.domain;

/** 인가용 역할. access token에는 name() 문자열로 실린다. */
public enum UserRole {
    USER, ADMIN
}
