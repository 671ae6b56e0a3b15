package com.cosave.backend.auth.domain;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * users 테이블 = 신원 저장소(identity store)
 *
 * 세션 서브시스템은 이 엔티티를 "읽기"만 한다. (로그인 시 lastLoginAt 갱신 제외)
 * - id: JWT sub, refresh 레코드의 owner_id
 * - role: access token의 roles 클레임
 * - status: ACTIVE가 아니면 인증 거부
 */
@Getter
@Entity
@Table(name = "users", uniqueConstraints = {
        @UniqueConstraint(name = "uq_users_email", columnNames = "email"),
        @UniqueConstraint(name = "uq_users_nickname", columnNames = "nickname")
})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash; // BCrypt 해시 (원문 저장 금지)

    @Column(nullable = false, length = 30)
    private String nickname;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserRole role;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserStatus status;

    @Column(name = "last_login_at")
    private LocalDateTime lastLoginAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static User create(String email, String passwordHash, String nickname, UserRole role, LocalDateTime now) {
        User u = new User();
        u.email = email;
        u.passwordHash = passwordHash;
        u.nickname = nickname;
        u.role = role;
        u.status = UserStatus.ACTIVE;
        u.createdAt = now;
        return u;
    }

    public boolean isActive() {
        return status == UserStatus.ACTIVE;
    }

    public void markLoggedIn(LocalDateTime now) {
        this.lastLoginAt = now;
    }
}
