package com.cosave.backend.auth.identity.me.dto;

import java.util.List;
import java.util.Objects;

import com.cosave.backend.auth.domain.User;

public record MeResponse(
        Long userId,
        String email,
        String nickname,
        List<String> roles,
        String status
) {

    public static MeResponse from(User user) {
        Objects.requireNonNull(user, "user must not be null");

        return new MeResponse(
                user.getId(),
                user.getEmail(),
                user.getNickname(),
                List.of(user.getRole().name()),
                user.getStatus().name()
        );
    }
}
