package com.todoapi.todo.security;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Outcome of {@link JwtUtil#verify(String)}: the subject user id when the
 * token is valid, otherwise the reason it was rejected.
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class TokenVerification {

    private final TokenStatus status;

    /** Subject user id; null unless status is VALID. */
    private final Long userId;

    public static TokenVerification valid(Long userId) {
        return new TokenVerification(TokenStatus.VALID, userId);
    }

    public static TokenVerification invalid(TokenStatus status) {
        if (status == TokenStatus.VALID) {
            throw new IllegalArgumentException("invalid() needs a rejection status");
        }
        return new TokenVerification(status, null);
    }

    public boolean isValid() {
        return status == TokenStatus.VALID;
    }
}
