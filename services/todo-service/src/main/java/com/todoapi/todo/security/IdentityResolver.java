package com.todoapi.todo.security;

import com.todoapi.todo.entity.User;
import com.todoapi.todo.exception.ErrorKind;
import com.todoapi.todo.repository.UserRepository;
import com.todoapi.todo.service.ServiceResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * IdentityResolver - Turns the Authorization header of a request into the
 * calling User.
 *
 * Accepted form: {@code Authorization: Bearer <token>} with exactly one space
 * and a non-empty token. Every failure (missing header, other scheme, bad or
 * expired token, user no longer present) produces the same UNAUTHORIZED
 * outcome and message, so a client cannot tell the causes apart.
 *
 * Called once per protected request; performs at most one user read.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IdentityResolver {

    public static final String BEARER_PREFIX = "Bearer ";

    static final String UNAUTHORIZED_MESSAGE = "Could not validate credentials";

    private final JwtUtil jwtUtil;

    private final UserRepository userRepository;

    /**
     * Resolve the caller from the raw Authorization header value.
     *
     * @param authorizationHeader header value, may be null
     * @return the User on success, otherwise an UNAUTHORIZED failure
     */
    public ServiceResult<User> resolve(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            log.debug("Rejected request without a Bearer authorization header");
            return unauthorized();
        }

        String token = authorizationHeader.substring(BEARER_PREFIX.length());
        if (token.isEmpty() || token.startsWith(" ")) {
            log.debug("Rejected request with an empty bearer token");
            return unauthorized();
        }

        TokenVerification verification = jwtUtil.verify(token);
        if (!verification.isValid()) {
            log.warn("Rejected bearer token: {}", verification.getStatus());
            return unauthorized();
        }

        Optional<User> user = userRepository.findById(verification.getUserId());
        if (user.isEmpty()) {
            log.warn("Bearer token subject {} has no matching user", verification.getUserId());
            return unauthorized();
        }
        return ServiceResult.success(user.get());
    }

    private static ServiceResult<User> unauthorized() {
        return ServiceResult.failure(ErrorKind.UNAUTHORIZED, UNAUTHORIZED_MESSAGE);
    }
}
