package com.todoapi.todo.service;

import com.todoapi.todo.entity.User;
import com.todoapi.todo.exception.ErrorKind;
import com.todoapi.todo.repository.UserRepository;
import com.todoapi.todo.security.JwtUtil;
import com.todoapi.todo.security.PasswordHasher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

/**
 * AccountService - Registration and login.
 *
 * Key Responsibilities:
 * - Enforce email uniqueness before creating a user
 * - Hash passwords before they reach the database
 * - Verify credentials and issue JWT bearer tokens
 *
 * Emails are trimmed and lower-cased before every lookup and insert, so
 * "Ada@Example.com" and "ada@example.com" are the same account.
 *
 * Security Considerations:
 * - Unknown email and wrong password produce the identical failure
 * - An unknown email still pays for one BCrypt comparison, keeping response
 *   times of the two failure paths close
 * - Neither the password nor its hash is ever logged or returned
 *
 * @see JwtUtil for token issuance
 * @see PasswordHasher for hashing
 */
@Service
@Slf4j
public class AccountService {

    static final String EMAIL_TAKEN_MESSAGE = "Email already registered";
    static final String BAD_CREDENTIALS_MESSAGE = "Invalid email or password";

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final JwtUtil jwtUtil;

    /** Valid BCrypt hash compared against when the email is unknown. */
    private final String dummyHash;

    public AccountService(UserRepository userRepository, PasswordHasher passwordHasher, JwtUtil jwtUtil) {
        this.userRepository = userRepository;
        this.passwordHasher = passwordHasher;
        this.jwtUtil = jwtUtil;
        this.dummyHash = passwordHasher.hash("timing-equalization-placeholder");
    }

    /**
     * Register a new user.
     *
     * Not wrapped in a transaction: the existence check gives the common
     * duplicate case a clean answer without a write, and the unique index on
     * users.email catches a concurrent registration that slips past it.
     *
     * @return the created User (with assigned id), or CONFLICT if the email is taken
     * @throws DataIntegrityViolationException if the insert fails for another reason
     */
    public ServiceResult<User> register(String name, String email, String password) {
        String normalizedEmail = normalizeEmail(email);
        log.info("Registration attempt for email: {}", normalizedEmail);

        if (userRepository.existsByEmail(normalizedEmail)) {
            log.warn("Registration rejected, email already registered: {}", normalizedEmail);
            return ServiceResult.failure(ErrorKind.CONFLICT, EMAIL_TAKEN_MESSAGE);
        }

        User newUser = User.builder()
                .name(name)
                .email(normalizedEmail)
                .passwordHash(passwordHasher.hash(password))
                .build();

        User saved;
        try {
            saved = userRepository.saveAndFlush(newUser);
        } catch (DataIntegrityViolationException e) {
            // Only the unique email index means a lost race; anything else is a real failure
            if (!userRepository.existsByEmail(normalizedEmail)) {
                throw e;
            }
            log.warn("Registration lost a race on email: {}", normalizedEmail);
            return ServiceResult.failure(ErrorKind.CONFLICT, EMAIL_TAKEN_MESSAGE);
        }

        log.info("Created user account {} for email: {}", saved.getId(), normalizedEmail);
        return ServiceResult.success(saved);
    }

    /**
     * Authenticate with email and password.
     *
     * @return a signed bearer token bound to the user's id, or UNAUTHORIZED
     */
    public ServiceResult<String> login(String email, String password) {
        String normalizedEmail = normalizeEmail(email);
        Optional<User> user = userRepository.findByEmail(normalizedEmail);

        // Run the comparison either way so both failure paths look alike
        String storedHash = user.map(User::getPasswordHash).orElse(dummyHash);
        boolean passwordMatches = passwordHasher.verify(password, storedHash);

        if (user.isEmpty() || !passwordMatches) {
            log.warn("Login failed for email: {}", normalizedEmail);
            return ServiceResult.failure(ErrorKind.UNAUTHORIZED, BAD_CREDENTIALS_MESSAGE);
        }

        String token = jwtUtil.issue(user.get().getId());
        log.info("User authenticated successfully: {}", user.get().getId());
        return ServiceResult.success(token);
    }

    static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }
}
