package com.todoapi.todo.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * PasswordHasher - One-way password hashing and verification.
 *
 * Backed by BCrypt: every hash call draws a fresh random salt and embeds it,
 * together with the cost factor, in the 60-character output. Verification
 * re-derives the hash from the embedded salt and compares without early
 * return.
 *
 * BCrypt only reads the first 72 bytes of its input. Plaintext is therefore
 * reduced to its SHA-256 digest (44 Base64 characters) before BCrypt sees it,
 * so every byte of a long or multi-byte password counts.
 *
 * Configuration (from application.yml):
 * - todo.security.bcrypt-strength: BCrypt log rounds (default 10)
 */
@Component
@Slf4j
public class PasswordHasher {

    private static final String DIGEST_ALGORITHM = "SHA-256";

    private final BCryptPasswordEncoder encoder;

    public PasswordHasher(@Value("${todo.security.bcrypt-strength:10}") int strength) {
        this.encoder = new BCryptPasswordEncoder(strength);
    }

    /**
     * Hash a plaintext password.
     *
     * @param plaintext any string, including the empty string
     * @return opaque BCrypt hash with the salt embedded
     */
    public String hash(String plaintext) {
        return encoder.encode(digest(plaintext));
    }

    /**
     * Check a plaintext password against a stored hash.
     *
     * @return true only if the hash is well formed and matches; malformed or
     *         null input yields false
     */
    public boolean verify(String plaintext, String hash) {
        if (plaintext == null || hash == null) {
            return false;
        }
        try {
            return encoder.matches(digest(plaintext), hash);
        } catch (IllegalArgumentException e) {
            log.debug("Stored password hash could not be parsed: {}", e.getMessage());
            return false;
        }
    }

    private static String digest(String plaintext) {
        try {
            MessageDigest digest = MessageDigest.getInstance(DIGEST_ALGORITHM);
            byte[] bytes = digest.digest(plaintext.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
