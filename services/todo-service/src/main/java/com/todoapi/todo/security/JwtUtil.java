package com.todoapi.todo.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SecurityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * JwtUtil - Issues and verifies the bearer tokens of the Todo API.
 *
 * JWT Structure (RFC 7519):
 * - Header: Algorithm (HS256) and token type (JWT)
 * - Payload: Subject (user id as decimal string), issued at, expiration
 * - Signature: HMAC-SHA256 using the process-wide secret key
 *
 * Security Configuration (from application.yml):
 * - jwt.secret: HMAC signing key (min 256 bits / 32 bytes for HS256)
 * - jwt.expiration: Token lifetime as a Duration (default: 30 minutes)
 *
 * The signing key is derived once at construction and never changes while
 * the process runs. Time is read from the injected Clock, so expiry can be
 * exercised in tests without sleeping.
 *
 * Token Lifecycle:
 * 1. User logs in successfully
 * 2. issue() creates a signed JWT with the user id as subject
 * 3. Client sends it as "Authorization: Bearer &lt;token&gt;"
 * 4. verify() checks signature, expiration and subject on each request
 * 5. Token expires after the TTL; there is no refresh or revocation
 *
 * @see IdentityResolver for header parsing and user lookup
 */
@Component
@Slf4j
public class JwtUtil {

    /** HMAC-SHA256 key derived from jwt.secret. */
    private final Key signingKey;

    /** Token lifetime, jwt.expiration. */
    private final Duration expiration;

    private final Clock clock;

    private final JwtParser parser;

    public JwtUtil(@Value("${jwt.secret}") String secret,
                   @Value("${jwt.expiration:30m}") Duration expiration,
                   Clock clock) {
        // Keys.hmacShaKeyFor rejects secrets shorter than 256 bits
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expiration = expiration;
        this.clock = clock;
        this.parser = Jwts.parserBuilder()
                .setSigningKey(signingKey)
                .setClock(() -> Date.from(clock.instant()))
                .build();
        log.info("JWT signing initialized: algorithm=HS256, ttl={}", expiration);
    }

    /**
     * Generate a new JWT token for an authenticated user.
     *
     * Creates a signed JWT with:
     * - Subject (sub): User's id
     * - Issued At (iat): Current clock time
     * - Expiration (exp): Issued at + jwt.expiration
     *
     * @param userId id of the authenticated user
     * @return Signed JWT token string (header.payload.signature)
     */
    public String issue(Long userId) {
        Instant now = clock.instant();
        return Jwts.builder()
                .setSubject(String.valueOf(userId))
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plus(expiration)))
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * Verify a token and extract its subject.
     *
     * Never throws. Each rejection reason is reported separately so tests
     * and logs can tell them apart; the API answers all of them with 401.
     *
     * @param token compact JWT without the "Bearer " prefix
     * @return VALID with the user id, or MALFORMED, BAD_SIGNATURE, EXPIRED
     *         or MISSING_SUBJECT
     */
    public TokenVerification verify(String token) {
        if (token == null || token.isBlank()) {
            return TokenVerification.invalid(TokenStatus.MALFORMED);
        }

        Claims claims;
        try {
            claims = parser.parseClaimsJws(token).getBody();
        } catch (ExpiredJwtException e) {
            log.debug("Rejected expired token: exp={}", e.getClaims().getExpiration());
            return TokenVerification.invalid(TokenStatus.EXPIRED);
        } catch (SecurityException e) {
            log.debug("Rejected token with invalid signature");
            return TokenVerification.invalid(TokenStatus.BAD_SIGNATURE);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected malformed token: {}", e.getMessage());
            return TokenVerification.invalid(TokenStatus.MALFORMED);
        }

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            return TokenVerification.invalid(TokenStatus.MISSING_SUBJECT);
        }
        try {
            return TokenVerification.valid(Long.parseLong(subject));
        } catch (NumberFormatException e) {
            log.debug("Rejected token with non-numeric subject");
            return TokenVerification.invalid(TokenStatus.MALFORMED);
        }
    }
}
