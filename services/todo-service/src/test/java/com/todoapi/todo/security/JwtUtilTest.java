package com.todoapi.todo.security;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;

class JwtUtilTest {

    private static final String SECRET = "unit-test-secret-that-is-long-enough-0123456789";
    private static final Duration TTL = Duration.ofMinutes(30);
    private static final Instant ISSUED_AT = Instant.parse("2026-03-01T10:00:00Z");

    private static JwtUtil at(Instant now) {
        return new JwtUtil(SECRET, TTL, Clock.fixed(now, ZoneOffset.UTC));
    }

    @Test
    void verifiesFreshlyIssuedToken() {
        JwtUtil jwtUtil = at(ISSUED_AT);

        TokenVerification result = jwtUtil.verify(jwtUtil.issue(42L));

        assertThat(result.isValid()).isTrue();
        assertThat(result.getStatus()).isEqualTo(TokenStatus.VALID);
        assertThat(result.getUserId()).isEqualTo(42L);
    }

    @Test
    void acceptsTokenJustBeforeExpiry() {
        String token = at(ISSUED_AT).issue(7L);

        TokenVerification result = at(ISSUED_AT.plus(TTL).minusSeconds(1)).verify(token);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getUserId()).isEqualTo(7L);
    }

    @Test
    void rejectsTokenAfterTtlElapses() {
        String token = at(ISSUED_AT).issue(7L);

        TokenVerification result = at(ISSUED_AT.plus(TTL).plusSeconds(1)).verify(token);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getStatus()).isEqualTo(TokenStatus.EXPIRED);
        assertThat(result.getUserId()).isNull();
    }

    @Test
    void ttlComesFromConfiguration() {
        JwtUtil shortLived = new JwtUtil(SECRET, Duration.ofMinutes(1), Clock.fixed(ISSUED_AT, ZoneOffset.UTC));
        String token = shortLived.issue(1L);

        assertThat(at(ISSUED_AT.plusSeconds(61)).verify(token).getStatus()).isEqualTo(TokenStatus.EXPIRED);
    }

    @Test
    void rejectsTokenSignedWithAnotherKey() {
        JwtUtil other = new JwtUtil("a-completely-different-secret-0123456789abcdef", TTL,
                Clock.fixed(ISSUED_AT, ZoneOffset.UTC));
        String forged = other.issue(42L);

        assertThat(at(ISSUED_AT).verify(forged).getStatus()).isEqualTo(TokenStatus.BAD_SIGNATURE);
    }

    @Test
    void rejectsTokenWithoutSubject() {
        String token = Jwts.builder()
                .setIssuedAt(Date.from(ISSUED_AT))
                .setExpiration(Date.from(ISSUED_AT.plus(TTL)))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)), SignatureAlgorithm.HS256)
                .compact();

        assertThat(at(ISSUED_AT).verify(token).getStatus()).isEqualTo(TokenStatus.MISSING_SUBJECT);
    }

    @Test
    void rejectsNonNumericSubject() {
        String token = Jwts.builder()
                .setSubject("not-a-number")
                .setExpiration(Date.from(ISSUED_AT.plus(TTL)))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)), SignatureAlgorithm.HS256)
                .compact();

        assertThat(at(ISSUED_AT).verify(token).getStatus()).isEqualTo(TokenStatus.MALFORMED);
    }

    @Test
    void rejectsUnsignedToken() {
        String token = Jwts.builder()
                .setSubject("42")
                .setExpiration(Date.from(ISSUED_AT.plus(TTL)))
                .compact();

        assertThat(at(ISSUED_AT).verify(token).getStatus()).isEqualTo(TokenStatus.MALFORMED);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {" ", "garbage", "a.b.c", "only.two"})
    void rejectsMalformedTokens(String token) {
        TokenVerification result = at(ISSUED_AT).verify(token);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getStatus()).isEqualTo(TokenStatus.MALFORMED);
    }
}
