package com.todoapi.todo.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * LoginResponse - Returned after successful authentication.
 *
 * Example Response:
 * <pre>
 * {
 *   "token": "eyJhbGciOiJIUzI1NiJ9.eyJzdWIiOiI0MiIsImlhdCI6MTcwMDAwMDAwMH0.signature"
 * }
 * </pre>
 *
 * The client sends the token back as {@code Authorization: Bearer <token>}
 * until it expires (jwt.expiration, 30 minutes by default).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginResponse {

    private String token;
}
