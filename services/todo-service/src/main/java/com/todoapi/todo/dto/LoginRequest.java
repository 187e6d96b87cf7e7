package com.todoapi.todo.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * LoginRequest - Data Transfer Object for email/password login requests.
 *
 * Usage:
 * <pre>
 * POST /login
 * Content-Type: application/json
 *
 * {
 *   "email": "user@example.com",
 *   "password": "securePassword123"
 * }
 * </pre>
 *
 * Security Note:
 * Never log or persist the password field.
 *
 * @see com.todoapi.todo.controller.AuthController for endpoint handling
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @NotBlank
    @Email
    private String email;

    /**
     * Not checked for blankness: any wrong password, empty included, gets
     * the same 401 as every other failed login.
     */
    @NotNull
    private String password;
}
