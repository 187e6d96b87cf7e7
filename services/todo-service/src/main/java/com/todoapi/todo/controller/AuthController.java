package com.todoapi.todo.controller;

import com.todoapi.todo.dto.LoginRequest;
import com.todoapi.todo.dto.LoginResponse;
import com.todoapi.todo.dto.RegisterRequest;
import com.todoapi.todo.dto.UserResponse;
import com.todoapi.todo.entity.User;
import com.todoapi.todo.service.AccountService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * AuthController - REST API endpoints for account operations.
 *
 * Endpoints:
 * - POST /register - Create an account
 * - POST /login    - Exchange email and password for a bearer token
 *
 * Both endpoints are public. Every other endpoint except GET / expects the
 * token from /login in the Authorization header.
 *
 * Error Handling:
 * - 400 Bad Request: Invalid input or email already registered
 * - 401 Unauthorized: Wrong email or password (same response for both)
 *
 * @see AccountService for business logic
 */
@RestController
@RequiredArgsConstructor
public class AuthController {

    /** Service layer for registration and login */
    private final AccountService accountService;

    /**
     * Register a new user.
     *
     * @return 201 Created with {id, name, email}
     */
    @PostMapping("/register")
    public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterRequest request) {
        User user = accountService
                .register(request.getName(), request.getEmail(), request.getPassword())
                .orElseThrow();
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.from(user));
    }

    /**
     * Authenticate a user.
     *
     * @return 200 OK with {token}
     */
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        String token = accountService.login(request.getEmail(), request.getPassword()).orElseThrow();
        return ResponseEntity.ok(new LoginResponse(token));
    }
}
