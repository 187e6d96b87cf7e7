package com.todoapi.todo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * TodoServiceApplication - Main entry point for the Todo API service.
 *
 * This service exposes a small multi-tenant to-do list over HTTP:
 * - User registration and email/password login
 * - JWT bearer token issuance and validation
 * - Ownership-scoped create, list, update and delete of Todo records
 *
 * Architecture Context:
 * - Runs on port 8000 (configured in application.yml)
 * - Connects to PostgreSQL for user and todo persistence
 * - Stateless design - identity travels in the signed JWT on each request
 *
 * @see com.todoapi.todo.controller.AuthController for registration and login
 * @see com.todoapi.todo.controller.TodoController for todo endpoints
 * @see com.todoapi.todo.security.JwtUtil for JWT token operations
 */
@SpringBootApplication
public class TodoServiceApplication {

    /**
     * Application entry point.
     * Bootstraps the Spring Boot application context with auto-configuration
     * for web, JPA and validation.
     *
     * @param args Command-line arguments (supports standard Spring Boot args)
     */
    public static void main(String[] args) {
        SpringApplication.run(TodoServiceApplication.class, args);
    }
}
