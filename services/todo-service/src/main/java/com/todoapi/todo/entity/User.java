package com.todoapi.todo.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * User - JPA Entity representing a registered account of the Todo API.
 *
 * This entity maps to the 'users' table and is the identity record every
 * Todo points at through todos.user_id.
 *
 * Table Schema:
 * - id: BIGINT identity primary key (assigned by the database)
 * - email: Unique, normalized (trimmed, lower-case) login identifier, up to
 *   320 characters (64 local part, @, 255 domain)
 * - name: Display name, text
 * - password_hash: BCrypt hash, never leaves the service
 * - created_at: Account creation timestamp (immutable)
 *
 * Lifecycle:
 * - Created at registration (via AccountService.register)
 * - Never updated or deleted by any exposed operation
 *
 * @see com.todoapi.todo.repository.UserRepository for database operations
 * @see com.todoapi.todo.service.AccountService for user creation logic
 */
@Entity
@Table(name = "users")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    /**
     * Login identifier.
     *
     * Constraints:
     * - UNIQUE: enforced by AccountService before insert and by the column
     * - Stored normalized so lookups are case-insensitive
     */
    @Column(name = "email", unique = true, nullable = false, length = 320)
    private String email;

    /** Display name, unbounded text. */
    @Column(name = "name", nullable = false, columnDefinition = "text")
    private String name;

    /**
     * BCrypt hash of the user's password, salt embedded.
     * Only DTOs are serialized outward, so this never appears in a response.
     */
    @ToString.Exclude
    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
