package com.todoapi.todo.repository;

import com.todoapi.todo.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * UserRepository - Data Access Layer for User entities.
 *
 * Inherited Methods (from JpaRepository):
 * - save / saveAndFlush: Create user
 * - findById(Long id): Identity lookup for bearer tokens
 *
 * Custom Methods:
 * - findByEmail: Lookup for login
 * - existsByEmail: Uniqueness check for registration
 *
 * Callers pass normalized (trimmed, lower-case) emails.
 *
 * @see User for entity definition
 * @see com.todoapi.todo.service.AccountService for business logic using this repository
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    /**
     * Find a user by their email address.
     *
     * Query: SELECT * FROM users WHERE email = :email
     *
     * @param email normalized email address
     * @return Optional containing the User if found, empty Optional if not
     */
    Optional<User> findByEmail(String email);

    /**
     * Check if a user with the given email already exists.
     *
     * Query: SELECT COUNT(*) > 0 FROM users WHERE email = :email
     */
    boolean existsByEmail(String email);
}
