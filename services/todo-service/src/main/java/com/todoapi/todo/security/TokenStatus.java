package com.todoapi.todo.security;

/**
 * Result of checking a bearer token. Every value other than VALID collapses
 * to a single 401 at the API boundary.
 */
public enum TokenStatus {
    VALID,
    MALFORMED,
    BAD_SIGNATURE,
    EXPIRED,
    MISSING_SUBJECT
}
