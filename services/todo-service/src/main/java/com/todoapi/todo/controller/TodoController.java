package com.todoapi.todo.controller;

import com.todoapi.todo.dto.TodoListResponse;
import com.todoapi.todo.dto.TodoRequest;
import com.todoapi.todo.dto.TodoResponse;
import com.todoapi.todo.entity.Todo;
import com.todoapi.todo.entity.User;
import com.todoapi.todo.security.IdentityResolver;
import com.todoapi.todo.service.TodoPage;
import com.todoapi.todo.service.TodoService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * TodoController - CRUD endpoints over the caller's todos.
 *
 * Endpoints:
 * - POST   /todos            - Create a todo
 * - GET    /todos?page&limit - List the caller's todos, paginated
 * - PUT    /todos/{id}       - Replace title and description
 * - DELETE /todos/{id}       - Delete a todo
 *
 * Each handler first resolves the caller from the Authorization header and
 * passes the resulting User to TodoService.
 *
 * Error Handling:
 * - 401 Unauthorized: Missing, malformed, invalid or expired bearer token
 * - 403 Forbidden: Todo belongs to another user
 * - 404 Not Found: No todo with that id
 */
@RestController
@RequestMapping("/todos")
@RequiredArgsConstructor
public class TodoController {

    private final IdentityResolver identityResolver;
    private final TodoService todoService;

    /**
     * Create a todo owned by the caller.
     *
     * @return 201 Created with the stored todo
     */
    @PostMapping
    public ResponseEntity<TodoResponse> create(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody TodoRequest request) {
        User owner = identityResolver.resolve(authorization).orElseThrow();
        Todo todo = todoService.create(owner, request.getTitle(), request.getDescription());
        return ResponseEntity.status(HttpStatus.CREATED).body(TodoResponse.from(todo));
    }

    /**
     * List one page of the caller's todos in id order.
     *
     * @param page 1-based page number, values below 1 mean 1
     * @param limit page size, at least 1, clamped to todo.pagination.max-limit
     * @return 200 OK with data, effective page and limit, and the total count
     */
    @GetMapping
    public ResponseEntity<TodoListResponse> list(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int limit) {
        User owner = identityResolver.resolve(authorization).orElseThrow();
        TodoPage todos = todoService.list(owner, page, limit).orElseThrow();
        return ResponseEntity.ok(TodoListResponse.from(todos));
    }

    /**
     * Overwrite title and description of one of the caller's todos.
     *
     * @return 200 OK with the updated todo
     */
    @PutMapping("/{id}")
    public ResponseEntity<TodoResponse> update(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable("id") Long id,
            @Valid @RequestBody TodoRequest request) {
        User owner = identityResolver.resolve(authorization).orElseThrow();
        Todo todo = todoService.update(owner, id, request.getTitle(), request.getDescription()).orElseThrow();
        return ResponseEntity.ok(TodoResponse.from(todo));
    }

    /**
     * Delete one of the caller's todos.
     *
     * @return 204 No Content
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable("id") Long id) {
        User owner = identityResolver.resolve(authorization).orElseThrow();
        todoService.delete(owner, id).orElseThrow();
        return ResponseEntity.noContent().build();
    }
}
