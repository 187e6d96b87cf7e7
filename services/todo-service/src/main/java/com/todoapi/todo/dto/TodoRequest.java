package com.todoapi.todo.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of POST /todos and PUT /todos/{id}.
 * Both fields must be present; empty strings and any length are accepted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TodoRequest {

    @NotNull
    private String title;

    @NotNull
    private String description;
}
