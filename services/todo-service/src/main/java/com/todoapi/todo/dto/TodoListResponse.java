package com.todoapi.todo.dto;

import com.todoapi.todo.service.TodoPage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * TodoListResponse - One page of GET /todos.
 *
 * Example Response:
 * <pre>
 * {
 *   "data": [{"id": 1, "title": "Buy milk", "description": "2 litres"}],
 *   "page": 1,
 *   "limit": 10,
 *   "total": 1
 * }
 * </pre>
 *
 * total is the caller's full todo count, so clients can compute the number
 * of pages as ceil(total / limit).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TodoListResponse {

    private List<TodoResponse> data;
    private int page;
    private int limit;
    private long total;

    public static TodoListResponse from(TodoPage page) {
        return TodoListResponse.builder()
                .data(page.getItems().stream().map(TodoResponse::from).toList())
                .page(page.getPage())
                .limit(page.getLimit())
                .total(page.getTotal())
                .build();
    }
}
