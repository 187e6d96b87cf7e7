package com.todoapi.todo.service;

import com.todoapi.todo.entity.Todo;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One page of a user's todos, with the effective page and limit that
 * produced it and the owner's total todo count.
 */
@Value
@Builder
public class TodoPage {
    List<Todo> items;
    int page;
    int limit;
    long total;
}
