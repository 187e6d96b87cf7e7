package com.todoapi.todo.service;

import com.todoapi.todo.entity.Todo;
import com.todoapi.todo.entity.User;
import com.todoapi.todo.exception.ErrorKind;
import com.todoapi.todo.repository.TodoRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * TodoService - Ownership-scoped access to Todo records.
 *
 * Every operation receives the already resolved caller as owner. Reads are
 * filtered by owner; update and delete look the record up by id first and
 * then check ownership, so a caller touching someone else's todo gets
 * FORBIDDEN rather than NOT_FOUND. That reveals the id exists, which has
 * always been the observable behaviour of the API.
 *
 * Pagination policy:
 * - page below 1 is treated as 1
 * - limit below 1 is rejected with VALIDATION
 * - limit above todo.pagination.max-limit is clamped to it
 * - a page whose offset does not fit an int is empty, total still counted
 * - results are ordered by ascending id
 */
@Service
@Slf4j
public class TodoService {

    static final String NOT_FOUND_MESSAGE = "Todo not found";
    static final String FORBIDDEN_MESSAGE = "Forbidden";

    private static final Sort LIST_ORDER = Sort.by(Sort.Direction.ASC, "id");

    private final TodoRepository todoRepository;
    private final int maxLimit;

    public TodoService(TodoRepository todoRepository,
                       @Value("${todo.pagination.max-limit:100}") int maxLimit) {
        this.todoRepository = todoRepository;
        this.maxLimit = maxLimit;
    }

    @Transactional
    public Todo create(User owner, String title, String description) {
        Todo todo = Todo.builder()
                .userId(owner.getId())
                .title(title)
                .description(description)
                .build();
        Todo saved = todoRepository.save(todo);
        log.info("Created todo {} for user {}", saved.getId(), owner.getId());
        return saved;
    }

    /**
     * List one page of the owner's todos.
     * Skips (page - 1) * limit records in ascending id order.
     */
    @Transactional(readOnly = true)
    public ServiceResult<TodoPage> list(User owner, int page, int limit) {
        if (limit < 1) {
            return ServiceResult.failure(ErrorKind.VALIDATION, "limit must be at least 1");
        }
        int effectivePage = Math.max(page, 1);
        int effectiveLimit = Math.min(limit, maxLimit);

        long offset = (long) (effectivePage - 1) * effectiveLimit;
        if (offset > Integer.MAX_VALUE) {
            // JPA offsets are int; no owner can have that many todos anyway
            long total = todoRepository.countByUserId(owner.getId());
            log.debug("Page {} (offset {}) is past the end for user {}", effectivePage, offset, owner.getId());
            return ServiceResult.success(TodoPage.builder()
                    .items(List.of())
                    .page(effectivePage)
                    .limit(effectiveLimit)
                    .total(total)
                    .build());
        }

        Page<Todo> result = todoRepository.findByUserId(
                owner.getId(), PageRequest.of(effectivePage - 1, effectiveLimit, LIST_ORDER));
        log.debug("Listed {} todos for user {} (page={}, limit={}, total={})",
                result.getNumberOfElements(), owner.getId(), effectivePage, effectiveLimit,
                result.getTotalElements());

        return ServiceResult.success(TodoPage.builder()
                .items(result.getContent())
                .page(effectivePage)
                .limit(effectiveLimit)
                .total(result.getTotalElements())
                .build());
    }

    /**
     * Overwrite title and description of an owned todo.
     *
     * @return the updated todo, NOT_FOUND, or FORBIDDEN
     */
    @Transactional
    public ServiceResult<Todo> update(User owner, Long todoId, String title, String description) {
        ServiceResult<Todo> lookup = findOwned(owner, todoId);
        if (!lookup.isSuccess()) {
            return lookup;
        }

        Todo todo = lookup.getValue();
        todo.setTitle(title);
        todo.setDescription(description);
        Todo saved = todoRepository.save(todo);
        log.info("Updated todo {} for user {}", todoId, owner.getId());
        return ServiceResult.success(saved);
    }

    /**
     * Permanently remove an owned todo.
     *
     * @return success, NOT_FOUND, or FORBIDDEN
     */
    @Transactional
    public ServiceResult<Void> delete(User owner, Long todoId) {
        ServiceResult<Todo> lookup = findOwned(owner, todoId);
        if (!lookup.isSuccess()) {
            return ServiceResult.failure(lookup.getError(), lookup.getMessage());
        }

        todoRepository.delete(lookup.getValue());
        log.info("Deleted todo {} for user {}", todoId, owner.getId());
        return ServiceResult.success(null);
    }

    private ServiceResult<Todo> findOwned(User owner, Long todoId) {
        Todo todo = todoRepository.findById(todoId).orElse(null);
        if (todo == null) {
            return ServiceResult.failure(ErrorKind.NOT_FOUND, NOT_FOUND_MESSAGE);
        }
        if (!todo.isOwnedBy(owner)) {
            log.warn("User {} denied access to todo {} owned by user {}",
                    owner.getId(), todoId, todo.getUserId());
            return ServiceResult.failure(ErrorKind.FORBIDDEN, FORBIDDEN_MESSAGE);
        }
        return ServiceResult.success(todo);
    }
}
