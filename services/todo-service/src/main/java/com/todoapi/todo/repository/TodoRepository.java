package com.todoapi.todo.repository;

import com.todoapi.todo.entity.Todo;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * TodoRepository - Data Access Layer for Todo entities.
 *
 * findByUserId issues two queries: the offset/limit page and a
 * SELECT COUNT(*) ... WHERE user_id = ? for the total. countByUserId runs
 * only the count, for pages past any reachable offset.
 */
@Repository
public interface TodoRepository extends JpaRepository<Todo, Long> {

    Page<Todo> findByUserId(Long userId, Pageable pageable);

    long countByUserId(Long userId);
}
