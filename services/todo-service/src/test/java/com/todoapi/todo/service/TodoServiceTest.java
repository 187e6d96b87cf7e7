package com.todoapi.todo.service;

import com.todoapi.todo.entity.Todo;
import com.todoapi.todo.entity.User;
import com.todoapi.todo.exception.ErrorKind;
import com.todoapi.todo.repository.TodoRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TodoServiceTest {

    private static final User ALICE = User.builder().id(1L).name("Alice").email("alice@example.com").build();
    private static final User BOB = User.builder().id(2L).name("Bob").email("bob@example.com").build();

    @Mock
    private TodoRepository todoRepository;

    private TodoService todoService;

    @BeforeEach
    void setup() {
        todoService = new TodoService(todoRepository, 100);
    }

    private static Todo todo(long id, User owner) {
        return Todo.builder().id(id).userId(owner.getId()).title("t" + id).description("d" + id).build();
    }

    @Test
    void createAssignsCallerAsOwner() {
        when(todoRepository.save(any(Todo.class))).thenAnswer(inv -> {
            Todo t = inv.getArgument(0);
            t.setId(10L);
            return t;
        });

        Todo created = todoService.create(ALICE, "Buy milk", "2 litres");

        assertThat(created.getId()).isEqualTo(10L);
        assertThat(created.getUserId()).isEqualTo(ALICE.getId());
        assertThat(created.getTitle()).isEqualTo("Buy milk");
        assertThat(created.getDescription()).isEqualTo("2 litres");
    }

    @Test
    void listQueriesOwnersTodosInIdOrder() {
        Pageable expected = PageRequest.of(2, 10, Sort.by(Sort.Direction.ASC, "id"));
        List<Todo> lastPage = List.of(todo(21, ALICE), todo(22, ALICE), todo(23, ALICE), todo(24, ALICE), todo(25, ALICE));
        when(todoRepository.findByUserId(eq(ALICE.getId()), any(Pageable.class)))
                .thenReturn(new PageImpl<>(lastPage, expected, 25));

        TodoPage page = todoService.list(ALICE, 3, 10).getValue();

        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(todoRepository).findByUserId(eq(ALICE.getId()), pageable.capture());
        assertThat(pageable.getValue().getOffset()).isEqualTo(20);
        assertThat(pageable.getValue().getPageSize()).isEqualTo(10);
        assertThat(pageable.getValue().getSort()).isEqualTo(Sort.by(Sort.Direction.ASC, "id"));

        assertThat(page.getItems()).hasSize(5);
        assertThat(page.getPage()).isEqualTo(3);
        assertThat(page.getLimit()).isEqualTo(10);
        assertThat(page.getTotal()).isEqualTo(25);
    }

    @Test
    void pageBelowOneIsTreatedAsFirstPage() {
        when(todoRepository.findByUserId(eq(ALICE.getId()), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of()));

        TodoPage page = todoService.list(ALICE, -4, 10).getValue();

        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(todoRepository).findByUserId(eq(ALICE.getId()), pageable.capture());
        assertThat(pageable.getValue().getOffset()).isZero();
        assertThat(page.getPage()).isEqualTo(1);
    }

    @Test
    void nonPositiveLimitIsRejected() {
        ServiceResult<TodoPage> zero = todoService.list(ALICE, 1, 0);
        ServiceResult<TodoPage> negative = todoService.list(ALICE, 1, -5);

        assertThat(zero.getError()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(negative.getError()).isEqualTo(ErrorKind.VALIDATION);
        verifyNoInteractions(todoRepository);
    }

    @Test
    void oversizedLimitIsClamped() {
        when(todoRepository.findByUserId(eq(ALICE.getId()), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of()));

        TodoPage page = todoService.list(ALICE, 1, 5000).getValue();

        assertThat(page.getLimit()).isEqualTo(100);
    }

    @Test
    void pageBeyondIntOffsetIsEmptyWithRealTotal() {
        when(todoRepository.countByUserId(ALICE.getId())).thenReturn(25L);

        TodoPage page = todoService.list(ALICE, 300_000_000, 10).getValue();

        assertThat(page.getItems()).isEmpty();
        assertThat(page.getPage()).isEqualTo(300_000_000);
        assertThat(page.getLimit()).isEqualTo(10);
        assertThat(page.getTotal()).isEqualTo(25);
        verify(todoRepository, never()).findByUserId(anyLong(), any(Pageable.class));
    }

    @Test
    void updateOverwritesOwnedTodo() {
        Todo existing = todo(3, ALICE);
        when(todoRepository.findById(3L)).thenReturn(Optional.of(existing));
        when(todoRepository.save(existing)).thenReturn(existing);

        ServiceResult<Todo> result = todoService.update(ALICE, 3L, "new title", "new description");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue().getId()).isEqualTo(3L);
        assertThat(result.getValue().getUserId()).isEqualTo(ALICE.getId());
        assertThat(result.getValue().getTitle()).isEqualTo("new title");
        assertThat(result.getValue().getDescription()).isEqualTo("new description");
    }

    @Test
    void updateOfMissingTodoIsNotFound() {
        when(todoRepository.findById(404L)).thenReturn(Optional.empty());

        ServiceResult<Todo> result = todoService.update(ALICE, 404L, "t", "d");

        assertThat(result.getError()).isEqualTo(ErrorKind.NOT_FOUND);
        verify(todoRepository, never()).save(any());
    }

    @Test
    void updateOfSomeoneElsesTodoIsForbidden() {
        Todo bobs = todo(8, BOB);
        when(todoRepository.findById(8L)).thenReturn(Optional.of(bobs));

        ServiceResult<Todo> result = todoService.update(ALICE, 8L, "hijack", "hijack");

        assertThat(result.getError()).isEqualTo(ErrorKind.FORBIDDEN);
        assertThat(bobs.getTitle()).isEqualTo("t8");
        verify(todoRepository, never()).save(any());
    }

    @Test
    void deleteRemovesOwnedTodo() {
        Todo existing = todo(3, ALICE);
        when(todoRepository.findById(3L)).thenReturn(Optional.of(existing));

        ServiceResult<Void> result = todoService.delete(ALICE, 3L);

        assertThat(result.isSuccess()).isTrue();
        verify(todoRepository).delete(existing);
    }

    @Test
    void deleteOfMissingTodoIsNotFound() {
        when(todoRepository.findById(anyLong())).thenReturn(Optional.empty());

        assertThat(todoService.delete(ALICE, 77L).getError()).isEqualTo(ErrorKind.NOT_FOUND);
        verify(todoRepository, never()).delete(any());
    }

    @Test
    void deleteOfSomeoneElsesTodoIsForbidden() {
        when(todoRepository.findById(8L)).thenReturn(Optional.of(todo(8, BOB)));

        assertThat(todoService.delete(ALICE, 8L).getError()).isEqualTo(ErrorKind.FORBIDDEN);
        verify(todoRepository, never()).delete(any());
    }
}
