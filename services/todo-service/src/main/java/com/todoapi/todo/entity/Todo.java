package com.todoapi.todo.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Todo - JPA Entity for a single task owned by exactly one user.
 *
 * Maps to the 'todos' table. The owner reference is kept as a plain column
 * (userId) for ownership checks and filtered queries, while the read-only
 * association declares the foreign key to users.id.
 *
 * Only title and description change after creation; id and owner are fixed.
 * Both are stored as unbounded text.
 */
@Entity
@Table(name = "todos", indexes = @Index(name = "idx_todos_user_id", columnList = "user_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Todo {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    /** Owning user's id; set on create, never changed. */
    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    /** Mapping of the users.id foreign key, not used for writes. */
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_todos_user_id"))
    private User owner;

    @Column(name = "title", nullable = false, columnDefinition = "text")
    private String title;

    @Column(name = "description", nullable = false, columnDefinition = "text")
    private String description;

    /**
     * @return true if the given user is this todo's owner
     */
    public boolean isOwnedBy(User user) {
        return user != null && userId != null && userId.equals(user.getId());
    }
}
