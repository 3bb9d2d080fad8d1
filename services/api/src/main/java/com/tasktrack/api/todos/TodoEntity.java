package com.tasktrack.api.todos;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "todo", indexes = @Index(name = "ix_todo_owner_id", columnList = "owner_id"))
class TodoEntity {

    // identity column: id order is insertion order
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    UUID ownerId;

    @Column(nullable = false, length = 200)
    String title;

    @Column(length = 1000)
    String description;

    @Column(nullable = false)
    boolean completed;

    @Column(nullable = false, updatable = false)
    Instant createdAt;

    Instant updatedAt;

    protected TodoEntity() {}

    TodoEntity(UUID ownerId, String title, String description, Instant createdAt) {
        this.ownerId = ownerId;
        this.title = title;
        this.description = description;
        this.completed = false;
        this.createdAt = createdAt;
    }

    Todo toTodo() {
        return new Todo(id, ownerId, title, description, completed, createdAt, updatedAt);
    }
}
