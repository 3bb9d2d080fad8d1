package com.tasktrack.api.todos;

import java.time.Instant;

/**
 * Partial update of a todo. A null field is left unchanged.
 */
public record TodoPatch(String title, String description, Boolean completed) {

    public Todo applyTo(Todo todo, Instant now) {
        return new Todo(
                todo.id(),
                todo.ownerId(),
                title != null ? title : todo.title(),
                description != null ? description : todo.description(),
                completed != null ? completed : todo.completed(),
                todo.createdAt(),
                now);
    }
}
