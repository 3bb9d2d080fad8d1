package com.tasktrack.api.todos;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage for todo items. Every read and write takes the owner id and only ever touches that
 * owner's records, so a record owned by someone else behaves exactly like a missing one. Each
 * call is atomic for the single record it changes.
 */
public interface TodoStore {

    Todo insert(UUID ownerId, String title, String description);

    Optional<Todo> find(UUID ownerId, long todoId);

    /** All of the owner's todos in insertion order. */
    List<Todo> findAll(UUID ownerId);

    TodoPage search(UUID ownerId, TodoQuery query);

    Optional<Todo> update(UUID ownerId, long todoId, TodoPatch patch);

    Optional<Todo> toggle(UUID ownerId, long todoId);

    /** @return false if there was no such todo for this owner */
    boolean delete(UUID ownerId, long todoId);
}
