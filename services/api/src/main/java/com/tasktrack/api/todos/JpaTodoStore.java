package com.tasktrack.api.todos;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Relational {@link TodoStore} over the {@code todo} table. Ownership is part of every query.
 */
@Repository
public class JpaTodoStore implements TodoStore {

    private final TodoRepository todos;
    private final Clock clock;

    JpaTodoStore(TodoRepository todos, Clock clock) {
        this.todos = todos;
        this.clock = clock;
    }

    @Override
    @Transactional
    public Todo insert(UUID ownerId, String title, String description) {
        return todos.saveAndFlush(new TodoEntity(ownerId, title, description, clock.instant())).toTodo();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Todo> find(UUID ownerId, long todoId) {
        return todos.findByIdAndOwnerId(todoId, ownerId).map(TodoEntity::toTodo);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Todo> findAll(UUID ownerId) {
        return todos.findByOwnerIdOrderByIdAsc(ownerId).stream().map(TodoEntity::toTodo).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public TodoPage search(UUID ownerId, TodoQuery query) {
        var pattern = query.hasSearch() ? "%" + escapeLike(query.search().toLowerCase(Locale.ROOT)) + "%" : null;
        var pageable = PageRequest.of(query.page() - 1, query.perPage(), Sort.by("id"));
        var page = todos.search(ownerId, query.completed(), pattern, pageable);
        return new TodoPage(page.map(TodoEntity::toTodo).getContent(), page.getTotalElements(),
                query.page(), query.perPage());
    }

    @Override
    @Transactional
    public Optional<Todo> update(UUID ownerId, long todoId, TodoPatch patch) {
        return todos.findByIdAndOwnerId(todoId, ownerId).map(entity -> {
            if (patch.title() != null) {
                entity.title = patch.title();
            }
            if (patch.description() != null) {
                entity.description = patch.description();
            }
            if (patch.completed() != null) {
                entity.completed = patch.completed();
            }
            entity.updatedAt = clock.instant();
            return todos.saveAndFlush(entity).toTodo();
        });
    }

    @Override
    @Transactional
    public Optional<Todo> toggle(UUID ownerId, long todoId) {
        return todos.findByIdAndOwnerId(todoId, ownerId).map(entity -> {
            entity.completed = !entity.completed;
            entity.updatedAt = clock.instant();
            return todos.saveAndFlush(entity).toTodo();
        });
    }

    @Override
    @Transactional
    public boolean delete(UUID ownerId, long todoId) {
        var entity = todos.findByIdAndOwnerId(todoId, ownerId);
        entity.ifPresent(todos::delete);
        return entity.isPresent();
    }

    static String escapeLike(String s) {
        return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
