package com.tasktrack.api.todos;

import com.tasktrack.api.errors.NotFoundException;
import com.tasktrack.api.errors.ValidationException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Todo operations on behalf of a resolved identity. The owner id always comes from the caller's
 * identity, never from request input. A todo that belongs to another owner is reported as
 * {@link NotFoundException}, exactly as if it did not exist.
 */
@Service
public class TodoService {

    static final int MAX_TITLE_LENGTH = 200;
    static final int MAX_DESCRIPTION_LENGTH = 1000;
    static final String NOT_FOUND = "Todo not found";

    private final TodoStore store;

    public TodoService(TodoStore store) {
        this.store = store;
    }

    public Todo create(UUID ownerId, String title, String description) {
        requireTitle(title);
        checkDescription(description);
        return store.insert(ownerId, title, description);
    }

    public List<Todo> list(UUID ownerId) {
        return store.findAll(ownerId);
    }

    public TodoPage search(UUID ownerId, TodoQuery query) {
        if (query.page() < 1) {
            throw new ValidationException("page must be at least 1");
        }
        if (query.perPage() < 1 || query.perPage() > TodoQuery.MAX_PER_PAGE) {
            throw new ValidationException("per_page must be between 1 and " + TodoQuery.MAX_PER_PAGE);
        }
        // row offsets are int-sized in JPA
        if (query.offset() > Integer.MAX_VALUE) {
            throw new ValidationException("page is out of range");
        }
        return store.search(ownerId, query);
    }

    public Todo get(UUID ownerId, long todoId) {
        return store.find(ownerId, todoId).orElseThrow(() -> new NotFoundException(NOT_FOUND));
    }

    /**
     * Applies the supplied fields of {@code patch}; the others keep their value.
     */
    public Todo update(UUID ownerId, long todoId, TodoPatch patch) {
        if (patch.title() != null) {
            requireTitle(patch.title());
        }
        checkDescription(patch.description());
        return store.update(ownerId, todoId, patch).orElseThrow(() -> new NotFoundException(NOT_FOUND));
    }

    public Todo toggle(UUID ownerId, long todoId) {
        return store.toggle(ownerId, todoId).orElseThrow(() -> new NotFoundException(NOT_FOUND));
    }

    public void delete(UUID ownerId, long todoId) {
        if (!store.delete(ownerId, todoId)) {
            throw new NotFoundException(NOT_FOUND);
        }
    }

    private static void requireTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("Title must not be empty");
        }
        if (title.length() > MAX_TITLE_LENGTH) {
            throw new ValidationException("Title must be at most " + MAX_TITLE_LENGTH + " characters");
        }
    }

    private static void checkDescription(String description) {
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new ValidationException("Description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
    }
}
