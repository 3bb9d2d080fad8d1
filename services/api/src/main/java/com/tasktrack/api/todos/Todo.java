package com.tasktrack.api.todos;

import java.time.Instant;
import java.util.UUID;

/**
 * A todo item. {@code ownerId} refers to the identity that created it and never changes.
 */
public record Todo(
        long id,
        UUID ownerId,
        String title,
        String description,
        boolean completed,
        Instant createdAt,
        Instant updatedAt) {}
