package com.tasktrack.api.todos;

/**
 * Filters and paging for listing an owner's todos.
 *
 * @param completed only todos with this completion state, or all when null
 * @param search case-insensitive substring of title or description, or all when null/blank
 * @param page 1-based page number
 * @param perPage page size
 */
public record TodoQuery(Boolean completed, String search, int page, int perPage) {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_PER_PAGE = 10;
    public static final int MAX_PER_PAGE = 100;

    public static TodoQuery firstPage() {
        return new TodoQuery(null, null, DEFAULT_PAGE, DEFAULT_PER_PAGE);
    }

    public boolean hasSearch() {
        return search != null && !search.isBlank();
    }

    public long offset() {
        return (long) (page - 1) * perPage;
    }
}
