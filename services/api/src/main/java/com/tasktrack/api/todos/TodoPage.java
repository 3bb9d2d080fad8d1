package com.tasktrack.api.todos;

import java.util.List;

/**
 * One page of an owner's todos, in insertion order, with the total count of matches.
 */
public record TodoPage(List<Todo> todos, long total, int page, int perPage) {}
