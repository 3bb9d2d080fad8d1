package com.tasktrack.api.todos;

import com.tasktrack.api.users.Identity;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/todos")
public class TodoController {

    private final TodoService todos;

    TodoController(TodoService todos) {
        this.todos = todos;
    }

    @GetMapping
    TodoPage list(
            @AuthenticationPrincipal Identity me,
            @RequestParam(name = "page", defaultValue = "1") int page,
            @RequestParam(name = "per_page", defaultValue = "10") int perPage,
            @RequestParam(name = "completed", required = false) Boolean completed,
            @RequestParam(name = "search", required = false) String search) {
        return todos.search(me.id(), new TodoQuery(completed, search, page, perPage));
    }

    @PostMapping
    ResponseEntity<Todo> create(@AuthenticationPrincipal Identity me, @Valid @RequestBody CreateTodoRequest req) {
        var todo = todos.create(me.id(), req.title(), req.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(todo);
    }

    @GetMapping("/{id}")
    Todo get(@AuthenticationPrincipal Identity me, @PathVariable("id") long id) {
        return todos.get(me.id(), id);
    }

    @RequestMapping(value = "/{id}", method = {RequestMethod.PUT, RequestMethod.PATCH})
    Todo update(@AuthenticationPrincipal Identity me, @PathVariable("id") long id,
            @Valid @RequestBody UpdateTodoRequest req) {
        return todos.update(me.id(), id, req.toPatch());
    }

    @PostMapping("/{id}/toggle")
    Todo toggle(@AuthenticationPrincipal Identity me, @PathVariable("id") long id) {
        return todos.toggle(me.id(), id);
    }

    @DeleteMapping("/{id}")
    MessageResponse delete(@AuthenticationPrincipal Identity me, @PathVariable("id") long id) {
        todos.delete(me.id(), id);
        return new MessageResponse("Todo deleted successfully");
    }
}
