package com.tasktrack.api.todos;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

record CreateTodoRequest(
        @NotBlank @Size(max = TodoService.MAX_TITLE_LENGTH) String title,
        @Size(max = TodoService.MAX_DESCRIPTION_LENGTH) String description) {}

record UpdateTodoRequest(
        @Size(min = 1, max = TodoService.MAX_TITLE_LENGTH) String title,
        @Size(max = TodoService.MAX_DESCRIPTION_LENGTH) String description,
        Boolean completed) {

    TodoPatch toPatch() {
        return new TodoPatch(title, description, completed);
    }
}

record MessageResponse(String message) {}
