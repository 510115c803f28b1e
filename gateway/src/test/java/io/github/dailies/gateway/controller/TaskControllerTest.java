package io.github.dailies.gateway.controller;

import io.github.dailies.protocol.api.CreateTaskRequest;
import io.github.dailies.protocol.api.TaskDto;
import io.github.dailies.protocol.api.UpdateTaskRequest;
import io.github.dailies.runtime.error.NotFoundException;
import io.github.dailies.runtime.task.TaskService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TaskControllerTest {

    @Mock private TaskService taskService;

    private TaskController controller;

    @BeforeEach
    void setUp() {
        controller = new TaskController(taskService);
    }

    private static TaskDto makeTask(String id, boolean completed) {
        Instant now = Instant.parse("2025-01-15T10:00:00Z");
        return new TaskDto(id, "Stretch", null, completed, 2, null, null, List.of(), false, now, now);
    }

    @Test
    void listPassesFiltersThrough() {
        when(taskService.list(true, "str", List.of("t1"), "priority")).thenReturn(List.of(makeTask("a", true)));

        List<TaskDto> tasks = controller.list(true, "str", List.of("t1"), "priority");

        assertThat(tasks).extracting(TaskDto::id).containsExactly("a");
    }

    @Test
    void createReturns201() {
        when(taskService.create(any())).thenReturn(makeTask("a", false));

        ResponseEntity<TaskDto> response = controller.create(new CreateTaskRequest("Stretch", null, 2, null, null));

        assertThat(response.getStatusCode().value()).isEqualTo(201);
        assertThat(response.getBody().id()).isEqualTo("a");
    }

    @Test
    void updateReturns200() {
        UpdateTaskRequest req = new UpdateTaskRequest(null, null, true, null, null, null);
        when(taskService.update(eq("a"), eq(req))).thenReturn(makeTask("a", true));

        ResponseEntity<TaskDto> response = controller.update("a", req);

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(response.getBody().completed()).isTrue();
    }

    @Test
    void deleteReturns204() {
        ResponseEntity<Void> response = controller.delete("a");

        assertThat(response.getStatusCode().value()).isEqualTo(204);
        verify(taskService).delete("a");
    }

    @Test
    void getUnknownPropagatesNotFound() {
        when(taskService.get("missing")).thenThrow(new NotFoundException("Task not found"));

        assertThatThrownBy(() -> controller.get("missing")).isInstanceOf(NotFoundException.class);
    }
}
