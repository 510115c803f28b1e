package io.github.dailies.gateway.controller;

import io.github.dailies.protocol.api.CreateTaskRequest;
import io.github.dailies.protocol.api.TaskDto;
import io.github.dailies.protocol.api.UpdateTaskRequest;
import io.github.dailies.runtime.task.TaskService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/tasks")
public class TaskController {

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    @GetMapping
    public List<TaskDto> list(@RequestParam(required = false) Boolean completed,
                              @RequestParam(required = false) String name,
                              @RequestParam(name = "tag_ids", required = false) List<String> tagIds,
                              @RequestParam(required = false) String sort) {
        return taskService.list(completed, name, tagIds, sort);
    }

    @GetMapping("/{id}")
    public TaskDto get(@PathVariable String id) {
        return taskService.get(id);
    }

    @PostMapping
    public ResponseEntity<TaskDto> create(@RequestBody CreateTaskRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(taskService.create(req));
    }

    @PutMapping("/{id}")
    public ResponseEntity<TaskDto> update(@PathVariable String id, @RequestBody UpdateTaskRequest req) {
        return ResponseEntity.ok(taskService.update(id, req));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        taskService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
