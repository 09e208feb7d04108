package com.flamingo.ai.notebook.api.rest;

import com.flamingo.ai.notebook.api.dto.request.CreateTaskRequest;
import com.flamingo.ai.notebook.api.dto.request.UpdateTaskRequest;
import com.flamingo.ai.notebook.api.dto.response.TaskResponse;
import com.flamingo.ai.notebook.service.task.TaskService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for notebook tasks. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class TaskController {

  private final TaskService taskService;

  @PostMapping("/notebooks/{notebookId}/tasks")
  public ResponseEntity<TaskResponse> createTask(
      @PathVariable UUID notebookId, @Valid @RequestBody CreateTaskRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(TaskResponse.fromEntity(taskService.createTask(notebookId, request)));
  }

  @GetMapping("/notebooks/{notebookId}/tasks")
  public ResponseEntity<List<TaskResponse>> listTasks(@PathVariable UUID notebookId) {
    return ResponseEntity.ok(
        taskService.listTasks(notebookId).stream().map(TaskResponse::fromEntity).toList());
  }

  @GetMapping("/tasks/{taskId}")
  public ResponseEntity<TaskResponse> getTask(@PathVariable UUID taskId) {
    return ResponseEntity.ok(TaskResponse.fromEntity(taskService.getTask(taskId)));
  }

  @PutMapping("/tasks/{taskId}")
  public ResponseEntity<TaskResponse> updateTask(
      @PathVariable UUID taskId, @Valid @RequestBody UpdateTaskRequest request) {
    return ResponseEntity.ok(TaskResponse.fromEntity(taskService.updateTask(taskId, request)));
  }

  @DeleteMapping("/tasks/{taskId}")
  public ResponseEntity<Void> deleteTask(@PathVariable UUID taskId) {
    taskService.deleteTask(taskId);
    return ResponseEntity.noContent().build();
  }
}
