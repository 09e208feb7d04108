package com.flamingo.ai.notebook.service.task;

import com.flamingo.ai.notebook.api.dto.request.CreateTaskRequest;
import com.flamingo.ai.notebook.api.dto.request.UpdateTaskRequest;
import com.flamingo.ai.notebook.domain.entity.Task;
import java.util.List;
import java.util.UUID;

/** Service for managing notebook tasks. */
public interface TaskService {

  Task createTask(UUID notebookId, CreateTaskRequest request);

  Task getTask(UUID taskId);

  /** Tasks of a notebook in display order. */
  List<Task> listTasks(UUID notebookId);

  Task updateTask(UUID taskId, UpdateTaskRequest request);

  void deleteTask(UUID taskId);
}
