package com.flamingo.ai.notebook.service.task;

import com.flamingo.ai.notebook.api.dto.request.CreateTaskRequest;
import com.flamingo.ai.notebook.api.dto.request.UpdateTaskRequest;
import com.flamingo.ai.notebook.domain.entity.Notebook;
import com.flamingo.ai.notebook.domain.entity.Task;
import com.flamingo.ai.notebook.domain.enums.TaskStatus;
import com.flamingo.ai.notebook.domain.repository.NotebookRepository;
import com.flamingo.ai.notebook.domain.repository.TaskRepository;
import com.flamingo.ai.notebook.exception.NotebookNotFoundException;
import com.flamingo.ai.notebook.exception.TaskNotFoundException;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the TaskService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaskServiceImpl implements TaskService {

  private final TaskRepository taskRepository;
  private final NotebookRepository notebookRepository;

  @Override
  @Transactional
  public Task createTask(UUID notebookId, CreateTaskRequest request) {
    Notebook notebook =
        notebookRepository
            .findById(notebookId)
            .orElseThrow(() -> new NotebookNotFoundException(notebookId));
    Task saved =
        taskRepository.save(
            Task.builder()
                .notebook(notebook)
                .description(request.getDescription())
                .status(request.getStatus() != null ? request.getStatus() : TaskStatus.TODO)
                .dueDate(request.getDueDate())
                .displayOrder(request.getDisplayOrder())
                .build());
    log.info("Created task {} in notebook {}", saved.getId(), notebookId);
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public Task getTask(UUID taskId) {
    return taskRepository.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
  }

  @Override
  @Transactional(readOnly = true)
  public List<Task> listTasks(UUID notebookId) {
    if (!notebookRepository.existsById(notebookId)) {
      throw new NotebookNotFoundException(notebookId);
    }
    return taskRepository.findByNotebookIdOrdered(notebookId);
  }

  @Override
  @Transactional
  public Task updateTask(UUID taskId, UpdateTaskRequest request) {
    Task task = getTask(taskId);
    if (request.getDescription() != null) {
      task.setDescription(request.getDescription());
    }
    if (request.getStatus() != null) {
      task.setStatus(request.getStatus());
    }
    if (request.getDueDate() != null) {
      task.setDueDate(request.getDueDate());
    }
    if (request.getDisplayOrder() != null) {
      task.setDisplayOrder(request.getDisplayOrder());
    }
    return taskRepository.save(task);
  }

  @Override
  @Transactional
  public void deleteTask(UUID taskId) {
    taskRepository.delete(getTask(taskId));
    log.info("Deleted task: {}", taskId);
  }
}
