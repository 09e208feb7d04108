package com.flamingo.ai.notebook.service.notebook;

import com.flamingo.ai.notebook.api.dto.request.CreateNotebookRequest;
import com.flamingo.ai.notebook.api.dto.request.UpdateNotebookRequest;
import com.flamingo.ai.notebook.domain.entity.ChatSession;
import com.flamingo.ai.notebook.domain.entity.Notebook;
import com.flamingo.ai.notebook.domain.entity.Source;
import com.flamingo.ai.notebook.domain.enums.TaskStatus;
import com.flamingo.ai.notebook.domain.repository.ChatSessionRepository;
import com.flamingo.ai.notebook.domain.repository.NoteRepository;
import com.flamingo.ai.notebook.domain.repository.NotebookRepository;
import com.flamingo.ai.notebook.domain.repository.SourceRepository;
import com.flamingo.ai.notebook.domain.repository.TaskRepository;
import com.flamingo.ai.notebook.exception.NotebookNotFoundException;
import com.flamingo.ai.notebook.support.InFlightWork;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the NotebookService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotebookServiceImpl implements NotebookService {

  private final NotebookRepository notebookRepository;
  private final SourceRepository sourceRepository;
  private final NoteRepository noteRepository;
  private final ChatSessionRepository chatSessionRepository;
  private final TaskRepository taskRepository;
  private final InFlightWork inFlightWork;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  @Timed(value = "notebook.create", description = "Time to create a notebook")
  public Notebook createNotebook(CreateNotebookRequest request) {
    Notebook saved =
        notebookRepository.save(
            Notebook.builder()
                .name(request.getName().strip())
                .description(request.getDescription())
                .build());
    meterRegistry.counter("notebook.created").increment();
    log.info("Created notebook '{}' with ID: {}", saved.getName(), saved.getId());
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public Notebook getNotebook(UUID notebookId) {
    return notebookRepository
        .findById(notebookId)
        .orElseThrow(() -> new NotebookNotFoundException(notebookId));
  }

  @Override
  @Transactional(readOnly = true)
  public List<Notebook> listNotebooks(Boolean archived) {
    return archived == null
        ? notebookRepository.findAllByOrderByUpdatedAtDesc()
        : notebookRepository.findByArchivedOrderByUpdatedAtDesc(archived);
  }

  @Override
  @Transactional
  @Timed(value = "notebook.update", description = "Time to update a notebook")
  public Notebook updateNotebook(UUID notebookId, UpdateNotebookRequest request) {
    Notebook notebook = getNotebook(notebookId);
    if (request.getName() != null) {
      notebook.setName(request.getName().strip());
    }
    if (request.getDescription() != null) {
      notebook.setDescription(request.getDescription());
    }
    if (request.getArchived() != null) {
      notebook.setArchived(request.getArchived());
    }
    return notebookRepository.save(notebook);
  }

  @Override
  @Transactional
  @Timed(value = "notebook.delete", description = "Time to delete a notebook")
  public void deleteNotebook(UUID notebookId) {
    Notebook notebook = getNotebook(notebookId);

    for (Source source : sourceRepository.findByNotebookIdOrderByCreatedAtDesc(notebookId)) {
      inFlightWork.cancelAll(source.getId());
    }
    for (ChatSession session :
        chatSessionRepository.findByNotebookIdOrderByUpdatedAtDesc(notebookId)) {
      inFlightWork.cancelAll(session.getId());
    }

    notebookRepository.delete(notebook);
    meterRegistry.counter("notebook.deleted").increment();
    log.info("Deleted notebook: {}", notebookId);
  }

  @Override
  @Transactional(readOnly = true)
  public NotebookStats getStats(UUID notebookId) {
    return new NotebookStats(
        sourceRepository.countByNotebookId(notebookId),
        noteRepository.countByNotebookId(notebookId),
        chatSessionRepository.countByNotebookId(notebookId),
        taskRepository.countByNotebookIdAndStatus(notebookId, TaskStatus.TODO)
            + taskRepository.countByNotebookIdAndStatus(notebookId, TaskStatus.IN_PROGRESS));
  }
}
