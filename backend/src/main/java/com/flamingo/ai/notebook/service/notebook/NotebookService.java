package com.flamingo.ai.notebook.service.notebook;

import com.flamingo.ai.notebook.api.dto.request.CreateNotebookRequest;
import com.flamingo.ai.notebook.api.dto.request.UpdateNotebookRequest;
import com.flamingo.ai.notebook.domain.entity.Notebook;
import java.util.List;
import java.util.UUID;

/** Service for managing notebooks. */
public interface NotebookService {

  Notebook createNotebook(CreateNotebookRequest request);

  Notebook getNotebook(UUID notebookId);

  /**
   * Lists notebooks, most recently updated first.
   *
   * @param archived filter by archived flag, or {@code null} for all notebooks
   */
  List<Notebook> listNotebooks(Boolean archived);

  Notebook updateNotebook(UUID notebookId, UpdateNotebookRequest request);

  /** Deletes the notebook and everything it owns, cancelling work still running on it. */
  void deleteNotebook(UUID notebookId);

  NotebookStats getStats(UUID notebookId);
}
