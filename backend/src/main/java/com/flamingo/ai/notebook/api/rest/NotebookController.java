package com.flamingo.ai.notebook.api.rest;

import com.flamingo.ai.notebook.api.dto.request.CreateNotebookRequest;
import com.flamingo.ai.notebook.api.dto.request.UpdateNotebookRequest;
import com.flamingo.ai.notebook.api.dto.response.ContextPreviewResponse;
import com.flamingo.ai.notebook.api.dto.response.NotebookResponse;
import com.flamingo.ai.notebook.config.NotebookProperties;
import com.flamingo.ai.notebook.domain.entity.Notebook;
import com.flamingo.ai.notebook.service.context.ContextBudget;
import com.flamingo.ai.notebook.service.context.ContextSet;
import com.flamingo.ai.notebook.service.context.NotebookContextSelector;
import com.flamingo.ai.notebook.service.notebook.NotebookService;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for notebook management. */
@RestController
@RequestMapping("/api/notebooks")
@RequiredArgsConstructor
public class NotebookController {

  private final NotebookService notebookService;
  private final NotebookContextSelector contextSelector;
  private final NotebookProperties properties;

  /** Creates a new notebook. */
  @PostMapping
  public ResponseEntity<NotebookResponse> createNotebook(
      @Valid @RequestBody CreateNotebookRequest request) {
    Notebook notebook = notebookService.createNotebook(request);
    return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(notebook));
  }

  /** Lists notebooks, optionally filtered by the archived flag. */
  @GetMapping
  public ResponseEntity<List<NotebookResponse>> listNotebooks(
      @RequestParam(required = false) Boolean archived) {
    return ResponseEntity.ok(
        notebookService.listNotebooks(archived).stream().map(this::toResponse).toList());
  }

  /** Gets a notebook by ID. */
  @GetMapping("/{notebookId}")
  public ResponseEntity<NotebookResponse> getNotebook(@PathVariable UUID notebookId) {
    return ResponseEntity.ok(toResponse(notebookService.getNotebook(notebookId)));
  }

  /** Updates a notebook. */
  @PutMapping("/{notebookId}")
  public ResponseEntity<NotebookResponse> updateNotebook(
      @PathVariable UUID notebookId, @Valid @RequestBody UpdateNotebookRequest request) {
    return ResponseEntity.ok(toResponse(notebookService.updateNotebook(notebookId, request)));
  }

  /** Deletes a notebook with all of its content. */
  @DeleteMapping("/{notebookId}")
  public ResponseEntity<Void> deleteNotebook(@PathVariable UUID notebookId) {
    notebookService.deleteNotebook(notebookId);
    return ResponseEntity.noContent().build();
  }

  /** Shows the context a chat message with this query would be grounded in. */
  @GetMapping("/{notebookId}/context")
  public ResponseEntity<ContextPreviewResponse> previewContext(
      @PathVariable UUID notebookId,
      @RequestParam String query,
      @RequestParam(required = false) Integer maxItems,
      @RequestParam(required = false) Integer maxChars) {
    NotebookProperties.Context defaults = properties.getContext();
    ContextBudget budget =
        new ContextBudget(
            maxItems != null ? maxItems : defaults.getMaxItems(),
            maxChars != null ? maxChars : defaults.getMaxChars());
    ContextSet context = contextSelector.select(notebookId, query, budget);
    return ResponseEntity.ok(ContextPreviewResponse.from(query, context));
  }

  private NotebookResponse toResponse(Notebook notebook) {
    return NotebookResponse.fromEntity(notebook, notebookService.getStats(notebook.getId()));
  }
}
