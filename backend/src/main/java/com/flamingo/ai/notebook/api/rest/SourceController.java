package com.flamingo.ai.notebook.api.rest;

import com.flamingo.ai.notebook.api.dto.request.CreateSourceRequest;
import com.flamingo.ai.notebook.api.dto.request.RunTransformationRequest;
import com.flamingo.ai.notebook.api.dto.request.UpdateContextModeRequest;
import com.flamingo.ai.notebook.api.dto.request.UpdateSourceRequest;
import com.flamingo.ai.notebook.api.dto.response.SourceArtifactResponse;
import com.flamingo.ai.notebook.api.dto.response.SourceResponse;
import com.flamingo.ai.notebook.api.dto.response.TransformationResponse;
import com.flamingo.ai.notebook.domain.entity.Source;
import com.flamingo.ai.notebook.domain.entity.SourceArtifact;
import com.flamingo.ai.notebook.service.source.SourceRegistry;
import com.flamingo.ai.notebook.service.transformation.TransformationExecutor;
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

/** REST controller for sources and their transformations. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SourceController {

  private final SourceRegistry sourceRegistry;
  private final TransformationExecutor transformationExecutor;

  /** Registers a source; extraction starts in the background. */
  @PostMapping("/notebooks/{notebookId}/sources")
  public ResponseEntity<SourceResponse> registerSource(
      @PathVariable UUID notebookId, @Valid @RequestBody CreateSourceRequest request) {
    Source source =
        request.getApplyTransformations() == null
            ? sourceRegistry.register(notebookId, request.toOrigin(), request.getTitle())
            : sourceRegistry.register(
                notebookId,
                request.toOrigin(),
                request.getTitle(),
                request.getApplyTransformations());
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(SourceResponse.fromEntity(source));
  }

  /** Lists the sources of a notebook, newest first. */
  @GetMapping("/notebooks/{notebookId}/sources")
  public ResponseEntity<List<SourceResponse>> listSources(@PathVariable UUID notebookId) {
    return ResponseEntity.ok(
        sourceRegistry.list(notebookId).stream().map(SourceResponse::fromEntity).toList());
  }

  /** Gets a source, including its status and artifacts. */
  @GetMapping("/sources/{sourceId}")
  public ResponseEntity<SourceResponse> getSource(@PathVariable UUID sourceId) {
    return ResponseEntity.ok(SourceResponse.fromEntity(sourceRegistry.get(sourceId)));
  }

  /** Renames a source. */
  @PutMapping("/sources/{sourceId}")
  public ResponseEntity<SourceResponse> updateSource(
      @PathVariable UUID sourceId, @Valid @RequestBody UpdateSourceRequest request) {
    return ResponseEntity.ok(
        SourceResponse.fromEntity(sourceRegistry.updateTitle(sourceId, request.getTitle())));
  }

  /** Chooses whether chat uses the source's full text, its artifacts only, or nothing. */
  @PutMapping("/sources/{sourceId}/context-mode")
  public ResponseEntity<SourceResponse> updateContextMode(
      @PathVariable UUID sourceId, @Valid @RequestBody UpdateContextModeRequest request) {
    return ResponseEntity.ok(
        SourceResponse.fromEntity(
            sourceRegistry.updateContextMode(sourceId, request.getMode())));
  }

  /** Deletes a source, cancelling work still running on it. */
  @DeleteMapping("/sources/{sourceId}")
  public ResponseEntity<Void> deleteSource(@PathVariable UUID sourceId) {
    sourceRegistry.delete(sourceId);
    return ResponseEntity.noContent().build();
  }

  /** Re-runs ingestion of a source whose extraction failed. */
  @PostMapping("/sources/{sourceId}/retry")
  public ResponseEntity<SourceResponse> retrySource(@PathVariable UUID sourceId) {
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(SourceResponse.fromEntity(sourceRegistry.retry(sourceId)));
  }

  /** Runs a transformation on a source and returns the stored artifact. */
  @PostMapping("/sources/{sourceId}/transformations")
  public ResponseEntity<SourceArtifactResponse> runTransformation(
      @PathVariable UUID sourceId, @Valid @RequestBody RunTransformationRequest request) {
    SourceArtifact artifact =
        transformationExecutor.run(sourceId, request.getName(), request.getParams());
    return ResponseEntity.ok(SourceArtifactResponse.fromEntity(artifact));
  }

  /** Lists the artifacts of a source. */
  @GetMapping("/sources/{sourceId}/artifacts")
  public ResponseEntity<List<SourceArtifactResponse>> listArtifacts(@PathVariable UUID sourceId) {
    return ResponseEntity.ok(
        sourceRegistry.listArtifacts(sourceId).stream()
            .map(SourceArtifactResponse::fromEntity)
            .toList());
  }

  /** Lists the available transformations. */
  @GetMapping("/transformations")
  public ResponseEntity<List<TransformationResponse>> listTransformations() {
    return ResponseEntity.ok(
        transformationExecutor.listTransformations().stream()
            .map(TransformationResponse::from)
            .toList());
  }
}
