package com.flamingo.ai.notebook.api.rest;

import com.flamingo.ai.notebook.api.dto.request.CreateNoteRequest;
import com.flamingo.ai.notebook.api.dto.request.UpdateContextModeRequest;
import com.flamingo.ai.notebook.api.dto.request.UpdateNoteRequest;
import com.flamingo.ai.notebook.api.dto.response.NoteResponse;
import com.flamingo.ai.notebook.service.note.NoteService;
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

/** REST controller for notes. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class NoteController {

  private final NoteService noteService;

  @PostMapping("/notebooks/{notebookId}/notes")
  public ResponseEntity<NoteResponse> createNote(
      @PathVariable UUID notebookId, @Valid @RequestBody CreateNoteRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(NoteResponse.fromEntity(noteService.createNote(notebookId, request)));
  }

  @GetMapping("/notebooks/{notebookId}/notes")
  public ResponseEntity<List<NoteResponse>> listNotes(@PathVariable UUID notebookId) {
    return ResponseEntity.ok(
        noteService.listNotes(notebookId).stream().map(NoteResponse::fromEntity).toList());
  }

  @GetMapping("/notes/{noteId}")
  public ResponseEntity<NoteResponse> getNote(@PathVariable UUID noteId) {
    return ResponseEntity.ok(NoteResponse.fromEntity(noteService.getNote(noteId)));
  }

  @PutMapping("/notes/{noteId}")
  public ResponseEntity<NoteResponse> updateNote(
      @PathVariable UUID noteId, @Valid @RequestBody UpdateNoteRequest request) {
    return ResponseEntity.ok(NoteResponse.fromEntity(noteService.updateNote(noteId, request)));
  }

  @PutMapping("/notes/{noteId}/context-mode")
  public ResponseEntity<NoteResponse> updateContextMode(
      @PathVariable UUID noteId, @Valid @RequestBody UpdateContextModeRequest request) {
    return ResponseEntity.ok(
        NoteResponse.fromEntity(noteService.updateContextMode(noteId, request.getMode())));
  }

  /** Saves an assistant reply as an AI note in the session's notebook. */
  @PostMapping("/chats/{sessionId}/messages/{messageId}/note")
  public ResponseEntity<NoteResponse> createNoteFromMessage(
      @PathVariable UUID sessionId, @PathVariable UUID messageId) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(NoteResponse.fromEntity(noteService.createNoteFromMessage(sessionId, messageId)));
  }

  @DeleteMapping("/notes/{noteId}")
  public ResponseEntity<Void> deleteNote(@PathVariable UUID noteId) {
    noteService.deleteNote(noteId);
    return ResponseEntity.noContent().build();
  }
}
