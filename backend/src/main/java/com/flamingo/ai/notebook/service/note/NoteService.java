package com.flamingo.ai.notebook.service.note;

import com.flamingo.ai.notebook.api.dto.request.CreateNoteRequest;
import com.flamingo.ai.notebook.api.dto.request.UpdateNoteRequest;
import com.flamingo.ai.notebook.domain.entity.Note;
import com.flamingo.ai.notebook.domain.enums.ContextMode;
import java.util.List;
import java.util.UUID;

/** Service for managing notebook notes. */
public interface NoteService {

  Note createNote(UUID notebookId, CreateNoteRequest request);

  Note getNote(UUID noteId);

  /** Notes of a notebook, newest first. */
  List<Note> listNotes(UUID notebookId);

  Note updateNote(UUID noteId, UpdateNoteRequest request);

  Note updateContextMode(UUID noteId, ContextMode mode);

  /**
   * Saves an assistant reply of a chat session as an AI note in the session's notebook. The title
   * is taken from the reply's first line.
   *
   * @throws com.flamingo.ai.notebook.exception.InvalidStateException if the message is not an
   *     assistant reply
   */
  Note createNoteFromMessage(UUID sessionId, UUID messageId);

  void deleteNote(UUID noteId);
}
