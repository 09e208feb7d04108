package com.flamingo.ai.notebook.service.note;

import com.flamingo.ai.notebook.api.dto.request.CreateNoteRequest;
import com.flamingo.ai.notebook.api.dto.request.UpdateNoteRequest;
import com.flamingo.ai.notebook.domain.entity.ChatMessage;
import com.flamingo.ai.notebook.domain.entity.Note;
import com.flamingo.ai.notebook.domain.entity.Notebook;
import com.flamingo.ai.notebook.domain.enums.ContextMode;
import com.flamingo.ai.notebook.domain.enums.MessageSender;
import com.flamingo.ai.notebook.domain.enums.NoteType;
import com.flamingo.ai.notebook.domain.repository.ChatMessageRepository;
import com.flamingo.ai.notebook.domain.repository.ChatSessionRepository;
import com.flamingo.ai.notebook.domain.repository.NoteRepository;
import com.flamingo.ai.notebook.domain.repository.NotebookRepository;
import com.flamingo.ai.notebook.exception.ChatMessageNotFoundException;
import com.flamingo.ai.notebook.exception.InvalidStateException;
import com.flamingo.ai.notebook.exception.NoteNotFoundException;
import com.flamingo.ai.notebook.exception.NotebookNotFoundException;
import com.flamingo.ai.notebook.exception.SessionNotFoundException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the NoteService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class NoteServiceImpl implements NoteService {

  private static final int MAX_TITLE_WORDS = 15;
  private static final int MAX_TITLE_CHARS = 255;

  private final NoteRepository noteRepository;
  private final NotebookRepository notebookRepository;
  private final ChatSessionRepository chatSessionRepository;
  private final ChatMessageRepository chatMessageRepository;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  public Note createNote(UUID notebookId, CreateNoteRequest request) {
    Notebook notebook =
        notebookRepository
            .findById(notebookId)
            .orElseThrow(() -> new NotebookNotFoundException(notebookId));
    Note saved =
        noteRepository.save(
            Note.builder()
                .notebook(notebook)
                .title(request.getTitle())
                .content(request.getContent())
                .noteType(request.getNoteType() != null ? request.getNoteType() : NoteType.HUMAN)
                .build());
    meterRegistry.counter("note.created", "type", saved.getNoteType().name()).increment();
    log.info("Created note {} in notebook {}", saved.getId(), notebookId);
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public Note getNote(UUID noteId) {
    return noteRepository.findById(noteId).orElseThrow(() -> new NoteNotFoundException(noteId));
  }

  @Override
  @Transactional(readOnly = true)
  public List<Note> listNotes(UUID notebookId) {
    if (!notebookRepository.existsById(notebookId)) {
      throw new NotebookNotFoundException(notebookId);
    }
    return noteRepository.findByNotebookIdOrderByCreatedAtDesc(notebookId);
  }

  @Override
  @Transactional
  public Note updateNote(UUID noteId, UpdateNoteRequest request) {
    Note note = getNote(noteId);
    if (request.getTitle() != null) {
      note.setTitle(request.getTitle());
    }
    if (request.getContent() != null) {
      note.setContent(request.getContent());
    }
    return noteRepository.save(note);
  }

  @Override
  @Transactional
  public Note updateContextMode(UUID noteId, ContextMode mode) {
    if (mode == null) {
      throw new IllegalArgumentException("Context mode must not be null");
    }
    Note note = getNote(noteId);
    note.setContextMode(mode);
    log.info("Note {} context mode set to {}", noteId, mode);
    return noteRepository.save(note);
  }

  @Override
  @Transactional
  public Note createNoteFromMessage(UUID sessionId, UUID messageId) {
    if (!chatSessionRepository.existsById(sessionId)) {
      throw new SessionNotFoundException(sessionId);
    }
    ChatMessage message =
        chatMessageRepository
            .findById(messageId)
            .filter(m -> m.getSession().getId().equals(sessionId))
            .orElseThrow(() -> new ChatMessageNotFoundException(messageId));
    if (message.getSender() != MessageSender.ASSISTANT) {
      throw new InvalidStateException("Only assistant replies can be saved as notes");
    }

    Note saved =
        noteRepository.save(
            Note.builder()
                .notebook(message.getSession().getNotebook())
                .title(titleFrom(message.getContent()))
                .content(message.getContent())
                .noteType(NoteType.AI)
                .build());
    meterRegistry.counter("note.created", "type", NoteType.AI.name()).increment();
    log.info("Saved reply {} of session {} as note {}", messageId, sessionId, saved.getId());
    return saved;
  }

  @Override
  @Transactional
  public void deleteNote(UUID noteId) {
    noteRepository.delete(getNote(noteId));
    log.info("Deleted note: {}", noteId);
  }

  /** First non-blank line without markdown markers, cut to a short title. */
  static String titleFrom(String content) {
    String firstLine =
        content
            .lines()
            .map(line -> line.replaceFirst("^[\\s#>*\\-]+", "").strip())
            .filter(line -> !line.isEmpty())
            .findFirst()
            .orElse("");
    if (firstLine.isEmpty()) {
      return null;
    }
    String[] words = firstLine.split("\\s+");
    String title =
        words.length > MAX_TITLE_WORDS
            ? String.join(" ", Arrays.copyOf(words, MAX_TITLE_WORDS))
            : firstLine;
    return title.length() > MAX_TITLE_CHARS ? title.substring(0, MAX_TITLE_CHARS) : title;
  }
}
