package com.flamingo.ai.notebook.service.note;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.notebook.api.dto.request.CreateNoteRequest;
import com.flamingo.ai.notebook.api.dto.request.UpdateNoteRequest;
import com.flamingo.ai.notebook.domain.entity.ChatMessage;
import com.flamingo.ai.notebook.domain.entity.ChatSession;
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
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class NoteServiceImplTest {

  @Mock private NoteRepository noteRepository;

  @Mock private NotebookRepository notebookRepository;

  @Mock private ChatSessionRepository chatSessionRepository;

  @Mock private ChatMessageRepository chatMessageRepository;

  private SimpleMeterRegistry meterRegistry;
  private NoteServiceImpl noteService;
  private Notebook notebook;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    noteService =
        new NoteServiceImpl(
            noteRepository,
            notebookRepository,
            chatSessionRepository,
            chatMessageRepository,
            meterRegistry);
    notebook = Notebook.builder().id(UUID.randomUUID()).name("Thesis").build();
    when(notebookRepository.findById(notebook.getId())).thenReturn(Optional.of(notebook));
    when(noteRepository.save(any(Note.class))).thenAnswer(i -> i.getArgument(0));
  }

  @Test
  void shouldDefaultToHumanNote_whenTypeNotProvided() {
    // When
    Note note =
        noteService.createNote(
            notebook.getId(),
            CreateNoteRequest.builder().title("Idea").content("Compare both trials").build());

    // Then
    assertThat(note.getNoteType()).isEqualTo(NoteType.HUMAN);
    assertThat(note.getNotebook()).isSameAs(notebook);
    assertThat(meterRegistry.counter("note.created", "type", "HUMAN").count()).isEqualTo(1.0);
  }

  @Test
  void shouldThrowNotebookNotFound_whenCreatingInUnknownNotebook() {
    UUID unknown = UUID.randomUUID();
    when(notebookRepository.findById(unknown)).thenReturn(Optional.empty());

    assertThatThrownBy(
            () -> noteService.createNote(unknown, CreateNoteRequest.builder().content("x").build()))
        .isInstanceOf(NotebookNotFoundException.class);
    verify(noteRepository, never()).save(any());
  }

  @Test
  void shouldKeepTitle_whenOnlyContentUpdated() {
    UUID noteId = UUID.randomUUID();
    Note note = Note.builder().id(noteId).title("Idea").content("old").build();
    when(noteRepository.findById(noteId)).thenReturn(Optional.of(note));

    Note result =
        noteService.updateNote(noteId, UpdateNoteRequest.builder().content("new").build());

    assertThat(result.getTitle()).isEqualTo("Idea");
    assertThat(result.getContent()).isEqualTo("new");
  }

  @Test
  void shouldThrowNoteNotFound_whenDeletingUnknownNote() {
    UUID noteId = UUID.randomUUID();
    when(noteRepository.findById(noteId)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> noteService.deleteNote(noteId))
        .isInstanceOf(NoteNotFoundException.class);
  }

  @Test
  void shouldSetContextMode_whenNoteExists() {
    UUID noteId = UUID.randomUUID();
    Note note = Note.builder().id(noteId).title("Idea").content("text").build();
    when(noteRepository.findById(noteId)).thenReturn(Optional.of(note));

    Note result = noteService.updateContextMode(noteId, ContextMode.INSIGHTS);

    assertThat(result.getContextMode()).isEqualTo(ContextMode.INSIGHTS);
    verify(noteRepository).save(note);
  }

  @Test
  void shouldDefaultToFullContent_whenContextModeNeverSet() {
    assertThat(new Note().getContextMode()).isEqualTo(ContextMode.FULL_CONTENT);
  }

  @Test
  void shouldSaveAssistantReplyAsAiNote() {
    // Given
    ChatSession session = ChatSession.builder().id(UUID.randomUUID()).notebook(notebook).build();
    ChatMessage reply =
        ChatMessage.builder()
            .id(UUID.randomUUID())
            .session(session)
            .sender(MessageSender.ASSISTANT)
            .content("## Drip irrigation wins\n\nIt used a third less water in both trials.")
            .messageOrder(2)
            .build();
    when(chatSessionRepository.existsById(session.getId())).thenReturn(true);
    when(chatMessageRepository.findById(reply.getId())).thenReturn(Optional.of(reply));

    // When
    Note note = noteService.createNoteFromMessage(session.getId(), reply.getId());

    // Then
    assertThat(note.getNoteType()).isEqualTo(NoteType.AI);
    assertThat(note.getNotebook()).isSameAs(notebook);
    assertThat(note.getTitle()).isEqualTo("Drip irrigation wins");
    assertThat(note.getContent()).isEqualTo(reply.getContent());
    assertThat(meterRegistry.counter("note.created", "type", "AI").count()).isEqualTo(1.0);
  }

  @Test
  void shouldRejectUserMessage_whenSavingReplyAsNote() {
    ChatSession session = ChatSession.builder().id(UUID.randomUUID()).notebook(notebook).build();
    ChatMessage question =
        ChatMessage.builder()
            .id(UUID.randomUUID())
            .session(session)
            .sender(MessageSender.USER)
            .content("What saves water?")
            .messageOrder(1)
            .build();
    when(chatSessionRepository.existsById(session.getId())).thenReturn(true);
    when(chatMessageRepository.findById(question.getId())).thenReturn(Optional.of(question));

    assertThatThrownBy(() -> noteService.createNoteFromMessage(session.getId(), question.getId()))
        .isInstanceOf(InvalidStateException.class);
    verify(noteRepository, never()).save(any());
  }

  @Test
  void shouldThrowMessageNotFound_whenMessageBelongsToOtherSession() {
    ChatSession other = ChatSession.builder().id(UUID.randomUUID()).notebook(notebook).build();
    ChatMessage reply =
        ChatMessage.builder()
            .id(UUID.randomUUID())
            .session(other)
            .sender(MessageSender.ASSISTANT)
            .content("Answer")
            .build();
    UUID sessionId = UUID.randomUUID();
    when(chatSessionRepository.existsById(sessionId)).thenReturn(true);
    when(chatMessageRepository.findById(reply.getId())).thenReturn(Optional.of(reply));

    assertThatThrownBy(() -> noteService.createNoteFromMessage(sessionId, reply.getId()))
        .isInstanceOf(ChatMessageNotFoundException.class);
  }

  @Test
  void shouldThrowSessionNotFound_whenSavingReplyOfUnknownSession() {
    UUID sessionId = UUID.randomUUID();
    when(chatSessionRepository.existsById(sessionId)).thenReturn(false);

    assertThatThrownBy(() -> noteService.createNoteFromMessage(sessionId, UUID.randomUUID()))
        .isInstanceOf(SessionNotFoundException.class);
  }

  @Test
  void shouldCutTitleToFifteenWords() {
    String title =
        NoteServiceImpl.titleFrom(
            "- one two three four five six seven eight nine ten eleven twelve thirteen fourteen"
                + " fifteen sixteen seventeen");

    assertThat(title)
        .isEqualTo(
            "one two three four five six seven eight nine ten eleven twelve thirteen fourteen"
                + " fifteen");
    assertThat(NoteServiceImpl.titleFrom("   \n  ")).isNull();
  }
}
