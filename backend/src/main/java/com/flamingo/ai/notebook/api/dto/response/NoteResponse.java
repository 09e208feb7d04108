package com.flamingo.ai.notebook.api.dto.response;

import com.flamingo.ai.notebook.domain.entity.Note;
import com.flamingo.ai.notebook.domain.enums.ContextMode;
import com.flamingo.ai.notebook.domain.enums.NoteType;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for note data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NoteResponse {

  private UUID id;
  private String title;
  private String content;
  private NoteType noteType;
  private ContextMode contextMode;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;

  /** Creates a NoteResponse from a Note entity. */
  public static NoteResponse fromEntity(Note note) {
    return NoteResponse.builder()
        .id(note.getId())
        .title(note.getTitle())
        .content(note.getContent())
        .noteType(note.getNoteType())
        .contextMode(note.getContextMode())
        .createdAt(note.getCreatedAt())
        .updatedAt(note.getUpdatedAt())
        .build();
  }
}
