package com.flamingo.ai.notebook.api.dto.request;

import com.flamingo.ai.notebook.domain.enums.NoteType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for creating a note. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateNoteRequest {

  @Size(max = 255, message = "Title must be at most 255 characters")
  private String title;

  @NotBlank(message = "Content is required")
  private String content;

  private NoteType noteType;
}
