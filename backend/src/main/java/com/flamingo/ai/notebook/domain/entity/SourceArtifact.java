package com.flamingo.ai.notebook.domain.entity;

import com.flamingo.ai.notebook.domain.converter.ArtifactItemsConverter;
import com.flamingo.ai.notebook.domain.enums.ArtifactKind;
import com.flamingo.ai.notebook.domain.model.ArtifactValue;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Derived content produced by running a transformation against a source. */
@Entity
@Table(
    name = "source_artifacts",
    uniqueConstraints = @UniqueConstraint(columnNames = {"source_id", "name"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SourceArtifact {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "source_id", nullable = false)
  private Source source;

  /** Name of the transformation that produced this artifact. */
  @Column(nullable = false)
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private ArtifactKind kind;

  @Column(columnDefinition = "TEXT")
  private String textValue;

  @Convert(converter = ArtifactItemsConverter.class)
  @Column(columnDefinition = "TEXT")
  private List<String> items;

  private LocalDateTime createdAt;

  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    LocalDateTime now = LocalDateTime.now();
    createdAt = now;
    updatedAt = now;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  /** Returns the typed value. */
  public ArtifactValue getValue() {
    return switch (kind) {
      case TEXT -> new ArtifactValue.Text(textValue);
      case LIST -> new ArtifactValue.TextList(items);
    };
  }

  /** Replaces the stored value, switching shape if the kind changed. */
  public void setValue(ArtifactValue value) {
    this.kind = value.kind();
    if (value instanceof ArtifactValue.Text text) {
      this.textValue = text.text();
      this.items = null;
    } else if (value instanceof ArtifactValue.TextList list) {
      this.items = list.items();
      this.textValue = null;
    }
  }
}
