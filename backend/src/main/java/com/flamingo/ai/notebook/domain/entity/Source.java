package com.flamingo.ai.notebook.domain.entity;

import com.flamingo.ai.notebook.domain.enums.ContextMode;
import com.flamingo.ai.notebook.domain.enums.SourceOriginType;
import com.flamingo.ai.notebook.domain.enums.SourceStatus;
import com.flamingo.ai.notebook.domain.model.ArtifactValue;
import com.flamingo.ai.notebook.domain.model.SourceOrigin;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A unit of ingested material belonging to a notebook. */
@Entity
@Table(name = "sources")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Source {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "notebook_id", nullable = false)
  private Notebook notebook;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private SourceOriginType originType;

  @Column(columnDefinition = "TEXT")
  private String originUrl;

  private String originFilePath;

  /** Pasted text or scraped markdown, depending on the origin type. */
  @Column(columnDefinition = "TEXT")
  private String originContent;

  private String title;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private SourceStatus status = SourceStatus.PENDING;

  /** Error detail of the last failed extraction; set whenever status is ERROR. */
  @Column(columnDefinition = "TEXT")
  private String errorDetail;

  /** Normalized text cached by the first successful extraction. */
  @Column(columnDefinition = "TEXT")
  private String fullText;

  /** Whether chat may use this item as context; null on rows stored before the column existed. */
  @Enumerated(EnumType.STRING)
  @Column(length = 20)
  @Builder.Default
  private ContextMode contextMode = ContextMode.FULL_CONTENT;

  @OneToMany(mappedBy = "source", cascade = CascadeType.ALL, orphanRemoval = true)
  @OrderBy("name ASC")
  @Builder.Default
  private List<SourceArtifact> artifacts = new ArrayList<>();

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime updatedAt;

  private LocalDateTime processedAt;

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

  public ContextMode getContextMode() {
    return contextMode != null ? contextMode : ContextMode.FULL_CONTENT;
  }

  /** Rebuilds the typed origin from its persisted columns. */
  public SourceOrigin getOrigin() {
    return switch (originType) {
      case URL -> new SourceOrigin.Url(originUrl);
      case FILE -> new SourceOrigin.File(originFilePath);
      case TEXT -> new SourceOrigin.Text(originContent);
      case SCRAPED_PAGE -> new SourceOrigin.ScrapedPage(originContent, originUrl);
    };
  }

  /** Stores the origin payload in the columns its type uses and clears the others. */
  public void setOrigin(SourceOrigin origin) {
    this.originType = origin.type();
    this.originUrl = null;
    this.originFilePath = null;
    this.originContent = null;
    if (origin instanceof SourceOrigin.Url url) {
      this.originUrl = url.url();
    } else if (origin instanceof SourceOrigin.File file) {
      this.originFilePath = file.path();
    } else if (origin instanceof SourceOrigin.Text text) {
      this.originContent = text.text();
    } else if (origin instanceof SourceOrigin.ScrapedPage page) {
      this.originContent = page.markdown();
      this.originUrl = page.sourceUrl();
    }
  }

  /** Whether extraction has completed at least once. */
  public boolean hasExtractedContent() {
    return fullText != null;
  }

  /** Marks the source as processing. */
  public void startProcessing() {
    this.status = SourceStatus.PROCESSING;
    this.errorDetail = null;
  }

  /** Caches the extracted text and marks the source as processed. */
  public void markProcessed(String extractedText) {
    this.fullText = extractedText;
    this.status = SourceStatus.PROCESSED;
    this.errorDetail = null;
    this.processedAt = LocalDateTime.now();
  }

  /** Marks the source as failed with a non-empty error detail. */
  public void markFailed(String detail) {
    this.status = SourceStatus.ERROR;
    this.errorDetail = detail == null || detail.isBlank() ? "Content extraction failed" : detail;
    this.processedAt = LocalDateTime.now();
  }

  /** Finds the artifact produced by the named transformation. */
  public Optional<SourceArtifact> findArtifact(String name) {
    return artifacts.stream().filter(a -> a.getName().equals(name)).findFirst();
  }

  /** Replaces the named artifact's value, or adds the artifact if absent. */
  public SourceArtifact upsertArtifact(String name, ArtifactValue value) {
    SourceArtifact artifact =
        findArtifact(name)
            .orElseGet(
                () -> {
                  SourceArtifact created = SourceArtifact.builder().source(this).name(name).build();
                  artifacts.add(created);
                  return created;
                });
    artifact.setValue(value);
    return artifact;
  }
}
