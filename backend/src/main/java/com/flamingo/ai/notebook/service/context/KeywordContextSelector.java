package com.flamingo.ai.notebook.service.context;

import com.flamingo.ai.notebook.config.NotebookProperties;
import com.flamingo.ai.notebook.domain.entity.Note;
import com.flamingo.ai.notebook.domain.entity.Source;
import com.flamingo.ai.notebook.domain.entity.SourceArtifact;
import com.flamingo.ai.notebook.domain.enums.ArtifactKind;
import com.flamingo.ai.notebook.domain.enums.ContextMode;
import com.flamingo.ai.notebook.domain.repository.NoteRepository;
import com.flamingo.ai.notebook.domain.repository.NotebookRepository;
import com.flamingo.ai.notebook.domain.repository.SourceRepository;
import com.flamingo.ai.notebook.exception.NotebookNotFoundException;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Ranks extracted sources and notes by how many query terms they contain, then by recency and id.
 * Each item contributes an excerpt around its first matching term; items are taken in rank order
 * until the item or character budget is used up.
 *
 * <p>Items in {@link ContextMode#EXCLUDED} are skipped. Items in {@link ContextMode#INSIGHTS} are
 * matched and excerpted on their short form: a source's artifacts, or the opening of a note.
 */
@Service
@Slf4j
public class KeywordContextSelector implements NotebookContextSelector {

  private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+");
  private static final int MIN_TERM_LENGTH = 3;
  private static final Set<String> STOP_WORDS =
      Set.of(
          "the", "and", "for", "are", "but", "not", "you", "all", "any", "can", "had", "her",
          "was", "one", "our", "out", "has", "have", "what", "when", "where", "which", "who",
          "why", "how", "this", "that", "with", "from", "they", "them", "their", "there", "about",
          "into", "than", "then", "does", "did", "its", "your", "would", "could", "should");

  private final SourceRepository sourceRepository;
  private final NoteRepository noteRepository;
  private final NotebookRepository notebookRepository;
  private final int excerptChars;

  public KeywordContextSelector(
      SourceRepository sourceRepository,
      NoteRepository noteRepository,
      NotebookRepository notebookRepository,
      NotebookProperties properties) {
    this.sourceRepository = sourceRepository;
    this.noteRepository = noteRepository;
    this.notebookRepository = notebookRepository;
    this.excerptChars = properties.getContext().getExcerptChars();
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "context.select", description = "Time to select notebook context")
  public ContextSet select(UUID notebookId, String query, ContextBudget budget) {
    if (!notebookRepository.existsById(notebookId)) {
      throw new NotebookNotFoundException(notebookId);
    }
    if (budget.maxItems() == 0 || budget.maxChars() == 0) {
      return ContextSet.empty();
    }

    List<String> terms = terms(query);
    List<Candidate> candidates = new ArrayList<>();
    for (Source source : sourceRepository.findExtractedByNotebookId(notebookId)) {
      String text = contextText(source);
      if (text == null || text.isBlank()) {
        continue;
      }
      candidates.add(
          candidate(
              ContextItemType.SOURCE,
              source.getId(),
              source.getTitle() != null ? source.getTitle() : "Untitled source",
              text,
              source.getCreatedAt(),
              terms));
    }
    for (Note note : noteRepository.findByNotebookIdOrderByCreatedAtDesc(notebookId)) {
      String text = contextText(note);
      if (text == null || text.isBlank()) {
        continue;
      }
      candidates.add(
          candidate(
              ContextItemType.NOTE,
              note.getId(),
              note.getTitle() != null ? note.getTitle() : "Untitled note",
              text,
              note.getCreatedAt(),
              terms));
    }
    if (candidates.isEmpty()) {
      return ContextSet.empty();
    }

    candidates.sort(
        Comparator.comparingDouble(Candidate::relevance)
            .reversed()
            .thenComparing(
                Candidate::createdAt,
                Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()))
            .thenComparing(Candidate::id));

    List<ContextItem> selected = new ArrayList<>();
    int remaining = budget.maxChars();
    for (Candidate candidate : candidates) {
      if (selected.size() >= budget.maxItems() || remaining <= 0) {
        break;
      }
      String excerpt = candidate.excerpt();
      if (excerpt.length() > remaining) {
        excerpt = excerpt.substring(0, remaining);
      }
      selected.add(
          new ContextItem(
              candidate.type(), candidate.id(), candidate.title(), excerpt, candidate.relevance()));
      remaining -= excerpt.length();
    }

    log.debug(
        "Selected {} of {} context items for notebook {} (~{} tokens)",
        selected.size(),
        candidates.size(),
        notebookId,
        (budget.maxChars() - remaining) / 4);
    return new ContextSet(selected);
  }

  static List<String> terms(String query) {
    Set<String> terms = new LinkedHashSet<>();
    if (query != null) {
      Matcher matcher = WORD.matcher(query.toLowerCase(Locale.ROOT));
      while (matcher.find()) {
        String word = matcher.group();
        if (word.length() >= MIN_TERM_LENGTH && !STOP_WORDS.contains(word)) {
          terms.add(word);
        }
      }
    }
    return List.copyOf(terms);
  }

  private static String contextText(Source source) {
    return switch (source.getContextMode()) {
      case EXCLUDED -> null;
      case INSIGHTS -> insights(source);
      case FULL_CONTENT -> source.getFullText();
    };
  }

  private String contextText(Note note) {
    String content = note.getContent();
    if (content == null) {
      return null;
    }
    return switch (note.getContextMode()) {
      case EXCLUDED -> null;
      case INSIGHTS -> content.length() > excerptChars / 4
          ? content.substring(0, excerptChars / 4)
          : content;
      case FULL_CONTENT -> content;
    };
  }

  /** One line per artifact, list items joined with semicolons. */
  private static String insights(Source source) {
    StringBuilder text = new StringBuilder();
    for (SourceArtifact artifact : source.getArtifacts()) {
      String value =
          artifact.getKind() == ArtifactKind.LIST
              ? String.join("; ", artifact.getItems() != null ? artifact.getItems() : List.of())
              : artifact.getTextValue();
      if (value == null || value.isBlank()) {
        continue;
      }
      if (text.length() > 0) {
        text.append('\n');
      }
      text.append(artifact.getName()).append(": ").append(value.strip());
    }
    return text.toString();
  }

  private Candidate candidate(
      ContextItemType type,
      UUID id,
      String title,
      String text,
      LocalDateTime createdAt,
      List<String> terms) {
    int matched = 0;
    int firstMatch = -1;
    for (String term : terms) {
      Matcher matcher =
          Pattern.compile(Pattern.quote(term), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
              .matcher(text);
      if (matcher.find()) {
        matched++;
        if (firstMatch < 0 || matcher.start() < firstMatch) {
          firstMatch = matcher.start();
        }
      }
    }
    double relevance = terms.isEmpty() ? 0.0 : (double) matched / terms.size();
    return new Candidate(
        type, id, title, excerpt(text, Math.max(firstMatch, 0)), createdAt, relevance);
  }

  private String excerpt(String text, int anchor) {
    if (text.length() <= excerptChars) {
      return text.strip();
    }
    int start = Math.max(0, anchor - excerptChars / 4);
    int end = Math.min(text.length(), start + excerptChars);
    start = Math.max(0, end - excerptChars);
    return text.substring(start, end).strip();
  }

  private record Candidate(
      ContextItemType type,
      UUID id,
      String title,
      String excerpt,
      LocalDateTime createdAt,
      double relevance) {}
}
