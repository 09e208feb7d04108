package com.flamingo.ai.notebook.service.transformation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.flamingo.ai.notebook.config.NotebookProperties;
import com.flamingo.ai.notebook.domain.entity.Notebook;
import com.flamingo.ai.notebook.domain.entity.Source;
import com.flamingo.ai.notebook.domain.entity.SourceArtifact;
import com.flamingo.ai.notebook.domain.enums.ArtifactKind;
import com.flamingo.ai.notebook.domain.enums.SourceStatus;
import com.flamingo.ai.notebook.domain.model.SourceOrigin;
import com.flamingo.ai.notebook.exception.ExtractionFailedException;
import com.flamingo.ai.notebook.exception.GenerationFailedException;
import com.flamingo.ai.notebook.exception.SourceNotFoundException;
import com.flamingo.ai.notebook.exception.UnknownTransformationException;
import com.flamingo.ai.notebook.fixtures.InMemorySourceStore;
import com.flamingo.ai.notebook.integration.assistant.AssistantAdapter;
import com.flamingo.ai.notebook.integration.extraction.ContentExtractor;
import com.flamingo.ai.notebook.integration.extraction.ExtractedContent;
import com.flamingo.ai.notebook.service.source.SourceIngestionService;
import com.flamingo.ai.notebook.service.source.SourceRegistryImpl;
import com.flamingo.ai.notebook.support.AdapterInvoker;
import com.flamingo.ai.notebook.support.InFlightWork;
import com.flamingo.ai.notebook.support.SourceLocks;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs registration, extraction, transformation and deletion together against an in-memory store,
 * with scripted extractor and assistant behaviour.
 */
class SourcePipelineScenarioTest {

  private static final List<String> DEFAULTS = List.of("simple_summary", "key_insights");

  private final AtomicReference<ContentExtractor> extractorBehaviour = new AtomicReference<>();
  private final AtomicReference<AssistantAdapter> assistantBehaviour = new AtomicReference<>();
  private final AtomicInteger extractionCalls = new AtomicInteger();

  private InMemorySourceStore store;
  private InFlightWork inFlightWork;
  private SourceIngestionService ingestionScheduler;
  private SourceRegistryImpl registry;
  private SourceContentResolver resolver;
  private TransformationExecutorImpl executor;
  private SourceIngestionService ingestion;
  private ThreadPoolTaskExecutor adapterPool;
  private ThreadPoolTaskExecutor transformationPool;
  private ThreadPoolTaskExecutor extractionPool;
  private Notebook notebook;

  @BeforeEach
  void setUp() {
    NotebookProperties properties = new NotebookProperties();
    properties.getExtraction().setTimeout(Duration.ofSeconds(2));
    properties.getExtraction().setInitialBackoff(Duration.ofMillis(5));
    properties.getGeneration().setTimeout(Duration.ofSeconds(2));
    properties.getGeneration().setInitialBackoff(Duration.ofMillis(5));
    properties.getIngestion().setDefaultTransformations(DEFAULTS);

    adapterPool = pool("adapter-");
    transformationPool = pool("transform-");
    extractionPool = pool("extract-");

    store = new InMemorySourceStore();
    notebook = store.addNotebook("Soil research");
    inFlightWork = new InFlightWork();
    ingestionScheduler = mock(SourceIngestionService.class);
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    registry =
        new SourceRegistryImpl(
            store.sourceRepository(),
            store.artifactRepository(),
            store.notebookRepository(),
            new SourceLocks(),
            inFlightWork,
            new TransactionTemplate(mock(PlatformTransactionManager.class)),
            meterRegistry,
            properties,
            ingestionScheduler);

    AdapterInvoker invoker = new AdapterInvoker(adapterPool, inFlightWork);
    ContentExtractor extractor =
        origin -> {
          extractionCalls.incrementAndGet();
          return extractorBehaviour.get().extract(origin);
        };
    AssistantAdapter assistant = context -> assistantBehaviour.get().generate(context);

    resolver =
        new SourceContentResolver(
            registry, extractor, invoker, inFlightWork, extractionPool, properties);
    executor =
        new TransformationExecutorImpl(
            registry,
            resolver,
            new TransformationCatalog(properties),
            assistant,
            invoker,
            inFlightWork,
            transformationPool,
            meterRegistry,
            properties);
    ingestion = new SourceIngestionService(resolver, executor);

    extractorBehaviour.set(origin -> ExtractedContent.of("Soil moisture drives crop yield."));
    assistantBehaviour.set(
        context ->
            context.systemPrompt().contains("insights")
                ? "- Moisture matters\n- Yield follows water"
                : "Water drives yield.");
  }

  @AfterEach
  void tearDown() {
    adapterPool.shutdown();
    transformationPool.shutdown();
    extractionPool.shutdown();
  }

  @Test
  void shouldMoveFromPendingToProcessed_whenIngestingPastedText() {
    // Given
    Source source = registry.register(notebook.getId(), new SourceOrigin.Text("Soil notes"), null);
    assertThat(source.getStatus()).isEqualTo(SourceStatus.PENDING);
    verify(ingestionScheduler).ingestAsync(source.getId(), DEFAULTS);

    // When
    ingestion.ingest(source.getId(), DEFAULTS);

    // Then
    Source processed = registry.get(source.getId());
    assertThat(processed.getStatus()).isEqualTo(SourceStatus.PROCESSED);
    assertThat(processed.getFullText()).isEqualTo("Soil moisture drives crop yield.");
    assertThat(store.statusHistory(source.getId()))
        .containsSubsequence(SourceStatus.PENDING, SourceStatus.PROCESSING, SourceStatus.PROCESSED)
        .doesNotContain(SourceStatus.ERROR);
    assertThat(registry.listArtifacts(source.getId()))
        .extracting(SourceArtifact::getName)
        .containsExactly("key_insights", "simple_summary");
    SourceArtifact insights = processed.findArtifact("key_insights").orElseThrow();
    assertThat(insights.getKind()).isEqualTo(ArtifactKind.LIST);
    assertThat(insights.getItems()).containsExactly("Moisture matters", "Yield follows water");
  }

  @Test
  void shouldUseDetectedTitle_whenRegisteredWithoutTitle() {
    extractorBehaviour.set(origin -> new ExtractedContent("Body text", "Detected Title"));
    Source source =
        registry.register(notebook.getId(), new SourceOrigin.File("/data/paper.pdf"), " ");

    resolver.resolve(source.getId());

    assertThat(registry.get(source.getId()).getTitle()).isEqualTo("Detected Title");
  }

  @Test
  void shouldReplaceArtifact_whenSameTransformationRunsAgain() {
    // Given
    Source source = registry.register(notebook.getId(), new SourceOrigin.Text("notes"), null);
    SourceArtifact first = executor.run(source.getId(), "simple_summary", Map.of());
    assistantBehaviour.set(context -> "A newer summary.");

    // When
    SourceArtifact second = executor.run(source.getId(), "simple_summary", Map.of());

    // Then
    assertThat(second.getId()).isEqualTo(first.getId());
    assertThat(second.getTextValue()).isEqualTo("A newer summary.");
    assertThat(registry.get(source.getId()).getArtifacts()).hasSize(1);
    assertThat(extractionCalls.get()).isEqualTo(1);
  }

  @Test
  void shouldReplaceValueInPlace_whenTransformationRerunsWithOtherParams() {
    // Given
    extractorBehaviour.set(origin -> ExtractedContent.of("Hello world."));
    List<String> prompts = new CopyOnWriteArrayList<>();
    assistantBehaviour.set(
        context -> {
          prompts.add(context.systemPrompt());
          return context.systemPrompt().contains("one sentence")
              ? "A greeting."
              : "The text greets the whole world in a friendly way.";
        });
    Source source =
        registry.register(notebook.getId(), new SourceOrigin.Text("Hello world."), null);
    SourceArtifact first =
        executor.run(source.getId(), "summarize_text", Map.of("length", "two paragraphs"));
    UUID firstId = first.getId();
    String firstValue = first.getTextValue();

    // When
    SourceArtifact second =
        executor.run(source.getId(), "summarize_text", Map.of("length", "one sentence"));

    // Then
    assertThat(firstValue).isEqualTo("The text greets the whole world in a friendly way.");
    assertThat(second.getId()).isEqualTo(firstId);
    assertThat(second.getTextValue()).isEqualTo("A greeting.");
    assertThat(registry.listArtifacts(source.getId()))
        .singleElement()
        .satisfies(
            artifact -> {
              assertThat(artifact.getName()).isEqualTo("summarize_text");
              assertThat(artifact.getTextValue()).isEqualTo("A greeting.");
            });
    assertThat(prompts).hasSize(2);
    assertThat(prompts.get(0)).contains("in two paragraphs").doesNotContain("one sentence");
    assertThat(prompts.get(1)).contains("in one sentence").doesNotContain("two paragraphs");
    assertThat(extractionCalls.get()).isEqualTo(1);
  }

  @Test
  void shouldFinishSharedExtraction_whenCallerThatStartedItIsCancelled() throws Exception {
    // Given
    CountDownLatch extracting = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    extractorBehaviour.set(
        origin -> {
          extracting.countDown();
          awaitQuietly(release);
          return ExtractedContent.of("Hello world.");
        });
    Source source =
        registry.register(notebook.getId(), new SourceOrigin.Text("Hello world."), null);
    UUID sourceId = source.getId();
    CompletableFuture<SourceArtifact> starter =
        executor.runAsync(sourceId, "simple_summary", Map.of());
    assertThat(extracting.await(5, TimeUnit.SECONDS)).isTrue();
    CompletableFuture<SourceArtifact> joiner =
        executor.runAsync(sourceId, "summarize_text", Map.of());
    pause(100);

    // When
    starter.cancel(true);
    release.countDown();

    // Then
    assertThat(joiner.get(5, TimeUnit.SECONDS).getName()).isEqualTo("summarize_text");
    assertThat(starter).isCancelled();
    Source processed = registry.get(sourceId);
    assertThat(processed.getStatus()).isEqualTo(SourceStatus.PROCESSED);
    assertThat(processed.getErrorDetail()).isNull();
    assertThat(processed.getFullText()).isEqualTo("Hello world.");
    assertThat(store.statusHistory(sourceId)).doesNotContain(SourceStatus.ERROR);
    assertThat(extractionCalls.get()).isEqualTo(1);
  }

  @Test
  void shouldCancelSharedExtraction_whenSourceIsDeleted() throws Exception {
    // Given
    CountDownLatch extracting = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    extractorBehaviour.set(
        origin -> {
          extracting.countDown();
          awaitQuietly(release);
          return ExtractedContent.of("never stored");
        });
    Source source =
        registry.register(notebook.getId(), new SourceOrigin.Url("https://example.com"), null);
    UUID sourceId = source.getId();
    CompletableFuture<SourceArtifact> pending =
        executor.runAsync(sourceId, "simple_summary", Map.of());
    assertThat(extracting.await(5, TimeUnit.SECONDS)).isTrue();

    // When
    registry.delete(sourceId);
    release.countDown();

    // Then
    assertThatThrownBy(() -> pending.get(5, TimeUnit.SECONDS)).isInstanceOf(Exception.class);
    assertThat(store.contains(sourceId)).isFalse();
    assertThat(inFlightWork.count(sourceId)).isZero();
  }

  @Test
  void shouldBoundExtraction_whenTransformationCallerPassesTimeout() {
    // Given
    extractorBehaviour.set(
        origin -> {
          pause(3_000);
          return ExtractedContent.of("too late");
        });
    Source source =
        registry.register(notebook.getId(), new SourceOrigin.Url("https://slow.example"), null);
    long started = System.nanoTime();

    // When / Then
    assertThatThrownBy(
            () -> executor.run(source.getId(), "simple_summary", Map.of(), Duration.ofMillis(50)))
        .isInstanceOf(ExtractionFailedException.class)
        .satisfies(e -> assertThat(((ExtractionFailedException) e).isTransient()).isTrue());
    assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(1));
    Source failed = registry.get(source.getId());
    assertThat(failed.getStatus()).isEqualTo(SourceStatus.ERROR);
    assertThat(failed.getErrorDetail()).contains("timed out");
    assertThat(failed.getArtifacts()).isEmpty();
  }

  @Test
  void shouldKeepEveryArtifact_whenDifferentTransformationsRunConcurrently() throws Exception {
    // Given
    Source source = registry.register(notebook.getId(), new SourceOrigin.Text("notes"), null);
    extractorBehaviour.set(
        origin -> {
          pause(100);
          return ExtractedContent.of("Shared content");
        });
    assistantBehaviour.set(
        context -> {
          pause(30);
          return "- output";
        });
    List<String> names =
        List.of("simple_summary", "key_insights", "extract_entities", "generate_questions");

    // When
    List<CompletableFuture<SourceArtifact>> futures = new ArrayList<>();
    for (String name : names) {
      futures.add(executor.runAsync(source.getId(), name, Map.of()));
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

    // Then
    assertThat(registry.get(source.getId()).getArtifacts())
        .extracting(SourceArtifact::getName)
        .containsExactlyInAnyOrderElementsOf(names);
    assertThat(extractionCalls.get()).isEqualTo(1);
  }

  @Test
  void shouldMarkSourceFailed_whenExtractionFailsPermanently() {
    // Given
    extractorBehaviour.set(
        origin -> {
          throw ExtractionFailedException.permanent("File not found: /data/missing.pdf");
        });
    Source source =
        registry.register(notebook.getId(), new SourceOrigin.File("/data/missing.pdf"), null);

    // When
    ingestion.ingest(source.getId(), DEFAULTS);

    // Then
    Source failed = registry.get(source.getId());
    assertThat(failed.getStatus()).isEqualTo(SourceStatus.ERROR);
    assertThat(failed.getErrorDetail()).contains("File not found");
    assertThat(failed.getArtifacts()).isEmpty();
    assertThat(extractionCalls.get()).isEqualTo(1);
  }

  @Test
  void shouldRetryExtraction_whenFailureIsTransient() {
    // Given
    AtomicInteger attempts = new AtomicInteger();
    extractorBehaviour.set(
        origin -> {
          if (attempts.incrementAndGet() < 3) {
            throw ExtractionFailedException.transientFailure("HTTP 503", null);
          }
          return ExtractedContent.of("Fetched page");
        });
    Source source =
        registry.register(notebook.getId(), new SourceOrigin.Url("https://example.com"), null);

    // When
    String text = resolver.resolve(source.getId());

    // Then
    assertThat(text).isEqualTo("Fetched page");
    assertThat(attempts.get()).isEqualTo(3);
    assertThat(registry.get(source.getId()).getStatus()).isEqualTo(SourceStatus.PROCESSED);
  }

  @Test
  void shouldMarkSourceFailed_whenExtractionKeepsTimingOut() {
    // Given
    extractorBehaviour.set(
        origin -> {
          pause(2_000);
          return ExtractedContent.of("too late");
        });
    Source source =
        registry.register(notebook.getId(), new SourceOrigin.Url("https://slow.example"), null);

    // When / Then
    assertThatThrownBy(() -> resolver.resolve(source.getId(), Duration.ofMillis(50)))
        .isInstanceOf(ExtractionFailedException.class)
        .satisfies(e -> assertThat(((ExtractionFailedException) e).isTransient()).isTrue());
    Source failed = registry.get(source.getId());
    assertThat(failed.getStatus()).isEqualTo(SourceStatus.ERROR);
    assertThat(failed.getErrorDetail()).contains("timed out");
  }

  @Test
  void shouldProcessSource_whenRetriedAfterError() {
    // Given
    extractorBehaviour.set(
        origin -> {
          throw ExtractionFailedException.permanent("Empty response");
        });
    Source source =
        registry.register(notebook.getId(), new SourceOrigin.Url("https://example.com"), null);
    ingestion.ingest(source.getId(), DEFAULTS);
    extractorBehaviour.set(origin -> ExtractedContent.of("Now it works"));

    // When
    Source retried = registry.retry(source.getId());
    ingestion.ingest(source.getId(), DEFAULTS);

    // Then
    assertThat(retried.getStatus()).isEqualTo(SourceStatus.PROCESSING);
    verify(ingestionScheduler, times(2)).ingestAsync(source.getId(), DEFAULTS);
    Source processed = registry.get(source.getId());
    assertThat(processed.getStatus()).isEqualTo(SourceStatus.PROCESSED);
    assertThat(processed.getErrorDetail()).isNull();
    assertThat(processed.getArtifacts()).hasSize(2);
  }

  @Test
  void shouldRejectUnknownTransformation_beforeExtracting() {
    Source source = registry.register(notebook.getId(), new SourceOrigin.Text("notes"), null);

    assertThatThrownBy(() -> executor.run(source.getId(), "translate_to_latin", Map.of()))
        .isInstanceOf(UnknownTransformationException.class);

    assertThat(extractionCalls.get()).isZero();
    assertThat(registry.get(source.getId()).getStatus()).isEqualTo(SourceStatus.PENDING);
  }

  @Test
  void shouldLeaveSourceProcessed_whenTransformationFails() {
    // Given
    assistantBehaviour.set(
        context -> {
          if (context.systemPrompt().contains("insights")) {
            throw new GenerationFailedException(false, "content policy");
          }
          return "Summary.";
        });
    Source source = registry.register(notebook.getId(), new SourceOrigin.Text("notes"), null);

    // When
    ingestion.ingest(source.getId(), List.of("key_insights", "simple_summary"));

    // Then
    Source processed = registry.get(source.getId());
    assertThat(processed.getStatus()).isEqualTo(SourceStatus.PROCESSED);
    assertThat(processed.getArtifacts())
        .extracting(SourceArtifact::getName)
        .containsExactly("simple_summary");
  }

  @Test
  void shouldFailPermanently_whenModelOutputHasNoItems() {
    Source source = registry.register(notebook.getId(), new SourceOrigin.Text("notes"), null);
    assistantBehaviour.set(context -> "   ");

    assertThatThrownBy(() -> executor.run(source.getId(), "key_insights", Map.of()))
        .isInstanceOf(GenerationFailedException.class)
        .satisfies(e -> assertThat(((GenerationFailedException) e).isTransient()).isFalse());
    assertThat(registry.get(source.getId()).getArtifacts()).isEmpty();
  }

  @Test
  void shouldStoreNothing_whenSourceDeletedDuringTransformation() throws Exception {
    // Given
    CountDownLatch generating = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    assistantBehaviour.set(
        context -> {
          generating.countDown();
          awaitQuietly(release);
          return "Late summary.";
        });
    Source source = registry.register(notebook.getId(), new SourceOrigin.Text("notes"), null);
    UUID sourceId = source.getId();
    CompletableFuture<SourceArtifact> pending =
        executor.runAsync(sourceId, "simple_summary", Map.of());
    assertThat(generating.await(5, TimeUnit.SECONDS)).isTrue();

    // When
    registry.delete(sourceId);
    release.countDown();

    // Then
    assertThatThrownBy(() -> pending.get(5, TimeUnit.SECONDS)).isInstanceOf(Exception.class);
    assertThat(store.contains(sourceId)).isFalse();
    assertThatThrownBy(() -> registry.get(sourceId)).isInstanceOf(SourceNotFoundException.class);
    assertThatThrownBy(() -> executor.run(sourceId, "simple_summary", Map.of()))
        .isInstanceOf(SourceNotFoundException.class);
  }

  private static ThreadPoolTaskExecutor pool(String prefix) {
    ThreadPoolTaskExecutor pool = new ThreadPoolTaskExecutor();
    pool.setCorePoolSize(8);
    pool.setThreadNamePrefix(prefix);
    pool.initialize();
    return pool;
  }

  private static void pause(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted", e);
    }
  }

  private static void awaitQuietly(CountDownLatch latch) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted", e);
    }
  }
}
