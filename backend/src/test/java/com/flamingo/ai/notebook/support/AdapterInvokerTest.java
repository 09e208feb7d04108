package com.flamingo.ai.notebook.support;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.notebook.config.NotebookProperties;
import com.flamingo.ai.notebook.exception.ExtractionFailedException;
import com.flamingo.ai.notebook.exception.GenerationFailedException;
import com.flamingo.ai.notebook.exception.OperationCancelledException;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class AdapterInvokerTest {

  private ThreadPoolTaskExecutor executor;
  private InFlightWork inFlightWork;
  private AdapterInvoker invoker;
  private AdapterCallPolicy generationPolicy;
  private AdapterCallPolicy extractionPolicy;
  private UUID ownerId;

  @BeforeEach
  void setUp() {
    executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setThreadNamePrefix("adapter-test-");
    executor.initialize();
    inFlightWork = new InFlightWork();
    invoker = new AdapterInvoker(executor, inFlightWork);

    NotebookProperties.Generation generation = new NotebookProperties.Generation();
    generation.setTimeout(Duration.ofSeconds(2));
    generation.setInitialBackoff(Duration.ofMillis(5));
    generationPolicy = AdapterCallPolicy.generation(generation);

    NotebookProperties.Extraction extraction = new NotebookProperties.Extraction();
    extraction.setTimeout(Duration.ofSeconds(2));
    extraction.setInitialBackoff(Duration.ofMillis(5));
    extractionPolicy = AdapterCallPolicy.extraction(extraction);

    ownerId = UUID.randomUUID();
  }

  @AfterEach
  void tearDown() {
    executor.shutdown();
  }

  @Test
  void shouldReturnResult_whenCallSucceeds() {
    String result = invoker.invoke(generationPolicy, ownerId, () -> "hello");

    assertThat(result).isEqualTo("hello");
    assertThat(inFlightWork.count(ownerId)).isZero();
  }

  @Test
  void shouldRetryUntilSuccess_whenFailureIsTransient() {
    // Given
    AtomicInteger attempts = new AtomicInteger();

    // When
    String result =
        invoker.invoke(
            generationPolicy,
            ownerId,
            () -> {
              if (attempts.incrementAndGet() < 3) {
                throw new GenerationFailedException(true, "rate limited");
              }
              return "third time";
            });

    // Then
    assertThat(result).isEqualTo("third time");
    assertThat(attempts.get()).isEqualTo(3);
  }

  @Test
  void shouldGiveUpAfterMaxAttempts_whenFailureStaysTransient() {
    // Given
    AtomicInteger attempts = new AtomicInteger();

    // When / Then
    assertThatThrownBy(
            () ->
                invoker.invoke(
                    extractionPolicy,
                    ownerId,
                    () -> {
                      attempts.incrementAndGet();
                      throw ExtractionFailedException.transientFailure("HTTP 503", null);
                    }))
        .isInstanceOf(ExtractionFailedException.class)
        .satisfies(e -> assertThat(((ExtractionFailedException) e).isTransient()).isTrue());
    assertThat(attempts.get()).isEqualTo(3);
  }

  @Test
  void shouldNotRetry_whenFailureIsPermanent() {
    // Given
    AtomicInteger attempts = new AtomicInteger();

    // When / Then
    assertThatThrownBy(
            () ->
                invoker.invoke(
                    generationPolicy,
                    ownerId,
                    () -> {
                      attempts.incrementAndGet();
                      throw new GenerationFailedException(false, "context length exceeded");
                    }))
        .isInstanceOf(GenerationFailedException.class)
        .hasMessageContaining("context length exceeded");
    assertThat(attempts.get()).isEqualTo(1);
  }

  @Test
  void shouldReportTransientFailure_whenAttemptTimesOut() {
    // Given
    AdapterCallPolicy policy =
        new AdapterCallPolicy(
            "generation",
            Duration.ofMillis(100),
            1,
            Duration.ofMillis(5),
            2.0,
            generationPolicy.isTransient(),
            generationPolicy.onTimeout());

    // When / Then
    assertThatThrownBy(
            () ->
                invoker.invoke(
                    policy,
                    ownerId,
                    () -> {
                      Thread.sleep(5_000);
                      return "too late";
                    }))
        .isInstanceOf(GenerationFailedException.class)
        .hasMessageContaining("timed out")
        .satisfies(e -> assertThat(((GenerationFailedException) e).isTransient()).isTrue());
  }

  @Test
  void shouldThrowCancelled_whenOwnerWorkIsCancelled() throws Exception {
    // Given
    CountDownLatch started = new CountDownLatch(1);
    CompletableFuture<String> caller =
        CompletableFuture.supplyAsync(
            () ->
                invoker.invoke(
                    generationPolicy,
                    ownerId,
                    () -> {
                      started.countDown();
                      Thread.sleep(5_000);
                      return "never";
                    }));
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

    // When
    int cancelled = inFlightWork.cancelAll(ownerId);

    // Then
    assertThat(cancelled).isEqualTo(1);
    assertThatThrownBy(() -> caller.get(5, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class)
        .hasCauseInstanceOf(OperationCancelledException.class);
  }

  @Test
  void shouldRejectPolicy_whenMaxAttemptsBelowOne() {
    assertThatThrownBy(
            () ->
                new AdapterCallPolicy(
                    "generation",
                    Duration.ofSeconds(1),
                    0,
                    Duration.ofMillis(5),
                    2.0,
                    e -> false,
                    reason -> new IllegalStateException(reason)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
