package com.flamingo.ai.notebook.support;

import com.flamingo.ai.notebook.config.NotebookProperties;
import com.flamingo.ai.notebook.exception.ExtractionFailedException;
import com.flamingo.ai.notebook.exception.GenerationFailedException;
import java.time.Duration;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * How one kind of adapter call is bounded and retried.
 *
 * @param operation name used for logging and the retry instance
 * @param timeout upper bound on a single attempt
 * @param maxAttempts total attempts, the first included
 * @param initialBackoff wait before the second attempt
 * @param backoffMultiplier growth factor of the wait between attempts
 * @param isTransient which failures are worth another attempt
 * @param onTimeout builds the failure reported when an attempt times out
 */
public record AdapterCallPolicy(
    String operation,
    Duration timeout,
    int maxAttempts,
    Duration initialBackoff,
    double backoffMultiplier,
    Predicate<Throwable> isTransient,
    Function<String, RuntimeException> onTimeout) {

  public AdapterCallPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
  }

  public AdapterCallPolicy withTimeout(Duration newTimeout) {
    return new AdapterCallPolicy(
        operation,
        newTimeout,
        maxAttempts,
        initialBackoff,
        backoffMultiplier,
        isTransient,
        onTimeout);
  }

  public static AdapterCallPolicy extraction(NotebookProperties.Extraction settings) {
    return new AdapterCallPolicy(
        "extraction",
        settings.getTimeout(),
        settings.getMaxAttempts(),
        settings.getInitialBackoff(),
        settings.getBackoffMultiplier(),
        error -> error instanceof ExtractionFailedException e && e.isTransient(),
        reason -> ExtractionFailedException.transientFailure(reason, null));
  }

  public static AdapterCallPolicy generation(NotebookProperties.Generation settings) {
    return new AdapterCallPolicy(
        "generation",
        settings.getTimeout(),
        settings.getMaxAttempts(),
        settings.getInitialBackoff(),
        settings.getBackoffMultiplier(),
        error -> error instanceof GenerationFailedException e && e.isTransient(),
        reason -> new GenerationFailedException(true, reason));
  }
}
