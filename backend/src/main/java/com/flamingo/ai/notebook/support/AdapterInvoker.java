package com.flamingo.ai.notebook.support;

import com.flamingo.ai.notebook.exception.OperationCancelledException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Runs blocking adapter calls with a per-attempt timeout and retries transient failures with
 * exponential backoff.
 *
 * <p>Every attempt runs on the adapter executor and is tracked in {@link InFlightWork} under its
 * owner id, so deleting the owner interrupts the attempt. A timed-out attempt is cancelled and
 * reported through the policy's timeout failure, which is transient. An interrupted caller or a
 * cancelled attempt surfaces as {@link OperationCancelledException} and is never retried.
 */
@Component
@Slf4j
public class AdapterInvoker {

  private final ThreadPoolTaskExecutor adapterCallExecutor;
  private final InFlightWork inFlightWork;

  public AdapterInvoker(
      @Qualifier("adapterCallExecutor") ThreadPoolTaskExecutor adapterCallExecutor,
      InFlightWork inFlightWork) {
    this.adapterCallExecutor = adapterCallExecutor;
    this.inFlightWork = inFlightWork;
  }

  public <T> T invoke(AdapterCallPolicy policy, UUID ownerId, Callable<T> call) {
    Retry retry = Retry.of(policy.operation() + "-" + ownerId, retryConfig(policy));
    retry
        .getEventPublisher()
        .onRetry(
            event ->
                log.warn(
                    "Retrying {} for {} (attempt {} of {}): {}",
                    policy.operation(),
                    ownerId,
                    event.getNumberOfRetryAttempts() + 1,
                    policy.maxAttempts(),
                    event.getLastThrowable() != null
                        ? event.getLastThrowable().getMessage()
                        : "unknown error"));

    try {
      return retry.executeCallable(() -> attempt(policy, ownerId, call));
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new IllegalStateException(policy.operation() + " failed unexpectedly", e);
    }
  }

  private RetryConfig retryConfig(AdapterCallPolicy policy) {
    return RetryConfig.custom()
        .maxAttempts(policy.maxAttempts())
        .intervalFunction(
            IntervalFunction.ofExponentialBackoff(
                policy.initialBackoff(), policy.backoffMultiplier()))
        .retryOnException(policy.isTransient())
        .build();
  }

  private <T> T attempt(AdapterCallPolicy policy, UUID ownerId, Callable<T> call)
      throws Exception {
    if (Thread.currentThread().isInterrupted()) {
      throw new OperationCancelledException(policy.operation() + " cancelled for " + ownerId);
    }

    Future<T> future = adapterCallExecutor.submit(call);
    try (InFlightWork.Registration ignored = inFlightWork.track(ownerId, future)) {
      return future.get(policy.timeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("{} for {} timed out after {}", policy.operation(), ownerId, policy.timeout());
      throw policy.onTimeout().apply(policy.operation() + " timed out after " + policy.timeout());
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new OperationCancelledException(policy.operation() + " interrupted for " + ownerId, e);
    } catch (CancellationException e) {
      throw new OperationCancelledException(policy.operation() + " cancelled for " + ownerId, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Exception exception) {
        throw exception;
      }
      throw e;
    }
  }
}
