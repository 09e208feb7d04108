package com.flamingo.ai.notebook.support;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Tracks cancellable work bound to an entity (a source or a chat session) so that deleting the
 * entity can cancel whatever is still running against it.
 */
@Component
@Slf4j
public class InFlightWork {

  private final ConcurrentHashMap<UUID, Set<Future<?>>> work = new ConcurrentHashMap<>();

  /** Registers {@code future} under {@code ownerId}; close the registration once it settles. */
  public Registration track(UUID ownerId, Future<?> future) {
    work.computeIfAbsent(ownerId, id -> ConcurrentHashMap.newKeySet()).add(future);
    return () ->
        work.computeIfPresent(
            ownerId,
            (id, futures) -> {
              futures.remove(future);
              return futures.isEmpty() ? null : futures;
            });
  }

  /**
   * Cancels, with interruption, every tracked future of {@code ownerId}.
   *
   * @return how many futures were cancelled
   */
  public int cancelAll(UUID ownerId) {
    Set<Future<?>> futures = work.remove(ownerId);
    if (futures == null) {
      return 0;
    }
    int cancelled = 0;
    for (Future<?> future : futures) {
      if (future.cancel(true)) {
        cancelled++;
      }
    }
    if (cancelled > 0) {
      log.info("Cancelled {} in-flight operation(s) for {}", cancelled, ownerId);
    }
    return cancelled;
  }

  /** Number of unsettled futures tracked for {@code ownerId}. */
  public int count(UUID ownerId) {
    Set<Future<?>> futures = work.get(ownerId);
    return futures == null ? 0 : futures.size();
  }

  /** Handle returned by {@link #track}; closing it stops tracking the future. */
  @FunctionalInterface
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }
}
