package com.flamingo.ai.notebook.support;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One reentrant lock per entity id. Locks are created on first use and dropped once no thread holds
 * or waits for them, so the map only ever contains contended ids.
 */
public class KeyedLocks {

  private final ConcurrentHashMap<UUID, Holder> locks = new ConcurrentHashMap<>();

  /** Runs {@code action} while holding the lock for {@code key}. */
  public <T> T withLock(UUID key, Supplier<T> action) {
    Holder holder = acquire(key);
    holder.lock.lock();
    try {
      return action.get();
    } finally {
      holder.lock.unlock();
      release(key);
    }
  }

  /** Runs {@code action} while holding the lock for {@code key}. */
  public void withLock(UUID key, Runnable action) {
    withLock(
        key,
        () -> {
          action.run();
          return null;
        });
  }

  /** Number of ids that currently have a live lock. */
  public int activeKeys() {
    return locks.size();
  }

  private Holder acquire(UUID key) {
    return locks.compute(
        key,
        (k, existing) -> {
          Holder holder = existing != null ? existing : new Holder();
          holder.users++;
          return holder;
        });
  }

  private void release(UUID key) {
    locks.computeIfPresent(key, (k, holder) -> --holder.users == 0 ? null : holder);
  }

  private static final class Holder {
    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by the map's per-key compute
    private int users;
  }
}
