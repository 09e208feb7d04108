package com.flamingo.ai.notebook.support;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class KeyedLocksTest {

  private final KeyedLocks locks = new KeyedLocks();

  @Test
  void shouldSerializeActions_whenSameKey() throws Exception {
    // Given
    UUID key = UUID.randomUUID();
    AtomicInteger inside = new AtomicInteger();
    AtomicInteger maxInside = new AtomicInteger();
    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);

    // When
    List<Future<?>> futures = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      futures.add(
          pool.submit(
              () -> {
                start.await();
                locks.withLock(
                    key,
                    () -> {
                      maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                      sleep(5);
                      inside.decrementAndGet();
                    });
                return null;
              }));
    }
    start.countDown();
    for (Future<?> future : futures) {
      future.get(5, TimeUnit.SECONDS);
    }
    pool.shutdown();

    // Then
    assertThat(maxInside.get()).isEqualTo(1);
    assertThat(locks.activeKeys()).isZero();
  }

  @Test
  void shouldNotBlock_whenDifferentKeys() throws Exception {
    // Given
    UUID first = UUID.randomUUID();
    UUID second = UUID.randomUUID();
    CountDownLatch holding = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    ExecutorService pool = Executors.newSingleThreadExecutor();

    Future<?> holder =
        pool.submit(
            () ->
                locks.withLock(
                    first,
                    () -> {
                      holding.countDown();
                      await(release);
                    }));
    assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();

    // When
    String result = locks.withLock(second, () -> "done");

    // Then
    assertThat(result).isEqualTo("done");
    release.countDown();
    holder.get(5, TimeUnit.SECONDS);
    pool.shutdown();
  }

  @Test
  void shouldReleaseLock_whenActionThrows() {
    // Given
    UUID key = UUID.randomUUID();
    Runnable failing =
        () -> {
          throw new IllegalStateException("boom");
        };

    // When / Then
    assertThatThrownBy(() -> locks.withLock(key, failing))
        .isInstanceOf(IllegalStateException.class);
    assertThat(locks.activeKeys()).isZero();
    assertThat(locks.withLock(key, () -> 42)).isEqualTo(42);
  }

  @Test
  void shouldAllowReentry_whenSameThreadHoldsLock() {
    UUID key = UUID.randomUUID();

    String result = locks.withLock(key, () -> locks.withLock(key, () -> "nested"));

    assertThat(result).isEqualTo("nested");
    assertThat(locks.activeKeys()).isZero();
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static void await(CountDownLatch latch) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
