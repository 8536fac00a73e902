package ca.gc.cra.logship.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {
  @Test
  void namesThreadsSequentially() {
    ThreadFactory factory = ExecutorFactories.namedThreadFactory("closer", true, null);

    Thread first = factory.newThread(() -> {});
    Thread second = factory.newThread(() -> {});

    assertEquals("closer-0", first.getName());
    assertEquals("closer-1", second.getName());
    assertTrue(first.isDaemon());
  }

  @Test
  void workerPoolRejectsTasksBeyondSize() throws InterruptedException {
    CountDownLatch release = new CountDownLatch(1);
    ExecutorService pool = ExecutorFactories.newWorkerPool(1, "test-worker", null);
    try {
      pool.execute(() -> {
        try {
          release.await();
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
        }
      });
      assertThrows(RejectedExecutionException.class, () -> pool.execute(() -> {}));
    } finally {
      release.countDown();
      pool.shutdown();
    }
    assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
  }

  @Test
  void workerPoolThreadsKeepJvmAlive() throws Exception {
    ExecutorService pool = ExecutorFactories.newWorkerPool(1, "test-worker", null);
    try {
      boolean daemon = pool.submit(() -> Thread.currentThread().isDaemon()).get(5, TimeUnit.SECONDS);
      assertFalse(daemon);
    } finally {
      pool.shutdown();
    }
  }

  @Test
  void rejectsEmptyPool() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newWorkerPool(0, "x", null));
  }
}
