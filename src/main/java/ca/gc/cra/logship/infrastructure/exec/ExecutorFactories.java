package ca.gc.cra.logship.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the named threads the forwarder and its demo driver run on.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds a thread factory producing named threads.
   *
   * @param prefix thread-name prefix; blank falls back to {@code logship}
   * @param daemon whether threads should not keep the JVM alive
   * @param handler uncaught exception handler installed on each thread; {@code null} logs the failure
   * @return thread factory numbering threads {@code prefix-0}, {@code prefix-1}, ...
   */
  public static ThreadFactory namedThreadFactory(String prefix, boolean daemon, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "logship" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler,
        (t, ex) -> log.error("Uncaught exception in thread {}", t.getName(), ex));
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }

  /**
   * Builds a fixed-size pool for long-running workers. Each submitted task must have a free thread;
   * submissions beyond {@code size} are rejected.
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newWorkerPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "logship-worker" : prefix;
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        namedThreadFactory(threadPrefix, false, handler),
        new ThreadPoolExecutor.AbortPolicy());
  }
}
