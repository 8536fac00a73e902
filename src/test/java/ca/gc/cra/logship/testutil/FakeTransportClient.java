package ca.gc.cra.logship.testutil;

import ca.gc.cra.logship.application.port.TransportClient;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory transport that records posts and can be told to fail or hang.
 */
public final class FakeTransportClient implements TransportClient {
  private final List<Posted> posted = new CopyOnWriteArrayList<>();
  private final AtomicInteger flushes = new AtomicInteger();
  private final AtomicInteger closes = new AtomicInteger();
  private final CountDownLatch closeStarted = new CountDownLatch(1);
  private final CountDownLatch closeFinished = new CountDownLatch(1);
  private volatile IOException postFailure;
  private volatile IOException flushFailure;
  private volatile IOException closeFailure;
  private volatile CountDownLatch closeGate;

  public record Posted(String tag, Instant time, Map<String, Object> record) {}

  @Override
  public void postWithTime(String tag, Instant time, Map<String, Object> record) throws IOException {
    if (postFailure != null) {
      throw postFailure;
    }
    posted.add(new Posted(tag, time, record));
  }

  @Override
  public void flush() throws IOException {
    flushes.incrementAndGet();
    if (flushFailure != null) {
      throw flushFailure;
    }
  }

  @Override
  public void close() throws IOException {
    closes.incrementAndGet();
    closeStarted.countDown();
    try {
      CountDownLatch gate = closeGate;
      if (gate != null) {
        try {
          gate.await();
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
        }
      }
      if (closeFailure != null) {
        throw closeFailure;
      }
    } finally {
      closeFinished.countDown();
    }
  }

  public FakeTransportClient failPostsWith(IOException failure) {
    this.postFailure = failure;
    return this;
  }

  public FakeTransportClient failFlushWith(IOException failure) {
    this.flushFailure = failure;
    return this;
  }

  public FakeTransportClient failCloseWith(IOException failure) {
    this.closeFailure = failure;
    return this;
  }

  /** Makes {@link #close()} block until {@link #releaseClose()} is called. */
  public FakeTransportClient hangOnClose() {
    this.closeGate = new CountDownLatch(1);
    return this;
  }

  public void releaseClose() {
    CountDownLatch gate = closeGate;
    if (gate != null) {
      gate.countDown();
    }
  }

  public boolean awaitCloseFinished(long millis) throws InterruptedException {
    return closeFinished.await(millis, TimeUnit.MILLISECONDS);
  }

  public boolean awaitCloseStarted(long millis) throws InterruptedException {
    return closeStarted.await(millis, TimeUnit.MILLISECONDS);
  }

  public List<Posted> posted() {
    return List.copyOf(posted);
  }

  public int flushCount() {
    return flushes.get();
  }

  public int closeCount() {
    return closes.get();
  }
}
