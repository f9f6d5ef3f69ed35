package com.anyfile.progress.emitter;

import com.anyfile.progress.consumer.ProgressConsumer;
import com.anyfile.progress.exception.ProgressCancelledException;
import com.anyfile.progress.exception.ValidationException;
import com.anyfile.progress.model.ProgressState;
import com.anyfile.progress.model.ProgressUpdate;
import com.anyfile.progress.model.UpdateType;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Pull-style view over an emitter's events, obtained from {@link ProgressEmitter#stream()}.
 *
 * <p>The emitter pushes each delivered event into a bounded buffer; readers take them out with
 * {@link #next()} (blocking), {@link #poll(Duration)} or {@link #nextAsync(Executor)}. When the
 * buffer is full the oldest buffered event is discarded, so a slow reader always sees the most
 * recent state and never misses the final COMPLETED event.
 *
 * <p>The stream ends right after it hands out a COMPLETED event; at that point it unregisters
 * itself from the emitter. A reader that stops early should call {@link #close()}, otherwise the
 * stream stays registered until the emitter completes.
 *
 * <p>Each stream is single-consumption. Several streams may be open on the same emitter; each has
 * its own buffer.
 */
public class ProgressStream implements Iterator<ProgressUpdate>, AutoCloseable {
  private static final org.slf4j.Logger log =
      com.anyfile.progress.logging.LoggingService.getLogger(ProgressStream.class);

  private static final long CLOSE_CHECK_MILLIS = 50;

  private final ProgressEmitter emitter;
  private final BlockingQueue<ProgressUpdate> queue;
  private final ProgressConsumer consumer = new QueueingConsumer();
  private final AtomicLong dropped = new AtomicLong();

  private volatile boolean finished;
  private volatile boolean closed;

  ProgressStream(ProgressEmitter emitter, int capacity) {
    if (capacity <= 0) {
      throw new ValidationException(
          "stream capacity must be positive", Map.of("capacity", capacity));
    }
    this.emitter = emitter;
    this.queue = new ArrayBlockingQueue<>(capacity);
  }

  ProgressConsumer consumer() {
    return consumer;
  }

  /** False once COMPLETED has been handed out or the stream was closed with nothing buffered. */
  @Override
  public boolean hasNext() {
    return !finished && !(closed && queue.isEmpty());
  }

  /**
   * Wait for the next event.
   *
   * @throws NoSuchElementException if the stream is exhausted or closed
   * @throws ProgressCancelledException if the waiting thread is interrupted
   */
  @Override
  public ProgressUpdate next() {
    while (hasNext()) {
      ProgressUpdate update = take(CLOSE_CHECK_MILLIS);
      if (update != null) {
        return deliver(update);
      }
    }
    throw new NoSuchElementException("progress stream is exhausted");
  }

  /**
   * Wait at most {@code timeout} for the next event.
   *
   * @return the event, or empty if none arrived in time or the stream is exhausted
   */
  public Optional<ProgressUpdate> poll(Duration timeout) {
    if (!hasNext()) {
      return Optional.empty();
    }
    ProgressUpdate update = take(timeout.toMillis());
    return update == null ? Optional.empty() : Optional.of(deliver(update));
  }

  /** Read the next event on {@code executor}. */
  public CompletableFuture<ProgressUpdate> nextAsync(Executor executor) {
    return CompletableFuture.supplyAsync(this::next, executor);
  }

  /** Remaining events as a sequential {@link Stream}, ending after COMPLETED. */
  public Stream<ProgressUpdate> asStream() {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  /** Number of events discarded because the buffer was full. */
  public long droppedCount() {
    return dropped.get();
  }

  /** Unregister from the emitter. Already buffered events can still be read. */
  @Override
  public void close() {
    if (!closed) {
      closed = true;
      emitter.removeConsumer(consumer);
    }
  }

  private ProgressUpdate take(long timeoutMillis) {
    try {
      return queue.poll(timeoutMillis, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProgressCancelledException("interrupted while waiting for progress update", e);
    }
  }

  private ProgressUpdate deliver(ProgressUpdate update) {
    if (update.updateType() == UpdateType.COMPLETED) {
      finished = true;
      close();
    }
    return update;
  }

  private final class QueueingConsumer implements ProgressConsumer {
    @Override
    public void onProgress(ProgressUpdate update) {
      while (!queue.offer(update)) {
        if (queue.poll() != null) {
          long count = dropped.incrementAndGet();
          log.debug("Progress stream buffer full, dropped oldest update ({} so far)", count);
        }
      }
    }

    @Override
    public void onComplete(ProgressState state) {
      // the COMPLETED event was already queued by onProgress
    }
  }
}
