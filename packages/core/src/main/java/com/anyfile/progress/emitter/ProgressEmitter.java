package com.anyfile.progress.emitter;

import com.anyfile.progress.consumer.ProgressConsumer;
import com.anyfile.progress.exception.StateException;
import com.anyfile.progress.exception.ValidationException;
import com.anyfile.progress.model.ProgressState;
import com.anyfile.progress.model.ProgressUpdate;
import com.anyfile.progress.model.UpdateType;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.LongSupplier;

/**
 * Mutable progress timeline that turns driving calls into {@link ProgressUpdate} events.
 *
 * <p>A pipeline creates one emitter per operation, registers consumers, and drives it with {@link
 * #update}, {@link #setCurrent}, {@link #updateTotal} and {@link #complete}. Each call produces at
 * most one event, delivered synchronously to every consumer in registration order. Ordinary
 * progress events are throttled to one per {@code throttleInterval}; STARTED, TOTAL_CHANGED and
 * COMPLETED events, and forced updates, are always delivered.
 *
 * <p>Emitters compose: {@link #createChild} returns an emitter whose events recompute this
 * emitter's {@code current} as a weighted average of all children's completion fractions.
 *
 * <p>Instances are not thread-safe. They are meant to be driven from the thread that owns the
 * operation; only {@link ProgressStream} reads may happen elsewhere.
 *
 * <p>Input is validated, never clamped: every bound violation is thrown to the caller and leaves
 * the emitter unchanged.
 */
public class ProgressEmitter {
  private static final org.slf4j.Logger log =
      com.anyfile.progress.logging.LoggingService.getLogger(ProgressEmitter.class);

  /** 10 Hz. */
  public static final Duration DEFAULT_THROTTLE_INTERVAL = Duration.ofMillis(100);

  public static final int DEFAULT_STREAM_CAPACITY = 256;

  private final String label;
  private final ProgressThrottle throttle;
  private final LongSupplier nanoClock;

  // copy-on-write: consumers may unregister during delivery or from a stream reader thread
  private final List<ProgressConsumer> consumers = new CopyOnWriteArrayList<>();
  // parent recompute hooks run after every regular consumer has seen the event
  private final List<ProgressConsumer> parentLinks = new ArrayList<>();
  private final Map<String, Object> metadata = new LinkedHashMap<>();
  private final List<ProgressEmitter> children = new ArrayList<>();
  private final List<Double> weights = new ArrayList<>();

  private long current;
  private Long total;

  public ProgressEmitter(Long total) {
    this(total, null, DEFAULT_THROTTLE_INTERVAL);
  }

  public ProgressEmitter(Long total, String label) {
    this(total, label, DEFAULT_THROTTLE_INTERVAL);
  }

  public ProgressEmitter(Long total, String label, Duration throttleInterval) {
    this(total, label, throttleInterval, System::nanoTime);
  }

  /**
   * Creates an emitter.
   *
   * @param total total items, {@code null} for indeterminate progress
   * @param label human-readable label, at most {@value ProgressState#MAX_LABEL_LENGTH} characters
   * @param throttleInterval minimal time between two ordinary progress events
   * @param nanoClock monotonic clock in nanoseconds, used for throttling and snapshot timestamps
   * @throws ValidationException if total is negative, the label is too long, or the interval is
   *     negative
   */
  public ProgressEmitter(
      Long total, String label, Duration throttleInterval, LongSupplier nanoClock) {
    if (total != null && total < 0) {
      throw new ValidationException("total must be non-negative", Map.of("total", total));
    }
    if (label != null && label.length() > ProgressState.MAX_LABEL_LENGTH) {
      throw new ValidationException(
          "label too long (max " + ProgressState.MAX_LABEL_LENGTH + " chars)",
          Map.of("length", label.length()));
    }
    this.total = total;
    this.label = label;
    this.throttle = new ProgressThrottle(throttleInterval);
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
  }

  public long getCurrent() {
    return current;
  }

  /** Total items, {@code null} while indeterminate. */
  public Long getTotal() {
    return total;
  }

  public String getLabel() {
    return label;
  }

  public Duration getThrottleInterval() {
    return throttle.getInterval();
  }

  /** Fresh snapshot of the current values. */
  public ProgressState getState() {
    return new ProgressState(current, total, label, nanoClock.getAsLong(), metadata);
  }

  /**
   * Attach a pipeline attribute (file name, page number, ...) to every later snapshot. Does not
   * emit an event; a {@code null} value removes the key.
   */
  public void putMetadata(String key, Object value) {
    Objects.requireNonNull(key, "key");
    if (value == null) {
      metadata.remove(key);
    } else {
      metadata.put(key, value);
    }
  }

  /** Increment by one, subject to throttling. */
  public void update() {
    update(1, false);
  }

  public void update(long increment) {
    update(increment, false);
  }

  /**
   * Add {@code increment} (which may be negative) to the current value.
   *
   * <p>The move away from zero is reported as STARTED and always delivered; later moves are
   * PROGRESS events and delivered when the throttle window allows it or when {@code force} is set.
   *
   * @throws ValidationException if the result would be negative, exceed the total or overflow;
   *     the current value is left unchanged
   */
  public void update(long increment, boolean force) {
    long newCurrent;
    try {
      newCurrent = Math.addExact(current, increment);
    } catch (ArithmeticException e) {
      throw new ValidationException(
          "update would overflow current", Map.of("current", current, "increment", increment), e);
    }
    if (newCurrent < 0) {
      throw new ValidationException(
          "update would make current negative",
          Map.of("current", current, "increment", increment));
    }
    if (total != null && newCurrent > total) {
      throw new ValidationException(
          "update would exceed total",
          Map.of("current", current, "increment", increment, "total", total));
    }
    boolean started = current == 0 && increment > 0;
    current = newCurrent;
    emit(started ? UpdateType.STARTED : UpdateType.PROGRESS, increment, force);
  }

  public void setCurrent(long value) {
    setCurrent(value, false);
  }

  /**
   * Set the absolute current value. Moving back to zero is reported as STARTED.
   *
   * @throws ValidationException if {@code value} is negative or exceeds the total
   */
  public void setCurrent(long value, boolean force) {
    if (value < 0) {
      throw new ValidationException("value must be non-negative", Map.of("value", value));
    }
    if (total != null && value > total) {
      throw new ValidationException(
          "value cannot exceed total", Map.of("value", value, "total", total));
    }
    long delta = value - current;
    current = value;
    emit(value == 0 ? UpdateType.STARTED : UpdateType.PROGRESS, delta, force);
  }

  /**
   * Redefine the total once it is discovered or revised. {@code null} switches to indeterminate
   * progress. Always delivers a TOTAL_CHANGED event.
   *
   * @throws ValidationException if {@code newTotal} is negative
   * @throws StateException if {@code newTotal} is below the current value
   */
  public void updateTotal(Long newTotal) {
    if (newTotal != null && newTotal < 0) {
      throw new ValidationException("total must be non-negative", Map.of("total", newTotal));
    }
    if (newTotal != null && newTotal < current) {
      throw new StateException(
          "new total cannot be less than current", Map.of("current", current, "total", newTotal));
    }
    total = newTotal;
    emit(UpdateType.TOTAL_CHANGED, 0, true);
  }

  /**
   * Jump to the total and deliver COMPLETED, followed by {@link ProgressConsumer#onComplete} on
   * each consumer. Every call delivers exactly one COMPLETED event.
   *
   * @throws StateException if the emitter is indeterminate
   */
  public void complete() {
    if (total == null) {
      throw new StateException("cannot complete indeterminate progress");
    }
    current = total;
    emit(UpdateType.COMPLETED, 0, true);
  }

  /** Register a consumer. Duplicates are allowed and notified once per registration. */
  public void addConsumer(ProgressConsumer consumer) {
    consumers.add(Objects.requireNonNull(consumer, "consumer"));
  }

  /**
   * Unregister the first registration of {@code consumer}.
   *
   * @return whether a registration was removed
   */
  public boolean removeConsumer(ProgressConsumer consumer) {
    return consumers.remove(consumer);
  }

  public List<ProgressConsumer> getConsumers() {
    return Collections.unmodifiableList(consumers);
  }

  public ProgressEmitter createChild(Long total) {
    return createChild(total, 1.0, null);
  }

  public ProgressEmitter createChild(Long total, double weight) {
    return createChild(total, weight, null);
  }

  /**
   * Create a child timeline contributing {@code weight} to this emitter's progress. The child
   * shares this emitter's throttle interval and clock.
   *
   * @throws ValidationException if {@code weight} is not strictly positive
   */
  public ProgressEmitter createChild(Long total, double weight, String label) {
    if (!(weight > 0) || Double.isInfinite(weight)) {
      throw new ValidationException("weight must be positive", Map.of("weight", weight));
    }
    ProgressEmitter child =
        new ProgressEmitter(total, label, throttle.getInterval(), nanoClock);
    children.add(child);
    weights.add(weight);
    child.parentLinks.add(new ChildProgressConsumer(this::recalculateFromChildren));
    return child;
  }

  public List<ProgressEmitter> getChildren() {
    return Collections.unmodifiableList(children);
  }

  public ProgressStream stream() {
    return stream(DEFAULT_STREAM_CAPACITY);
  }

  /**
   * Open a pull-style view over this emitter's events. The stream is registered immediately, so it
   * sees every event delivered after this call.
   *
   * @param capacity maximum number of buffered events; when full the oldest one is dropped
   */
  public ProgressStream stream(int capacity) {
    ProgressStream stream = new ProgressStream(this, capacity);
    addConsumer(stream.consumer());
    return stream;
  }

  private void emit(UpdateType type, long delta, boolean force) {
    if (!throttle.tryAcquire(nanoClock.getAsLong(), force || type.isBoundary())) {
      return;
    }
    ProgressState state = getState();
    ProgressUpdate update = new ProgressUpdate(state, delta, type);
    deliver(consumers, update);
    // the child's own consumers are done before the parent recomputes
    deliver(parentLinks, update);
  }

  private void deliver(List<ProgressConsumer> targets, ProgressUpdate update) {
    UpdateType type = update.updateType();
    ProgressState state = update.state();
    for (ProgressConsumer consumer : targets) {
      try {
        consumer.onProgress(update);
        if (type == UpdateType.COMPLETED) {
          consumer.onComplete(state);
        }
      } catch (RuntimeException e) {
        log.error(
            "Progress consumer {} failed on {} event: {}",
            consumer.getClass().getName(),
            type,
            e.getMessage(),
            e);
      }
    }
  }

  /**
   * Weighted average of the children's completion, written into {@code current}. Decimal
   * arithmetic keeps a fully completed hierarchy at exactly its total.
   */
  void recalculateFromChildren() {
    if (children.isEmpty() || total == null || total <= 0) {
      return;
    }
    BigDecimal totalWeight = BigDecimal.ZERO;
    BigDecimal weightedFraction = BigDecimal.ZERO;
    for (int i = 0; i < children.size(); i++) {
      BigDecimal weight = BigDecimal.valueOf(weights.get(i));
      totalWeight = totalWeight.add(weight);
      ProgressEmitter child = children.get(i);
      Long childTotal = child.getTotal();
      if (childTotal != null && childTotal > 0) {
        weightedFraction =
            weightedFraction.add(
                weight
                    .multiply(BigDecimal.valueOf(child.getCurrent()))
                    .divide(BigDecimal.valueOf(childTotal), MathContext.DECIMAL128));
      }
    }
    long aggregated =
        weightedFraction
            .multiply(BigDecimal.valueOf(total))
            .divide(totalWeight, MathContext.DECIMAL128)
            // absorb the last-digit error of the divisions before flooring
            .setScale(20, RoundingMode.HALF_EVEN)
            .setScale(0, RoundingMode.FLOOR)
            .longValueExact();
    aggregated = Math.min(total, aggregated);
    long delta = aggregated - current;
    current = aggregated;
    emit(UpdateType.PROGRESS, delta, false);
  }
}
