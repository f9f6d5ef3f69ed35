package com.anyfile.progress.emitter;

import com.anyfile.progress.exception.ValidationException;
import java.time.Duration;
import java.util.Map;

/**
 * Time-based gate for progress notifications.
 *
 * <p>An event passes if it is forced, if nothing has passed yet, or if at least {@code interval}
 * elapsed since the last accepted event. Every accepted event, forced or not, restarts the window.
 * Readings are monotonic nanoseconds supplied by the caller.
 */
public class ProgressThrottle {
  private final long intervalNanos;

  private boolean acceptedOnce;
  private long lastAcceptedAt;

  public ProgressThrottle(Duration interval) {
    if (interval == null || interval.isNegative()) {
      throw new ValidationException(
          "throttle interval must be non-negative", Map.of("interval", String.valueOf(interval)));
    }
    this.intervalNanos = interval.toNanos();
  }

  /** Return true if the event should be delivered at {@code nowNanos}. */
  public boolean tryAcquire(long nowNanos, boolean force) {
    boolean intervalOk = !acceptedOnce || nowNanos - lastAcceptedAt >= intervalNanos;
    if (force || intervalOk) {
      acceptedOnce = true;
      lastAcceptedAt = nowNanos;
      return true;
    }
    return false;
  }

  public Duration getInterval() {
    return Duration.ofNanos(intervalNanos);
  }
}
