package com.anyfile.progress.model;

import com.anyfile.progress.exception.ValidationException;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Immutable snapshot of a progress timeline.
 *
 * <p>All invariants are checked once, at construction:
 *
 * <ul>
 *   <li>{@code current} is non-negative
 *   <li>{@code total}, when present, is non-negative and not below {@code current}
 *   <li>{@code label} is at most {@value #MAX_LABEL_LENGTH} characters
 * </ul>
 *
 * @param current items processed so far
 * @param total total items, or {@code null} for indeterminate progress
 * @param label human-readable label, may be {@code null}
 * @param timestampNanos monotonic reading ({@link System#nanoTime()}) taken at creation
 * @param metadata extra attributes set through {@code ProgressEmitter.putMetadata}, never {@code
 *     null}
 */
public record ProgressState(
    long current, Long total, String label, long timestampNanos, Map<String, Object> metadata) {

  public static final int MAX_LABEL_LENGTH = 100;

  public ProgressState {
    if (current < 0) {
      throw new ValidationException(
          "current must be non-negative", Map.of("current", current));
    }
    if (total != null && total < 0) {
      throw new ValidationException("total must be non-negative", Map.of("total", total));
    }
    if (total != null && current > total) {
      throw new ValidationException(
          "current cannot exceed total", Map.of("current", current, "total", total));
    }
    if (label != null && label.length() > MAX_LABEL_LENGTH) {
      throw new ValidationException(
          "label too long (max " + MAX_LABEL_LENGTH + " chars)",
          Map.of("length", label.length()));
    }
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public ProgressState(long current, Long total, String label) {
    this(current, total, label, System.nanoTime(), Map.of());
  }

  /** Completion percentage in [0, 100]; empty when indeterminate or when total is zero. */
  public OptionalDouble percentage() {
    if (total == null || total == 0) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of((current / (double) total) * 100.0);
  }

  public boolean isIndeterminate() {
    return total == null;
  }

  public boolean isComplete() {
    return total != null && current == total;
  }

  public OptionalLong itemsRemaining() {
    return total == null ? OptionalLong.empty() : OptionalLong.of(total - current);
  }
}
