package com.anyfile.progress.consumer;

import com.anyfile.progress.model.ProgressState;
import com.anyfile.progress.model.ProgressUpdate;
import com.anyfile.progress.model.UpdateType;
import com.anyfile.progress.utility.JacksonUtility;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;
import org.slf4j.event.Level;

/**
 * Consumer that writes progress to an SLF4J logger.
 *
 * <p>Progress lines are rate-limited to one per {@code logInterval}; completion is always logged.
 * Every line carries a compact JSON payload with a stable shape so log processors can parse it:
 *
 * <pre>
 * {
 *   "label": "Extracting pages",
 *   "current": 3,
 *   "total": 7,
 *   "percent": 42.9,
 *   "type": "PROGRESS",
 *   "delta": 1
 * }
 * </pre>
 *
 * <p>{@code total} and {@code percent} are {@code null} for indeterminate progress.
 */
public class LoggingProgressConsumer implements ProgressConsumer {
  static final String DEFAULT_LABEL = "Processing";

  private final org.slf4j.Logger log;
  private final Level level;
  private final long logIntervalNanos;
  private final LongSupplier nanoClock;

  private boolean loggedOnce;
  private long lastLoggedAt;

  public LoggingProgressConsumer(org.slf4j.Logger logger) {
    this(logger, Duration.ofSeconds(5), Level.INFO);
  }

  public LoggingProgressConsumer(org.slf4j.Logger logger, Duration logInterval, Level level) {
    this(logger, logInterval, level, System::nanoTime);
  }

  public LoggingProgressConsumer(
      org.slf4j.Logger logger, Duration logInterval, Level level, LongSupplier nanoClock) {
    this.log = Objects.requireNonNull(logger, "logger");
    this.level = Objects.requireNonNull(level, "level");
    this.logIntervalNanos = Objects.requireNonNull(logInterval, "logInterval").toNanos();
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
  }

  @Override
  public void onProgress(ProgressUpdate update) {
    // completion is reported by onComplete
    if (update.updateType() == UpdateType.COMPLETED) return;
    long now = nanoClock.getAsLong();
    if (loggedOnce && now - lastLoggedAt < logIntervalNanos) return;
    loggedOnce = true;
    lastLoggedAt = now;
    ProgressState state = update.state();
    String summary =
        state.isIndeterminate()
            ? "%s - %d items".formatted(labelOf(state), state.current())
            : String.format(
                Locale.ROOT,
                "%s - %d/%d (%.1f%%)",
                labelOf(state),
                state.current(),
                state.total(),
                state.percentage().orElse(0.0));
    emit("Progress: " + summary, state, update.updateType(), update.delta());
  }

  @Override
  public void onComplete(ProgressState state) {
    emit(
        "Complete: %s - %d items".formatted(labelOf(state), state.current()),
        state,
        UpdateType.COMPLETED,
        0);
  }

  /** Build the payload map. Package-private for tests. */
  Map<String, Object> createPayload(ProgressState state, UpdateType type, long delta) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("label", labelOf(state));
    payload.put("current", state.current());
    payload.put("total", state.total());
    payload.put(
        "percent",
        state.percentage().isPresent()
            ? Math.round(state.percentage().getAsDouble() * 10.0) / 10.0
            : null);
    payload.put("type", type.name());
    payload.put("delta", delta);
    return payload;
  }

  private void emit(String summary, ProgressState state, UpdateType type, long delta) {
    if (!log.isEnabledForLevel(level)) return;
    log.atLevel(level)
        .log("{} {}", summary, JacksonUtility.toJson(createPayload(state, type, delta)));
  }

  private static String labelOf(ProgressState state) {
    return state.label() == null || state.label().isBlank() ? DEFAULT_LABEL : state.label();
  }
}
