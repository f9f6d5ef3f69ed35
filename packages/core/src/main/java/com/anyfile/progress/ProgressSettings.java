package com.anyfile.progress;

import com.anyfile.progress.emitter.ProgressEmitter;
import com.anyfile.progress.exception.ConfigException;
import java.time.Duration;
import java.util.Locale;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ex.ConversionException;
import org.slf4j.event.Level;

/**
 * Tunables for emitters and the stock consumers.
 *
 * <p>Expected YAML structure:
 *
 * <pre>
 * progress:
 *   throttle-interval-ms: 100
 *   stream:
 *     capacity: 256
 *   logging:
 *     interval-ms: 5000
 *     level: INFO
 * </pre>
 */
public record ProgressSettings(
    Duration throttleInterval, int streamCapacity, Duration logInterval, Level logLevel) {

  public static final ProgressSettings DEFAULTS =
      new ProgressSettings(
          ProgressEmitter.DEFAULT_THROTTLE_INTERVAL,
          ProgressEmitter.DEFAULT_STREAM_CAPACITY,
          Duration.ofSeconds(5),
          Level.INFO);

  public ProgressSettings {
    if (throttleInterval == null || throttleInterval.isNegative()) {
      throw new ConfigException("progress.throttle-interval-ms must be non-negative");
    }
    if (streamCapacity <= 0) {
      throw new ConfigException("progress.stream.capacity must be positive");
    }
    if (logInterval == null || logInterval.isNegative()) {
      throw new ConfigException("progress.logging.interval-ms must be non-negative");
    }
    if (logLevel == null) {
      throw new ConfigException("progress.logging.level is required");
    }
  }

  /** Read settings from {@code cfg}, falling back to {@link #DEFAULTS} for absent keys. */
  public static ProgressSettings from(Configuration cfg) {
    if (cfg == null) return DEFAULTS;
    try {
      long throttleMs =
          cfg.getLong(
              "progress.throttle-interval-ms", DEFAULTS.throttleInterval().toMillis());
      int capacity = cfg.getInt("progress.stream.capacity", DEFAULTS.streamCapacity());
      long logMs = cfg.getLong("progress.logging.interval-ms", DEFAULTS.logInterval().toMillis());
      String level = cfg.getString("progress.logging.level", DEFAULTS.logLevel().name());
      return new ProgressSettings(
          Duration.ofMillis(throttleMs), capacity, Duration.ofMillis(logMs), parseLevel(level));
    } catch (ConversionException e) {
      throw new ConfigException("Invalid progress configuration: " + e.getMessage(), e);
    }
  }

  private static Level parseLevel(String value) {
    try {
      return Level.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Unknown progress.logging.level: " + value, e);
    }
  }
}
