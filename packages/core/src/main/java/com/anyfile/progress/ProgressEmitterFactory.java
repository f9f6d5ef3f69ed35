package com.anyfile.progress;

import com.anyfile.progress.consumer.LoggingProgressConsumer;
import com.anyfile.progress.emitter.ProgressEmitter;
import com.anyfile.progress.emitter.ProgressStream;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Creates emitters, streams and logging consumers from one {@link ProgressSettings}.
 *
 * <p>Pipelines receive a factory through their constructor instead of reading global defaults.
 */
public class ProgressEmitterFactory {
  private final ProgressSettings settings;
  private final LongSupplier nanoClock;

  public ProgressEmitterFactory(ProgressSettings settings) {
    this(settings, System::nanoTime);
  }

  public ProgressEmitterFactory(ProgressSettings settings, LongSupplier nanoClock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
  }

  /** Factory configured from a YAML location (see {@link ConfigurationProvider}). */
  public static ProgressEmitterFactory fromLocation(String location) {
    ConfigurationProvider provider = new ConfigurationProvider(location);
    com.anyfile.progress.logging.LoggingService.applyConfiguration(provider.config());
    return new ProgressEmitterFactory(ProgressSettings.from(provider.config()));
  }

  public ProgressSettings settings() {
    return settings;
  }

  public ProgressEmitter create(Long total, String label) {
    return new ProgressEmitter(total, label, settings.throttleInterval(), nanoClock);
  }

  public ProgressStream stream(ProgressEmitter emitter) {
    return emitter.stream(settings.streamCapacity());
  }

  /** Logging consumer writing to {@code logger} with the configured interval and level. */
  public LoggingProgressConsumer loggingConsumer(org.slf4j.Logger logger) {
    return new LoggingProgressConsumer(
        logger, settings.logInterval(), settings.logLevel(), nanoClock);
  }
}
