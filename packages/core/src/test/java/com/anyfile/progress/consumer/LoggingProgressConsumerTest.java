package com.anyfile.progress.consumer;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.anyfile.progress.ManualNanoClock;
import com.anyfile.progress.emitter.ProgressEmitter;
import com.anyfile.progress.model.ProgressState;
import com.anyfile.progress.model.UpdateType;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

class LoggingProgressConsumerTest {

  private Logger logger;
  private ListAppender<ILoggingEvent> appender;
  private ManualNanoClock clock;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger("progress.logging.test");
    logger.setLevel(ch.qos.logback.classic.Level.DEBUG);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    clock = new ManualNanoClock();
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
  }

  private ProgressEmitter emitterWith(LoggingProgressConsumer consumer, Long total, String label) {
    ProgressEmitter emitter = new ProgressEmitter(total, label, Duration.ZERO, clock);
    emitter.addConsumer(consumer);
    return emitter;
  }

  @Test
  void logsAtMostOneProgressLinePerInterval() {
    LoggingProgressConsumer consumer =
        new LoggingProgressConsumer(logger, Duration.ofSeconds(5), Level.INFO, clock);
    ProgressEmitter emitter = emitterWith(consumer, 10L, "Extracting pages");

    emitter.update(1);
    emitter.update(1);
    clock.advance(Duration.ofSeconds(5));
    emitter.update(1);

    assertEquals(2, appender.list.size());
    ILoggingEvent last = appender.list.get(1);
    assertEquals(ch.qos.logback.classic.Level.INFO, last.getLevel());
    assertTrue(
        last.getFormattedMessage().startsWith("Progress: Extracting pages - 3/10 (30.0%)"),
        last.getFormattedMessage());
    assertTrue(last.getFormattedMessage().contains("\"type\":\"PROGRESS\""));
  }

  @Test
  void completionIsAlwaysLogged() {
    LoggingProgressConsumer consumer =
        new LoggingProgressConsumer(logger, Duration.ofHours(1), Level.INFO, clock);
    ProgressEmitter emitter = emitterWith(consumer, 4L, null);

    emitter.update(1);
    emitter.complete();

    assertEquals(2, appender.list.size());
    String message = appender.list.get(1).getFormattedMessage();
    assertTrue(message.startsWith("Complete: Processing - 4 items"), message);
    assertTrue(message.contains("\"type\":\"COMPLETED\""));
  }

  @Test
  void indeterminateProgressReportsItemCount() {
    LoggingProgressConsumer consumer =
        new LoggingProgressConsumer(logger, Duration.ZERO, Level.DEBUG, clock);
    ProgressEmitter emitter = emitterWith(consumer, null, "Transcribing");

    emitter.update(7);

    ILoggingEvent event = appender.list.get(0);
    assertEquals(ch.qos.logback.classic.Level.DEBUG, event.getLevel());
    assertTrue(event.getFormattedMessage().startsWith("Progress: Transcribing - 7 items"));
    assertTrue(event.getFormattedMessage().contains("\"total\":null"));
  }

  @Test
  void skipsWorkWhenLevelIsDisabled() {
    logger.setLevel(ch.qos.logback.classic.Level.WARN);
    LoggingProgressConsumer consumer =
        new LoggingProgressConsumer(logger, Duration.ZERO, Level.INFO, clock);
    ProgressEmitter emitter = emitterWith(consumer, 2L, "quiet");

    emitter.update(1);
    emitter.complete();

    assertTrue(appender.list.isEmpty());
  }

  @Test
  void payloadHasStableShape() {
    LoggingProgressConsumer consumer = new LoggingProgressConsumer(logger);
    ProgressState state = new ProgressState(3, 7L, "Summarizing");

    Map<String, Object> payload = consumer.createPayload(state, UpdateType.PROGRESS, 1);

    assertEquals(
        java.util.List.of("label", "current", "total", "percent", "type", "delta"),
        java.util.List.copyOf(payload.keySet()));
    assertEquals("Summarizing", payload.get("label"));
    assertEquals(3L, payload.get("current"));
    assertEquals(7L, payload.get("total"));
    assertEquals(42.9, payload.get("percent"));
    assertEquals("PROGRESS", payload.get("type"));
    assertEquals(1L, payload.get("delta"));
  }
}
