package com.anyfile.progress;

import static org.junit.jupiter.api.Assertions.*;

import com.anyfile.progress.consumer.LoggingProgressConsumer;
import com.anyfile.progress.emitter.ProgressEmitter;
import com.anyfile.progress.emitter.ProgressStream;
import com.anyfile.progress.model.UpdateType;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

class ProgressEmitterFactoryTest {

  @Test
  void emittersUseConfiguredThrottleInterval() {
    ProgressSettings settings =
        new ProgressSettings(Duration.ofMillis(40), 4, Duration.ofSeconds(1), Level.INFO);
    ProgressEmitterFactory factory = new ProgressEmitterFactory(settings, new ManualNanoClock());

    ProgressEmitter emitter = factory.create(10L, "images");

    assertEquals(Duration.ofMillis(40), emitter.getThrottleInterval());
    assertEquals("images", emitter.getLabel());
    assertEquals(Duration.ofMillis(40), emitter.createChild(5L).getThrottleInterval());
  }

  @Test
  void streamsUseConfiguredCapacity() {
    ProgressSettings settings =
        new ProgressSettings(Duration.ZERO, 1, Duration.ofSeconds(1), Level.INFO);
    ProgressEmitterFactory factory = new ProgressEmitterFactory(settings, new ManualNanoClock());
    ProgressEmitter emitter = factory.create(3L, null);
    ProgressStream stream = factory.stream(emitter);

    emitter.update();
    emitter.update();
    emitter.complete();

    assertEquals(2, stream.droppedCount());
    assertEquals(UpdateType.COMPLETED, stream.next().updateType());
  }

  @Test
  void fromLocationReadsYamlAndBuildsConsumers() {
    ProgressEmitterFactory factory = ProgressEmitterFactory.fromLocation("classpath:progress-test.yaml");

    assertEquals(Duration.ofMillis(250), factory.settings().throttleInterval());
    LoggingProgressConsumer consumer =
        factory.loggingConsumer(LoggerFactory.getLogger(ProgressEmitterFactoryTest.class));
    assertNotNull(consumer);
    assertEquals(
        ch.qos.logback.classic.Level.WARN,
        ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("progress-test-logger"))
            .getLevel());
  }
}
