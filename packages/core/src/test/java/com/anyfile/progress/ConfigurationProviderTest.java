package com.anyfile.progress;

import static org.junit.jupiter.api.Assertions.*;

import com.anyfile.progress.exception.ConfigException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.event.Level;

class ConfigurationProviderTest {

  @TempDir Path tempDir;

  @Test
  void defaultLocationLoadsBundledProgressYaml() {
    Configuration cfg = new ConfigurationProvider().config();

    assertEquals(100L, cfg.getLong("progress.throttle-interval-ms"));
    assertEquals(256, cfg.getInt("progress.stream.capacity"));
  }

  @Test
  void loadsFromClasspathLocation() {
    Configuration cfg = new ConfigurationProvider("classpath:progress-test.yaml").config();

    ProgressSettings settings = ProgressSettings.from(cfg);

    assertEquals(Duration.ofMillis(250), settings.throttleInterval());
    assertEquals(8, settings.streamCapacity());
    assertEquals(Duration.ofSeconds(1), settings.logInterval());
    assertEquals(Level.DEBUG, settings.logLevel());
  }

  @Test
  void missingClasspathResourceYieldsEmptyConfiguration() {
    Configuration cfg = new ConfigurationProvider("classpath:does-not-exist.yaml").config();

    assertTrue(cfg.isEmpty());
    assertEquals(ProgressSettings.DEFAULTS, ProgressSettings.from(cfg));
  }

  @Test
  void loadsFromFilePathAndFileUri() throws IOException {
    Path file = tempDir.resolve("custom.yaml");
    Files.writeString(
        file,
        "progress:\n  throttle-interval-ms: 40\n  stream:\n    capacity: 3\n",
        StandardCharsets.UTF_8);

    Configuration fromPath = new ConfigurationProvider(file.toString()).config();
    Configuration fromUri = new ConfigurationProvider(file.toUri().toString()).config();

    assertEquals(40L, fromPath.getLong("progress.throttle-interval-ms"));
    assertEquals(3, fromUri.getInt("progress.stream.capacity"));
  }

  @Test
  void missingFileIsAConfigurationError() {
    Path missing = tempDir.resolve("nope.yaml");

    assertThrows(ConfigException.class, () -> new ConfigurationProvider(missing.toString()));
  }
}
