package com.gentoro.kgbridge.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import com.gentoro.kgbridge.ConfigurationProvider;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {

  private static Level levelOf(String name) {
    return ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(name).getLevel();
  }

  @Test
  void appliesFlatLevels() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("logging.level.test.flat.pkg", "ERROR");
    cfg.setProperty("logging.level.test.flat.other", "NOT_A_LEVEL");

    LoggingService.applyConfiguration(cfg);

    assertEquals(Level.ERROR, levelOf("test.flat.pkg"));
    assertNull(levelOf("test.flat.other"));
  }

  @Test
  void appliesDottedLoggerNamesFromYaml(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("logging.yaml");
    Files.writeString(file, "logging:\n  level:\n    test.yaml.pkg: WARN\n");

    LoggingService.applyConfiguration(new ConfigurationProvider(file.toString()).config());

    assertEquals(Level.WARN, levelOf("test.yaml.pkg"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void stderrAppenderEncodesUtf8() {
    ConsoleAppender<ILoggingEvent> appender =
        (ConsoleAppender<ILoggingEvent>)
            ((LoggerContext) LoggerFactory.getILoggerFactory())
                .getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)
                .getAppender("STDERR");

    assertNotNull(appender);
    assertEquals(
        StandardCharsets.UTF_8,
        ((LayoutWrappingEncoder<ILoggingEvent>) appender.getEncoder()).getCharset());
  }
}
