package com.gentoro.reformat.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.io.StringReader;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {
  private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

  @AfterEach
  void resetLevels() {
    context.getLogger("com.gentoro.reformat.sizing").setLevel(null);
    context.getLogger("plain").setLevel(null);
  }

  @Test
  void appliesLevelsFromYaml() throws Exception {
    YAMLConfiguration config = new YAMLConfiguration();
    config.read(
        new StringReader(
            "logging:\n"
                + "  level:\n"
                + "    com.gentoro.reformat.sizing: DEBUG\n"
                + "    plain: bogus\n"));

    LoggingService.applyConfiguration(config);

    assertEquals(Level.DEBUG, context.getLogger("com.gentoro.reformat.sizing").getLevel());
    assertEquals(Level.INFO, context.getLogger("plain").getLevel());
  }

  @Test
  void ignoresMissingConfiguration() {
    assertDoesNotThrow(() -> LoggingService.applyConfiguration(null));
  }
}
