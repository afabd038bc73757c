package com.gentoro.gae.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {

  @Test
  @DisplayName("logging.level entries set logger levels")
  void appliesLevels() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("logging.level.com.gentoro.gae.cost", "WARN");
    cfg.setProperty("logging.level.com.gentoro.gae.batch", "not-a-level");

    LoggingService.applyConfiguration(cfg);

    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    assertEquals(Level.WARN, context.getLogger("com.gentoro.gae.cost").getLevel());
    assertNull(context.getLogger("com.gentoro.gae.batch").getLevel());
  }

  @Test
  @DisplayName("a missing configuration is ignored")
  void nullConfiguration() {
    assertDoesNotThrow(() -> LoggingService.applyConfiguration(null));
  }
}
