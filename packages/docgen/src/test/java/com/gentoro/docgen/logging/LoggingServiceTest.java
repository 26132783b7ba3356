package com.gentoro.docgen.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {

  private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
  private Level rootLevel;

  @AfterEach
  void restore() {
    if (rootLevel != null) {
      context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
    }
    context.getLogger("com.gentoro.docgen.xml").setLevel(null);
  }

  @Test
  void bundledLogbackConfigurationWritesToConsole() {
    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    assertNotNull(root.getAppender("CONSOLE"), "CONSOLE appender should be attached to root");
  }

  @Test
  void configuredLevelsAreApplied() {
    rootLevel = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel();
    Configuration configuration = new BaseConfiguration();
    configuration.setProperty("logging.level.root", "ERROR");
    configuration.setProperty("logging.level.com.gentoro.docgen.xml", "TRACE");

    LoggingService.applyConfiguration(configuration);

    assertEquals(Level.ERROR, context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel());
    assertEquals(Level.TRACE, context.getLogger("com.gentoro.docgen.xml").getLevel());
  }

  @Test
  void unknownLevelIsIgnored() {
    Configuration configuration = new BaseConfiguration();
    configuration.setProperty("logging.level.com.gentoro.docgen.xml", "LOUD");

    LoggingService.applyConfiguration(configuration);

    assertNull(context.getLogger("com.gentoro.docgen.xml").getLevel());
  }
}
