package ca.gc.cra.lattice.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Adjusts Logback levels from CLI flags.
 *
 * @implNote Only Logback supports changing levels at runtime; other SLF4J bindings log a warning.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String CLIENT_LOGGER = "ca.gc.cra.lattice";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the root and client loggers to DEBUG for {@code --verbose}.
   */
  public static void enableVerboseLogging() {
    setLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, Level.DEBUG);
    setLevel(CLIENT_LOGGER, Level.DEBUG);
  }


  private static void setLevel(String loggerName, Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger logger = context.getLogger(loggerName);
      if (!level.equals(logger.getLevel())) {
        logger.setLevel(level);
      }
      return;
    }
    log.warn("Cannot set {} to {}: backend {} does not support dynamic level updates",
        loggerName, level, factory.getClass().getName());
  }
}
