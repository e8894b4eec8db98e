package ca.gc.cra.huesort.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Bridges the {@code --verbose} CLI flag to the Logback backend.
 *
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String APP_LOGGER = "ca.gc.cra.huesort";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root and application loggers to DEBUG within the running JVM.
   * <p>Intended for single-threaded CLI startup.</p>
   */
  public static void enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(Level.DEBUG);
      Logger app = context.getLogger(APP_LOGGER);
      if (app.getLevel() != null && !Level.DEBUG.equals(app.getLevel())) {
        app.setLevel(Level.DEBUG);
      }
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }
}
