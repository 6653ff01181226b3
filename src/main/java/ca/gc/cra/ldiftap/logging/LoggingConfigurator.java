package ca.gc.cra.ldiftap.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts runtime logging for CLI-driven runs.
 * <p><strong>Why:</strong> {@code --verbose} surfaces per-line parser decisions such as dropped entries
 * without editing {@code logback.xml}. Only the {@code ca.gc.cra.ldiftap} loggers
 * are raised; Kafka and OpenTelemetry keep their configured levels.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings keep their defaults and a warning is logged.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  static final String APPLICATION_LOGGER = "ca.gc.cra.ldiftap";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Lowers the application logger threshold to DEBUG.
   *
   * @return {@code true} when the level was changed by this call
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
          factory.getClass().getName());
      return false;
    }
    Logger application = context.getLogger(APPLICATION_LOGGER);
    if (Level.DEBUG.equals(application.getLevel())) {
      return false;
    }
    application.setLevel(Level.DEBUG);
    log.debug("Verbose logging enabled for {}", APPLICATION_LOGGER);
    return true;
  }
}
