package dev.harvest.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts log verbosity for CLI invocations.
 * <p><strong>Role:</strong> Bridges the {@code --verbose} flag to the Logback root logger.</p>
 * <p><strong>Thread-safety:</strong> Intended for the CLI bootstrap thread.</p>
 *
 * @implNote Other SLF4J bindings keep their configured levels and a warning is logged.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {}

  /** Lowers the root logger to DEBUG for the rest of the process. */
  public static void enableVerboseLogging() {
    setRootLevel(Level.DEBUG);
  }

  /**
   * Sets the root level when the backend is Logback.
   *
   * @param level new root level
   * @return {@code true} when the level was applied
   */
  static boolean setRootLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("Cannot change log level: backend {} is not Logback", factory.getClass().getName());
      return false;
    }
    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    if (!level.equals(root.getLevel())) {
      root.setLevel(level);
      log.debug("Root log level set to {}", level);
    }
    return true;
  }
}
