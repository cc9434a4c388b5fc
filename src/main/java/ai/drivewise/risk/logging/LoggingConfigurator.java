package ai.drivewise.risk.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Runtime adjustments to the Logback configuration loaded from {@code logback.xml}.
 *
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String ENGINE_LOGGER = "ai.drivewise.risk";

  private LoggingConfigurator() {}

  /**
   * Switches engine loggers to DEBUG for {@code --verbose}. Third-party loggers such as the Kafka client keep
   * their configured level.
   */
  public static void enableVerboseLogging() {
    setLevel(ENGINE_LOGGER, Level.DEBUG);
  }

  /**
   * Sets the level of one logger when the backend is Logback.
   *
   * @param loggerName logger to adjust
   * @param level new level
   * @return {@code true} if the level was applied
   */
  public static boolean setLevel(String loggerName, Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger target = context.getLogger(loggerName);
      target.setLevel(level);
      log.debug("Logger {} set to {}", loggerName, level);
      return true;
    }
    log.warn("Cannot change level of {}: backend {} is not Logback", loggerName, factory.getClass().getName());
    return false;
  }
}
