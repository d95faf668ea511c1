package com.gruelbox.dispatchbridge;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.MDC;
import org.slf4j.event.Level;

/**
 * Utility methods used internally by the bridge. Not part of the API; they may be modified or
 * removed without warning.
 */
@Slf4j
final class Utils {

  private Utils() {}

  @SuppressWarnings("UnusedReturnValue")
  static boolean safelyRun(String gerund, Runnable runnable) {
    try {
      runnable.run();
      return true;
    } catch (Exception e) {
      log.error("Error when {}", gerund, e);
      return false;
    }
  }

  static <T> T firstNonNull(T one, Supplier<T> two) {
    if (one == null) return two.get();
    return one;
  }

  static void shutdown(ExecutorService executor) {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
        log.warn("Executor did not terminate within 30 seconds, forcing shutdown");
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  static void withinMdc(Map<String, String> mdc, Runnable runnable) {
    if (mdc == null || MDC.getMDCAdapter() == null) {
      runnable.run();
      return;
    }
    var oldMdc = MDC.getCopyOfContextMap();
    MDC.setContextMap(mdc);
    try {
      runnable.run();
    } finally {
      if (oldMdc == null) {
        MDC.clear();
      } else {
        MDC.setContextMap(oldMdc);
      }
    }
  }

  static boolean logAtLevel(Logger logger, Level level, String message, Object... args) {
    switch (level) {
      case ERROR:
        if (logger.isErrorEnabled()) {
          logger.error(message, args);
          return true;
        }
        return false;
      case WARN:
        if (logger.isWarnEnabled()) {
          logger.warn(message, args);
          return true;
        }
        return false;
      case INFO:
        if (logger.isInfoEnabled()) {
          logger.info(message, args);
          return true;
        }
        return false;
      case DEBUG:
        if (logger.isDebugEnabled()) {
          logger.debug(message, args);
          return true;
        }
        return false;
      case TRACE:
        if (logger.isTraceEnabled()) {
          logger.trace(message, args);
          return true;
        }
        return false;
      default:
        return logAtLevel(logger, Level.WARN, message, args);
    }
  }
}
