package net.certauth.crl.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.FormattingTuple;
import org.slf4j.helpers.MessageFormatter;
import org.slf4j.spi.LocationAwareLogger;

/** CrlLogger backed by slf4j-api, selected with {@code -Dnet.certauth.crl.loggerImpl}. */
public class SLF4JLogger implements CrlLogger {
  private static final String FQCN = SLF4JLogger.class.getName();

  private final Logger slf4jLogger;

  private final boolean isLocationAwareLogger;

  public SLF4JLogger(Class<?> clazz) {
    this(clazz.getName());
  }

  public SLF4JLogger(String name) {
    slf4jLogger = LoggerFactory.getLogger(name);
    isLocationAwareLogger = slf4jLogger instanceof LocationAwareLogger;
  }

  public boolean isDebugEnabled() {
    return this.slf4jLogger.isDebugEnabled();
  }

  public boolean isErrorEnabled() {
    return this.slf4jLogger.isErrorEnabled();
  }

  public boolean isInfoEnabled() {
    return this.slf4jLogger.isInfoEnabled();
  }

  public boolean isTraceEnabled() {
    return this.slf4jLogger.isTraceEnabled();
  }

  public boolean isWarnEnabled() {
    return this.slf4jLogger.isWarnEnabled();
  }

  public void debug(String msg, Object... arguments) {
    if (isDebugEnabled()) {
      log(LocationAwareLogger.DEBUG_INT, format(msg, arguments), null);
    }
  }

  public void debug(String msg, Throwable t) {
    log(LocationAwareLogger.DEBUG_INT, msg, t);
  }

  public void error(String msg, Object... arguments) {
    if (isErrorEnabled()) {
      log(LocationAwareLogger.ERROR_INT, format(msg, arguments), null);
    }
  }

  public void error(String msg, Throwable t) {
    log(LocationAwareLogger.ERROR_INT, msg, t);
  }

  public void info(String msg, Object... arguments) {
    if (isInfoEnabled()) {
      log(LocationAwareLogger.INFO_INT, format(msg, arguments), null);
    }
  }

  public void info(String msg, Throwable t) {
    log(LocationAwareLogger.INFO_INT, msg, t);
  }

  public void trace(String msg, Object... arguments) {
    if (isTraceEnabled()) {
      log(LocationAwareLogger.TRACE_INT, format(msg, arguments), null);
    }
  }

  public void trace(String msg, Throwable t) {
    log(LocationAwareLogger.TRACE_INT, msg, t);
  }

  public void warn(String msg, Object... arguments) {
    if (isWarnEnabled()) {
      log(LocationAwareLogger.WARN_INT, format(msg, arguments), null);
    }
  }

  public void warn(String msg, Throwable t) {
    log(LocationAwareLogger.WARN_INT, msg, t);
  }

  private void log(int level, String msg, Throwable t) {
    if (isLocationAwareLogger) {
      ((LocationAwareLogger) slf4jLogger).log(null, FQCN, level, msg, null, t);
      return;
    }
    switch (level) {
      case LocationAwareLogger.ERROR_INT:
        slf4jLogger.error(msg, t);
        break;
      case LocationAwareLogger.WARN_INT:
        slf4jLogger.warn(msg, t);
        break;
      case LocationAwareLogger.INFO_INT:
        slf4jLogger.info(msg, t);
        break;
      case LocationAwareLogger.DEBUG_INT:
        slf4jLogger.debug(msg, t);
        break;
      default:
        slf4jLogger.trace(msg, t);
    }
  }

  private static String format(String msg, Object... arguments) {
    FormattingTuple ft = MessageFormatter.arrayFormat(msg, evaluateLambdaArgs(arguments));
    return ft.getMessage();
  }

  private static Object[] evaluateLambdaArgs(Object... args) {
    final Object[] result = new Object[args.length];

    for (int i = 0; i < args.length; i++) {
      result[i] = args[i] instanceof ArgSupplier ? ((ArgSupplier) args[i]).get() : args[i];
    }

    return result;
  }
}
