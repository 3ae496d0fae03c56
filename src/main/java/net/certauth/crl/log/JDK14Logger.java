package net.certauth.crl.log;

import java.text.MessageFormat;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Use java.util.logging to implement CrlLogger.
 *
 * <p>Log Level mapping from CrlLogger to java.util.logging: ERROR -- SEVERE WARN -- WARNING INFO --
 * INFO DEBUG -- FINE TRACE -- FINEST
 */
public class JDK14Logger implements CrlLogger {
  /** Name of the parent logger of every registry class. */
  public static final String ROOT_LOGGER_NAME = "net.certauth.crl";

  private static final Set<String> LOG_METHODS =
      new HashSet<>(Arrays.asList("debug", "error", "info", "trace", "warn", "logInternal"));

  private final Logger jdkLogger;

  public JDK14Logger(String name) {
    this.jdkLogger = Logger.getLogger(name);
  }

  public boolean isDebugEnabled() {
    return this.jdkLogger.isLoggable(Level.FINE);
  }

  public boolean isErrorEnabled() {
    return this.jdkLogger.isLoggable(Level.SEVERE);
  }

  public boolean isInfoEnabled() {
    return this.jdkLogger.isLoggable(Level.INFO);
  }

  public boolean isTraceEnabled() {
    return this.jdkLogger.isLoggable(Level.FINEST);
  }

  public boolean isWarnEnabled() {
    return this.jdkLogger.isLoggable(Level.WARNING);
  }

  public void debug(String msg, Object... arguments) {
    logInternal(Level.FINE, msg, arguments);
  }

  public void debug(String msg, Throwable t) {
    logInternal(Level.FINE, msg, t);
  }

  public void error(String msg, Object... arguments) {
    logInternal(Level.SEVERE, msg, arguments);
  }

  public void error(String msg, Throwable t) {
    logInternal(Level.SEVERE, msg, t);
  }

  public void info(String msg, Object... arguments) {
    logInternal(Level.INFO, msg, arguments);
  }

  public void info(String msg, Throwable t) {
    logInternal(Level.INFO, msg, t);
  }

  public void trace(String msg, Object... arguments) {
    logInternal(Level.FINEST, msg, arguments);
  }

  public void trace(String msg, Throwable t) {
    logInternal(Level.FINEST, msg, t);
  }

  public void warn(String msg, Object... arguments) {
    logInternal(Level.WARNING, msg, arguments);
  }

  public void warn(String msg, Throwable t) {
    logInternal(Level.WARNING, msg, t);
  }

  private void logInternal(Level level, String msg, Object... arguments) {
    if (jdkLogger.isLoggable(level)) {
      String[] source = findSourceInStack();
      String message;
      try {
        message = MessageFormat.format(refactorString(msg), evaluateLambdaArgs(arguments));
      } catch (IllegalArgumentException e) {
        message = "Unable to format msg: " + msg;
      }
      jdkLogger.logp(level, source[0], source[1], message);
    }
  }

  private void logInternal(Level level, String msg, Throwable t) {
    if (jdkLogger.isLoggable(level)) {
      String[] source = findSourceInStack();
      jdkLogger.logp(level, source[0], source[1], msg, t);
    }
  }

  public static void addHandler(Handler handler) {
    Logger.getLogger(ROOT_LOGGER_NAME).addHandler(handler);
  }

  public static void removeHandler(Handler handler) {
    Logger.getLogger(ROOT_LOGGER_NAME).removeHandler(handler);
  }

  public static void setLevel(Level level) {
    Logger.getLogger(ROOT_LOGGER_NAME).setLevel(level);
  }

  public static Level getLevel() {
    return Logger.getLogger(ROOT_LOGGER_NAME).getLevel();
  }

  /**
   * Converts SLF4J placeholders into java.text.MessageFormat ones, e.g. {@code "CRL {} has {}
   * serials"} becomes {@code "CRL {0} has {1} serials"}.
   *
   * @param original original string
   * @return refactored string
   */
  static String refactorString(String original) {
    StringBuilder sb = new StringBuilder();
    int argCount = 0;
    for (int i = 0; i < original.length(); i++) {
      if (original.charAt(i) == '{' && i < original.length() - 1 && original.charAt(i + 1) == '}') {
        sb.append(String.format("{%d}", argCount));
        argCount++;
        i++;
      } else {
        sb.append(original.charAt(i));
      }
    }
    return sb.toString();
  }

  /**
   * Locates the caller of the logger: the first stack frame after the outermost log method.
   *
   * @return an array of size two, first element is className and second is methodName
   */
  private String[] findSourceInStack() {
    StackTraceElement[] stackTraces = Thread.currentThread().getStackTrace();
    String[] results = new String[2];
    for (int i = 0; i < stackTraces.length; i++) {
      if (LOG_METHODS.contains(stackTraces[i].getMethodName())) {
        for (int j = i; j < stackTraces.length; j++) {
          if (!LOG_METHODS.contains(stackTraces[j].getMethodName())) {
            results[0] = stackTraces[j].getClassName();
            results[1] = stackTraces[j].getMethodName();
            return results;
          }
        }
      }
    }
    return results;
  }

  private static Object[] evaluateLambdaArgs(Object... args) {
    final Object[] result = new Object[args.length];

    for (int i = 0; i < args.length; i++) {
      result[i] = args[i] instanceof ArgSupplier ? ((ArgSupplier) args[i]).get() : args[i];
    }

    return result;
  }
}
