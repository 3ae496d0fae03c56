package net.certauth.crl.log;

import static net.certauth.crl.util.SystemUtil.systemGetProperty;

/** Used to create CrlLogger instances */
public class CrlLoggerFactory {
  public static final String LOGGER_IMPL_PROPERTY = "net.certauth.crl.loggerImpl";

  private static volatile LoggerImpl loggerImplementation;

  private CrlLoggerFactory() {}

  enum LoggerImpl {
    SLF4JLOGGER("net.certauth.crl.log.SLF4JLogger"),
    JDK14LOGGER("net.certauth.crl.log.JDK14Logger");

    private final String loggerImplClassName;

    LoggerImpl(String loggerClass) {
      this.loggerImplClassName = loggerClass;
    }

    public String getLoggerImplClassName() {
      return this.loggerImplClassName;
    }

    public static LoggerImpl fromString(String loggerImplClassName) {
      if (loggerImplClassName != null) {
        for (LoggerImpl imp : LoggerImpl.values()) {
          if (loggerImplClassName.equalsIgnoreCase(imp.getLoggerImplClassName())) {
            return imp;
          }
        }
      }
      return null;
    }
  }

  /**
   * @param clazz Class type that the logger is instantiated
   * @return A CrlLogger instance given the name of the class
   */
  public static CrlLogger getLogger(Class<?> clazz) {
    return getLogger(clazz.getName());
  }

  /**
   * @param name logger name
   * @return A CrlLogger instance given the name
   */
  public static CrlLogger getLogger(String name) {
    switch (resolveImplementation()) {
      case SLF4JLOGGER:
        return new SLF4JLogger(name);
      case JDK14LOGGER:
      default:
        return new JDK14Logger(name);
    }
  }

  static LoggerImpl resolveImplementation() {
    if (loggerImplementation == null) {
      LoggerImpl impl = LoggerImpl.fromString(systemGetProperty(LOGGER_IMPL_PROPERTY));
      // default to use java util logging
      loggerImplementation = impl != null ? impl : LoggerImpl.JDK14LOGGER;
    }
    return loggerImplementation;
  }

  static void reset() {
    loggerImplementation = null;
  }
}
