package net.certauth.crl.util;

import java.util.Locale;

/** System property and platform helpers. */
public final class SystemUtil {
  public enum OS {
    WINDOWS,
    LINUX,
    MAC,
    SOLARIS,
    OTHER
  }

  private static OS os = null;

  private SystemUtil() {}

  /**
   * System.getProperty wrapper. If System.getProperty raises a SecurityException, it is ignored
   * and null is returned.
   *
   * @param property the property name
   * @return the property value if set, otherwise null
   */
  public static String systemGetProperty(String property) {
    try {
      return System.getProperty(property);
    } catch (SecurityException ex) {
      return null;
    }
  }

  /**
   * Helper function to convert system properties to boolean
   *
   * @param systemProperty name of the system property
   * @param defaultValue default value used
   * @return the value of the system property as boolean, else the default value
   */
  public static boolean convertSystemPropertyToBooleanValue(
      String systemProperty, boolean defaultValue) {
    String systemPropertyValue = systemGetProperty(systemProperty);
    if (systemPropertyValue != null && !systemPropertyValue.isEmpty()) {
      return Boolean.parseBoolean(systemPropertyValue);
    }
    return defaultValue;
  }

  public static boolean isNullOrEmpty(String input) {
    return input == null || input.isEmpty();
  }

  public static synchronized OS getOS() {
    if (os == null) {
      String operSys = String.valueOf(systemGetProperty("os.name")).toLowerCase(Locale.ROOT);
      if (operSys.contains("win")) {
        os = OS.WINDOWS;
      } else if (operSys.contains("nix") || operSys.contains("nux") || operSys.contains("aix")) {
        os = OS.LINUX;
      } else if (operSys.contains("mac")) {
        os = OS.MAC;
      } else if (operSys.contains("sunos")) {
        os = OS.SOLARIS;
      } else {
        os = OS.OTHER;
      }
    }
    return os;
  }
}
