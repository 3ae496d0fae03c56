package net.certauth.crl.log;

/**
 * Lazily supplies a log message argument. The supplier is only invoked when the message is
 * actually written at the requested level.
 *
 * <p>E.g., {@code logger.debug("Serials: {}", (ArgSupplier) () -> record.getSerials().keySet());}
 */
@FunctionalInterface
public interface ArgSupplier {
  /**
   * Get value
   *
   * @return value substituted into the message placeholder
   */
  Object get();
}
