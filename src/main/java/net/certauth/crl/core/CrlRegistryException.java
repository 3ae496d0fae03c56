package net.certauth.crl.core;

import java.text.MessageFormat;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import net.certauth.crl.log.CrlLogger;
import net.certauth.crl.log.CrlLoggerFactory;

/**
 * Failure raised by every registry operation. The message is rendered from the error message
 * bundle so callers can report it back verbatim.
 */
public class CrlRegistryException extends Exception {
  private static final CrlLogger logger = CrlLoggerFactory.getLogger(CrlRegistryException.class);

  private static final long serialVersionUID = 1L;

  private final ErrorCode errorCode;
  private final Object[] params;

  /**
   * @param errorCode error code
   * @param params message parameters
   */
  public CrlRegistryException(ErrorCode errorCode, Object... params) {
    this(null, errorCode, params);
  }

  /**
   * @param cause underlying failure
   * @param errorCode error code
   * @param params message parameters
   */
  public CrlRegistryException(Throwable cause, ErrorCode errorCode, Object... params) {
    super(getLocalizedMessage(errorCode, params), cause);
    this.errorCode = errorCode;
    this.params = params;

    logger.debug(
        "CRL registry exception: {}, vendorCode: {}", getMessage(), errorCode.getMessageCode());
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }

  public ErrorCode.Kind getKind() {
    return errorCode.getKind();
  }

  public int getVendorCode() {
    return errorCode.getMessageCode();
  }

  public Object[] getParams() {
    return params;
  }

  static String getLocalizedMessage(ErrorCode errorCode, Object... params) {
    String key = String.valueOf(errorCode.getMessageCode());
    try {
      String pattern = ResourceBundle.getBundle(ErrorCode.errorMessageResource).getString(key);
      return MessageFormat.format(pattern, params);
    } catch (MissingResourceException e) {
      return "!!" + key + "!!";
    }
  }
}
