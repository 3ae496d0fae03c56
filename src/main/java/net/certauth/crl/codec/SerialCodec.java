package net.certauth.crl.codec;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;
import net.certauth.crl.core.CrlRegistryException;
import net.certauth.crl.core.ErrorCode;

/**
 * Parses certificate serial numbers supplied by callers and renders the canonical index key.
 *
 * <p>Accepted encodings, in precedence order:
 *
 * <ol>
 *   <li>colon separated hex byte groups, e.g. {@code 1a:2b:3c}
 *   <li>hyphen separated hex byte groups, e.g. {@code 1a-2b-3c}
 *   <li>a plain integer: {@code 0x} selects base 16, a leading {@code 0} base 8, otherwise base 10
 * </ol>
 *
 * Hex groups are read big-endian as an unsigned value.
 */
public final class SerialCodec {
  private static final Pattern HEX_GROUP = Pattern.compile("[0-9a-fA-F]{1,2}");

  private static final Pattern OCTAL_DIGITS = Pattern.compile("[0-7]+");
  private static final Pattern DECIMAL_DIGITS = Pattern.compile("[0-9]+");
  private static final Pattern HEX_DIGITS = Pattern.compile("[0-9a-fA-F]+");

  private SerialCodec() {}

  public static BigInteger parseSerial(String input) throws CrlRegistryException {
    if (input == null || input.isEmpty()) {
      throw new CrlRegistryException(ErrorCode.SERIAL_PARSE_ERROR, input);
    }
    if (input.indexOf(':') >= 0) {
      return parseHexFormatted(input, ":");
    }
    if (input.indexOf('-') >= 0) {
      return parseHexFormatted(input, "-");
    }
    return parseInteger(input);
  }

  /** Base-10 rendering of the serial; the only form used as an index or storage key. */
  public static String toCanonicalKey(BigInteger serial) {
    return serial.toString();
  }

  /**
   * Renders the serial as lower case hex byte groups joined by {@code separator}, e.g. {@code
   * 1a:2b}.
   */
  public static String toHexFormatted(BigInteger serial, String separator) {
    byte[] bytes = serial.toByteArray();
    int start = 0;
    // drop the sign byte BigInteger adds when the top bit is set
    while (start < bytes.length - 1 && bytes[start] == 0) {
      start++;
    }
    StringBuilder sb = new StringBuilder();
    for (int i = start; i < bytes.length; i++) {
      if (i > start) {
        sb.append(separator);
      }
      sb.append(String.format("%02x", bytes[i] & 0xff));
    }
    return sb.toString();
  }

  private static BigInteger parseHexFormatted(String input, String separator)
      throws CrlRegistryException {
    ByteArrayOutputStream serialBytes = new ByteArrayOutputStream();
    for (String group : input.split(Pattern.quote(separator), -1)) {
      if (!HEX_GROUP.matcher(group).matches()) {
        throw new CrlRegistryException(ErrorCode.SERIAL_PARSE_ERROR, input);
      }
      serialBytes.write(Integer.parseInt(group, 16));
    }
    return new BigInteger(1, serialBytes.toByteArray());
  }

  // ASCII only; BigInteger would also take other Unicode digits
  private static Pattern digitsPattern(int radix) {
    switch (radix) {
      case 8:
        return OCTAL_DIGITS;
      case 16:
        return HEX_DIGITS;
      default:
        return DECIMAL_DIGITS;
    }
  }

  private static BigInteger parseInteger(String input) throws CrlRegistryException {
    String digits = input.startsWith("+") ? input.substring(1) : input;
    int radix = 10;
    String lower = digits.toLowerCase(Locale.ROOT);
    if (lower.startsWith("0x")) {
      radix = 16;
      digits = digits.substring(2);
    } else if (digits.length() > 1 && digits.startsWith("0")) {
      radix = 8;
      digits = digits.substring(1);
    }
    if (!digitsPattern(radix).matcher(digits).matches()) {
      throw new CrlRegistryException(ErrorCode.SERIAL_PARSE_ERROR, input);
    }
    return new BigInteger(digits, radix);
  }
}
