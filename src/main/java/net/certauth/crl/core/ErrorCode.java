package net.certauth.crl.core;

import java.util.HashMap;
import java.util.Map;

/**
 * Registry error codes. Messages live in {@code crl_error_messages.properties} keyed by the
 * numeric message code.
 *
 * <p>Error codes partitioning:
 *
 * <p>3001NN: request validation, 3002NN: input decoding, 3003NN: registry state, 3004NN:
 * storage
 */
public enum ErrorCode {
  MISSING_PARAMETER(300101, Kind.VALIDATION),
  MISSING_NAME_OR_SERIAL(300102, Kind.VALIDATION),
  INVALID_NAME(300103, Kind.VALIDATION),
  SERIAL_PARSE_ERROR(300201, Kind.PARSE),
  CRL_DECODE_ERROR(300202, Kind.DECODE),
  CRL_NOT_FOUND(300301, Kind.NOT_FOUND),
  REGISTRY_NOT_READY(300302, Kind.UNAVAILABLE),
  POPULATION_ERROR(300303, Kind.POPULATION),
  STORAGE_ERROR(300401, Kind.STORAGE),
  RECORD_DECODE_ERROR(300402, Kind.STORAGE);

  /** Coarse failure category reported to callers. */
  public enum Kind {
    VALIDATION,
    PARSE,
    DECODE,
    NOT_FOUND,
    STORAGE,
    POPULATION,
    UNAVAILABLE
  }

  public static final String errorMessageResource = "net.certauth.crl.core.crl_error_messages";

  private static final Map<Integer, ErrorCode> errorCodeMap = new HashMap<>();

  static {
    for (ErrorCode errorCode : ErrorCode.values()) {
      errorCodeMap.put(errorCode.getMessageCode(), errorCode);
    }
  }

  private final int messageCode;
  private final Kind kind;

  ErrorCode(int messageCode, Kind kind) {
    this.messageCode = messageCode;
    this.kind = kind;
  }

  public int getMessageCode() {
    return messageCode;
  }

  public Kind getKind() {
    return kind;
  }

  public static ErrorCode getByMessageCode(int messageCode) {
    return errorCodeMap.get(messageCode);
  }

  @Override
  public String toString() {
    return "ErrorCode{" + "messageCode=" + messageCode + ", kind=" + kind + '}';
  }
}
