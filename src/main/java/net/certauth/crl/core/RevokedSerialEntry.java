package net.certauth.crl.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Per-serial metadata stored for every revoked serial of a CRL. It carries no fields yet and is
 * persisted as an empty JSON object; unknown fields are ignored when reading so revocation reason
 * or date can be added later without changing the serial key type.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RevokedSerialEntry {
  public static final RevokedSerialEntry EMPTY = new RevokedSerialEntry();

  public RevokedSerialEntry() {}

  @Override
  public boolean equals(Object o) {
    return o instanceof RevokedSerialEntry;
  }

  @Override
  public int hashCode() {
    return RevokedSerialEntry.class.hashCode();
  }

  @Override
  public String toString() {
    return "{}";
  }
}
