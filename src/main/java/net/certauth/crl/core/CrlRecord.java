package net.certauth.crl.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import net.certauth.crl.codec.SerialCodec;

/**
 * The revoked serials of one named CRL, keyed by canonical serial key. Instances are immutable;
 * writing a CRL again under the same name produces a new record that replaces this one.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CrlRecord {
  private final Map<String, RevokedSerialEntry> serials;

  @JsonCreator
  public CrlRecord(@JsonProperty("serials") Map<String, RevokedSerialEntry> serials) {
    Map<String, RevokedSerialEntry> copy = new LinkedHashMap<>();
    if (serials != null) {
      for (Map.Entry<String, RevokedSerialEntry> entry : serials.entrySet()) {
        copy.put(
            entry.getKey(),
            entry.getValue() != null ? entry.getValue() : RevokedSerialEntry.EMPTY);
      }
    }
    this.serials = Collections.unmodifiableMap(copy);
  }

  public static CrlRecord fromSerials(Collection<BigInteger> revokedSerials) {
    Map<String, RevokedSerialEntry> serials = new LinkedHashMap<>();
    for (BigInteger serial : revokedSerials) {
      serials.put(SerialCodec.toCanonicalKey(serial), RevokedSerialEntry.EMPTY);
    }
    return new CrlRecord(serials);
  }

  @JsonProperty("serials")
  public Map<String, RevokedSerialEntry> getSerials() {
    return serials;
  }

  /** Returns the entry for the serial, or null when this CRL does not revoke it. */
  public RevokedSerialEntry get(BigInteger serial) {
    return serials.get(SerialCodec.toCanonicalKey(serial));
  }

  public boolean contains(BigInteger serial) {
    return get(serial) != null;
  }

  @JsonIgnore
  public int size() {
    return serials.size();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CrlRecord)) {
      return false;
    }
    return serials.equals(((CrlRecord) o).serials);
  }

  @Override
  public int hashCode() {
    return serials.hashCode();
  }

  @Override
  public String toString() {
    return "CrlRecord{serials=" + serials.keySet() + '}';
  }
}
