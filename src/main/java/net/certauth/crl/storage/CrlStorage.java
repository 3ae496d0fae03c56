package net.certauth.crl.storage;

import java.io.IOException;
import java.util.List;

/**
 * Durable key/value storage holding the persisted CRL records. Implementations must be strongly
 * consistent per key; the registry performs no retries.
 */
public interface CrlStorage {
  /**
   * Lists the keys directly under {@code prefix}, with the prefix removed. Keys nested deeper are
   * returned as their first path segment followed by {@code /}.
   */
  List<String> list(String prefix) throws IOException;

  /** Returns the stored value, or null when the key is absent. */
  byte[] get(String key) throws IOException;

  void put(String key, byte[] value) throws IOException;

  /** Deleting an absent key is not an error. */
  void delete(String key) throws IOException;
}
