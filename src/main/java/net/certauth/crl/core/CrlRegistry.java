package net.certauth.crl.core;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;
import net.certauth.crl.codec.SerialCodec;
import net.certauth.crl.log.ArgSupplier;
import net.certauth.crl.log.CrlLogger;
import net.certauth.crl.log.CrlLoggerFactory;
import net.certauth.crl.storage.CrlRecordStore;

/**
 * In-memory index of named CRLs backed by a {@link CrlRecordStore}.
 *
 * <p>A single read/write lock guards the whole index. Lookups share the read lock; {@link
 * #populate()}, {@link #upsert(String, Collection)} and {@link #remove(String)} hold the write lock
 * for the full storage round trip, so no reader ever sees a record that is not yet durable or
 * that has been half replaced. Storage is always written before the index, and a failed storage
 * call leaves the index untouched.
 *
 * <p>Names are case-insensitive: every entry point lower-cases the name before use.
 */
public class CrlRegistry {
  private static final CrlLogger logger = CrlLoggerFactory.getLogger(CrlRegistry.class);

  private static final Pattern NAME_PATTERN = Pattern.compile("\\w([\\w.-]*\\w)?");

  private final Map<String, CrlRecord> crls = new HashMap<>();
  private final ReadWriteLock crlUpdateLock = new ReentrantReadWriteLock();
  private final CrlRecordStore store;

  public CrlRegistry(CrlRecordStore store) {
    this.store = store;
  }

  /**
   * Loads every persisted record into the index, replacing in-memory entries of the same name.
   * The load is all-or-nothing: records are staged first and only installed when every one of
   * them decoded, so a failed reload keeps the previous index.
   *
   * @throws CrlRegistryException POPULATION_ERROR wrapping the first storage or decode failure
   */
  public void populate() throws CrlRegistryException {
    crlUpdateLock.writeLock().lock();
    try {
      List<String> names;
      try {
        names = store.listNames();
      } catch (CrlRegistryException e) {
        throw new CrlRegistryException(e, ErrorCode.POPULATION_ERROR, e.getMessage());
      }

      Map<String, CrlRecord> staged = new LinkedHashMap<>();
      for (String name : names) {
        CrlRecord record;
        try {
          record = store.get(name);
        } catch (CrlRegistryException e) {
          logger.error("Failed to load CRL {}, keeping the current index", name);
          throw new CrlRegistryException(e, ErrorCode.POPULATION_ERROR, e.getMessage());
        }
        if (record == null) {
          continue;
        }
        staged.put(name, record);
      }

      crls.putAll(staged);
      logger.info(
          "Loaded {} CRLs from storage, {} CRLs registered", staged.size(), crls.size());
    } finally {
      crlUpdateLock.writeLock().unlock();
    }
  }

  /**
   * Persists a new serial set under the name and then makes it visible, replacing any previous
   * set for that name.
   */
  public void upsert(String name, Collection<BigInteger> revokedSerials)
      throws CrlRegistryException {
    String normalized = normalizeName(name);
    CrlRecord record = CrlRecord.fromSerials(revokedSerials);

    crlUpdateLock.writeLock().lock();
    try {
      store.put(normalized, record);
      CrlRecord previous = crls.put(normalized, record);
      logger.debug(
          "{} CRL {} with {} revoked serials",
          previous == null ? "Created" : "Replaced",
          normalized,
          record.size());
      logger.trace(
          "CRL {} serials: {}", normalized, (ArgSupplier) () -> record.getSerials().keySet());
    } finally {
      crlUpdateLock.writeLock().unlock();
    }
  }

  /**
   * Deletes the named CRL from storage and then from the index.
   *
   * @throws CrlRegistryException CRL_NOT_FOUND when no such CRL is registered
   */
  public void remove(String name) throws CrlRegistryException {
    String normalized = normalizeName(name);

    crlUpdateLock.writeLock().lock();
    try {
      if (!crls.containsKey(normalized)) {
        throw new CrlRegistryException(ErrorCode.CRL_NOT_FOUND, normalized);
      }
      store.delete(normalized);
      crls.remove(normalized);
      logger.debug("Removed CRL {}", normalized);
    } finally {
      crlUpdateLock.writeLock().unlock();
    }
  }

  /** @throws CrlRegistryException CRL_NOT_FOUND when no such CRL is registered */
  public CrlRecord lookupByName(String name) throws CrlRegistryException {
    String normalized = normalizeName(name);

    crlUpdateLock.readLock().lock();
    try {
      CrlRecord record = crls.get(normalized);
      if (record == null) {
        throw new CrlRegistryException(ErrorCode.CRL_NOT_FOUND, normalized);
      }
      return record;
    } finally {
      crlUpdateLock.readLock().unlock();
    }
  }

  /** Sorted snapshot of the registered CRL names. */
  public List<String> names() {
    crlUpdateLock.readLock().lock();
    try {
      return new ArrayList<>(new TreeMap<>(crls).keySet());
    } finally {
      crlUpdateLock.readLock().unlock();
    }
  }

  public int size() {
    crlUpdateLock.readLock().lock();
    try {
      return crls.size();
    } finally {
      crlUpdateLock.readLock().unlock();
    }
  }

  /** Every CRL revoking the serial, keyed by CRL name. Empty when none does. */
  Map<String, RevokedSerialEntry> findBySerial(BigInteger serial) {
    String serialKey = SerialCodec.toCanonicalKey(serial);

    crlUpdateLock.readLock().lock();
    try {
      Map<String, RevokedSerialEntry> found = new TreeMap<>();
      for (Map.Entry<String, CrlRecord> crl : crls.entrySet()) {
        RevokedSerialEntry entry = crl.getValue().getSerials().get(serialKey);
        if (entry != null) {
          found.put(crl.getKey(), entry);
        }
      }
      return found;
    } finally {
      crlUpdateLock.readLock().unlock();
    }
  }

  /**
   * Lower-cases the name and checks it is usable as a storage key.
   *
   * @throws CrlRegistryException MISSING_PARAMETER for an empty name, INVALID_NAME otherwise
   */
  public static String normalizeName(String name) throws CrlRegistryException {
    if (name == null || name.isEmpty()) {
      throw new CrlRegistryException(ErrorCode.MISSING_PARAMETER, "name");
    }
    String normalized = name.toLowerCase(Locale.ROOT);
    if (!NAME_PATTERN.matcher(normalized).matches()) {
      throw new CrlRegistryException(ErrorCode.INVALID_NAME, name);
    }
    return normalized;
  }
}
