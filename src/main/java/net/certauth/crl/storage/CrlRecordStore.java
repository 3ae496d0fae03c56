package net.certauth.crl.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import net.certauth.crl.core.CrlRecord;
import net.certauth.crl.core.CrlRegistryException;
import net.certauth.crl.core.ErrorCode;
import net.certauth.crl.core.ObjectMapperFactory;
import net.certauth.crl.log.CrlLogger;
import net.certauth.crl.log.CrlLoggerFactory;

/**
 * Translates {@link CrlRecord}s to and from the JSON documents kept in {@link CrlStorage}. Every
 * record lives under {@code crls/<name>} as {@code {"serials": {"<serial>": {}}}}.
 */
public class CrlRecordStore {
  private static final CrlLogger logger = CrlLoggerFactory.getLogger(CrlRecordStore.class);

  public static final String CRL_PREFIX = "crls/";

  private static final ObjectMapper mapper = ObjectMapperFactory.getObjectMapper();

  private final CrlStorage storage;

  public CrlRecordStore(CrlStorage storage) {
    this.storage = storage;
  }

  /** Names of every persisted record; nested keys are skipped. */
  public List<String> listNames() throws CrlRegistryException {
    try {
      List<String> listed = storage.list(CRL_PREFIX);
      if (listed == null) {
        return new ArrayList<>();
      }
      List<String> names = new ArrayList<>(listed);
      names.removeIf(name -> name.isEmpty() || name.endsWith("/"));
      return names;
    } catch (IOException e) {
      logger.warn("Failed to list CRLs: {}", e.getMessage());
      throw new CrlRegistryException(
          e, ErrorCode.STORAGE_ERROR, "list", CRL_PREFIX, e.getMessage());
    }
  }

  /**
   * @return the stored record, or null when nothing is stored under the name
   * @throws CrlRegistryException STORAGE_ERROR on read failure, RECORD_DECODE_ERROR when the
   *     document cannot be decoded
   */
  public CrlRecord get(String name) throws CrlRegistryException {
    String key = CRL_PREFIX + name;
    byte[] document;
    try {
      document = storage.get(key);
    } catch (IOException e) {
      logger.warn("Failed to read CRL {}: {}", name, e.getMessage());
      throw new CrlRegistryException(e, ErrorCode.STORAGE_ERROR, "get", key, e.getMessage());
    }
    if (document == null) {
      return null;
    }
    try {
      return mapper.readValue(document, CrlRecord.class);
    } catch (IOException e) {
      throw new CrlRegistryException(e, ErrorCode.RECORD_DECODE_ERROR, name, e.getMessage());
    }
  }

  public void put(String name, CrlRecord record) throws CrlRegistryException {
    String key = CRL_PREFIX + name;
    byte[] document;
    try {
      document = mapper.writeValueAsBytes(record);
    } catch (JsonProcessingException e) {
      throw new CrlRegistryException(e, ErrorCode.STORAGE_ERROR, "encode", key, e.getMessage());
    }
    try {
      storage.put(key, document);
    } catch (IOException e) {
      logger.warn("Failed to persist CRL {}: {}", name, e.getMessage());
      throw new CrlRegistryException(e, ErrorCode.STORAGE_ERROR, "put", key, e.getMessage());
    }
  }

  public void delete(String name) throws CrlRegistryException {
    String key = CRL_PREFIX + name;
    try {
      storage.delete(key);
    } catch (IOException e) {
      logger.warn("Failed to delete CRL {}: {}", name, e.getMessage());
      throw new CrlRegistryException(e, ErrorCode.STORAGE_ERROR, "delete", key, e.getMessage());
    }
  }
}
