package net.certauth.crl.backend;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;
import net.certauth.crl.codec.CrlDecoder;
import net.certauth.crl.codec.SerialCodec;
import net.certauth.crl.core.CrlRecord;
import net.certauth.crl.core.CrlRegistry;
import net.certauth.crl.core.CrlRegistryConfig;
import net.certauth.crl.core.CrlRegistryException;
import net.certauth.crl.core.ErrorCode;
import net.certauth.crl.core.ObjectMapperFactory;
import net.certauth.crl.core.RevocationQueryService;
import net.certauth.crl.core.RevokedSerialEntry;
import net.certauth.crl.log.CrlLogger;
import net.certauth.crl.log.CrlLoggerFactory;
import net.certauth.crl.storage.CrlRecordStore;
import net.certauth.crl.storage.CrlStorage;
import net.certauth.crl.storage.FileCrlStorage;
import net.certauth.crl.storage.InMemoryCrlStorage;

/**
 * The {@code crls/<name>} operations handed to the request router: write, read and delete of
 * named CRLs, plus lookups by serial number.
 *
 * <p>No operation is served before {@link #initialize()} has loaded the persisted CRLs.
 */
public class CrlBackend {
  private static final CrlLogger logger = CrlLoggerFactory.getLogger(CrlBackend.class);

  public static final String HELP_SYNOPSIS =
      "Manage Certificate Revocation Lists checked during authentication.";

  public static final String HELP_DESCRIPTION =
      "This endpoint allows you to create, read, update, and delete the Certificate\n"
          + "Revocation Lists checked during authentication.\n\n"
          + "When any CRLs are in effect, any login will check the trust chains sent by a\n"
          + "client against the submitted CRLs. Any chain containing a serial number revoked\n"
          + "by one or more of the CRLs causes that chain to be marked as invalid for the\n"
          + "authentication attempt. Conversely, any chain in which none of the serials are\n"
          + "revoked by any CRL allows authentication. The expiration time of a CRL is\n"
          + "ignored; delete a CRL under the same name once it is no longer valid.\n\n"
          + "A serial may be given as hex bytes separated by : or -, or as an integer, read\n"
          + "as base 10 unless prefixed by 0x for base 16 or 0 for base 8.";

  private static final ObjectMapper mapper = ObjectMapperFactory.getObjectMapper();

  private static final TypeReference<Map<String, Object>> RESPONSE_TYPE =
      new TypeReference<Map<String, Object>>() {};

  private final CrlRegistry registry;
  private final RevocationQueryService queryService;
  private volatile boolean ready;

  public CrlBackend(CrlRegistry registry, RevocationQueryService queryService) {
    this.registry = registry;
    this.queryService = queryService;
  }

  /** Wires a backend over a storage and populates it when the config asks for it. */
  public static CrlBackend create(CrlRegistryConfig config) throws CrlRegistryException {
    logger.debug("Creating CRL backend with {}", config);
    CrlBackend backend = create(openStorage(config));
    if (config.populateOnStart()) {
      backend.initialize();
    }
    return backend;
  }

  public static CrlBackend create(CrlStorage storage) {
    CrlRegistry registry = new CrlRegistry(new CrlRecordStore(storage));
    return new CrlBackend(registry, new RevocationQueryService(registry));
  }

  /**
   * Populates the registry from storage. The backend only becomes ready when this succeeds; it
   * may be called again after a failure.
   */
  public void initialize() throws CrlRegistryException {
    try {
      registry.populate();
    } catch (CrlRegistryException e) {
      logger.error("CRL backend is not ready: {}", e.getMessage());
      throw e;
    }
    ready = true;
  }

  public boolean isReady() {
    return ready;
  }

  public CrlRegistry getRegistry() {
    return registry;
  }

  public RevocationQueryService getQueryService() {
    return queryService;
  }

  /**
   * Decodes the CRL and stores its revoked serials under the name.
   *
   * @param name CRL name, case-insensitive
   * @param crl PEM text, or DER bytes carried one byte per char (ISO-8859-1)
   */
  public void write(String name, String crl) throws CrlRegistryException {
    write(name, crl == null ? null : crl.getBytes(StandardCharsets.ISO_8859_1));
  }

  public void write(String name, byte[] crl) throws CrlRegistryException {
    ensureReady();
    String normalized = CrlRegistry.normalizeName(name);
    if (crl == null || crl.length == 0) {
      throw new CrlRegistryException(ErrorCode.MISSING_PARAMETER, "crl");
    }
    Set<BigInteger> revokedSerials = CrlDecoder.decodeCrl(crl);
    registry.upsert(normalized, revokedSerials);
  }

  /**
   * Reads by serial when one is given, otherwise by name.
   *
   * @return for a serial, CRL name to entry for every CRL revoking it; for a name, the record as
   *     {@code {"serials": {...}}}
   */
  public Map<String, Object> read(String name, String serial) throws CrlRegistryException {
    ensureReady();
    if ((name == null || name.isEmpty()) && (serial == null || serial.isEmpty())) {
      throw new CrlRegistryException(ErrorCode.MISSING_NAME_OR_SERIAL);
    }

    if (serial != null && !serial.isEmpty()) {
      Map<String, RevokedSerialEntry> found =
          queryService.findBySerial(SerialCodec.parseSerial(serial));
      return toResponseData(found);
    }

    CrlRecord record = registry.lookupByName(name);
    return toResponseData(record);
  }

  public void delete(String name) throws CrlRegistryException {
    ensureReady();
    registry.remove(name);
  }

  private void ensureReady() throws CrlRegistryException {
    if (!ready) {
      throw new CrlRegistryException(ErrorCode.REGISTRY_NOT_READY);
    }
  }

  private static Map<String, Object> toResponseData(Object value) {
    return mapper.convertValue(value, RESPONSE_TYPE);
  }

  private static CrlStorage openStorage(CrlRegistryConfig config) throws CrlRegistryException {
    switch (config.storageType()) {
      case MEMORY:
        return new InMemoryCrlStorage();
      case FILE:
      default:
        try {
          return new FileCrlStorage(config.storageDir());
        } catch (IOException e) {
          throw new CrlRegistryException(
              e, ErrorCode.STORAGE_ERROR, "open", config.storageDir(), e.getMessage());
        }
    }
  }
}
