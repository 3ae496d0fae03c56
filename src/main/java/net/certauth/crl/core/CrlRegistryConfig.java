package net.certauth.crl.core;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import net.certauth.crl.log.CrlLogger;
import net.certauth.crl.log.CrlLoggerFactory;
import net.certauth.crl.util.SystemUtil;

/** Registry settings, read from system properties. */
public class CrlRegistryConfig {
  private static final CrlLogger logger = CrlLoggerFactory.getLogger(CrlRegistryConfig.class);

  public static final String CRL_REGISTRY_STORAGE = "CRL_REGISTRY_STORAGE";
  public static final String CRL_REGISTRY_STORAGE_DIR = "CRL_REGISTRY_STORAGE_DIR";
  public static final String CRL_REGISTRY_POPULATE_ON_START = "CRL_REGISTRY_POPULATE_ON_START";

  public enum StorageType {
    MEMORY,
    FILE
  }

  private final StorageType storageType;
  private final Path storageDir;
  private final boolean populateOnStart;

  public CrlRegistryConfig(StorageType storageType, Path storageDir, boolean populateOnStart) {
    if (storageType == null) {
      throw new IllegalArgumentException("Storage type cannot be null");
    }
    if (storageType == StorageType.FILE && storageDir == null) {
      throw new IllegalArgumentException("File storage requires a storage directory");
    }
    this.storageType = storageType;
    this.storageDir = storageDir;
    this.populateOnStart = populateOnStart;
  }

  public static CrlRegistryConfig fromSystemProperties() {
    StorageType storageType = getStorageType();
    return new CrlRegistryConfig(
        storageType,
        storageType == StorageType.FILE ? getStorageDir() : null,
        getPopulateOnStart());
  }

  public static StorageType getStorageType() {
    String storageType = SystemUtil.systemGetProperty(CRL_REGISTRY_STORAGE);
    if (SystemUtil.isNullOrEmpty(storageType)) {
      return StorageType.FILE;
    }
    try {
      return StorageType.valueOf(storageType.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid CRL storage type: " + storageType, e);
    }
  }

  public static Path getStorageDir() {
    String storageDir = SystemUtil.systemGetProperty(CRL_REGISTRY_STORAGE_DIR);
    if (!SystemUtil.isNullOrEmpty(storageDir)) {
      return Paths.get(storageDir);
    }
    String userHome = SystemUtil.systemGetProperty("user.home");
    if (SystemUtil.isNullOrEmpty(userHome)) {
      throw new IllegalStateException(
          "Cannot determine a default CRL storage directory, set " + CRL_REGISTRY_STORAGE_DIR);
    }
    Path defaultDir = Paths.get(userHome, ".crl-registry");
    logger.debug("Using default CRL storage directory {}", defaultDir);
    return defaultDir;
  }

  public static boolean getPopulateOnStart() {
    return SystemUtil.convertSystemPropertyToBooleanValue(CRL_REGISTRY_POPULATE_ON_START, true);
  }

  public StorageType storageType() {
    return storageType;
  }

  public Path storageDir() {
    return storageDir;
  }

  public boolean populateOnStart() {
    return populateOnStart;
  }

  @Override
  public String toString() {
    return "CrlRegistryConfig{storageType="
        + storageType
        + ", storageDir="
        + storageDir
        + ", populateOnStart="
        + populateOnStart
        + '}';
  }
}
