package net.certauth.crl.core;

import java.math.BigInteger;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Map;
import net.certauth.crl.codec.SerialCodec;
import net.certauth.crl.log.CrlLogger;
import net.certauth.crl.log.CrlLoggerFactory;

/**
 * Answers revocation questions against the registry. The authentication path uses it to decide
 * whether a presented certificate chain may be trusted.
 */
public class RevocationQueryService {
  private static final CrlLogger logger = CrlLoggerFactory.getLogger(RevocationQueryService.class);

  private final CrlRegistry registry;

  public RevocationQueryService(CrlRegistry registry) {
    this.registry = registry;
  }

  /**
   * @param serial certificate serial number
   * @return CRL name to entry for every CRL listing the serial; empty when none does
   */
  public Map<String, RevokedSerialEntry> findBySerial(BigInteger serial) {
    Map<String, RevokedSerialEntry> found = registry.findBySerial(serial);
    if (!found.isEmpty()) {
      logger.debug(
          "Serial {} is revoked by CRLs {}",
          SerialCodec.toHexFormatted(serial, ":"),
          found.keySet());
    }
    return found;
  }

  /**
   * Same as {@link #findBySerial(BigInteger)} for a serial in any encoding accepted by {@link
   * SerialCodec#parseSerial(String)}.
   */
  public Map<String, RevokedSerialEntry> findBySerial(String serial) throws CrlRegistryException {
    return findBySerial(SerialCodec.parseSerial(serial));
  }

  public boolean isRevoked(BigInteger serial) {
    return !registry.findBySerial(serial).isEmpty();
  }

  /** A chain is revoked as soon as any of its certificates is listed in any CRL. */
  public boolean isChainRevoked(X509Certificate[] chain) {
    for (X509Certificate cert : chain) {
      if (isRevoked(cert.getSerialNumber())) {
        logger.debug(
            "Certificate {} with serial {} is revoked",
            cert.getSubjectX500Principal(),
            SerialCodec.toHexFormatted(cert.getSerialNumber(), ":"));
        return true;
      }
    }
    return false;
  }

  /**
   * Authentication succeeds when at least one verified chain contains no revoked certificate, so
   * a client whose certificate was cross-signed by a revoked and an unrevoked intermediate is
   * still accepted.
   *
   * @param certificateChains the verified chains built for the presented certificate
   * @return true if some chain is entirely unrevoked
   */
  public boolean hasUnrevokedChain(List<X509Certificate[]> certificateChains) {
    if (certificateChains == null || certificateChains.isEmpty()) {
      throw new IllegalArgumentException("Certificate chains cannot be null or empty");
    }
    for (X509Certificate[] chain : certificateChains) {
      if (!isChainRevoked(chain)) {
        logger.debug("Found certificate chain with all certificates unrevoked");
        return true;
      }
    }
    logger.debug("Every verified certificate chain contained revoked certificates");
    return false;
  }
}
