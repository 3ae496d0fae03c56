package net.certauth.crl.codec;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import net.certauth.crl.core.CrlRegistryException;
import net.certauth.crl.core.ErrorCode;
import net.certauth.crl.log.CrlLogger;
import net.certauth.crl.log.CrlLoggerFactory;
import org.bouncycastle.asn1.ASN1InputStream;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.x509.CertificateList;
import org.bouncycastle.cert.X509CRLEntryHolder;
import org.bouncycastle.cert.X509CRLHolder;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;

/**
 * Extracts the revoked serial numbers from a DER or PEM encoded X.509 CRL.
 *
 * <p>Only the revoked certificate entries of the to-be-signed list are read. The signature, the
 * issuer and the thisUpdate/nextUpdate window are not checked. A CRL stays
 * authoritative until it is removed from the registry.
 */
public final class CrlDecoder {
  private static final CrlLogger logger = CrlLoggerFactory.getLogger(CrlDecoder.class);

  static final String PEM_CRL_TYPE = "X509 CRL";
  private static final String PEM_PREFIX = "-----BEGIN";

  private CrlDecoder() {}

  /**
   * @param blob DER bytes, or PEM text of type {@code X509 CRL}
   * @return de-duplicated revoked serials in CRL order
   * @throws CrlRegistryException with {@link ErrorCode#CRL_DECODE_ERROR} if the blob is not a
   *     structurally valid CRL
   */
  public static Set<BigInteger> decodeCrl(byte[] blob) throws CrlRegistryException {
    if (blob == null || blob.length == 0) {
      throw new CrlRegistryException(ErrorCode.CRL_DECODE_ERROR, "CRL is empty");
    }

    byte[] der = isPem(blob) ? unwrapPem(blob) : blob;

    X509CRLHolder crlHolder;
    Set<BigInteger> serials = new LinkedHashSet<>();
    try {
      crlHolder = new X509CRLHolder(readCertificateList(der));
      // entries are parsed lazily, so malformed ones only fail here
      Collection<?> revoked = crlHolder.getRevokedCertificates();
      for (Object entry : revoked) {
        serials.add(((X509CRLEntryHolder) entry).getSerialNumber());
      }
    } catch (IOException | RuntimeException e) {
      throw new CrlRegistryException(e, ErrorCode.CRL_DECODE_ERROR, e.getMessage());
    }

    logger.debug(
        "Decoded CRL issued by {} with {} revoked serials", crlHolder.getIssuer(), serials.size());
    return Collections.unmodifiableSet(serials);
  }

  private static CertificateList readCertificateList(byte[] der) throws IOException {
    try (ASN1InputStream asn1In = new ASN1InputStream(der)) {
      ASN1Primitive crl = asn1In.readObject();
      if (crl == null) {
        throw new IOException("no content found");
      }
      if (asn1In.available() > 0) {
        throw new IOException("trailing data after CRL");
      }
      return CertificateList.getInstance(crl);
    }
  }

  static boolean isPem(byte[] blob) {
    int i = 0;
    while (i < blob.length && Character.isWhitespace(blob[i])) {
      i++;
    }
    if (blob.length - i < PEM_PREFIX.length()) {
      return false;
    }
    return new String(blob, i, PEM_PREFIX.length(), StandardCharsets.US_ASCII)
        .equals(PEM_PREFIX);
  }

  private static byte[] unwrapPem(byte[] blob) throws CrlRegistryException {
    PemObject pemObject;
    try (PemReader pemReader =
        new PemReader(new StringReader(new String(blob, StandardCharsets.US_ASCII).trim()))) {
      pemObject = pemReader.readPemObject();
    } catch (IOException | RuntimeException e) {
      throw new CrlRegistryException(e, ErrorCode.CRL_DECODE_ERROR, e.getMessage());
    }
    if (pemObject == null) {
      throw new CrlRegistryException(ErrorCode.CRL_DECODE_ERROR, "no PEM block found");
    }
    if (!PEM_CRL_TYPE.equals(pemObject.getType())) {
      throw new CrlRegistryException(
          ErrorCode.CRL_DECODE_ERROR,
          "unexpected PEM block type " + pemObject.getType() + ", expected " + PEM_CRL_TYPE);
    }
    return pemObject.getContent();
  }
}
