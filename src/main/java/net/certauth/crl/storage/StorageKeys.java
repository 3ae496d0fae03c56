package net.certauth.crl.storage;

final class StorageKeys {
  private StorageKeys() {}

  /** {@code key} relative to {@code prefix}, cut after the first {@code /} of the remainder. */
  static String childOf(String prefix, String key) {
    String rest = key.substring(prefix.length());
    int slash = rest.indexOf('/');
    return slash < 0 ? rest : rest.substring(0, slash + 1);
  }
}
