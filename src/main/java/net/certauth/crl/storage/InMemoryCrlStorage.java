package net.certauth.crl.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import net.certauth.crl.log.CrlLogger;
import net.certauth.crl.log.CrlLoggerFactory;

/** Non-durable storage for tests and ephemeral deployments. */
public class InMemoryCrlStorage implements CrlStorage {
  private static final CrlLogger logger = CrlLoggerFactory.getLogger(InMemoryCrlStorage.class);

  private final ConcurrentHashMap<String, byte[]> entries = new ConcurrentHashMap<>();

  @Override
  public List<String> list(String prefix) {
    Set<String> keys = new TreeSet<>();
    for (String key : entries.keySet()) {
      if (key.startsWith(prefix)) {
        keys.add(StorageKeys.childOf(prefix, key));
      }
    }
    return new ArrayList<>(keys);
  }

  @Override
  public byte[] get(String key) {
    byte[] value = entries.get(key);
    if (value != null) {
      logger.trace("Found entry in memory storage for {}", key);
    }
    return value == null ? null : value.clone();
  }

  @Override
  public void put(String key, byte[] value) {
    entries.put(key, value.clone());
  }

  @Override
  public void delete(String key) {
    entries.remove(key);
  }
}
