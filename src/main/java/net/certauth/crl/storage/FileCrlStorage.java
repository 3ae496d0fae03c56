package net.certauth.crl.storage;

import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import net.certauth.crl.log.CrlLogger;
import net.certauth.crl.log.CrlLoggerFactory;
import net.certauth.crl.util.SystemUtil;

/**
 * Stores every key as one file in a single directory. File names are the URL encoded keys, so
 * {@code crls/web} is kept in {@code crls%2Fweb}. Values are replaced by writing a temporary file
 * and moving it over the old one.
 */
public class FileCrlStorage implements CrlStorage {
  private static final CrlLogger logger = CrlLoggerFactory.getLogger(FileCrlStorage.class);

  private static final String TEMP_FILE_PREFIX = ".pending-";

  private final Path storageDir;
  private final Lock storageLock = new ReentrantLock();

  public FileCrlStorage(Path storageDir) throws IOException {
    this.storageDir = storageDir;
    ensureStorageDirectoryExists(storageDir);
  }

  public Path getStorageDir() {
    return storageDir;
  }

  @Override
  public List<String> list(String prefix) throws IOException {
    storageLock.lock();
    try (Stream<Path> files = Files.list(storageDir)) {
      Set<String> keys = new TreeSet<>();
      for (Path file : files.filter(Files::isRegularFile).collect(Collectors.toList())) {
        String fileName = file.getFileName().toString();
        if (fileName.startsWith(TEMP_FILE_PREFIX)) {
          continue;
        }
        String key = decodeKey(fileName);
        if (key.startsWith(prefix)) {
          keys.add(StorageKeys.childOf(prefix, key));
        }
      }
      return new ArrayList<>(keys);
    } finally {
      storageLock.unlock();
    }
  }

  @Override
  public byte[] get(String key) throws IOException {
    storageLock.lock();
    try {
      Path file = getFilePath(key);
      if (!Files.exists(file)) {
        return null;
      }
      logger.trace("Reading {} from {}", key, file);
      return Files.readAllBytes(file);
    } catch (NoSuchFileException e) {
      return null;
    } finally {
      storageLock.unlock();
    }
  }

  @Override
  public void put(String key, byte[] value) throws IOException {
    storageLock.lock();
    Path tempFile = null;
    try {
      Path file = getFilePath(key);
      if (SystemUtil.getOS() != SystemUtil.OS.WINDOWS) {
        tempFile =
            Files.createTempFile(
                storageDir,
                TEMP_FILE_PREFIX,
                null,
                PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rw-------")));
      } else {
        tempFile = Files.createTempFile(storageDir, TEMP_FILE_PREFIX, null);
      }
      Files.write(tempFile, value);
      try {
        Files.move(
            tempFile, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING);
      }
      tempFile = null;
      logger.debug("Wrote {} bytes for {} to {}", value.length, key, file);
    } finally {
      if (tempFile != null) {
        Files.deleteIfExists(tempFile);
      }
      storageLock.unlock();
    }
  }

  @Override
  public void delete(String key) throws IOException {
    storageLock.lock();
    try {
      if (Files.deleteIfExists(getFilePath(key))) {
        logger.debug("Deleted {} from {}", key, storageDir);
      }
    } finally {
      storageLock.unlock();
    }
  }

  private Path getFilePath(String key) throws UnsupportedEncodingException {
    return storageDir.resolve(URLEncoder.encode(key, StandardCharsets.UTF_8.toString()));
  }

  private static String decodeKey(String fileName) throws UnsupportedEncodingException {
    return URLDecoder.decode(fileName, StandardCharsets.UTF_8.toString());
  }

  private static boolean ownerOnlyPermissions(Path dir) throws IOException {
    return Files.getPosixFilePermissions(dir).equals(PosixFilePermissions.fromString("rwx------"));
  }

  private static void ensureStorageDirectoryExists(Path storageDir) throws IOException {
    boolean posix = SystemUtil.getOS() != SystemUtil.OS.WINDOWS;
    if (!Files.exists(storageDir)) {
      if (posix) {
        Files.createDirectories(
            storageDir,
            PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rwx------")));
      } else {
        Files.createDirectories(storageDir);
      }
      logger.debug("Initialized CRL storage directory: {}", storageDir);
    }
    if (!Files.isDirectory(storageDir)) {
      throw new IOException("CRL storage path is not a directory: " + storageDir);
    }
    if (posix && !ownerOnlyPermissions(storageDir)) {
      Files.setPosixFilePermissions(storageDir, PosixFilePermissions.fromString("rwx------"));
      logger.debug("Set CRL storage directory permissions to rwx------");
    }
  }
}
