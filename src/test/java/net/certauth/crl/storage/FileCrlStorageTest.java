package net.certauth.crl.storage;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Arrays;
import java.util.Collections;
import java.util.Set;
import java.util.stream.Stream;
import net.certauth.crl.category.TestTags;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@Tag(TestTags.STORAGE)
class FileCrlStorageTest {
  @TempDir Path tempDir;

  private Path storageDir;
  private FileCrlStorage storage;

  @BeforeEach
  void setUp() throws IOException {
    storageDir = tempDir.resolve("crl-registry");
    storage = new FileCrlStorage(storageDir);
  }

  @Test
  void testCreatesStorageDirectory() {
    assertTrue(Files.isDirectory(storageDir));
    assertEquals(storageDir, storage.getStorageDir());
  }

  @Test
  @DisabledOnOs(OS.WINDOWS)
  void testStorageDirectoryIsOwnerOnly() throws IOException {
    Set<PosixFilePermission> permissions = Files.getPosixFilePermissions(storageDir);

    assertEquals(PosixFilePermissions.fromString("rwx------"), permissions);
  }

  @Test
  @DisabledOnOs(OS.WINDOWS)
  void testExistingDirectoryPermissionsAreTightened() throws IOException {
    Path existing = Files.createDirectory(tempDir.resolve("existing"));
    Files.setPosixFilePermissions(existing, PosixFilePermissions.fromString("rwxr-xr-x"));

    new FileCrlStorage(existing);

    assertEquals(
        PosixFilePermissions.fromString("rwx------"), Files.getPosixFilePermissions(existing));
  }

  @Test
  @DisabledOnOs(OS.WINDOWS)
  void testStoredFilesAreOwnerOnly() throws IOException {
    storage.put("crls/web", bytes("w"));

    try (Stream<Path> files = Files.list(storageDir)) {
      for (Path file : (Iterable<Path>) files::iterator) {
        assertEquals(
            PosixFilePermissions.fromString("rw-------"), Files.getPosixFilePermissions(file));
      }
    }
  }

  @Test
  void testRejectsRegularFileAsDirectory() throws IOException {
    Path file = Files.createFile(tempDir.resolve("not-a-dir"));

    assertThrows(IOException.class, () -> new FileCrlStorage(file));
  }

  @Test
  void testPutAndGet() throws IOException {
    storage.put("crls/web", bytes("{\"serials\":{\"1000\":{}}}"));

    assertArrayEquals(bytes("{\"serials\":{\"1000\":{}}}"), storage.get("crls/web"));
  }

  @Test
  void testKeyIsStoredAsEncodedFileName() throws IOException {
    storage.put("crls/web", bytes("w"));

    assertTrue(Files.exists(storageDir.resolve("crls%2Fweb")));
  }

  @Test
  void testKeysWithReservedCharactersRoundTrip() throws IOException {
    storage.put("crls/web ca+1%", bytes("w"));

    assertTrue(Files.exists(storageDir.resolve("crls%2Fweb+ca%2B1%25")));
    assertArrayEquals(bytes("w"), storage.get("crls/web ca+1%"));
    assertEquals(Collections.singletonList("web ca+1%"), storage.list("crls/"));
  }

  @Test
  void testGetMissingKeyReturnsNull() throws IOException {
    assertNull(storage.get("crls/missing"));
  }

  @Test
  void testPutReplacesValue() throws IOException {
    storage.put("crls/web", bytes("first"));
    storage.put("crls/web", bytes("second"));

    assertArrayEquals(bytes("second"), storage.get("crls/web"));
    assertEquals(Collections.singletonList("web"), storage.list("crls/"));
  }

  @Test
  void testListReturnsSortedChildrenOfPrefix() throws IOException {
    storage.put("crls/zeta", bytes("z"));
    storage.put("crls/alpha", bytes("a"));
    storage.put("crls/nested/inner", bytes("n"));
    storage.put("config/other", bytes("o"));

    assertEquals(Arrays.asList("alpha", "nested/", "zeta"), storage.list("crls/"));
  }

  @Test
  void testListSkipsPendingWrites() throws IOException {
    storage.put("crls/web", bytes("w"));
    Files.write(storageDir.resolve(".pending-12345.tmp"), bytes("partial"));

    assertEquals(Collections.singletonList("web"), storage.list("crls/"));
  }

  @Test
  void testNoPendingFilesRemainAfterPut() throws IOException {
    storage.put("crls/web", bytes("w"));

    try (Stream<Path> files = Files.list(storageDir)) {
      assertFalse(files.anyMatch(f -> f.getFileName().toString().startsWith(".pending-")));
    }
  }

  @Test
  void testDeleteIsIdempotent() throws IOException {
    storage.put("crls/web", bytes("w"));

    storage.delete("crls/web");
    storage.delete("crls/web");

    assertNull(storage.get("crls/web"));
    assertTrue(storage.list("crls/").isEmpty());
  }

  @Test
  void testValuesSurviveReopen() throws IOException {
    storage.put("crls/web", bytes("persisted"));

    FileCrlStorage reopened = new FileCrlStorage(storageDir);

    assertArrayEquals(bytes("persisted"), reopened.get("crls/web"));
    assertEquals(Collections.singletonList("web"), reopened.list("crls/"));
  }

  private static byte[] bytes(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }
}
