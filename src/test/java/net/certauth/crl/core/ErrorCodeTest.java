package net.certauth.crl.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.HashSet;
import java.util.ResourceBundle;
import java.util.Set;
import net.certauth.crl.category.TestTags;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag(TestTags.CORE)
class ErrorCodeTest {

  @Test
  void testEveryCodeHasAMessage() {
    ResourceBundle bundle = ResourceBundle.getBundle(ErrorCode.errorMessageResource);
    for (ErrorCode errorCode : ErrorCode.values()) {
      String key = String.valueOf(errorCode.getMessageCode());
      assertTrue(bundle.containsKey(key), "missing message for " + errorCode.name());
    }
  }

  @Test
  void testMessageCodesAreUnique() {
    Set<Integer> codes = new HashSet<>();
    for (ErrorCode errorCode : ErrorCode.values()) {
      assertTrue(codes.add(errorCode.getMessageCode()), errorCode.name());
    }
  }

  @Test
  void testLookupByMessageCode() {
    assertSame(ErrorCode.CRL_NOT_FOUND, ErrorCode.getByMessageCode(300301));
    assertNull(ErrorCode.getByMessageCode(1));
  }

  @Test
  void testExceptionRendersMessage() {
    CrlRegistryException ex = new CrlRegistryException(ErrorCode.MISSING_PARAMETER, "crl");

    assertEquals("\"crl\" parameter cannot be empty", ex.getMessage());
    assertEquals(300101, ex.getVendorCode());
    assertEquals(ErrorCode.Kind.VALIDATION, ex.getKind());
    assertNull(ex.getCause());
  }

  @Test
  void testExceptionKeepsCause() {
    IOException cause = new IOException("no space left");
    CrlRegistryException ex =
        new CrlRegistryException(
            cause, ErrorCode.STORAGE_ERROR, "put", "crls/ca1", "no space left");

    assertSame(cause, ex.getCause());
    assertEquals("storage put failed for key crls/ca1: no space left", ex.getMessage());
  }

  @Test
  void testMessagesContainNoUnfilledPlaceholders() {
    for (ErrorCode errorCode : ErrorCode.values()) {
      String message = new CrlRegistryException(errorCode, "a", "b", "c").getMessage();
      assertFalse(message.contains("{"), errorCode.name() + ": " + message);
      assertFalse(message.startsWith("!!"), errorCode.name());
    }
  }
}
