package net.certauth.crl.log;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import net.certauth.crl.category.TestTags;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag(TestTags.LOGGING)
class CrlLoggerFactoryTest {

  @AfterEach
  void tearDown() {
    System.clearProperty(CrlLoggerFactory.LOGGER_IMPL_PROPERTY);
    CrlLoggerFactory.reset();
  }

  @Test
  void testDefaultsToJdkLogging() {
    CrlLoggerFactory.reset();

    assertTrue(CrlLoggerFactory.getLogger(CrlLoggerFactoryTest.class) instanceof JDK14Logger);
  }

  @Test
  void testSlf4jSelectedByProperty() {
    System.setProperty(
        CrlLoggerFactory.LOGGER_IMPL_PROPERTY, "net.certauth.crl.log.SLF4JLogger");
    CrlLoggerFactory.reset();

    assertEquals(
        CrlLoggerFactory.LoggerImpl.SLF4JLOGGER, CrlLoggerFactory.resolveImplementation());
    assertTrue(CrlLoggerFactory.getLogger("net.certauth.crl.test") instanceof SLF4JLogger);
  }

  @Test
  void testUnknownImplementationFallsBackToJdkLogging() {
    System.setProperty(CrlLoggerFactory.LOGGER_IMPL_PROPERTY, "org.example.NoSuchLogger");
    CrlLoggerFactory.reset();

    assertEquals(
        CrlLoggerFactory.LoggerImpl.JDK14LOGGER, CrlLoggerFactory.resolveImplementation());
  }

  @Test
  void testImplementationNameMatching() {
    assertEquals(
        CrlLoggerFactory.LoggerImpl.JDK14LOGGER,
        CrlLoggerFactory.LoggerImpl.fromString("NET.CERTAUTH.CRL.LOG.JDK14LOGGER"));
    assertNull(CrlLoggerFactory.LoggerImpl.fromString(null));
  }
}
