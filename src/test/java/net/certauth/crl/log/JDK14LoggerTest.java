package net.certauth.crl.log;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import net.certauth.crl.category.TestTags;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag(TestTags.LOGGING)
class JDK14LoggerTest {
  private final ListHandler handler = new ListHandler();
  private JDK14Logger logger;
  private Level originalLevel;

  @BeforeEach
  void setUp() {
    logger = new JDK14Logger(JDK14LoggerTest.class.getName());
    originalLevel = JDK14Logger.getLevel();
    JDK14Logger.setLevel(Level.FINEST);
    JDK14Logger.addHandler(handler);
  }

  @AfterEach
  void tearDown() {
    JDK14Logger.removeHandler(handler);
    JDK14Logger.setLevel(originalLevel);
  }

  @Test
  void testPlaceholdersAreFilled() {
    logger.info("CRL {} was replaced by {}", "ca1", "ca2");

    assertEquals(1, handler.records.size());
    LogRecord record = handler.records.get(0);
    assertEquals(Level.INFO, record.getLevel());
    assertEquals("CRL ca1 was replaced by ca2", record.getMessage());
  }

  @Test
  void testLevelsMapToJdkLevels() {
    logger.error("e");
    logger.warn("w");
    logger.info("i");
    logger.debug("d");
    logger.trace("t");

    assertEquals(5, handler.records.size());
    assertEquals(Level.SEVERE, handler.records.get(0).getLevel());
    assertEquals(Level.WARNING, handler.records.get(1).getLevel());
    assertEquals(Level.INFO, handler.records.get(2).getLevel());
    assertEquals(Level.FINE, handler.records.get(3).getLevel());
    assertEquals(Level.FINEST, handler.records.get(4).getLevel());
  }

  @Test
  void testCallerIsRecordedAsSource() {
    logger.warn("from the test");

    LogRecord record = handler.records.get(0);
    assertEquals(JDK14LoggerTest.class.getName(), record.getSourceClassName());
    assertEquals("testCallerIsRecordedAsSource", record.getSourceMethodName());
  }

  @Test
  void testThrowableIsAttached() {
    IOException failure = new IOException("disk gone");

    logger.error("Failed to persist CRL", failure);

    LogRecord record = handler.records.get(0);
    assertEquals("Failed to persist CRL", record.getMessage());
    assertSame(failure, record.getThrown());
  }

  @Test
  void testArgSupplierIsEvaluatedOnlyWhenLogged() {
    AtomicInteger calls = new AtomicInteger();
    ArgSupplier supplier = () -> "serials-" + calls.incrementAndGet();

    JDK14Logger.setLevel(Level.INFO);
    logger.debug("Serials: {}", supplier);
    assertEquals(0, calls.get());
    assertTrue(handler.records.isEmpty());

    logger.info("Serials: {}", supplier);
    assertEquals(1, calls.get());
    assertEquals("Serials: serials-1", handler.records.get(0).getMessage());
  }

  @Test
  void testLevelChecks() {
    JDK14Logger.setLevel(Level.WARNING);

    assertTrue(logger.isErrorEnabled());
    assertTrue(logger.isWarnEnabled());
    assertFalse(logger.isInfoEnabled());
    assertFalse(logger.isDebugEnabled());
    assertFalse(logger.isTraceEnabled());
  }

  @Test
  void testUnformattableMessageIsStillLogged() {
    logger.info("broken {0", "x");

    assertEquals("Unable to format msg: broken {0", handler.records.get(0).getMessage());
  }

  @Test
  void testRefactorString() {
    assertEquals("CRL {0} has {1} serials", JDK14Logger.refactorString("CRL {} has {} serials"));
    assertEquals("no placeholders", JDK14Logger.refactorString("no placeholders"));
    assertEquals("trailing {", JDK14Logger.refactorString("trailing {"));
  }

  private static class ListHandler extends Handler {
    private final List<LogRecord> records = new ArrayList<>();

    @Override
    public synchronized void publish(LogRecord record) {
      records.add(record);
    }

    @Override
    public void flush() {}

    @Override
    public void close() {}
  }
}
