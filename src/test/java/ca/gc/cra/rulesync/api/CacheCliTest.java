package ca.gc.cra.rulesync.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class CacheCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(CacheCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
  }

  @Test
  void infoReportsEntries() throws IOException {
    Path cacheDir = Files.createDirectories(tempDir.resolve("cache"));
    Files.writeString(cacheDir.resolve("a.cache"), "DOMAIN,a.com\n");
    Files.writeString(cacheDir.resolve("ignored.txt"), "x");

    ExitCode code = CacheCli.run(new String[] {"info", "cacheDir=" + cacheDir, "cacheTtlHours=12"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.startsWith("Cache info"));
    assertTrue(out.contains(" Entries          : 1"));
    assertTrue(out.contains(" TTL              : 12 h"));
  }

  @Test
  void clearRemovesOnlyOldEntries() throws IOException {
    Path cacheDir = Files.createDirectories(tempDir.resolve("cache"));
    Path old = Files.writeString(cacheDir.resolve("old.cache"), "x");
    Path fresh = Files.writeString(cacheDir.resolve("fresh.cache"), "y");
    Files.setLastModifiedTime(old, FileTime.from(Instant.now().minus(Duration.ofHours(5))));

    ExitCode code = CacheCli.run(new String[] {"clear", "cacheDir=" + cacheDir, "olderThanHours=2"});

    assertEquals(ExitCode.SUCCESS, code);
    assertFalse(Files.exists(old));
    assertTrue(Files.exists(fresh));
    assertTrue(buffer.toString().contains("Removed 1 cache entries older than 2 h"));
  }

  @Test
  void missingActionPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, CacheCli.run(new String[] {"cacheDir=" + tempDir}));
    assertTrue(buffer.toString().contains("usage: cache <info|clear>"));
    assertTrue(appender.list.stream().anyMatch(event ->
        event.getLevel() == Level.ERROR && event.getFormattedMessage().contains("Missing cache action")));
  }

  @Test
  void unknownActionPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, CacheCli.run(new String[] {"purge"}));
    assertTrue(appender.list.stream().anyMatch(event -> event.getFormattedMessage().contains("purge")));
  }

  @Test
  void invalidHoursAreRejected() {
    ExitCode code = CacheCli.run(new String[] {"clear", "cacheDir=" + tempDir, "olderThanHours=soon"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(appender.list.stream().anyMatch(event ->
        event.getFormattedMessage().contains("olderThanHours must be an integer")));
  }
}
