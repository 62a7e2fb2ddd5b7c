package ca.gc.cra.rulesync.application.fetch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rulesync.domain.fetch.DownloadResult;
import ca.gc.cra.rulesync.domain.fetch.FetchOptions;
import ca.gc.cra.rulesync.domain.fetch.FetchOutcome;
import ca.gc.cra.rulesync.infrastructure.cache.FileSystemCacheAdapter;
import ca.gc.cra.rulesync.testutil.MutableClock;
import ca.gc.cra.rulesync.testutil.RecordingMetrics;
import ca.gc.cra.rulesync.testutil.ScriptedTransport;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FetcherTest {
  private static final String URL = "https://rules.example/list.txt";

  @TempDir Path tempDir;

  private ScriptedTransport transport;
  private RecordingMetrics metrics;
  private FileSystemCacheAdapter cache;
  private List<Duration> sleeps;
  private Fetcher fetcher;

  @BeforeEach
  void setUp() {
    transport = new ScriptedTransport();
    metrics = new RecordingMetrics();
    cache = new FileSystemCacheAdapter(tempDir.resolve("cache"), Duration.ofHours(24),
        new MutableClock(System.currentTimeMillis()));
    sleeps = new CopyOnWriteArrayList<>();
    fetcher = new Fetcher(transport, cache, metrics, sleeps::add);
  }

  @Test
  void downloadsIntoDestinationAndCaches() throws Exception {
    transport.ok(URL, "DOMAIN,a.com\n");
    Path dest = tempDir.resolve("list.txt");
    List<Long> progress = new ArrayList<>();

    DownloadResult result = fetcher.fetch(URL, dest, FetchOptions.defaults(), (done, total) -> progress.add(done));

    assertTrue(result.success());
    assertFalse(result.fromCache());
    assertEquals("DOMAIN,a.com\n", Files.readString(dest));
    assertFalse(Files.exists(tempDir.resolve("list.txt" + Fetcher.PART_SUFFIX)));
    assertTrue(cache.get(URL).isPresent());
    assertEquals(List.of(13L), progress);
    assertEquals(1, metrics.count("fetch.cache.miss"));
    assertEquals(List.of(13L), metrics.observed("fetch.bytes"));
    assertEquals(1, metrics.observed("fetch.latencyMillis").size());
  }

  @Test
  void permanentClientErrorIsNotRetried() throws Exception {
    transport.status(URL, 404).ok(URL, "never read");

    DownloadResult result = fetcher.fetch(URL, tempDir.resolve("list.txt"), FetchOptions.defaults(), null);

    assertFalse(result.success());
    assertTrue(result.error().orElseThrow().startsWith("HTTP 404"));
    assertEquals(1, transport.requestCount(URL));
    assertTrue(sleeps.isEmpty());
    assertEquals(1, metrics.count("fetch.failure.fatal"));
  }

  @Test
  void transientFailuresBackOffExponentially() throws Exception {
    transport.status(URL, 503).failure(URL, new SocketTimeoutException("read timed out")).ok(URL, "a.com\n");

    DownloadResult result = fetcher.fetch(URL, tempDir.resolve("list.txt"), FetchOptions.defaults(), null);

    assertTrue(result.success());
    assertEquals(3, transport.requestCount(URL));
    assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);
    assertEquals(2, metrics.count("fetch.retry"));
  }

  @Test
  void exhaustedRetriesReportLastFailure() throws Exception {
    FetchOptions options = new FetchOptions(2, Duration.ofMillis(10), false, false);
    transport.status(URL, 500).status(URL, 502).status(URL, 503);

    DownloadResult result = fetcher.fetch(URL, tempDir.resolve("list.txt"), options, null);

    assertFalse(result.success());
    assertTrue(result.error().orElseThrow().startsWith("HTTP 503"));
    assertEquals(List.of(Duration.ofMillis(10), Duration.ofMillis(20)), sleeps);
    assertEquals(1, metrics.count("fetch.failure.exhausted"));
  }

  @Test
  void emptyBodyIsRetryable() throws Exception {
    FetchOptions options = new FetchOptions(1, Duration.ZERO, false, true);
    transport.ok(URL, "").ok(URL, "a.com\n");

    DownloadResult result = fetcher.fetch(URL, tempDir.resolve("list.txt"), options, null);

    assertTrue(result.success());
    assertEquals(6, result.sizeBytes());
  }

  @Test
  void freshCacheEntryAvoidsNetwork() throws Exception {
    Path seed = tempDir.resolve("seed.txt");
    Files.writeString(seed, "cached.com\n", StandardCharsets.UTF_8);
    cache.put(URL, seed);
    Path dest = tempDir.resolve("list.txt");

    DownloadResult result = fetcher.fetch(URL, dest, FetchOptions.defaults(), null);

    assertTrue(result.success());
    assertTrue(result.fromCache());
    assertEquals("cached.com\n", Files.readString(dest));
    assertTrue(transport.requests().isEmpty());
    assertEquals(1, metrics.count("fetch.cache.hit"));
  }

  @Test
  void cacheIsIgnoredWhenDisabled() throws Exception {
    Path seed = tempDir.resolve("seed.txt");
    Files.writeString(seed, "cached.com\n", StandardCharsets.UTF_8);
    cache.put(URL, seed);
    transport.ok(URL, "fresh.com\n");
    Path dest = tempDir.resolve("list.txt");

    fetcher.fetch(URL, dest, new FetchOptions(0, Duration.ZERO, false, true), null);

    assertEquals("fresh.com\n", Files.readString(dest));
    assertEquals(0, metrics.count("fetch.cache.hit"));
  }

  @Test
  void existingDestinationShortCircuits() throws Exception {
    Path dest = tempDir.resolve("list.txt");
    Files.writeString(dest, "already.com\n", StandardCharsets.UTF_8);

    DownloadResult result = fetcher.fetch(URL, dest, FetchOptions.defaults(), null);

    assertTrue(result.success());
    assertTrue(transport.requests().isEmpty());
  }

  @Test
  void resumesPartialDownloadWithRange() throws Exception {
    Path dest = tempDir.resolve("list.txt");
    Files.writeString(tempDir.resolve("list.txt" + Fetcher.PART_SUFFIX), "abc", StandardCharsets.UTF_8);
    transport.acceptRanges(URL).partial(URL, "def", "bytes 3-5/6");

    DownloadResult result = fetcher.fetch(URL, dest, new FetchOptions(0, Duration.ZERO, false, true), null);

    assertTrue(result.success());
    assertEquals("abcdef", Files.readString(dest));
    assertEquals(3L, transport.requests().get(0).rangeStart());
  }

  @Test
  void rangeFromByteZeroReplacesPartialFile() throws Exception {
    Path dest = tempDir.resolve("list.txt");
    Files.writeString(tempDir.resolve("list.txt" + Fetcher.PART_SUFFIX), "abc", StandardCharsets.UTF_8);
    transport.acceptRanges(URL).partial(URL, "abcdef", "bytes 0-5/6");

    DownloadResult result = fetcher.fetch(URL, dest, new FetchOptions(0, Duration.ZERO, false, true), null);

    assertTrue(result.success());
    assertEquals(6L, result.sizeBytes());
    assertEquals("abcdef", Files.readString(dest));
  }

  @Test
  void mismatchedRangeStartDiscardsPartialFile() throws Exception {
    Path part = tempDir.resolve("list.txt" + Fetcher.PART_SUFFIX);
    Files.writeString(part, "abc", StandardCharsets.UTF_8);
    transport.acceptRanges(URL).partial(URL, "ef", "bytes 4-5/6");

    FetchOutcome outcome = fetcher.attempt(URL, part, FetchOptions.defaults(), (d, t) -> {});

    assertEquals(FetchOutcome.Status.RETRYABLE, outcome.status());
    assertFalse(Files.exists(part));
  }

  @Test
  void bodyLongerThanAdvertisedTotalIsRejected() throws Exception {
    Path part = tempDir.resolve("list.txt" + Fetcher.PART_SUFFIX);
    Files.writeString(part, "abc", StandardCharsets.UTF_8);
    transport.acceptRanges(URL).partial(URL, "defghi", "bytes 3-5/6");

    FetchOutcome outcome = fetcher.attempt(URL, part, FetchOptions.defaults(), (d, t) -> {});

    assertEquals(FetchOutcome.Status.RETRYABLE, outcome.status());
    assertFalse(Files.exists(part));
  }

  @Test
  void partialFileIsDiscardedWithoutRangeSupport() throws Exception {
    Path dest = tempDir.resolve("list.txt");
    Files.writeString(tempDir.resolve("list.txt" + Fetcher.PART_SUFFIX), "stale", StandardCharsets.UTF_8);
    transport.ok(URL, "whole\n");

    fetcher.fetch(URL, dest, new FetchOptions(0, Duration.ZERO, false, true), null);

    assertEquals("whole\n", Files.readString(dest));
    assertEquals(0L, transport.requests().get(0).rangeStart());
  }

  @Test
  void unsatisfiableRangeRestartsFromScratch() throws Exception {
    Path part = tempDir.resolve("list.txt" + Fetcher.PART_SUFFIX);
    Files.writeString(part, "abc", StandardCharsets.UTF_8);
    transport.acceptRanges(URL).status(URL, 416);

    FetchOutcome outcome = fetcher.attempt(URL, part, FetchOptions.defaults(), (d, t) -> {});

    assertEquals(FetchOutcome.Status.RETRYABLE, outcome.status());
    assertFalse(Files.exists(part));
  }

  @Test
  void ioFailureIsRetryable() throws Exception {
    transport.failure(URL, new IOException("connection reset"));

    FetchOutcome outcome = fetcher.attempt(
        URL, tempDir.resolve("x" + Fetcher.PART_SUFFIX), FetchOptions.defaults(), (d, t) -> {});

    assertEquals(FetchOutcome.Status.RETRYABLE, outcome.status());
    assertEquals("IOException: connection reset", outcome.message());
  }
}
