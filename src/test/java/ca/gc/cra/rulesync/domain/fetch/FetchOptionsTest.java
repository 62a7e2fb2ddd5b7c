package ca.gc.cra.rulesync.domain.fetch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class FetchOptionsTest {

  @Test
  void backoffDoublesFromBaseDelay() {
    FetchOptions options = FetchOptions.defaults();

    assertEquals(Duration.ofSeconds(1), options.backoffAfter(0));
    assertEquals(Duration.ofSeconds(2), options.backoffAfter(1));
    assertEquals(Duration.ofSeconds(4), options.backoffAfter(2));
  }

  @Test
  void rejectsNegativeSettings() {
    assertThrows(IllegalArgumentException.class, () -> new FetchOptions(-1, Duration.ZERO, true, true));
    assertThrows(IllegalArgumentException.class, () -> new FetchOptions(1, Duration.ofMillis(-1), true, true));
  }

  @Test
  void fatalStatusesAreNotRetried() {
    assertEquals(FetchOutcome.Status.FATAL, FetchOutcome.forHttpStatus(404, "Not Found").status());
    assertEquals(FetchOutcome.Status.FATAL, FetchOutcome.forHttpStatus(410, "Gone").status());
    assertEquals(FetchOutcome.Status.RETRYABLE, FetchOutcome.forHttpStatus(503, "Unavailable").status());
    assertEquals(FetchOutcome.Status.RETRYABLE, FetchOutcome.forHttpStatus(429, "Too Many").status());
  }

  @Test
  void batchStatsSummarizeResults() {
    List<DownloadResult> results = List.of(
        DownloadResult.success("https://a/1", Path.of("1"), 1024 * 1024, 1.0, false),
        DownloadResult.failure("https://a/2", "HTTP 404", 0.2),
        DownloadResult.success("https://a/3", Path.of("3"), 1024 * 1024, 1.0, true));

    BatchStats stats = BatchStats.from(results, 2.0, 5);

    assertEquals(3, stats.totalFiles());
    assertEquals(2, stats.successfulFiles());
    assertEquals(1, stats.failedFiles());
    assertEquals(200d / 3, stats.successRatePercent(), 1e-9);
    assertEquals(2.0, stats.totalSizeMb(), 1e-9);
    assertEquals(1.0, stats.averageSpeedMbps(), 1e-9);
    assertEquals(List.of("https://a/2"), stats.failedUrls());
    assertTrue(stats.anySucceeded());
  }

  @Test
  void emptyBatchHasZeroRate() {
    BatchStats stats = BatchStats.from(List.of(), 0d, 3);

    assertEquals(0d, stats.successRatePercent());
    assertEquals(0d, stats.averageSpeedMbps());
    assertFalse(stats.anySucceeded());
    assertEquals(100d, new BatchProgress(0, 0, 0, 0, 0).percentComplete());
  }

  @Test
  void successRequiresLocalPath() {
    assertThrows(IllegalArgumentException.class, () -> new DownloadResult(
        "https://a/1", true, Optional.empty(), Optional.empty(), 0, 0, false));
  }
}
