package ca.gc.cra.rulesync.domain.fetch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate statistics computed once a download batch has finished.
 *
 * @param totalFiles number of URLs in the batch
 * @param successfulFiles URLs with a usable local copy
 * @param failedFiles URLs that failed after retries
 * @param successRatePercent successful share in percent, zero for an empty batch
 * @param totalSizeMb megabytes across successful copies
 * @param totalTimeSeconds wall-clock batch duration
 * @param averageSpeedMbps {@code totalSizeMb / totalTimeSeconds}
 * @param maxConcurrent worker pool size used for the batch
 * @param failedUrls URLs that failed, in input order
 * @since 0.1.0
 */
public record BatchStats(
    int totalFiles,
    int successfulFiles,
    int failedFiles,
    double successRatePercent,
    double totalSizeMb,
    double totalTimeSeconds,
    double averageSpeedMbps,
    int maxConcurrent,
    List<String> failedUrls) {

  private static final double BYTES_PER_MB = 1024d * 1024d;

  public BatchStats {
    failedUrls = List.copyOf(Objects.requireNonNull(failedUrls, "failedUrls"));
  }

  /**
   * Computes statistics from the complete result list of a batch.
   *
   * @param results one result per URL
   * @param totalTimeSeconds wall-clock batch duration
   * @param maxConcurrent worker pool size
   * @return aggregate statistics
   */
  public static BatchStats from(List<DownloadResult> results, double totalTimeSeconds, int maxConcurrent) {
    Objects.requireNonNull(results, "results");
    int successful = 0;
    long bytes = 0L;
    List<String> failed = new ArrayList<>();
    for (DownloadResult result : results) {
      if (result.success()) {
        successful++;
        bytes += result.sizeBytes();
      } else {
        failed.add(result.url());
      }
    }
    int total = results.size();
    double rate = total == 0 ? 0d : (successful * 100d) / total;
    double sizeMb = bytes / BYTES_PER_MB;
    double speed = totalTimeSeconds > 0d ? sizeMb / totalTimeSeconds : 0d;
    return new BatchStats(
        total, successful, failed.size(), rate, sizeMb, totalTimeSeconds, speed, maxConcurrent, failed);
  }

  /**
   * Indicates whether at least one URL produced a usable copy.
   *
   * @return {@code true} when the batch is usable
   */
  public boolean anySucceeded() {
    return successfulFiles > 0;
  }
}
